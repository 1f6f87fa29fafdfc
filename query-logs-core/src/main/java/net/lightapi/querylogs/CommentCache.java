package net.lightapi.querylogs;

import java.util.Collections;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Holds the comment computed for one unit of work. An absent comment is cached as well, so a
 * context without any tag does not resolve the tags again on every query.
 *
 * The comment is stored together with the connection values it was computed for. A unit of
 * work that uses connections of several pools gets the comment recomputed whenever the pool
 * changes, so db_host or database of one pool never end up on a statement of another.
 */
public class CommentCache {
    private String comment;
    private Object scope;
    private boolean present;

    /**
     * Returns the cached comment, computing and storing it on the first call.
     *
     * @param loader computes the comment; may return null when there is nothing to tag
     * @return the cached comment, possibly null
     */
    public String computeIfAbsent(Supplier<String> loader) {
        return computeIfAbsent(Collections.emptyMap(), loader);
    }

    /**
     * Returns the cached comment if it was computed for an equal scope, otherwise computes and
     * stores a new one.
     *
     * @param scope connection values the comment depends on
     * @param loader computes the comment; may return null when there is nothing to tag
     * @return the cached comment, possibly null
     */
    public String computeIfAbsent(Object scope, Supplier<String> loader) {
        if (!present || !Objects.equals(this.scope, scope)) {
            comment = loader.get();
            this.scope = scope;
            present = true;
        }
        return comment;
    }

    public boolean isPresent() {
        return present;
    }

    public void clear() {
        comment = null;
        scope = null;
        present = false;
    }
}
