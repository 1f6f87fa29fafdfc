package net.lightapi.querylogs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key/value state of one unit of work (an HTTP request, a job execution) that tags are read
 * from. The request handler or job runner creates one context per unit of work and passes it
 * along with the queries it issues. It also carries the comment cache of that unit of work;
 * any change to the values clears the cache and notifies the after-change listeners.
 *
 * A context is confined to the thread that runs the unit of work and is not thread safe.
 */
public class ExecutionContext {
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, Object> view = Collections.unmodifiableMap(values);
    private final CommentCache commentCache = new CommentCache();
    private final List<Runnable> afterChangeListeners = new ArrayList<>();

    public ExecutionContext() {
    }

    public ExecutionContext(Map<String, ?> values) {
        if (values != null) {
            values.forEach(this::put);
        }
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Sets a value; a null value removes the key.
     */
    public ExecutionContext set(String key, Object value) {
        put(key, value);
        changed();
        return this;
    }

    public ExecutionContext set(Map<String, ?> entries) {
        entries.forEach(this::put);
        changed();
        return this;
    }

    /**
     * Sets the given values until the returned scope is closed, then restores the previous
     * ones. Meant for try-with-resources around a nested piece of work:
     *
     * <pre>
     * try (ExecutionContext.Scope scope = context.push(Map.of("job", "InvoiceJob"))) {
     *     ...
     * }
     * </pre>
     *
     * @param entries values to apply for the duration of the scope
     * @return scope restoring the previous values on close
     */
    public Scope push(Map<String, ?> entries) {
        Map<String, Object> previous = new HashMap<>();
        entries.keySet().forEach(key -> previous.put(key, values.get(key)));
        set(entries);
        return new Scope(previous);
    }

    public void clear() {
        values.clear();
        changed();
    }

    /**
     * @return read-only live view of the values
     */
    public Map<String, Object> toMap() {
        return view;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Registers a callback invoked after every change of the values.
     */
    public void afterChange(Runnable listener) {
        afterChangeListeners.add(listener);
    }

    public CommentCache getCommentCache() {
        return commentCache;
    }

    private void put(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    private void changed() {
        commentCache.clear();
        afterChangeListeners.forEach(Runnable::run);
    }

    @Override
    public String toString() {
        return "ExecutionContext" + values;
    }

    public class Scope implements AutoCloseable {
        private final Map<String, Object> previous;

        private Scope(Map<String, Object> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            set(previous);
        }
    }
}
