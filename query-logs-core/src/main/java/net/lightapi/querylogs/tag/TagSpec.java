package net.lightapi.querylogs.tag;

import net.lightapi.querylogs.QueryLogsConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Ordered list of tag declarations. The order of the declarations is the order of the tags
 * in a legacy formatted comment.
 */
public class TagSpec {
    private final List<TagDeclaration> declarations;

    private TagSpec(List<TagDeclaration> declarations) {
        this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
    }

    public static TagSpec of(String... keys) {
        Builder builder = builder();
        for (String key : keys) {
            builder.tag(key);
        }
        return builder.build();
    }

    public static TagSpec empty() {
        return new TagSpec(Collections.emptyList());
    }

    /**
     * Builds a spec from the tags list of query-logs.yml. Each entry is either a tag name or a
     * map of tag names to static values; the entries of a map keep their iteration order.
     *
     * @param tags list of String or Map entries
     * @return the tag spec
     * @throws QueryLogsConfigException if an entry is neither a String nor a Map
     */
    public static TagSpec fromConfig(List<?> tags) {
        Builder builder = builder();
        if (tags == null) return builder.build();
        for (Object entry : tags) {
            if (entry instanceof String) {
                builder.tag((String) entry);
            } else if (entry instanceof Map) {
                for (Map.Entry<?, ?> e : ((Map<?, ?>) entry).entrySet()) {
                    if (!(e.getKey() instanceof String)) {
                        throw new QueryLogsConfigException("Tag name must be a string: " + e.getKey());
                    }
                    builder.tag((String) e.getKey(), e.getValue());
                }
            } else {
                throw new QueryLogsConfigException("Unsupported tag declaration: " + entry);
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TagDeclaration> getDeclarations() {
        return declarations;
    }

    public boolean isEmpty() {
        return declarations.isEmpty();
    }

    @Override
    public String toString() {
        return declarations.toString();
    }

    public static class Builder {
        private final List<TagDeclaration> declarations = new ArrayList<>();

        public Builder tag(String key) {
            declarations.add(TagDeclaration.bare(key));
            return this;
        }

        public Builder tag(String key, Object value) {
            declarations.add(TagDeclaration.of(key, TagHandler.staticValue(value)));
            return this;
        }

        public Builder tag(String key, TagHandler handler) {
            declarations.add(TagDeclaration.of(key, handler));
            return this;
        }

        public Builder supplierTag(String key, Supplier<?> supplier) {
            return tag(key, TagHandler.supplier(supplier));
        }

        public Builder contextTag(String key, Function<Map<String, Object>, ?> function) {
            return tag(key, TagHandler.fromContext(function));
        }

        public TagSpec build() {
            return new TagSpec(declarations);
        }
    }
}
