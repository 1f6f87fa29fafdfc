package net.lightapi.querylogs.tag;

import java.util.Objects;

/**
 * A tag name with its non-null value, produced by the {@link TagResolver} for one query.
 */
public class ResolvedTag {
    private final String key;
    private final Object value;

    public ResolvedTag(String key, Object value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedTag that = (ResolvedTag) o;
        return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
