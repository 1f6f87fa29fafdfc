package net.lightapi.querylogs.tag;

import java.util.Objects;

/**
 * One entry of a {@link TagSpec}. A declaration without a handler is a bare key that is
 * resolved from the {@link TagRegistry} or directly from the execution context.
 */
public class TagDeclaration {
    private final String key;
    private final TagHandler handler;

    private TagDeclaration(String key, TagHandler handler) {
        this.key = Objects.requireNonNull(key, "key");
        this.handler = handler;
    }

    public static TagDeclaration bare(String key) {
        return new TagDeclaration(key, null);
    }

    public static TagDeclaration of(String key, TagHandler handler) {
        return new TagDeclaration(key, Objects.requireNonNull(handler, "handler"));
    }

    public String getKey() {
        return key;
    }

    public TagHandler getHandler() {
        return handler;
    }

    public boolean isBare() {
        return handler == null;
    }

    @Override
    public String toString() {
        return isBare() ? key : key + "=" + handler;
    }
}
