package net.lightapi.querylogs.tag;

/**
 * Plug-in that contributes a default handler for one tag. Implementations are listed under
 * this interface in service.yml and picked up by {@link TagRegistry#loadProviders()}.
 */
public interface QueryTagProvider {

    /**
     * The tag name this provider supplies a handler for.
     * @return the tag name (e.g., "tenant").
     */
    String getKey();

    /**
     * @return the handler used when a bare declaration of {@link #getKey()} has no handler of its own.
     */
    TagHandler getHandler();
}
