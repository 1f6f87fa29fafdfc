package net.lightapi.querylogs.tag;

import com.networknt.service.SingletonServiceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default handlers keyed by tag name. A bare tag declaration is resolved through the registry
 * before falling back to the raw context value, so collaborators can contribute tags without
 * touching the configured tag list.
 */
public class TagRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TagRegistry.class);

    // Maps tag name (e.g., "controller") to its default handler
    private final Map<String, TagHandler> handlerMap = new ConcurrentHashMap<>();

    public TagRegistry() {
    }

    /**
     * Registers or replaces the default handler of a tag.
     * @param key The tag name.
     * @param handler The handler to use for bare declarations of the tag.
     */
    public void register(String key, TagHandler handler) {
        TagHandler previous = handlerMap.put(key, handler);
        if (previous != null) {
            logger.debug("Replaced default tag handler for {}", key);
        }
    }

    public TagHandler get(String key) {
        return handlerMap.get(key);
    }

    public boolean contains(String key) {
        return handlerMap.containsKey(key);
    }

    public Map<String, TagHandler> getHandlers() {
        return Collections.unmodifiableMap(handlerMap);
    }

    /**
     * Registers the handlers of all QueryTagProvider implementations configured in service.yml.
     * A provider whose key is already registered is ignored.
     *
     * @return the number of providers registered
     */
    public int loadProviders() {
        QueryTagProvider[] providers = SingletonServiceFactory.getBeans(QueryTagProvider.class);
        if (providers == null) return 0;
        int[] count = {0};
        Arrays.stream(providers).forEach(provider -> {
            String key = provider.getKey();
            if (handlerMap.containsKey(key)) {
                logger.error("Duplicate QueryTagProvider found for tag: {}. Ignoring class: {}", key, provider.getClass().getName());
            } else {
                handlerMap.put(key, provider.getHandler());
                count[0]++;
                logger.info("Registered QueryTagProvider for tag: {}", key);
            }
        });
        return count[0];
    }
}
