package net.lightapi.querylogs.tag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class TagResolver {
    private static final Logger logger = LoggerFactory.getLogger(TagResolver.class);

    private TagResolver() {
        // Private constructor for utility class
    }

    /**
     * Resolves the tags of a spec against the current context, in declaration order.
     *
     * A declaration with its own handler uses it. A bare declaration uses the registry handler
     * for its key, or the context value of the same key when nothing is registered. Tags whose
     * value resolves to null are left out. Exceptions thrown by handlers are not caught.
     *
     * @param tagSpec declared tags
     * @param context read-only context of the current unit of work
     * @param registry default handlers
     * @return resolved tags in declaration order
     */
    public static List<ResolvedTag> resolve(TagSpec tagSpec, Map<String, Object> context, TagRegistry registry) {
        List<ResolvedTag> pairs = new ArrayList<>();
        for (TagDeclaration declaration : tagSpec.getDeclarations()) {
            String key = declaration.getKey();
            TagHandler handler = declaration.getHandler();
            if (handler == null && registry != null) {
                handler = registry.get(key);
            }
            Object value = handler == null ? context.get(key) : handler.resolve(context);
            if (value != null) {
                pairs.add(new ResolvedTag(key, value));
            } else if (logger.isTraceEnabled()) {
                logger.trace("tag {} resolved to null and is omitted", key);
            }
        }
        return pairs;
    }
}
