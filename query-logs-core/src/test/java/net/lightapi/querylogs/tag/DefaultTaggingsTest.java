package net.lightapi.querylogs.tag;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

public class DefaultTaggingsTest {

    static class UserHandler {
    }

    static class InvoiceJob {
    }

    @Test
    void testRegisteredTags() {
        TagRegistry registry = new TagRegistry();
        DefaultTaggings.register(registry, "portal");

        Map<String, Object> context = new HashMap<>();
        context.put("controller", new UserHandler());
        context.put("action", "getUser");
        context.put("job", new InvoiceJob());

        assertEquals("portal", registry.get("application").resolve(context));
        assertEquals(ProcessHandle.current().pid(), registry.get("pid").resolve(context));
        assertEquals("UserHandler", registry.get("controller").resolve(context));
        assertEquals("getUser", registry.get("action").resolve(context));
        assertEquals(UserHandler.class.getName(), registry.get("namespaced_controller").resolve(context));
        assertEquals(InvoiceJob.class.getName(), registry.get("job").resolve(context));
    }

    @Test
    void testStringValuesKept() {
        TagRegistry registry = new TagRegistry();
        DefaultTaggings.register(registry, "portal");
        Map<String, Object> context = Map.of("controller", "user", "job", "nightly-export");
        assertEquals("user", registry.get("controller").resolve(context));
        assertEquals("user", registry.get("namespaced_controller").resolve(context));
        assertEquals("nightly-export", registry.get("job").resolve(context));
    }

    @Test
    void testAbsentContextValues() {
        TagRegistry registry = new TagRegistry();
        DefaultTaggings.register(registry, "portal");
        List<ResolvedTag> pairs = TagResolver.resolve(TagSpec.of("application", "controller", "action", "job"), Map.of(), registry);
        assertEquals(List.of(new ResolvedTag("application", "portal")), pairs);
    }

    @Test
    void testBlankApplicationFallsBackToContext() {
        TagRegistry registry = new TagRegistry();
        DefaultTaggings.register(registry, " ");
        assertFalse(registry.contains("application"));
        assertNull(registry.get("application"));
        List<ResolvedTag> pairs = TagResolver.resolve(TagSpec.of("application"), Map.of("application", "from-context"), registry);
        assertEquals(List.of(new ResolvedTag("application", "from-context")), pairs);
    }
}
