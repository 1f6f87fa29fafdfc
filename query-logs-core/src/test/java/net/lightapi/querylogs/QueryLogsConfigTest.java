package net.lightapi.querylogs;

import net.lightapi.querylogs.tag.DefaultTaggings;
import net.lightapi.querylogs.tag.TagRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueryLogsConfigTest {

    @Test
    void testLoadConfig() {
        QueryLogsConfig config = QueryLogsConfig.load();
        assertTrue(config.isEnabled());
        assertEquals("sqlcommenter", config.getFormat());
        assertTrue(config.isPrependComment());
        assertTrue(config.isCacheQueryLogTags());
        assertEquals("portal", config.getApplication());
        assertEquals(4, config.getTags().size());
        assertEquals("application", config.getTags().get(0));
        assertEquals(Map.of("team", "billing"), config.getTags().get(2));
    }

    @Test
    void testDefaults() {
        QueryLogsConfig config = new QueryLogsConfig();
        assertTrue(config.isEnabled());
        assertEquals(List.of("application"), config.getTags());
    }

    @Test
    void testQueryLogsFromLoadedConfig() {
        QueryLogsConfig config = QueryLogsConfig.load();
        TagRegistry registry = new TagRegistry();
        DefaultTaggings.register(registry, config.getApplication());
        registry.loadProviders();
        QueryLogs queryLogs = new QueryLogs(config, registry);

        ExecutionContext context = new ExecutionContext(Map.of("controller", "UserHandler", "requestId", "r-1"));
        assertEquals("/*application='portal',controller='UserHandler',request_id='r-1',team='billing'*/ SELECT 1",
                queryLogs.call("SELECT 1", context));
    }
}
