package net.lightapi.querylogs;

import com.networknt.config.Config;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the SQL query comment tagging. It is loaded from query-logs.yml so that
 * every service sharing a database can tag its queries the same way.
 *
 * The tags list accepts either a bare tag name or a map from tag name to a static value:
 *
 * <pre>
 * tags:
 *   - application
 *   - controller
 *   - team: billing
 * </pre>
 */
public class QueryLogsConfig {
    public static final String CONFIG_NAME = "query-logs";

    boolean enabled = true;
    List<Object> tags = new ArrayList<>(List.of(QueryLogsConstants.APPLICATION));
    String format;
    boolean prependComment;
    boolean cacheQueryLogTags;
    String application;

    public QueryLogsConfig() {
    }

    /**
     * Loads query-logs.yml from the externalized config folder or the classpath.
     *
     * @return the loaded config, or a config with defaults when no file is found
     */
    public static QueryLogsConfig load() {
        QueryLogsConfig config = (QueryLogsConfig) Config.getInstance().getJsonObjectConfig(CONFIG_NAME, QueryLogsConfig.class);
        return config != null ? config : new QueryLogsConfig();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<Object> getTags() {
        return tags;
    }

    public void setTags(List<Object> tags) {
        this.tags = tags;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public boolean isPrependComment() {
        return prependComment;
    }

    public void setPrependComment(boolean prependComment) {
        this.prependComment = prependComment;
    }

    public boolean isCacheQueryLogTags() {
        return cacheQueryLogTags;
    }

    public void setCacheQueryLogTags(boolean cacheQueryLogTags) {
        this.cacheQueryLogTags = cacheQueryLogTags;
    }

    public String getApplication() {
        return application;
    }

    public void setApplication(String application) {
        this.application = application;
    }
}
