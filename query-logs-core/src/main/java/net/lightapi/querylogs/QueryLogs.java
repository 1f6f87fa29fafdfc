package net.lightapi.querylogs;

import net.lightapi.querylogs.format.QueryLogsFormat;
import net.lightapi.querylogs.format.QueryLogsFormatter;
import net.lightapi.querylogs.format.SqlCommentEscaper;
import net.lightapi.querylogs.tag.ResolvedTag;
import net.lightapi.querylogs.tag.TagHandler;
import net.lightapi.querylogs.tag.TagRegistry;
import net.lightapi.querylogs.tag.TagResolver;
import net.lightapi.querylogs.tag.TagSpec;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends or prepends a comment with runtime information tags to SQL statements, so that a slow
 * or troublesome statement seen by the database can be traced back to the request or job that
 * issued it.
 *
 * <pre>
 * QueryLogs queryLogs = new QueryLogs(QueryLogsConfig.load(), registry);
 * String sql = queryLogs.call("SELECT * FROM user_t", context);
 * // SELECT * FROM user_t /*application='portal',controller='UserHandler'*&#47;
 * </pre>
 *
 * The configuration is shared by all units of work and is expected to be changed at startup
 * only. The comment cache lives in the {@link ExecutionContext} of each unit of work.
 */
public class QueryLogs {
    private static final Logger logger = LoggerFactory.getLogger(QueryLogs.class);

    private final TagRegistry registry;
    private volatile TagSpec tags;
    private volatile QueryLogsFormatter formatter;
    private volatile boolean prependComment;
    private volatile boolean cacheQueryLogTags;
    private volatile boolean enabled = true;

    public QueryLogs() {
        this(new TagRegistry());
    }

    public QueryLogs(TagRegistry registry) {
        this.registry = registry;
        this.tags = TagSpec.of(QueryLogsConstants.APPLICATION);
    }

    /**
     * Creates the query logs from configuration.
     *
     * @param config loaded query-logs.yml
     * @param registry default tag handlers
     * @throws QueryLogsConfigException if the format or a tag declaration is not supported
     */
    public QueryLogs(QueryLogsConfig config, TagRegistry registry) {
        this.registry = registry;
        this.enabled = config.isEnabled();
        this.tags = TagSpec.fromConfig(config.getTags());
        this.prependComment = config.isPrependComment();
        this.cacheQueryLogTags = config.isCacheQueryLogTags();
        if (StringUtils.isNotBlank(config.getFormat())) {
            updateFormatter(config.getFormat());
        }
        logger.info("QueryLogs enabled = {} tags = {} prependComment = {} cacheQueryLogTags = {}",
                enabled, tags, prependComment, cacheQueryLogTags);
    }

    /**
     * Tags the SQL with the comment of the given unit of work.
     *
     * @param sql the statement, never inspected
     * @param context the current unit of work
     * @return the SQL with the comment joined by a single space, or the SQL unchanged when
     *         there is nothing to tag
     */
    public String call(String sql, ExecutionContext context) {
        return call(sql, context, Collections.emptyMap());
    }

    /**
     * Tags the SQL issued over one connection. The connection values (e.g., db_host and database
     * of the pool the connection belongs to) are visible to the tags next to the context values
     * and take precedence over them.
     *
     * @param sql the statement, never inspected
     * @param context the current unit of work
     * @param connectionValues values of the connection the statement runs on
     * @return the tagged SQL, or the SQL unchanged when there is nothing to tag
     */
    public String call(String sql, ExecutionContext context, Map<String, ?> connectionValues) {
        if (!enabled) return sql;
        String comment = comment(context, connectionValues);
        if (StringUtils.isEmpty(comment)) {
            return sql;
        } else if (prependComment) {
            return comment + " " + sql;
        } else {
            return sql + " " + comment;
        }
    }

    /**
     * Returns the comment for the unit of work, reusing the cached one when caching is on.
     *
     * @param context the current unit of work
     * @return the comment including its delimiters, or null when no tag resolved
     */
    public String comment(ExecutionContext context) {
        return comment(context, Collections.emptyMap());
    }

    /**
     * Returns the comment for the unit of work and connection. A cached comment is only reused
     * for the same connection values it was computed with.
     *
     * @param context the current unit of work
     * @param connectionValues values of the connection the statement runs on
     * @return the comment including its delimiters, or null when no tag resolved
     */
    public String comment(ExecutionContext context, Map<String, ?> connectionValues) {
        if (cacheQueryLogTags) {
            return context.getCommentCache().computeIfAbsent(connectionValues, () -> uncachedComment(context, connectionValues));
        }
        // drop what was cached while caching was on
        context.getCommentCache().clear();
        return uncachedComment(context, connectionValues);
    }

    public void clearCache(ExecutionContext context) {
        context.getCommentCache().clear();
    }

    /**
     * Selects the formatter by name.
     *
     * @param format "legacy" or "sqlcommenter"
     * @return the new formatter
     * @throws QueryLogsConfigException if the name is not supported
     */
    public QueryLogsFormatter updateFormatter(String format) {
        QueryLogsFormatter newFormatter = QueryLogsFormat.of(format).newFormatter();
        this.formatter = newFormatter;
        logger.info("QueryLogs formatter set to {}", format);
        return newFormatter;
    }

    /**
     * @return the selected formatter; legacy when none was selected
     */
    public QueryLogsFormatter getFormatter() {
        QueryLogsFormatter current = formatter;
        return current != null ? current : updateFormatter(QueryLogsConstants.FORMAT_LEGACY);
    }

    /**
     * Registers the default handler of a tag, used by bare declarations of that tag.
     */
    public void register(String key, TagHandler handler) {
        registry.register(key, handler);
    }

    private String uncachedComment(ExecutionContext context, Map<String, ?> connectionValues) {
        String content = tagContent(context, connectionValues);
        if (StringUtils.isNotEmpty(content)) {
            String comment = QueryLogsConstants.COMMENT_OPEN + SqlCommentEscaper.escape(content) + QueryLogsConstants.COMMENT_CLOSE;
            if (logger.isTraceEnabled()) logger.trace("comment = {}", comment);
            return comment;
        }
        return null;
    }

    private String tagContent(ExecutionContext context, Map<String, ?> connectionValues) {
        List<ResolvedTag> pairs = TagResolver.resolve(tags, tagValues(context, connectionValues), registry);
        return getFormatter().format(pairs);
    }

    private static Map<String, Object> tagValues(ExecutionContext context, Map<String, ?> connectionValues) {
        if (connectionValues == null || connectionValues.isEmpty()) {
            return context.toMap();
        }
        Map<String, Object> values = new LinkedHashMap<>(context.toMap());
        values.putAll(connectionValues);
        return Collections.unmodifiableMap(values);
    }

    public TagRegistry getRegistry() {
        return registry;
    }

    public TagSpec getTags() {
        return tags;
    }

    public void setTags(TagSpec tags) {
        this.tags = tags;
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

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
