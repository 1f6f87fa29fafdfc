package net.lightapi.querylogs;

/**
 * Raised while the query logs are being configured, for example when an unknown formatter
 * name or a malformed tag declaration is supplied. It is never raised while tagging a query.
 */
public class QueryLogsConfigException extends RuntimeException {
    public QueryLogsConfigException(String message) { super(message); }
    public QueryLogsConfigException(String message, Throwable cause) { super(message, cause); }
}
