package net.lightapi.querylogs;

public class QueryLogsConstants {

    // formatter names
    public static final String FORMAT_LEGACY = "legacy";
    public static final String FORMAT_SQLCOMMENTER = "sqlcommenter";

    // built-in tags
    public static final String APPLICATION = "application";
    public static final String PID = "pid";
    public static final String CONTROLLER = "controller";
    public static final String ACTION = "action";
    public static final String NAMESPACED_CONTROLLER = "namespaced_controller";
    public static final String JOB = "job";
    public static final String DB_HOST = "db_host";
    public static final String DATABASE = "database";
    public static final String SOCKET = "socket";

    // comment delimiters
    public static final String COMMENT_OPEN = "/*";
    public static final String COMMENT_CLOSE = "*/";

    private QueryLogsConstants() {
    }
}
