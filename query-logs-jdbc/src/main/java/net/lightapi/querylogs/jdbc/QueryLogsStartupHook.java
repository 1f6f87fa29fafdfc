package net.lightapi.querylogs.jdbc;

import com.networknt.server.StartupHookProvider;
import net.lightapi.querylogs.QueryLogs;
import net.lightapi.querylogs.QueryLogsConfig;
import net.lightapi.querylogs.tag.DefaultTaggings;
import net.lightapi.querylogs.tag.TagRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Start up hook that creates the shared QueryLogs from query-logs.yml, registers the default
 * tags and the tag providers in service.yml. Handlers and repositories wrap their data source
 * with {@link #wrap(DataSource)} to get tagging connections.
 */
public class QueryLogsStartupHook implements StartupHookProvider {
    private static final Logger logger = LoggerFactory.getLogger(QueryLogsStartupHook.class);
    static QueryLogsConfig config = QueryLogsConfig.load();
    public static QueryLogs queryLogs;

    @Override
    public void onStartup() {
        logger.info("QueryLogsStartupHook begins");
        TagRegistry registry = new TagRegistry();
        DefaultTaggings.register(registry, config.getApplication());
        int providers = registry.loadProviders();
        queryLogs = new QueryLogs(config, registry);
        logger.info("QueryLogsStartupHook ends with {} tag providers", providers);
    }

    public static DataSource wrap(DataSource dataSource) {
        if (queryLogs == null) {
            throw new IllegalStateException("QueryLogsStartupHook has not been run");
        }
        return new TaggingDataSource(dataSource, queryLogs);
    }
}
