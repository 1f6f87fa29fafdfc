package net.lightapi.querylogs.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import net.lightapi.querylogs.ExecutionContext;
import net.lightapi.querylogs.QueryLogs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Collections;
import java.util.Map;

/**
 * DataSource whose connections tag every statement with the query logs comment. The db_host,
 * database and socket values are taken from the JDBC URL of this data source and only apply
 * to its own connections, so several pools can share one QueryLogs.
 */
public class TaggingDataSource implements DataSource {
    private static final Logger logger = LoggerFactory.getLogger(TaggingDataSource.class);

    private final DataSource delegate;
    private final QueryLogs queryLogs;
    private final Map<String, Object> connectionTags;

    /**
     * Wraps a data source. For a Hikari pool the database values are read from its JDBC URL.
     */
    public TaggingDataSource(DataSource delegate, QueryLogs queryLogs) {
        this(delegate, queryLogs, delegate instanceof HikariDataSource ? ((HikariDataSource) delegate).getJdbcUrl() : null);
    }

    /**
     * Wraps a data source whose JDBC URL is known to the caller.
     *
     * @param delegate the pool or driver data source
     * @param queryLogs the shared query logs
     * @param jdbcUrl the JDBC URL of the data source, may be null
     */
    public TaggingDataSource(DataSource delegate, QueryLogs queryLogs, String jdbcUrl) {
        this.delegate = delegate;
        this.queryLogs = queryLogs;
        this.connectionTags = jdbcUrl == null ? Collections.emptyMap() : DatabaseTaggings.fromJdbcUrl(jdbcUrl);
        if (jdbcUrl != null && connectionTags.isEmpty()) {
            logger.warn("Cannot derive db_host and database from jdbcUrl {}", jdbcUrl);
        }
    }

    /**
     * Gets a connection for the given unit of work.
     *
     * @param context the execution context of the current request or job
     * @return a tagging connection
     * @throws SQLException if the wrapped data source fails
     */
    public Connection getConnection(ExecutionContext context) throws SQLException {
        return new TaggingConnection(delegate.getConnection(), queryLogs, context, connectionTags);
    }

    /**
     * Gets a connection bound to a new, empty execution context. Only static, registered and
     * database tags can be resolved for its statements.
     */
    @Override
    public Connection getConnection() throws SQLException {
        return getConnection(new ExecutionContext());
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return new TaggingConnection(delegate.getConnection(username, password), queryLogs, new ExecutionContext(), connectionTags);
    }

    public DataSource getDelegate() {
        return delegate;
    }

    public Map<String, Object> getConnectionTags() {
        return connectionTags;
    }

    @Override
    public PrintWriter getLogWriter() throws SQLException {
        return delegate.getLogWriter();
    }

    @Override
    public void setLogWriter(PrintWriter out) throws SQLException {
        delegate.setLogWriter(out);
    }

    @Override
    public void setLoginTimeout(int seconds) throws SQLException {
        delegate.setLoginTimeout(seconds);
    }

    @Override
    public int getLoginTimeout() throws SQLException {
        return delegate.getLoginTimeout();
    }

    @Override
    public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
        return delegate.getParentLogger();
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        return delegate.unwrap(iface);
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) throws SQLException {
        return iface.isInstance(this) || delegate.isWrapperFor(iface);
    }
}
