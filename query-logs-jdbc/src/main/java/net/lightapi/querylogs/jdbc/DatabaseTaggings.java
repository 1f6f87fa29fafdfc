package net.lightapi.querylogs.jdbc;

import net.lightapi.querylogs.QueryLogsConstants;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the db_host, database and socket tag values of a data source from its JDBC URL of the
 * form jdbc:vendor://host[:port]/database[?params], e.g. jdbc:postgresql://localhost:5432/configserver.
 * The values belong to the connections of that data source only and are handed to each
 * {@link TaggingConnection} rather than registered globally.
 */
public class DatabaseTaggings {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseTaggings.class);
    private static final String JDBC_PREFIX = "jdbc:";

    // driver parameters naming a unix domain socket: MySQL/MariaDB, MySQL Connector/J X DevAPI, MariaDB
    static final List<String> SOCKET_PARAMETERS = List.of("socket", "unixSocketPath", "localSocket");

    private DatabaseTaggings() {
    }

    /**
     * @param jdbcUrl the JDBC URL of the data source
     * @return the db_host, database and socket values found in the URL; empty if it cannot be parsed
     */
    public static Map<String, Object> fromJdbcUrl(String jdbcUrl) {
        URI uri = parse(jdbcUrl);
        if (uri == null) return Collections.emptyMap();
        Map<String, Object> values = new LinkedHashMap<>();
        String host = uri.getHost();
        if (StringUtils.isNotEmpty(host)) {
            values.put(QueryLogsConstants.DB_HOST, host);
        }
        String database = StringUtils.removeStart(uri.getPath(), "/");
        if (StringUtils.isNotEmpty(database)) {
            values.put(QueryLogsConstants.DATABASE, database);
        }
        String socket = socket(uri.getRawQuery());
        if (StringUtils.isNotEmpty(socket)) {
            values.put(QueryLogsConstants.SOCKET, socket);
        }
        return Collections.unmodifiableMap(values);
    }

    static URI parse(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(JDBC_PREFIX)) return null;
        try {
            URI uri = new URI(jdbcUrl.substring(JDBC_PREFIX.length()));
            return uri.isOpaque() ? null : uri;
        } catch (URISyntaxException e) {
            logger.debug("Unable to parse jdbcUrl {}", jdbcUrl, e);
            return null;
        }
    }

    private static String socket(String query) {
        if (StringUtils.isEmpty(query)) return null;
        for (String parameter : query.split("&")) {
            String name = StringUtils.substringBefore(parameter, "=");
            if (SOCKET_PARAMETERS.contains(name) && parameter.contains("=")) {
                return URLDecoder.decode(StringUtils.substringAfter(parameter, "="), StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
