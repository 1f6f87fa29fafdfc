package net.lightapi.querylogs.format;

import net.lightapi.querylogs.QueryLogsConfigException;
import net.lightapi.querylogs.QueryLogsConstants;

import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Supported comment formats, selected by the name used in query-logs.yml.
 */
public enum QueryLogsFormat {
    LEGACY(QueryLogsConstants.FORMAT_LEGACY, LegacyFormatter::new),
    SQLCOMMENTER(QueryLogsConstants.FORMAT_SQLCOMMENTER, SqlCommenterFormatter::new);

    private final String formatName;
    private final Supplier<QueryLogsFormatter> factory;

    QueryLogsFormat(String formatName, Supplier<QueryLogsFormatter> factory) {
        this.formatName = formatName;
        this.factory = factory;
    }

    public String getFormatName() {
        return formatName;
    }

    public QueryLogsFormatter newFormatter() {
        return factory.get();
    }

    /**
     * @param name format name, exactly "legacy" or "sqlcommenter"
     * @return the matching format
     * @throws QueryLogsConfigException if the name is null or not supported
     */
    public static QueryLogsFormat of(String name) {
        return Arrays.stream(values())
                .filter(format -> format.formatName.equals(name))
                .findFirst()
                .orElseThrow(() -> new QueryLogsConfigException("Formatter is unsupported: " + name));
    }
}
