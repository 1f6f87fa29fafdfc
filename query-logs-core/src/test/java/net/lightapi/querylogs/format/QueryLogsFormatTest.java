package net.lightapi.querylogs.format;

import net.lightapi.querylogs.QueryLogsConfigException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueryLogsFormatTest {

    @Test
    void testSupportedNames() {
        assertEquals(QueryLogsFormat.LEGACY, QueryLogsFormat.of("legacy"));
        assertEquals(QueryLogsFormat.SQLCOMMENTER, QueryLogsFormat.of("sqlcommenter"));
        assertTrue(QueryLogsFormat.of("sqlcommenter").newFormatter() instanceof SqlCommenterFormatter);
        assertTrue(QueryLogsFormat.of("legacy").newFormatter() instanceof LegacyFormatter);
    }

    @Test
    void testUnsupportedName() {
        QueryLogsConfigException e = assertThrows(QueryLogsConfigException.class, () -> QueryLogsFormat.of("json"));
        assertEquals("Formatter is unsupported: json", e.getMessage());
        assertThrows(QueryLogsConfigException.class, () -> QueryLogsFormat.of(null));
    }

    @Test
    void testNameMustMatchExactly() {
        assertThrows(QueryLogsConfigException.class, () -> QueryLogsFormat.of("SQLCommenter"));
        assertThrows(QueryLogsConfigException.class, () -> QueryLogsFormat.of(" sqlcommenter "));
        assertThrows(QueryLogsConfigException.class, () -> QueryLogsFormat.of("Legacy"));
    }
}
