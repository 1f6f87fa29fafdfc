package net.lightapi.querylogs.format;

import net.lightapi.querylogs.tag.ResolvedTag;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LegacyFormatterTest {
    private final LegacyFormatter formatter = new LegacyFormatter();

    @Test
    void testEmpty() {
        assertEquals("", formatter.format(Collections.emptyList()));
    }

    @Test
    void testKeepsInputOrder() {
        List<ResolvedTag> pairs = List.of(
                new ResolvedTag("job", "InvoiceJob"),
                new ResolvedTag("application", "portal"),
                new ResolvedTag("pid", 1234L));
        assertEquals("job='InvoiceJob',application='portal',pid='1234'", formatter.format(pairs));
    }

    @Test
    void testValuesEscaped() {
        List<ResolvedTag> pairs = List.of(new ResolvedTag("action", "*/DROP TABLE x;/*"));
        assertEquals("action='* /DROP TABLE x;/ *'", formatter.format(pairs));
    }
}
