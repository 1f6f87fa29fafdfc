package net.lightapi.querylogs.format;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class SqlCommentEscaperTest {

    @Test
    void testPlainTextUnchanged() {
        assertEquals("application='portal'", SqlCommentEscaper.escape("application='portal'"));
        String once = SqlCommentEscaper.escape("UserHandler#getUser");
        assertEquals(once, SqlCommentEscaper.escape(once));
    }

    @Test
    void testNullAndNonString() {
        assertEquals("", SqlCommentEscaper.escape(null));
        assertEquals("42", SqlCommentEscaper.escape(42));
    }

    @Test
    void testInternalDelimitersNeutralized() {
        assertEquals("* /DROP TABLE x;/ *", SqlCommentEscaper.escape("*/DROP TABLE x;/*"));
        assertEquals("a* / *b", SqlCommentEscaper.escape("a*/*b"));
    }

    @Test
    void testSurroundingDelimitersStripped() {
        assertEquals("application='portal'", SqlCommentEscaper.escape("/* application='portal' */"));
        assertEquals("INDEX(t idx)", SqlCommentEscaper.escape("/*+ INDEX(t idx) */"));
        assertEquals("abc", SqlCommentEscaper.escape("/*abc*/"));
        assertEquals("", SqlCommentEscaper.escape("/**/"));
    }

    @Test
    void testOnlyOuterDelimitersStripped() {
        assertEquals("a * / b / * c", SqlCommentEscaper.escape("/* a */ b /* c */"));
    }

    @Test
    void testNoCloseSequenceSurvives() {
        String[] inputs = {"*/", "**/", "*/*/", "/*/", "x*/*/*y", "'*/ OR 1=1 --", "/**/*/"};
        for (String input : inputs) {
            assertFalse(SqlCommentEscaper.escape(input).contains("*/"), input);
            assertFalse(SqlCommentEscaper.escape(input).contains("/*"), input);
        }
    }
}
