package net.lightapi.querylogs.format;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Sanitizes text so it can be placed inside a SQL block comment.
 *
 * A leading "/*" (or "/*+" optimizer hint opener) and a trailing "*&#47;", each with at most one
 * adjacent space, are stripped first so that a payload that was already wrapped keeps its
 * content. Any remaining "*&#47;" becomes "* /" and any remaining "/*" becomes "/ *", so the
 * payload can neither close the comment early nor open a nested one.
 */
public class SqlCommentEscaper {

    private static final Pattern SURROUNDING_DELIMITERS = Pattern.compile("\\A\\s*/\\*\\+?\\s?|\\s?\\*/\\s*\\z");

    private SqlCommentEscaper() {
    }

    /**
     * @param raw value to escape; null becomes an empty string, other objects their toString()
     * @return text that is safe inside a SQL block comment
     */
    public static String escape(Object raw) {
        String comment = raw == null ? "" : raw.toString();
        comment = SURROUNDING_DELIMITERS.matcher(comment).replaceAll("");
        comment = StringUtils.replace(comment, "*/", "* /");
        return StringUtils.replace(comment, "/*", "/ *");
    }
}
