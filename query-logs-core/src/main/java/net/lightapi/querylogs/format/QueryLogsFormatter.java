package net.lightapi.querylogs.format;

import net.lightapi.querylogs.tag.ResolvedTag;

import java.util.List;

/**
 * Turns resolved tags into the body of a SQL comment, without the surrounding delimiters.
 */
public interface QueryLogsFormatter {

    /**
     * @param pairs resolved tags in declaration order
     * @return the comment body, or an empty string when there are no tags
     */
    String format(List<ResolvedTag> pairs);
}
