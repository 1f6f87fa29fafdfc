package net.lightapi.querylogs.format;

import net.lightapi.querylogs.tag.ResolvedTag;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders tags as key='value' joined by commas, keeping the declaration order.
 */
public class LegacyFormatter implements QueryLogsFormatter {

    @Override
    public String format(List<ResolvedTag> pairs) {
        return pairs.stream()
                .map(tag -> tag.getKey() + "='" + SqlCommentEscaper.escape(tag.getValue()) + "'")
                .collect(Collectors.joining(","));
    }
}
