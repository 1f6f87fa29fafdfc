package net.lightapi.querylogs.format;

import net.lightapi.querylogs.tag.ResolvedTag;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders tags following the SQLCommenter convention
 * (https://google.github.io/sqlcommenter/spec/): key='percent-encoded value', sorted by key
 * and joined by commas. Sorting makes the comment identical for the same set of tags no
 * matter how they were declared.
 */
public class SqlCommenterFormatter implements QueryLogsFormatter {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    @Override
    public String format(List<ResolvedTag> pairs) {
        return pairs.stream()
                .sorted(Comparator.comparing(ResolvedTag::getKey))
                .map(tag -> tag.getKey() + "='" + encode(SqlCommentEscaper.escape(tag.getValue())) + "'")
                .collect(Collectors.joining(","));
    }

    /**
     * Percent-encodes every UTF-8 byte except the RFC 3986 unreserved characters.
     * URLEncoder is not used as it writes a space as '+' and leaves '*' alone.
     *
     * @param value the text to encode
     * @return the encoded text
     */
    static String encode(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (isUnreserved(c)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '_' || c == '.' || c == '~';
    }
}
