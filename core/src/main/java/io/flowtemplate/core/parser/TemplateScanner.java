package io.flowtemplate.core.parser;

import io.flowtemplate.core.error.ParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits template source into literal text and <code>{{ ... }}</code> expression segments.
 *
 * <ul>
 * <li><code>\{{</code> in text stands for a literal <code>{{</code>
 * <li>quoted strings inside an expression may contain <code>}}</code>
 * <li>expression bodies are trimmed; an empty body is an error
 * <li>adjacent text (including escapes) is merged into one segment
 * </ul>
 */
public final class TemplateScanner {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    /**
     * A piece of the template.
     *
     * @param expression true for an expression body, false for literal text
     * @param text       the literal text, or the trimmed expression body
     * @param offset     char index of {@code text} inside the template
     * @param start      char index of the opening <code>{{</code> for expressions, equal to
     *                   {@code offset} for text
     */
    public record Segment(boolean expression, String text, int offset, int start) {}

    private TemplateScanner() {
        // utility class
    }

    /**
     * Scans {@code template} into segments. The empty template yields no segments.
     *
     * @throws ParseException for an unclosed <code>{{</code> or an empty expression
     */
    public static List<Segment> scan(String template) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int textStart = 0;
        int cursor = 0;

        while (cursor < template.length()) {
            int open = template.indexOf(OPEN, cursor);
            if (open < 0) {
                break;
            }
            if (open > 0 && template.charAt(open - 1) == '\\') {
                text.append(template, cursor, open - 1).append(OPEN);
                cursor = open + OPEN.length();
                continue;
            }
            text.append(template, cursor, open);
            if (text.length() > 0) {
                segments.add(new Segment(false, text.toString(), textStart, textStart));
                text.setLength(0);
            }

            int bodyStart = open + OPEN.length();
            int close = findClose(template, bodyStart);
            if (close < 0) {
                throw ParseException.atChar("Unclosed expression", open, template);
            }
            String raw = template.substring(bodyStart, close);
            String body = raw.strip();
            if (body.isEmpty()) {
                throw ParseException.atChar("Empty expression", open, template);
            }
            int leading = raw.indexOf(body);
            segments.add(new Segment(true, body, bodyStart + leading, open));

            cursor = close + CLOSE.length();
            textStart = cursor;
        }

        text.append(template, Math.min(cursor, template.length()), template.length());
        if (text.length() > 0) {
            segments.add(new Segment(false, text.toString(), textStart, textStart));
        }
        return segments;
    }

    /** Index of the first <code>}}</code> at or after {@code from} outside a quoted string, or -1. */
    private static int findClose(String template, int from) {
        int i = from;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(template, i);
                if (i < 0) {
                    return -1;
                }
                continue;
            }
            if (template.startsWith(CLOSE, i)) {
                return i;
            }
            i++;
        }
        return -1;
    }

    /** Returns the index just past the string starting at {@code quoteAt}, or -1 if unterminated. */
    private static int skipString(String template, int quoteAt) {
        char quote = template.charAt(quoteAt);
        int i = quoteAt + 1;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return -1;
    }
}
