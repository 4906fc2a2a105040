package io.flowtemplate.core.error;

import java.nio.charset.StandardCharsets;

/**
 * Thrown when template source cannot be parsed: an unclosed <code>{{</code>, an unknown data source, a
 * malformed literal, and so on. A template that parsed successfully never produces this exception
 * later.
 */
public final class ParseException extends TemplateException {

    private static final long serialVersionUID = 1L;

    private final String reason;
    private final int position;
    private final String template;

    /**
     * @param reason   what went wrong
     * @param position UTF-8 byte offset into {@code template} where the problem starts
     * @param template the complete template source
     */
    public ParseException(String reason, int position, String template) {
        super("Parse error at position " + position + ": " + reason, Phase.PARSE);
        this.reason = reason;
        this.position = position;
        this.template = template;
    }

    /**
     * Creates an exception for a problem found at a {@code char} index of the source, converting
     * it to a UTF-8 byte offset.
     */
    public static ParseException atChar(String reason, int charIndex, String template) {
        int clamped = Math.max(0, Math.min(charIndex, template.length()));
        int bytes = template.substring(0, clamped).getBytes(StandardCharsets.UTF_8).length;
        return new ParseException(reason, bytes, template);
    }

    @Override
    public String detail() {
        return reason;
    }

    /** UTF-8 byte offset of the error in the template source. */
    public int position() {
        return position;
    }

    /** The template source that failed to parse. */
    public String template() {
        return template;
    }
}
