package io.flowtemplate.core.error;

/**
 * Thrown when a value cannot be coerced to the type an operation needs, e.g. an object rendered as
 * text or a non-numeric string used in arithmetic.
 */
public final class TypeConversionException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    private final String from;
    private final String to;
    private final String context;

    public TypeConversionException(String from, String to) {
        this(from, to, null);
    }

    /**
     * @param from    type name of the source value
     * @param to      type name of the requested target
     * @param context where the conversion was attempted, or {@code null}
     */
    public TypeConversionException(String from, String to, String context) {
        super("Type error: cannot convert " + from + " to " + to + (context != null ? " (" + context + ")" : ""));
        this.from = from;
        this.to = to;
        this.context = context;
    }

    @Override
    public String detail() {
        return "cannot convert " + from + " to " + to;
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    /** Where the conversion was attempted, or {@code null}. */
    public String context() {
        return context;
    }
}
