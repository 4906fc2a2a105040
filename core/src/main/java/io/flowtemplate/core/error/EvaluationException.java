package io.flowtemplate.core.error;

/** Thrown when an expression asks for a runtime operation that is invalid or not implemented. */
public final class EvaluationException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    private final String reason;
    private final String context;

    public EvaluationException(String reason) {
        this(reason, null);
    }

    /**
     * @param reason  what went wrong
     * @param context where it went wrong (typically the expression source), or {@code null}
     */
    public EvaluationException(String reason, String context) {
        super("Evaluation error: " + reason + (context != null ? " (in " + context + ")" : ""));
        this.reason = reason;
        this.context = context;
    }

    @Override
    public String detail() {
        return reason;
    }

    /** Where the error occurred, or {@code null} if unknown. */
    public String context() {
        return context;
    }
}
