package io.flowtemplate.core.error;

/**
 * Abstract base for all template engine exceptions. Never thrown directly; use the concrete
 * {@link ParseException} or one of the subclasses of {@link TemplateEvalException}.
 */
public abstract class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final Phase phase;

    protected TemplateException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected TemplateException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description without the category prefix. */
    public abstract String detail();

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
