package io.flowtemplate.core.error;

/** Thrown for arithmetic failures: division by zero, integer overflow. */
public final class MathException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    public MathException(String reason) {
        super("Math error: " + reason);
        this.reason = reason;
    }

    @Override
    public String detail() {
        return reason;
    }
}
