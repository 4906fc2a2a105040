package io.flowtemplate.core.error;

/** Thrown when a function is called with arguments that violate its declared signature. */
public final class SignatureException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    private final String function;
    private final String reason;

    public SignatureException(String function, String reason) {
        super("Invalid function signature for '" + function + "': " + reason);
        this.function = function;
        this.reason = reason;
    }

    @Override
    public String detail() {
        return reason;
    }

    public String function() {
        return function;
    }
}
