package io.flowtemplate.core.error;

/**
 * Thrown when structured data handed to the engine (JSON text) cannot be read. Wraps the
 * underlying Jackson exception as the cause.
 */
public final class DataFormatException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    public DataFormatException(String message, Throwable cause) {
        super("JSON error: " + message, cause);
    }

    @Override
    public String detail() {
        return getCause() != null ? getCause().getMessage() : getMessage();
    }
}
