package io.flowtemplate.core.error;

import java.util.List;

/**
 * Thrown when a function referenced by a template is missing from the registry, or when the
 * function itself reports a failure. Failures of any other type raised inside a function are
 * wrapped into this exception with the original as the cause.
 */
public final class FunctionException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    private final String function;
    private final String reason;
    private final List<String> args;

    public FunctionException(String function, String reason, List<String> args) {
        super("Function '" + function + "' failed: " + reason);
        this.function = function;
        this.reason = reason;
        this.args = args != null ? List.copyOf(args) : List.of();
    }

    public FunctionException(String function, String reason, List<String> args, Throwable cause) {
        super("Function '" + function + "' failed: " + reason, cause);
        this.function = function;
        this.reason = reason;
        this.args = args != null ? List.copyOf(args) : List.of();
    }

    /** Creates the exception raised when no function with the given name is registered. */
    public static FunctionException notFound(String function) {
        return new FunctionException(function, "Function not found", List.of());
    }

    @Override
    public String detail() {
        return reason;
    }

    /** Name of the function that failed. */
    public String function() {
        return function;
    }

    /** Textual form of the arguments the function was called with (may be empty). */
    public List<String> args() {
        return args;
    }
}
