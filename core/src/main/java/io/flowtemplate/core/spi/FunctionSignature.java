package io.flowtemplate.core.spi;

import io.flowtemplate.core.error.SignatureException;

/**
 * Declared arity of a {@link TemplateFunction}.
 *
 * @param minArgs minimum number of arguments (inclusive, {@code >= 0})
 * @param maxArgs maximum number of arguments (inclusive), or {@link #UNBOUNDED}
 */
public record FunctionSignature(int minArgs, int maxArgs) {

    /** Marker for "no upper limit". */
    public static final int UNBOUNDED = -1;

    private static final FunctionSignature ANY = new FunctionSignature(0, UNBOUNDED);

    public FunctionSignature {
        if (minArgs < 0) {
            throw new IllegalArgumentException("minArgs must not be negative, got: " + minArgs);
        }
        if (maxArgs != UNBOUNDED && maxArgs < minArgs) {
            throw new IllegalArgumentException("maxArgs (" + maxArgs + ") must not be below minArgs (" + minArgs + ")");
        }
    }

    /** Accepts any number of arguments. */
    public static FunctionSignature any() {
        return ANY;
    }

    public static FunctionSignature exactly(int count) {
        return new FunctionSignature(count, count);
    }

    public static FunctionSignature between(int minArgs, int maxArgs) {
        return new FunctionSignature(minArgs, maxArgs);
    }

    public static FunctionSignature atLeast(int minArgs) {
        return new FunctionSignature(minArgs, UNBOUNDED);
    }

    public boolean accepts(int argCount) {
        return argCount >= minArgs && (maxArgs == UNBOUNDED || argCount <= maxArgs);
    }

    /**
     * Verifies that a call with {@code argCount} arguments is allowed.
     *
     * @throws SignatureException if it is not
     */
    public void check(String function, int argCount) {
        if (!accepts(argCount)) {
            throw new SignatureException(function, "expected " + describe() + " but got " + argCount);
        }
    }

    private String describe() {
        if (maxArgs == minArgs) {
            return minArgs + (minArgs == 1 ? " argument" : " arguments");
        }
        if (maxArgs == UNBOUNDED) {
            return "at least " + minArgs + (minArgs == 1 ? " argument" : " arguments");
        }
        return minArgs + " to " + maxArgs + " arguments";
    }
}
