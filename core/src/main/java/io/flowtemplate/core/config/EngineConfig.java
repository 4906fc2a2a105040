package io.flowtemplate.core.config;

/**
 * Limits and switches applied when templates are parsed through a {@code TemplateEngine}.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxTemplateLength  maximum template source length in chars (default: 1M)
 * @param maxExpressionDepth maximum nesting depth of a single expression (default: 64)
 * @param strictFunctions    reject, at parse time, templates that call functions the engine's
 *                           registry does not know (default: false)
 */
public record EngineConfig(int maxTemplateLength, int maxExpressionDepth, boolean strictFunctions) {

    /** Default configuration: 1M chars, depth 64, lenient function checking. */
    public static final EngineConfig DEFAULT = new EngineConfig(1024 * 1024, 64, false);

    public EngineConfig {
        if (maxTemplateLength <= 0) {
            throw new IllegalArgumentException("maxTemplateLength must be positive, got: " + maxTemplateLength);
        }
        if (maxExpressionDepth <= 0) {
            throw new IllegalArgumentException("maxExpressionDepth must be positive, got: " + maxExpressionDepth);
        }
    }

    public EngineConfig withMaxTemplateLength(int value) {
        return new EngineConfig(value, maxExpressionDepth, strictFunctions);
    }

    public EngineConfig withMaxExpressionDepth(int value) {
        return new EngineConfig(maxTemplateLength, value, strictFunctions);
    }

    public EngineConfig withStrictFunctions(boolean value) {
        return new EngineConfig(maxTemplateLength, maxExpressionDepth, value);
    }
}
