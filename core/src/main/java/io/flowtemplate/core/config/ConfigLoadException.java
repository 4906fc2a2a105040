package io.flowtemplate.core.config;

/**
 * Thrown when engine configuration cannot be loaded: missing file, invalid YAML, an out-of-range
 * value, or an environment override that does not parse.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
