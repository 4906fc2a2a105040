package io.flowtemplate.core.error;

import java.util.List;

/**
 * Thrown when a data-source reference cannot be resolved against the context. Always carries the
 * alternatives that were available, for diagnostics and UI hints.
 */
public final class DataNotFoundException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final List<String> available;

    /**
     * @param path      the reference that failed, e.g. {@code $input.user.name}
     * @param available suggested alternatives (may be empty, never null)
     */
    public DataNotFoundException(String path, List<String> available) {
        super("Data not found: " + path);
        this.path = path;
        this.available = available != null ? List.copyOf(available) : List.of();
    }

    @Override
    public String detail() {
        return path;
    }

    /** The data reference that could not be resolved. */
    public String path() {
        return path;
    }

    /** Alternatives available in the context at the time of the failure. */
    public List<String> available() {
        return available;
    }
}
