package io.flowtemplate.core.spi;

import java.util.Optional;

/**
 * Name → function lookup consulted by the evaluator for function calls and pipeline stages.
 * Injected into each {@code Template} at parse time; there is no global registry.
 *
 * <p>
 * Implementations MUST be thread-safe for lookups.
 */
@FunctionalInterface
public interface FunctionRegistry {

    /**
     * Looks up a function by name.
     *
     * @param name the function name as written in the template
     * @return the function, or empty if none is registered under that name
     */
    Optional<TemplateFunction> lookup(String name);

    /** Returns {@code true} if a function with the given name is available. */
    default boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /** A registry without any functions. */
    static FunctionRegistry empty() {
        return name -> Optional.empty();
    }
}
