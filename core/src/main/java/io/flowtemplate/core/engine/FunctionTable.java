package io.flowtemplate.core.engine;

import io.flowtemplate.core.spi.FunctionRegistry;
import io.flowtemplate.core.spi.TemplateFunction;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link FunctionRegistry}: a name-to-function table. Thread-safe; registration and
 * lookup can happen concurrently, and re-registering a name replaces the earlier function.
 */
public final class FunctionTable implements FunctionRegistry {

    private final Map<String, TemplateFunction> functions = new ConcurrentHashMap<>();

    /**
     * Registers {@code function} under {@code name}.
     *
     * @return this table, for chaining
     * @throws NullPointerException     if name or function is null
     * @throws IllegalArgumentException if name is empty
     */
    public FunctionTable register(String name, TemplateFunction function) {
        if (name == null) {
            throw new NullPointerException("function name must not be null");
        }
        if (function == null) {
            throw new NullPointerException("function must not be null");
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("function name must not be empty");
        }
        functions.put(name, function);
        return this;
    }

    @Override
    public Optional<TemplateFunction> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(functions.get(name));
    }

    @Override
    public boolean contains(String name) {
        return name != null && functions.containsKey(name);
    }

    /** Registered names in sorted order (a snapshot). */
    public Set<String> names() {
        return new TreeSet<>(functions.keySet());
    }

    public int size() {
        return functions.size();
    }
}
