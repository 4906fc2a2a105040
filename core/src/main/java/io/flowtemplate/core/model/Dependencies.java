package io.flowtemplate.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Everything a template can reach at render time, found by a static walk over its expressions.
 * Both branches of every conditional are included, so this over-approximates what any single
 * render touches.
 *
 * <p>
 * Immutable; assemble with {@link Builder}.
 *
 * @param inputPaths    paths read from {@code $input} ({@code ""} for the whole input)
 * @param nodeIds       node ids read through {@code $node('id')}
 * @param envVars       environment variable names read through {@code $env}
 * @param functions     function and pipeline stage names called
 * @param usesSystem    whether {@code $system} is read
 * @param usesExecution whether {@code $execution} is read
 * @param usesWorkflow  whether {@code $workflow} is read
 */
public record Dependencies(
        Set<String> inputPaths,
        Set<String> nodeIds,
        Set<String> envVars,
        Set<String> functions,
        boolean usesSystem,
        boolean usesExecution,
        boolean usesWorkflow) {

    private static final Dependencies NONE =
            new Dependencies(Set.of(), Set.of(), Set.of(), Set.of(), false, false, false);

    public Dependencies {
        inputPaths = copy(inputPaths);
        nodeIds = copy(nodeIds);
        envVars = copy(envVars);
        functions = copy(functions);
    }

    /** Dependencies of a template without expressions. */
    public static Dependencies none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True if no data source and no function is referenced. */
    public boolean isEmpty() {
        return inputPaths.isEmpty()
                && nodeIds.isEmpty()
                && envVars.isEmpty()
                && functions.isEmpty()
                && !usesSystem
                && !usesExecution
                && !usesWorkflow;
    }

    /** True if {@code $input} is referenced at all. */
    public boolean usesInput() {
        return !inputPaths.isEmpty();
    }

    private static Set<String> copy(Set<String> set) {
        return set == null || set.isEmpty() ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(set));
    }

    /** Mutable accumulator filled by the dependency walk. Recording the same item twice is harmless. */
    public static final class Builder {

        private final Set<String> inputPaths = new LinkedHashSet<>();
        private final Set<String> nodeIds = new LinkedHashSet<>();
        private final Set<String> envVars = new LinkedHashSet<>();
        private final Set<String> functions = new LinkedHashSet<>();
        private boolean usesSystem;
        private boolean usesExecution;
        private boolean usesWorkflow;

        Builder() {}

        /** Records a read of {@code path} from {@code source}. */
        public Builder dataAccess(DataSource source, String path) {
            switch (source.kind()) {
                case INPUT -> inputPaths.add(path);
                case NODE -> nodeIds.add(source.nodeId());
                case ENVIRONMENT -> envVars.add(path);
                case SYSTEM -> usesSystem = true;
                case EXECUTION -> usesExecution = true;
                case WORKFLOW -> usesWorkflow = true;
            }
            return this;
        }

        public Builder function(String name) {
            functions.add(name);
            return this;
        }

        /** Adds everything recorded in {@code other}. */
        public Builder merge(Dependencies other) {
            inputPaths.addAll(other.inputPaths());
            nodeIds.addAll(other.nodeIds());
            envVars.addAll(other.envVars());
            functions.addAll(other.functions());
            usesSystem |= other.usesSystem();
            usesExecution |= other.usesExecution();
            usesWorkflow |= other.usesWorkflow();
            return this;
        }

        public Dependencies build() {
            return new Dependencies(
                    inputPaths, nodeIds, envVars, functions, usesSystem, usesExecution, usesWorkflow);
        }
    }
}
