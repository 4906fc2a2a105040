package io.flowtemplate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.flowtemplate.core.error.DataNotFoundException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The data a template renders against: the current input, upstream node outputs, environment
 * variables, execution and workflow metadata, and the {@code $system} block.
 *
 * <p>
 * A context is filled through the chainable setters and then only read while rendering. It is
 * not thread-safe; use one context per render. {@code $system}, {@code $execution}, {@code $env}
 * and {@code $workflow} always exist (possibly empty); {@code $input} and each {@code $node('id')}
 * exist only once set.
 */
public final class Context {

    private Value input;
    private final Map<String, Value> nodeOutputs = new LinkedHashMap<>();
    private final Map<String, String> env = new LinkedHashMap<>();
    private final Map<String, Value> executionData = new LinkedHashMap<>();
    private final Map<String, Value> workflowData = new LinkedHashMap<>();
    private final SystemData systemData;

    /** Creates an empty context whose {@code $system.datetime} is the current UTC time. */
    public Context() {
        this(Clock.systemUTC());
    }

    /** Creates an empty context whose {@code $system.datetime} is read from {@code clock}. */
    public Context(Clock clock) {
        this.systemData = SystemData.capture(clock);
    }

    // ── Setters ──

    public Context setInput(Value value) {
        this.input = Objects.requireNonNull(value, "input must not be null");
        return this;
    }

    public Context setInput(JsonNode json) {
        return setInput(JsonValues.fromJson(json));
    }

    /** Registers the output of node {@code nodeId}, replacing any earlier output. */
    public Context addNodeOutput(String nodeId, Value output) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        nodeOutputs.put(nodeId, Objects.requireNonNull(output, "output must not be null"));
        return this;
    }

    public Context addNodeOutput(String nodeId, JsonNode output) {
        return addNodeOutput(nodeId, JsonValues.fromJson(output));
    }

    public Context setEnv(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        env.put(key, Objects.requireNonNull(value, "value must not be null"));
        return this;
    }

    public Context setExecutionData(String key, Value value) {
        Objects.requireNonNull(key, "key must not be null");
        executionData.put(key, Objects.requireNonNull(value, "value must not be null"));
        return this;
    }

    public Context setWorkflowData(String key, Value value) {
        Objects.requireNonNull(key, "key must not be null");
        workflowData.put(key, Objects.requireNonNull(value, "value must not be null"));
        return this;
    }

    // ── Getters ──

    public Optional<Value> getInput() {
        return Optional.ofNullable(input);
    }

    public Optional<Value> getNodeOutput(String nodeId) {
        return Optional.ofNullable(nodeOutputs.get(nodeId));
    }

    public Optional<String> getEnv(String key) {
        return Optional.ofNullable(env.get(key));
    }

    public Optional<Value> getExecutionData(String key) {
        return Optional.ofNullable(executionData.get(key));
    }

    public Optional<Value> getWorkflowData(String key) {
        return Optional.ofNullable(workflowData.get(key));
    }

    public SystemData getSystemData() {
        return systemData;
    }

    // ── Resolution ──

    /**
     * Resolves {@code path} below {@code source}.
     *
     * <p>
     * {@code $input}, {@code $node} and {@code $system} navigate nested paths. {@code $execution}
     * and {@code $workflow} look up a single key (the empty path returns all metadata as an
     * object), and {@code $env} looks up a single variable and returns it as a string.
     *
     * @throws DataNotFoundException if the source is unset or the path leads nowhere; the
     *                               exception lists what was available instead
     */
    public Value resolveDataSource(DataSource source, String path) {
        Objects.requireNonNull(source, "source must not be null");
        String p = path != null ? path : "";
        return switch (source.kind()) {
            case INPUT -> resolveInput(p);
            case NODE -> resolveNode(source.nodeId(), p);
            case SYSTEM -> systemData
                    .get(p)
                    .orElseThrow(() -> new DataNotFoundException("$system." + p, List.of("$system.datetime")));
            case EXECUTION -> resolveMetadata(executionData, "$execution.", p);
            case WORKFLOW -> resolveMetadata(workflowData, "$workflow.", p);
            case ENVIRONMENT -> {
                String value = env.get(p);
                if (value == null) {
                    throw new DataNotFoundException("$env." + p, prefixed("$env.", env.keySet()));
                }
                yield Value.of(value);
            }
        };
    }

    private Value resolveInput(String path) {
        if (input == null) {
            throw new DataNotFoundException("$input", List.of("No input data available"));
        }
        return input.navigate(path)
                .orElseThrow(() -> new DataNotFoundException("$input." + path, List.of("$input")));
    }

    private Value resolveNode(String nodeId, String path) {
        Value output = nodeOutputs.get(nodeId);
        String reference = DataSource.node(nodeId).reference();
        if (output == null) {
            List<String> available = new ArrayList<>();
            nodeOutputs.keySet().forEach(id -> available.add(DataSource.node(id).reference()));
            throw new DataNotFoundException(reference, available);
        }
        return output.navigate(path)
                .orElseThrow(() -> new DataNotFoundException(reference + "." + path, List.of(reference)));
    }

    private static Value resolveMetadata(Map<String, Value> data, String prefix, String key) {
        if (key.isEmpty()) {
            return Value.object(data);
        }
        Value value = data.get(key);
        if (value == null) {
            throw new DataNotFoundException(prefix + key, prefixed(prefix, data.keySet()));
        }
        return value;
    }

    private static List<String> prefixed(String prefix, Iterable<String> keys) {
        List<String> out = new ArrayList<>();
        keys.forEach(k -> out.add(prefix + k));
        return out;
    }

    /**
     * Lists every reference that currently resolves: {@code $input} if set, one
     * {@code $node('id')} per node, the always-present {@code $system}, {@code $execution} and
     * {@code $workflow}, and one {@code $env.NAME} per variable.
     */
    public List<String> availableDataSources() {
        List<String> sources = new ArrayList<>();
        if (input != null) {
            sources.add(DataSource.INPUT.reference());
        }
        nodeOutputs.keySet().forEach(id -> sources.add(DataSource.node(id).reference()));
        sources.add(DataSource.SYSTEM.reference());
        sources.add(DataSource.EXECUTION.reference());
        sources.add(DataSource.WORKFLOW.reference());
        sources.addAll(prefixed("$env.", env.keySet()));
        return sources;
    }

    /** Whether {@code source} is present; only {@code $input} and node sources can be absent. */
    public boolean hasDataSource(DataSource source) {
        return switch (source.kind()) {
            case INPUT -> input != null;
            case NODE -> nodeOutputs.containsKey(source.nodeId());
            case SYSTEM, EXECUTION, ENVIRONMENT, WORKFLOW -> true;
        };
    }
}
