package io.flowtemplate.core.model;

import java.util.Objects;

/**
 * Selects one of the six channels a template can read from. Carries no data itself; the node id
 * of a {@link Kind#NODE} source is the only payload.
 *
 * <ul>
 * <li>{@code $input} - data handed to the current node
 * <li>{@code $node('id')} - output of an upstream node
 * <li>{@code $system} - engine-provided data such as the current time
 * <li>{@code $execution} - metadata of the running execution
 * <li>{@code $env} - environment variables
 * <li>{@code $workflow} - metadata of the workflow definition
 * </ul>
 *
 * @param kind   the channel
 * @param nodeId the node id for {@link Kind#NODE}, {@code null} for every other kind
 */
public record DataSource(Kind kind, String nodeId) {

    /** The six data channels. */
    public enum Kind {
        INPUT("$input"),
        NODE("$node"),
        SYSTEM("$system"),
        EXECUTION("$execution"),
        ENVIRONMENT("$env"),
        WORKFLOW("$workflow");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        /** The {@code $}-prefixed name used in template syntax. */
        public String prefix() {
            return prefix;
        }
    }

    public static final DataSource INPUT = new DataSource(Kind.INPUT, null);
    public static final DataSource SYSTEM = new DataSource(Kind.SYSTEM, null);
    public static final DataSource EXECUTION = new DataSource(Kind.EXECUTION, null);
    public static final DataSource ENVIRONMENT = new DataSource(Kind.ENVIRONMENT, null);
    public static final DataSource WORKFLOW = new DataSource(Kind.WORKFLOW, null);

    public DataSource {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.NODE) {
            Objects.requireNonNull(nodeId, "nodeId must not be null for a node source");
        } else if (nodeId != null) {
            throw new IllegalArgumentException("nodeId is only valid for a node source, got kind " + kind);
        }
    }

    /** Creates the source for the output of node {@code id}. */
    public static DataSource node(String id) {
        return new DataSource(Kind.NODE, id);
    }

    /** The {@code $}-prefixed name of the channel, e.g. {@code $env}; {@code $node} for every node. */
    public String asString() {
        return kind.prefix();
    }

    /** The reference as written in a template, e.g. {@code $input} or {@code $node('fetch')}. */
    public String reference() {
        return kind == Kind.NODE ? "$node('" + nodeId + "')" : kind.prefix();
    }

    @Override
    public String toString() {
        return reference();
    }
}
