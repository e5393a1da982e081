package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.Preconditions;
import co.fanki.digraph.shared.ValueObject;

/**
 * A vertex of the dependency graph: a declared class or an inferred
 * dependency target.
 *
 * @param id the declared class or token name, unique within a graph
 * @param kind the injection role of the node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Node(String id, NodeKind kind) implements ValueObject {

    /** Validates the node attributes. */
    public Node {
        Preconditions.requireNonNull(id, "Node id is required");
        Preconditions.requireNonNull(kind, "Node kind is required");
    }

    /**
     * Creates a placeholder node for a dependency that was never declared.
     *
     * @param id the dependency token
     * @return a node of kind {@link NodeKind#UNKNOWN}
     */
    public static Node unknown(final String id) {
        return new Node(id, NodeKind.UNKNOWN);
    }

}
