package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.Preconditions;
import co.fanki.digraph.shared.ValueObject;

/**
 * A directed dependency: {@code from} depends on {@code to}.
 *
 * @param from the id of the dependent node
 * @param to the id of the dependency node
 * @param flags the resolution flags, null when the declaration had none
 * @param isCircular true when the edge is a step of a detected cycle,
 *        null otherwise
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Edge(
        String from,
        String to,
        EdgeFlags flags,
        Boolean isCircular) implements ValueObject {

    /** Validates the edge endpoints. */
    public Edge {
        Preconditions.requireNonNull(from, "Edge source is required");
        Preconditions.requireNonNull(to, "Edge target is required");
    }

    /**
     * Creates a non-circular edge.
     *
     * @param from the dependent node id
     * @param to the dependency node id
     * @param flags the flags, may be null
     * @return the edge
     */
    public static Edge of(final String from, final String to,
            final EdgeFlags flags) {
        return new Edge(from, to, flags, null);
    }

    /**
     * Returns a copy of this edge marked as part of a cycle.
     *
     * @return the circular edge
     */
    public Edge markCircular() {
        return new Edge(from, to, flags, Boolean.TRUE);
    }

    /**
     * Checks if this edge was marked as part of a cycle.
     *
     * @return true if the edge is circular
     */
    public boolean circular() {
        return Boolean.TRUE.equals(isCircular);
    }

    /**
     * Checks if this edge has flags attached, even empty ones.
     *
     * @return true if flags are present
     */
    public boolean hasFlags() {
        return flags != null;
    }

    /**
     * Returns the (from, to) step this edge represents.
     *
     * @return the step
     */
    public CycleStep step() {
        return new CycleStep(from, to);
    }

}
