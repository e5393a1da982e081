package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.DomainException;

import java.util.List;

/**
 * Direction of a reachability filter relative to the declared edges.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FilterDirection {

    /** Everything the entries transitively depend on. */
    DOWNSTREAM("downstream"),

    /** Everything that transitively depends on the entries. */
    UPSTREAM("upstream"),

    /** The union of the downstream and the upstream sets. */
    BOTH("both");

    /** Error code raised for an unrecognized direction. */
    public static final String INVALID_DIRECTION = "INVALID_DIRECTION";

    private final String value;

    FilterDirection(final String theValue) {
        this.value = theValue;
    }

    /**
     * Returns the lower-case option value of this direction.
     *
     * @return the option value
     */
    public String value() {
        return value;
    }

    /**
     * Returns the one-way edge directions this filter direction follows.
     *
     * @return forward, reverse, or both, each traversed on its own
     */
    public List<AdjacencyIndex.EdgeDirection> edgeDirections() {
        return switch (this) {
            case DOWNSTREAM -> List.of(AdjacencyIndex.EdgeDirection.FORWARD);
            case UPSTREAM -> List.of(AdjacencyIndex.EdgeDirection.REVERSE);
            case BOTH -> List.of(AdjacencyIndex.EdgeDirection.FORWARD,
                    AdjacencyIndex.EdgeDirection.REVERSE);
        };
    }

    /**
     * Parses a direction option, defaulting to DOWNSTREAM when absent.
     *
     * @param value the option value, e.g. {@code upstream}
     * @return the direction
     * @throws DomainException if the value is not a known direction
     */
    public static FilterDirection fromString(final String value) {
        if (value == null || value.isBlank()) {
            return DOWNSTREAM;
        }
        final String normalized = value.trim();
        for (final FilterDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(normalized)) {
                return direction;
            }
        }
        throw new DomainException("Invalid direction: " + normalized
                + ". Must be 'upstream', 'downstream', or 'both'",
                INVALID_DIRECTION);
    }

    @Override
    public String toString() {
        return value;
    }

}
