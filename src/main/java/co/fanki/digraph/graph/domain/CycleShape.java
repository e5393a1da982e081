package co.fanki.digraph.graph.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Classifies the textual shape of a reported cycle.
 *
 * <p>Cycles built by {@link CycleDetector} are always closed. Cycles
 * supplied by other tooling may be open, in which case the last id
 * wraps around to the first. Anything else is {@link #INVALID}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum CycleShape {

    /** {@code [X, X]}. */
    SELF_LOOP,

    /** Three or more ids whose first equals the last, {@code [A,B,A]}. */
    CLOSED,

    /** Three or more ids whose first differs from the last, {@code [A,B,C]}. */
    OPEN,

    /** Shorter than two ids, or a two-id walk between distinct nodes. */
    INVALID;

    /**
     * Determines the shape of the given cycle.
     *
     * @param cycle the node ids, may be null
     * @return the shape, never null
     */
    public static CycleShape classify(final List<String> cycle) {
        if (cycle == null || cycle.size() < 2) {
            return INVALID;
        }
        final String first = cycle.get(0);
        final String last = cycle.get(cycle.size() - 1);
        if (cycle.size() == 2) {
            return first.equals(last) ? SELF_LOOP : INVALID;
        }
        return first.equals(last) ? CLOSED : OPEN;
    }

    /**
     * Returns the (from, to) steps a cycle of this shape implies.
     *
     * @param cycle the node ids of the cycle
     * @return the implied steps, empty for {@link #INVALID}
     */
    public List<CycleStep> steps(final List<String> cycle) {
        return switch (this) {
            case SELF_LOOP, CLOSED -> CycleStep.consecutive(cycle);
            case OPEN -> wrapAround(cycle);
            case INVALID -> List.of();
        };
    }

    private static List<CycleStep> wrapAround(final List<String> cycle) {
        final List<CycleStep> steps = new ArrayList<>();
        final int size = cycle.size();
        for (int i = 0; i < size; i++) {
            steps.add(new CycleStep(cycle.get(i), cycle.get((i + 1) % size)));
        }
        return Collections.unmodifiableList(steps);
    }

}
