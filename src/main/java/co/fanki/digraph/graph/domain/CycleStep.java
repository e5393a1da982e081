package co.fanki.digraph.graph.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered (from, to) pair of node ids, used to match cycle steps
 * against edges.
 *
 * @param from the source id
 * @param to the target id
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CycleStep(String from, String to) {

    /**
     * Returns the consecutive pairs of a closed-form cycle, e.g.
     * {@code [A,B,A]} gives {@code A->B, B->A}.
     *
     * @param cycle the node ids of the walk
     * @return the steps in walk order
     */
    public static List<CycleStep> consecutive(final List<String> cycle) {
        final List<CycleStep> steps = new ArrayList<>();
        for (int i = 0; i < cycle.size() - 1; i++) {
            steps.add(new CycleStep(cycle.get(i), cycle.get(i + 1)));
        }
        return Collections.unmodifiableList(steps);
    }

    @Override
    public String toString() {
        return from + "->" + to;
    }

}
