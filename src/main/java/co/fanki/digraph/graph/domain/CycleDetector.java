package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.Preconditions;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the cycles of a directed graph with a depth-first search.
 *
 * <p>Roots are taken in node order; every node not yet processed starts
 * a fresh search. Reaching a node that is still on the current path
 * reports the path from that node's position onwards, closed with the
 * node itself: {@code [A, B, A]}, or {@code [A, A]} for a self-loop. The
 * re-entered node is not explored again from that step.</p>
 *
 * <p>A cycle is reported once per re-entry, so the same cycle can be
 * reported more than once when several paths lead into it. Callers that
 * want unique cycles apply {@link #distinct(List)} explicitly.</p>
 *
 * <p>The search keeps its own frame stack instead of recursing, so long
 * dependency chains do not exhaust the call stack.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public final class CycleDetector {

    /**
     * The cycles found and the steps belonging to at least one of them.
     *
     * @param cycles the reported cycles in discovery order, closed form
     * @param circularSteps the (from, to) pairs of every reported cycle
     */
    public record Detection(List<List<String>> cycles,
            Set<CycleStep> circularSteps) {

        /**
         * Checks if the given edge is a step of a reported cycle.
         *
         * @param edge the edge
         * @return true if the edge is circular
         */
        public boolean isCircular(final Edge edge) {
            return circularSteps.contains(edge.step());
        }
    }

    /** A node on the search stack and the next neighbour to try. */
    private static final class Frame {

        private final int position;

        private int next;

        private Frame(final int thePosition) {
            this.position = thePosition;
        }
    }

    /**
     * Detects the cycles of the given nodes and edges.
     *
     * @param nodes the nodes, in root order
     * @param edges the edges, in neighbour order
     * @return the detection result
     */
    public Detection detect(final List<Node> nodes, final List<Edge> edges) {
        Preconditions.requireNonNull(nodes, "Nodes are required");
        Preconditions.requireNonNull(edges, "Edges are required");

        final AdjacencyIndex index = AdjacencyIndex.build(nodes, edges,
                AdjacencyIndex.EdgeDirection.FORWARD);

        final Set<String> onPath = new HashSet<>();
        final Set<String> processed = new HashSet<>();
        final List<String> path = new ArrayList<>();

        final List<List<String>> cycles = new ArrayList<>();
        final Set<CycleStep> circularSteps = new LinkedHashSet<>();

        for (final Node root : nodes) {
            if (processed.contains(root.id())) {
                continue;
            }

            final Deque<Frame> stack = new ArrayDeque<>();
            enter(index.positionOf(root.id()), index, stack, onPath, path);

            while (!stack.isEmpty()) {
                final Frame frame = stack.peek();
                final int[] neighbors = index.neighborPositions(
                        frame.position);

                if (frame.next >= neighbors.length) {
                    stack.pop();
                    final String id = path.remove(path.size() - 1);
                    onPath.remove(id);
                    processed.add(id);
                    continue;
                }

                final int neighbor = neighbors[frame.next++];
                final String neighborId = index.idAt(neighbor);

                if (processed.contains(neighborId)) {
                    continue;
                }

                if (onPath.contains(neighborId)) {
                    final List<String> cycle = new ArrayList<>(path.subList(
                            path.indexOf(neighborId), path.size()));
                    cycle.add(neighborId);
                    cycles.add(Collections.unmodifiableList(cycle));
                    circularSteps.addAll(CycleStep.consecutive(cycle));
                    continue;
                }

                enter(neighbor, index, stack, onPath, path);
            }
        }

        return new Detection(Collections.unmodifiableList(cycles),
                Collections.unmodifiableSet(circularSteps));
    }

    private static void enter(final int position, final AdjacencyIndex index,
            final Deque<Frame> stack, final Set<String> onPath,
            final List<String> path) {
        final String id = index.idAt(position);
        onPath.add(id);
        path.add(id);
        stack.push(new Frame(position));
    }

    /**
     * Removes exact duplicate cycles, keeping the first occurrence.
     *
     * <p>Not applied by the detector itself: duplicates are part of its
     * output.</p>
     *
     * @param cycles the cycles, possibly with duplicates
     * @return unmodifiable list of unique cycles in first-seen order
     */
    public static List<List<String>> distinct(
            final List<List<String>> cycles) {
        Preconditions.requireNonNull(cycles, "Cycles are required");
        return List.copyOf(new LinkedHashSet<>(cycles));
    }

}
