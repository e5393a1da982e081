package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Narrows a {@link DependencyGraph} to what is reachable from a set of
 * entry nodes.
 *
 * <p>Each edge direction a {@link FilterDirection} names is traversed on
 * its own, one entry at a time, and the reached ids are unioned; a
 * {@link FilterDirection#BOTH} filter is therefore the ancestors plus the
 * descendants of the entries, never their siblings. Entries missing from
 * the graph are skipped.</p>
 *
 * <p>The result keeps nodes and edges in the order of the source graph.
 * A cycle is kept only when all its members were reached, its shape is
 * valid and each of its steps is an edge of the source graph.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GraphFilter {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphFilter.class);

    /**
     * Filters the graph from the given entries.
     *
     * @param graph the built graph, never modified
     * @param direction the traversal direction
     * @param entries the entry node ids, may be null or empty
     * @return the same graph when there are no entries, otherwise a new
     *         graph holding the reachable subset
     */
    public DependencyGraph filter(final DependencyGraph graph,
            final FilterDirection direction,
            final Collection<String> entries) {

        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(direction, "Direction is required");

        if (entries == null || entries.isEmpty()) {
            return graph;
        }

        final Set<String> reachable = reachable(graph, direction, entries);

        final List<Node> nodes = new ArrayList<>();
        for (final Node node : graph.nodes()) {
            if (reachable.contains(node.id())) {
                nodes.add(node);
            }
        }

        final List<Edge> edges = new ArrayList<>();
        for (final Edge edge : graph.edges()) {
            if (reachable.contains(edge.from())
                    && reachable.contains(edge.to())) {
                edges.add(edge);
            }
        }

        final Set<CycleStep> originalSteps = graph.steps();
        final List<List<String>> cycles = new ArrayList<>();
        for (final List<String> cycle : graph.circularDependencies()) {
            if (keepCycle(cycle, reachable, originalSteps)) {
                cycles.add(cycle);
            } else {
                LOG.debug("Dropping cycle {} from filtered graph", cycle);
            }
        }

        LOG.debug("Filtered graph ({}) from {}: {} nodes, {} edges,"
                + " {} cycles", direction, entries, nodes.size(),
                edges.size(), cycles.size());

        return new DependencyGraph(nodes, edges, cycles);
    }

    /**
     * Computes the ids reachable from the entries in the given direction.
     *
     * @param graph the graph
     * @param direction the direction
     * @param entries the entry ids
     * @return the reachable ids, entries included
     */
    Set<String> reachable(final DependencyGraph graph,
            final FilterDirection direction,
            final Collection<String> entries) {

        final Set<String> known = graph.nodeIds();
        final Set<String> result = new LinkedHashSet<>();

        for (final AdjacencyIndex.EdgeDirection edgeDirection
                : direction.edgeDirections()) {

            final AdjacencyIndex index = AdjacencyIndex.build(graph.nodes(),
                    graph.edges(), edgeDirection);
            final Set<String> visited = new HashSet<>();

            for (final String entry : entries) {
                if (entry == null || !known.contains(entry)) {
                    LOG.warn("Entry point '{}' not found in graph", entry);
                    continue;
                }
                flood(entry, index, visited);
            }
            result.addAll(visited);
        }
        return result;
    }

    /**
     * Marks everything reachable from the start id, using an explicit
     * stack.
     */
    private static void flood(final String start, final AdjacencyIndex index,
            final Set<String> visited) {

        final Deque<String> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            final String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (final String neighbor : index.neighbors(current)) {
                if (!visited.contains(neighbor)) {
                    stack.push(neighbor);
                }
            }
        }
    }

    private static boolean keepCycle(final List<String> cycle,
            final Set<String> reachable, final Set<CycleStep> originalSteps) {

        final CycleShape shape = CycleShape.classify(cycle);
        if (shape == CycleShape.INVALID) {
            return false;
        }
        if (!reachable.containsAll(cycle)) {
            return false;
        }
        return originalSteps.containsAll(shape.steps(cycle));
    }

}
