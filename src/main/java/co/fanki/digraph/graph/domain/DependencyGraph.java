package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.Preconditions;
import co.fanki.digraph.shared.ValueObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable dependency graph produced by {@link GraphBuilder} and
 * narrowed by {@link GraphFilter}.
 *
 * <p>Nodes are ordered by id and edges by (from, to) when built; a
 * filtered graph keeps the relative order of its source. Every edge
 * endpoint and every cycle member references a node of the graph.</p>
 *
 * @param nodes the vertices
 * @param edges the dependency edges
 * @param circularDependencies the detected cycles, each a walk of ids
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DependencyGraph(
        List<Node> nodes,
        List<Edge> edges,
        List<List<String>> circularDependencies) implements ValueObject {

    /** Copies every collection so the graph cannot change afterwards. */
    public DependencyGraph {
        Preconditions.requireNonNull(nodes, "Nodes are required");
        Preconditions.requireNonNull(edges, "Edges are required");
        Preconditions.requireNonNull(circularDependencies,
                "Circular dependencies are required");

        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);

        final List<List<String>> cycles = new ArrayList<>();
        for (final List<String> cycle : circularDependencies) {
            cycles.add(List.copyOf(cycle));
        }
        circularDependencies = Collections.unmodifiableList(cycles);
    }

    /**
     * Returns a graph without nodes, edges or cycles.
     *
     * @return the empty graph
     */
    public static DependencyGraph empty() {
        return new DependencyGraph(List.of(), List.of(), List.of());
    }

    /**
     * Returns the node ids in graph order.
     *
     * @return unmodifiable ordered set of ids
     */
    public Set<String> nodeIds() {
        final Set<String> ids = new LinkedHashSet<>();
        for (final Node node : nodes) {
            ids.add(node.id());
        }
        return Collections.unmodifiableSet(ids);
    }

    /**
     * Checks if the graph contains a node with the given id.
     *
     * @param id the node id
     * @return true if the node exists
     */
    public boolean contains(final String id) {
        for (final Node node : nodes) {
            if (node.id().equals(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the (from, to) steps of all edges.
     *
     * @return unmodifiable set of steps
     */
    public Set<CycleStep> steps() {
        final Set<CycleStep> steps = new LinkedHashSet<>();
        for (final Edge edge : edges) {
            steps.add(edge.step());
        }
        return Collections.unmodifiableSet(steps);
    }

    /**
     * Returns the number of nodes.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of edges.
     *
     * @return the edge count
     */
    public int edgeCount() {
        return edges.size();
    }

    /**
     * Checks if at least one cycle was detected.
     *
     * @return true if the graph has circular dependencies
     */
    public boolean hasCycles() {
        return !circularDependencies.isEmpty();
    }

}
