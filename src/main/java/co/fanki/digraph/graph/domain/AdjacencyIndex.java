package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Neighbour lookup over a node and edge set, built once per traversal.
 *
 * <p>Ids are translated to dense integer positions on construction; the
 * neighbour lists are stored per position in edge order. Edge endpoints
 * that are not in the node list get a position after the known nodes, so
 * traversals over inconsistent input never fail on a lookup.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AdjacencyIndex {

    /** Which way an edge is followed. */
    public enum EdgeDirection {
        /** From the dependent to its dependency. */
        FORWARD,
        /** From the dependency back to its dependent. */
        REVERSE
    }

    private static final int[] NO_NEIGHBORS = new int[0];

    private final Map<String, Integer> positions;

    private final List<String> ids;

    private final int[][] neighbors;

    private AdjacencyIndex(final Map<String, Integer> thePositions,
            final List<String> theIds, final int[][] theNeighbors) {
        this.positions = thePositions;
        this.ids = theIds;
        this.neighbors = theNeighbors;
    }

    /**
     * Builds the index for the given nodes and edges.
     *
     * @param nodes the nodes, in the order positions are assigned
     * @param edges the edges, in the order neighbours are listed
     * @param direction the direction edges are followed in
     * @return the index
     */
    public static AdjacencyIndex build(final List<Node> nodes,
            final List<Edge> edges, final EdgeDirection direction) {

        Preconditions.requireNonNull(nodes, "Nodes are required");
        Preconditions.requireNonNull(edges, "Edges are required");
        Preconditions.requireNonNull(direction, "Direction is required");

        final Map<String, Integer> positions = new HashMap<>();
        final List<String> ids = new ArrayList<>();

        for (final Node node : nodes) {
            register(node.id(), positions, ids);
        }

        final List<List<Integer>> lists = new ArrayList<>();
        for (final Edge edge : edges) {
            final String source = direction == EdgeDirection.FORWARD
                    ? edge.from() : edge.to();
            final String target = direction == EdgeDirection.FORWARD
                    ? edge.to() : edge.from();

            final int sourcePosition = register(source, positions, ids);
            final int targetPosition = register(target, positions, ids);

            while (lists.size() < ids.size()) {
                lists.add(null);
            }
            List<Integer> list = lists.get(sourcePosition);
            if (list == null) {
                list = new ArrayList<>();
                lists.set(sourcePosition, list);
            }
            list.add(targetPosition);
        }

        final int[][] neighbors = new int[ids.size()][];
        for (int i = 0; i < neighbors.length; i++) {
            final List<Integer> list = i < lists.size() ? lists.get(i) : null;
            if (list == null) {
                neighbors[i] = NO_NEIGHBORS;
            } else {
                neighbors[i] = list.stream().mapToInt(Integer::intValue)
                        .toArray();
            }
        }

        return new AdjacencyIndex(positions, Collections.unmodifiableList(ids),
                neighbors);
    }

    /**
     * Builds a forward index over a whole graph.
     *
     * @param graph the graph
     * @return the index following edges from dependent to dependency
     */
    public static AdjacencyIndex forward(final DependencyGraph graph) {
        return build(graph.nodes(), graph.edges(), EdgeDirection.FORWARD);
    }

    /**
     * Builds a reverse index over a whole graph.
     *
     * @param graph the graph
     * @return the index following edges from dependency to dependent
     */
    public static AdjacencyIndex reverse(final DependencyGraph graph) {
        return build(graph.nodes(), graph.edges(), EdgeDirection.REVERSE);
    }

    private static int register(final String id,
            final Map<String, Integer> positions, final List<String> ids) {
        final Integer existing = positions.get(id);
        if (existing != null) {
            return existing;
        }
        final int position = ids.size();
        positions.put(id, position);
        ids.add(id);
        return position;
    }

    /**
     * Returns the position of an id.
     *
     * @param id the node id
     * @return the position, or -1 if the id is not indexed
     */
    public int positionOf(final String id) {
        final Integer position = positions.get(id);
        return position == null ? -1 : position;
    }

    /**
     * Returns the id stored at a position.
     *
     * @param position the position
     * @return the node id
     */
    public String idAt(final int position) {
        return ids.get(position);
    }

    /**
     * Checks if the id is indexed.
     *
     * @param id the node id
     * @return true if the id has a position
     */
    public boolean contains(final String id) {
        return positions.containsKey(id);
    }

    /**
     * Returns the neighbour positions of a position, in edge order.
     *
     * <p>The returned array is shared; callers must not modify it.</p>
     *
     * @param position the position
     * @return the neighbour positions
     */
    int[] neighborPositions(final int position) {
        return neighbors[position];
    }

    /**
     * Returns the neighbour ids of a node, in edge order.
     *
     * @param id the node id
     * @return unmodifiable list of neighbour ids, empty if unknown
     */
    public List<String> neighbors(final String id) {
        final int position = positionOf(id);
        if (position < 0) {
            return List.of();
        }
        final List<String> result = new ArrayList<>();
        for (final int neighbor : neighbors[position]) {
            result.add(ids.get(neighbor));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the number of indexed ids.
     *
     * @return the size
     */
    public int size() {
        return ids.size();
    }

}
