package co.fanki.digraph.graph.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AdjacencyIndex}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AdjacencyIndexTest {

    private static final List<Node> NODES = List.of(
            new Node("A", NodeKind.SERVICE),
            new Node("B", NodeKind.SERVICE),
            new Node("C", NodeKind.SERVICE));

    private static final List<Edge> EDGES = List.of(
            Edge.of("A", "B", null),
            Edge.of("A", "C", null),
            Edge.of("B", "C", null));

    @Test
    void whenBuildingForward_shouldListDependenciesInEdgeOrder() {
        final AdjacencyIndex index = AdjacencyIndex.build(NODES, EDGES,
                AdjacencyIndex.EdgeDirection.FORWARD);

        assertEquals(List.of("B", "C"), index.neighbors("A"));
        assertEquals(List.of("C"), index.neighbors("B"));
        assertEquals(List.of(), index.neighbors("C"));
    }

    @Test
    void whenBuildingReverse_shouldListDependents() {
        final AdjacencyIndex index = AdjacencyIndex.build(NODES, EDGES,
                AdjacencyIndex.EdgeDirection.REVERSE);

        assertEquals(List.of(), index.neighbors("A"));
        assertEquals(List.of("A"), index.neighbors("B"));
        assertEquals(List.of("A", "B"), index.neighbors("C"));
    }

    @Test
    void whenBuilding_shouldAssignPositionsInNodeOrder() {
        final AdjacencyIndex index = AdjacencyIndex.build(NODES, EDGES,
                AdjacencyIndex.EdgeDirection.FORWARD);

        assertEquals(0, index.positionOf("A"));
        assertEquals(2, index.positionOf("C"));
        assertEquals("B", index.idAt(1));
        assertEquals(3, index.size());
    }

    @Test
    void whenQuerying_givenUnknownId_shouldReturnNoNeighbors() {
        final AdjacencyIndex index = AdjacencyIndex.build(NODES, EDGES,
                AdjacencyIndex.EdgeDirection.FORWARD);

        assertEquals(-1, index.positionOf("Z"));
        assertFalse(index.contains("Z"));
        assertEquals(List.of(), index.neighbors("Z"));
    }

    @Test
    void whenBuilding_givenEdgeToUndeclaredNode_shouldIndexItAfterNodes() {
        final AdjacencyIndex index = AdjacencyIndex.build(
                List.of(new Node("A", NodeKind.SERVICE)),
                List.of(Edge.of("A", "Ghost", null)),
                AdjacencyIndex.EdgeDirection.FORWARD);

        assertTrue(index.contains("Ghost"));
        assertEquals(1, index.positionOf("Ghost"));
        assertEquals(List.of("Ghost"), index.neighbors("A"));
    }

    @Test
    void whenBuilding_givenDuplicateEdges_shouldKeepEachOccurrence() {
        final AdjacencyIndex index = AdjacencyIndex.build(NODES,
                List.of(Edge.of("A", "B", null), Edge.of("A", "B", null)),
                AdjacencyIndex.EdgeDirection.FORWARD);

        assertEquals(List.of("B", "B"), index.neighbors("A"));
    }

    @Test
    void whenBuildingFromGraph_shouldOfferBothDirections() {
        final DependencyGraph graph = new DependencyGraph(NODES, EDGES,
                List.of());

        assertEquals(List.of("B", "C"),
                AdjacencyIndex.forward(graph).neighbors("A"));
        assertEquals(List.of("A", "B"),
                AdjacencyIndex.reverse(graph).neighbors("C"));
    }

}
