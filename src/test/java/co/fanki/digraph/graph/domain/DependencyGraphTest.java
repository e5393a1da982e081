package co.fanki.digraph.graph.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DependencyGraph}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DependencyGraphTest {

    @Test
    void whenCreatingGraph_givenMutableLists_shouldCopyThem() {
        final List<Node> nodes = new ArrayList<>(List.of(
                new Node("A", NodeKind.SERVICE)));
        final List<String> cycle = new ArrayList<>(List.of("A", "A"));
        final List<List<String>> cycles = new ArrayList<>(List.of(cycle));

        final DependencyGraph graph = new DependencyGraph(nodes,
                List.of(Edge.of("A", "A", null).markCircular()), cycles);

        nodes.add(new Node("B", NodeKind.SERVICE));
        cycle.add("A");
        cycles.clear();

        assertEquals(1, graph.nodeCount());
        assertEquals(List.of(List.of("A", "A")),
                graph.circularDependencies());
    }

    @Test
    void whenModifyingGraph_shouldThrowException() {
        final DependencyGraph graph = new DependencyGraph(
                List.of(new Node("A", NodeKind.SERVICE)), List.of(),
                List.of(List.of("A", "A")));

        assertThrows(UnsupportedOperationException.class,
                () -> graph.nodes().clear());
        assertThrows(UnsupportedOperationException.class,
                () -> graph.circularDependencies().get(0).add("B"));
    }

    @Test
    void whenQueryingGraph_shouldExposeIdsAndSteps() {
        final DependencyGraph graph = new DependencyGraph(
                List.of(new Node("A", NodeKind.SERVICE),
                        Node.unknown("B")),
                List.of(Edge.of("A", "B", null)),
                List.of());

        assertEquals(Set.of("A", "B"), graph.nodeIds());
        assertTrue(graph.contains("B"));
        assertFalse(graph.contains("C"));
        assertEquals(Set.of(new CycleStep("A", "B")), graph.steps());
        assertFalse(graph.hasCycles());
    }

    @Test
    void whenComparingGraphs_givenSameContent_shouldBeEqual() {
        final DependencyGraph first = new DependencyGraph(
                List.of(new Node("A", NodeKind.SERVICE)), List.of(),
                List.of());
        final DependencyGraph second = new DependencyGraph(
                new ArrayList<>(List.of(new Node("A", NodeKind.SERVICE))),
                new ArrayList<>(), new ArrayList<>());

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void whenCreatingGraph_givenNullCollection_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new DependencyGraph(null, List.of(), List.of()));
    }

}
