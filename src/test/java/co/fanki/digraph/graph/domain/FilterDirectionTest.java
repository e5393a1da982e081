package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link FilterDirection}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FilterDirectionTest {

    @Test
    void whenParsing_givenKnownValues_shouldMapEachDirection() {
        assertEquals(FilterDirection.DOWNSTREAM,
                FilterDirection.fromString("downstream"));
        assertEquals(FilterDirection.UPSTREAM,
                FilterDirection.fromString("UPSTREAM"));
        assertEquals(FilterDirection.BOTH,
                FilterDirection.fromString(" Both "));
    }

    @Test
    void whenParsing_givenNullOrBlank_shouldDefaultToDownstream() {
        assertEquals(FilterDirection.DOWNSTREAM,
                FilterDirection.fromString(null));
        assertEquals(FilterDirection.DOWNSTREAM,
                FilterDirection.fromString("   "));
    }

    @Test
    void whenParsing_givenUnknownValue_shouldFailLoudly() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> FilterDirection.fromString("sideways"));

        assertEquals(FilterDirection.INVALID_DIRECTION, ex.getErrorCode());
        assertEquals("Invalid direction: sideways. Must be 'upstream',"
                + " 'downstream', or 'both'", ex.getMessage());
    }

    @Test
    void whenAskingEdgeDirections_shouldTraverseEachWayOnItsOwn() {
        assertEquals(List.of(AdjacencyIndex.EdgeDirection.FORWARD),
                FilterDirection.DOWNSTREAM.edgeDirections());
        assertEquals(List.of(AdjacencyIndex.EdgeDirection.REVERSE),
                FilterDirection.UPSTREAM.edgeDirections());
        assertEquals(List.of(AdjacencyIndex.EdgeDirection.FORWARD,
                AdjacencyIndex.EdgeDirection.REVERSE),
                FilterDirection.BOTH.edgeDirections());
    }

    @Test
    void whenPrinting_shouldUseOptionValue() {
        assertEquals("upstream", FilterDirection.UPSTREAM.toString());
    }

}
