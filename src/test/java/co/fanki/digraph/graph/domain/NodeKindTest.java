package co.fanki.digraph.graph.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link NodeKind}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class NodeKindTest {

    @Test
    void whenParsing_givenKnownLowerCaseValues_shouldMapEachKind() {
        assertEquals(NodeKind.SERVICE, NodeKind.fromString("service"));
        assertEquals(NodeKind.COMPONENT, NodeKind.fromString("component"));
        assertEquals(NodeKind.DIRECTIVE, NodeKind.fromString("directive"));
        assertEquals(NodeKind.UNKNOWN, NodeKind.fromString("unknown"));
    }

    @Test
    void whenParsing_givenMixedCaseWithSpaces_shouldIgnoreCase() {
        assertEquals(NodeKind.COMPONENT, NodeKind.fromString(" Component "));
    }

    @Test
    void whenParsing_givenUnrecognizedValue_shouldReturnUnknown() {
        assertEquals(NodeKind.UNKNOWN, NodeKind.fromString("pipe"));
    }

    @Test
    void whenParsing_givenNullOrBlank_shouldReturnUnknown() {
        assertEquals(NodeKind.UNKNOWN, NodeKind.fromString(null));
        assertEquals(NodeKind.UNKNOWN, NodeKind.fromString(""));
    }

    @Test
    void whenPrinting_shouldUseWireValue() {
        assertEquals("directive", NodeKind.DIRECTIVE.toString());
    }

}
