package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.ClassDeclaration;
import co.fanki.digraph.graph.domain.FilterDirection;

import java.util.List;

/**
 * Everything needed to turn declarations into rendered graph text.
 *
 * @param declarations the extracted class declarations
 * @param format the output format
 * @param direction the filter direction, used only with entries
 * @param entries the entry node ids, empty for the whole graph
 * @param includeDecorators whether edge flags are kept
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphRequest(
        List<ClassDeclaration> declarations,
        OutputFormat format,
        FilterDirection direction,
        List<String> entries,
        boolean includeDecorators) {

    /** Normalizes absent options to their defaults. */
    public GraphRequest {
        if (format == null) {
            format = OutputFormat.JSON;
        }
        if (direction == null) {
            direction = FilterDirection.DOWNSTREAM;
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

}
