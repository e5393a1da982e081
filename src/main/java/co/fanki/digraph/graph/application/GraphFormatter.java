package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.DependencyGraph;

/**
 * Renders a dependency graph as text.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface GraphFormatter {

    /**
     * Returns the format this formatter produces.
     *
     * @return the output format
     */
    OutputFormat outputFormat();

    /**
     * Renders the graph.
     *
     * @param graph the graph to render
     * @return the rendered text
     */
    String format(DependencyGraph graph);

}
