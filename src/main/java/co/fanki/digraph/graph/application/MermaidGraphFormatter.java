package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.CycleShape;
import co.fanki.digraph.graph.domain.DependencyGraph;
import co.fanki.digraph.graph.domain.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders a graph as a Mermaid {@code flowchart LR} diagram.
 *
 * <p>Circular edges are drawn dotted with a {@code circular} label and
 * the detected cycles are listed as comments after the edges.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class MermaidGraphFormatter implements GraphFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(
            MermaidGraphFormatter.class);

    /** Output for a graph without nodes. */
    static final String EMPTY_GRAPH =
            "flowchart LR\n  %% Empty graph - no nodes to display";

    private static final Pattern SEPARATORS = Pattern.compile("[.-]");

    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9_]");

    @Override
    public OutputFormat outputFormat() {
        return OutputFormat.MERMAID;
    }

    @Override
    public String format(final DependencyGraph graph) {
        LOG.debug("Generating Mermaid output for {} nodes, {} edges",
                graph.nodeCount(), graph.edgeCount());

        if (graph.nodes().isEmpty()) {
            return EMPTY_GRAPH;
        }

        final List<String> lines = new ArrayList<>();
        lines.add("flowchart LR");

        for (final Edge edge : graph.edges()) {
            final String from = sanitize(edge.from());
            final String to = sanitize(edge.to());
            if (edge.circular()) {
                lines.add("  " + from + " -.->|circular| " + to);
            } else {
                lines.add("  " + from + " --> " + to);
            }
        }

        if (graph.hasCycles()) {
            lines.add("");
            lines.add("  %% Circular Dependencies Detected:");
            for (final List<String> cycle : graph.circularDependencies()) {
                lines.add("  %% " + describe(cycle));
            }
        }

        return String.join("\n", lines);
    }

    /**
     * Joins a cycle with arrows, closing open-form cycles on their first
     * id.
     */
    private static String describe(final List<String> cycle) {
        final String walk = String.join(" -> ", cycle);
        if (CycleShape.classify(cycle) == CycleShape.OPEN) {
            return walk + " -> " + cycle.get(0);
        }
        return walk;
    }

    /**
     * Turns a node id into a Mermaid-safe identifier: dots and dashes
     * become underscores, other symbols are dropped.
     *
     * @param id the node id
     * @return the sanitized identifier
     */
    static String sanitize(final String id) {
        final String separated = SEPARATORS.matcher(id).replaceAll("_");
        return UNSAFE.matcher(separated).replaceAll("");
    }

}
