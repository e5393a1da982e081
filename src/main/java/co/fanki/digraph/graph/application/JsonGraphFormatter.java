package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.DependencyGraph;
import co.fanki.digraph.graph.domain.Edge;
import co.fanki.digraph.graph.domain.EdgeFlags;
import co.fanki.digraph.graph.domain.Node;
import co.fanki.digraph.shared.DomainException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a graph as pretty-printed JSON.
 *
 * <p>Edges only carry {@code flags} when the declaration had them (an
 * empty bag is written as {@code {}}) and only carry
 * {@code isCircular} when it is true.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class JsonGraphFormatter implements GraphFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(
            JsonGraphFormatter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public OutputFormat outputFormat() {
        return OutputFormat.JSON;
    }

    @Override
    public String format(final DependencyGraph graph) {
        LOG.debug("Generating JSON output for {} nodes, {} edges",
                graph.nodeCount(), graph.edgeCount());

        final ObjectNode root = MAPPER.createObjectNode();

        final ArrayNode nodesArray = root.putArray("nodes");
        for (final Node node : graph.nodes()) {
            final ObjectNode nodeObj = nodesArray.addObject();
            nodeObj.put("id", node.id());
            nodeObj.put("kind", node.kind().value());
        }

        final ArrayNode edgesArray = root.putArray("edges");
        for (final Edge edge : graph.edges()) {
            final ObjectNode edgeObj = edgesArray.addObject();
            edgeObj.put("from", edge.from());
            edgeObj.put("to", edge.to());
            if (edge.hasFlags()) {
                edgeObj.set("flags", toJson(edge.flags()));
            }
            if (edge.circular()) {
                edgeObj.put("isCircular", true);
            }
        }

        final ArrayNode cyclesArray = root.putArray("circularDependencies");
        for (final List<String> cycle : graph.circularDependencies()) {
            final ArrayNode cycleArray = cyclesArray.addArray();
            for (final String id : cycle) {
                cycleArray.add(id);
            }
        }

        try {
            final String result = MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(root);
            LOG.debug("JSON output complete ({} characters)",
                    result.length());
            return result;
        } catch (final JsonProcessingException e) {
            throw new DomainException("Failed to serialize graph",
                    DomainException.DOMAIN_ERROR, e);
        }
    }

    private static ObjectNode toJson(final EdgeFlags flags) {
        final ObjectNode flagsObj = MAPPER.createObjectNode();
        if (flags.optional() != null) {
            flagsObj.put("optional", flags.optional());
        }
        if (flags.self() != null) {
            flagsObj.put("self", flags.self());
        }
        if (flags.skipSelf() != null) {
            flagsObj.put("skipSelf", flags.skipSelf());
        }
        if (flags.host() != null) {
            flagsObj.put("host", flags.host());
        }
        return flagsObj;
    }

}
