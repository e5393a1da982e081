package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.ClassDeclaration;
import co.fanki.digraph.graph.domain.DependencyGraph;
import co.fanki.digraph.graph.domain.GraphBuilder;
import co.fanki.digraph.graph.domain.GraphFilter;
import co.fanki.digraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Application service chaining graph construction, entry filtering and
 * rendering.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DependencyGraphService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyGraphService.class);

    private final GraphBuilder graphBuilder;

    private final GraphFilter graphFilter;

    private final Map<OutputFormat, GraphFormatter> formatters;

    /**
     * Creates a new DependencyGraphService.
     *
     * @param theGraphBuilder the graph builder
     * @param theGraphFilter the graph filter
     * @param theFormatters the available formatters, one per format
     */
    public DependencyGraphService(final GraphBuilder theGraphBuilder,
            final GraphFilter theGraphFilter,
            final List<GraphFormatter> theFormatters) {
        this.graphBuilder = Preconditions.requireNonNull(theGraphBuilder,
                "Graph builder is required");
        this.graphFilter = Preconditions.requireNonNull(theGraphFilter,
                "Graph filter is required");
        Preconditions.requireNonNull(theFormatters,
                "Formatters are required");

        this.formatters = new EnumMap<>(OutputFormat.class);
        for (final GraphFormatter formatter : theFormatters) {
            formatters.put(formatter.outputFormat(), formatter);
        }
    }

    /**
     * Builds, optionally filters, and returns the graph of a request.
     *
     * @param request the request
     * @return the resulting graph
     */
    public DependencyGraph graph(final GraphRequest request) {
        Preconditions.requireNonNull(request, "Request is required");

        List<ClassDeclaration> declarations = request.declarations();
        if (declarations != null && !request.includeDecorators()) {
            declarations = declarations.stream()
                    .map(d -> d == null ? null : d.withoutFlags())
                    .toList();
        }

        final long start = System.nanoTime();
        final DependencyGraph graph = graphBuilder.build(declarations);

        LOG.info("Built graph with {} nodes, {} edges and {} circular"
                + " dependencies in {} ms", graph.nodeCount(),
                graph.edgeCount(), graph.circularDependencies().size(),
                elapsedMillis(start));

        if (request.entries().isEmpty()) {
            return graph;
        }

        final DependencyGraph filtered = graphFilter.filter(graph,
                request.direction(), request.entries());

        LOG.info("Filtered graph {} from {}: {} nodes, {} edges",
                request.direction(), request.entries(),
                filtered.nodeCount(), filtered.edgeCount());

        return filtered;
    }

    /**
     * Builds, filters and renders the graph of a request.
     *
     * @param request the request
     * @return the rendered graph
     */
    public String render(final GraphRequest request) {
        final DependencyGraph graph = graph(request);
        return formatterFor(request.format()).format(graph);
    }

    /**
     * Returns the formatter of the given format.
     *
     * @param format the output format
     * @return the formatter
     * @throws IllegalArgumentException if no formatter is registered
     */
    public GraphFormatter formatterFor(final OutputFormat format) {
        return Preconditions.requireNonNull(formatters.get(format),
                "No formatter registered for " + format);
    }

    private static long elapsedMillis(final long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }

}
