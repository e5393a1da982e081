package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.DomainException;
import co.fanki.digraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link DependencyGraph} from extracted class declarations.
 *
 * <p>The input is validated as a whole before anything is built; a
 * single malformed declaration rejects the call. Nodes are registered
 * for every declaration (the first declaration of a name decides its
 * kind) and for every dependency token nobody declared (kind
 * {@link NodeKind#UNKNOWN}). Nodes are then sorted by id, edges by
 * (from, to), and the edges taking part in a detected cycle are marked
 * circular.</p>
 *
 * <p>Same input, same output: the builder holds no state between
 * calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphBuilder.class);

    /** Error code of every declaration contract violation. */
    public static final String INVALID_DECLARATION = "INVALID_DECLARATION";

    /** The declaration list itself is null. */
    public static final String NULL_DECLARATIONS =
            "Class declarations cannot be null";

    /** An element of the declaration list is null. */
    public static final String NULL_DECLARATION =
            "Class declaration cannot be null";

    /** The name is missing or not a string. */
    public static final String INVALID_NAME =
            "Class declaration must have a valid name property";

    /** The name is blank after trimming. */
    public static final String EMPTY_NAME =
            "Class declaration name cannot be empty";

    /** The kind is missing or not a string. */
    public static final String INVALID_KIND =
            "Class declaration must have a valid kind property";

    /** The dependency list is missing. */
    public static final String MISSING_DEPENDENCIES =
            "Class declaration must have a dependencies array";

    /** The dependency list is not a sequence. */
    public static final String INVALID_DEPENDENCIES =
            "Class declaration dependencies must be an array";

    /** A dependency token is missing or not a string. */
    public static final String INVALID_TOKEN =
            "Dependency must have a valid token property";

    /** Ordinal id ordering. */
    static final Comparator<Node> NODE_ORDER =
            Comparator.comparing(Node::id);

    /** Ordinal (from, to) ordering. */
    static final Comparator<Edge> EDGE_ORDER =
            Comparator.comparing(Edge::from).thenComparing(Edge::to);

    private final CycleDetector cycleDetector;

    /**
     * Creates a new GraphBuilder.
     *
     * @param theCycleDetector the detector run over every built graph
     */
    public GraphBuilder(final CycleDetector theCycleDetector) {
        this.cycleDetector = Preconditions.requireNonNull(theCycleDetector,
                "Cycle detector is required");
    }

    /**
     * Builds the graph of the given declarations.
     *
     * @param declarations the extracted class declarations
     * @return the sorted graph with its cycles
     * @throws DomainException if any declaration is malformed
     */
    public DependencyGraph build(final List<ClassDeclaration> declarations) {
        validate(declarations);

        LOG.debug("Building graph from {} class declarations",
                declarations.size());

        final Map<String, Node> nodes = new LinkedHashMap<>();
        final List<Edge> edges = new ArrayList<>();

        for (final ClassDeclaration declaration : declarations) {
            nodes.putIfAbsent(declaration.name(), new Node(
                    declaration.name(),
                    NodeKind.fromString(declaration.kind())));
        }
        final int declaredCount = nodes.size();

        for (final ClassDeclaration declaration : declarations) {
            for (final DependencyDeclaration dependency
                    : declaration.dependencies()) {
                nodes.putIfAbsent(dependency.token(),
                        Node.unknown(dependency.token()));
                edges.add(Edge.of(declaration.name(), dependency.token(),
                        dependency.flags()));
            }
        }

        final List<Node> sortedNodes = new ArrayList<>(nodes.values());
        sortedNodes.sort(NODE_ORDER);
        edges.sort(EDGE_ORDER);

        final CycleDetector.Detection detection = cycleDetector.detect(
                sortedNodes, edges);

        final List<Edge> markedEdges = new ArrayList<>(edges.size());
        for (final Edge edge : edges) {
            markedEdges.add(detection.isCircular(edge)
                    ? edge.markCircular() : edge);
        }

        if (detection.cycles().isEmpty()) {
            LOG.debug("No circular dependencies detected");
        } else {
            LOG.debug("Detected {} circular dependencies across {} edges",
                    detection.cycles().size(),
                    detection.circularSteps().size());
        }

        LOG.debug("Graph built: {} nodes ({} declared, {} unknown),"
                + " {} edges", sortedNodes.size(), declaredCount,
                sortedNodes.size() - declaredCount, markedEdges.size());

        return new DependencyGraph(sortedNodes, markedEdges,
                detection.cycles());
    }

    /**
     * Checks the whole declaration list before any node is created.
     *
     * @param declarations the declarations to check
     * @throws DomainException on the first violated constraint
     */
    private static void validate(final List<ClassDeclaration> declarations) {
        requireDeclaration(declarations != null, NULL_DECLARATIONS);

        for (final ClassDeclaration declaration : declarations) {
            requireDeclaration(declaration != null, NULL_DECLARATION);
            requireDeclaration(declaration.name() != null, INVALID_NAME);
            requireDeclaration(!declaration.name().isBlank(),
                    EMPTY_NAME);
            requireDeclaration(declaration.kind() != null, INVALID_KIND);
            requireDeclaration(declaration.dependencies() != null,
                    MISSING_DEPENDENCIES);

            for (final DependencyDeclaration dependency
                    : declaration.dependencies()) {
                requireDeclaration(dependency != null
                        && dependency.token() != null, INVALID_TOKEN);
            }
        }
    }

    private static void requireDeclaration(final boolean condition,
            final String message) {
        Preconditions.requireDomain(condition, message, INVALID_DECLARATION);
    }

}
