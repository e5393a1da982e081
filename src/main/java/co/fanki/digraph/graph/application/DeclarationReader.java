package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.ClassDeclaration;
import co.fanki.digraph.graph.domain.DependencyDeclaration;
import co.fanki.digraph.graph.domain.EdgeFlags;
import co.fanki.digraph.graph.domain.GraphBuilder;
import co.fanki.digraph.shared.DomainException;
import co.fanki.digraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the declaration extractor's output from its JSON form.
 *
 * <p>The document is an array of
 * {@code {"name", "kind", "dependencies": [{"token", "flags"}]}}
 * objects. Values of the wrong JSON type are read as missing, so that
 * {@link GraphBuilder} reports them with its own messages; a
 * {@code dependencies} value that is present but not an array is
 * rejected here with the builder's message for it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class DeclarationReader {

    /** Error code for documents that are not valid declaration JSON. */
    public static final String INVALID_INPUT = "INVALID_INPUT";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parses a declarations document.
     *
     * @param json the JSON text
     * @return the declarations in document order
     * @throws DomainException if the text is not a JSON array of
     *         declarations
     */
    public List<ClassDeclaration> read(final String json) {
        Preconditions.requireNonNull(json, "JSON is required");

        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new DomainException("Declarations are not valid JSON: "
                    + e.getOriginalMessage(), INVALID_INPUT, e);
        }

        if (root == null || !root.isArray()) {
            throw new DomainException(
                    "Declarations document must be a JSON array",
                    INVALID_INPUT);
        }

        final List<ClassDeclaration> declarations = new ArrayList<>();
        for (final JsonNode node : root) {
            declarations.add(node.isObject() ? toDeclaration(node) : null);
        }
        return Collections.unmodifiableList(declarations);
    }

    private static ClassDeclaration toDeclaration(final JsonNode node) {
        final JsonNode dependenciesNode = node.get("dependencies");

        List<DependencyDeclaration> dependencies = null;
        if (dependenciesNode != null && !dependenciesNode.isNull()) {
            if (!dependenciesNode.isArray()) {
                throw new DomainException(GraphBuilder.INVALID_DEPENDENCIES,
                        GraphBuilder.INVALID_DECLARATION);
            }
            dependencies = new ArrayList<>();
            for (final JsonNode dependency : dependenciesNode) {
                dependencies.add(toDependency(dependency));
            }
        }

        return new ClassDeclaration(text(node, "name"), text(node, "kind"),
                dependencies);
    }

    private static DependencyDeclaration toDependency(final JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        return new DependencyDeclaration(text(node, "token"),
                toFlags(node.get("flags")));
    }

    private static EdgeFlags toFlags(final JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new EdgeFlags(
                bool(node, "optional"),
                bool(node, "self"),
                bool(node, "skipSelf"),
                bool(node, "host"));
    }

    private static String text(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static Boolean bool(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.asBoolean() : null;
    }

}
