package co.fanki.digraph.graph.domain;

import java.util.List;

/**
 * A class declaration as reported by the declaration extractor.
 *
 * <p>Not validated on construction: {@link GraphBuilder} rejects
 * malformed declarations as a whole before building anything.</p>
 *
 * @param name the declared class name
 * @param kind the declared kind, e.g. {@code service}
 * @param dependencies the injected dependencies in declaration order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ClassDeclaration(
        String name,
        String kind,
        List<DependencyDeclaration> dependencies) {

    /**
     * Returns a copy of this declaration whose dependencies carry no flags.
     *
     * @return the declaration without flags
     */
    public ClassDeclaration withoutFlags() {
        if (dependencies == null) {
            return this;
        }
        return new ClassDeclaration(name, kind, dependencies.stream()
                .map(d -> d == null ? null
                        : new DependencyDeclaration(d.token(), null))
                .toList());
    }

}
