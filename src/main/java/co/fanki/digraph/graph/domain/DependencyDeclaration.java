package co.fanki.digraph.graph.domain;

/**
 * One injected dependency of a {@link ClassDeclaration}.
 *
 * @param token the injection token, usually a class name
 * @param flags the resolution flags, null when none were declared
 */
public record DependencyDeclaration(String token, EdgeFlags flags) {

    /**
     * Creates a dependency without flags.
     *
     * @param token the injection token
     * @return the dependency
     */
    public static DependencyDeclaration of(final String token) {
        return new DependencyDeclaration(token, null);
    }

}
