package co.fanki.digraph.graph.domain;

/**
 * Represents the injection role of a node in the dependency graph.
 *
 * <p>Declared classes carry the kind reported by the declaration
 * extractor. Nodes that only exist because something depends on them
 * are {@link #UNKNOWN}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeKind {

    /**
     * Injectable service.
     */
    SERVICE("service"),

    /**
     * UI component with an injector of its own.
     */
    COMPONENT("component"),

    /**
     * Directive attached to a host element.
     */
    DIRECTIVE("directive"),

    /**
     * Dependency target that was never declared.
     */
    UNKNOWN("unknown");

    private final String value;

    NodeKind(final String theValue) {
        this.value = theValue;
    }

    /**
     * Returns the lower-case wire value of this kind.
     *
     * @return the wire value, e.g. {@code service}
     */
    public String value() {
        return value;
    }

    /**
     * Parses a kind string, returning UNKNOWN if not recognized.
     *
     * @param value the string value to parse
     * @return the corresponding NodeKind or UNKNOWN if not found
     */
    public static NodeKind fromString(final String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        final String normalized = value.trim();
        for (final NodeKind kind : values()) {
            if (kind.value.equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return value;
    }

}
