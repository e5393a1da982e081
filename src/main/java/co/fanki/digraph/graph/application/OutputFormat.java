package co.fanki.digraph.graph.application;

import co.fanki.digraph.shared.DomainException;

/**
 * Text formats a graph can be rendered to.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum OutputFormat {

    /** Pretty-printed graph JSON. */
    JSON("json"),

    /** Mermaid {@code flowchart LR} diagram. */
    MERMAID("mermaid");

    /** Error code raised for an unrecognized format. */
    public static final String INVALID_FORMAT = "INVALID_FORMAT";

    private final String value;

    OutputFormat(final String theValue) {
        this.value = theValue;
    }

    /**
     * Returns the lower-case option value of this format.
     *
     * @return the option value
     */
    public String value() {
        return value;
    }

    /**
     * Parses a format option, defaulting to JSON when absent.
     *
     * @param value the option value
     * @return the format
     * @throws DomainException if the value is not a known format
     */
    public static OutputFormat fromString(final String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        final String normalized = value.trim();
        for (final OutputFormat format : values()) {
            if (format.value.equalsIgnoreCase(normalized)) {
                return format;
            }
        }
        throw new DomainException("Invalid format: " + normalized
                + ". Must be 'json' or 'mermaid'", INVALID_FORMAT);
    }

    @Override
    public String toString() {
        return value;
    }

}
