package co.fanki.digraph.graph.domain;

import co.fanki.digraph.shared.ValueObject;

/**
 * Resolution modifiers attached to a dependency edge.
 *
 * <p>Each flag is independently present or absent; an absent flag is
 * {@code null}. The graph engine never interprets them, it carries them
 * from the declaration to the edge unchanged. An instance with every
 * flag absent is the empty bag {@code {}}, which is not the same as an
 * edge without flags.</p>
 *
 * @param optional resolution may yield null
 * @param self resolve from the local injector only
 * @param skipSelf start resolution at the parent injector
 * @param host stop resolution at the host element
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EdgeFlags(
        Boolean optional,
        Boolean self,
        Boolean skipSelf,
        Boolean host) implements ValueObject {

    /** The present-but-empty flag bag. */
    public static final EdgeFlags EMPTY = new EdgeFlags(null, null, null,
            null);

    /**
     * Checks if no flag is set.
     *
     * @return true if all four flags are absent
     */
    public boolean isEmpty() {
        return optional == null && self == null && skipSelf == null
                && host == null;
    }

}
