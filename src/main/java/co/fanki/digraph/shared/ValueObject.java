package co.fanki.digraph.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects in the graph model.
 *
 * <p>Value objects are immutable and compared by their attributes. Nodes,
 * edges, flags and whole graphs are values: filtering never mutates them,
 * it only selects among them.</p>
 *
 * <p>Implementations must:</p>
 * <ul>
 *   <li>Be immutable</li>
 *   <li>Override equals() and hashCode() based on all attributes</li>
 *   <li>Be self-validating (validate in constructor)</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
