package work.strata.core.llb;

import java.util.List;
import java.util.Map;

/**
 * A deferred operation node in the build graph. Nodes are immutable and compared structurally, so
 * two states built the same way are the same state. Equality and hashing go through {@link #key()}.
 */
public interface Op {
    /**
     * Stable node kind written into the marshaled definition.
     */
    String kind();

    /**
     * Input states in a fixed order; scratch inputs are allowed.
     */
    List<State> inputs();

    /**
     * JSON-friendly attributes (strings, numbers, lists and maps of those) fully describing the node
     * apart from its inputs.
     */
    Map<String, Object> attributes();

    /**
     * Structural key covering the kind, the attributes and the inputs. Nodes that own inputs compute
     * it once at construction.
     */
    String key();

    /**
     * Number of outputs the node produces.
     */
    default int outputs() {
        return 1;
    }
}
