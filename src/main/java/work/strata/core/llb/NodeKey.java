package work.strata.core.llb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural key of a graph node: the digest of its kind, its attributes and the keys of its
 * inputs. Inputs contribute only their own key, so computing a key never walks the graph.
 */
final class NodeKey {
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private NodeKey() {}

    static String of(String kind, Map<String, Object> attributes, List<State> inputs) {
        var refs = new ArrayList<Object>(inputs.size());
        for (State input : inputs) {
            refs.add(input.isScratch() ? null : input.op().key() + "#" + input.output());
        }
        var node = new LinkedHashMap<String, Object>();
        node.put("kind", kind);
        node.put("attrs", attributes);
        node.put("inputs", refs);
        try {
            return Definition.sha256(JSON.writeValueAsString(node));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize graph node: " + ex.getOriginalMessage(), ex);
        }
    }
}
