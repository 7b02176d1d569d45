package work.strata.core.llb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.strata.core.error.DecodingException;

/**
 * Canonical marshaling of lazy states into {@link Definition}s and back.
 *
 * <p>Each node is written as a JSON document with sorted keys; inputs reference earlier nodes by
 * digest, so equal subgraphs collapse into one node and equal states always produce byte-identical
 * definitions.
 */
public final class DefinitionCodec {
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};
    private static final String OUTPUT_KIND = "output";

    private DefinitionCodec() {}

    /**
     * @param platform constraint stamped on every node, or {@code null} to leave nodes unconstrained
     */
    public static Definition marshal(State state, Platform platform) {
        if (state == null || state.isScratch()) {
            return Definition.empty();
        }
        var nodes = new ArrayList<String>();
        var digests = new HashMap<Op, String>();
        var terminal = new LinkedHashMap<String, Object>();
        terminal.put("kind", OUTPUT_KIND);
        terminal.put("inputs", List.of(inputRef(state, platform, nodes, digests)));
        nodes.add(write(terminal));
        return new Definition(nodes);
    }

    public static State unmarshal(Definition definition) {
        if (definition == null || definition.isEmpty()) {
            return State.scratch();
        }
        var parsed = new HashMap<String, Map<String, Object>>();
        for (String node : definition.nodes()) {
            parsed.put(Definition.sha256(node), read(node));
        }
        var terminal = read(definition.nodes().get(definition.nodes().size() - 1));
        if (!OUTPUT_KIND.equals(terminal.get("kind"))) {
            throw new DecodingException("malformed definition: missing output node");
        }
        var inputs = list(terminal.get("inputs"), "inputs");
        if (inputs.size() != 1) {
            throw new DecodingException("malformed definition: output node must have exactly one input");
        }
        return resolve(inputs.get(0), parsed, new HashMap<>());
    }

    private static Object inputRef(State state, Platform platform, List<String> nodes, Map<Op, String> digests) {
        if (state.isScratch()) {
            return null;
        }
        var ref = new LinkedHashMap<String, Object>();
        ref.put("digest", writeOp(state.op(), platform, nodes, digests));
        ref.put("output", state.output());
        return ref;
    }

    private static String writeOp(Op op, Platform platform, List<String> nodes, Map<Op, String> digests) {
        String known = digests.get(op);
        if (known != null) {
            return known;
        }
        var inputs = new ArrayList<Object>();
        for (State input : op.inputs()) {
            inputs.add(inputRef(input, platform, nodes, digests));
        }
        var node = new LinkedHashMap<String, Object>();
        node.put("kind", op.kind());
        node.put("inputs", inputs);
        node.put("attrs", op.attributes());
        if (platform != null) {
            var constraint = new LinkedHashMap<String, Object>();
            constraint.put("os", platform.os());
            constraint.put("architecture", platform.architecture());
            if (platform.variant() != null) {
                constraint.put("variant", platform.variant());
            }
            node.put("platform", constraint);
        }
        String written = write(node);
        String digest = Definition.sha256(written);
        nodes.add(written);
        digests.put(op, digest);
        return digest;
    }

    private static State resolve(Object rawRef, Map<String, Map<String, Object>> parsed, Map<String, Op> built) {
        if (rawRef == null) {
            return State.scratch();
        }
        var ref = map(rawRef, "input");
        String digest = String.valueOf(ref.get("digest"));
        var node = parsed.get(digest);
        if (node == null) {
            throw new DecodingException("malformed definition: unknown node " + digest);
        }
        Op op = built.get(digest);
        if (op == null) {
            var inputs = new ArrayList<State>();
            for (Object input : list(node.get("inputs"), "inputs")) {
                inputs.add(resolve(input, parsed, built));
            }
            op = toOp(String.valueOf(node.get("kind")), inputs, map(node.get("attrs"), "attrs"));
            built.put(digest, op);
        }
        try {
            return new State(op, integer(ref.get("output"), "output"));
        } catch (IllegalArgumentException ex) {
            throw new DecodingException("malformed definition: " + ex.getMessage(), ex);
        }
    }

    private static Op toOp(String kind, List<State> inputs, Map<String, Object> attrs) {
        try {
            switch (kind) {
                case SourceOp.KIND:
                    return new SourceOp(string(attrs.get("identifier"), "identifier"));
                case MkFileOp.KIND:
                    return new MkFileOp(
                        inputs.get(0),
                        string(attrs.get("path"), "path"),
                        string(attrs.get("data"), "data"),
                        integer(attrs.get("mode"), "mode")
                    );
                case ExecOp.KIND:
                    var mounts = new ArrayList<ExecMount>();
                    for (Object raw : list(attrs.get("mounts"), "mounts")) {
                        var mount = map(raw, "mount");
                        mounts.add(new ExecMount(
                            string(mount.get("target"), "target"),
                            inputs.get(integer(mount.get("input"), "input")),
                            string(mount.get("sourcePath"), "sourcePath")
                        ));
                    }
                    return new ExecOp(
                        inputs.get(0),
                        mounts,
                        strings(attrs.get("args"), "args"),
                        strings(attrs.get("env"), "env"),
                        string(attrs.get("cwd"), "cwd"),
                        string(attrs.get("name"), "name")
                    );
                default:
                    throw new DecodingException("malformed definition: unknown node kind " + kind);
            }
        } catch (IndexOutOfBoundsException | IllegalArgumentException | NullPointerException ex) {
            throw new DecodingException("malformed definition: invalid " + kind + " node: " + ex.getMessage(), ex);
        }
    }

    private static String write(Map<String, Object> node) {
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize graph node: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Map<String, Object> read(String node) {
        try {
            return JSON.readValue(node, MAP_REF);
        } catch (JsonProcessingException ex) {
            throw new DecodingException("malformed definition node: " + ex.getOriginalMessage(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value, String field) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new DecodingException("malformed definition: " + field + " must be an object");
    }

    private static List<?> list(Object value, String field) {
        if (value instanceof List<?> list) {
            return list;
        }
        throw new DecodingException("malformed definition: " + field + " must be an array");
    }

    private static List<String> strings(Object value, String field) {
        var result = new ArrayList<String>();
        for (Object item : list(value, field)) {
            result.add(string(item, field));
        }
        return result;
    }

    private static String string(Object value, String field) {
        if (value instanceof String str) {
            return str;
        }
        throw new DecodingException("malformed definition: " + field + " must be a string");
    }

    private static int integer(Object value, String field) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new DecodingException("malformed definition: " + field + " must be a number");
    }
}
