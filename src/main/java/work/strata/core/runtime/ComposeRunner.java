package work.strata.core.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interprets compose steps sequentially. Each step names an operation ({@code call}), binds its
 * inputs from literals or {@code $.path} references into the pipeline state ({@code in}), and copies
 * result fields back into the state ({@code out}).
 */
public final class ComposeRunner {
    private ComposeRunner() {}

    public static Map<String, Object> runSteps(ExecutionContext ctx, List<Map<String, Object>> rawSteps, Map<String, Object> initialState) throws Exception {
        var state = initialState == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<>(initialState);
        var steps = rawSteps == null ? List.<Map<String, Object>>of() : rawSteps;

        for (int index = 0; index < steps.size(); index++) {
            ctx.ensureNotCancelled();
            var step = steps.get(index);
            if (step == null) continue;
            var callId = Objects.toString(step.get("call"), null);
            if (callId == null || callId.isBlank()) {
                throw new IllegalArgumentException("compose step " + index + " has no call");
            }
            var input = buildInput(castMap(step.get("in")), state);
            Object result = ctx.call(callId, input);
            applyOutputs(step, state, result);
        }
        return state;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object obj) {
        if (obj instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    private static Map<String, Object> buildInput(Map<String, Object> bindings, Map<String, Object> state) {
        var result = new LinkedHashMap<String, Object>();
        for (var entry : bindings.entrySet()) {
            result.put(entry.getKey(), resolveValue(entry.getValue(), state));
        }
        return result;
    }

    private static Object resolveValue(Object value, Map<String, Object> state) {
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(resolveValue(item, state));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), resolveValue(entry.getValue(), state));
            }
            return copy;
        }
        if (value instanceof String str && (str.equals("$") || str.startsWith("$."))) {
            return getByPath(Map.of("$", state), str);
        }
        return value;
    }

    private static Object getByPath(Map<String, Object> root, String path) {
        var parts = path.split("\\.");
        Object current = root;
        for (String part : parts) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(part);
            } else if (current instanceof List<?> list) {
                int index = parseIndex(part);
                if (index < 0 || index >= list.size()) {
                    return null;
                }
                current = list.get(index);
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return cloneLiteral(current);
    }

    private static int parseIndex(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    private static Object cloneLiteral(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), cloneLiteral(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(cloneLiteral(item));
            }
            return copy;
        }
        return value;
    }

    private static void applyOutputs(Map<String, Object> step, Map<String, Object> state, Object result) {
        var outs = castMap(step.get("out"));
        for (var entry : outs.entrySet()) {
            var alias = entry.getValue();
            Object resolved;
            if ("$".equals(alias)) {
                resolved = result;
            } else if (alias instanceof String str && result instanceof Map<?, ?> resMap) {
                resolved = resMap.get(str);
            } else {
                resolved = null;
            }
            state.put(entry.getKey(), cloneLiteral(resolved));
        }
    }
}
