package work.strata.core.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over the loose input maps operations receive.
 */
final class Inputs {
    private Inputs() {}

    static String id(Map<String, Object> input) {
        return optionalString(input, "id");
    }

    static String required(Map<String, Object> input, String key) {
        Object raw = input.get(key);
        if (raw == null) {
            throw new IllegalArgumentException(key + " is required");
        }
        return String.valueOf(raw);
    }

    static String optionalString(Map<String, Object> input, String key) {
        Object raw = input.get(key);
        return raw == null ? null : String.valueOf(raw);
    }

    static List<String> strings(Map<String, Object> input, String key) {
        Object raw = input.get(key);
        if (raw == null) {
            throw new IllegalArgumentException(key + " is required");
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException(key + " must be a list");
        }
        var values = new ArrayList<String>(list.size());
        for (Object item : list) {
            values.add(String.valueOf(item));
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> object(Map<String, Object> input, String key) {
        Object raw = input.get(key);
        if (raw == null) {
            return Map.of();
        }
        if (raw instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException(key + " must be an object");
    }
}
