package work.strata.core.schema;

import java.util.LinkedHashMap;
import java.util.Map;

final class Results {
    private Results() {}

    static Map<String, Object> id(String id) {
        var result = new LinkedHashMap<String, Object>();
        result.put("id", id);
        return result;
    }

    static Map<String, Object> value(Object value) {
        var result = new LinkedHashMap<String, Object>();
        result.put("value", value);
        return result;
    }
}
