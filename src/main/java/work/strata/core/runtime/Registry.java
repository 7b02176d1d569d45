package work.strata.core.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.strata.core.error.NotImplementedException;

/**
 * Static table of operations, keyed by operation id.
 */
public final class Registry {
    private final Map<String, Entry> operations = new ConcurrentHashMap<>();

    public Registry register(String id, OperationHandler handler) {
        operations.put(id, new Entry(id, handler, true));
        return this;
    }

    /**
     * Reserves an operation id that is part of the surface but not wired yet; calling it fails with
     * {@link NotImplementedException}.
     */
    public Registry registerUnimplemented(String id) {
        operations.put(id, new Entry(id, (ctx, input) -> {
            throw new NotImplementedException(id);
        }, false));
        return this;
    }

    public Entry get(String id) {
        return operations.get(id);
    }

    public void unregister(String id) {
        if (id != null) {
            operations.remove(id);
        }
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(operations);
    }

    public record Entry(String id, OperationHandler handler, boolean implemented) {}
}
