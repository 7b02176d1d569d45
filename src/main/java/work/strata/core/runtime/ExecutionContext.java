package work.strata.core.runtime;

import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.strata.core.engine.GraphEngine;
import work.strata.core.engine.ShimProvider;
import work.strata.core.llb.Platform;

/**
 * Execution context passed to every operation: the operation registry, the shared engine
 * collaborators, the target platform and the cancellation token.
 *
 * <p>The engine, shim provider and platform are shared by reference between concurrent calls; the
 * context itself holds no per-call state.
 */
public final class ExecutionContext {
    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private final Registry registry;
    private final GraphEngine engine;
    private final ShimProvider shim;
    private final Platform platform;
    private final CancellationToken cancellationToken;

    public ExecutionContext(Registry registry, GraphEngine engine, ShimProvider shim, Platform platform) {
        this(registry, engine, shim, platform, new CancellationToken());
    }

    public ExecutionContext(Registry registry, GraphEngine engine, ShimProvider shim, Platform platform, CancellationToken token) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.shim = Objects.requireNonNull(shim, "shim");
        this.platform = platform == null ? Platform.DEFAULT : platform;
        this.cancellationToken = token == null ? new CancellationToken() : token;
    }

    public Registry registry() {
        return registry;
    }

    public GraphEngine engine() {
        return engine;
    }

    public ShimProvider shim() {
        return shim;
    }

    public Platform platform() {
        return platform;
    }

    public CancellationToken token() {
        return cancellationToken;
    }

    public void ensureNotCancelled() {
        cancellationToken.ensureNotCancelled();
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    public Object call(String id, Map<String, Object> input) throws Exception {
        ensureNotCancelled();
        var entry = registry.get(id);
        if (entry == null) {
            throw new IllegalStateException("Operation not registered: " + id);
        }
        log.debug("call {}", id);
        return entry.handler().invoke(this, input == null ? Map.of() : input);
    }
}
