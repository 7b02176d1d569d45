package work.strata.core.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.strata.core.error.StrataException;
import work.strata.core.runtime.CancellationToken;
import work.strata.core.runtime.ComposeLoader;
import work.strata.core.runtime.ComposeRunner;
import work.strata.core.runtime.ExecutionContext;
import work.strata.core.schema.OperationRegistry;

/**
 * Public entry point for embedding the container core: runs a compose pipeline against an
 * in-memory engine configured from {@code strata.toml}.
 */
public final class StrataRunner {
    private static final Logger log = LoggerFactory.getLogger(StrataRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        try {
            var settings = configuration.configFile()
                .map(EngineSettingsLoader::load)
                .or(() -> EngineSettingsLoader.discover(configuration.workingDirectory()))
                .orElse(EngineSettings.DEFAULT);
            var logLevel = configuration.logLevel().or(settings::logLevel).orElse(LogLevel.WARN);
            logLevel.apply();
            var platform = configuration.platform().orElse(settings.platform());
            var timeout = configuration.timeout().or(settings::timeout);

            var steps = loadCompose(configuration);
            var initialState = parseInitialState(configuration.inputPayload());
            var engine = settings.createEngine();
            var token = timeout.map(CancellationToken::withTimeout).orElseGet(CancellationToken::new);
            var ctx = new ExecutionContext(OperationRegistry.create(), engine, engine.shim(), platform, token);
            log.debug("running {} ({} steps) on {}", configuration.composeTarget().display(), steps.size(), platform);
            var finalState = ComposeRunner.runSteps(ctx, steps, initialState);

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("compose", configuration.composeTarget().display());
            metadata.put("result", finalState);
            metadata.put("platform", platform.format());
            metadata.put("executions", engine.executions());
            metadata.put("logLevel", logLevel.name());
            metadata.put("status", "ok");
            return RunResult.success(metadata, started);
        } catch (StrataException ex) {
            log.warn("compose {} failed [{}]: {}", configuration.composeTarget().display(), ex.code(), ex.getMessage());
            return failure(configuration, ex.code(), ex, started);
        } catch (Exception ex) {
            log.warn("compose {} failed: {}", configuration.composeTarget().display(), ex.getMessage());
            return failure(configuration, "runtime_error", ex, started);
        }
    }

    private RunResult failure(RunConfiguration configuration, String code, Exception ex, Instant started) {
        var errorMeta = new LinkedHashMap<String, Object>();
        errorMeta.put("compose", configuration.composeTarget().display());
        if (ex instanceof StrataException strata && strata.data() != null) {
            errorMeta.put("data", strata.data());
        }
        if (Boolean.getBoolean("strata.debug")) {
            log.error("compose failure", ex);
        }
        String message = ex.getMessage() == null || ex.getMessage().isBlank() ? ex.getClass().getSimpleName() : ex.getMessage();
        return RunResult.failure(code, message, errorMeta, started);
    }

    private List<Map<String, Object>> loadCompose(RunConfiguration configuration) {
        return configuration.composeTarget().remoteUri()
            .map(ComposeLoader::loadFromHttp)
            .orElseGet(() -> ComposeLoader.loadFromLocalFile(configuration.composeTarget().localPath().orElseThrow()));
    }

    private Map<String, Object> parseInitialState(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            var parsed = JSON.readValue(payload, MAP_REF);
            return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON input payload", ex);
        }
    }
}
