package work.strata.core.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class StrataRunnerTest {
    private static final Path COMPOSES = Path.of("src", "test", "resources", "composes").toAbsolutePath();

    private static RunConfiguration.Builder configuration(String compose) {
        return RunConfiguration.builder()
            .composeTarget(ComposeTarget.forLocal(COMPOSES.resolve(compose)))
            .workingDirectory(COMPOSES);
    }

    @Test
    void runsLocalComposeFile() {
        var result = new StrataRunner().run(configuration("pipeline.yaml").inputPayload("{\"message\":\"hi\"}").build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        var state = (Map<?, ?>) result.metadata().get("result");
        assertEquals(0, state.get("exitCode"));
        assertEquals("hi\n", state.get("stdout"));
        assertEquals("linux/amd64", result.metadata().get("platform"));
        assertEquals(1, result.metadata().get("executions"));
    }

    @Test
    void reportsStableErrorCodes() {
        var result = new StrataRunner().run(configuration("failing.yaml").build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("registry_error", result.errorCode());
        assertEquals("docker.io/library/ghost:1.0", result.metadata().get("data"));
    }

    @Test
    void invalidInputIsARuntimeError() {
        var result = new StrataRunner().run(configuration("pipeline.yaml").inputPayload("[not json").build());

        assertEquals("runtime_error", result.errorCode());
        assertTrue(result.toPrettyJson().contains("Invalid JSON input payload"));
    }

    @Test
    void explicitSettingsOverrideDiscovery() {
        var result = new StrataRunner().run(configuration("pipeline.yaml")
            .inputPayload("{\"message\":\"hi\"}")
            .platform(Optional.of(work.strata.core.llb.Platform.parse("linux/arm64")))
            .configFile(Optional.of(COMPOSES.resolve("strata.toml")))
            .build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals("linux/arm64", result.metadata().get("platform"));
    }
}
