package work.strata.core.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.strata.core.api.ComposeTarget;
import work.strata.core.api.LogLevel;
import work.strata.core.api.RunConfiguration;
import work.strata.core.api.RunResult;
import work.strata.core.api.StrataRunner;
import work.strata.core.llb.Platform;
import work.strata.core.shared.DurationParser;

@CommandLine.Command(
    name = "strata-run",
    description = "Run container pipelines against the in-memory build engine.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true,
    subcommands = {InspectCommand.class}
)
final class RunCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--compose"},
        description = "Compose file path or HTTP(S) URL.",
        arity = "1..*"
    )
    private List<String> composePaths = new ArrayList<>();

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|JSON|-",
        description = "Initial pipeline state as JSON, a JSON file, or '-' for stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = "--platform",
        description = "Target platform os/arch[/variant] (default: strata.toml or linux/amd64).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String platformRaw;

    @CommandLine.Option(
        names = "--timeout",
        description = "Execution timeout (e.g. 30s, 2m, 1h).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--config",
        description = "Engine settings file (default: <compose-dir>/strata.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        if (composePaths == null || composePaths.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "At least one --compose value is required.");
        }
        String payload = loadInputPayload();
        Optional<LogLevel> logLevel = Optional.ofNullable(logLevelRaw).map(LogLevel::from);
        Optional<Platform> platform = Optional.ofNullable(platformRaw).map(Platform::parse);

        var runner = new StrataRunner();
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = 0;
        for (String compose : composePaths) {
            ComposeTarget target;
            try {
                target = ComposeTarget.detect(compose);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
            Path workingDir = target.localPath()
                .map(path -> path.getParent() == null ? path : path.getParent())
                .orElseGet(() -> Path.of("").toAbsolutePath());

            var configuration = RunConfiguration.builder()
                .composeTarget(target)
                .workingDirectory(workingDir)
                .inputPayload(payload)
                .platform(platform)
                .timeout(DurationParser.parse(timeoutRaw))
                .logLevel(logLevel)
                .configFile(Optional.ofNullable(configFile))
                .build();

            RunResult result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.status().exitCode());
            out.println(JSON_WRITER.writeValueAsString(projectOutputs(result)));
            out.flush();
        }
        return exitCode;
    }

    private Map<String, Object> projectOutputs(RunResult result) {
        if (result.status() == RunResult.Status.SUCCESS) {
            Object state = result.metadata().get("result");
            if (state instanceof Map<?, ?> map) {
                var projected = new LinkedHashMap<String, Object>();
                map.forEach((key, value) -> projected.put(String.valueOf(key), value));
                return projected;
            }
            return Map.of();
        }
        var error = new LinkedHashMap<String, Object>();
        error.put("code", result.errorCode());
        error.put("error", result.metadata().get("error"));
        return error;
    }

    private String loadInputPayload() {
        if (input == null || input.isBlank()) {
            return "{}";
        }
        if ("-".equals(input)) {
            return validateJsonPayload(readStdin());
        }
        String trimmed = input.trim();
        if (trimmed.startsWith("{")) {
            return validateJsonPayload(trimmed);
        }
        Path path = Path.of(input).toAbsolutePath().normalize();
        try {
            return validateJsonPayload(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + path);
        }
    }

    private String validateJsonPayload(String payload) {
        String trimmed = payload == null ? "" : payload.trim();
        if (trimmed.isEmpty()) {
            return "{}";
        }
        try {
            var node = JSON.readTree(trimmed);
            if (node != null && !node.isObject()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "JSON payload must be an object");
            }
            return trimmed;
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON payload: " + ex.getMessage());
        }
    }

    private String readStdin() {
        try {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
