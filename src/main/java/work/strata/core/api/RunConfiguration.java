package work.strata.core.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.strata.core.llb.Platform;

/**
 * Immutable configuration of a compose run. Empty optionals fall back to the engine settings file,
 * then to built-in defaults.
 */
public record RunConfiguration(
    ComposeTarget composeTarget,
    Path workingDirectory,
    String inputPayload,
    Optional<Platform> platform,
    Optional<Duration> timeout,
    Optional<LogLevel> logLevel,
    Optional<Path> configFile
) {
    public RunConfiguration {
        Objects.requireNonNull(composeTarget, "composeTarget");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(inputPayload, "inputPayload");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(configFile, "configFile");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ComposeTarget composeTarget;
        private Path workingDirectory;
        private String inputPayload = "{}";
        private Optional<Platform> platform = Optional.empty();
        private Optional<Duration> timeout = Optional.empty();
        private Optional<LogLevel> logLevel = Optional.empty();
        private Optional<Path> configFile = Optional.empty();

        public Builder composeTarget(ComposeTarget composeTarget) {
            this.composeTarget = composeTarget;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder platform(Optional<Platform> platform) {
            this.platform = platform;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(Optional<LogLevel> logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder configFile(Optional<Path> configFile) {
            this.configFile = configFile;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(
                composeTarget,
                workingDirectory,
                inputPayload,
                platform,
                timeout,
                logLevel,
                configFile
            );
        }
    }
}
