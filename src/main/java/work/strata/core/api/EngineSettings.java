package work.strata.core.api;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.strata.core.engine.memory.InMemoryGraphEngine;
import work.strata.core.engine.memory.Snapshot;
import work.strata.core.llb.Platform;
import work.strata.core.model.ImageConfig;

/**
 * Engine defaults and image fixtures read from {@code strata.toml}.
 */
public record EngineSettings(Platform platform, Optional<Duration> timeout, Optional<LogLevel> logLevel, List<ImageFixture> images) {
    public static final EngineSettings DEFAULT = new EngineSettings(Platform.DEFAULT, Optional.empty(), Optional.empty(), List.of());

    public EngineSettings {
        platform = platform == null ? Platform.DEFAULT : platform;
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
        images = images == null ? List.of() : List.copyOf(images);
    }

    /**
     * In-memory engine serving every configured image.
     */
    public InMemoryGraphEngine createEngine() {
        var builder = InMemoryGraphEngine.builder();
        for (ImageFixture image : images) {
            builder.image(image.reference(), image.config(), Snapshot.ofText(image.files()));
        }
        return builder.build();
    }

    public record ImageFixture(String reference, ImageConfig config, Map<String, String> files) {
        public ImageFixture {
            Objects.requireNonNull(reference, "reference");
            config = config == null ? ImageConfig.EMPTY : config;
            files = files == null ? Map.of() : Map.copyOf(files);
        }
    }
}
