package work.strata.core.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.strata.core.llb.Platform;
import work.strata.core.model.ImageConfig;
import work.strata.core.shared.DurationParser;

/**
 * Reads {@code strata.toml}:
 *
 * <pre>
 * [engine]
 * platform = "linux/arm64"
 * timeout = "30s"
 * log_level = "debug"
 *
 * [images."alpine:3.19"]
 * env = ["PATH=/usr/bin:/bin"]
 * workdir = "/root"
 * user = "root"
 * entrypoint = ["/bin/sh"]
 * files = { "etc/alpine-release" = "3.19.1" }
 * </pre>
 */
public final class EngineSettingsLoader {
    public static final String DEFAULT_FILE_NAME = "strata.toml";

    private EngineSettingsLoader() {}

    public static EngineSettings load(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read engine settings: " + path, ex);
        }
        return parse(content, path.toString());
    }

    /**
     * Loads {@code strata.toml} from {@code directory} when present.
     */
    public static Optional<EngineSettings> discover(Path directory) {
        Path candidate = directory.resolve(DEFAULT_FILE_NAME);
        return Files.isRegularFile(candidate) ? Optional.of(load(candidate)) : Optional.empty();
    }

    public static EngineSettings parse(String content, String source) {
        TomlParseResult toml = Toml.parse(content);
        if (toml.hasErrors()) {
            String errors = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid engine settings " + source + ": " + errors);
        }
        try {
            return read(toml);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid engine settings " + source + ": " + ex.getMessage(), ex);
        }
    }

    private static EngineSettings read(TomlParseResult toml) {
        Platform platform = Platform.DEFAULT;
        Optional<Duration> timeout = Optional.empty();
        Optional<LogLevel> logLevel = Optional.empty();
        TomlTable engine = toml.getTable("engine");
        if (engine != null) {
            platform = Platform.parse(engine.getString("platform"));
            timeout = DurationParser.parse(engine.getString("timeout"));
            String level = engine.getString("log_level");
            if (level != null) {
                logLevel = Optional.of(LogLevel.from(level));
            }
        }
        return new EngineSettings(platform, timeout, logLevel, readImages(toml.getTable("images")));
    }

    private static List<EngineSettings.ImageFixture> readImages(TomlTable images) {
        var fixtures = new ArrayList<EngineSettings.ImageFixture>();
        if (images == null) {
            return fixtures;
        }
        for (String reference : images.keySet()) {
            if (!images.isTable(List.of(reference))) {
                throw new IllegalArgumentException("images." + reference + " must be a table");
            }
            TomlTable image = images.getTable(List.of(reference));
            var config = ImageConfig.EMPTY
                .withEnv(strings(image.getArray(List.of("env"))))
                .withEntrypoint(strings(image.getArray(List.of("entrypoint"))))
                .withWorkingDir(image.getString(List.of("workdir")))
                .withUser(image.getString(List.of("user")));
            fixtures.add(new EngineSettings.ImageFixture(reference, config, files(image.getTable(List.of("files")))));
        }
        return fixtures;
    }

    private static List<String> strings(TomlArray array) {
        var values = new ArrayList<String>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    private static Map<String, String> files(TomlTable table) {
        var files = new LinkedHashMap<String, String>();
        if (table == null) {
            return files;
        }
        for (String path : table.keySet()) {
            files.put(path, table.getString(List.of(path)));
        }
        return files;
    }
}
