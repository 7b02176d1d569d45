package work.strata.core.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.strata.core.llb.Platform;

class EngineSettingsLoaderTest {
    @Test
    void readsEngineDefaultsAndImages() {
        String toml = String.join("\n",
            "[engine]",
            "platform = \"linux/arm64/v8\"",
            "timeout = \"2m\"",
            "log_level = \"debug\"",
            "",
            "[images.\"busybox:1.36\"]",
            "env = [\"HOME=/root\"]",
            "user = \"root\"",
            "files = { \"bin/busybox\" = \"bb\" }"
        );

        var settings = EngineSettingsLoader.parse(toml, "inline");

        assertEquals(new Platform("linux", "arm64", "v8"), settings.platform());
        assertEquals(Optional.of(Duration.ofMinutes(2)), settings.timeout());
        assertEquals(Optional.of(LogLevel.DEBUG), settings.logLevel());
        var image = settings.images().get(0);
        assertEquals("busybox:1.36", image.reference());
        assertEquals(List.of("HOME=/root"), image.config().env());
        assertEquals("root", image.config().user());
        assertEquals(Map.of("bin/busybox", "bb"), image.files());
    }

    @Test
    void emptyFilesUseDefaults() {
        var settings = EngineSettingsLoader.parse("", "inline");
        assertEquals(Platform.DEFAULT, settings.platform());
        assertTrue(settings.timeout().isEmpty());
        assertTrue(settings.images().isEmpty());
    }

    @Test
    void rejectsMalformedSettings() {
        assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[engine", "inline"));
        assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[engine]\ntimeout = \"soon\"", "inline"));
        assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("images = { alpine = 1 }", "inline"));
    }

    @Test
    void discoversSettingsNextToCompose() {
        var composes = Path.of("src", "test", "resources", "composes");
        var settings = EngineSettingsLoader.discover(composes).orElseThrow();

        assertEquals(Optional.of(Duration.ofSeconds(30)), settings.timeout());
        assertEquals("alpine", settings.images().get(0).reference());
        assertTrue(EngineSettingsLoader.discover(composes.resolve("missing")).isEmpty());
    }

    @Test
    void createdEnginesServeConfiguredImages() {
        var settings = EngineSettingsLoader.parse("[images.\"alpine\"]\nworkdir = \"/srv\"", "inline");
        var engine = settings.createEngine();

        var document = engine.resolveImageConfig("docker.io/library/alpine:latest", Platform.DEFAULT, new work.strata.core.runtime.CancellationToken());
        assertTrue(new String(document, java.nio.charset.StandardCharsets.UTF_8).contains("/srv"));
    }
}
