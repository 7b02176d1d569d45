package work.strata.core.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.net.URI;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogLevelTest {
    @Test
    void parsesCaseInsensitively() {
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("fatal"));
    }

    @Test
    void appliesToTheRootLogger() {
        var root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level previous = root.getLevel();
        try {
            LogLevel.ERROR.apply();
            assertEquals(Level.ERROR, root.getLevel());
        } finally {
            root.setLevel(previous);
        }
    }

    @Test
    void composeTargetsDistinguishUrlsFromFiles() {
        var remote = ComposeTarget.detect("https://example.com/pipeline.yaml");
        assertTrue(remote.isRemote());
        assertEquals(URI.create("https://example.com/pipeline.yaml"), remote.remoteUri().orElseThrow());

        var local = ComposeTarget.detect(Path.of("src", "test", "resources", "composes", "pipeline.yaml").toString());
        assertTrue(local.display().endsWith("pipeline.yaml"));
        assertThrows(IllegalArgumentException.class, () -> ComposeTarget.detect("missing.yaml"));
    }
}
