package work.strata.core.engine.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import work.strata.core.engine.ShimProvider;
import work.strata.core.model.ExecOptions;

class InMemoryShimTest {
    private final InMemoryShim shim = new InMemoryShim();
    private final Logger logger = (Logger) LoggerFactory.getLogger(InMemoryShim.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    @Test
    void supportsEveryExecOption() {
        assertEquals(EnumSet.allOf(ExecOptions.Option.class), shim.supportedOptions());
        assertEquals("/_shim", shim.path());
    }

    @Test
    void recordsExitCodeAndStreams() {
        var fs = metaFilesystem();
        Map<String, SimulatedCommand> commands = Map.of("greet", process -> {
            process.out("hello " + process.env("WHO"));
            process.err("warned");
            return 4;
        });

        int exitCode = shim.supervise(List.of("greet"), Map.of("WHO", "world"), "", fs, commands);

        assertEquals(4, exitCode);
        assertEquals("hello world", text(fs, "/dagger/stdout"));
        assertEquals("warned", text(fs, "/dagger/stderr"));
        assertEquals("4", text(fs, "/dagger/exitCode"));
    }

    @Test
    void failingCommandsExitWithOneAndAreLogged() {
        var fs = metaFilesystem();
        Map<String, SimulatedCommand> commands = Map.of("boom", process -> {
            throw new IllegalStateException("kaput");
        });

        int exitCode = shim.supervise(List.of("boom"), Map.of(), "", fs, commands);

        assertEquals(1, exitCode);
        assertTrue(text(fs, "/dagger/stderr").contains("kaput"));
        assertEquals(1, appender.list.size());
        assertEquals(Level.WARN, appender.list.get(0).getLevel());
    }

    @Test
    void redirectsResolveAgainstTheWorkingDirectory() {
        var fs = metaFilesystem();
        Map<String, SimulatedCommand> commands = Map.of("say", process -> {
            process.out("said");
            return 0;
        });

        shim.supervise(List.of("say"), Map.of(ShimProvider.REDIRECT_STDOUT_ENV, "out.log"), "var/log", fs, commands);

        assertEquals("said", text(fs, "/var/log/out.log"));
        assertEquals("", text(fs, "/dagger/stdout"));
    }

    private static ProcessFilesystem metaFilesystem() {
        var fs = new ProcessFilesystem(Snapshot.EMPTY);
        fs.mount("/dagger", Snapshot.EMPTY, "");
        return fs;
    }

    private static String text(ProcessFilesystem fs, String path) {
        return new String(fs.read(path).orElseThrow(), StandardCharsets.UTF_8);
    }
}
