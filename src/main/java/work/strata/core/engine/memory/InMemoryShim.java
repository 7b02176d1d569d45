package work.strata.core.engine.memory;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.strata.core.engine.ShimProvider;
import work.strata.core.llb.Platform;
import work.strata.core.llb.State;
import work.strata.core.model.ExecOptions;
import work.strata.core.runtime.CancellationToken;
import work.strata.core.shared.PathUtils;

/**
 * Supervising shim understood by {@link InMemoryGraphEngine}. Runs the wrapped command and records
 * its exit code and output in the metadata mount; a non-zero exit is recorded, not raised.
 */
public final class InMemoryShim implements ShimProvider {
    private static final Logger log = LoggerFactory.getLogger(InMemoryShim.class);

    public static final String PATH = "/_shim";
    public static final String SOURCE_SCHEME = "strata-shim://";
    static final int COMMAND_NOT_FOUND = 127;

    @Override
    public String path() {
        return PATH;
    }

    @Override
    public State build(Platform platform, CancellationToken token) {
        token.ensureNotCancelled();
        return State.source(SOURCE_SCHEME + (platform == null ? Platform.DEFAULT : platform).format());
    }

    @Override
    public Set<ExecOptions.Option> supportedOptions() {
        return EnumSet.allOf(ExecOptions.Option.class);
    }

    /**
     * Content of the shim image: a single executable at {@link #PATH}.
     */
    Snapshot contents(String platform) {
        return Snapshot.ofText(Map.of(PATH, "#!strata-shim " + platform + "\n"));
    }

    int supervise(List<String> command, Map<String, String> env, String cwd, ProcessFilesystem fs, Map<String, SimulatedCommand> commands) {
        String meta = ShimProvider.META_MOUNT + "/";
        byte[] stdin = fs.read(meta + ShimProvider.STDIN_FILE).orElse(new byte[0]);
        var process = new SimulatedProcess(command, env, cwd, stdin, fs);
        int exitCode = run(process, commands);

        writeStream(fs, env.get(ShimProvider.REDIRECT_STDOUT_ENV), cwd, meta + "stdout", process.stdoutBytes());
        writeStream(fs, env.get(ShimProvider.REDIRECT_STDERR_ENV), cwd, meta + "stderr", process.stderrBytes());
        fs.write(meta + "exitCode", String.valueOf(exitCode).getBytes(StandardCharsets.UTF_8));
        log.debug("shim {} exited with {}", command, exitCode);
        return exitCode;
    }

    static int run(SimulatedProcess process, Map<String, SimulatedCommand> commands) {
        String name = process.args().get(0);
        SimulatedCommand command = commands.get(name);
        if (command == null) {
            process.err(name + ": command not found\n");
            return COMMAND_NOT_FOUND;
        }
        try {
            return command.run(process);
        } catch (RuntimeException ex) {
            log.warn("command {} failed: {}", name, ex.getMessage());
            process.err(name + ": " + ex.getMessage() + "\n");
            return 1;
        }
    }

    private static void writeStream(ProcessFilesystem fs, String redirect, String cwd, String metaPath, byte[] content) {
        if (redirect == null || redirect.isEmpty()) {
            fs.write(metaPath, content);
            return;
        }
        fs.write("/" + PathUtils.resolve(cwd, redirect), content);
        fs.write(metaPath, new byte[0]);
    }
}
