package work.strata.core.engine.memory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.strata.core.shared.PathUtils;

/**
 * What a {@link SimulatedCommand} sees while it runs: its arguments, environment, working
 * directory, stdin, output streams and filesystem. Relative paths resolve against the working
 * directory.
 */
public final class SimulatedProcess {
    private final List<String> args;
    private final Map<String, String> env;
    private final String cwd;
    private final byte[] stdin;
    private final ProcessFilesystem fs;
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    SimulatedProcess(List<String> args, Map<String, String> env, String cwd, byte[] stdin, ProcessFilesystem fs) {
        this.args = List.copyOf(args);
        this.env = Map.copyOf(env);
        this.cwd = cwd;
        this.stdin = stdin == null ? new byte[0] : stdin;
        this.fs = fs;
    }

    public List<String> args() {
        return args;
    }

    public String env(String name) {
        return env.get(name);
    }

    public Map<String, String> env() {
        return env;
    }

    public String cwd() {
        return cwd;
    }

    public byte[] stdin() {
        return stdin.clone();
    }

    public void out(String text) {
        stdout.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    public void out(byte[] bytes) {
        stdout.writeBytes(bytes);
    }

    public void err(String text) {
        stderr.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<byte[]> readFile(String path) {
        return fs.read(absolute(path));
    }

    public boolean exists(String path) {
        return fs.exists(absolute(path));
    }

    public void writeFile(String path, byte[] content) {
        fs.write(absolute(path), content);
    }

    public void writeFile(String path, String content) {
        writeFile(path, content.getBytes(StandardCharsets.UTF_8));
    }

    public boolean deleteFile(String path) {
        return fs.delete(absolute(path));
    }

    byte[] stdoutBytes() {
        return stdout.toByteArray();
    }

    byte[] stderrBytes() {
        return stderr.toByteArray();
    }

    private String absolute(String path) {
        return "/" + PathUtils.resolve(cwd, path);
    }
}
