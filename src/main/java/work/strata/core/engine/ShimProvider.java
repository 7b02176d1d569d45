package work.strata.core.engine;

import java.util.Set;
import work.strata.core.llb.Platform;
import work.strata.core.llb.State;
import work.strata.core.model.ExecOptions;
import work.strata.core.runtime.CancellationToken;

/**
 * Supplies the supervising shim that runs in front of every exec.
 *
 * <p>The shim receives the real command as its arguments, runs it, and writes {@code exitCode},
 * {@code stdout} and {@code stderr} into the metadata mount at {@link #META_MOUNT}. When the metadata
 * mount holds a {@code stdin} file the shim pipes it to the process; the redirect variables send a
 * stream to an in-container path instead of the metadata mount.
 */
public interface ShimProvider {
    String META_MOUNT = "/dagger";
    String STDIN_FILE = "stdin";
    String REDIRECT_STDOUT_ENV = "_STRATA_REDIRECT_STDOUT";
    String REDIRECT_STDERR_ENV = "_STRATA_REDIRECT_STDERR";

    /**
     * Fixed path the shim is mounted at and invoked from.
     */
    String path();

    State build(Platform platform, CancellationToken token);

    /**
     * Exec options this shim knows how to honour.
     */
    default Set<ExecOptions.Option> supportedOptions() {
        return Set.of();
    }
}
