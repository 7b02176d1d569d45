package work.strata.core.llb;

import java.util.Objects;

/**
 * A state mounted into an exec at {@code target}; {@code sourcePath} scopes the mount to a
 * directory beneath the source (empty for the source root).
 */
public record ExecMount(String target, State source, String sourcePath) {
    public ExecMount {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(source, "source");
        if (!target.startsWith("/")) {
            throw new IllegalArgumentException("mount target must be absolute: " + target);
        }
        sourcePath = sourcePath == null ? "" : sourcePath;
    }
}
