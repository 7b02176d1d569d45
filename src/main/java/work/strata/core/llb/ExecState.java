package work.strata.core.llb;

import java.util.Objects;

/**
 * Result of attaching a run to a state: exposes the post-run root filesystem and the post-run
 * content of every mount.
 */
public final class ExecState {
    private final ExecOp op;

    ExecState(ExecOp op) {
        this.op = Objects.requireNonNull(op, "op");
    }

    public ExecOp op() {
        return op;
    }

    public State root() {
        return new State(op, 0);
    }

    /**
     * Post-run state of the mount at {@code target}.
     *
     * @throws IllegalArgumentException when nothing is mounted there
     */
    public State mount(String target) {
        return new State(op, op.outputFor(target));
    }

    /**
     * Post-run state of the mount at position {@code index} in the run's mount list, regardless of
     * other mounts sharing its target.
     */
    public State mountAt(int index) {
        if (index < 0 || index >= op.mounts().size()) {
            throw new IllegalArgumentException("no mount at index " + index);
        }
        return new State(op, index + 1);
    }
}
