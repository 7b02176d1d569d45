package work.strata.core.llb;

import java.nio.charset.StandardCharsets;

/**
 * Lazy filesystem state: one output of a deferred operation node. Nothing is evaluated when a state
 * is built; the graph engine evaluates a state only once it has been marshaled into a
 * {@link Definition}.
 */
public record State(Op op, int output) {
    private static final State SCRATCH = new State(null, 0);

    public State {
        if (op == null && output != 0) {
            throw new IllegalArgumentException("scratch has a single output");
        }
        if (op != null && (output < 0 || output >= op.outputs())) {
            throw new IllegalArgumentException("output " + output + " out of range for " + op.kind());
        }
    }

    public static State scratch() {
        return SCRATCH;
    }

    public static State of(Op op) {
        return new State(op, 0);
    }

    public static State source(String identifier) {
        return of(new SourceOp(identifier));
    }

    /**
     * Root filesystem of an image; {@code reference} should already be normalized.
     */
    public static State image(String reference) {
        return source(SourceOp.IMAGE_SCHEME + reference);
    }

    public boolean isScratch() {
        return op == null;
    }

    public State file(String path, byte[] content) {
        return of(MkFileOp.of(this, path, content, 0644));
    }

    public State file(String path, String content) {
        return file(path, content.getBytes(StandardCharsets.UTF_8));
    }

    public ExecState run(RunSpec spec) {
        return new ExecState(new ExecOp(this, spec.mounts(), spec.args(), spec.env(), spec.dir(), spec.customName()));
    }

    @Override
    public String toString() {
        return op == null ? "State[scratch]" : "State[" + op.kind() + ":" + output + "]";
    }
}
