package work.strata.core.llb;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a process over a root filesystem and a list of mounts. Output {@code 0} is the root
 * filesystem after the run, output {@code i + 1} is mount {@code i} after the run.
 */
public final class ExecOp implements Op {
    public static final String KIND = "exec";

    private final State root;
    private final List<ExecMount> mounts;
    private final List<String> args;
    private final List<String> env;
    private final String cwd;
    private final String customName;
    private final String key;

    public ExecOp(State root, List<ExecMount> mounts, List<String> args, List<String> env, String cwd, String customName) {
        this.root = Objects.requireNonNull(root, "root");
        this.mounts = mounts == null ? List.of() : List.copyOf(mounts);
        this.args = args == null ? List.of() : List.copyOf(args);
        this.env = env == null ? List.of() : List.copyOf(env);
        this.cwd = cwd == null || cwd.isEmpty() ? "/" : cwd;
        this.customName = customName == null ? "" : customName;
        if (this.args.isEmpty()) {
            throw new IllegalArgumentException("exec requires at least one argument");
        }
        this.key = NodeKey.of(KIND, attributes(), inputs());
    }

    public State root() {
        return root;
    }

    public List<ExecMount> mounts() {
        return mounts;
    }

    public List<String> args() {
        return args;
    }

    public List<String> env() {
        return env;
    }

    public String cwd() {
        return cwd;
    }

    public String customName() {
        return customName;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public int outputs() {
        return mounts.size() + 1;
    }

    @Override
    public List<State> inputs() {
        var inputs = new ArrayList<State>(mounts.size() + 1);
        inputs.add(root);
        for (ExecMount mount : mounts) {
            inputs.add(mount.source());
        }
        return inputs;
    }

    @Override
    public Map<String, Object> attributes() {
        var mountAttrs = new ArrayList<Map<String, Object>>(mounts.size());
        for (int i = 0; i < mounts.size(); i++) {
            var mount = mounts.get(i);
            var attrs = new LinkedHashMap<String, Object>();
            attrs.put("target", mount.target());
            attrs.put("sourcePath", mount.sourcePath());
            attrs.put("input", i + 1);
            mountAttrs.add(attrs);
        }
        var attrs = new LinkedHashMap<String, Object>();
        attrs.put("args", args);
        attrs.put("env", env);
        attrs.put("cwd", cwd);
        attrs.put("name", customName);
        attrs.put("mounts", mountAttrs);
        return attrs;
    }

    /**
     * Output index of the mount at {@code target}. Later mounts shadow earlier ones on the same target.
     */
    public int outputFor(String target) {
        for (int i = mounts.size() - 1; i >= 0; i--) {
            if (mounts.get(i).target().equals(target)) {
                return i + 1;
            }
        }
        throw new IllegalArgumentException("no mount at " + target);
    }

    /**
     * Target of the mount behind an output index, or {@code null} for the root output.
     */
    public String targetOf(int output) {
        return output == 0 ? null : mounts.get(output - 1).target();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecOp other)) return false;
        return key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return "ExecOp[" + (customName.isEmpty() ? String.join(" ", args) : customName) + "]";
    }
}
