package work.strata.core.llb;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a run needs besides its root filesystem.
 */
public record RunSpec(List<String> args, String customName, String dir, List<String> env, List<ExecMount> mounts) {
    public RunSpec {
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? List.of() : List.copyOf(env);
        mounts = mounts == null ? List.of() : List.copyOf(mounts);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> args = new ArrayList<>();
        private final List<String> env = new ArrayList<>();
        private final List<ExecMount> mounts = new ArrayList<>();
        private String customName;
        private String dir;

        public Builder args(List<String> values) {
            args.clear();
            args.addAll(values);
            return this;
        }

        public Builder customName(String name) {
            this.customName = name;
            return this;
        }

        public Builder dir(String dir) {
            this.dir = dir;
            return this;
        }

        /**
         * Adds {@code name=value}, replacing an earlier binding of the same name.
         */
        public Builder env(String name, String value) {
            String prefix = name + "=";
            env.removeIf(entry -> entry.startsWith(prefix));
            env.add(prefix + (value == null ? "" : value));
            return this;
        }

        public Builder mount(String target, State source) {
            return mount(target, source, "");
        }

        public Builder mount(String target, State source, String sourcePath) {
            mounts.add(new ExecMount(target, source, sourcePath));
            return this;
        }

        public RunSpec build() {
            return new RunSpec(args, customName, dir, env, mounts);
        }
    }
}
