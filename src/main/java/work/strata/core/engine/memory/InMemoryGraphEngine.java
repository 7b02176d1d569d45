package work.strata.core.engine.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.strata.core.engine.GraphEngine;
import work.strata.core.error.RegistryException;
import work.strata.core.llb.Definition;
import work.strata.core.llb.DefinitionCodec;
import work.strata.core.llb.ExecMount;
import work.strata.core.llb.ExecOp;
import work.strata.core.llb.MkFileOp;
import work.strata.core.llb.Op;
import work.strata.core.llb.Platform;
import work.strata.core.llb.SourceOp;
import work.strata.core.llb.State;
import work.strata.core.model.Image;
import work.strata.core.model.ImageConfig;
import work.strata.core.model.ImageReference;
import work.strata.core.runtime.CancellationToken;
import work.strata.core.shared.PathUtils;

/**
 * Graph engine that solves definitions in memory against a fixed set of images and simulated
 * commands. Solved outputs are memoized per node, so a run is executed at most once however many
 * containers share it.
 */
public final class InMemoryGraphEngine implements GraphEngine {
    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphEngine.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, byte[]> imageConfigs;
    private final Map<String, Snapshot> imageRoots;
    private final Map<String, SimulatedCommand> commands;
    private final InMemoryShim shim;
    private final Map<State, Snapshot> solved = new ConcurrentHashMap<>();
    private final Map<ExecOp, List<Snapshot>> executed = new ConcurrentHashMap<>();
    private final AtomicInteger executions = new AtomicInteger();

    private InMemoryGraphEngine(Builder builder) {
        this.imageConfigs = Map.copyOf(builder.imageConfigs);
        this.imageRoots = Map.copyOf(builder.imageRoots);
        this.commands = Map.copyOf(builder.commands);
        this.shim = builder.shim;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shim this engine recognizes; hand the same instance to the execution context.
     */
    public InMemoryShim shim() {
        return shim;
    }

    /**
     * Number of runs actually executed so far.
     */
    public int executions() {
        return executions.get();
    }

    @Override
    public Definition marshal(State state, Platform platform, CancellationToken token) {
        token.ensureNotCancelled();
        return DefinitionCodec.marshal(state, platform);
    }

    @Override
    public State evaluate(Definition definition) {
        return DefinitionCodec.unmarshal(definition);
    }

    @Override
    public byte[] resolveImageConfig(String reference, Platform platform, CancellationToken token) {
        token.ensureNotCancelled();
        byte[] document = imageConfigs.get(reference);
        if (document == null) {
            throw new RegistryException(reference, "manifest unknown: " + reference);
        }
        log.debug("image config {} ({})", reference, platform);
        return document.clone();
    }

    @Override
    public Optional<byte[]> readFile(Definition definition, String path, CancellationToken token) {
        return solve(evaluate(definition), token).read(path);
    }

    /**
     * Evaluates a state into the filesystem it stands for.
     */
    public Snapshot solve(State state, CancellationToken token) {
        token.ensureNotCancelled();
        if (state.isScratch()) {
            return Snapshot.EMPTY;
        }
        Snapshot known = solved.get(state);
        if (known != null) {
            return known;
        }
        Snapshot result = compute(state, token);
        Snapshot previous = solved.putIfAbsent(state, result);
        return previous == null ? result : previous;
    }

    private Snapshot compute(State state, CancellationToken token) {
        Op op = state.op();
        if (op instanceof SourceOp source) {
            return source(source);
        }
        if (op instanceof MkFileOp mkfile) {
            return solve(mkfile.base(), token).with(mkfile.path(), mkfile.content());
        }
        if (op instanceof ExecOp exec) {
            return run(exec, token).get(state.output());
        }
        throw new IllegalStateException("unsupported graph node " + op.kind());
    }

    private Snapshot source(SourceOp source) {
        if (source.hasScheme(SourceOp.IMAGE_SCHEME)) {
            String reference = source.withoutScheme(SourceOp.IMAGE_SCHEME);
            Snapshot root = imageRoots.get(reference);
            if (root == null) {
                throw new RegistryException(reference, "image not found: " + reference);
            }
            return root;
        }
        if (source.hasScheme(InMemoryShim.SOURCE_SCHEME)) {
            return shim.contents(source.withoutScheme(InMemoryShim.SOURCE_SCHEME));
        }
        throw new IllegalStateException("unsupported source " + source.identifier());
    }

    private List<Snapshot> run(ExecOp exec, CancellationToken token) {
        List<Snapshot> known = executed.get(exec);
        if (known != null) {
            return known;
        }
        var fs = new ProcessFilesystem(solve(exec.root(), token));
        for (ExecMount mount : exec.mounts()) {
            fs.mount(mount.target(), solve(mount.source(), token), mount.sourcePath());
        }
        token.ensureNotCancelled();

        var env = new LinkedHashMap<String, String>();
        for (String entry : exec.env()) {
            int eq = entry.indexOf('=');
            env.put(eq < 0 ? entry : entry.substring(0, eq), eq < 0 ? "" : entry.substring(eq + 1));
        }
        String cwd = PathUtils.normalize(exec.cwd());
        List<String> args = exec.args();
        executions.incrementAndGet();
        log.debug("run {} in /{}", exec.customName().isEmpty() ? args : exec.customName(), cwd);

        if (args.get(0).equals(shim.path()) && args.size() > 1) {
            shim.supervise(args.subList(1, args.size()), env, cwd, fs, commands);
        } else {
            var process = new SimulatedProcess(args, env, cwd, null, fs);
            int exitCode = InMemoryShim.run(process, commands);
            if (exitCode != 0) {
                throw new IllegalStateException("process " + args + " did not complete successfully: exit code " + exitCode);
            }
        }

        var outputs = new ArrayList<Snapshot>(exec.outputs());
        outputs.add(fs.rootOutput());
        for (int i = 0; i < exec.mounts().size(); i++) {
            outputs.add(fs.mountOutput(i));
        }
        List<Snapshot> result = List.copyOf(outputs);
        List<Snapshot> previous = executed.putIfAbsent(exec, result);
        return previous == null ? result : previous;
    }

    public static final class Builder {
        private final Map<String, byte[]> imageConfigs = new LinkedHashMap<>();
        private final Map<String, Snapshot> imageRoots = new LinkedHashMap<>();
        private final Map<String, SimulatedCommand> commands = new LinkedHashMap<>(BuiltinCommands.defaults());
        private InMemoryShim shim = new InMemoryShim();

        private Builder() {}

        /**
         * Registers an image under its normalized reference ({@code alpine} is stored as
         * {@code docker.io/library/alpine:latest}).
         */
        public Builder image(String reference, ImageConfig config, Snapshot rootfs) {
            try {
                byte[] document = JSON.writeValueAsBytes(new Image(Platform.DEFAULT.architecture(), Platform.DEFAULT.os(), config));
                return imageDocument(reference, document, rootfs);
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("Unable to encode image config for " + reference, ex);
            }
        }

        /**
         * Registers an image whose configuration document is served verbatim.
         */
        public Builder imageDocument(String reference, byte[] document, Snapshot rootfs) {
            String normalized = ImageReference.parse(reference).withDefaultTag().toString();
            imageConfigs.put(normalized, document.clone());
            imageRoots.put(normalized, rootfs == null ? Snapshot.EMPTY : rootfs);
            return this;
        }

        public Builder command(String name, SimulatedCommand command) {
            commands.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(command, "command"));
            return this;
        }

        public Builder shim(InMemoryShim shim) {
            this.shim = Objects.requireNonNull(shim, "shim");
            return this;
        }

        public InMemoryGraphEngine build() {
            return new InMemoryGraphEngine(this);
        }
    }
}
