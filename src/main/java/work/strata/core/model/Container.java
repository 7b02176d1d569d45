package work.strata.core.model;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.strata.core.engine.ShimProvider;
import work.strata.core.error.ExitCodeParseException;
import work.strata.core.error.MarshalException;
import work.strata.core.error.NotImplementedException;
import work.strata.core.error.RegistryException;
import work.strata.core.error.StrataException;
import work.strata.core.id.IdCodec;
import work.strata.core.llb.Definition;
import work.strata.core.llb.ExecState;
import work.strata.core.llb.Platform;
import work.strata.core.llb.RunSpec;
import work.strata.core.llb.State;
import work.strata.core.runtime.ExecutionContext;
import work.strata.core.shared.PathUtils;

/**
 * A content-addressed container.
 *
 * <p>Every operation decodes a private copy of the payload, derives a new payload and returns a new
 * container; the receiver is never changed and its identity stays valid whatever happens.
 */
public final class Container {
    private static final Logger log = LoggerFactory.getLogger(Container.class);

    /**
     * Name of the file the shim writes the exit code to.
     */
    public static final String EXIT_CODE_FILE = "exitCode";
    public static final String STDOUT_FILE = "stdout";
    public static final String STDERR_FILE = "stderr";

    private final String id;

    public Container(String id) {
        this.id = id == null ? "" : id;
    }

    public static Container scratch() {
        return new Container("");
    }

    public static Container of(ContainerPayload payload) {
        return new Container(IdCodec.encode(payload));
    }

    public String id() {
        return id;
    }

    public ContainerPayload payload() {
        return IdCodec.decode(id, ContainerPayload.class, ContainerPayload::scratch);
    }

    /**
     * Root filesystem state; scratch when the container has none.
     */
    public State fsState(ExecutionContext ctx) {
        return payload().fsState(ctx.engine());
    }

    public Directory filesystem(ExecutionContext ctx) {
        var payload = payload();
        return Directory.of(payload.fs() == null ? Definition.empty() : payload.fs(), "");
    }

    public Container withFilesystem(ExecutionContext ctx, State state, Platform platform) {
        var payload = payload();
        var fs = Marshaling.marshal(ctx, MarshalException.ROOT, () -> state, platform);
        return of(payload.withFs(fs));
    }

    public Container withMountedDirectory(ExecutionContext ctx, String target, Directory source) {
        Objects.requireNonNull(source, "source");
        if (target == null || !target.startsWith("/")) {
            throw new IllegalArgumentException("mount target must be an absolute path: " + target);
        }
        for (String reserved : List.of(ShimProvider.META_MOUNT, ctx.shim().path())) {
            if (PathUtils.relativize(reserved, target) != null) {
                throw new IllegalArgumentException("mount target " + target + " is reserved by " + reserved);
            }
        }
        var payload = payload();
        var dir = source.payload();
        var dirState = dir.state(ctx.engine());
        var definition = Marshaling.marshal(ctx, target, () -> dirState, null);
        log.debug("mount {} at {}", definition.digest(), target);
        return of(payload.withMount(new ContainerMount(definition, dir.dir(), target)));
    }

    public List<String> mounts() {
        var targets = new ArrayList<String>();
        for (ContainerMount mount : payload().mounts()) {
            targets.add(mount.target());
        }
        return targets;
    }

    public ImageConfig imageConfig() {
        return payload().config();
    }

    public Container updateImageConfig(UnaryOperator<ImageConfig> update) {
        var payload = payload();
        return of(payload.withConfig(update.apply(payload.config())));
    }

    /**
     * Replaces the filesystem with the root of the image at {@code address} and the image
     * configuration with the image's own.
     */
    public Container from(ExecutionContext ctx, String address) {
        ctx.ensureNotCancelled();
        String ref = ImageReference.parse(address).withDefaultTag().toString();
        byte[] document;
        try {
            document = ctx.engine().resolveImageConfig(ref, ctx.platform(), ctx.token());
        } catch (StrataException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new RegistryException(ref, "resolve image config for " + ref + ": " + ex.getMessage(), ex);
        }
        var image = Image.parse(ref, document);
        log.debug("resolved {} for {}", ref, ctx.platform());
        return withFilesystem(ctx, State.image(ref), ctx.platform())
            .updateImageConfig(cfg -> image.config());
    }

    /**
     * Adds a supervised run of {@code args} to the build graph. Nothing executes here; the returned
     * container describes the filesystem, mounts and metadata as they will be after the run.
     */
    public Container exec(ExecutionContext ctx, List<String> args, ExecOptions opts) {
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException("exec requires at least one argument");
        }
        ctx.ensureNotCancelled();
        var payload = payload();
        var cfg = payload.config();
        var mounts = payload.mounts();
        var options = opts == null ? ExecOptions.NONE : opts;
        var shim = ctx.shim();
        for (ExecOptions.Option option : options.requested()) {
            if (!shim.supportedOptions().contains(option)) {
                throw new NotImplementedException("exec option " + option.field());
            }
        }

        var shimState = shim.build(ctx.platform(), ctx.token());
        var shimArgs = new ArrayList<String>(args.size() + 1);
        shimArgs.add(shim.path());
        shimArgs.addAll(args);

        // run the command through the shim, labelled with the real command
        var run = RunSpec.builder()
            .mount(shim.path(), shimState, shim.path())
            .args(shimArgs)
            .customName(String.join(" ", args))
            .mount(ShimProvider.META_MOUNT, metaSeed(options));
        int firstUserMount = 2;

        if (!cfg.workingDir().isEmpty()) {
            run.dir(cfg.workingDir());
        }
        for (String env : cfg.env()) {
            int eq = env.indexOf('=');
            if (eq < 0) {
                // a bare name is bound to the empty string
                run.env(env, "");
            } else {
                run.env(env.substring(0, eq), env.substring(eq + 1));
            }
        }
        if (options.redirectStdout() != null) {
            run.env(ShimProvider.REDIRECT_STDOUT_ENV, options.redirectStdout());
        }
        if (options.redirectStderr() != null) {
            run.env(ShimProvider.REDIRECT_STDERR_ENV, options.redirectStderr());
        }
        for (ContainerMount mount : mounts) {
            run.mount(mount.target(), mount.sourceState(ctx.engine()), mount.sourcePath());
        }

        ExecState execState = payload.fsState(ctx.engine()).run(run.build());
        var platform = ctx.platform();

        var fs = Marshaling.marshal(ctx, MarshalException.ROOT, execState::root, platform);

        // mounts are stateful: whatever the run wrote to them carries over to the next container
        var propagated = new ArrayList<ContainerMount>(mounts.size());
        for (int i = 0; i < mounts.size(); i++) {
            var mount = mounts.get(i);
            int index = firstUserMount + i;
            var definition = Marshaling.marshal(ctx, mount.target(), () -> execState.mountAt(index), platform);
            propagated.add(mount.withSource(definition));
        }

        var meta = Marshaling.marshal(ctx, MarshalException.META, () -> execState.mountAt(1), platform);

        var result = of(payload.withFs(fs).withMounts(propagated).withMeta(meta));
        log.debug("exec {} -> root {}", execState.op().customName(), fs.digest());
        return result;
    }

    /**
     * Exit code of the last exec. Empty when nothing ran yet or when the shim left no exit code.
     */
    public Optional<Integer> exitCode(ExecutionContext ctx) {
        ctx.ensureNotCancelled();
        var payload = payload();
        if (payload.meta() == null) {
            return Optional.empty();
        }
        var content = ctx.engine().readFile(payload.meta(), EXIT_CODE_FILE, ctx.token());
        if (content.isEmpty()) {
            return Optional.empty();
        }
        String text = new String(content.get(), StandardCharsets.UTF_8).trim();
        try {
            return Optional.of(Integer.parseInt(text, 10));
        } catch (NumberFormatException ex) {
            throw new ExitCodeParseException(text, ex);
        }
    }

    /**
     * A file in the metadata mount of the last exec, or empty when nothing ran yet.
     */
    public Optional<File> metaFile(ExecutionContext ctx, String path) {
        ctx.ensureNotCancelled();
        var payload = payload();
        if (payload.meta() == null) {
            return Optional.empty();
        }
        return Optional.of(File.of(payload.meta(), path));
    }

    public Optional<File> stdout(ExecutionContext ctx) {
        return metaFile(ctx, STDOUT_FILE);
    }

    public Optional<File> stderr(ExecutionContext ctx) {
        return metaFile(ctx, STDERR_FILE);
    }

    private static State metaSeed(ExecOptions options) {
        if (options.stdin() == null) {
            return State.scratch();
        }
        return State.scratch().file(ShimProvider.STDIN_FILE, options.stdin());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Container other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Container{" + (id.isEmpty() ? "scratch" : id) + "}";
    }
}
