package work.strata.core.schema;

import java.util.List;
import java.util.Map;
import work.strata.core.model.Container;
import work.strata.core.model.Directory;
import work.strata.core.model.ExecOptions;
import work.strata.core.model.File;
import work.strata.core.runtime.ExecutionContext;
import work.strata.core.runtime.Registry;

/**
 * Container operations. Every operation takes the container {@code id} and returns either the
 * derived container ({@code {"id": ...}}) or a scalar ({@code {"value": ...}}).
 */
public final class ContainerSchema {
    public static final String PREFIX = "strata://container/";

    private ContainerSchema() {}

    public static Registry register(Registry registry) {
        registry.register("strata://query/container@1", ContainerSchema::query);
        registry.register(op("from"), ContainerSchema::from);
        registry.register(op("rootfs"), ContainerSchema::rootfs);
        registry.register(op("workdir"), ContainerSchema::workdir);
        registry.register(op("withWorkdir"), ContainerSchema::withWorkdir);
        registry.register(op("variables"), ContainerSchema::variables);
        registry.register(op("variable"), ContainerSchema::variable);
        registry.register(op("withVariable"), ContainerSchema::withVariable);
        registry.register(op("withoutVariable"), ContainerSchema::withoutVariable);
        registry.register(op("user"), ContainerSchema::user);
        registry.register(op("withUser"), ContainerSchema::withUser);
        registry.register(op("entrypoint"), ContainerSchema::entrypoint);
        registry.register(op("withEntrypoint"), ContainerSchema::withEntrypoint);
        registry.register(op("mounts"), ContainerSchema::mounts);
        registry.register(op("withMountedDirectory"), ContainerSchema::withMountedDirectory);
        registry.register(op("exec"), ContainerSchema::exec);
        registry.register(op("exitCode"), ContainerSchema::exitCode);
        registry.register(op("stdout"), ContainerSchema::stdout);
        registry.register(op("stderr"), ContainerSchema::stderr);

        for (String name : List.of(
            "withMountedFile",
            "withMountedTemp",
            "withMountedCache",
            "withMountedSecret",
            "withSecretVariable",
            "withoutMount",
            "directory",
            "publish"
        )) {
            registry.registerUnimplemented(op(name));
        }
        return registry;
    }

    public static String op(String name) {
        return PREFIX + name + "@1";
    }

    private static Container containerOf(Map<String, Object> input) {
        return new Container(Inputs.id(input));
    }

    private static Object query(ExecutionContext ctx, Map<String, Object> input) {
        var container = containerOf(input);
        // fail fast on ids that do not decode
        container.payload();
        return Results.id(container.id());
    }

    private static Object from(ExecutionContext ctx, Map<String, Object> input) {
        String address = Inputs.required(input, "address");
        return Results.id(containerOf(input).from(ctx, address).id());
    }

    private static Object rootfs(ExecutionContext ctx, Map<String, Object> input) {
        return Results.id(containerOf(input).filesystem(ctx).id());
    }

    private static Object workdir(ExecutionContext ctx, Map<String, Object> input) {
        return Results.value(containerOf(input).imageConfig().workingDir());
    }

    private static Object withWorkdir(ExecutionContext ctx, Map<String, Object> input) {
        String path = Inputs.required(input, "path");
        return Results.id(containerOf(input).updateImageConfig(cfg -> cfg.withWorkingDir(path)).id());
    }

    private static Object variables(ExecutionContext ctx, Map<String, Object> input) {
        return Results.value(containerOf(input).imageConfig().env());
    }

    private static Object variable(ExecutionContext ctx, Map<String, Object> input) {
        String name = Inputs.required(input, "name");
        return Results.value(containerOf(input).imageConfig().variable(name).orElse(null));
    }

    private static Object withVariable(ExecutionContext ctx, Map<String, Object> input) {
        String name = Inputs.required(input, "name");
        String value = Inputs.required(input, "value");
        return Results.id(containerOf(input).updateImageConfig(cfg -> cfg.withVariable(name, value)).id());
    }

    private static Object withoutVariable(ExecutionContext ctx, Map<String, Object> input) {
        String name = Inputs.required(input, "name");
        return Results.id(containerOf(input).updateImageConfig(cfg -> cfg.withoutVariable(name)).id());
    }

    private static Object user(ExecutionContext ctx, Map<String, Object> input) {
        return Results.value(containerOf(input).imageConfig().user());
    }

    private static Object withUser(ExecutionContext ctx, Map<String, Object> input) {
        String name = Inputs.required(input, "name");
        return Results.id(containerOf(input).updateImageConfig(cfg -> cfg.withUser(name)).id());
    }

    private static Object entrypoint(ExecutionContext ctx, Map<String, Object> input) {
        return Results.value(containerOf(input).imageConfig().entrypoint());
    }

    private static Object withEntrypoint(ExecutionContext ctx, Map<String, Object> input) {
        List<String> args = Inputs.strings(input, "args");
        return Results.id(containerOf(input).updateImageConfig(cfg -> cfg.withEntrypoint(args)).id());
    }

    private static Object mounts(ExecutionContext ctx, Map<String, Object> input) {
        return Results.value(containerOf(input).mounts());
    }

    private static Object withMountedDirectory(ExecutionContext ctx, Map<String, Object> input) {
        String path = Inputs.required(input, "path");
        var source = new Directory(Inputs.optionalString(input, "source"));
        return Results.id(containerOf(input).withMountedDirectory(ctx, path, source).id());
    }

    private static Object exec(ExecutionContext ctx, Map<String, Object> input) {
        List<String> args = Inputs.strings(input, "args");
        var opts = Inputs.object(input, "opts");
        var options = new ExecOptions(
            Inputs.optionalString(opts, "stdin"),
            Inputs.optionalString(opts, "redirectStdout"),
            Inputs.optionalString(opts, "redirectStderr")
        );
        return Results.id(containerOf(input).exec(ctx, args, options).id());
    }

    private static Object exitCode(ExecutionContext ctx, Map<String, Object> input) {
        return Results.value(containerOf(input).exitCode(ctx).orElse(null));
    }

    private static Object stdout(ExecutionContext ctx, Map<String, Object> input) {
        return Results.id(containerOf(input).stdout(ctx).map(File::id).orElse(null));
    }

    private static Object stderr(ExecutionContext ctx, Map<String, Object> input) {
        return Results.id(containerOf(input).stderr(ctx).map(File::id).orElse(null));
    }
}
