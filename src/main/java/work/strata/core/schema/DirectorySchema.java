package work.strata.core.schema;

import java.util.Map;
import work.strata.core.model.Directory;
import work.strata.core.runtime.ExecutionContext;
import work.strata.core.runtime.Registry;

public final class DirectorySchema {
    private DirectorySchema() {}

    public static Registry register(Registry registry) {
        registry.register("strata://directory/file@1", DirectorySchema::file);
        return registry;
    }

    private static Object file(ExecutionContext ctx, Map<String, Object> input) {
        var directory = new Directory(Inputs.id(input));
        return Results.id(directory.file(Inputs.required(input, "path")).id());
    }
}
