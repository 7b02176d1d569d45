package work.strata.core.schema;

import java.util.Map;
import work.strata.core.model.File;
import work.strata.core.runtime.ExecutionContext;
import work.strata.core.runtime.Registry;

public final class FileSchema {
    private FileSchema() {}

    public static Registry register(Registry registry) {
        registry.register("strata://file/contents@1", FileSchema::contents);
        return registry;
    }

    private static Object contents(ExecutionContext ctx, Map<String, Object> input) {
        return Results.value(new File(Inputs.id(input)).contentsAsString(ctx));
    }
}
