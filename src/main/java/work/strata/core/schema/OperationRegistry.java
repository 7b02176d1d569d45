package work.strata.core.schema;

import work.strata.core.runtime.Registry;

/**
 * Shared registry bootstrap so the CLI, the embedding API and tests see the same operation table.
 */
public final class OperationRegistry {
    private OperationRegistry() {}

    public static Registry create() {
        var registry = new Registry();
        ContainerSchema.register(registry);
        DirectorySchema.register(registry);
        FileSchema.register(registry);
        return registry;
    }
}
