package work.strata.core.cli;

import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.strata.core.id.IdCodec;
import work.strata.core.model.Container;
import work.strata.core.model.Directory;
import work.strata.core.model.File;

/**
 * Decodes an opaque identity and prints its payload.
 */
@CommandLine.Command(
    name = "inspect",
    description = "Decode a container, directory or file id and print its payload as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class InspectCommand implements Callable<Integer> {
    enum Kind { CONTAINER, DIRECTORY, FILE }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-t", "--type"},
        description = "Payload type: ${COMPLETION-CANDIDATES}.",
        defaultValue = "container",
        converter = KindConverter.class
    )
    private Kind kind = Kind.CONTAINER;

    @CommandLine.Parameters(index = "0", paramLabel = "ID", description = "Opaque identity; empty for scratch.", arity = "0..1")
    private String id = "";

    @Override
    public Integer call() {
        Object payload;
        switch (kind) {
            case DIRECTORY:
                payload = new Directory(id).payload();
                break;
            case FILE:
                payload = new File(id).payload();
                break;
            default:
                payload = new Container(id).payload();
                break;
        }
        spec.commandLine().getOut().println(IdCodec.describe(payload));
        spec.commandLine().getOut().flush();
        return 0;
    }

    static final class KindConverter implements CommandLine.ITypeConverter<Kind> {
        @Override
        public Kind convert(String value) {
            return Kind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
