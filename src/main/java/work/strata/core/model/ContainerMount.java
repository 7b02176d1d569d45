package work.strata.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import work.strata.core.engine.GraphEngine;
import work.strata.core.llb.Definition;
import work.strata.core.llb.State;

/**
 * A mount point configured in a container.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ContainerMount(
    @JsonProperty("source") Definition source,
    @JsonProperty("source_path") String sourcePath,
    @JsonProperty("target") String target
) {
    public ContainerMount {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        sourcePath = sourcePath == null ? "" : sourcePath;
    }

    public State sourceState(GraphEngine engine) {
        return engine.evaluate(source);
    }

    public ContainerMount withSource(Definition value) {
        return new ContainerMount(value, sourcePath, target);
    }
}
