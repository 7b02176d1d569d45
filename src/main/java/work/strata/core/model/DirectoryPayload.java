package work.strata.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import work.strata.core.engine.GraphEngine;
import work.strata.core.llb.Definition;
import work.strata.core.llb.State;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record DirectoryPayload(@JsonProperty("llb") Definition llb, @JsonProperty("dir") String dir) {
    private static final DirectoryPayload SCRATCH = new DirectoryPayload(null, "");

    public DirectoryPayload {
        dir = dir == null ? "" : dir;
    }

    public static DirectoryPayload scratch() {
        return SCRATCH;
    }

    public State state(GraphEngine engine) {
        return llb == null ? State.scratch() : engine.evaluate(llb);
    }
}
