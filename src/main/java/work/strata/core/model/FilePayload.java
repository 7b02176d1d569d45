package work.strata.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import work.strata.core.llb.Definition;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record FilePayload(@JsonProperty("llb") Definition llb, @JsonProperty("file") String file) {
    private static final FilePayload SCRATCH = new FilePayload(null, "");

    public FilePayload {
        file = file == null ? "" : file;
    }

    public static FilePayload scratch() {
        return SCRATCH;
    }
}
