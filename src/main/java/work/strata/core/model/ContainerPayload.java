package work.strata.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import work.strata.core.engine.GraphEngine;
import work.strata.core.llb.Definition;
import work.strata.core.llb.State;

/**
 * Decoded content of a container identity.
 *
 * @param fs root filesystem, {@code null} for the empty filesystem
 * @param config image configuration (env, workdir, entrypoint, ...)
 * @param mounts mounts in the order they were added
 * @param meta the metadata mount of the last exec, {@code null} until something ran
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ContainerPayload(
    @JsonProperty("fs") Definition fs,
    @JsonProperty("cfg") ImageConfig config,
    @JsonProperty("mounts") List<ContainerMount> mounts,
    @JsonProperty("meta") Definition meta
) {
    private static final ContainerPayload SCRATCH = new ContainerPayload(null, ImageConfig.EMPTY, List.of(), null);

    public ContainerPayload {
        // the empty filesystem has a single encoding
        fs = fs == null || fs.isEmpty() ? null : fs;
        meta = meta == null || meta.isEmpty() ? null : meta;
        config = config == null ? ImageConfig.EMPTY : config;
        mounts = mounts == null ? List.of() : List.copyOf(mounts);
    }

    public static ContainerPayload scratch() {
        return SCRATCH;
    }

    public State fsState(GraphEngine engine) {
        return fs == null ? State.scratch() : engine.evaluate(fs);
    }

    public ContainerPayload withFs(Definition value) {
        return new ContainerPayload(value, config, mounts, meta);
    }

    public ContainerPayload withConfig(ImageConfig value) {
        return new ContainerPayload(fs, value, mounts, meta);
    }

    public ContainerPayload withMount(ContainerMount mount) {
        var updated = new ArrayList<ContainerMount>(mounts);
        updated.add(mount);
        return new ContainerPayload(fs, config, updated, meta);
    }

    public ContainerPayload withMounts(List<ContainerMount> value) {
        return new ContainerPayload(fs, config, value, meta);
    }

    public ContainerPayload withMeta(Definition value) {
        return new ContainerPayload(fs, config, mounts, value);
    }
}
