package work.strata.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Execution parameters of an image, using the OCI image-spec field names. Empty fields are left out
 * of the encoding so that an unset field and an empty one share one identity.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ImageConfig(
    @JsonProperty("User") String user,
    @JsonProperty("ExposedPorts") Map<String, Object> exposedPorts,
    @JsonProperty("Env") List<String> env,
    @JsonProperty("Entrypoint") List<String> entrypoint,
    @JsonProperty("Cmd") List<String> cmd,
    @JsonProperty("Volumes") Map<String, Object> volumes,
    @JsonProperty("WorkingDir") String workingDir,
    @JsonProperty("Labels") Map<String, String> labels,
    @JsonProperty("StopSignal") String stopSignal
) {
    public static final ImageConfig EMPTY = new ImageConfig(null, null, null, null, null, null, null, null, null);

    public ImageConfig {
        user = user == null ? "" : user;
        exposedPorts = copy(exposedPorts);
        env = env == null ? List.of() : List.copyOf(env);
        entrypoint = entrypoint == null ? List.of() : List.copyOf(entrypoint);
        cmd = cmd == null ? List.of() : List.copyOf(cmd);
        volumes = copy(volumes);
        workingDir = workingDir == null ? "" : workingDir;
        labels = copy(labels);
        stopSignal = stopSignal == null ? "" : stopSignal;
    }

    public ImageConfig withUser(String value) {
        return new ImageConfig(value, exposedPorts, env, entrypoint, cmd, volumes, workingDir, labels, stopSignal);
    }

    public ImageConfig withEnv(List<String> value) {
        return new ImageConfig(user, exposedPorts, value, entrypoint, cmd, volumes, workingDir, labels, stopSignal);
    }

    public ImageConfig withEntrypoint(List<String> value) {
        return new ImageConfig(user, exposedPorts, env, value, cmd, volumes, workingDir, labels, stopSignal);
    }

    public ImageConfig withWorkingDir(String value) {
        return new ImageConfig(user, exposedPorts, env, entrypoint, cmd, volumes, value, labels, stopSignal);
    }

    /**
     * Drops every binding of {@code name} and appends {@code name=value} at the end, so a name is
     * never bound twice.
     */
    public ImageConfig withVariable(String name, String value) {
        var updated = new ArrayList<String>(withoutVariable(name).env());
        updated.add(name + "=" + (value == null ? "" : value));
        return withEnv(updated);
    }

    public ImageConfig withoutVariable(String name) {
        String prefix = name + "=";
        var updated = new ArrayList<String>(env.size());
        for (String entry : env) {
            if (!entry.startsWith(prefix)) {
                updated.add(entry);
            }
        }
        return withEnv(updated);
    }

    public Optional<String> variable(String name) {
        String prefix = name + "=";
        for (int i = env.size() - 1; i >= 0; i--) {
            if (env.get(i).startsWith(prefix)) {
                return Optional.of(env.get(i).substring(prefix.length()));
            }
        }
        return Optional.empty();
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
