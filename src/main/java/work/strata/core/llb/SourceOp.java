package work.strata.core.llb;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Leaf node pulling content from outside the graph, identified by a scheme-prefixed identifier such
 * as {@code docker-image://docker.io/library/alpine:latest}.
 */
public record SourceOp(String identifier) implements Op {
    public static final String KIND = "source";
    public static final String IMAGE_SCHEME = "docker-image://";

    public SourceOp {
        Objects.requireNonNull(identifier, "identifier");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("source identifier must not be blank");
        }
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public List<State> inputs() {
        return List.of();
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("identifier", identifier);
    }

    @Override
    public String key() {
        return NodeKey.of(KIND, attributes(), List.of());
    }

    public boolean hasScheme(String scheme) {
        return identifier.startsWith(scheme);
    }

    public String withoutScheme(String scheme) {
        return identifier.substring(scheme.length());
    }
}
