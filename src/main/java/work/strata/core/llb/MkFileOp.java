package work.strata.core.llb;

import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a single file on top of a base state.
 */
public final class MkFileOp implements Op {
    public static final String KIND = "mkfile";

    private final State base;
    private final String path;
    private final String data;
    private final int mode;
    private final String key;

    public MkFileOp(State base, String path, String data, int mode) {
        this.base = Objects.requireNonNull(base, "base");
        this.path = Objects.requireNonNull(path, "path");
        this.data = Objects.requireNonNull(data, "data");
        this.mode = mode;
        if (path.isBlank()) {
            throw new IllegalArgumentException("mkfile path must not be blank");
        }
        this.key = NodeKey.of(KIND, attributes(), inputs());
    }

    public static MkFileOp of(State base, String path, byte[] content, int mode) {
        return new MkFileOp(base, path, Base64.getEncoder().encodeToString(content), mode);
    }

    public State base() {
        return base;
    }

    public String path() {
        return path;
    }

    /**
     * Base64 form of the content, as written into definitions.
     */
    public String data() {
        return data;
    }

    public int mode() {
        return mode;
    }

    public byte[] content() {
        return Base64.getDecoder().decode(data);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public List<State> inputs() {
        return List.of(base);
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("path", path, "data", data, "mode", mode);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MkFileOp other)) return false;
        return key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return "MkFileOp[" + path + "]";
    }
}
