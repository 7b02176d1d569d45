package work.strata.core.model;

import java.util.Objects;
import work.strata.core.id.IdCodec;
import work.strata.core.llb.Definition;
import work.strata.core.llb.State;
import work.strata.core.runtime.ExecutionContext;
import work.strata.core.shared.PathUtils;

/**
 * A content-addressed directory: a lazy filesystem plus a path inside it.
 */
public final class Directory {
    private final String id;

    public Directory(String id) {
        this.id = id == null ? "" : id;
    }

    public static Directory of(Definition llb, String dir) {
        return new Directory(IdCodec.encode(new DirectoryPayload(llb, PathUtils.normalize(dir))));
    }

    /**
     * Marshals {@code state} (engine default platform) and wraps it as a directory.
     */
    public static Directory fromState(ExecutionContext ctx, State state, String dir) {
        return of(Marshaling.marshal(ctx, "directory", () -> state, null), dir);
    }

    public String id() {
        return id;
    }

    public DirectoryPayload payload() {
        return IdCodec.decode(id, DirectoryPayload.class, DirectoryPayload::scratch);
    }

    public State state(ExecutionContext ctx) {
        return payload().state(ctx.engine());
    }

    public File file(String path) {
        var payload = payload();
        return File.of(payload.llb(), PathUtils.join(payload.dir(), path));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Directory other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Directory{" + id + "}";
    }
}
