package work.strata.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import work.strata.core.error.NotFoundException;
import work.strata.core.id.IdCodec;
import work.strata.core.llb.Definition;
import work.strata.core.runtime.ExecutionContext;
import work.strata.core.shared.PathUtils;

/**
 * A content-addressed file: a lazy filesystem plus the path of one file inside it. Nothing is read
 * until {@link #contents(ExecutionContext)} is called.
 */
public final class File {
    private final String id;

    public File(String id) {
        this.id = id == null ? "" : id;
    }

    public static File of(Definition llb, String path) {
        return new File(IdCodec.encode(new FilePayload(llb, PathUtils.normalize(path))));
    }

    public String id() {
        return id;
    }

    public FilePayload payload() {
        return IdCodec.decode(id, FilePayload.class, FilePayload::scratch);
    }

    public byte[] contents(ExecutionContext ctx) {
        ctx.ensureNotCancelled();
        var payload = payload();
        if (payload.llb() == null) {
            throw new NotFoundException(payload.file());
        }
        return ctx.engine()
            .readFile(payload.llb(), payload.file(), ctx.token())
            .orElseThrow(() -> new NotFoundException(payload.file()));
    }

    public String contentsAsString(ExecutionContext ctx) {
        return new String(contents(ctx), StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof File other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "File{" + id + "}";
    }
}
