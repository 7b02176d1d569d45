package work.strata.core.error;

public final class NotFoundException extends StrataException {
    public NotFoundException(String path) {
        super("not_found", "no such file: " + path, path);
    }
}
