package work.strata.core.error;

/**
 * The operation (or option) is part of the surface but has no implementation yet.
 */
public final class NotImplementedException extends StrataException {
    public NotImplementedException(String what) {
        super("not_implemented", "not implemented yet: " + what, what);
    }
}
