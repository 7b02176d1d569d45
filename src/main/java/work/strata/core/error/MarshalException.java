package work.strata.core.error;

/**
 * A lazy state could not be turned into a graph definition. The stage tells which part of an
 * operation failed: {@code root}, {@code meta}, or the target path of a mount.
 */
public final class MarshalException extends StrataException {
    public static final String ROOT = "root";
    public static final String META = "meta";

    private final String stage;

    public MarshalException(String stage, Throwable cause) {
        super("marshal_error", "marshal " + stage + ": " + describe(cause), stage, cause);
        this.stage = stage;
    }

    public String stage() {
        return stage;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown failure";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
