package work.strata.core.error;

/**
 * A payload holds data that cannot be serialized into an identity.
 */
public final class EncodingException extends StrataException {
    public EncodingException(String message, Throwable cause) {
        super("encoding_error", message, null, cause);
    }
}
