package work.strata.core.error;

/**
 * An identity string (or a marshaled definition) is malformed or corrupt.
 */
public final class DecodingException extends StrataException {
    public DecodingException(String message, Throwable cause) {
        super("decoding_error", message, null, cause);
    }

    public DecodingException(String message) {
        this(message, null);
    }
}
