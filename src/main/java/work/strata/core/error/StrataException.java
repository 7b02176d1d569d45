package work.strata.core.error;

/**
 * Base failure of every container, directory and file operation. Carries a stable error code (and
 * optional structured data) so callers can branch on the kind of failure without parsing messages.
 */
public class StrataException extends RuntimeException {
    private final String code;
    private final Object data;

    public StrataException(String code, String message, Object data) {
        this(code, message, data, null);
    }

    public StrataException(String code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
