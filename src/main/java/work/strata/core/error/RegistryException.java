package work.strata.core.error;

/**
 * The image configuration could not be fetched for a reference.
 */
public final class RegistryException extends StrataException {
    public RegistryException(String reference, String message, Throwable cause) {
        super("registry_error", message, reference, cause);
    }

    public RegistryException(String reference, String message) {
        this(reference, message, null);
    }
}
