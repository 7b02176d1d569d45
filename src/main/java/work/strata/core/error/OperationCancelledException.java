package work.strata.core.error;

/**
 * The execution context was cancelled or its deadline passed while an operation was running.
 */
public final class OperationCancelledException extends StrataException {
    public OperationCancelledException(String message) {
        super("cancelled", message, null);
    }
}
