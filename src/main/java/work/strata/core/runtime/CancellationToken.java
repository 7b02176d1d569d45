package work.strata.core.runtime;

import java.time.Duration;
import java.time.Instant;
import work.strata.core.error.OperationCancelledException;

/**
 * Cooperative cancellation shared by an execution context and every engine call made on its behalf.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;
    private final Instant deadline;

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(Instant deadline) {
        this.deadline = deadline;
    }

    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return new CancellationToken();
        }
        return new CancellationToken(Instant.now().plus(timeout));
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (deadline != null && Instant.now().isAfter(deadline));
    }

    public void ensureNotCancelled() {
        if (cancelled) {
            throw new OperationCancelledException("Execution cancelled");
        }
        if (deadline != null && Instant.now().isAfter(deadline)) {
            throw new OperationCancelledException("Execution deadline exceeded");
        }
    }
}
