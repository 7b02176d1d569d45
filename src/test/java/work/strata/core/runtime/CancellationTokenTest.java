package work.strata.core.runtime;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import work.strata.core.error.OperationCancelledException;

class CancellationTokenTest {
    @Test
    void cancelStopsFurtherWork() {
        var token = new CancellationToken();
        assertDoesNotThrow(token::ensureNotCancelled);

        token.cancel();

        assertTrue(token.isCancelled());
        var ex = assertThrows(OperationCancelledException.class, token::ensureNotCancelled);
        assertEquals("cancelled", ex.code());
    }

    @Test
    void expiredDeadlinesCancel() throws InterruptedException {
        var token = CancellationToken.withTimeout(Duration.ofMillis(1));
        Thread.sleep(20);
        assertTrue(token.isCancelled());
        assertThrows(OperationCancelledException.class, token::ensureNotCancelled);
    }

    @Test
    void zeroTimeoutMeansNoDeadline() {
        assertFalse(CancellationToken.withTimeout(Duration.ZERO).isCancelled());
        assertFalse(CancellationToken.withTimeout(null).isCancelled());
    }
}
