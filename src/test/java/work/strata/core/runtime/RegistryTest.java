package work.strata.core.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.strata.core.error.NotImplementedException;
import work.strata.core.support.StrataTestSupport;

class RegistryTest {
    @Test
    void reservedOperationsFailWhenCalled() {
        var registry = new Registry().registerUnimplemented("strata://demo/later@1");
        var ctx = new ExecutionContext(registry, StrataTestSupport.engine(), StrataTestSupport.engine().shim(), null);

        assertFalse(registry.get("strata://demo/later@1").implemented());
        var ex = assertThrows(NotImplementedException.class, () -> ctx.call("strata://demo/later@1", Map.of()));
        assertEquals("not_implemented", ex.code());
    }

    @Test
    void unregisteredOperationsAreRejected() {
        var ctx = new ExecutionContext(new Registry(), StrataTestSupport.engine(), StrataTestSupport.engine().shim(), null);
        var ex = assertThrows(IllegalStateException.class, () -> ctx.call("strata://demo/missing@1", Map.of()));
        assertTrue(ex.getMessage().contains("strata://demo/missing@1"));
    }

    @Test
    void unregisterRemovesEntries() {
        var registry = new Registry().register("strata://demo/echo@1", (ctx, input) -> input);
        assertTrue(registry.get("strata://demo/echo@1").implemented());

        registry.unregister("strata://demo/echo@1");
        registry.unregister(null);

        assertNull(registry.get("strata://demo/echo@1"));
        assertTrue(registry.entries().isEmpty());
    }
}
