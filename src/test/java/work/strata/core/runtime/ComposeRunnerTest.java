package work.strata.core.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.strata.core.error.OperationCancelledException;
import work.strata.core.support.StrataTestSupport;

class ComposeRunnerTest {
    private static ExecutionContext context(Registry registry) {
        var engine = StrataTestSupport.engine();
        return new ExecutionContext(registry, engine, engine.shim(), null);
    }

    @Test
    void runsSimpleStepAndStoresOutput() throws Exception {
        var registry = new Registry();
        registry.register("demo.echo", (ctx, input) -> Map.of("value", input.get("value")));
        var ctx = context(registry);

        var step = new LinkedHashMap<String, Object>();
        step.put("call", "demo.echo");
        step.put("in", Map.of("value", 42));
        step.put("out", Map.of("answer", "value"));

        var finalState = ComposeRunner.runSteps(ctx, List.of(step), new LinkedHashMap<>());
        assertEquals(42, finalState.get("answer"));
    }

    @Test
    void resolvesStatePathsInInputs() throws Exception {
        var registry = new Registry();
        registry.register("demo.set", (ctx, input) -> Map.of("value", input.get("value")));
        var ctx = context(registry);

        var firstStep = new LinkedHashMap<String, Object>();
        firstStep.put("call", "demo.set");
        firstStep.put("in", Map.of("value", List.of(7, 8)));
        firstStep.put("out", Map.of("counts", "value"));

        var secondStep = new LinkedHashMap<String, Object>();
        secondStep.put("call", "demo.set");
        secondStep.put("in", Map.of("value", "$.counts.1"));
        secondStep.put("out", Map.of("copy", "value", "whole", "$"));

        var finalState = ComposeRunner.runSteps(ctx, List.of(firstStep, secondStep), Map.of());
        assertEquals(8, finalState.get("copy"));
        assertEquals(Map.of("value", 8), finalState.get("whole"));
        assertTrue(finalState.containsKey("counts"));
    }

    @Test
    void stepsWithoutCallAreRejected() {
        var ctx = context(new Registry());
        Map<String, Object> step = Map.of("in", Map.of());
        assertThrows(IllegalArgumentException.class, () -> ComposeRunner.runSteps(ctx, List.of(step), Map.of()));
    }

    @Test
    void cancelledContextsRunNothing() {
        var registry = new Registry();
        registry.register("demo.echo", (ctx, input) -> Map.of());
        var ctx = context(registry);
        ctx.cancel();

        Map<String, Object> step = Map.of("call", "demo.echo");
        assertThrows(OperationCancelledException.class, () -> ComposeRunner.runSteps(ctx, List.of(step), Map.of()));
    }
}
