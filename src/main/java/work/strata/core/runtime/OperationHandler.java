package work.strata.core.runtime;

import java.util.Map;

/**
 * A named operation registered in the {@link Registry}.
 */
@FunctionalInterface
public interface OperationHandler {
    Object invoke(ExecutionContext ctx, Map<String, Object> input) throws Exception;
}
