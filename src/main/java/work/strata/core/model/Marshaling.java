package work.strata.core.model;

import java.util.function.Supplier;
import work.strata.core.error.MarshalException;
import work.strata.core.error.OperationCancelledException;
import work.strata.core.llb.Definition;
import work.strata.core.llb.Platform;
import work.strata.core.llb.State;
import work.strata.core.runtime.ExecutionContext;

final class Marshaling {
    private Marshaling() {}

    /**
     * Marshals the state produced by {@code state}, tagging any failure with {@code stage}.
     * Cancellation passes through untouched.
     */
    static Definition marshal(ExecutionContext ctx, String stage, Supplier<State> state, Platform platform) {
        ctx.ensureNotCancelled();
        try {
            return ctx.engine().marshal(state.get(), platform, ctx.token());
        } catch (OperationCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new MarshalException(stage, ex);
        }
    }
}
