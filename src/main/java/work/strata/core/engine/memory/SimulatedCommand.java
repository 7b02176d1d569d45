package work.strata.core.engine.memory;

/**
 * A program the in-memory engine can run. Implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface SimulatedCommand {
    /**
     * @return the exit code
     */
    int run(SimulatedProcess process);
}
