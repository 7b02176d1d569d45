package work.strata.core.engine;

import java.util.Optional;
import work.strata.core.llb.Definition;
import work.strata.core.llb.Platform;
import work.strata.core.llb.State;
import work.strata.core.runtime.CancellationToken;

/**
 * Capabilities the container core consumes from the build-graph engine. Implementations are shared
 * by every concurrent operation and must be safe for concurrent use.
 */
public interface GraphEngine {
    /**
     * Turns a lazy state into a content-addressed graph definition.
     *
     * @param platform target platform, or {@code null} for the engine default
     */
    Definition marshal(State state, Platform platform, CancellationToken token);

    /**
     * Turns a definition back into a lazy state that can be composed further.
     */
    State evaluate(Definition definition);

    /**
     * Fetches the raw image configuration document for a normalized reference.
     */
    byte[] resolveImageConfig(String reference, Platform platform, CancellationToken token);

    /**
     * Evaluates the definition and reads one file from the result, or returns empty when the path
     * does not exist.
     */
    Optional<byte[]> readFile(Definition definition, String path, CancellationToken token);
}
