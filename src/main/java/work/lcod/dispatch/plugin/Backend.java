package work.lcod.dispatch.plugin;

import java.util.List;
import java.util.Optional;
import work.lcod.dispatch.convert.ConversionRequest;
import work.lcod.dispatch.runtime.Algorithm;
import work.lcod.dispatch.tooling.ConformanceCase;

/**
 * Pluggable implementation of a set of algorithms working on its own graph representation.
 */
public interface Backend {
    /**
     * Name the backend registers under; graphs it owns report the same name.
     */
    String name();

    /**
     * Implementation of the algorithm registered under {@code algorithm}, if this backend has one.
     */
    Optional<Algorithm> algorithm(String algorithm);

    Object convertFromNative(Object graph, ConversionRequest request);

    Object convertToNative(Object result, String algorithm);

    /**
     * Called with every discovered conformance case before a conversion-forcing run so the backend
     * can mark known gaps as expected failures.
     */
    default void onStartTests(List<ConformanceCase> cases) {
    }
}
