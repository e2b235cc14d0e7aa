package work.lcod.dispatch.runtime;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.dispatch.convert.ConversionRequest;
import work.lcod.dispatch.errors.ExpectedFailureException;
import work.lcod.dispatch.errors.NotImplementedByBackendException;
import work.lcod.dispatch.errors.RegistrationException;
import work.lcod.dispatch.plugin.Backend;
import work.lcod.dispatch.plugin.BackendNames;

/**
 * Conversion-forcing mode of a {@link DispatchableAlgorithm}: converts graph inputs into the test
 * backend, runs its implementation and converts the result back. Lets native test suites run
 * unchanged against a backend.
 */
final class ConversionHarness {
    private static final Logger log = LoggerFactory.getLogger(ConversionHarness.class);

    private final DispatchableAlgorithm algorithm;

    ConversionHarness(DispatchableAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    Object call(String backendName, BackendOptions options) throws Exception {
        String name = algorithm.name();
        BoundArguments bound = algorithm.signature().bind(name, options.remaining());
        for (String graphName : algorithm.graphs().names()) {
            if (!bound.contains(graphName)) {
                throw new RegistrationException(name + "() invalid graph name: " + graphName);
            }
        }

        Backend backend = algorithm.context().plugins().load(backendName);
        Optional<Algorithm> implementation = backend.algorithm(name);
        if (implementation.isEmpty()) {
            if (BackendNames.REFERENCE.equals(backendName)) {
                throw new NotImplementedByBackendException(
                    name,
                    backendName,
                    "'" + name + "' not found in " + backend.getClass().getSimpleName()
                );
            }
            throw new ExpectedFailureException(name, backendName);
        }

        ConversionRequest request = algorithm.conversions().plan(name, bound);
        for (String graphName : algorithm.graphs().names()) {
            Object graph = bound.get(graphName);
            if (graph != null) {
                bound.replace(graphName, backend.convertFromNative(graph, request));
            }
        }
        log.debug("{}: harness run on '{}' (edges={}, nodes={})", name, backendName, request.edgeAttrs(), request.nodeAttrs());
        Object result = implementation.get().invoke(options.applyTo(backendName, bound));
        return backend.convertToNative(result, name);
    }
}
