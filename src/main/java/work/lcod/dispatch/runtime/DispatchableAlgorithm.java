package work.lcod.dispatch.runtime;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.dispatch.config.DispatchConfig;
import work.lcod.dispatch.convert.ConversionRequest;
import work.lcod.dispatch.convert.ConversionSpec;
import work.lcod.dispatch.errors.ArgumentResolutionException;
import work.lcod.dispatch.errors.BackendMismatchException;
import work.lcod.dispatch.errors.NotImplementedByBackendException;
import work.lcod.dispatch.plugin.Backend;
import work.lcod.dispatch.plugin.BackendGraph;
import work.lcod.dispatch.plugin.BackendNames;
import work.lcod.dispatch.plugin.CachesConversions;

/**
 * Wraps a native algorithm and decides on each call where it runs.
 *
 * <p>Selection order: the {@code backend} keyword, the configured {@code backend}, backend tags on
 * the graph arguments, the configured priority list, then the native body. When
 * {@code test_backend} is configured every call goes through the {@link ConversionHarness}.</p>
 *
 * <p>{@code <backend>_kwargs} keywords carry extra options for one backend only; they are added to
 * the call when that backend runs it and dropped otherwise.</p>
 */
public final class DispatchableAlgorithm implements Algorithm {
    /** Reserved keyword naming the backend a caller wants. Never forwarded. */
    public static final String BACKEND_KEYWORD = "backend";

    private static final Logger log = LoggerFactory.getLogger(DispatchableAlgorithm.class);

    private final DispatchContext context;
    private final Algorithm nativeAlgorithm;
    private final Signature signature;
    private final GraphArgumentSpec graphs;
    private final ConversionSpec conversions;
    private final ConversionHarness harness;
    private String name;

    DispatchableAlgorithm(
        DispatchContext context,
        String name,
        Algorithm nativeAlgorithm,
        Signature signature,
        GraphArgumentSpec graphs,
        ConversionSpec conversions
    ) {
        this.context = Objects.requireNonNull(context, "context");
        this.name = Objects.requireNonNull(name, "name");
        this.nativeAlgorithm = Objects.requireNonNull(nativeAlgorithm, "nativeAlgorithm");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.graphs = Objects.requireNonNull(graphs, "graphs");
        this.conversions = Objects.requireNonNull(conversions, "conversions");
        this.harness = new ConversionHarness(this);
    }

    void attachName(String registeredName) {
        this.name = registeredName;
    }

    public String name() {
        return name;
    }

    public Algorithm nativeAlgorithm() {
        return nativeAlgorithm;
    }

    public Signature signature() {
        return signature;
    }

    public GraphArgumentSpec graphs() {
        return graphs;
    }

    public ConversionSpec conversions() {
        return conversions;
    }

    DispatchContext context() {
        return context;
    }

    @Override
    public Object invoke(CallArguments arguments) throws Exception {
        return call(arguments);
    }

    public Object call(CallArguments arguments) throws Exception {
        DispatchConfig config = context.config();
        BackendOptions options = BackendOptions.extract(name, signature, arguments.without(BACKEND_KEYWORD));
        String testBackend = config.testBackend();
        if (testBackend != null) {
            return harness.call(testBackend, options);
        }

        String requested = requestedBackend(arguments);
        CallArguments forwarded = options.remaining();
        if (requested == null) {
            requested = config.backend();
        }

        Map<String, Object> resolved = graphs.resolve(name, forwarded);
        Set<String> tags = backendTags(resolved);
        if (tags.size() > 1) {
            throw new BackendMismatchException(
                name + "() graphs must all be from the same backend, found " + tags,
                tags
            );
        }

        if (requested != null) {
            if (BackendNames.isNative(requested)) {
                if (!tags.isEmpty()) {
                    throw mismatch(tags, requested);
                }
                log.debug("{}: native implementation requested", name);
                return nativeAlgorithm.invoke(forwarded);
            }
            if (!tags.isEmpty() && !tags.contains(requested)) {
                throw mismatch(tags, requested);
            }
            // graphs already owned by the requested backend pass through; the rest are converted
            return runConverted(requested, forwarded, options);
        }

        if (tags.size() == 1) {
            return forwardTagged(tags.iterator().next(), forwarded, options);
        }

        for (String candidate : config.backendPriority().forAlgorithm(name)) {
            if (BackendNames.isNative(candidate)) {
                break;
            }
            Backend backend = context.plugins().load(candidate);
            if (backend.algorithm(name).isPresent()) {
                log.debug("{}: dispatching to '{}' from backend priority", name, candidate);
                return runConverted(candidate, forwarded, options);
            }
        }
        return nativeAlgorithm.invoke(forwarded);
    }

    private String requestedBackend(CallArguments arguments) {
        if (!arguments.hasKeyword(BACKEND_KEYWORD)) {
            return null;
        }
        Object value = arguments.keyword(BACKEND_KEYWORD);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String backend)) {
            throw new ArgumentResolutionException(name + "() 'backend' must be a backend name, got " + value);
        }
        return backend;
    }

    private static Set<String> backendTags(Map<String, Object> resolved) {
        Set<String> tags = new TreeSet<>();
        for (Object graph : resolved.values()) {
            if (graph instanceof BackendGraph tagged && !BackendNames.isNative(tagged.backendName())) {
                tags.add(tagged.backendName());
            }
        }
        return tags;
    }

    private BackendMismatchException mismatch(Set<String> tags, String requested) {
        Set<String> all = new TreeSet<>(tags);
        all.add(requested);
        return new BackendMismatchException(
            name + "() was asked to run on '" + requested + "' but received graphs from " + tags,
            all
        );
    }

    private Object forwardTagged(String backendName, CallArguments arguments, BackendOptions options)
        throws Exception {
        log.debug("{}: forwarding to '{}' for tagged graphs", name, backendName);
        return implementation(backendName).invoke(options.applyTo(backendName, signature, arguments));
    }

    Algorithm implementation(String backendName) {
        Backend backend = context.plugins().load(backendName);
        return backend.algorithm(name)
            .orElseThrow(() -> new NotImplementedByBackendException(
                name,
                backendName,
                "'" + name + "' not implemented by " + backendName
            ));
    }

    private Object runConverted(String backendName, CallArguments arguments, BackendOptions options)
        throws Exception {
        Backend backend = context.plugins().load(backendName);
        Algorithm implementation = implementation(backendName);
        BoundArguments bound = signature.bind(name, arguments);
        ConversionRequest request = conversions.plan(name, bound);
        for (String graphName : graphs.names()) {
            Object graph = bound.get(graphName);
            if (graph == null || ownedBy(graph, backendName)) {
                continue;
            }
            bound.replace(graphName, convert(backend, graph, request));
        }
        log.debug("{}: running on '{}' with converted graphs", name, backendName);
        return implementation.invoke(options.applyTo(backendName, bound));
    }

    private static boolean ownedBy(Object graph, String backendName) {
        return graph instanceof BackendGraph tagged && backendName.equals(tagged.backendName());
    }

    private Object convert(Backend backend, Object graph, ConversionRequest request) {
        DispatchConfig config = context.config();
        if (!config.cacheConvertedGraphs() || !(graph instanceof CachesConversions caching)) {
            return backend.convertFromNative(graph, request);
        }
        ConversionRequest.CacheKey key = request.cacheKey(backend.name());
        Map<Object, Object> cache = caching.conversionCache();
        Object cached = cache.get(key);
        if (cached != null) {
            if (config.warningEnabled(DispatchConfig.CACHE_WARNING)) {
                log.warn(
                    "{}: using cached '{}' graph; the cache is stale if the input graph was mutated without clearing it",
                    name,
                    backend.name()
                );
            }
            return cached;
        }
        Object converted = backend.convertFromNative(graph, request);
        cache.put(key, converted);
        return converted;
    }

    @Override
    public String toString() {
        return "DispatchableAlgorithm[" + name + "]";
    }
}
