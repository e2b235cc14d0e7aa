package work.lcod.dispatch.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.dispatch.errors.ConfigValidationException;
import work.lcod.dispatch.plugin.PluginRegistry;
import work.lcod.dispatch.runtime.AlgorithmRegistry;

/**
 * Settings the dispatch layer consults on every call.
 *
 * <ul>
 *   <li>{@code backend}: backend used for every call, converting inputs as needed ({@code null} for none).</li>
 *   <li>{@code backend_priority}: {@link BackendPriorities} tried when a call names no backend.</li>
 *   <li>{@code backends}: per-backend configs keyed by backend name.</li>
 *   <li>{@code cache_converted_graphs}: keep converted graphs on inputs that support it.</li>
 *   <li>{@code warnings}: enabled warning categories; only {@code "cache"} is known.</li>
 *   <li>{@code test_backend}: routes every call through the conversion harness for that backend.</li>
 * </ul>
 */
public final class DispatchConfig extends StrictConfig {
    public static final String BACKEND = "backend";
    public static final String BACKEND_PRIORITY = "backend_priority";
    public static final String BACKENDS = "backends";
    public static final String CACHE_CONVERTED_GRAPHS = "cache_converted_graphs";
    public static final String WARNINGS = "warnings";
    public static final String TEST_BACKEND = "test_backend";

    public static final String CACHE_WARNING = "cache";
    static final Set<String> KNOWN_WARNINGS = Set.of(CACHE_WARNING);

    private static final List<String> SCHEMA = List.of(
        BACKEND,
        BACKEND_PRIORITY,
        BACKENDS,
        CACHE_CONVERTED_GRAPHS,
        WARNINGS,
        TEST_BACKEND
    );

    private final PluginRegistry plugins;
    private final AlgorithmRegistry algorithms;

    public DispatchConfig(PluginRegistry plugins, AlgorithmRegistry algorithms, Map<String, ?> values) {
        super(SCHEMA);
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.algorithms = Objects.requireNonNull(algorithms, "algorithms");
        load(values);
    }

    public static DispatchConfig defaults(PluginRegistry plugins, AlgorithmRegistry algorithms) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(BACKEND, null);
        values.put(BACKEND_PRIORITY, BackendPriorities.empty(plugins, algorithms));
        values.put(BACKENDS, new FlexibleConfig());
        values.put(CACHE_CONVERTED_GRAPHS, Boolean.TRUE);
        values.put(WARNINGS, Set.of(CACHE_WARNING));
        values.put(TEST_BACKEND, null);
        return new DispatchConfig(plugins, algorithms, values);
    }

    @Override
    protected Object onSet(String key, Object value) {
        switch (key) {
            case BACKEND, TEST_BACKEND -> {
                if (value != null && !(value instanceof String)) {
                    throw new ConfigValidationException(key, "'" + key + "' config must be a backend name or null; got " + value);
                }
                if (value != null && !plugins.has((String) value)) {
                    throw new ConfigValidationException(key, "Unknown backend when setting '" + key + "': " + value);
                }
                return value;
            }
            case BACKEND_PRIORITY -> {
                if (!(value instanceof BackendPriorities)) {
                    throw new ConfigValidationException(key, "'" + key + "' config must be a BackendPriorities; got " + value);
                }
                return value;
            }
            case BACKENDS -> {
                if (!(value instanceof FlexibleConfig backends)) {
                    throw new ConfigValidationException(key, "'" + key + "' config must be a Config of backend configs; got " + value);
                }
                List<String> unknown = new ArrayList<>();
                for (String name : backends.keys()) {
                    if (!(backends.get(name) instanceof Config)) {
                        throw new ConfigValidationException(key, "'" + key + "' config must be a Config of backend configs; got " + value);
                    }
                    if (!plugins.has(name)) {
                        unknown.add("'" + name + "'");
                    }
                }
                if (!unknown.isEmpty()) {
                    unknown.sort(null);
                    throw new ConfigValidationException(key, "Unknown backend when setting '" + key + "': " + String.join(", ", unknown));
                }
                return value;
            }
            case CACHE_CONVERTED_GRAPHS -> {
                if (!(value instanceof Boolean)) {
                    throw new ConfigValidationException(key, "'" + key + "' config must be true or false; got " + value);
                }
                return value;
            }
            case WARNINGS -> {
                if (!(value instanceof Collection<?> collection)) {
                    throw new ConfigValidationException(key, "'" + key + "' config must be a set of warning names; got " + value);
                }
                Set<String> names = new LinkedHashSet<>();
                List<String> unknown = new ArrayList<>();
                for (Object item : collection) {
                    if (!(item instanceof String name)) {
                        throw new ConfigValidationException(key, "'" + key + "' config must be a set of warning names; got " + value);
                    }
                    if (!KNOWN_WARNINGS.contains(name)) {
                        unknown.add("'" + name + "'");
                    }
                    names.add(name);
                }
                if (!unknown.isEmpty()) {
                    unknown.sort(null);
                    throw new ConfigValidationException(
                        key,
                        "Unknown warning when setting '" + key + "': " + String.join(", ", unknown)
                            + ". Valid entries: " + String.join(", ", KNOWN_WARNINGS)
                    );
                }
                return Collections.unmodifiableSet(names);
            }
            default -> {
                return value;
            }
        }
    }

    public String backend() {
        return (String) get(BACKEND);
    }

    public BackendPriorities backendPriority() {
        return (BackendPriorities) get(BACKEND_PRIORITY);
    }

    public FlexibleConfig backends() {
        return (FlexibleConfig) get(BACKENDS);
    }

    public boolean cacheConvertedGraphs() {
        return Boolean.TRUE.equals(get(CACHE_CONVERTED_GRAPHS));
    }

    public Set<String> warnings() {
        Set<String> names = new LinkedHashSet<>();
        for (Object name : (Collection<?>) get(WARNINGS)) {
            names.add((String) name);
        }
        return Collections.unmodifiableSet(names);
    }

    public boolean warningEnabled(String category) {
        return warnings().contains(category);
    }

    public String testBackend() {
        return (String) get(TEST_BACKEND);
    }

    PluginRegistry plugins() {
        return plugins;
    }

    AlgorithmRegistry algorithms() {
        return algorithms;
    }

    @Override
    public Config reconstruct(Map<String, Object> exported) {
        return new DispatchConfig(plugins, algorithms, exported);
    }
}
