package work.lcod.dispatch.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.dispatch.errors.ConfigValidationException;
import work.lcod.dispatch.plugin.BackendNames;
import work.lcod.dispatch.plugin.PluginRegistry;
import work.lcod.dispatch.runtime.AlgorithmRegistry;

/**
 * Ordered backend names tried when a call names no backend. {@code algos} applies to every
 * algorithm; a key named after a registered algorithm overrides it for that algorithm.
 */
public final class BackendPriorities extends FlexibleConfig {
    public static final String ALGOS = "algos";

    private final PluginRegistry plugins;
    private final AlgorithmRegistry algorithms;

    public BackendPriorities(PluginRegistry plugins, AlgorithmRegistry algorithms, Map<String, ?> initial) {
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.algorithms = Objects.requireNonNull(algorithms, "algorithms");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(ALGOS, List.of());
        if (initial != null) {
            values.putAll(initial);
        }
        load(values);
    }

    public static BackendPriorities empty(PluginRegistry plugins, AlgorithmRegistry algorithms) {
        return new BackendPriorities(plugins, algorithms, Map.of());
    }

    @Override
    protected Object onSet(String key, Object value) {
        if (!ALGOS.equals(key) && !algorithms.contains(key)) {
            throw invalidName(key);
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigValidationException(key, "'" + key + "' config must be a list of backend names; got " + value);
        }
        List<String> names = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof String name)) {
                throw new ConfigValidationException(key, "'" + key + "' config must be a list of backend names; got " + value);
            }
            if (!BackendNames.NATIVE.equals(name) && !plugins.has(name)) {
                unknown.add("'" + name + "'");
            }
            names.add(name);
        }
        if (!unknown.isEmpty()) {
            unknown.sort(null);
            throw new ConfigValidationException(key, "Unknown backend when setting '" + key + "': " + String.join(", ", unknown));
        }
        return List.copyOf(names);
    }

    @Override
    protected void onRemove(String key) {
        if (ALGOS.equals(key)) {
            throw new ConfigValidationException(key, "'" + key + "' configuration item can't be deleted.");
        }
    }

    public List<String> algos() {
        return names(get(ALGOS, List.of()));
    }

    /**
     * Priority list for {@code algorithm}: its own entry when present, otherwise {@link #ALGOS}.
     */
    public List<String> forAlgorithm(String algorithm) {
        Object specific = get(algorithm, null);
        if (!ALGOS.equals(algorithm) && specific instanceof List<?>) {
            return names(specific);
        }
        return algos();
    }

    private static List<String> names(Object stored) {
        List<String> names = new ArrayList<>();
        for (Object name : (List<?>) stored) {
            names.add((String) name);
        }
        return List.copyOf(names);
    }

    @Override
    public Config reconstruct(Map<String, Object> exported) {
        return new BackendPriorities(plugins, algorithms, exported);
    }
}
