package work.lcod.dispatch.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.dispatch.errors.ConfigValidationException;
import work.lcod.dispatch.plugin.PluginRegistry;
import work.lcod.dispatch.runtime.AlgorithmRegistry;

/**
 * Builds a {@link DispatchConfig} from defaults, an optional TOML file ({@code [dispatch]} table)
 * and environment variables, later sources winning.
 */
public final class DispatchConfigLoader {
    public static final String ENV_BACKEND = "GRAPH_DISPATCH_BACKEND";
    public static final String ENV_BACKEND_PRIORITY = "GRAPH_DISPATCH_BACKEND_PRIORITY";
    public static final String ENV_CACHE_CONVERTED_GRAPHS = "GRAPH_DISPATCH_CACHE_CONVERTED_GRAPHS";
    public static final String ENV_WARNINGS = "GRAPH_DISPATCH_WARNINGS";
    public static final String ENV_TEST_BACKEND = "GRAPH_DISPATCH_TEST_BACKEND";

    static final String TOML_TABLE = "dispatch";

    private static final Logger log = LoggerFactory.getLogger(DispatchConfigLoader.class);

    private DispatchConfigLoader() {}

    public static DispatchConfig load(
        PluginRegistry plugins,
        AlgorithmRegistry algorithms,
        Path tomlFile,
        Map<String, String> environment
    ) {
        DispatchConfig config = DispatchConfig.defaults(plugins, algorithms);
        if (tomlFile != null) {
            config = merge(config, fromToml(tomlFile));
        }
        return merge(config, fromEnvironment(environment));
    }

    public static DispatchConfig fromSystemEnvironment(PluginRegistry plugins, AlgorithmRegistry algorithms) {
        return load(plugins, algorithms, null, System.getenv());
    }

    /**
     * Plain overrides carried by the environment. Unset variables contribute nothing.
     */
    public static Map<String, Object> fromEnvironment(Map<String, String> environment) {
        Map<String, Object> overrides = new LinkedHashMap<>();
        if (environment == null) {
            return overrides;
        }
        String backend = environment.get(ENV_BACKEND);
        if (backend != null && !backend.isBlank()) {
            overrides.put(DispatchConfig.BACKEND, backend.trim());
        }
        String priority = environment.get(ENV_BACKEND_PRIORITY);
        if (priority != null) {
            overrides.put(DispatchConfig.BACKEND_PRIORITY, splitNames(priority));
        }
        String cache = environment.get(ENV_CACHE_CONVERTED_GRAPHS);
        if (cache != null) {
            overrides.put(DispatchConfig.CACHE_CONVERTED_GRAPHS, !cache.isEmpty());
        }
        String warnings = environment.get(ENV_WARNINGS);
        if (warnings != null) {
            overrides.put(DispatchConfig.WARNINGS, new LinkedHashSet<>(splitNames(warnings)));
        }
        String testBackend = environment.get(ENV_TEST_BACKEND);
        if (testBackend != null && !testBackend.isBlank()) {
            overrides.put(DispatchConfig.TEST_BACKEND, testBackend.trim());
        }
        return overrides;
    }

    public static Map<String, Object> fromToml(Path file) {
        try {
            return fromToml(Toml.parse(Files.readString(file)), file.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read dispatch config " + file + ": " + ex.getMessage(), ex);
        }
    }

    public static Map<String, Object> fromToml(TomlParseResult result, String origin) {
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid dispatch config " + origin + ": " + result.errors().get(0).toString());
        }
        TomlTable table = result.getTable(TOML_TABLE);
        if (table == null) {
            log.debug("No [{}] table in {}", TOML_TABLE, origin);
            return new LinkedHashMap<>();
        }
        return plainTable(table);
    }

    /**
     * New config holding {@code base} with the plain {@code overrides} applied. Values are
     * validated before anything is returned, so {@code base} is never left half-updated. A plain
     * list for {@code backend_priority} replaces {@code algos} only; a table replaces every entry.
     */
    public static DispatchConfig merge(DispatchConfig base, Map<String, ?> overrides) {
        Map<String, Object> values = base.export();
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            String key = entry.getKey();
            if (!base.contains(key)) {
                throw new ConfigValidationException(key, "Invalid config name: '" + key + "'");
            }
            values.put(key, typedValue(base, key, entry.getValue()));
        }
        return new DispatchConfig(base.plugins(), base.algorithms(), values);
    }

    private static Object typedValue(DispatchConfig base, String key, Object value) {
        switch (key) {
            case DispatchConfig.BACKEND_PRIORITY -> {
                if (value instanceof Collection<?> names) {
                    Map<String, Object> layered = base.backendPriority().export();
                    layered.put(BackendPriorities.ALGOS, new ArrayList<>(names));
                    return new BackendPriorities(base.plugins(), base.algorithms(), layered);
                }
                if (value instanceof Map<?, ?> map) {
                    return new BackendPriorities(base.plugins(), base.algorithms(), stringKeys(map));
                }
                return value;
            }
            case DispatchConfig.BACKENDS -> {
                if (value instanceof Map<?, ?> map) {
                    FlexibleConfig backends = new FlexibleConfig();
                    stringKeys(map).forEach((name, settings) -> backends.set(
                        name,
                        settings instanceof Map<?, ?> nested ? new FlexibleConfig(stringKeys(nested)) : settings
                    ));
                    return backends;
                }
                return value;
            }
            case DispatchConfig.WARNINGS -> {
                if (value instanceof Collection<?> names && !(value instanceof Set<?>)) {
                    return new LinkedHashSet<>(names);
                }
                return value;
            }
            default -> {
                return value;
            }
        }
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    private static List<String> splitNames(String raw) {
        List<String> names = new ArrayList<>();
        Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .forEach(names::add);
        return names;
    }

    private static Map<String, Object> plainTable(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, plainToml(table.get(List.of(key))));
        }
        return map;
    }

    private static Object plainToml(Object value) {
        if (value instanceof TomlTable table) {
            return plainTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(plainToml(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
