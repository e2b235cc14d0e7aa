package work.lcod.dispatch.runtime;

import java.util.Objects;
import work.lcod.dispatch.config.DispatchConfig;
import work.lcod.dispatch.plugin.PluginRegistry;

/**
 * Registries and configuration shared by every dispatch wrapper of one runtime.
 */
public final class DispatchContext {
    private final AlgorithmRegistry algorithms;
    private final PluginRegistry plugins;
    private DispatchConfig config;

    public DispatchContext(AlgorithmRegistry algorithms, PluginRegistry plugins) {
        this(algorithms, plugins, DispatchConfig.defaults(plugins, algorithms));
    }

    public DispatchContext(AlgorithmRegistry algorithms, PluginRegistry plugins, DispatchConfig config) {
        this.algorithms = Objects.requireNonNull(algorithms, "algorithms");
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.config = Objects.requireNonNull(config, "config");
    }

    public AlgorithmRegistry algorithms() {
        return algorithms;
    }

    public PluginRegistry plugins() {
        return plugins;
    }

    public DispatchConfig config() {
        return config;
    }

    /**
     * Replaces the whole configuration, e.g. after reloading it from a file.
     */
    public void setConfig(DispatchConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public Object call(String algorithm, CallArguments arguments) throws Exception {
        var wrapper = algorithms.lookup(algorithm)
            .orElseThrow(() -> new IllegalStateException("Algorithm not registered: " + algorithm));
        return wrapper.call(arguments);
    }
}
