package work.lcod.dispatch.runtime;

import work.lcod.dispatch.config.DispatchConfigLoader;
import work.lcod.dispatch.plugin.PluginRegistry;

/**
 * Process-wide dispatch context so library code, the CLI and tests share one setup.
 */
public final class DispatchRuntime {
    private static DispatchContext global;

    private DispatchRuntime() {}

    /**
     * Fresh context backed by the backend registration table, configured from the environment.
     */
    public static DispatchContext create() {
        var algorithms = new AlgorithmRegistry();
        var plugins = new PluginRegistry();
        return new DispatchContext(algorithms, plugins, DispatchConfigLoader.fromSystemEnvironment(plugins, algorithms));
    }

    public static synchronized DispatchContext global() {
        if (global == null) {
            global = create();
        }
        return global;
    }
}
