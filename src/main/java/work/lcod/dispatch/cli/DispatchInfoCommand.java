package work.lcod.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.dispatch.config.ConfigCodec;
import work.lcod.dispatch.config.DispatchConfig;
import work.lcod.dispatch.config.DispatchConfigLoader;
import work.lcod.dispatch.errors.BackendUnavailableException;
import work.lcod.dispatch.plugin.AbstractBackend;
import work.lcod.dispatch.plugin.Backend;
import work.lcod.dispatch.plugin.BackendLoader;
import work.lcod.dispatch.plugin.BackendNames;
import work.lcod.dispatch.plugin.BackendRegistrations;
import work.lcod.dispatch.plugin.PluginRegistry;
import work.lcod.dispatch.runtime.AlgorithmRegistry;

@CommandLine.Command(
    name = "graph-dispatch",
    description = "Show the effective dispatch configuration and the installed backends.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class DispatchInfoCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "TOML file with a [dispatch] table."
    )
    private Path configFile;

    @CommandLine.Option(
        names = {"-p", "--plugin"},
        description = "Extra backend as name=fully.qualified.ClassName (repeatable)."
    )
    private List<String> plugins = new ArrayList<>();

    @CommandLine.Option(
        names = "--check",
        description = "Load every backend and report the ones that fail."
    )
    private boolean check;

    @CommandLine.Option(
        names = "--json",
        description = "Print the report as JSON."
    )
    private boolean json;

    private final Map<String, String> environment;

    DispatchInfoCommand() {
        this(System.getenv());
    }

    DispatchInfoCommand(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    @Override
    public Integer call() throws Exception {
        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Config file not found: " + configFile);
        }
        PluginRegistry registry = PluginRegistry.of(collectLoaders());
        DispatchConfig config = DispatchConfigLoader.load(registry, new AlgorithmRegistry(), configFile, environment);

        List<Map<String, Object>> backends = new ArrayList<>();
        boolean healthy = true;
        for (String name : registry.names()) {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("name", name);
            if (check) {
                try {
                    Backend backend = registry.load(name);
                    status.put("status", "ok");
                    if (backend instanceof AbstractBackend table) {
                        status.put("algorithms", List.copyOf(table.algorithms().keySet()));
                    }
                } catch (BackendUnavailableException ex) {
                    healthy = false;
                    status.put("status", "unavailable");
                    status.put("error", ex.getMessage());
                }
            } else {
                status.put("status", registry.get(name).isLoaded() ? "loaded" : "installed");
            }
            backends.add(status);
        }

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("config", ConfigCodec.toPlain(config));
            report.put("backends", backends);
            out.println(toJson(report));
        } else {
            printText(out, config, backends);
        }
        out.flush();
        return healthy ? 0 : 1;
    }

    private Map<String, BackendLoader> collectLoaders() {
        Map<String, BackendLoader> loaders = new LinkedHashMap<>(BackendRegistrations.snapshot());
        for (String plugin : plugins) {
            int idx = plugin.indexOf('=');
            if (idx <= 0 || idx == plugin.length() - 1) {
                throw new CommandLine.ParameterException(
                    spec.commandLine(),
                    "Invalid --plugin value (expected name=ClassName): " + plugin
                );
            }
            String name = plugin.substring(0, idx).trim();
            String className = plugin.substring(idx + 1).trim();
            if (BackendNames.isNative(name) || loaders.containsKey(name)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Duplicate backend name: " + name);
            }
            loaders.put(name, BackendLoader.forClassName(className));
        }
        return loaders;
    }

    private static void printText(PrintWriter out, DispatchConfig config, List<Map<String, Object>> backends) {
        Map<String, Object> plain = ConfigCodec.toPlain(config);
        out.println("Configuration:");
        plain.forEach((key, value) -> out.println("  " + key + " = " + value));
        out.println("Backends:");
        if (backends.isEmpty()) {
            out.println("  (none installed)");
        }
        for (Map<String, Object> backend : backends) {
            StringBuilder line = new StringBuilder("  ")
                .append(backend.get("name"))
                .append(": ")
                .append(backend.get("status"));
            if (backend.containsKey("algorithms")) {
                line.append(' ').append(backend.get("algorithms"));
            }
            if (backend.containsKey("error")) {
                line.append(" (").append(backend.get("error")).append(')');
            }
            out.println(line);
        }
    }

    private static String toJson(Object value) {
        try {
            return JSON_WRITER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render report: " + ex.getMessage(), ex);
        }
    }
}
