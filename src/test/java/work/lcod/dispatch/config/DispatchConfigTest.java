package work.lcod.dispatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.dispatch.errors.ConfigValidationException;
import work.lcod.dispatch.runtime.DispatchContext;
import work.lcod.dispatch.support.DispatchTestSupport;
import work.lcod.dispatch.support.DispatchTestSupport.DemoBackend;
import work.lcod.dispatch.support.DispatchTestSupport.LoopbackBackend;

class DispatchConfigTest {
    private final DispatchContext ctx = DispatchTestSupport.standardContext(new LoopbackBackend(), new DemoBackend());
    private final DispatchConfig config = ctx.config();

    @Test
    void defaultsMatchTheDocumentedValues() {
        assertNull(config.backend());
        assertNull(config.testBackend());
        assertTrue(config.cacheConvertedGraphs());
        assertEquals(Set.of("cache"), config.warnings());
        assertEquals(List.of(), config.backendPriority().algos());
        assertEquals(0, config.backends().size());
        assertEquals(
            List.of("backend", "backend_priority", "backends", "cache_converted_graphs", "warnings", "test_backend"),
            config.keys()
        );
    }

    @Test
    void backendMustBeInstalled() {
        config.set(DispatchConfig.BACKEND, "demo");
        assertEquals("demo", config.backend());
        var ex = assertThrows(ConfigValidationException.class, () -> config.set(DispatchConfig.BACKEND, "ghost"));
        assertEquals("Unknown backend when setting 'backend': ghost", ex.getMessage());
        assertThrows(ConfigValidationException.class, () -> config.set(DispatchConfig.TEST_BACKEND, 3));
        assertEquals("demo", config.backend());
    }

    @Test
    void validatesScalarSettings() {
        assertThrows(ConfigValidationException.class, () -> config.set(DispatchConfig.CACHE_CONVERTED_GRAPHS, "yes"));
        assertThrows(ConfigValidationException.class, () -> config.set(DispatchConfig.BACKEND_PRIORITY, List.of("demo")));
        var warnings = assertThrows(ConfigValidationException.class, () -> config.set(DispatchConfig.WARNINGS, List.of("nope")));
        assertTrue(warnings.getMessage().startsWith("Unknown warning when setting 'warnings': 'nope'"));
        config.set(DispatchConfig.WARNINGS, List.of());
        assertTrue(config.warnings().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> config.warnings().add("cache"));
    }

    @Test
    void backendsTableOnlyAcceptsInstalledBackends() {
        var backends = new FlexibleConfig(Map.of("demo", new FlexibleConfig(Map.of("threads", 4))));
        config.set(DispatchConfig.BACKENDS, backends);
        assertEquals(4, ((Config) config.backends().get("demo")).get("threads"));

        var unknown = new FlexibleConfig(Map.of("ghost", new FlexibleConfig()));
        var ex = assertThrows(ConfigValidationException.class, () -> config.set(DispatchConfig.BACKENDS, unknown));
        assertEquals("Unknown backend when setting 'backends': 'ghost'", ex.getMessage());
        var notConfig = new FlexibleConfig(Map.of("demo", 1));
        assertThrows(ConfigValidationException.class, () -> config.set(DispatchConfig.BACKENDS, notConfig));
    }

    @Test
    void prioritiesValidateNamesAndKeys() {
        var priorities = new BackendPriorities(ctx.plugins(), ctx.algorithms(), Map.of("algos", List.of("demo", "native")));
        assertEquals(List.of("demo", "native"), priorities.forAlgorithm("whoami"));
        priorities.set("whoami", List.of("loopback"));
        assertEquals(List.of("loopback"), priorities.forAlgorithm("whoami"));
        assertEquals(List.of("demo", "native"), priorities.forAlgorithm("edge_weights"));

        assertThrows(ConfigValidationException.class, () -> priorities.set("not_an_algorithm", List.of("demo")));
        assertThrows(ConfigValidationException.class, () -> priorities.set("algos", List.of("ghost")));
        assertThrows(ConfigValidationException.class, () -> priorities.set("algos", "demo"));
        assertThrows(ConfigValidationException.class, () -> priorities.remove("algos"));
        priorities.remove("whoami");
        assertEquals(List.of("demo", "native"), priorities.forAlgorithm("whoami"));
    }

    @Test
    void everySchemaKeyIsRequired() {
        Map<String, Object> partial = new HashMap<>();
        partial.put(DispatchConfig.BACKEND, null);
        var ex = assertThrows(
            ConfigValidationException.class,
            () -> new DispatchConfig(ctx.plugins(), ctx.algorithms(), partial)
        );
        assertEquals("Missing config value: 'backend_priority'", ex.getMessage());
    }

    @Test
    void reconstructKeepsValidationContext() {
        config.set(DispatchConfig.BACKEND, "loopback");
        var rebuilt = (DispatchConfig) config.reconstruct(config.export());
        assertEquals(config, rebuilt);
        assertThrows(ConfigValidationException.class, () -> rebuilt.set(DispatchConfig.BACKEND, "ghost"));
    }
}
