package work.lcod.dispatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.tomlj.Toml;
import work.lcod.dispatch.errors.ConfigValidationException;
import work.lcod.dispatch.runtime.DispatchContext;
import work.lcod.dispatch.support.DispatchTestSupport;
import work.lcod.dispatch.support.DispatchTestSupport.DemoBackend;
import work.lcod.dispatch.support.DispatchTestSupport.LoopbackBackend;

class DispatchConfigLoaderTest {
    private final DispatchContext ctx = DispatchTestSupport.standardContext(new LoopbackBackend(), new DemoBackend());

    private static Path fixture() throws Exception {
        return Path.of(DispatchConfigLoaderTest.class.getResource("/fixtures/dispatch.toml").toURI());
    }

    @Test
    void environmentProducesPlainOverrides() {
        var overrides = DispatchConfigLoader.fromEnvironment(Map.of(
            DispatchConfigLoader.ENV_BACKEND, " demo ",
            DispatchConfigLoader.ENV_BACKEND_PRIORITY, "loopback, ,native",
            DispatchConfigLoader.ENV_CACHE_CONVERTED_GRAPHS, "",
            DispatchConfigLoader.ENV_WARNINGS, ""
        ));
        assertEquals("demo", overrides.get("backend"));
        assertEquals(List.of("loopback", "native"), overrides.get("backend_priority"));
        assertEquals(false, overrides.get("cache_converted_graphs"));
        assertEquals(Set.of(), overrides.get("warnings"));
        assertFalse(overrides.containsKey("test_backend"));
    }

    @Test
    void unsetEnvironmentKeepsDefaults() {
        var config = DispatchConfigLoader.load(ctx.plugins(), ctx.algorithms(), null, Map.of());
        assertEquals(DispatchConfig.defaults(ctx.plugins(), ctx.algorithms()), config);
    }

    @Test
    void environmentIsAppliedOnTopOfDefaults() {
        var config = DispatchConfigLoader.load(
            ctx.plugins(),
            ctx.algorithms(),
            null,
            Map.of(
                DispatchConfigLoader.ENV_BACKEND_PRIORITY, "demo,native",
                DispatchConfigLoader.ENV_TEST_BACKEND, "loopback",
                DispatchConfigLoader.ENV_CACHE_CONVERTED_GRAPHS, "1"
            )
        );
        assertEquals(List.of("demo", "native"), config.backendPriority().algos());
        assertEquals("loopback", config.testBackend());
        assertTrue(config.cacheConvertedGraphs());
    }

    @Test
    void unknownBackendInEnvironmentFailsValidation() {
        assertThrows(
            ConfigValidationException.class,
            () -> DispatchConfigLoader.load(ctx.plugins(), ctx.algorithms(), null, Map.of(DispatchConfigLoader.ENV_BACKEND, "ghost"))
        );
    }

    @Test
    void readsDispatchTableFromToml() throws Exception {
        var config = DispatchConfigLoader.load(ctx.plugins(), ctx.algorithms(), fixture(), Map.of());
        assertEquals(List.of("demo", "native"), config.backendPriority().algos());
        assertFalse(config.cacheConvertedGraphs());
        assertTrue(config.warnings().isEmpty());
        assertNull(config.backend());
        var demo = (Config) config.backends().get("demo");
        assertEquals(4L, demo.get("threads"));
    }

    @Test
    void environmentWinsOverToml() throws Exception {
        var config = DispatchConfigLoader.load(
            ctx.plugins(),
            ctx.algorithms(),
            fixture(),
            Map.of(DispatchConfigLoader.ENV_CACHE_CONVERTED_GRAPHS, "true")
        );
        assertTrue(config.cacheConvertedGraphs());
        assertEquals(List.of("demo", "native"), config.backendPriority().algos());
    }

    @Test
    void priorityTableMayNameAlgorithms() {
        var parsed = Toml.parse("[dispatch.backend_priority]\nalgos = [\"demo\"]\nwhoami = [\"loopback\"]\n");
        var overrides = DispatchConfigLoader.fromToml(parsed, "inline");
        var config = DispatchConfigLoader.merge(ctx.config(), overrides);
        assertEquals(List.of("loopback"), config.backendPriority().forAlgorithm("whoami"));
        assertEquals(List.of("demo"), config.backendPriority().forAlgorithm("union"));
    }

    @Test
    void rejectsBrokenOrUnknownToml() {
        assertThrows(
            IllegalArgumentException.class,
            () -> DispatchConfigLoader.fromToml(Toml.parse("[dispatch\nbackend = "), "broken")
        );
        var unknown = DispatchConfigLoader.fromToml(Toml.parse("[dispatch]\nbogus = 1\n"), "unknown");
        assertThrows(ConfigValidationException.class, () -> DispatchConfigLoader.merge(ctx.config(), unknown));
        assertTrue(DispatchConfigLoader.fromToml(Toml.parse("[other]\nx = 1\n"), "other").isEmpty());
    }

    @Test
    void mergeLeavesTheBaseUntouched() {
        var base = ctx.config();
        var merged = DispatchConfigLoader.merge(base, Map.of("backend", "demo"));
        assertEquals("demo", merged.backend());
        assertNull(base.backend());
    }

    @Test
    void priorityListFromEnvironmentKeepsPerAlgorithmEntries() {
        var parsed = Toml.parse("[dispatch.backend_priority]\nalgos = [\"demo\"]\nwhoami = [\"demo\", \"native\"]\n");
        var fromFile = DispatchConfigLoader.merge(ctx.config(), DispatchConfigLoader.fromToml(parsed, "inline"));
        var config = DispatchConfigLoader.merge(
            fromFile,
            DispatchConfigLoader.fromEnvironment(Map.of(DispatchConfigLoader.ENV_BACKEND_PRIORITY, "loopback"))
        );
        assertEquals(List.of("loopback"), config.backendPriority().algos());
        assertEquals(List.of("loopback"), config.backendPriority().forAlgorithm("union"));
        assertEquals(List.of("demo", "native"), config.backendPriority().forAlgorithm("whoami"));
    }

    @Test
    void priorityListsAreReadOnly() {
        var parsed = Toml.parse("[dispatch.backend_priority]\nalgos = [\"demo\"]\nwhoami = [\"loopback\"]\n");
        var priorities = DispatchConfigLoader.merge(ctx.config(), DispatchConfigLoader.fromToml(parsed, "inline")).backendPriority();
        assertThrows(UnsupportedOperationException.class, () -> priorities.algos().add("loopback"));
        assertThrows(UnsupportedOperationException.class, () -> priorities.forAlgorithm("whoami").add("demo"));
    }
}
