package work.lcod.dispatch.plugin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.lcod.dispatch.errors.BackendUnavailableException;
import work.lcod.dispatch.errors.RegistrationException;
import work.lcod.dispatch.support.DispatchTestSupport.DemoBackend;
import work.lcod.dispatch.support.DispatchTestSupport.LoopbackBackend;

class PluginRegistryTest {
    @Test
    void loadsEachBackendOnceAndOnlyOnDemand() {
        var loads = new AtomicInteger();
        var registry = PluginRegistry.of(Map.of("demo", () -> {
            loads.incrementAndGet();
            return new DemoBackend();
        }));
        assertTrue(registry.has("demo"));
        assertFalse(registry.get("demo").isLoaded());
        assertEquals(0, loads.get());

        Backend first = registry.load("demo");
        Backend second = registry.load("demo");
        assertSame(first, second);
        assertEquals(1, loads.get());
        assertTrue(registry.get("demo").isLoaded());
    }

    @Test
    void readsTheRegistrationSourceOnce() {
        var reads = new AtomicInteger();
        var registry = new PluginRegistry(() -> {
            reads.incrementAndGet();
            return Map.of("demo", BackendLoader.of(new DemoBackend()));
        });
        registry.names();
        registry.has("demo");
        registry.isEmpty();
        assertEquals(1, reads.get());
    }

    @Test
    void unknownBackendIsNotInstalled() {
        var registry = PluginRegistry.of(Map.of());
        assertTrue(registry.isEmpty());
        assertFalse(registry.has(null));
        var ex = assertThrows(BackendUnavailableException.class, () -> registry.load("ghost"));
        assertEquals("'ghost' backend is not installed", ex.getMessage());
    }

    @Test
    void loaderFailuresBecomeUnavailableAndAreRetried() {
        var attempts = new AtomicInteger();
        var registry = PluginRegistry.of(Map.of("flaky", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IOException("boom");
            }
            return new DemoBackend();
        }));
        var ex = assertThrows(BackendUnavailableException.class, () -> registry.load("flaky"));
        assertEquals("Unable to load backend 'flaky': boom", ex.getMessage());
        assertInstanceOf(IOException.class, ex.getCause());
        assertEquals("demo", registry.load("flaky").name());
    }

    @Test
    void loadsBackendsByClassName() throws Exception {
        var loader = BackendLoader.forClassName(LoopbackBackend.class.getName());
        assertInstanceOf(LoopbackBackend.class, loader.load());

        Map<String, BackendLoader> loaders = new LinkedHashMap<>();
        loaders.put("wrong", BackendLoader.forClassName(String.class.getName()));
        loaders.put("missing", BackendLoader.forClassName("work.lcod.dispatch.NoSuchBackend"));
        var registry = PluginRegistry.of(loaders);
        assertEquals(List.of("wrong", "missing"), List.copyOf(registry.names()));
        assertThrows(BackendUnavailableException.class, () -> registry.load("wrong"));
        assertThrows(BackendUnavailableException.class, () -> registry.load("missing"));
    }

    @Test
    void registrationTableRejectsReservedAndDuplicateNames() {
        assertThrows(RegistrationException.class, () -> BackendRegistrations.register("native", BackendLoader.of(new DemoBackend())));
        assertThrows(RegistrationException.class, () -> BackendRegistrations.register(" ", BackendLoader.of(new DemoBackend())));
        String name = "registration-test";
        BackendRegistrations.register(name, BackendLoader.of(new DemoBackend()));
        try {
            assertThrows(RegistrationException.class, () -> BackendRegistrations.register(name, BackendLoader.of(new DemoBackend())));
            assertTrue(new PluginRegistry().has(name));
        } finally {
            BackendRegistrations.unregister(name);
        }
        assertFalse(new PluginRegistry().has(name));
    }

    @Test
    void nativeNamesAreRecognized() {
        assertTrue(BackendNames.isNative(null));
        assertTrue(BackendNames.isNative("native"));
        assertFalse(BackendNames.isNative("loopback"));
    }
}
