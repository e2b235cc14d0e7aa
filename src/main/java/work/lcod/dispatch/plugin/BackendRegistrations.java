package work.lcod.dispatch.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.dispatch.errors.RegistrationException;

/**
 * Process-wide table backends add themselves to at startup. {@link PluginRegistry} reads it once.
 */
public final class BackendRegistrations {
    private static final Map<String, BackendLoader> LOADERS = new LinkedHashMap<>();

    private BackendRegistrations() {}

    public static synchronized void register(String name, BackendLoader loader) {
        Objects.requireNonNull(loader, "loader");
        if (name == null || name.isBlank()) {
            throw new RegistrationException("Backend name must not be blank");
        }
        if (BackendNames.NATIVE.equals(name)) {
            throw new RegistrationException("'" + BackendNames.NATIVE + "' is reserved for the native implementation");
        }
        if (LOADERS.containsKey(name)) {
            throw new RegistrationException("Backend already registered: " + name);
        }
        LOADERS.put(name, loader);
    }

    public static synchronized Map<String, BackendLoader> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(LOADERS));
    }

    /**
     * Removes a registration; for tests that install temporary backends.
     */
    public static synchronized void unregister(String name) {
        LOADERS.remove(name);
    }
}
