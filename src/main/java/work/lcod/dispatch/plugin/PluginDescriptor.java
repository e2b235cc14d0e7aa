package work.lcod.dispatch.plugin;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.dispatch.errors.BackendUnavailableException;

/**
 * Backend name, its deferred loader and, once loaded, the backend instance.
 */
public final class PluginDescriptor {
    private static final Logger log = LoggerFactory.getLogger(PluginDescriptor.class);

    private final String name;
    private final BackendLoader loader;
    private Backend backend;

    PluginDescriptor(String name, BackendLoader loader) {
        this.name = Objects.requireNonNull(name, "name");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public String name() {
        return name;
    }

    public boolean isLoaded() {
        return backend != null;
    }

    public Backend load() {
        if (backend != null) {
            return backend;
        }
        Backend loaded;
        try {
            loaded = loader.load();
        } catch (BackendUnavailableException ex) {
            throw ex;
        } catch (Exception ex) {
            String reason = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            throw new BackendUnavailableException(name, "Unable to load backend '" + name + "': " + reason, ex);
        }
        if (loaded == null) {
            throw new BackendUnavailableException(name, "Unable to load backend '" + name + "': loader returned nothing");
        }
        if (!name.equals(loaded.name())) {
            log.warn("Backend registered as '{}' reports name '{}'", name, loaded.name());
        }
        log.debug("Loaded backend '{}' ({})", name, loaded.getClass().getName());
        backend = loaded;
        return backend;
    }
}
