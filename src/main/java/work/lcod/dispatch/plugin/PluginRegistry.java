package work.lcod.dispatch.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import work.lcod.dispatch.errors.BackendUnavailableException;

/**
 * Lazily discovered, name-keyed backends. The registration source is read once; each backend is
 * loaded at most once and cached here.
 *
 * <p>Not synchronized: concurrent first loads of the same backend are the caller's responsibility.</p>
 */
public final class PluginRegistry {
    private final Supplier<Map<String, BackendLoader>> source;
    private Map<String, PluginDescriptor> entries;

    public PluginRegistry() {
        this(BackendRegistrations::snapshot);
    }

    public PluginRegistry(Supplier<Map<String, BackendLoader>> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public static PluginRegistry of(Map<String, BackendLoader> loaders) {
        var copy = new LinkedHashMap<>(loaders);
        return new PluginRegistry(() -> copy);
    }

    public Map<String, PluginDescriptor> entries() {
        if (entries == null) {
            Map<String, PluginDescriptor> discovered = new LinkedHashMap<>();
            Map<String, BackendLoader> loaders = source.get();
            if (loaders != null) {
                loaders.forEach((name, loader) -> discovered.put(name, new PluginDescriptor(name, loader)));
            }
            entries = Collections.unmodifiableMap(discovered);
        }
        return entries;
    }

    public boolean has(String name) {
        return name != null && entries().containsKey(name);
    }

    public boolean isEmpty() {
        return entries().isEmpty();
    }

    public Set<String> names() {
        return entries().keySet();
    }

    public PluginDescriptor get(String name) {
        PluginDescriptor descriptor = name == null ? null : entries().get(name);
        if (descriptor == null) {
            throw new BackendUnavailableException(name, "'" + name + "' backend is not installed");
        }
        return descriptor;
    }

    public Backend load(String name) {
        return get(name).load();
    }
}
