package work.lcod.dispatch.config;

import java.util.Map;

/**
 * Handle returned by {@link Config#override(Map)}. Use with try-with-resources so the previous
 * state comes back on every exit path.
 */
public final class ConfigScope implements AutoCloseable {
    private final AbstractConfig owner;
    private final Map<String, Object> snapshot;
    private boolean closed;

    ConfigScope(AbstractConfig owner, Map<String, Object> snapshot) {
        this.owner = owner;
        this.snapshot = snapshot;
    }

    Map<String, Object> snapshot() {
        return snapshot;
    }

    boolean isClosed() {
        return closed;
    }

    void markClosed() {
        closed = true;
    }

    public Config config() {
        return owner;
    }

    @Override
    public void close() {
        owner.endOverride(this);
    }
}
