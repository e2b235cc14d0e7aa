package work.lcod.dispatch.config;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Ordered key/value configuration shared by the strict and flexible variants.
 *
 * <p>Instances are process-wide mutable state without internal locking. Writes and overrides
 * must not race with each other; concurrent reads are fine while no writer is active.</p>
 */
public interface Config extends Iterable<String> {
    /**
     * Returns the stored value. Strict configs reject unknown keys, flexible configs return {@code null}.
     */
    Object get(String key);

    Object get(String key, Object fallback);

    /**
     * Validates {@code value} through the config's hook and stores the sanitized result.
     */
    void set(String key, Object value);

    void remove(String key);

    boolean contains(String key);

    /**
     * Keys in declaration (strict) or insertion (flexible) order.
     */
    List<String> keys();

    int size();

    boolean isStrict();

    /**
     * Plain key to value copy of the current state. Nested configs are kept as config objects.
     */
    Map<String, Object> export();

    /**
     * Builds a new instance of this config's type holding {@code exported}.
     */
    Config reconstruct(Map<String, Object> exported);

    /**
     * Validates every change, snapshots the current state and applies the changes. Closing the
     * returned scope restores the snapshot verbatim. Scopes must be closed in reverse order.
     */
    ConfigScope override(Map<String, ?> changes);

    /**
     * Scope that restores nothing on close, for callers that enter a scope without overriding.
     */
    ConfigScope scope();

    @Override
    default Iterator<String> iterator() {
        return keys().iterator();
    }
}
