package work.lcod.dispatch.config;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import work.lcod.dispatch.errors.ConfigValidationException;

/**
 * Shared storage, validation hooks and override stack for {@link StrictConfig} and {@link FlexibleConfig}.
 */
public abstract class AbstractConfig implements Config {
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Deque<ConfigScope> overrides = new ArrayDeque<>();

    /**
     * Checks a value before it is stored and returns the sanitized form. Throws
     * {@link ConfigValidationException} when the value is not acceptable.
     */
    protected Object onSet(String key, Object value) {
        return value;
    }

    /**
     * Called before a key is removed from a flexible config.
     */
    protected void onRemove(String key) {
    }

    protected abstract boolean isDeclared(String key);

    protected void load(Map<String, ?> initial) {
        if (initial == null) {
            return;
        }
        for (Map.Entry<String, ?> entry : initial.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public Object get(String key) {
        if (isStrict() && !isDeclared(key)) {
            throw invalidName(key);
        }
        return values.get(key);
    }

    @Override
    public Object get(String key, Object fallback) {
        return values.containsKey(key) ? values.get(key) : fallback;
    }

    @Override
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (isStrict() && !isDeclared(key)) {
            throw invalidName(key);
        }
        values.put(key, onSet(key, value));
    }

    @Override
    public void remove(String key) {
        if (isStrict()) {
            throw new ConfigValidationException(key, "Configuration items can't be deleted (can't delete '" + key + "').");
        }
        if (!values.containsKey(key)) {
            throw invalidName(key);
        }
        onRemove(key);
        values.remove(key);
    }

    @Override
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    @Override
    public List<String> keys() {
        return List.copyOf(values.keySet());
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public Map<String, Object> export() {
        return new LinkedHashMap<>(values);
    }

    @Override
    public ConfigScope override(Map<String, ?> changes) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (changes != null) {
            for (Map.Entry<String, ?> entry : changes.entrySet()) {
                String key = entry.getKey();
                if (isStrict() && !isDeclared(key)) {
                    throw invalidName(key);
                }
                sanitized.put(key, onSet(key, entry.getValue()));
            }
        }
        var scope = new ConfigScope(this, new LinkedHashMap<>(values));
        values.putAll(sanitized);
        overrides.push(scope);
        return scope;
    }

    @Override
    public ConfigScope scope() {
        return new ConfigScope(this, null);
    }

    void endOverride(ConfigScope scope) {
        if (scope.isClosed()) {
            return;
        }
        if (scope.snapshot() == null) {
            scope.markClosed();
            return;
        }
        if (overrides.peek() != scope) {
            throw new IllegalStateException("Config overrides must be closed in reverse order of creation");
        }
        overrides.pop();
        scope.markClosed();
        values.clear();
        values.putAll(scope.snapshot());
    }

    /**
     * Number of overrides currently open on this instance.
     */
    public int overrideDepth() {
        return overrides.size();
    }

    protected static ConfigValidationException invalidName(String key) {
        return new ConfigValidationException(key, "Invalid config name: '" + key + "'");
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return values.equals(((AbstractConfig) other).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), values);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + values.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", ", "(", ")"));
    }
}
