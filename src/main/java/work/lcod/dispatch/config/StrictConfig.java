package work.lcod.dispatch.config;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.dispatch.errors.ConfigValidationException;

/**
 * Config with a schema fixed at construction. Unknown keys are rejected on read and write, and
 * keys can never be removed.
 */
public class StrictConfig extends AbstractConfig {
    private final Set<String> schema;

    /**
     * Declares the schema only; subclasses call {@link #load(Map)} once their own fields are set.
     */
    protected StrictConfig(Collection<String> schema) {
        if (schema == null || schema.isEmpty()) {
            throw new IllegalArgumentException("schema must declare at least one key");
        }
        this.schema = new LinkedHashSet<>(schema);
    }

    /**
     * Schema taken from the keys of {@code values}.
     */
    public StrictConfig(Map<String, ?> values) {
        this(values.keySet());
        load(values);
    }

    @Override
    protected void load(Map<String, ?> initial) {
        for (String key : schema) {
            if (initial == null || !initial.containsKey(key)) {
                throw new ConfigValidationException(key, "Missing config value: '" + key + "'");
            }
        }
        for (String key : initial.keySet()) {
            if (!schema.contains(key)) {
                throw invalidName(key);
            }
        }
        for (String key : schema) {
            set(key, initial.get(key));
        }
    }

    @Override
    protected final boolean isDeclared(String key) {
        return schema.contains(key);
    }

    @Override
    public final boolean isStrict() {
        return true;
    }

    @Override
    public List<String> keys() {
        return List.copyOf(schema);
    }

    @Override
    public Config reconstruct(Map<String, Object> exported) {
        return new StrictConfig(exported);
    }
}
