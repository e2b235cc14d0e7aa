package work.lcod.dispatch.runtime;

import java.util.Objects;

/**
 * Declared parameter of an algorithm. Parameters without a default are required.
 */
public record Parameter(String name, boolean hasDefault, Object defaultValue) {
    public Parameter {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("parameter name must not be blank");
        }
    }

    public static Parameter required(String name) {
        return new Parameter(name, false, null);
    }

    public static Parameter optional(String name, Object defaultValue) {
        return new Parameter(name, true, defaultValue);
    }
}
