package work.lcod.dispatch.convert;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.dispatch.errors.ArgumentResolutionException;
import work.lcod.dispatch.runtime.BoundArguments;

/**
 * Describes which node or edge attributes a conversion carries over, resolved per call against
 * the bound arguments.
 *
 * <ul>
 *   <li>{@link #argument(String)}: the named argument holds one attribute name.</li>
 *   <li>{@link #argumentList(String)}: the named argument holds a collection of attribute names.</li>
 *   <li>{@link #mapping(Map)}: each key names an argument holding an attribute name; each value is a
 *   literal default or an {@link ArgumentRef} to the argument holding the default.</li>
 * </ul>
 */
public final class AttributeConversionSpec {
    private static final AttributeConversionSpec NONE = new AttributeConversionSpec(Kind.NONE, null, Map.of());

    private final Kind kind;
    private final String argument;
    private final Map<String, Object> mapping;

    private AttributeConversionSpec(Kind kind, String argument, Map<String, Object> mapping) {
        this.kind = kind;
        this.argument = argument;
        this.mapping = mapping;
    }

    public static AttributeConversionSpec none() {
        return NONE;
    }

    public static AttributeConversionSpec argument(String argument) {
        return new AttributeConversionSpec(Kind.ARGUMENT, Objects.requireNonNull(argument, "argument"), Map.of());
    }

    public static AttributeConversionSpec argumentList(String argument) {
        return new AttributeConversionSpec(Kind.ARGUMENT_LIST, Objects.requireNonNull(argument, "argument"), Map.of());
    }

    public static AttributeConversionSpec mapping(Map<String, ?> mapping) {
        if (mapping == null || mapping.isEmpty()) {
            return NONE;
        }
        return new AttributeConversionSpec(Kind.MAPPING, null, Collections.unmodifiableMap(new LinkedHashMap<>(mapping)));
    }

    /**
     * {@code "weight"} names one argument, {@code "[attrs]"} names an argument holding a list.
     */
    public static AttributeConversionSpec parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return NONE;
        }
        if (spec.startsWith("[") && spec.endsWith("]") && spec.length() > 2) {
            return argumentList(spec.substring(1, spec.length() - 1));
        }
        return argument(spec);
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    /**
     * Argument names this spec reads at call time.
     */
    public Set<String> referencedArguments() {
        Set<String> names = new LinkedHashSet<>();
        switch (kind) {
            case ARGUMENT, ARGUMENT_LIST -> names.add(argument);
            case MAPPING -> {
                names.addAll(mapping.keySet());
                for (Object value : mapping.values()) {
                    if (value instanceof ArgumentRef ref) {
                        names.add(ref.name());
                    }
                }
            }
            default -> {
            }
        }
        return names;
    }

    /**
     * Attribute name to default value for this call, or {@code null} when nothing is converted.
     * Arguments holding {@code null} contribute no attribute.
     */
    public Map<String, Object> resolve(BoundArguments bound, Object defaultValue) {
        if (kind == Kind.NONE) {
            return null;
        }
        Map<String, Object> resolved = new LinkedHashMap<>();
        switch (kind) {
            case ARGUMENT -> {
                Object name = bound.get(argument);
                if (name != null) {
                    resolved.put(String.valueOf(name), defaultValue);
                }
            }
            case ARGUMENT_LIST -> {
                Object names = bound.get(argument);
                if (names instanceof Collection<?> collection) {
                    for (Object name : collection) {
                        if (name != null) {
                            resolved.put(String.valueOf(name), defaultValue);
                        }
                    }
                } else if (names instanceof String single) {
                    resolved.put(single, defaultValue);
                } else if (names != null) {
                    throw new ArgumentResolutionException(
                        "Argument '" + argument + "' must hold a collection of attribute names, got " + names.getClass().getSimpleName()
                    );
                }
            }
            case MAPPING -> {
                for (Map.Entry<String, Object> entry : mapping.entrySet()) {
                    Object name = bound.get(entry.getKey());
                    if (name == null) {
                        continue;
                    }
                    Object value = entry.getValue();
                    Object fallback = value instanceof ArgumentRef ref
                        ? bound.getOrDefault(ref.name(), defaultValue)
                        : value;
                    resolved.put(String.valueOf(name), fallback);
                }
            }
            default -> {
            }
        }
        return resolved;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AttributeConversionSpec that)) {
            return false;
        }
        return kind == that.kind && Objects.equals(argument, that.argument) && mapping.equals(that.mapping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, argument, mapping);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "none";
            case ARGUMENT -> argument;
            case ARGUMENT_LIST -> "[" + argument + "]";
            case MAPPING -> mapping.toString();
        };
    }

    private enum Kind {
        NONE,
        ARGUMENT,
        ARGUMENT_LIST,
        MAPPING
    }
}
