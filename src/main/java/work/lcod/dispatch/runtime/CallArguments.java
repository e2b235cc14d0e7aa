package work.lcod.dispatch.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Positional values plus named values of one algorithm call. Both may hold {@code null}.
 */
public final class CallArguments {
    private final List<Object> positional;
    private final Map<String, Object> keywords;

    public CallArguments(List<?> positional, Map<String, ?> keywords) {
        this.positional = positional == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(positional));
        this.keywords = keywords == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public static CallArguments of(Object... positional) {
        return new CallArguments(positional == null ? List.of() : Arrays.asList(positional), Map.of());
    }

    public static CallArguments keywords(Map<String, ?> keywords) {
        return new CallArguments(List.of(), keywords);
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> keywords() {
        return keywords;
    }

    public int size() {
        return positional.size();
    }

    public Object positional(int index) {
        return positional.get(index);
    }

    public boolean hasKeyword(String name) {
        return keywords.containsKey(name);
    }

    public Object keyword(String name) {
        return keywords.get(name);
    }

    /**
     * Copy with {@code name} set as a keyword value.
     */
    public CallArguments with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(keywords);
        copy.put(name, value);
        return new CallArguments(positional, copy);
    }

    public CallArguments without(String name) {
        if (!keywords.containsKey(name)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(keywords);
        copy.remove(name);
        return new CallArguments(positional, copy);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CallArguments that)) {
            return false;
        }
        return positional.equals(that.positional) && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, keywords);
    }

    @Override
    public String toString() {
        return "CallArguments" + positional + keywords;
    }
}
