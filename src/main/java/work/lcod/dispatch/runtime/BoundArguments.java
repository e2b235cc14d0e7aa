package work.lcod.dispatch.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Complete name to value map for one call, in declaration order, defaults applied.
 */
public final class BoundArguments {
    private final Map<String, Object> arguments;

    BoundArguments(Map<String, Object> arguments) {
        this.arguments = new LinkedHashMap<>(arguments);
    }

    public boolean contains(String name) {
        return arguments.containsKey(name);
    }

    public Object get(String name) {
        return arguments.get(name);
    }

    public Object getOrDefault(String name, Object fallback) {
        return arguments.containsKey(name) ? arguments.get(name) : fallback;
    }

    public void replace(String name, Object value) {
        if (!arguments.containsKey(name)) {
            throw new IllegalArgumentException("Unknown bound argument: " + name);
        }
        arguments.put(name, value);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(arguments);
    }

    /**
     * Every bound value passed by name.
     */
    public CallArguments toCallArguments() {
        return CallArguments.keywords(arguments);
    }
}
