package work.lcod.dispatch.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.dispatch.errors.ArgumentResolutionException;
import work.lcod.dispatch.errors.RegistrationException;

/**
 * Which parameters of an algorithm hold graphs, at which position, and whether they are optional.
 * A name ending in {@code ?} marks an optional graph; the marker is stripped.
 */
public final class GraphArgumentSpec {
    static final String OPTIONAL_MARKER = "?";

    private final List<Entry> entries;

    private GraphArgumentSpec(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * Single required graph at position 0.
     */
    public static GraphArgumentSpec single(String name) {
        return of(Map.of(name, 0));
    }

    public static GraphArgumentSpec of(Map<String, Integer> spec) {
        if (spec == null || spec.isEmpty()) {
            throw new RegistrationException("'graphs' must contain at least one variable name");
        }
        List<Entry> parsed = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Map.Entry<String, Integer> raw : spec.entrySet()) {
            String name = Objects.requireNonNull(raw.getKey(), "graph name");
            Integer position = raw.getValue();
            boolean optional = name.endsWith(OPTIONAL_MARKER);
            if (optional) {
                name = name.substring(0, name.length() - OPTIONAL_MARKER.length());
            }
            if (name.isBlank()) {
                throw new RegistrationException("Graph argument names must not be blank");
            }
            if (position == null || position < 0) {
                throw new RegistrationException("Graph argument '" + name + "' needs a non-negative position");
            }
            if (!seen.add(name)) {
                throw new RegistrationException("Graph argument '" + name + "' declared twice");
            }
            parsed.add(new Entry(name, position, optional));
        }
        parsed.sort((a, b) -> Integer.compare(a.position(), b.position()));
        return new GraphArgumentSpec(parsed);
    }

    public List<Entry> entries() {
        return entries;
    }

    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        for (Entry entry : entries) {
            names.add(entry.name());
        }
        return names;
    }

    /**
     * Picks the graph values out of a call. Optional graphs that are absent or {@code null} are
     * left out of the result.
     */
    public Map<String, Object> resolve(String algorithm, CallArguments arguments) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Entry entry : entries) {
            String name = entry.name();
            Object value;
            if (entry.position() < arguments.size()) {
                if (arguments.hasKeyword(name)) {
                    throw new ArgumentResolutionException(algorithm + "() got multiple values for '" + name + "'");
                }
                value = arguments.positional(entry.position());
            } else if (arguments.hasKeyword(name)) {
                value = arguments.keyword(name);
            } else if (!entry.optional()) {
                throw new ArgumentResolutionException(algorithm + "() missing required graph argument: " + name);
            } else {
                continue;
            }
            if (value == null) {
                if (!entry.optional()) {
                    throw new ArgumentResolutionException(
                        algorithm + "() required graph argument '" + name + "' is None; must be a graph"
                    );
                }
            } else {
                resolved.put(name, value);
            }
        }
        return resolved;
    }

    public record Entry(String name, int position, boolean optional) {}
}
