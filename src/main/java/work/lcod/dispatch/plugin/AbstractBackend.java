package work.lcod.dispatch.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.dispatch.runtime.Algorithm;

/**
 * Backend keeping its algorithms in a name to implementation table.
 */
public abstract class AbstractBackend implements Backend {
    private final String name;
    private final Map<String, Algorithm> algorithms = new LinkedHashMap<>();

    protected AbstractBackend(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    protected final AbstractBackend implement(String algorithm, Algorithm implementation) {
        algorithms.put(algorithm, Objects.requireNonNull(implementation, "implementation"));
        return this;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public Optional<Algorithm> algorithm(String algorithm) {
        return Optional.ofNullable(algorithms.get(algorithm));
    }

    public Map<String, Algorithm> algorithms() {
        return Collections.unmodifiableMap(algorithms);
    }
}
