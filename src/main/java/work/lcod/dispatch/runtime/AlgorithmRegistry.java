package work.lcod.dispatch.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.lcod.dispatch.errors.RegistrationException;

/**
 * Append-only map from canonical algorithm name to its dispatch wrapper.
 *
 * <p>Not synchronized: register algorithms during initialization, before concurrent calls start.</p>
 */
public final class AlgorithmRegistry {
    private final Map<String, AlgorithmEntry> algorithms = new LinkedHashMap<>();

    public AlgorithmEntry register(String name, DispatchableAlgorithm wrapper) {
        if (name == null || name.isBlank()) {
            throw new RegistrationException("Algorithm name must not be blank");
        }
        if (algorithms.containsKey(name)) {
            throw new RegistrationException("Algorithm already exists in dispatch registry: " + name);
        }
        wrapper.attachName(name);
        var entry = new AlgorithmEntry(name, wrapper.nativeAlgorithm(), wrapper);
        algorithms.put(name, entry);
        return entry;
    }

    public Optional<DispatchableAlgorithm> lookup(String name) {
        return Optional.ofNullable(algorithms.get(name)).map(AlgorithmEntry::wrapper);
    }

    public Optional<AlgorithmEntry> entry(String name) {
        return Optional.ofNullable(algorithms.get(name));
    }

    public boolean contains(String name) {
        return algorithms.containsKey(name);
    }

    public Map<String, AlgorithmEntry> entries() {
        return Collections.unmodifiableMap(algorithms);
    }
}
