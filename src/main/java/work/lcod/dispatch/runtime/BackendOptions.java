package work.lcod.dispatch.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.dispatch.errors.ArgumentResolutionException;

/**
 * {@code <backend>_kwargs} keywords of one call: options meant only for the backend that ends up
 * running it. Options for any other backend, and all of them on the native path, are dropped.
 */
final class BackendOptions {
    static final String SUFFIX = "_kwargs";

    private final String algorithm;
    private final CallArguments remaining;
    private final Map<String, Map<String, Object>> byBackend;

    private BackendOptions(String algorithm, CallArguments remaining, Map<String, Map<String, Object>> byBackend) {
        this.algorithm = algorithm;
        this.remaining = remaining;
        this.byBackend = byBackend;
    }

    /**
     * Splits option keywords off {@code arguments}. Keywords the signature declares are left alone.
     */
    static BackendOptions extract(String algorithm, Signature signature, CallArguments arguments) {
        CallArguments remaining = arguments;
        Map<String, Map<String, Object>> byBackend = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : arguments.keywords().entrySet()) {
            String keyword = entry.getKey();
            if (!keyword.endsWith(SUFFIX) || keyword.length() == SUFFIX.length() || signature.declares(keyword)) {
                continue;
            }
            Map<String, Object> options = new LinkedHashMap<>();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> map) {
                map.forEach((key, option) -> options.put(String.valueOf(key), option));
            } else if (value != null) {
                throw new ArgumentResolutionException(
                    algorithm + "() '" + keyword + "' must be a map of backend options, got " + value
                );
            }
            byBackend.put(keyword.substring(0, keyword.length() - SUFFIX.length()), options);
            remaining = remaining.without(keyword);
        }
        return new BackendOptions(algorithm, remaining, byBackend);
    }

    CallArguments remaining() {
        return remaining;
    }

    /**
     * Options addressed to {@code backend}; a {@code -} in the name may be written as {@code _}.
     */
    Map<String, Object> forBackend(String backend) {
        Map<String, Object> options = byBackend.get(backend);
        if (options == null) {
            options = byBackend.get(backend.replace('-', '_'));
        }
        return options == null ? Map.of() : options;
    }

    /**
     * Bound call for {@code backend} with its options added. An option naming a bound parameter
     * is a second value for it.
     */
    CallArguments applyTo(String backend, BoundArguments bound) {
        CallArguments call = bound.toCallArguments();
        for (Map.Entry<String, Object> option : forBackend(backend).entrySet()) {
            if (bound.contains(option.getKey())) {
                throw multipleValues(option.getKey());
            }
            call = call.with(option.getKey(), option.getValue());
        }
        return call;
    }

    /**
     * Unbound call for {@code backend} with its options added as keywords.
     */
    CallArguments applyTo(String backend, Signature signature, CallArguments arguments) {
        CallArguments call = arguments;
        for (Map.Entry<String, Object> option : forBackend(backend).entrySet()) {
            String name = option.getKey();
            int index = signature.indexOf(name);
            if (call.hasKeyword(name) || (index >= 0 && index < call.size())) {
                throw multipleValues(name);
            }
            call = call.with(name, option.getValue());
        }
        return call;
    }

    private ArgumentResolutionException multipleValues(String name) {
        return new ArgumentResolutionException(algorithm + "() got multiple values for '" + name + "'");
    }
}
