package work.lcod.dispatch.runtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.dispatch.errors.ArgumentResolutionException;

/**
 * Ordered parameter list used to bind positional and named values of a call.
 */
public final class Signature {
    private final List<Parameter> parameters;

    public Signature(List<Parameter> parameters) {
        var names = new HashSet<String>();
        for (Parameter parameter : parameters) {
            if (!names.add(parameter.name())) {
                throw new IllegalArgumentException("Duplicate parameter name: " + parameter.name());
            }
        }
        this.parameters = List.copyOf(parameters);
    }

    public static Signature of(Parameter... parameters) {
        return new Signature(List.of(parameters));
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public Optional<Parameter> parameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public boolean declares(String name) {
        return parameter(name).isPresent();
    }

    public int indexOf(String name) {
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        for (Parameter parameter : parameters) {
            names.add(parameter.name());
        }
        return names;
    }

    public BoundArguments bind(String algorithm, CallArguments arguments) {
        if (arguments.size() > parameters.size()) {
            throw new ArgumentResolutionException(
                algorithm + "() takes " + parameters.size() + " positional arguments but " + arguments.size() + " were given"
            );
        }
        for (String keyword : arguments.keywords().keySet()) {
            if (!declares(keyword)) {
                throw new ArgumentResolutionException(algorithm + "() got an unexpected keyword argument '" + keyword + "'");
            }
        }
        Map<String, Object> bound = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            String name = parameter.name();
            if (i < arguments.size()) {
                if (arguments.hasKeyword(name)) {
                    throw new ArgumentResolutionException(algorithm + "() got multiple values for '" + name + "'");
                }
                bound.put(name, arguments.positional(i));
            } else if (arguments.hasKeyword(name)) {
                bound.put(name, arguments.keyword(name));
            } else if (parameter.hasDefault()) {
                bound.put(name, parameter.defaultValue());
            } else {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new ArgumentResolutionException(algorithm + "() missing required arguments: " + String.join(", ", missing));
        }
        return new BoundArguments(bound);
    }
}
