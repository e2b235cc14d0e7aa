package work.lcod.dispatch.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import work.lcod.dispatch.convert.AttributeConversionSpec;
import work.lcod.dispatch.convert.ConversionSpec;
import work.lcod.dispatch.convert.PreserveAttributes;
import work.lcod.dispatch.errors.RegistrationException;

/**
 * Registration entry point for algorithm authors.
 *
 * <pre>{@code
 * Dispatchable.named("shortest_path", ShortestPaths::run)
 *     .parameters(Parameter.required("G"), Parameter.optional("weight", "weight"))
 *     .graphs("G")
 *     .edgeAttrs("weight")
 *     .register(context);
 * }</pre>
 */
public final class Dispatchable {
    private final String name;
    private final Algorithm body;
    private Signature signature;
    private GraphArgumentSpec graphs = GraphArgumentSpec.single("G");
    private AttributeConversionSpec edgeAttrs = AttributeConversionSpec.none();
    private AttributeConversionSpec nodeAttrs = AttributeConversionSpec.none();
    private PreserveAttributes preserveEdgeAttrs = PreserveAttributes.never();
    private PreserveAttributes preserveNodeAttrs = PreserveAttributes.never();

    private Dispatchable(String name, Algorithm body) {
        this.name = name;
        this.body = Objects.requireNonNull(body, "body");
    }

    public static Dispatchable named(String name, Algorithm body) {
        return new Dispatchable(name, body);
    }

    public Dispatchable parameters(Parameter... parameters) {
        this.signature = Signature.of(parameters);
        return this;
    }

    public Dispatchable signature(Signature signature) {
        this.signature = signature;
        return this;
    }

    /**
     * Single required graph at position 0.
     */
    public Dispatchable graphs(String name) {
        this.graphs = GraphArgumentSpec.single(name);
        return this;
    }

    /**
     * Graph name to position; a trailing {@code ?} marks an optional graph.
     */
    public Dispatchable graphs(Map<String, Integer> spec) {
        this.graphs = GraphArgumentSpec.of(spec);
        return this;
    }

    public Dispatchable edgeAttrs(String spec) {
        this.edgeAttrs = AttributeConversionSpec.parse(spec);
        return this;
    }

    public Dispatchable edgeAttrs(Map<String, ?> spec) {
        this.edgeAttrs = AttributeConversionSpec.mapping(spec);
        return this;
    }

    public Dispatchable edgeAttrs(AttributeConversionSpec spec) {
        this.edgeAttrs = Objects.requireNonNull(spec, "spec");
        return this;
    }

    public Dispatchable nodeAttrs(String spec) {
        this.nodeAttrs = AttributeConversionSpec.parse(spec);
        return this;
    }

    public Dispatchable nodeAttrs(Map<String, ?> spec) {
        this.nodeAttrs = AttributeConversionSpec.mapping(spec);
        return this;
    }

    public Dispatchable nodeAttrs(AttributeConversionSpec spec) {
        this.nodeAttrs = Objects.requireNonNull(spec, "spec");
        return this;
    }

    public Dispatchable preserveEdgeAttrs(boolean preserve) {
        this.preserveEdgeAttrs = PreserveAttributes.of(preserve);
        return this;
    }

    /**
     * Preserve all edge attributes when the named boolean argument is {@code true}.
     */
    public Dispatchable preserveEdgeAttrs(String argument) {
        this.preserveEdgeAttrs = PreserveAttributes.whenArgument(argument);
        return this;
    }

    public Dispatchable preserveNodeAttrs(boolean preserve) {
        this.preserveNodeAttrs = PreserveAttributes.of(preserve);
        return this;
    }

    public Dispatchable preserveNodeAttrs(String argument) {
        this.preserveNodeAttrs = PreserveAttributes.whenArgument(argument);
        return this;
    }

    /**
     * Builds the wrapper, checks it against its signature and adds it to the context's registry.
     */
    public DispatchableAlgorithm register(DispatchContext context) {
        if (name == null || name.isBlank()) {
            throw new RegistrationException("Dispatchable algorithms need a name");
        }
        Signature effective = signature != null ? signature : derivedSignature();
        validate(effective);
        var conversions = new ConversionSpec(edgeAttrs, nodeAttrs, preserveEdgeAttrs, preserveNodeAttrs);
        var wrapper = new DispatchableAlgorithm(context, name, body, effective, graphs, conversions);
        context.algorithms().register(name, wrapper);
        return wrapper;
    }

    private Signature derivedSignature() {
        List<Parameter> parameters = new ArrayList<>();
        for (GraphArgumentSpec.Entry entry : graphs.entries()) {
            if (entry.position() != parameters.size()) {
                throw new RegistrationException(
                    name + ": graph positions are not contiguous from 0; declare the parameters explicitly"
                );
            }
            parameters.add(entry.optional() ? Parameter.optional(entry.name(), null) : Parameter.required(entry.name()));
        }
        return new Signature(parameters);
    }

    private void validate(Signature effective) {
        Map<String, Integer> misplaced = new LinkedHashMap<>();
        Set<String> missing = new TreeSet<>();
        for (GraphArgumentSpec.Entry entry : graphs.entries()) {
            int index = effective.indexOf(entry.name());
            if (index < 0) {
                missing.add(entry.name());
            } else if (index != entry.position()) {
                misplaced.put(entry.name(), index);
            }
        }
        if (!missing.isEmpty()) {
            throw new RegistrationException(name + ": invalid graph names " + missing);
        }
        if (!misplaced.isEmpty()) {
            throw new RegistrationException(name + ": graph positions disagree with the parameter list " + misplaced);
        }
        Set<String> unknown = new TreeSet<>();
        for (String argument : new ConversionSpec(edgeAttrs, nodeAttrs, preserveEdgeAttrs, preserveNodeAttrs).referencedArguments()) {
            if (!effective.declares(argument)) {
                unknown.add(argument);
            }
        }
        if (!unknown.isEmpty()) {
            throw new RegistrationException(name + ": attribute conversion refers to unknown arguments " + unknown);
        }
    }
}
