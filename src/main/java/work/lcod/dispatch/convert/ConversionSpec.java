package work.lcod.dispatch.convert;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.dispatch.runtime.BoundArguments;

/**
 * Edge and node conversion rules declared when an algorithm is registered.
 */
public record ConversionSpec(
    AttributeConversionSpec edgeAttrs,
    AttributeConversionSpec nodeAttrs,
    PreserveAttributes preserveEdgeAttrs,
    PreserveAttributes preserveNodeAttrs
) {
    /** Missing edge attributes default to a unit weight. */
    public static final Object DEFAULT_EDGE_VALUE = 1;

    public ConversionSpec {
        Objects.requireNonNull(edgeAttrs, "edgeAttrs");
        Objects.requireNonNull(nodeAttrs, "nodeAttrs");
        Objects.requireNonNull(preserveEdgeAttrs, "preserveEdgeAttrs");
        Objects.requireNonNull(preserveNodeAttrs, "preserveNodeAttrs");
    }

    public static ConversionSpec none() {
        return new ConversionSpec(
            AttributeConversionSpec.none(),
            AttributeConversionSpec.none(),
            PreserveAttributes.never(),
            PreserveAttributes.never()
        );
    }

    public Set<String> referencedArguments() {
        Set<String> names = new LinkedHashSet<>();
        names.addAll(edgeAttrs.referencedArguments());
        names.addAll(nodeAttrs.referencedArguments());
        preserveEdgeAttrs.argument().ifPresent(names::add);
        preserveNodeAttrs.argument().ifPresent(names::add);
        return names;
    }

    /**
     * Conversion parameters for one call. Preserving all attributes of a kind wins over any
     * attribute list of that kind.
     */
    public ConversionRequest plan(String algorithm, BoundArguments bound) {
        boolean preserveEdges = preserveEdgeAttrs.resolve(bound);
        boolean preserveNodes = preserveNodeAttrs.resolve(bound);
        Map<String, Object> edges = preserveEdges ? null : edgeAttrs.resolve(bound, DEFAULT_EDGE_VALUE);
        Map<String, Object> nodes = preserveNodes ? null : nodeAttrs.resolve(bound, null);
        return new ConversionRequest(edges, nodes, preserveEdges, preserveNodes, algorithm);
    }
}
