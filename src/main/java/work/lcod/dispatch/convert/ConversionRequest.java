package work.lcod.dispatch.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arguments handed to {@code Backend.convertFromNative}. A {@code null} attribute map means no
 * attribute of that kind is converted.
 */
public record ConversionRequest(
    Map<String, Object> edgeAttrs,
    Map<String, Object> nodeAttrs,
    boolean preserveEdgeAttrs,
    boolean preserveNodeAttrs,
    String algorithm
) {
    public ConversionRequest {
        edgeAttrs = edgeAttrs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(edgeAttrs));
        nodeAttrs = nodeAttrs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(nodeAttrs));
    }

    /**
     * Identity of the converted graph independent of the algorithm that asked for it.
     */
    public CacheKey cacheKey(String backend) {
        return new CacheKey(backend, edgeAttrs, nodeAttrs, preserveEdgeAttrs, preserveNodeAttrs);
    }

    public record CacheKey(
        String backend,
        Map<String, Object> edgeAttrs,
        Map<String, Object> nodeAttrs,
        boolean preserveEdgeAttrs,
        boolean preserveNodeAttrs
    ) {}
}
