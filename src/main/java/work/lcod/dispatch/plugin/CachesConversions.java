package work.lcod.dispatch.plugin;

import java.util.Map;

/**
 * Capability of native graphs that can keep converted copies of themselves.
 * Implementations must clear the cache whenever the graph changes.
 */
public interface CachesConversions {
    Map<Object, Object> conversionCache();
}
