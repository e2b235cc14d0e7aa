package work.lcod.dispatch.plugin;

/**
 * Capability of graph objects owned by a backend. Graphs without it use the native representation.
 */
public interface BackendGraph {
    String backendName();
}
