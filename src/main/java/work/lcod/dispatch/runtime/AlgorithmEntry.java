package work.lcod.dispatch.runtime;

/**
 * Registered algorithm: canonical name, native body and the dispatching wrapper around it.
 */
public record AlgorithmEntry(String name, Algorithm nativeAlgorithm, DispatchableAlgorithm wrapper) {}
