package work.lcod.dispatch.runtime;

/**
 * Executable algorithm body, native or backend-provided.
 */
@FunctionalInterface
public interface Algorithm {
    Object invoke(CallArguments arguments) throws Exception;
}
