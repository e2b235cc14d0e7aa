package work.lcod.dispatch.errors;

/**
 * Raised when call arguments cannot be matched to the declared parameters of an algorithm.
 */
public final class ArgumentResolutionException extends DispatchException {
    public ArgumentResolutionException(String message) {
        super("argument_resolution_error", message);
    }
}
