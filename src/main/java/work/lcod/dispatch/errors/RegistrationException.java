package work.lcod.dispatch.errors;

/**
 * Raised when an algorithm or backend cannot be registered (duplicate name, empty graph spec, ...).
 */
public final class RegistrationException extends DispatchException {
    public RegistrationException(String message) {
        super("registration_error", message);
    }
}
