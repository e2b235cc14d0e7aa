package work.lcod.dispatch.errors;

/**
 * Raised when a backend is not installed or its loader fails.
 */
public final class BackendUnavailableException extends DispatchException {
    private final String backend;

    public BackendUnavailableException(String backend, String message) {
        super("backend_unavailable", message);
        this.backend = backend;
    }

    public BackendUnavailableException(String backend, String message, Throwable cause) {
        super("backend_unavailable", message, cause);
        this.backend = backend;
    }

    public String backend() {
        return backend;
    }
}
