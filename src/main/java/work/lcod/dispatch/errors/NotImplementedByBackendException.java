package work.lcod.dispatch.errors;

/**
 * Raised when a loaded backend does not provide the requested algorithm.
 */
public class NotImplementedByBackendException extends DispatchException {
    private final String algorithm;
    private final String backend;

    public NotImplementedByBackendException(String algorithm, String backend, String message) {
        super("not_implemented", message);
        this.algorithm = algorithm;
        this.backend = backend;
    }

    public String algorithm() {
        return algorithm;
    }

    public String backend() {
        return backend;
    }

    /**
     * Soft failures mark a known gap in a backend and must not fail a conformance run.
     */
    public boolean soft() {
        return false;
    }
}
