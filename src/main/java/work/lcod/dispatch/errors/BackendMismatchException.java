package work.lcod.dispatch.errors;

import java.util.Set;

public final class BackendMismatchException extends DispatchException {
    private final Set<String> backends;

    public BackendMismatchException(String message, Set<String> backends) {
        super("backend_mismatch", message);
        this.backends = Set.copyOf(backends);
    }

    public Set<String> backends() {
        return backends;
    }
}
