package work.lcod.dispatch.errors;

/**
 * Base exception for dispatch failures. Carries a stable error code next to the message.
 */
public class DispatchException extends RuntimeException {
    private final String code;

    public DispatchException(String code, String message) {
        super(message);
        this.code = code;
    }

    public DispatchException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
