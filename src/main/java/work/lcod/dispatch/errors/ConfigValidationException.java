package work.lcod.dispatch.errors;

/**
 * Raised for invalid config values and, on strict configs, for undeclared keys.
 */
public final class ConfigValidationException extends DispatchException {
    private final String key;

    public ConfigValidationException(String key, String message) {
        super("config_validation_error", message);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
