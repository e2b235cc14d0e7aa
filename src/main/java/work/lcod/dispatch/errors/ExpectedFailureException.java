package work.lcod.dispatch.errors;

/**
 * Soft variant of {@link NotImplementedByBackendException} raised by the conversion harness for
 * backends other than the reference one.
 */
public final class ExpectedFailureException extends NotImplementedByBackendException {
    public ExpectedFailureException(String algorithm, String backend) {
        super(algorithm, backend, "'" + algorithm + "' not implemented by " + backend);
    }

    @Override
    public boolean soft() {
        return true;
    }
}
