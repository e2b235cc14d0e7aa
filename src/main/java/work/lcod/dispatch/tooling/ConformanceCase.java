package work.lcod.dispatch.tooling;

import java.util.Objects;
import java.util.Optional;

/**
 * One replayable check, typically a native algorithm test, that a backend can mark as a known gap.
 */
public final class ConformanceCase {
    private final String name;
    private final Body body;
    private String expectedFailureReason;

    private ConformanceCase(String name, Body body) {
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
    }

    public static ConformanceCase of(String name, Body body) {
        return new ConformanceCase(name, body);
    }

    public String name() {
        return name;
    }

    public void markExpectedFailure(String reason) {
        this.expectedFailureReason = reason == null ? "" : reason;
    }

    public boolean expectedFailure() {
        return expectedFailureReason != null;
    }

    public Optional<String> expectedFailureReason() {
        return Optional.ofNullable(expectedFailureReason);
    }

    void run() throws Exception {
        body.run();
    }

    @FunctionalInterface
    public interface Body {
        void run() throws Exception;
    }
}
