package work.lcod.dispatch.tooling;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.dispatch.config.ConfigScope;
import work.lcod.dispatch.config.DispatchConfig;
import work.lcod.dispatch.errors.NotImplementedByBackendException;
import work.lcod.dispatch.runtime.DispatchContext;

/**
 * Replays conformance cases, usually with the conversion harness pointed at a backend, and
 * classifies each outcome.
 */
public final class ConformanceRunner {
    private static final Logger log = LoggerFactory.getLogger(ConformanceRunner.class);

    private final DispatchContext context;

    public ConformanceRunner(DispatchContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Runs {@code cases} with {@code test_backend} set to {@code backend} for the duration of the run.
     */
    public ConformanceReport runAgainst(String backend, List<ConformanceCase> cases) {
        Objects.requireNonNull(backend, "backend");
        try (ConfigScope ignored = context.config().override(Map.of(DispatchConfig.TEST_BACKEND, backend))) {
            return run(cases);
        }
    }

    /**
     * Runs {@code cases} under the current configuration. When a test backend is configured, its
     * {@code onStartTests} hook sees every case first.
     */
    public ConformanceReport run(List<ConformanceCase> cases) {
        String backend = context.config().testBackend();
        if (backend != null) {
            context.plugins().load(backend).onStartTests(List.copyOf(cases));
        }
        List<ConformanceReport.Result> results = new ArrayList<>();
        for (ConformanceCase testCase : cases) {
            results.add(runCase(testCase));
        }
        var report = new ConformanceReport(backend, results);
        log.info(
            "Conformance run against {}: {} passed, {} failed, {} xfailed, {} xpassed",
            backend == null ? "native" : backend,
            report.count(ConformanceReport.Outcome.PASSED),
            report.count(ConformanceReport.Outcome.FAILED),
            report.count(ConformanceReport.Outcome.XFAILED),
            report.count(ConformanceReport.Outcome.XPASSED)
        );
        return report;
    }

    private ConformanceReport.Result runCase(ConformanceCase testCase) {
        try {
            testCase.run();
        } catch (NotImplementedByBackendException ex) {
            if (ex.soft() || testCase.expectedFailure()) {
                return new ConformanceReport.Result(testCase.name(), ConformanceReport.Outcome.XFAILED, ex.getMessage());
            }
            return new ConformanceReport.Result(testCase.name(), ConformanceReport.Outcome.FAILED, ex.getMessage());
        } catch (Exception | AssertionError ex) {
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            if (testCase.expectedFailure()) {
                return new ConformanceReport.Result(testCase.name(), ConformanceReport.Outcome.XFAILED, message);
            }
            return new ConformanceReport.Result(testCase.name(), ConformanceReport.Outcome.FAILED, message);
        }
        if (testCase.expectedFailure()) {
            return new ConformanceReport.Result(
                testCase.name(),
                ConformanceReport.Outcome.XPASSED,
                testCase.expectedFailureReason().orElse(null)
            );
        }
        return new ConformanceReport.Result(testCase.name(), ConformanceReport.Outcome.PASSED, null);
    }
}
