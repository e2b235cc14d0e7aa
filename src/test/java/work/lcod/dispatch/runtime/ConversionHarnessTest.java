package work.lcod.dispatch.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.dispatch.config.ConfigScope;
import work.lcod.dispatch.config.DispatchConfig;
import work.lcod.dispatch.errors.ExpectedFailureException;
import work.lcod.dispatch.errors.NotImplementedByBackendException;
import work.lcod.dispatch.support.DispatchTestSupport;
import work.lcod.dispatch.support.DispatchTestSupport.DemoBackend;
import work.lcod.dispatch.support.DispatchTestSupport.LoopbackBackend;
import work.lcod.dispatch.support.DispatchTestSupport.NativeGraph;

class ConversionHarnessTest {
    private final DemoBackend demo = new DemoBackend();
    private final LoopbackBackend loopback = new LoopbackBackend();
    private final DispatchContext ctx = DispatchTestSupport.standardContext(loopback, demo);

    private ConfigScope testBackend(String backend) {
        return ctx.config().override(Map.of(DispatchConfig.TEST_BACKEND, backend));
    }

    @Test
    void convertsInputsAndResultsThroughTheTestBackend() throws Exception {
        var g = new NativeGraph("g");
        var h = new NativeGraph("h");
        try (ConfigScope ignored = testBackend("loopback")) {
            assertEquals("loopback", ctx.call("whoami", CallArguments.of(g)));
            assertSame(g, ctx.call("union", CallArguments.of(g, h)));
        }
        assertEquals(3, loopback.conversions().size());
        assertEquals("native", ctx.call("whoami", CallArguments.of(g)));
    }

    @Test
    void harnessIgnoresTheBackendKeyword() throws Exception {
        try (ConfigScope ignored = testBackend("loopback")) {
            assertEquals("loopback", ctx.call("whoami", CallArguments.of(new NativeGraph("g")).with("backend", "demo")));
        }
        assertTrue(demo.conversions().isEmpty());
    }

    @Test
    void absentOptionalGraphsAreNotConverted() throws Exception {
        try (ConfigScope ignored = testBackend("loopback")) {
            assertEquals("no H", ctx.call("maybe", CallArguments.of(new NativeGraph("g"))));
            assertEquals(1, loopback.conversions().size());
            assertEquals("H converted", ctx.call("maybe", CallArguments.of(new NativeGraph("g"), new NativeGraph("h"))));
        }
        assertEquals(3, loopback.conversions().size());
    }

    @Test
    void conversionPlanUsesDefaultsFromTheSignature() throws Exception {
        try (ConfigScope ignored = testBackend("loopback")) {
            assertEquals(Map.of("weight", 1), ctx.call("edge_weights", CallArguments.of(new NativeGraph("g"))));
        }
        var request = loopback.conversions().get(0);
        assertEquals("edge_weights", request.algorithm());
        assertFalse(request.preserveEdgeAttrs());
        assertEquals(null, request.nodeAttrs());
    }

    @Test
    void referenceBackendGapsAreHardFailures() {
        try (ConfigScope ignored = testBackend("loopback")) {
            var ex = assertThrows(
                NotImplementedByBackendException.class,
                () -> ctx.call("only_native", CallArguments.of(new NativeGraph("g")))
            );
            assertFalse(ex.soft());
            assertEquals("'only_native' not found in LoopbackBackend", ex.getMessage());
        }
    }

    @Test
    void otherBackendGapsAreExpectedFailures() {
        try (ConfigScope ignored = testBackend("demo")) {
            var ex = assertThrows(
                ExpectedFailureException.class,
                () -> ctx.call("edge_weights", CallArguments.of(new NativeGraph("g")))
            );
            assertTrue(ex.soft());
            assertEquals("'edge_weights' not implemented by demo", ex.getMessage());
        }
        assertTrue(demo.conversions().isEmpty());
    }

    @Test
    void harnessPassesOptionsForTheTestBackendOnly() throws Exception {
        try (ConfigScope ignored = testBackend("loopback")) {
            ctx.call(
                "whoami",
                CallArguments.of(new NativeGraph("g"))
                    .with("loopback_kwargs", Map.of("extra", 1))
                    .with("demo_kwargs", Map.of("other", 2))
            );
        }
        CallArguments received = loopback.calls().get(0);
        assertEquals(1, received.keyword("extra"));
        assertFalse(received.hasKeyword("other"));
    }
}
