package work.lcod.dispatch.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.dispatch.errors.ArgumentResolutionException;
import work.lcod.dispatch.errors.RegistrationException;

class GraphArgumentSpecTest {
    private final GraphArgumentSpec spec = GraphArgumentSpec.of(Map.of("H?", 1, "G", 0));

    @Test
    void entriesAreOrderedByPositionWithMarkerStripped() {
        assertEquals(
            List.of(new GraphArgumentSpec.Entry("G", 0, false), new GraphArgumentSpec.Entry("H", 1, true)),
            spec.entries()
        );
    }

    @Test
    void resolvesPositionalAndKeywordGraphs() {
        assertEquals(Map.of("G", "g", "H", "h"), spec.resolve("f", CallArguments.of("g", "h")));
        assertEquals(Map.of("G", "g", "H", "h"), spec.resolve("f", CallArguments.of("g").with("H", "h")));
    }

    @Test
    void skipsAbsentOrNullOptionalGraphs() {
        assertEquals(Map.of("G", "g"), spec.resolve("f", CallArguments.of("g")));
        assertEquals(Map.of("G", "g"), spec.resolve("f", CallArguments.of("g", null)));
    }

    @Test
    void requiredGraphMustBePresentAndNotNull() {
        var missing = assertThrows(ArgumentResolutionException.class, () -> spec.resolve("f", CallArguments.of()));
        assertEquals("f() missing required graph argument: G", missing.getMessage());
        var nullGraph = assertThrows(ArgumentResolutionException.class, () -> spec.resolve("f", CallArguments.of((Object) null)));
        assertEquals("f() required graph argument 'G' is None; must be a graph", nullGraph.getMessage());
    }

    @Test
    void positionalAndKeywordForTheSameGraphConflict() {
        var ex = assertThrows(
            ArgumentResolutionException.class,
            () -> spec.resolve("f", CallArguments.of("g").with("G", "other"))
        );
        assertTrue(ex.getMessage().contains("multiple values for 'G'"));
    }

    @Test
    void rejectsInvalidDeclarations() {
        assertThrows(RegistrationException.class, () -> GraphArgumentSpec.of(Map.of()));
        assertThrows(RegistrationException.class, () -> GraphArgumentSpec.of(Map.of("?", 0)));
        assertThrows(RegistrationException.class, () -> GraphArgumentSpec.of(Map.of("G", -1)));
        assertThrows(RegistrationException.class, () -> GraphArgumentSpec.of(Map.of("G", 0, "G?", 1)));
    }
}
