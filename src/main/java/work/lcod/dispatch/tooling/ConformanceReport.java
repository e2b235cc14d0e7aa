package work.lcod.dispatch.tooling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a {@link ConformanceRunner} pass.
 */
public record ConformanceReport(String backend, List<Result> results) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ConformanceReport {
        results = List.copyOf(results);
    }

    public long count(Outcome outcome) {
        return results.stream().filter(result -> result.outcome() == outcome).count();
    }

    public boolean success() {
        return count(Outcome.FAILED) == 0;
    }

    public Result result(String name) {
        return results.stream()
            .filter(result -> result.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No conformance case named " + name));
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> summary = new LinkedHashMap<>();
        for (Outcome outcome : Outcome.values()) {
            summary.put(outcome.name().toLowerCase(), count(outcome));
        }
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("backend", backend);
        serializable.put("success", success());
        serializable.put("summary", summary);
        serializable.put("results", results.stream().map(Result::toSerializableMap).toList());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize conformance report: " + ex.getMessage(), ex);
        }
    }

    public enum Outcome {
        PASSED,
        FAILED,
        /** Failed as expected: a soft not-implemented signal or a case the backend marked. */
        XFAILED,
        /** Marked as expected to fail, but passed. */
        XPASSED
    }

    public record Result(String name, Outcome outcome, String message) {
        Map<String, Object> toSerializableMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", name);
            map.put("outcome", outcome.name().toLowerCase());
            if (message != null) {
                map.put("message", message);
            }
            return map;
        }
    }
}
