package work.lcod.dispatch.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Converts configs to plain maps and JSON. Nested configs become maps, sets become sorted lists.
 */
public final class ConfigCodec {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON.writerWithDefaultPrettyPrinter();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private ConfigCodec() {}

    public static Map<String, Object> toPlain(Config config) {
        Map<String, Object> plain = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : config.export().entrySet()) {
            plain.put(entry.getKey(), plainValue(entry.getValue()));
        }
        return plain;
    }

    public static String toJson(Config config) {
        try {
            return WRITER.writeValueAsString(toPlain(config));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize config: " + ex.getMessage(), ex);
        }
    }

    public static Map<String, Object> readPlain(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return new LinkedHashMap<>(JSON.readValue(json, MAP_REF));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid JSON config payload: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Object plainValue(Object value) {
        if (value instanceof Config nested) {
            return toPlain(nested);
        }
        if (value instanceof Set<?> set) {
            boolean allStrings = set.stream().allMatch(String.class::isInstance);
            Collection<?> ordered = allStrings ? new TreeSet<>(set) : set;
            return plainList(ordered);
        }
        if (value instanceof Collection<?> collection) {
            return plainList(collection);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> plain = new LinkedHashMap<>();
            map.forEach((key, item) -> plain.put(String.valueOf(key), plainValue(item)));
            return plain;
        }
        return value;
    }

    private static List<Object> plainList(Collection<?> items) {
        List<Object> plain = new ArrayList<>(items.size());
        for (Object item : items) {
            plain.add(plainValue(item));
        }
        return plain;
    }
}
