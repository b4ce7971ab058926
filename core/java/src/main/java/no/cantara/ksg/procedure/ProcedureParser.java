package no.cantara.ksg.procedure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses serialized procedure descriptions (JSON or YAML) into maps, and maps into
 * {@link ProcedureDescription}s.
 */
public class ProcedureParser {

    // SafeConstructor disables arbitrary Java type instantiation via YAML tags.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /** Thrown when text cannot be parsed into a mapping. */
    public static class ParseException extends IllegalArgumentException {
        public ParseException(String msg, Throwable cause) { super(msg, cause); }
        public ParseException(String msg) { super(msg); }
    }

    public static Map<String, Object> parse(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Text starting with <code>{</code> is read as JSON, anything else as YAML.
     *
     * @throws ParseException if the text is not a well-formed mapping
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ParseException("Empty procedure description");
        }
        String trimmed = text.strip();
        if (trimmed.startsWith("{")) {
            try {
                return JSON.readValue(trimmed, MAP_TYPE);
            } catch (JsonProcessingException e) {
                throw new ParseException("Invalid JSON: " + e.getOriginalMessage(), e);
            }
        }
        Object loaded;
        try {
            loaded = YAML.load(trimmed);
        } catch (YAMLException e) {
            throw new ParseException("Invalid YAML: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map<?, ?> m)) {
            throw new ParseException("Procedure description must be a mapping, got "
                    + (loaded == null ? "nothing" : loaded.getClass().getSimpleName()));
        }
        return (Map<String, Object>) m;
    }

    /**
     * Builds a typed description. Callers are expected to have validated the map first;
     * structurally unusable input raises {@link IllegalArgumentException}.
     */
    @SuppressWarnings("unchecked")
    public static ProcedureDescription fromMap(Map<String, Object> data) {
        Object rawSteps = data.get("steps");
        if (!(rawSteps instanceof List<?> stepList)) {
            throw new IllegalArgumentException("Procedure description has no 'steps' sequence");
        }
        List<StepDescriptor> steps = new ArrayList<>();
        for (int i = 0; i < stepList.size(); i++) {
            Object s = stepList.get(i);
            if (!(s instanceof Map<?, ?> stepMap)) {
                throw new IllegalArgumentException("steps[" + i + "] is not a mapping");
            }
            StepDescriptor step = parseStep((Map<String, Object>) stepMap, i);
            if (step.id() == null || step.id().isBlank()) {
                throw new IllegalArgumentException("steps[" + i + "] has no 'id'");
            }
            steps.add(step);
        }
        return new ProcedureDescription(
                asString(data.get("name")),
                asString(data.get("description")),
                asString(data.get("goal")),
                stringList(data.get("tags")),
                steps,
                data.get("metadata") instanceof Map<?, ?> meta ? (Map<String, Object>) meta : Map.of()
        );
    }

    @SuppressWarnings("unchecked")
    static StepDescriptor parseStep(Map<String, Object> s, int index) {
        Object params = s.get("params");
        Object order = s.get("order");
        Object retries = s.get("retries");
        return new StepDescriptor(
                asString(s.get("id")),
                asString(s.get("name")),
                asString(s.get("tool")),
                params instanceof Map<?, ?> p ? (Map<String, Object>) p : Map.of(),
                stringList(s.get("depends_on")),
                s.get("guard"),
                order instanceof Number n ? n.intValue() : index,
                asString(s.get("on_fail")),
                retries instanceof Number r ? r.intValue() : 0
        );
    }

    static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    /** A list of strings from a list, a single scalar, or nothing. */
    static List<String> stringList(Object value) {
        if (value == null) return List.of();
        if (value instanceof List<?> list) {
            return list.stream().filter(v -> v != null).map(Object::toString).toList();
        }
        return List.of(value.toString());
    }
}
