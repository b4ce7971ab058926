package no.cantara.ksg.procedure;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a procedure description before it is built into the graph.
 *
 * <p>Every rule is checked so that all defects are reported together. Returns a
 * {@link ValidationResult} with {@code errors} (must fix) and {@code warnings} (should fix).
 * Validation never throws.
 */
public class ProcedureValidator {

    /**
     * A single structural defect.
     *
     * @param path    JSON-path style location, e.g. {@code $.steps[2].id}
     * @param message human-readable description
     */
    public record ValidationError(String path, String message) {
        @Override
        public String toString() {
            return path + ": " + message;
        }
    }

    /**
     * Immutable result of validating a procedure description.
     *
     * @param errors   Conditions that make the description invalid (MUST fix).
     * @param warnings Conditions that are permitted but suspicious (SHOULD fix).
     */
    public record ValidationResult(List<ValidationError> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    /**
     * Validate serialized (JSON or YAML) text. A parse failure yields a single error
     * at {@code $} and no further checks.
     */
    public static ValidationResult validate(String text) {
        Map<String, Object> data;
        try {
            data = ProcedureParser.parse(text);
        } catch (ProcedureParser.ParseException e) {
            return new ValidationResult(List.of(new ValidationError("$", e.getMessage())), List.of());
        }
        return validate(data);
    }

    public static ValidationResult validate(Map<String, Object> data) {
        List<ValidationError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (data == null) {
            errors.add(new ValidationError("$", "procedure description is required"));
            return new ValidationResult(errors, warnings);
        }

        // Required root fields
        if (isBlank(data.get("name"))) {
            errors.add(new ValidationError("$.name", "'name' is required"));
        }
        if (isBlank(data.get("description"))) {
            errors.add(new ValidationError("$.description", "'description' is required"));
        }

        Object rawSteps = data.get("steps");
        List<?> steps = List.of();
        if (rawSteps == null) {
            errors.add(new ValidationError("$.steps", "'steps' is required"));
        } else if (!(rawSteps instanceof List<?> list)) {
            errors.add(new ValidationError("$.steps", "'steps' must be a sequence"));
        } else if (list.isEmpty()) {
            errors.add(new ValidationError("$.steps", "'steps' must not be empty"));
        } else {
            steps = list;
        }

        // Declared ids, first index wins
        Map<String, Integer> firstIndex = new LinkedHashMap<>();
        Map<String, List<String>> deps = new LinkedHashMap<>();

        for (int i = 0; i < steps.size(); i++) {
            String p = "$.steps[" + i + "]";
            if (!(steps.get(i) instanceof Map<?, ?> step)) {
                errors.add(new ValidationError(p, "step must be a mapping"));
                continue;
            }
            Object id = step.get("id");
            String stepId = isBlank(id) ? null : id.toString();
            if (stepId == null) {
                errors.add(new ValidationError(p + ".id", "'id' is required"));
            }
            if (isBlank(step.get("tool"))) {
                errors.add(new ValidationError(p + ".tool", "'tool' is required"));
            }
            if (step.get("params") == null) {
                warnings.add(p + ": no 'params' declared");
            } else if (!(step.get("params") instanceof Map)) {
                errors.add(new ValidationError(p + ".params", "'params' must be a mapping"));
            }

            Object rawDeps = step.get("depends_on");
            if (rawDeps != null && !(rawDeps instanceof List)) {
                errors.add(new ValidationError(p + ".depends_on", "'depends_on' must be a sequence"));
            }
            if (stepId == null) {
                continue;
            }
            Integer earlier = firstIndex.putIfAbsent(stepId, i);
            if (earlier != null) {
                errors.add(new ValidationError(p + ".id",
                        "duplicate step id '" + stepId + "' (also declared at $.steps[" + earlier + "])"));
            } else {
                deps.put(stepId, ProcedureParser.stringList(rawDeps instanceof List ? rawDeps : null));
            }
        }

        // Unknown dependencies
        for (int i = 0; i < steps.size(); i++) {
            if (!(steps.get(i) instanceof Map<?, ?> step) || !(step.get("depends_on") instanceof List<?> list)) {
                continue;
            }
            for (String dep : ProcedureParser.stringList(list)) {
                if (!firstIndex.containsKey(dep)) {
                    errors.add(new ValidationError("$.steps[" + i + "].depends_on",
                            "unknown dependency '" + dep + "'"));
                }
            }
        }

        for (List<String> cycle : detectCycles(deps)) {
            String first = cycle.get(0);
            errors.add(new ValidationError("$.steps[" + firstIndex.get(first) + "].depends_on",
                    "Circular dependency detected: " + String.join(" -> ", cycle)));
        }

        return new ValidationResult(errors, warnings);
    }

    /**
     * Detect cycles in the depends_on relation using DFS, restricted to declared ids.
     *
     * @return each cycle as a path that starts and ends with the same id
     */
    static List<List<String>> detectCycles(Map<String, List<String>> deps) {
        List<List<String>> cycles = new ArrayList<>();
        Map<String, Integer> state = new HashMap<>();
        for (String id : deps.keySet()) {
            state.put(id, 0);
        }
        for (String id : deps.keySet()) {
            if (state.get(id) == 0) {
                dfs(id, deps, state, new LinkedHashSet<>(), cycles);
            }
        }
        return cycles;
    }

    private static void dfs(String node, Map<String, List<String>> deps, Map<String, Integer> state,
                            LinkedHashSet<String> path, List<List<String>> cycles) {
        state.put(node, 1);
        path.add(node);
        for (String dep : deps.getOrDefault(node, List.of())) {
            if (!deps.containsKey(dep)) {
                continue;
            }
            int depState = state.getOrDefault(dep, 0);
            if (depState == 1) {
                cycles.add(cycleFrom(path, dep));
            } else if (depState == 0) {
                dfs(dep, deps, state, path, cycles);
            }
        }
        path.remove(node);
        state.put(node, 2);
    }

    private static List<String> cycleFrom(Set<String> path, String start) {
        List<String> cycle = new ArrayList<>();
        boolean on = false;
        for (String id : path) {
            if (id.equals(start)) on = true;
            if (on) cycle.add(id);
        }
        cycle.add(start);
        return cycle;
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
