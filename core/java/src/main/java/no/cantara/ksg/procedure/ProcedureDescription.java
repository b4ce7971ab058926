package no.cantara.ksg.procedure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A procedure as submitted by a user, tool or reasoning layer, before it is materialized
 * in the graph.
 */
public record ProcedureDescription(
        String name,
        String description,
        String goal,
        List<String> tags,
        List<StepDescriptor> steps,
        Map<String, Object> metadata
) {
    public ProcedureDescription {
        tags = tags != null ? List.copyOf(tags) : List.of();
        steps = steps != null ? List.copyOf(steps) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /** Sum of all {@code depends_on} list lengths; equals the number of dependency edges built. */
    public int dependencyCount() {
        return steps.stream().mapToInt(s -> s.dependsOn().size()).sum();
    }
}
