package no.cantara.ksg.dag;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A step as the executor sees it, whether it was stored inline or as its own concept.
 *
 * @param id          step id, unique within the graph
 * @param tool        command name, or {@code null} for a nested sub-procedure
 * @param params      tool parameters with bookkeeping keys removed
 * @param guard       raw guard value
 * @param dependsOn   ids of steps that must be scheduled first
 * @param order       tie-break hint
 * @param conceptUuid nested procedure to run instead of a tool, or {@code null}
 */
public record GraphStep(
        String id,
        String tool,
        Map<String, Object> params,
        Object guard,
        List<String> dependsOn,
        int order,
        String conceptUuid
) {
    public GraphStep {
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }
}
