package no.cantara.ksg.procedure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of a procedure description.
 *
 * @param id        unique within its procedure
 * @param name      human-readable label, optional
 * @param tool      command name, e.g. {@code web.fill}
 * @param params    tool parameters
 * @param dependsOn ids of sibling steps that must run first
 * @param guard     {@code null}, a Boolean, or a condition string
 * @param order     tie-break hint for scheduling
 * @param onFail    stop, skip, retry or ask_user
 * @param retries   retry budget when {@code onFail} is retry
 */
public record StepDescriptor(
        String id,
        String name,
        String tool,
        Map<String, Object> params,
        List<String> dependsOn,
        Object guard,
        int order,
        String onFail,
        int retries
) {
    public StepDescriptor {
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        onFail = onFail != null ? onFail : "stop";
    }

    /** The tool family, e.g. {@code web} for {@code web.fill}. */
    public String toolFamily() {
        if (tool == null) return "unknown";
        int dot = tool.indexOf('.');
        return dot > 0 ? tool.substring(0, dot) : tool;
    }
}
