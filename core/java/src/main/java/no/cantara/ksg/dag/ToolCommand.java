package no.cantara.ksg.dag;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A resolved step, handed to the caller's dispatch callback. Nested sub-procedures resolve to
 * the {@value #DAG_EXECUTE} sentinel and are executed by the core instead of dispatched.
 */
public record ToolCommand(String tool, Map<String, Object> params, String conceptUuid, boolean nested) {

    public static final String DAG_EXECUTE = "dag.execute";

    public ToolCommand {
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
    }

    public static ToolCommand tool(String tool, Map<String, Object> params) {
        return new ToolCommand(tool, params, null, false);
    }

    public static ToolCommand nested(String conceptUuid) {
        return new ToolCommand(DAG_EXECUTE, Map.of(), conceptUuid, true);
    }
}
