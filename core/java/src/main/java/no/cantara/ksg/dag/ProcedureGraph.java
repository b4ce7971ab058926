package no.cantara.ksg.dag;

import java.util.List;

/** The loaded, uniform view of a stored procedure's steps. */
public record ProcedureGraph(String conceptUuid, String name, List<GraphStep> steps) {
    public ProcedureGraph {
        steps = List.copyOf(steps);
    }
}
