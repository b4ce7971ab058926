package no.cantara.ksg.dag;

/** How a step whose guard passed will be run. */
public sealed interface StepResolution permits StepResolution.Tool, StepResolution.Nested, StepResolution.Unresolved {

    /** Dispatch to the caller. */
    record Tool(ToolCommand command) implements StepResolution {}

    /** Recurse into another procedure concept. */
    record Nested(ToolCommand command) implements StepResolution {}

    /** Neither a tool nor a resolvable nested reference. */
    record Unresolved(String reason) implements StepResolution {}
}
