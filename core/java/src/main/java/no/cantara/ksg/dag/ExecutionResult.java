package no.cantara.ksg.dag;

import java.util.List;

/**
 * Outcome of one procedure run.
 *
 * @param status         {@code ERROR} only when the root concept could not be loaded
 * @param conceptUuid    the procedure that was run
 * @param executed       steps that resolved and ran, in execution order
 * @param pending        steps whose guard was false
 * @param skipped        steps that did not run because of their guard
 * @param errors         per-step failures; any entry makes the run {@code PARTIAL}
 * @param executionOrder the full scheduled order, including skipped steps
 * @param error          reason for an {@code ERROR} status, otherwise {@code null}
 */
public record ExecutionResult(
        Status status,
        String conceptUuid,
        List<ExecutedStep> executed,
        List<String> pending,
        List<String> skipped,
        List<StepError> errors,
        List<String> executionOrder,
        String error
) {

    public enum Status { COMPLETED, PARTIAL, ERROR }

    /** A step that ran. {@code nestedResult} is set when the step was a sub-procedure. */
    public record ExecutedStep(String stepId, ToolCommand command, ExecutionResult nestedResult) {}

    public record StepError(String stepId, String message) {}

    public ExecutionResult {
        executed = List.copyOf(executed);
        pending = List.copyOf(pending);
        skipped = List.copyOf(skipped);
        errors = List.copyOf(errors);
        executionOrder = List.copyOf(executionOrder);
    }

    static ExecutionResult failed(String conceptUuid, String error) {
        return new ExecutionResult(Status.ERROR, conceptUuid, List.of(), List.of(), List.of(), List.of(), List.of(), error);
    }

    public List<String> executedIds() {
        return executed.stream().map(ExecutedStep::stepId).toList();
    }
}
