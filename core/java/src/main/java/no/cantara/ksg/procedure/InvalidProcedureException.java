package no.cantara.ksg.procedure;

import java.util.List;
import java.util.stream.Collectors;

/** Thrown when a procedure description fails validation and the caller asked for it to be built. */
public class InvalidProcedureException extends IllegalArgumentException {

    private final List<ProcedureValidator.ValidationError> errors;

    public InvalidProcedureException(List<ProcedureValidator.ValidationError> errors) {
        super("Invalid procedure description: " + errors.stream()
                .map(ProcedureValidator.ValidationError::toString)
                .collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ProcedureValidator.ValidationError> errors() {
        return errors;
    }
}
