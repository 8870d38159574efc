package org.smtflat.encoder.api;

import java.util.List;

/**
 * Thrown when an Ast operation is applied in a way the typed IR should have
 * ruled out: projecting from a scalar, selecting from a non-array, a symbolic
 * field index, a union initializer with more than one member, and so on.
 * <p>
 * Carries the offending operation and the names of the Ast operands so the
 * upstream defect can be diagnosed.
 */
public class EncodingContractException extends EncodingException {

    private final String operation;
    private final List<String> astNames;

    /**
     * Constructs a new contract violation.
     * @param code The error code.
     * @param operation The operation that was attempted (e.g. "project").
     * @param detail A human-readable description of the violation.
     * @param astNames The names of the Asts involved.
     */
    public EncodingContractException(EncodingErrorCode code, String operation, String detail, String... astNames) {
        super(code, String.format("%s: %s %s", operation, detail, List.of(astNames)));
        this.operation = operation;
        this.astNames = List.of(astNames);
    }

    public String operation() {
        return operation;
    }

    public List<String> astNames() {
        return astNames;
    }
}
