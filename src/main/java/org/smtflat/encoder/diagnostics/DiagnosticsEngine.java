package org.smtflat.encoder.diagnostics;

import org.smtflat.encoder.api.EncodingErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics produced during one encoding session so that a driver
 * can report refused or weakly modelled constructs after the fact.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param subject The IR node or Ast concerned.
     * @param message The error message.
     */
    public void reportError(EncodingErrorCode code, String subject, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, subject, message));
    }

    /**
     * Reports a warning.
     *
     * @param code    The error code describing the weakness, may be {@code null}.
     * @param subject The IR node or Ast concerned.
     * @param message The warning message.
     */
    public void reportWarning(EncodingErrorCode code, String subject, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, subject, message));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
