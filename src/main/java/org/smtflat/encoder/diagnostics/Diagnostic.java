package org.smtflat.encoder.diagnostics;

import org.smtflat.encoder.api.EncodingErrorCode;

/**
 * A single diagnostic message (error, warning, info) raised while encoding
 * or reading back.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code, or {@code null} for purely informational messages.
 * @param subject The IR node or Ast the message is about.
 * @param message The diagnostic message.
 */
public record Diagnostic(
        Type type,
        EncodingErrorCode code,
        String subject,
        String message
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A construct was refused. */
        ERROR,
        /** A construct was encoded with a documented weakness. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return code == null
                ? String.format("[%s] %s: %s", type, subject, message)
                : String.format("[%s] %s %s: %s", type, code, subject, message);
    }
}
