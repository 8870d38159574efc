package org.smtflat.encoder.api;

import org.smtflat.encoder.ast.Ast;

/**
 * Outcome of a conversion attempt that does not throw, letting a driver treat
 * a refused construct as an inconclusive verification instead of a crash.
 */
public sealed interface ConversionResult permits ConversionResult.Converted, ConversionResult.Refused {

    /**
     * The expression was encoded.
     * @param ast The resulting Ast.
     */
    record Converted(Ast ast) implements ConversionResult {}

    /**
     * The expression was refused.
     * @param code The error code of the refusal.
     * @param message The detail message.
     */
    record Refused(EncodingErrorCode code, String message) implements ConversionResult {}

    /**
     * @return {@code true} if the expression was encoded.
     */
    default boolean isConverted() {
        return this instanceof Converted;
    }
}
