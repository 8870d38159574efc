package org.smtflat.encoder.api;

/**
 * Base type of every failure raised while encoding IR values or reading
 * models back. Nothing below the driver recovers from it.
 */
public class EncodingException extends RuntimeException {

    private final EncodingErrorCode code;

    /**
     * Constructs a new encoding exception.
     * @param code The error code identifying the failure.
     * @param message The detail message.
     */
    public EncodingException(EncodingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * @return The error code identifying the failure.
     */
    public EncodingErrorCode code() {
        return code;
    }
}
