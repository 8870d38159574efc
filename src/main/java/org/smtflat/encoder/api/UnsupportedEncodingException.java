package org.smtflat.encoder.api;

/**
 * Thrown when the input is well-typed but uses a construct the encoder
 * refuses to model rather than approximate, so that callers can abstain from
 * verifying it.
 */
public class UnsupportedEncodingException extends EncodingException {

    private final String feature;

    /**
     * Constructs a new unsupported-input fault.
     * @param code The error code.
     * @param feature Short name of the unsupported feature.
     */
    public UnsupportedEncodingException(EncodingErrorCode code, String feature) {
        super(code, "Unsupported: " + feature);
        this.feature = feature;
    }

    public String feature() {
        return feature;
    }
}
