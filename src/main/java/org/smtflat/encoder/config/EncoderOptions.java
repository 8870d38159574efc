package org.smtflat.encoder.config;

import com.typesafe.config.Config;

/**
 * Tunables of the encoding layer, read from the {@code smtflat.encoder} block.
 *
 * @param pointerWidth Machine word width of both pointer fields.
 * @param infiniteDomainWidth Index width of unbounded and non-constant sized arrays.
 * @param readbackMaxDomainWidth Readback enumerates at most 2^this many array indices.
 * @param maxBroadcastWidth Largest domain width a scalar broadcast may enumerate.
 */
public record EncoderOptions(int pointerWidth,
                             int infiniteDomainWidth,
                             int readbackMaxDomainWidth,
                             int maxBroadcastWidth) {

    private static final String PATH = "smtflat.encoder";

    public EncoderOptions {
        if (pointerWidth <= 0) throw new IllegalArgumentException("pointer-width must be positive");
        if (infiniteDomainWidth <= 0) throw new IllegalArgumentException("array.infinite-domain-width must be positive");
        if (readbackMaxDomainWidth < 0) throw new IllegalArgumentException("readback.max-domain-width must not be negative");
        if (maxBroadcastWidth < 0) throw new IllegalArgumentException("array.max-broadcast-width must not be negative");
    }

    /**
     * @param config A resolved configuration containing {@code smtflat.encoder}.
     * @return The options.
     */
    public static EncoderOptions fromConfig(Config config) {
        Config c = config.getConfig(PATH);
        return new EncoderOptions(
                c.getInt("pointer-width"),
                c.getInt("array.infinite-domain-width"),
                c.getInt("readback.max-domain-width"),
                c.getInt("array.max-broadcast-width"));
    }

    /**
     * @return The options from {@code reference.conf} alone.
     */
    public static EncoderOptions defaults() {
        return fromConfig(com.typesafe.config.ConfigFactory.parseResources("reference.conf").resolve());
    }
}
