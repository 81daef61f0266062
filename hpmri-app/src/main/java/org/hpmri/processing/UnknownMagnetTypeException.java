package org.hpmri.processing;

/**
 * This exception is thrown when a magnet type discriminator does not match any supported backend.
 */
public class UnknownMagnetTypeException
        extends IllegalArgumentException {

    private final String discriminator;

    public UnknownMagnetTypeException(final String discriminator) {
        super("invalid magnet type '" + discriminator + "'");
        this.discriminator = discriminator;
    }

    public String getDiscriminator() {
        return discriminator;
    }
}
