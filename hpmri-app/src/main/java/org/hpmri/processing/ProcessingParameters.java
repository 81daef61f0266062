package org.hpmri.processing;

import java.io.Serializable;

import org.hpmri.processing.filter.ContrastEnhancer;
import org.hpmri.processing.json.JsonUtils;

/**
 * Per-request processing options as sent by viewer clients,
 * e.g. <code>{"magnetType": "MR Solutions", "contrast": 1.5}</code>.
 * Unspecified values fall back to defaults.
 */
public class ProcessingParameters
        implements Serializable {

    private final String magnetType;
    private final Double contrast;

    @SuppressWarnings("unused")
    public ProcessingParameters() {
        this(null, null);
    }

    public ProcessingParameters(final String magnetType,
                                final Double contrast) {
        this.magnetType = magnetType;
        this.contrast = contrast;
    }

    /**
     * @return raw magnet type discriminator (may be null).
     */
    public String getMagnetTypeDiscriminator() {
        return magnetType;
    }

    /**
     * @throws UnknownMagnetTypeException
     *   if the discriminator does not match a supported backend.
     */
    public MagnetType getMagnetType()
            throws UnknownMagnetTypeException {
        return MagnetType.fromDiscriminator(magnetType);
    }

    public double getContrast() {
        return contrast == null ? ContrastEnhancer.DEFAULT_CONTRAST : contrast;
    }

    @Override
    public String toString() {
        return JSON_HELPER.toJson(this);
    }

    public static ProcessingParameters fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<ProcessingParameters> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, ProcessingParameters.class);
}
