package org.hpmri.processing.loader;

import java.io.Reader;
import java.io.Serializable;

import org.hpmri.processing.json.JsonUtils;

/**
 * One exported echo-planar spectroscopic imaging (EPSI) dataset: a single spectral series.
 */
public class EpsiDataset
        implements Serializable {

    private final double[] values;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private EpsiDataset() {
        this.values = null;
    }

    public EpsiDataset(final double[] values) {
        this.values = values;
    }

    /**
     * @return spectral samples or null if the source document did not include any.
     */
    public double[] getValues() {
        return values;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static EpsiDataset fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<EpsiDataset> JSON_HELPER =
            new JsonUtils.Helper<>(EpsiDataset.class);
}
