package org.hpmri.processing;

import java.io.Serializable;

import org.hpmri.processing.filter.ThresholdFilter;
import org.hpmri.processing.json.JsonUtils;

/**
 * Ready-to-plot spectral series for one dataset after threshold filtering.
 *
 * Values are on the peak-normalized scale the threshold applies to.
 * Multiplying them by {@link #getPeak()} restores the dataset's stored scale.
 * Backends without spectroscopic capability produce an unsupported (empty) instance rather than an error.
 */
public class ThresholdedSpectrum
        implements Serializable {

    private final String magnetType;
    private final int datasetIndex;
    private final double threshold;
    private final double peak;
    private final boolean supported;
    private final double[] values;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ThresholdedSpectrum() {
        this(null, 0, ThresholdFilter.DEFAULT_THRESHOLD, 0.0, false, new double[0]);
    }

    public ThresholdedSpectrum(final String magnetType,
                               final int datasetIndex,
                               final double threshold,
                               final double peak,
                               final boolean supported,
                               final double[] values) {
        this.magnetType = magnetType;
        this.datasetIndex = datasetIndex;
        this.threshold = threshold;
        this.peak = peak;
        this.supported = supported;
        this.values = values.clone();
    }

    public static ThresholdedSpectrum unsupported(final MagnetType magnetType,
                                                  final int datasetIndex,
                                                  final double threshold) {
        return new ThresholdedSpectrum(magnetType.getDisplayName(), datasetIndex, threshold, 0.0, false,
                                       new double[0]);
    }

    public String getMagnetType() {
        return magnetType;
    }

    public int getDatasetIndex() {
        return datasetIndex;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return largest absolute sample of the stored series (0 for unsupported or all-zero datasets).
     */
    public double getPeak() {
        return peak;
    }

    /**
     * @return false if the backend has no spectroscopic capability (values will be empty).
     */
    public boolean isSupported() {
        return supported;
    }

    /**
     * @return copy of the thresholded values.
     */
    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static ThresholdedSpectrum fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    @Override
    public String toString() {
        return "{magnetType: '" + magnetType + "', datasetIndex: " + datasetIndex +
               ", threshold: " + threshold + ", peak: " + peak + ", supported: " + supported + ", size: " + values.length + '}';
    }

    private static final JsonUtils.Helper<ThresholdedSpectrum> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, ThresholdedSpectrum.class);
}
