package org.hpmri.processing.filter;

/**
 * Zeroes spectral samples below an operator supplied threshold.
 *
 * Operator thresholds are given in [0,1], so raw series are first scaled by their peak
 * (see {@link #normalizeToPeak}) before being filtered.
 */
public class ThresholdFilter {

    public static final double DEFAULT_THRESHOLD = 0.2;

    /**
     * @param  series     samples to filter (not modified).
     * @param  threshold  samples strictly below this value become 0.
     *
     * @return new series of the same length.
     *
     * @throws IllegalArgumentException
     *   if the threshold is NaN.
     */
    public static double[] apply(final double[] series,
                                 final double threshold)
            throws IllegalArgumentException {

        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be a number");
        }

        final double[] filtered = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            filtered[i] = series[i] < threshold ? 0.0 : series[i];
        }
        return filtered;
    }

    /**
     * @return largest absolute sample in the series (0 for an empty or all-zero series).
     */
    public static double getPeak(final double[] series) {
        double peak = 0.0;
        for (final double value : series) {
            peak = Math.max(peak, Math.abs(value));
        }
        return peak;
    }

    /**
     * @return copy of the series divided by the specified peak
     *         (a non-positive peak returns an unscaled copy).
     */
    public static double[] normalizeToPeak(final double[] series,
                                           final double peak) {
        final double[] normalized = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            normalized[i] = peak > 0.0 ? series[i] / peak : series[i];
        }
        return normalized;
    }

    /**
     * @return number of non-zero samples in the series.
     */
    public static int countNonZero(final double[] series) {
        int count = 0;
        for (final double value : series) {
            if (value != 0.0) {
                count++;
            }
        }
        return count;
    }
}
