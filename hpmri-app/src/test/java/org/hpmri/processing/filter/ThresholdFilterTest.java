package org.hpmri.processing.filter;

import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ThresholdFilter} class.
 */
public class ThresholdFilterTest {

    @Test
    public void testApply() {
        final double[] series = { 0.1, 0.2, 0.19999, 0.5, -0.3, 1.0 };
        final double[] seriesCopy = series.clone();

        final double[] filtered = ThresholdFilter.apply(series, 0.2);

        Assert.assertArrayEquals("invalid filtered series",
                                 new double[] { 0.0, 0.2, 0.0, 0.5, 0.0, 1.0 }, filtered, 0.0);
        Assert.assertArrayEquals("source series should not be modified", seriesCopy, series, 0.0);
        Assert.assertEquals("empty series should stay empty", 0, ThresholdFilter.apply(new double[0], 0.2).length);
    }

    @Test
    public void testIdempotentAndMonotonic() {

        final Random random = new Random(7);
        final double[] series = new double[200];
        for (int i = 0; i < series.length; i++) {
            series[i] = random.nextDouble() * 2.0 - 0.5;
        }

        int previousNonZeroCount = Integer.MAX_VALUE;
        for (double threshold = -1.0; threshold <= 2.0; threshold += 0.05) {
            final double[] once = ThresholdFilter.apply(series, threshold);
            final double[] twice = ThresholdFilter.apply(once, threshold);
            Assert.assertArrayEquals("filtering should be idempotent for threshold " + threshold, once, twice, 0.0);

            final int nonZeroCount = ThresholdFilter.countNonZero(once);
            Assert.assertTrue("raising threshold to " + threshold + " increased non-zero count",
                              nonZeroCount <= previousNonZeroCount);
            previousNonZeroCount = nonZeroCount;
        }

        Assert.assertEquals("threshold above max should zero everything",
                            0, ThresholdFilter.countNonZero(ThresholdFilter.apply(series, 2.0)));
    }

    @Test
    public void testNormalizeToPeak() {
        final double[] raw = { 0.0, 2.0, -4.0, 8.0, 1.0 };

        final double peak = ThresholdFilter.getPeak(raw);
        Assert.assertEquals("invalid peak", 8.0, peak, 0.0);

        final double[] normalized = ThresholdFilter.normalizeToPeak(raw, peak);
        Assert.assertArrayEquals("series should be scaled to peak",
                                 new double[] { 0.0, 0.25, -0.5, 1.0, 0.125 }, normalized, 0.000001);
        Assert.assertArrayEquals("raw series should not be modified",
                                 new double[] { 0.0, 2.0, -4.0, 8.0, 1.0 }, raw, 0.0);

        final double[] flat = { 0.0, 0.0, 0.0 };
        Assert.assertEquals("flat series should have zero peak", 0.0, ThresholdFilter.getPeak(flat), 0.0);
        Assert.assertArrayEquals("flat series should stay zero",
                                 flat, ThresholdFilter.normalizeToPeak(flat, 0.0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNThreshold() {
        ThresholdFilter.apply(new double[] { 1.0 }, Double.NaN);
    }
}
