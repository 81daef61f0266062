package org.hpmri.processing.filter;

import ij.process.FloatProcessor;

import java.io.Serializable;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps raw acquisition intensities into [0,1]:
 * <ol>
 *     <li>raw values below the absolute noise floor become 0,</li>
 *     <li>the remaining range is rescaled using the matrix's own min and max,</li>
 *     <li>rescaled values below the relative floor become 0.</li>
 * </ol>
 * A flat matrix (min == max after flooring) normalizes to all zeros.
 */
public class ImageNormalizer
        implements Serializable {

    public static final double DEFAULT_ABSOLUTE_FLOOR = 5.0;
    public static final double DEFAULT_RELATIVE_FLOOR = 0.05;

    private final double absoluteFloor;
    private final double relativeFloor;

    public ImageNormalizer() {
        this(DEFAULT_ABSOLUTE_FLOOR, DEFAULT_RELATIVE_FLOOR);
    }

    public ImageNormalizer(final double absoluteFloor,
                           final double relativeFloor) {
        this.absoluteFloor = absoluteFloor;
        this.relativeFloor = relativeFloor;
    }

    public double getAbsoluteFloor() {
        return absoluteFloor;
    }

    public double getRelativeFloor() {
        return relativeFloor;
    }

    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("absoluteFloor", String.valueOf(absoluteFloor));
        map.put("relativeFloor", String.valueOf(relativeFloor));
        return map;
    }

    /**
     * @param  raw  raw intensities (not modified).
     *
     * @return new processor with normalized intensities in [0,1].
     */
    public FloatProcessor process(final FloatProcessor raw) {

        final float[] rawPixels = (float[]) raw.getPixels();
        final float[] pixels = new float[rawPixels.length];

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (int i = 0; i < rawPixels.length; i++) {
            // NaN fails the comparison and is treated as noise
            final float value = rawPixels[i] >= absoluteFloor ? rawPixels[i] : 0.0f;
            pixels[i] = value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        final double range = max - min;
        if (range > 0.0) {
            for (int i = 0; i < pixels.length; i++) {
                final double normalized = (pixels[i] - min) / range;
                pixels[i] = normalized < relativeFloor ? 0.0f : (float) normalized;
            }
        } else {
            Arrays.fill(pixels, 0.0f);
        }

        return new FloatProcessor(raw.getWidth(), raw.getHeight(), pixels);
    }

}
