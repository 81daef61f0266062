package org.hpmri.processing.filter;

import ij.ImagePlus;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

import mpicbg.ij.clahe.Flat;

/**
 * Converts a normalized [0,1] image to 8 bits and applies contrast limited adaptive histogram equalization.
 *
 * The contextual region covers one cell of an 8x8 tiling of the image and the contrast strength is used as the
 * CLAHE slope (clip limit). Because equalization can lift suppressed noise, the absolute (8-bit) and relative
 * noise floors are re-applied afterwards.
 *
 * A non-positive contrast skips equalization, so the result is the plain 8-bit conversion with the floors applied.
 */
public class ContrastEnhancer
        implements Serializable {

    public static final double DEFAULT_CONTRAST = 1.0;
    public static final int TILES_PER_SIDE = 8;
    public static final int BINS = 256;

    private final double absoluteFloor;
    private final double relativeFloor;

    public ContrastEnhancer() {
        this(ImageNormalizer.DEFAULT_ABSOLUTE_FLOOR, ImageNormalizer.DEFAULT_RELATIVE_FLOOR);
    }

    public ContrastEnhancer(final double absoluteFloor,
                            final double relativeFloor) {
        this.absoluteFloor = absoluteFloor;
        this.relativeFloor = relativeFloor;
    }

    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("tilesPerSide", String.valueOf(TILES_PER_SIDE));
        map.put("bins", String.valueOf(BINS));
        map.put("absoluteFloor", String.valueOf(absoluteFloor));
        map.put("relativeFloor", String.valueOf(relativeFloor));
        return map;
    }

    /**
     * @param  normalized  normalized intensities in [0,1] (not modified).
     * @param  contrast    CLAHE slope, non-positive (or NaN) values disable equalization.
     *
     * @return new 8-bit processor ready for display.
     */
    public ByteProcessor process(final FloatProcessor normalized,
                                 final double contrast) {

        final ByteProcessor bp = toByteProcessor(normalized);

        if (contrast > 0.0) {
            final int blockRadius = getBlockRadius(bp.getWidth(), bp.getHeight());
            final ImagePlus imagePlus = new ImagePlus("", bp);
            Flat.getFastInstance().run(imagePlus, blockRadius, BINS, (float) contrast, null, false);
        }

        suppressNoise(bp);

        return bp;
    }

    /**
     * @return contextual region radius that corresponds to one tile of an 8x8 grid.
     */
    public static int getBlockRadius(final int width,
                                     final int height) {
        final double tileSize = (double) Math.max(width, height) / TILES_PER_SIDE;
        return Math.max(1, (int) Math.round(tileSize / 2.0));
    }

    /**
     * @return 8-bit copy of the normalized intensities (values are truncated, not rounded).
     */
    static ByteProcessor toByteProcessor(final FloatProcessor normalized) {
        final float[] pixels = (float[]) normalized.getPixels();
        final byte[] bytes = new byte[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            final float value = pixels[i];
            int scaled = 0;
            if (value > 0.0f) {
                scaled = value >= 1.0f ? 255 : (int) (value * 255.0f);
            }
            bytes[i] = (byte) scaled;
        }
        return new ByteProcessor(normalized.getWidth(), normalized.getHeight(), bytes);
    }

    private void suppressNoise(final ByteProcessor bp) {
        final byte[] bytes = (byte[]) bp.getPixels();
        for (int i = 0; i < bytes.length; i++) {
            final int value = bytes[i] & 0xff;
            if ((value < absoluteFloor) || ((value / 255.0) < relativeFloor)) {
                bytes[i] = 0;
            }
        }
    }

}
