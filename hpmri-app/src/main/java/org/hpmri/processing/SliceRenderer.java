package org.hpmri.processing;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import org.hpmri.processing.filter.ContrastEnhancer;
import org.hpmri.processing.filter.ImageNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw acquisition frame into a displayable 8-bit slice (normalize, then enhance).
 * Instances are immutable and every call works on fresh copies of the source pixels.
 */
public class SliceRenderer {

    private final ImageNormalizer normalizer;
    private final ContrastEnhancer enhancer;

    public SliceRenderer() {
        this(ImageNormalizer.DEFAULT_ABSOLUTE_FLOOR, ImageNormalizer.DEFAULT_RELATIVE_FLOOR);
    }

    public SliceRenderer(final double absoluteFloor,
                         final double relativeFloor) {
        this(new ImageNormalizer(absoluteFloor, relativeFloor),
             new ContrastEnhancer(absoluteFloor, relativeFloor));
    }

    public SliceRenderer(final ImageNormalizer normalizer,
                         final ContrastEnhancer enhancer) {
        this.normalizer = normalizer;
        this.enhancer = enhancer;
    }

    public ByteProcessor render(final FloatProcessor raw,
                                final double contrast) {

        LOG.debug("render: entry, {}x{} frame, contrast={}", raw.getWidth(), raw.getHeight(), contrast);

        final FloatProcessor normalized = normalizer.process(raw);
        return enhancer.process(normalized, contrast);
    }

    @Override
    public String toString() {
        return "{normalizer: " + normalizer.toParametersMap() + ", enhancer: " + enhancer.toParametersMap() + '}';
    }

    private static final Logger LOG = LoggerFactory.getLogger(SliceRenderer.class);
}
