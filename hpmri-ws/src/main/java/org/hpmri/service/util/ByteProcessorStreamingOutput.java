package org.hpmri.service.util;

import ij.process.ByteProcessor;

import java.io.IOException;
import java.io.OutputStream;

import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.StreamingOutput;

import org.hpmri.processing.util.PngUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams a rendered 8-bit slice as the PNG response for a JAX-RS API request.
 * Uses {@link PngUtil#writeGrayscalePng} to do the real work.
 */
public class ByteProcessorStreamingOutput
        implements StreamingOutput {

    private final ByteProcessor slice;

    public ByteProcessorStreamingOutput(final ByteProcessor slice) {
        this.slice = slice;
    }

    @Override
    public void write(final OutputStream outputStream)
            throws IOException, WebApplicationException {

        LOG.debug("write: entry, {}x{} slice", slice.getWidth(), slice.getHeight());

        PngUtil.writeGrayscalePng(slice, outputStream);

        LOG.debug("write: exit");
    }

    private static final Logger LOG = LoggerFactory.getLogger(ByteProcessorStreamingOutput.class);
}
