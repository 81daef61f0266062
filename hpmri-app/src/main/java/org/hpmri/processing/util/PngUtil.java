package org.hpmri.processing.util;

import ij.process.ByteProcessor;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;

import ar.com.hjg.pngj.FilterType;
import ar.com.hjg.pngj.ImageInfo;
import ar.com.hjg.pngj.ImageLineInt;
import ar.com.hjg.pngj.PngWriter;

/**
 * Writes rendered slices as 8-bit grayscale PNG images using the PNGJ library.
 */
public class PngUtil {

    public static final String PNG_FORMAT = "png";
    public static final int DEFAULT_COMPRESSION_LEVEL = 6;

    public static void writeGrayscalePng(final ByteProcessor slice,
                                         final OutputStream outputStream)
            throws IOException {
        writeGrayscalePng(slice, DEFAULT_COMPRESSION_LEVEL, FilterType.FILTER_PAETH, outputStream);
    }

    /**
     * @param  slice             8-bit pixels to write.
     * @param  compressionLevel  0 (no compression) - 9 (max compression)
     * @param  filterType        internal prediction filter type.
     * @param  outputStream      target stream (left open).
     */
    public static void writeGrayscalePng(final ByteProcessor slice,
                                         final int compressionLevel,
                                         final FilterType filterType,
                                         final OutputStream outputStream)
            throws IOException {

        // cols, rows, bitDepth, alpha, grayscale, indexed
        final ImageInfo imageInfo = new ImageInfo(slice.getWidth(), slice.getHeight(), 8, false, true, false);

        final PngWriter pngWriter = new PngWriter(outputStream, imageInfo);
        pngWriter.setCompLevel(compressionLevel);
        pngWriter.setFilterType(filterType);
        pngWriter.setShouldCloseStream(false);

        final byte[] pixels = (byte[]) slice.getPixels();
        final int[] scanline = new int[imageInfo.cols];
        final ImageLineInt line = new ImageLineInt(imageInfo, scanline);
        for (int row = 0; row < imageInfo.rows; row++) {
            final int offset = row * imageInfo.cols;
            for (int col = 0; col < imageInfo.cols; col++) {
                scanline[col] = pixels[offset + col] & 0xff;
            }
            pngWriter.writeRow(line, row);
        }
        pngWriter.end();
    }

    public static void writeGrayscalePng(final ByteProcessor slice,
                                         final File file)
            throws IOException {
        try (final OutputStream outputStream = new FileOutputStream(file)) {
            writeGrayscalePng(slice, outputStream);
        }
    }
}
