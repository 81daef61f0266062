package org.hpmri.processing.loader;

import ij.IJ;
import ij.ImagePlus;
import ij.plugin.DICOM;
import ij.process.FloatProcessor;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base store for backends that export one DICOM file per image frame.
 * Subclasses supply naming defaults and may add spectroscopic capability.
 */
public abstract class DicomAcquisitionStore
        implements AcquisitionStore {

    private static final double[] NO_SPECTRUM = new double[0];

    private final AcquisitionStoreConfig config;

    protected DicomAcquisitionStore(final AcquisitionStoreConfig config) {
        this.config = config;
    }

    public AcquisitionStoreConfig getConfig() {
        return config;
    }

    @Override
    public int getImageCount() {
        return countFiles(config.getImageDirectory(), config.getImageNaming());
    }

    @Override
    public FloatProcessor loadImage(final int index)
            throws AcquisitionNotFoundException, AcquisitionDecodeException {

        final File dicomFile = resolveFile(config.getImageDirectory(),
                                           config.getImageNaming(),
                                           index,
                                           getImageCount(),
                                           "DICOM file");

        LOG.debug("loadImage: loading {} for {} index {}", dicomFile, getMagnetType(), index);

        final ImagePlus imagePlus;
        try {
            // DICOM readers keep state about the file being opened, so we need a new reader for each load
            final DICOM dicom = new DICOM();
            IJ.redirectErrorMessages();
            dicom.open(dicomFile.getAbsolutePath());
            imagePlus = dicom;
        } catch (final Throwable t) {
            throw new AcquisitionDecodeException(getDecodeErrorMessage(dicomFile), t);
        }

        if ((imagePlus.getWidth() == 0) || (imagePlus.getProcessor() == null)) {
            // ImageJ reports decode problems through its log rather than by throwing
            throw new AcquisitionDecodeException(getDecodeErrorMessage(dicomFile) +
                                                 ", file is not a readable DICOM image",
                                                 buildNoPixelDataCause(dicomFile, imagePlus));
        }

        return imagePlus.getProcessor().convertToFloatProcessor();
    }

    /**
     * @return false by default, subclasses with spectroscopic capability should override.
     */
    @Override
    public boolean hasSpectra() {
        return false;
    }

    /**
     * @return zero by default, subclasses with spectroscopic capability should override.
     */
    @Override
    public int getSpectrumCount() {
        return 0;
    }

    /**
     * @return an empty series by default, subclasses with spectroscopic capability should override.
     */
    @Override
    public double[] loadSpectrum(final int index) {
        return NO_SPECTRUM;
    }

    @Override
    public String toString() {
        return getMagnetType() + " store " + config;
    }

    /**
     * @return number of files in the directory that follow the naming convention
     *         (zero if the directory is undefined or missing).
     */
    static int countFiles(final File directory,
                          final FileNamingConvention naming) {
        int count = 0;
        if ((directory != null) && (naming != null)) {
            final String[] names = directory.list((dir, name) -> naming.matches(name));
            if (names != null) {
                count = names.length;
            }
        }
        return count;
    }

    /**
     * @return existing file for the specified index.
     *
     * @throws AcquisitionNotFoundException
     *   if the index is out of range or the derived file does not exist.
     */
    static File resolveFile(final File directory,
                            final FileNamingConvention naming,
                            final int index,
                            final int count,
                            final String description)
            throws AcquisitionNotFoundException {

        if ((directory == null) || (index < 0) || (index >= count)) {
            throw new AcquisitionNotFoundException(
                    description + " index " + index + " is out of range, " + count + " files are available",
                    AcquisitionNotFoundException.Reason.INDEX_OUT_OF_RANGE);
        }

        final File file = new File(directory, naming.getFileName(index));
        if (! file.isFile()) {
            throw new AcquisitionNotFoundException(description + " " + file + " not found",
                                                   AcquisitionNotFoundException.Reason.FILE_MISSING);
        }

        return file;
    }

    private static IOException buildNoPixelDataCause(final File file,
                                                     final ImagePlus imagePlus) {
        final String header = imagePlus.getInfoProperty();
        final String headerSummary = (header == null) || header.trim().isEmpty() ?
                                     "no header information was parsed" :
                                     "parsed header was:\n" + header.trim();
        return new IOException("ImageJ DICOM reader returned no pixel data for '" + file + "', " + headerSummary);
    }

    private static String getDecodeErrorMessage(final File file) {
        return "failed to decode '" + file + "'";
    }

    private static final Logger LOG = LoggerFactory.getLogger(DicomAcquisitionStore.class);
}
