package org.hpmri.processing.loader;

import ij.process.FloatProcessor;

import org.hpmri.processing.MagnetType;

/**
 * Describes methods required for all backend acquisition stores.
 *
 * Implementations are the only place where a backend's file naming and indexing conventions are encoded.
 * Stores are read-only and must be safe for concurrent use.
 */
public interface AcquisitionStore {

    /**
     * @return the backend this store reads from.
     */
    MagnetType getMagnetType();

    /**
     * @return number of available image frames (zero means no data, not an error).
     */
    int getImageCount();

    /**
     * @param  index  zero-based slider index of the frame to load.
     *
     * @return raw intensity matrix for the specified frame.
     *
     * @throws AcquisitionNotFoundException
     *   if no file corresponds to the index.
     *
     * @throws AcquisitionDecodeException
     *   if the file exists but cannot be decoded.
     */
    FloatProcessor loadImage(final int index)
            throws AcquisitionNotFoundException, AcquisitionDecodeException;

    /**
     * @return true if this backend produces spectroscopic (EPSI) datasets; otherwise false.
     */
    boolean hasSpectra();

    /**
     * @return number of available spectroscopic datasets (always zero for backends without spectra).
     */
    int getSpectrumCount();

    /**
     * @param  index  zero-based index of the dataset to load.
     *
     * @return spectral series for the specified dataset
     *         or an empty array if this backend has no spectroscopic capability.
     *
     * @throws AcquisitionNotFoundException
     *   if spectra are supported but no file corresponds to the index.
     *
     * @throws AcquisitionDecodeException
     *   if the file exists but cannot be decoded.
     */
    double[] loadSpectrum(final int index)
            throws AcquisitionNotFoundException, AcquisitionDecodeException;

}
