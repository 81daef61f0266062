package org.hpmri.processing;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

import org.hpmri.processing.filter.ThresholdFilter;
import org.hpmri.processing.loader.AcquisitionDecodeException;
import org.hpmri.processing.loader.AcquisitionNotFoundException;
import org.hpmri.processing.loader.AcquisitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes picture, count and spectral data requests to the store for the requested backend.
 *
 * Dispatch is a map lookup keyed by {@link MagnetType}, so unknown discriminators fail in
 * {@link MagnetType#fromDiscriminator} before any store (and any file) is touched.
 */
public class AcquisitionDispatcher {

    private final Map<MagnetType, AcquisitionStore> stores;
    private final SliceRenderer sliceRenderer;

    /**
     * @param  stores         store for every {@link MagnetType}.
     * @param  sliceRenderer  renderer for picture requests.
     *
     * @throws IllegalArgumentException
     *   if a store is missing for any backend or a store is registered under the wrong backend.
     */
    public AcquisitionDispatcher(final Map<MagnetType, AcquisitionStore> stores,
                                 final SliceRenderer sliceRenderer)
            throws IllegalArgumentException {

        final EnumMap<MagnetType, AcquisitionStore> map = new EnumMap<>(MagnetType.class);
        for (final MagnetType magnetType : MagnetType.values()) {
            final AcquisitionStore store = stores.get(magnetType);
            if (store == null) {
                throw new IllegalArgumentException("missing acquisition store for " + magnetType);
            } else if (store.getMagnetType() != magnetType) {
                throw new IllegalArgumentException(store.getMagnetType() + " store registered for " + magnetType);
            }
            map.put(magnetType, store);
        }

        this.stores = Collections.unmodifiableMap(map);
        this.sliceRenderer = sliceRenderer;
    }

    /**
     * @param  parametersForType  returns store parameters for each backend (empty map for defaults).
     * @param  sliceRenderer      renderer for picture requests.
     *
     * @return dispatcher with one store built per backend.
     */
    public static AcquisitionDispatcher build(final Function<MagnetType, Map<String, String>> parametersForType,
                                              final SliceRenderer sliceRenderer) {
        final Map<MagnetType, AcquisitionStore> stores = new EnumMap<>(MagnetType.class);
        for (final MagnetType magnetType : MagnetType.values()) {
            final AcquisitionStore store = magnetType.buildStore(parametersForType.apply(magnetType));
            LOG.info("build: created {}", store);
            stores.put(magnetType, store);
        }
        LOG.info("build: rendering with {}", sliceRenderer);
        return new AcquisitionDispatcher(stores, sliceRenderer);
    }

    public AcquisitionStore getStore(final MagnetType magnetType) {
        return stores.get(magnetType);
    }

    /**
     * @return 8-bit rendering of the specified frame.
     *
     * @throws AcquisitionNotFoundException
     *   if the frame does not exist.
     *
     * @throws AcquisitionDecodeException
     *   if the frame file cannot be decoded.
     */
    public ByteProcessor renderPicture(final MagnetType magnetType,
                                       final int index,
                                       final double contrast)
            throws AcquisitionNotFoundException, AcquisitionDecodeException {

        LOG.info("renderPicture: entry, magnetType={}, index={}, contrast={}", magnetType, index, contrast);

        final FloatProcessor raw = getStore(magnetType).loadImage(index);
        final ByteProcessor slice = sliceRenderer.render(raw, contrast);

        LOG.info("renderPicture: exit, rendered {}x{} slice", slice.getWidth(), slice.getHeight());

        return slice;
    }

    /**
     * @throws UnknownMagnetTypeException
     *   if the discriminator is not recognized (no I/O is attempted).
     */
    public ByteProcessor renderPicture(final String magnetTypeDiscriminator,
                                       final int index,
                                       final double contrast)
            throws UnknownMagnetTypeException, AcquisitionNotFoundException, AcquisitionDecodeException {
        return renderPicture(MagnetType.fromDiscriminator(magnetTypeDiscriminator), index, contrast);
    }

    /**
     * @return number of image frames available for the backend.
     */
    public int getImageCount(final MagnetType magnetType) {
        return getStore(magnetType).getImageCount();
    }

    /**
     * @return number of spectroscopic datasets available for the backend.
     */
    public int getSpectrumCount(final MagnetType magnetType) {
        return getStore(magnetType).getSpectrumCount();
    }

    /**
     * @return thresholded series for the specified dataset
     *         or an unsupported (empty) result if the backend has no spectroscopic capability.
     *
     * @throws AcquisitionNotFoundException
     *   if spectra are supported but the dataset does not exist.
     *
     * @throws AcquisitionDecodeException
     *   if the dataset file cannot be decoded.
     */
    public ThresholdedSpectrum getThresholdedData(final MagnetType magnetType,
                                                  final int datasetIndex,
                                                  final double threshold)
            throws AcquisitionNotFoundException, AcquisitionDecodeException {

        LOG.info("getThresholdedData: entry, magnetType={}, datasetIndex={}, threshold={}",
                 magnetType, datasetIndex, threshold);

        final AcquisitionStore store = getStore(magnetType);

        final ThresholdedSpectrum spectrum;
        if (store.hasSpectra()) {
            final double[] raw = store.loadSpectrum(datasetIndex);
            final double peak = ThresholdFilter.getPeak(raw);
            final double[] values = ThresholdFilter.apply(ThresholdFilter.normalizeToPeak(raw, peak), threshold);
            spectrum = new ThresholdedSpectrum(magnetType.getDisplayName(), datasetIndex, threshold, peak, true,
                                               values);
        } else {
            spectrum = ThresholdedSpectrum.unsupported(magnetType, datasetIndex, threshold);
        }

        LOG.info("getThresholdedData: exit, returning {}", spectrum);

        return spectrum;
    }

    public ThresholdedSpectrum getThresholdedData(final String magnetTypeDiscriminator,
                                                  final int datasetIndex,
                                                  final double threshold)
            throws UnknownMagnetTypeException, AcquisitionNotFoundException, AcquisitionDecodeException {
        return getThresholdedData(MagnetType.fromDiscriminator(magnetTypeDiscriminator), datasetIndex, threshold);
    }

    private static final Logger LOG = LoggerFactory.getLogger(AcquisitionDispatcher.class);
}
