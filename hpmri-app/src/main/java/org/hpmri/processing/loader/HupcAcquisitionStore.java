package org.hpmri.processing.loader;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.hpmri.processing.MagnetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store for the HUPC magnet: proton DICOM frames plus exported EPSI datasets.
 * EPSI series are returned exactly as stored in each dataset file.
 */
public class HupcAcquisitionStore
        extends DicomAcquisitionStore {

    public static final FileNamingConvention DEFAULT_IMAGE_NAMING =
            new FileNamingConvention("proton_", 5, ".dcm", 0);

    public static final FileNamingConvention DEFAULT_SPECTRA_NAMING =
            new FileNamingConvention("epsi_", 5, ".json", 0);

    public HupcAcquisitionStore(final AcquisitionStoreConfig config) {
        super(config);
    }

    @Override
    public MagnetType getMagnetType() {
        return MagnetType.HUPC;
    }

    @Override
    public boolean hasSpectra() {
        return true;
    }

    @Override
    public int getSpectrumCount() {
        return countFiles(getConfig().getSpectraDirectory(), getConfig().getSpectraNaming());
    }

    @Override
    public double[] loadSpectrum(final int index)
            throws AcquisitionNotFoundException, AcquisitionDecodeException {

        final File epsiFile = resolveFile(getConfig().getSpectraDirectory(),
                                          getConfig().getSpectraNaming(),
                                          index,
                                          getSpectrumCount(),
                                          "EPSI dataset");

        LOG.debug("loadSpectrum: loading {}", epsiFile);

        final EpsiDataset dataset;
        try (final Reader reader = Files.newBufferedReader(epsiFile.toPath(), StandardCharsets.UTF_8)) {
            dataset = EpsiDataset.fromJson(reader);
        } catch (final IOException | IllegalArgumentException e) {
            throw new AcquisitionDecodeException("failed to decode '" + epsiFile + "'", e);
        }

        if ((dataset == null) || (dataset.getValues() == null)) {
            throw new AcquisitionDecodeException("failed to decode '" + epsiFile + "', no values found");
        }

        return dataset.getValues();
    }

    private static final Logger LOG = LoggerFactory.getLogger(HupcAcquisitionStore.class);
}
