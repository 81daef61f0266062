package org.hpmri.processing.loader;

import org.hpmri.processing.MagnetType;

/**
 * Store for MR Solutions magnets.
 *
 * The scanner numbers exported proton frames from 1 (e.g. {@code 5091_00001.dcm}),
 * so slider index 0 maps to file number 1.
 * Spectroscopic export is not supported for this backend.
 */
public class MrSolutionsAcquisitionStore
        extends DicomAcquisitionStore {

    public static final FileNamingConvention DEFAULT_IMAGE_NAMING =
            new FileNamingConvention("5091_", 5, ".dcm", 1);

    public MrSolutionsAcquisitionStore(final AcquisitionStoreConfig config) {
        super(config);
    }

    @Override
    public MagnetType getMagnetType() {
        return MagnetType.MR_SOLUTIONS;
    }
}
