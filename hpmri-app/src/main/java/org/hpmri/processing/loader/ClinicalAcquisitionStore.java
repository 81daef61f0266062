package org.hpmri.processing.loader;

import org.hpmri.processing.MagnetType;

/**
 * Store for clinical scanners, which export proton DICOM frames but no HP-MRI spectra.
 */
public class ClinicalAcquisitionStore
        extends DicomAcquisitionStore {

    public static final FileNamingConvention DEFAULT_IMAGE_NAMING =
            new FileNamingConvention("clinical_", 5, ".dcm", 0);

    public ClinicalAcquisitionStore(final AcquisitionStoreConfig config) {
        super(config);
    }

    @Override
    public MagnetType getMagnetType() {
        return MagnetType.CLINICAL;
    }
}
