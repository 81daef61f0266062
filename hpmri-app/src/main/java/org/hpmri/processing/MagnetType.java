package org.hpmri.processing;

import java.util.Map;
import java.util.function.Function;

import org.hpmri.processing.loader.AcquisitionStore;
import org.hpmri.processing.loader.AcquisitionStoreConfig;
import org.hpmri.processing.loader.ClinicalAcquisitionStore;
import org.hpmri.processing.loader.FileNamingConvention;
import org.hpmri.processing.loader.HupcAcquisitionStore;
import org.hpmri.processing.loader.MrSolutionsAcquisitionStore;

/**
 * Supported acquisition backends.
 * Adding a backend means adding a constant here along with its {@link AcquisitionStore} implementation.
 */
public enum MagnetType {

    HUPC("HUPC",
         HupcAcquisitionStore::new,
         HupcAcquisitionStore.DEFAULT_IMAGE_NAMING,
         HupcAcquisitionStore.DEFAULT_SPECTRA_NAMING),

    CLINICAL("Clinical",
             ClinicalAcquisitionStore::new,
             ClinicalAcquisitionStore.DEFAULT_IMAGE_NAMING,
             null),

    MR_SOLUTIONS("MR Solutions",
                 MrSolutionsAcquisitionStore::new,
                 MrSolutionsAcquisitionStore.DEFAULT_IMAGE_NAMING,
                 null);

    /** Backend used when a request does not specify one. */
    public static final MagnetType DEFAULT = HUPC;

    private final String displayName;
    private final Function<AcquisitionStoreConfig, AcquisitionStore> storeFactory;
    private final FileNamingConvention defaultImageNaming;
    private final FileNamingConvention defaultSpectraNaming;

    MagnetType(final String displayName,
               final Function<AcquisitionStoreConfig, AcquisitionStore> storeFactory,
               final FileNamingConvention defaultImageNaming,
               final FileNamingConvention defaultSpectraNaming) {
        this.displayName = displayName;
        this.storeFactory = storeFactory;
        this.defaultImageNaming = defaultImageNaming;
        this.defaultSpectraNaming = defaultSpectraNaming;
    }

    /**
     * @return name used by clients (e.g. "MR Solutions").
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * @param  params  store parameters (see {@link AcquisitionStoreConfig}), missing values use this backend's defaults.
     *
     * @return store for this backend.
     */
    public AcquisitionStore buildStore(final Map<String, String> params)
            throws IllegalArgumentException {
        return buildStore(AcquisitionStoreConfig.fromParameters(params, defaultImageNaming, defaultSpectraNaming));
    }

    public AcquisitionStore buildStore(final AcquisitionStoreConfig config) {
        return storeFactory.apply(config);
    }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * @param  discriminator  client supplied display name, matched exactly (null selects {@link #DEFAULT}).
     *
     * @return matching magnet type.
     *
     * @throws UnknownMagnetTypeException
     *   if the discriminator does not match any supported backend.
     */
    public static MagnetType fromDiscriminator(final String discriminator)
            throws UnknownMagnetTypeException {

        if (discriminator == null) {
            return DEFAULT;
        }

        for (final MagnetType magnetType : values()) {
            if (magnetType.displayName.equals(discriminator)) {
                return magnetType;
            }
        }

        throw new UnknownMagnetTypeException(discriminator);
    }
}
