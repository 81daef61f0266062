package org.hpmri.processing.loader;

import java.io.File;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Locations and file naming conventions for one backend's acquisition store.
 * Spectra are optional: a config without a spectra convention describes an image-only store.
 */
public class AcquisitionStoreConfig
        implements Serializable {

    public static final String IMAGE_DIRECTORY = "imageDirectory";
    public static final String IMAGE_FILE_PREFIX = "imageFilePrefix";
    public static final String IMAGE_FILE_EXTENSION = "imageFileExtension";
    public static final String IMAGE_INDEX_DIGITS = "imageIndexDigits";
    public static final String FIRST_IMAGE_NUMBER = "firstImageNumber";

    public static final String SPECTRA_DIRECTORY = "spectraDirectory";
    public static final String SPECTRA_FILE_PREFIX = "spectraFilePrefix";
    public static final String SPECTRA_FILE_EXTENSION = "spectraFileExtension";
    public static final String SPECTRA_INDEX_DIGITS = "spectraIndexDigits";
    public static final String FIRST_SPECTRA_NUMBER = "firstSpectraNumber";

    private final File imageDirectory;
    private final FileNamingConvention imageNaming;
    private final File spectraDirectory;
    private final FileNamingConvention spectraNaming;

    public AcquisitionStoreConfig(final File imageDirectory,
                                  final FileNamingConvention imageNaming) {
        this(imageDirectory, imageNaming, null, null);
    }

    public AcquisitionStoreConfig(final File imageDirectory,
                                  final FileNamingConvention imageNaming,
                                  final File spectraDirectory,
                                  final FileNamingConvention spectraNaming)
            throws IllegalArgumentException {
        if (imageNaming == null) {
            throw new IllegalArgumentException("image naming convention must be defined");
        }
        this.imageDirectory = imageDirectory;
        this.imageNaming = imageNaming;
        this.spectraDirectory = spectraDirectory;
        this.spectraNaming = spectraNaming;
    }

    /**
     * @return image directory or null if none has been configured.
     */
    public File getImageDirectory() {
        return imageDirectory;
    }

    public FileNamingConvention getImageNaming() {
        return imageNaming;
    }

    /**
     * @return spectra directory or null if none has been configured.
     */
    public File getSpectraDirectory() {
        return spectraDirectory;
    }

    /**
     * @return spectra naming convention or null if this store has no spectra.
     */
    public FileNamingConvention getSpectraNaming() {
        return spectraNaming;
    }

    /**
     * @return map of this config's parameters (suitable for property file serialization).
     */
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        if (imageDirectory != null) {
            map.put(IMAGE_DIRECTORY, imageDirectory.getPath());
        }
        map.put(IMAGE_FILE_PREFIX, imageNaming.getPrefix());
        map.put(IMAGE_FILE_EXTENSION, imageNaming.getExtension());
        map.put(IMAGE_INDEX_DIGITS, String.valueOf(imageNaming.getIndexDigits()));
        map.put(FIRST_IMAGE_NUMBER, String.valueOf(imageNaming.getFirstFileNumber()));
        if (spectraNaming != null) {
            if (spectraDirectory != null) {
                map.put(SPECTRA_DIRECTORY, spectraDirectory.getPath());
            }
            map.put(SPECTRA_FILE_PREFIX, spectraNaming.getPrefix());
            map.put(SPECTRA_FILE_EXTENSION, spectraNaming.getExtension());
            map.put(SPECTRA_INDEX_DIGITS, String.valueOf(spectraNaming.getIndexDigits()));
            map.put(FIRST_SPECTRA_NUMBER, String.valueOf(spectraNaming.getFirstFileNumber()));
        }
        return map;
    }

    @Override
    public String toString() {
        return toParametersMap().toString();
    }

    /**
     * @param  params                parameters to apply (keys without any magnet specific prefix).
     * @param  defaultImageNaming    convention to use for image values missing from params.
     * @param  defaultSpectraNaming  convention to use for spectra values missing from params
     *                               or null if the backend has no spectra.
     *
     * @return config built from the specified parameters and defaults.
     *
     * @throws IllegalArgumentException
     *   if any of the parameter values cannot be parsed.
     */
    public static AcquisitionStoreConfig fromParameters(final Map<String, String> params,
                                                        final FileNamingConvention defaultImageNaming,
                                                        final FileNamingConvention defaultSpectraNaming)
            throws IllegalArgumentException {

        final FileNamingConvention imageNaming =
                defaultImageNaming.withOverrides(params.get(IMAGE_FILE_PREFIX),
                                                 getIntegerParameter(IMAGE_INDEX_DIGITS, params),
                                                 params.get(IMAGE_FILE_EXTENSION),
                                                 getIntegerParameter(FIRST_IMAGE_NUMBER, params));

        FileNamingConvention spectraNaming = null;
        File spectraDirectory = null;
        if (defaultSpectraNaming != null) {
            spectraNaming =
                    defaultSpectraNaming.withOverrides(params.get(SPECTRA_FILE_PREFIX),
                                                       getIntegerParameter(SPECTRA_INDEX_DIGITS, params),
                                                       params.get(SPECTRA_FILE_EXTENSION),
                                                       getIntegerParameter(FIRST_SPECTRA_NUMBER, params));
            spectraDirectory = getFileParameter(SPECTRA_DIRECTORY, params);
        }

        return new AcquisitionStoreConfig(getFileParameter(IMAGE_DIRECTORY, params),
                                          imageNaming,
                                          spectraDirectory,
                                          spectraNaming);
    }

    static File getFileParameter(final String parameterName,
                                 final Map<String, String> params) {
        final String valueString = params.get(parameterName);
        File file = null;
        if ((valueString != null) && (! valueString.trim().isEmpty())) {
            file = new File(valueString.trim()).getAbsoluteFile();
        }
        return file;
    }

    static Integer getIntegerParameter(final String parameterName,
                                       final Map<String, String> params)
            throws IllegalArgumentException {
        final String valueString = params.get(parameterName);
        Integer value = null;
        if (valueString != null) {
            try {
                value = Integer.parseInt(valueString.trim());
            } catch (final Throwable t) {
                throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
            }
        }
        return value;
    }
}
