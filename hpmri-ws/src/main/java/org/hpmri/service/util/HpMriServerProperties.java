package org.hpmri.service.util;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

import org.hpmri.processing.MagnetType;
import org.hpmri.processing.SliceRenderer;
import org.hpmri.processing.filter.ImageNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configured properties for an HP-MRI server.
 *
 * Acquisition store locations are configured per backend with keys like
 * <code>magnet.HUPC.imageDirectory</code> (see {@link org.hpmri.processing.loader.AcquisitionStoreConfig}).
 */
public class HpMriServerProperties {

    public static final String DEFAULT_FILE_PATH = "resources/hpmri-server.properties";

    public static final String MAGNET_KEY_PREFIX = "magnet.";
    public static final String ABSOLUTE_FLOOR_KEY = "processing.absoluteFloor";
    public static final String RELATIVE_FLOOR_KEY = "processing.relativeFloor";
    public static final String UPLOAD_DIRECTORY_KEY = "upload.directory";

    public static final String DEFAULT_UPLOAD_DIRECTORY = "uploads";

    private static HpMriServerProperties serverProperties;

    private final String filePath;
    private final Map<String, String> properties;

    public HpMriServerProperties(final String filePath) {

        this.properties = new LinkedHashMap<>(); // keep properties sorted by key

        final File propertiesFile = new File(filePath).getAbsoluteFile();
        this.filePath = propertiesFile.getPath();

        final Properties p = new Properties();
        if (propertiesFile.exists()) {
            try (final InputStream in = new FileInputStream(propertiesFile)) {
                p.load(in);
                LOG.info("loaded {}", propertiesFile);
            } catch (final Throwable t) {
                LOG.warn("failed to load properties from " + propertiesFile, t);
            }
        } else {
            LOG.warn("{} not found, using default configuration", propertiesFile);
        }

        for (final String sortedKey : new TreeSet<>(p.stringPropertyNames())) {
            properties.put(sortedKey, p.getProperty(sortedKey));
        }
    }

    public String getFilePath() {
        return filePath;
    }

    public String get(final String key) {
        return properties.get(key);
    }

    public Map<String, String> getAll() {
        return Collections.unmodifiableMap(properties);
    }

    public Double getDouble(final String key,
                            final Double defaultValue) {
        final String valueString = get(key);
        Double value = defaultValue;
        if ((valueString != null) && (valueString.trim().length() > 0)) {
            try {
                value = Double.parseDouble(valueString.trim());
            } catch (final Throwable t) {
                LOG.warn("failed to parse " + key + " value in " + filePath + ", using " + defaultValue, t);
            }
        }
        return value;
    }

    /**
     * @return all properties whose keys start with the specified prefix, with the prefix removed from each key.
     */
    public Map<String, String> getParametersWithPrefix(final String prefix) {
        final Map<String, String> parameters = new LinkedHashMap<>();
        for (final Map.Entry<String, String> entry : properties.entrySet()) {
            final String key = entry.getKey();
            if (key.startsWith(prefix) && (key.length() > prefix.length())) {
                parameters.put(key.substring(prefix.length()), entry.getValue());
            }
        }
        return parameters;
    }

    /**
     * @return acquisition store parameters for the specified backend (empty if nothing is configured).
     */
    public Map<String, String> getMagnetParameters(final MagnetType magnetType) {
        return getParametersWithPrefix(MAGNET_KEY_PREFIX + magnetType.name() + ".");
    }

    public SliceRenderer buildSliceRenderer() {
        return new SliceRenderer(getDouble(ABSOLUTE_FLOOR_KEY, ImageNormalizer.DEFAULT_ABSOLUTE_FLOOR),
                                 getDouble(RELATIVE_FLOOR_KEY, ImageNormalizer.DEFAULT_RELATIVE_FLOOR));
    }

    public File getUploadDirectory() {
        final String path = get(UPLOAD_DIRECTORY_KEY);
        final String directoryPath = ((path == null) || path.trim().isEmpty()) ? DEFAULT_UPLOAD_DIRECTORY : path.trim();
        return new File(directoryPath).getAbsoluteFile();
    }

    public static HpMriServerProperties getProperties() {
        if (serverProperties == null) {
            buildProperties();
        }
        return serverProperties;
    }

    private static synchronized void buildProperties() {
        if (serverProperties == null) {
            serverProperties = new HpMriServerProperties(DEFAULT_FILE_PATH);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(HpMriServerProperties.class);
}
