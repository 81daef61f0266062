package org.hpmri.client;

import com.beust.jcommander.Parameter;

import ij.process.ByteProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.hpmri.client.parameter.CommandLineParameters;
import org.hpmri.processing.AcquisitionDispatcher;
import org.hpmri.processing.MagnetType;
import org.hpmri.processing.SliceRenderer;
import org.hpmri.processing.ThresholdedSpectrum;
import org.hpmri.processing.filter.ContrastEnhancer;
import org.hpmri.processing.filter.ImageNormalizer;
import org.hpmri.processing.filter.ThresholdFilter;
import org.hpmri.processing.loader.AcquisitionStoreConfig;
import org.hpmri.processing.util.PngUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders slices (and thresholded EPSI datasets where the backend has them) from a local acquisition
 * directory into PNG and JSON files.
 */
public class RenderSliceClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--magnetType",
                description = "Magnet type: HUPC, Clinical, or MR Solutions")
        public String magnetType = MagnetType.DEFAULT.getDisplayName();

        @Parameter(
                names = "--rootDirectory",
                description = "Directory containing the backend's DICOM files",
                required = true)
        public String rootDirectory;

        @Parameter(
                names = "--spectraDirectory",
                description = "Directory containing EPSI json datasets (only used for backends with spectra)")
        public String spectraDirectory;

        @Parameter(
                names = "--index",
                description = "Index of first slice to render")
        public int index = 0;

        @Parameter(
                names = "--count",
                description = "Number of consecutive slices to render (omit to render all slices from index)")
        public Integer count;

        @Parameter(
                names = "--contrast",
                description = "CLAHE slope (values <= 0 skip enhancement)")
        public double contrast = ContrastEnhancer.DEFAULT_CONTRAST;

        @Parameter(
                names = "--threshold",
                description = "Threshold applied to peak normalized EPSI values")
        public double threshold = ThresholdFilter.DEFAULT_THRESHOLD;

        @Parameter(
                names = "--absoluteFloor",
                description = "Raw intensities below this value are treated as noise")
        public double absoluteFloor = ImageNormalizer.DEFAULT_ABSOLUTE_FLOOR;

        @Parameter(
                names = "--relativeFloor",
                description = "Normalized intensities below this fraction are treated as noise")
        public double relativeFloor = ImageNormalizer.DEFAULT_RELATIVE_FLOOR;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for rendered files",
                required = true)
        public String outputDirectory;

        public Map<String, String> getStoreParameters() {
            final Map<String, String> storeParameters = new HashMap<>();
            storeParameters.put(AcquisitionStoreConfig.IMAGE_DIRECTORY, rootDirectory);
            if (spectraDirectory != null) {
                storeParameters.put(AcquisitionStoreConfig.SPECTRA_DIRECTORY, spectraDirectory);
            }
            return storeParameters;
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final RenderSliceClient client = new RenderSliceClient(parameters, buildDispatcher(parameters));
                client.renderSlices();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final MagnetType magnetType;
    private final AcquisitionDispatcher dispatcher;

    /**
     * @throws org.hpmri.processing.UnknownMagnetTypeException
     *   if the magnet type parameter is not recognized.
     */
    public RenderSliceClient(final Parameters parameters,
                             final AcquisitionDispatcher dispatcher) {
        this.parameters = parameters;
        this.magnetType = MagnetType.fromDiscriminator(parameters.magnetType);
        this.dispatcher = dispatcher;
    }

    /**
     * @return dispatcher that reads the specified magnet type's files from the parameter directories
     *         (other backends are left unconfigured).
     */
    public static AcquisitionDispatcher buildDispatcher(final Parameters parameters) {
        final MagnetType magnetType = MagnetType.fromDiscriminator(parameters.magnetType);
        final Map<String, String> storeParameters = parameters.getStoreParameters();
        return AcquisitionDispatcher.build(
                type -> type == magnetType ? storeParameters : Collections.emptyMap(),
                new SliceRenderer(parameters.absoluteFloor, parameters.relativeFloor));
    }

    /**
     * @return list of files written.
     *
     * @throws IOException
     *   if any output file cannot be written.
     */
    public List<File> renderSlices()
            throws IOException {

        final File outputDirectory = new File(parameters.outputDirectory).getAbsoluteFile();
        if (! outputDirectory.exists() && ! outputDirectory.mkdirs()) {
            throw new IOException("failed to create " + outputDirectory);
        }

        final int imageCount = dispatcher.getImageCount(magnetType);
        final int lastIndex = parameters.count == null ? imageCount : parameters.index + parameters.count;
        final int spectrumCount = dispatcher.getSpectrumCount(magnetType);
        final String filePrefix = magnetType.name().toLowerCase();

        LOG.info("renderSlices: entry, rendering {} slices [{}, {}) of {} available, {} datasets available",
                 magnetType, parameters.index, lastIndex, imageCount, spectrumCount);

        final List<File> writtenFiles = new ArrayList<>();

        for (int i = parameters.index; i < lastIndex; i++) {

            final ByteProcessor slice = dispatcher.renderPicture(magnetType, i, parameters.contrast);
            final File pngFile = new File(outputDirectory, filePrefix + "_slice_" + i + "." + PngUtil.PNG_FORMAT);
            PngUtil.writeGrayscalePng(slice, pngFile);
            writtenFiles.add(pngFile);

            if (i < spectrumCount) {
                final ThresholdedSpectrum spectrum = dispatcher.getThresholdedData(magnetType, i, parameters.threshold);
                final File jsonFile = new File(outputDirectory, filePrefix + "_epsi_" + i + ".json");
                Files.write(jsonFile.toPath(), spectrum.toJson().getBytes(StandardCharsets.UTF_8));
                writtenFiles.add(jsonFile);
            }

            LOG.debug("renderSlices: finished index {}", i);
        }

        LOG.info("renderSlices: exit, wrote {} files to {}", writtenFiles.size(), outputDirectory);

        return writtenFiles;
    }

    private static final Logger LOG = LoggerFactory.getLogger(RenderSliceClient.class);
}
