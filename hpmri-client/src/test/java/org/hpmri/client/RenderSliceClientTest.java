package org.hpmri.client;

import ij.process.FloatProcessor;

import java.awt.image.BufferedImage;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import javax.imageio.ImageIO;

import org.hpmri.client.parameter.CommandLineParameters;
import org.hpmri.processing.AcquisitionDispatcher;
import org.hpmri.processing.MagnetType;
import org.hpmri.processing.SliceRenderer;
import org.hpmri.processing.ThresholdedSpectrum;
import org.hpmri.processing.UnknownMagnetTypeException;
import org.hpmri.processing.loader.AcquisitionNotFoundException;
import org.hpmri.processing.loader.AcquisitionStore;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link RenderSliceClient} class.
 */
public class RenderSliceClientTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new RenderSliceClient.Parameters());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidParameters() {
        new RenderSliceClient.Parameters().parse(new String[] { "--index", "three" }, RenderSliceClient.class, false);
    }

    @Test
    public void testRenderSlices() throws Exception {

        final File outputDirectory = new File(temporaryFolder.getRoot(), "out");
        final RenderSliceClient.Parameters parameters = parseParameters("--magnetType", "HUPC",
                                                                        "--index", "1",
                                                                        "--count", "2",
                                                                        "--threshold", "0.5");
        parameters.outputDirectory = outputDirectory.getPath();

        final RenderSliceClient client = new RenderSliceClient(parameters, buildStubDispatcher());
        final List<File> writtenFiles = client.renderSlices();

        Assert.assertEquals("invalid files written",
                            Arrays.asList(new File(outputDirectory, "hupc_slice_1.png"),
                                          new File(outputDirectory, "hupc_epsi_1.json"),
                                          new File(outputDirectory, "hupc_slice_2.png")),
                            writtenFiles);

        final BufferedImage image = ImageIO.read(writtenFiles.get(0));
        Assert.assertNotNull("PNG should be decodable", image);
        Assert.assertEquals("PNG should be 8-bit grayscale", BufferedImage.TYPE_BYTE_GRAY, image.getType());

        final String json = new String(Files.readAllBytes(writtenFiles.get(1).toPath()), StandardCharsets.UTF_8);
        final ThresholdedSpectrum spectrum = ThresholdedSpectrum.fromJson(json);
        Assert.assertEquals("invalid dataset index", 1, spectrum.getDatasetIndex());
        Assert.assertArrayEquals("invalid thresholded values",
                                 new double[] { 0.0, 1.0, 0.5 }, spectrum.getValues(), 0.0);
    }

    @Test
    public void testUnknownMagnetType() throws Exception {
        final RenderSliceClient.Parameters parameters = parseParameters("--magnetType", "Bogus");
        try {
            new RenderSliceClient(parameters, buildStubDispatcher());
            Assert.fail("Bogus magnet type should be rejected");
        } catch (final UnknownMagnetTypeException e) {
            Assert.assertEquals("invalid discriminator", "Bogus", e.getDiscriminator());
        }
    }

    @Test
    public void testEmptyRootDirectory() throws Exception {

        final RenderSliceClient.Parameters parameters = parseParameters("--magnetType", "MR Solutions",
                                                                        "--count", "1");

        final AcquisitionDispatcher dispatcher = RenderSliceClient.buildDispatcher(parameters);
        Assert.assertEquals("empty directory should have no slices",
                            0, dispatcher.getImageCount(MagnetType.MR_SOLUTIONS));

        final RenderSliceClient client = new RenderSliceClient(parameters, dispatcher);
        try {
            client.renderSlices();
            Assert.fail("rendering from an empty directory should fail");
        } catch (final AcquisitionNotFoundException e) {
            Assert.assertEquals("invalid reason",
                                AcquisitionNotFoundException.Reason.INDEX_OUT_OF_RANGE, e.getReason());
        }

        final ClientRunner failingRunner = new ClientRunner(new String[0]) {
            @Override
            public void runClient(final String[] args) throws Exception {
                client.renderSlices();
            }
        };
        Assert.assertEquals("failed run should return non-zero exit code", 1, failingRunner.runWithoutExit());
    }

    @Test
    public void testRenderAllSlices() throws Exception {

        final RenderSliceClient.Parameters parameters = parseParameters("--magnetType", "Clinical",
                                                                        "--contrast", "0");
        final RenderSliceClient client = new RenderSliceClient(parameters, buildStubDispatcher());

        final ClientRunner runner = new ClientRunner(new String[0]) {
            @Override
            public void runClient(final String[] args) throws Exception {
                final List<File> writtenFiles = client.renderSlices();
                Assert.assertEquals("all clinical slices should be rendered without spectra", 2, writtenFiles.size());
            }
        };
        Assert.assertEquals("successful run should return zero exit code", 0, runner.runWithoutExit());
    }

    private RenderSliceClient.Parameters parseParameters(final String... args)
            throws Exception {
        final String[] requiredArgs = {
                "--rootDirectory", temporaryFolder.newFolder().getPath(),
                "--outputDirectory", temporaryFolder.getRoot().getPath()
        };
        final String[] allArgs = Arrays.copyOf(requiredArgs, requiredArgs.length + args.length);
        System.arraycopy(args, 0, allArgs, requiredArgs.length, args.length);

        final RenderSliceClient.Parameters parameters = new RenderSliceClient.Parameters();
        parameters.parse(allArgs, RenderSliceClient.class, false);
        return parameters;
    }

    private static AcquisitionDispatcher buildStubDispatcher() {
        final Map<MagnetType, AcquisitionStore> stores = new EnumMap<>(MagnetType.class);
        stores.put(MagnetType.HUPC, new SyntheticStore(MagnetType.HUPC, 3, new double[][] {
                { 1.0, 0.5, 0.25 },
                { 0.25, 1.0, 0.5 }
        }));
        stores.put(MagnetType.CLINICAL, new SyntheticStore(MagnetType.CLINICAL, 2, null));
        stores.put(MagnetType.MR_SOLUTIONS, new SyntheticStore(MagnetType.MR_SOLUTIONS, 0, null));
        return new AcquisitionDispatcher(stores, new SliceRenderer());
    }

    private static class SyntheticStore
            implements AcquisitionStore {

        private final MagnetType magnetType;
        private final int imageCount;
        private final double[][] spectra;

        SyntheticStore(final MagnetType magnetType,
                       final int imageCount,
                       final double[][] spectra) {
            this.magnetType = magnetType;
            this.imageCount = imageCount;
            this.spectra = spectra;
        }

        @Override
        public MagnetType getMagnetType() {
            return magnetType;
        }

        @Override
        public int getImageCount() {
            return imageCount;
        }

        @Override
        public FloatProcessor loadImage(final int index) {
            if ((index < 0) || (index >= imageCount)) {
                throw new AcquisitionNotFoundException("frame " + index + " is out of range",
                                                       AcquisitionNotFoundException.Reason.INDEX_OUT_OF_RANGE);
            }
            final float[] pixels = new float[16 * 16];
            for (int i = 0; i < pixels.length; i++) {
                pixels[i] = (i % 16) > 7 ? 200 + index : 1;
            }
            return new FloatProcessor(16, 16, pixels);
        }

        @Override
        public boolean hasSpectra() {
            return spectra != null;
        }

        @Override
        public int getSpectrumCount() {
            return spectra == null ? 0 : spectra.length;
        }

        @Override
        public double[] loadSpectrum(final int index) {
            return spectra == null ? new double[0] : spectra[index].clone();
        }
    }
}
