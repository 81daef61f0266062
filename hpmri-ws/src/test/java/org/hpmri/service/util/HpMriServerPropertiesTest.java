package org.hpmri.service.util;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Map;

import org.hpmri.processing.MagnetType;
import org.hpmri.processing.loader.AcquisitionStoreConfig;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link HpMriServerProperties} class.
 */
public class HpMriServerPropertiesTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testMagnetParameters() throws Exception {

        final HpMriServerProperties properties = loadProperties(
                "magnet.HUPC.imageDirectory=/data/hupc/proton",
                "magnet.HUPC.spectraDirectory=/data/hupc/epsi",
                "magnet.MR_SOLUTIONS.firstImageNumber=1",
                "magnet.MR_SOLUTIONS.=ignored",
                "processing.absoluteFloor=7",
                "processing.relativeFloor=not-a-number",
                "upload.directory=" + temporaryFolder.getRoot().getAbsolutePath());

        final Map<String, String> hupcParameters = properties.getMagnetParameters(MagnetType.HUPC);
        Assert.assertEquals("invalid number of HUPC parameters", 2, hupcParameters.size());
        Assert.assertEquals("invalid HUPC image directory",
                            "/data/hupc/proton", hupcParameters.get(AcquisitionStoreConfig.IMAGE_DIRECTORY));

        final Map<String, String> mrSolutionsParameters = properties.getMagnetParameters(MagnetType.MR_SOLUTIONS);
        Assert.assertEquals("invalid MR Solutions parameters",
                            "{firstImageNumber=1}", mrSolutionsParameters.toString());

        Assert.assertTrue("clinical should have no parameters",
                          properties.getMagnetParameters(MagnetType.CLINICAL).isEmpty());

        Assert.assertEquals("invalid absolute floor",
                            7.0, properties.getDouble(HpMriServerProperties.ABSOLUTE_FLOOR_KEY, 5.0), 0.0);
        Assert.assertEquals("unparseable relative floor should use default",
                            0.05, properties.getDouble(HpMriServerProperties.RELATIVE_FLOOR_KEY, 0.05), 0.0);
        Assert.assertNotNull("renderer should be built", properties.buildSliceRenderer());

        Assert.assertEquals("invalid upload directory",
                            temporaryFolder.getRoot().getAbsoluteFile(), properties.getUploadDirectory());

        Assert.assertEquals("properties should be sorted by key",
                            "magnet.HUPC.imageDirectory", properties.getAll().keySet().iterator().next());
    }

    @Test
    public void testMissingFile() {

        final HpMriServerProperties properties =
                new HpMriServerProperties(new File(temporaryFolder.getRoot(), "missing.properties").getPath());

        Assert.assertTrue("missing file should have no properties", properties.getAll().isEmpty());
        Assert.assertTrue("missing file should have no magnet parameters",
                          properties.getMagnetParameters(MagnetType.HUPC).isEmpty());
        Assert.assertEquals("invalid default upload directory",
                            HpMriServerProperties.DEFAULT_UPLOAD_DIRECTORY, properties.getUploadDirectory().getName());
    }

    private HpMriServerProperties loadProperties(final String... lines)
            throws Exception {
        final File file = temporaryFolder.newFile("hpmri-server.properties");
        Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.ISO_8859_1);
        return new HpMriServerProperties(file.getAbsolutePath());
    }
}
