package org.hpmri.service;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.Map;

import org.hpmri.service.util.HpMriServerProperties;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link DeploymentConfigurationService} class.
 */
public class DeploymentConfigurationServiceTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testGetServerProperties() throws Exception {

        final File file = temporaryFolder.newFile("hpmri-server.properties");
        Files.write(file.toPath(),
                    Collections.singletonList("magnet.CLINICAL.imageDirectory=/data/clinical"),
                    StandardCharsets.ISO_8859_1);

        final DeploymentConfigurationService service =
                new DeploymentConfigurationService(new HpMriServerProperties(file.getAbsolutePath()));

        final Map<String, String> properties = service.getServerProperties();
        Assert.assertEquals("invalid properties",
                            "{magnet.CLINICAL.imageDirectory=/data/clinical}", properties.toString());
    }

    @Test
    public void testGetVersionInfo() {

        final DeploymentConfigurationService service = new DeploymentConfigurationService(
                new HpMriServerProperties(new File(temporaryFolder.getRoot(), "missing.properties").getPath()));

        final Map<String, String> versionInfo = service.getVersionInfo();
        Assert.assertNotNull("version info should be loaded", versionInfo);
        Assert.assertEquals("invalid artifact id", "hpmri-ws", versionInfo.get("hpmri.artifactId"));
        Assert.assertSame("version info should only be loaded once", versionInfo, service.getVersionInfo());
    }
}
