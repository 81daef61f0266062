package org.hpmri.processing;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ProcessingParameters} class.
 */
public class ProcessingParametersTest {

    @Test
    public void testFromJson() {

        final ProcessingParameters parameters =
                ProcessingParameters.fromJson("{\"magnetType\": \"MR Solutions\", \"contrast\": 1.5, \"other\": 3}");

        Assert.assertEquals("invalid discriminator", "MR Solutions", parameters.getMagnetTypeDiscriminator());
        Assert.assertEquals("invalid magnet type", MagnetType.MR_SOLUTIONS, parameters.getMagnetType());
        Assert.assertEquals("invalid contrast", 1.5, parameters.getContrast(), 0.0);

        final ProcessingParameters parsedAgain = ProcessingParameters.fromJson(parameters.toString());
        Assert.assertEquals("contrast should survive serialization", 1.5, parsedAgain.getContrast(), 0.0);
    }

    @Test
    public void testDefaults() {

        final ProcessingParameters parameters = ProcessingParameters.fromJson("{}");

        Assert.assertNull("discriminator should not be defined", parameters.getMagnetTypeDiscriminator());
        Assert.assertEquals("invalid default magnet type", MagnetType.DEFAULT, parameters.getMagnetType());
        Assert.assertEquals("invalid default contrast", 1.0, parameters.getContrast(), 0.0);
        Assert.assertEquals("unset values should not be serialized", "{}", parameters.toString());
    }

    @Test(expected = UnknownMagnetTypeException.class)
    public void testUnknownMagnetType() {
        new ProcessingParameters("Bogus", null).getMagnetType();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidJson() {
        ProcessingParameters.fromJson("{\"contrast\": ");
    }
}
