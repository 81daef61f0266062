package org.hpmri.processing;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link MagnetType} class.
 */
public class MagnetTypeTest {

    @Test
    public void testFromDiscriminator() {
        Assert.assertEquals("null should select default", MagnetType.HUPC, MagnetType.fromDiscriminator(null));
        Assert.assertEquals("invalid type", MagnetType.HUPC, MagnetType.fromDiscriminator("HUPC"));
        Assert.assertEquals("invalid type", MagnetType.CLINICAL, MagnetType.fromDiscriminator("Clinical"));
        Assert.assertEquals("invalid type", MagnetType.MR_SOLUTIONS, MagnetType.fromDiscriminator("MR Solutions"));
    }

    @Test
    public void testUnknownDiscriminator() {
        for (final String discriminator : new String[] {
                "Bogus", "hupc", "MRSolutions", "MR_SOLUTIONS", "CLINICAL", " HUPC ", "", "  "
        }) {
            try {
                MagnetType.fromDiscriminator(discriminator);
                Assert.fail("'" + discriminator + "' should not be recognized");
            } catch (final UnknownMagnetTypeException e) {
                Assert.assertEquals("invalid discriminator", discriminator, e.getDiscriminator());
            }
        }
    }

    @Test
    public void testDisplayNames() {
        for (final MagnetType magnetType : MagnetType.values()) {
            Assert.assertEquals("display name should round trip",
                                magnetType, MagnetType.fromDiscriminator(magnetType.getDisplayName()));
            Assert.assertEquals("toString should return display name",
                                magnetType.getDisplayName(), magnetType.toString());
        }
    }
}
