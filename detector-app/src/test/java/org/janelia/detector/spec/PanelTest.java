package org.janelia.detector.spec;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Panel} class.
 */
public class PanelTest {

    @Test
    public void testDerivedValues() {

        final Panel panel = new Panel("p0", 10, 19, 4, 7, 5000.0,
                                      new Vector3D(-3.0, 2.0), X_AXIS, Y_AXIS,
                                      0.2, null, 0.003, PanelMetadata.EMPTY);

        Assert.assertEquals("invalid width", 10, panel.getWidth());
        Assert.assertEquals("invalid height", 4, panel.getHeight());
        Assert.assertEquals("invalid pixel count", 40L, panel.getPixelCount());
        Assert.assertEquals("invalid pitch", 2.0e-4, panel.getPixelPitch(), 1.0e-15);
        Assert.assertEquals("invalid z offset", 0.203, panel.getZOffset(), 1.0e-12);

        Assert.assertTrue("should contain first address", panel.contains(4, 10));
        Assert.assertTrue("should contain last address", panel.contains(7, 19));
        Assert.assertFalse("should not contain address before min_fs", panel.contains(4, 9));
        Assert.assertFalse("should not contain address after max_ss", panel.contains(8, 10));
    }

    @Test
    public void testZOffsetWithoutFixedCameraLength() {
        final Panel panel = new Panel("p0", 0, 0, 0, 0, 1.0, Vector3D.ZERO, X_AXIS, Y_AXIS,
                                      null, "/LCLS/detector_1/EncoderValue", 0.5, PanelMetadata.EMPTY);
        Assert.assertEquals("coffset should be the only offset", 0.5, panel.getZOffset(), 0.0);
    }

    @Test
    public void testOverlaps() {

        final Panel a = new Panel("a", 0, 9, 0, 9, 1.0, Vector3D.ZERO, X_AXIS, Y_AXIS);
        final Panel touching = new Panel("b", 10, 19, 0, 9, 1.0, Vector3D.ZERO, X_AXIS, Y_AXIS);
        final Panel sharingCorner = new Panel("c", 9, 19, 9, 19, 1.0, Vector3D.ZERO, X_AXIS, Y_AXIS);

        Assert.assertFalse("adjacent panels should not overlap", a.overlaps(touching));
        Assert.assertTrue("panels sharing a corner address should overlap", a.overlaps(sharingCorner));
        Assert.assertTrue("overlap should be symmetric", sharingCorner.overlaps(a));
    }

    @Test
    public void testDegenerate() {

        final Panel parallel = new Panel("p", 0, 1, 0, 1, 1.0, Vector3D.ZERO, X_AXIS, new Vector3D(-2.0, 0.0));
        final Panel zeroLength = new Panel("z", 0, 1, 0, 1, 1.0, Vector3D.ZERO, X_AXIS, Vector3D.ZERO);
        final Panel rotated = new Panel("r", 0, 1, 0, 1, 1.0, Vector3D.ZERO,
                                        new Vector3D(0.0024, 0.9999), new Vector3D(-0.9999, 0.0024));

        Assert.assertTrue("parallel vectors should be degenerate", parallel.isDegenerate());
        Assert.assertTrue("zero length vector should be degenerate", zeroLength.isDegenerate());
        Assert.assertFalse("rotated panel should not be degenerate", rotated.isDegenerate());

        final Panel outOfPlane = new Panel("o", 0, 1, 0, 1, 1.0, Vector3D.ZERO, X_AXIS, new Vector3D(0.0, 0.0, 1.0));
        final Panel tilted = new Panel("t", 0, 1, 0, 1, 1.0, Vector3D.ZERO, X_AXIS, new Vector3D(0.0, 0.5, 0.5));
        Assert.assertTrue("slow-scan along z should be degenerate", outOfPlane.isDegenerate());
        Assert.assertFalse("tilted slow-scan with in-plane component should not be degenerate",
                           tilted.isDegenerate());

        try {
            parallel.validateScanVectors();
            Assert.fail("parallel vectors should cause exception");
        } catch (final DegeneratePanelException e) {
            Assert.assertEquals("invalid panel name", "p", e.getPanelName());
        }
    }

    @Test
    public void testInvalidAttributes() {

        final Object[][] testData = {
                // minFs, maxFs, minSs, maxSs, res
                {  -1,     1,     0,     1,     1.0 },
                {   2,     1,     0,     1,     1.0 },
                {   0,     1,     0,     1,     0.0 },
                {   0,     1,     0,     1,     Double.NaN },
                {   0,     Integer.MAX_VALUE, 0, 1, 1.0 },
                {   0,     1,     0,     Integer.MAX_VALUE, 1.0 },
        };

        for (final Object[] testCase : testData) {
            try {
                new Panel("p", (int) testCase[0], (int) testCase[1], (int) testCase[2], (int) testCase[3],
                          (double) testCase[4], Vector3D.ZERO, X_AXIS, Y_AXIS);
                Assert.fail("attributes " + Arrays.toString(testCase) + " should cause exception");
            } catch (final IllegalArgumentException e) {
                Assert.assertTrue("message should name panel", e.getMessage().contains("panel p"));
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFiniteCorner() {
        new Panel("p", 0, 1, 0, 1, 1.0, new Vector3D(Double.POSITIVE_INFINITY, 0.0), X_AXIS, Y_AXIS);
    }

    private static final Vector3D X_AXIS = new Vector3D(1.0, 0.0);
    private static final Vector3D Y_AXIS = new Vector3D(0.0, 1.0);
}
