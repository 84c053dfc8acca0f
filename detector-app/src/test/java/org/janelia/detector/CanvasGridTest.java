package org.janelia.detector;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CanvasGrid} class.
 */
public class CanvasGridTest {

    @Test
    public void testCellIndex() {

        final CanvasGrid canvas = new CanvasGrid(-1.0e-3, 2.0e-3, 1.0e-4, 20, 10);

        Assert.assertEquals("origin should map to first cell", 0, canvas.getCellIndex(-1.0e-3, 2.0e-3));
        Assert.assertEquals("invalid cell x", 3, canvas.getCellX(-0.65e-3));
        Assert.assertEquals("invalid cell y", 4, canvas.getCellY(2.45e-3));
        Assert.assertEquals("invalid cell index", 4 * 20 + 3, canvas.getCellIndex(-0.65e-3, 2.45e-3));

        // 0.7 / 0.1 is slightly less than 7 in double arithmetic
        final CanvasGrid tenthCanvas = new CanvasGrid(0.0, 0.0, 0.1, 10, 1);
        Assert.assertEquals("boundary position should map to upper cell", 7, tenthCanvas.getCellX(0.7));
    }

    @Test
    public void testPositionsOutsideCanvasAreClamped() {

        final CanvasGrid canvas = new CanvasGrid(0.0, 0.0, 1.0, 4, 3);

        Assert.assertEquals("low x should clamp to first column", 0, canvas.getCellX(-7.0));
        Assert.assertEquals("high x should clamp to last column", 3, canvas.getCellX(4.0));
        Assert.assertEquals("high y should clamp to last row", 2, canvas.getCellY(99.0));
    }

    @Test
    public void testInvalidGrids() {

        final Object[][] testData = {
                // cellSize,      width, height
                { 0.0,            1,     1 },
                { Double.NaN,     1,     1 },
                { 1.0,            0,     1 },
                { 1.0,            1,     -1 },
                { 1.0,            65536, 65536 },
        };

        for (final Object[] testCase : testData) {
            try {
                new CanvasGrid(0.0, 0.0, (double) testCase[0], (int) testCase[1], (int) testCase[2]);
                Assert.fail("cellSize " + testCase[0] + ", width " + testCase[1] + ", height " + testCase[2] +
                            " should cause exception");
            } catch (final IllegalArgumentException e) {
                Assert.assertNotNull("exception should have message", e.getMessage());
            }
        }
    }

}
