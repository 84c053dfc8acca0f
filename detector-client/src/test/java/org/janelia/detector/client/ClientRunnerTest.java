package org.janelia.detector.client;

import org.janelia.detector.ShapeMismatchException;
import org.janelia.detector.geom.GeometryParseException;
import org.janelia.detector.spec.DegeneratePanelException;
import org.janelia.detector.spec.EmptyGeometryException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ClientRunner} class.
 */
public class ClientRunnerTest {

    @Test
    public void testExitStatus() {

        final Object[][] testData = {
                // failure,                                                      expected status
                { null,                                                          ClientRunner.EXIT_SUCCESS },
                { new GeometryParseException("bad value", 3, "p0/res"),          ClientRunner.EXIT_INVALID_GEOMETRY },
                { new DegeneratePanelException("p0", "parallel scan vectors"),   ClientRunner.EXIT_INVALID_GEOMETRY },
                { new EmptyGeometryException(),                                  ClientRunner.EXIT_INVALID_GEOMETRY },
                { new ShapeMismatchException(4, 4, 4, 3),                        ClientRunner.EXIT_SHAPE_MISMATCH },
                { new IllegalStateException("disk full"),                        ClientRunner.EXIT_FAILURE },
        };

        for (final Object[] testCase : testData) {
            final RuntimeException failure = (RuntimeException) testCase[0];
            final ClientRunner clientRunner = new ClientRunner(new String[0]) {
                @Override
                public void runClient(final String[] args) {
                    if (failure != null) {
                        throw failure;
                    }
                }
            };
            Assert.assertEquals("invalid exit status for " + failure,
                                (int) testCase[1], clientRunner.runAndGetExitStatus());
        }
    }

}
