package org.janelia.detector;

/**
 * Thrown when a raw data array does not have the shape described by a pixel map.
 */
public class ShapeMismatchException
        extends IllegalArgumentException {

    public ShapeMismatchException(final int expectedWidth,
                                  final int expectedHeight,
                                  final int actualWidth,
                                  final int actualHeight) {
        super("raw data is " + actualWidth + "x" + actualHeight +
              " (width x height) but the pixel map requires " + expectedWidth + "x" + expectedHeight);
    }

}
