package org.janelia.detector;

/**
 * Placement of the visualization canvas relative to the detector pixels.
 */
public enum CanvasMode {

    /** Smallest canvas containing every pixel position. */
    BOUNDING_BOX,

    /** Canvas symmetric about the reference center, so the center always maps to the middle cell. */
    CENTERED

}
