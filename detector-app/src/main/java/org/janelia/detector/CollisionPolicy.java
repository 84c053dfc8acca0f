package org.janelia.detector;

/**
 * Resolution of raw pixels that map to the same canvas cell.
 * Raw pixels are always visited in row-major order.
 */
public enum CollisionPolicy {

    /** The last raw pixel visited for a cell provides its value. */
    LAST_WRITE_WINS,

    /** The first raw pixel visited for a cell provides its value. */
    FIRST_WRITE_WINS

}
