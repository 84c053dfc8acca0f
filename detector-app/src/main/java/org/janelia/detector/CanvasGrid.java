package org.janelia.detector;

import java.io.Serializable;

/**
 * Regular grid of visualization cells covering a region of the detector plane.
 * Cell (0, 0) starts at ({@link #getOriginX()}, {@link #getOriginY()}); x maps to canvas
 * columns and y maps to canvas rows.
 */
public class CanvasGrid
        implements Serializable {

    private final double originX;
    private final double originY;
    private final double cellSize;
    private final int width;
    private final int height;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private CanvasGrid() {
        this(0.0, 0.0, 1.0, 1, 1);
    }

    public CanvasGrid(final double originX,
                      final double originY,
                      final double cellSize,
                      final int width,
                      final int height)
            throws IllegalArgumentException {

        if (! (Double.isFinite(cellSize) && cellSize > 0.0)) {
            throw new IllegalArgumentException("canvas cell size must be a positive number");
        }
        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("canvas must have at least one cell, width=" + width +
                                               ", height=" + height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("canvas with " + width + "x" + height + " cells is too large");
        }

        this.originX = originX;
        this.originY = originY;
        this.cellSize = cellSize;
        this.width = width;
        this.height = height;
    }

    public double getOriginX() {
        return originX;
    }

    public double getOriginY() {
        return originY;
    }

    /**
     * @return size of one canvas cell in meters.
     */
    public double getCellSize() {
        return cellSize;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getCellX(final double x) {
        return toCell(x, originX, width);
    }

    public int getCellY(final double y) {
        return toCell(y, originY, height);
    }

    /**
     * @return row-major index of the cell containing the specified position.
     */
    public int getCellIndex(final double x,
                            final double y) {
        return getCellY(y) * width + getCellX(x);
    }

    private int toCell(final double value,
                       final double origin,
                       final int size) {
        // positions that land on a cell boundary within rounding error belong to the upper cell
        final int cell = (int) Math.floor((value - origin) / cellSize + BOUNDARY_TOLERANCE);
        return Math.max(0, Math.min(size - 1, cell));
    }

    @Override
    public String toString() {
        return "{origin=(" + originX + ", " + originY + "), cellSize=" + cellSize +
               ", width=" + width + ", height=" + height + '}';
    }

    static final double BOUNDARY_TOLERANCE = 1.0e-6;
}
