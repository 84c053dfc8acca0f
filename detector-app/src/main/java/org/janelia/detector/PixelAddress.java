package org.janelia.detector;

import java.io.Serializable;

/**
 * Raw data address of one detector pixel together with its distance from the reference center.
 */
public class PixelAddress
        implements Serializable {

    private final String panelName;
    private final int row;
    private final int column;
    private final double radius;

    public PixelAddress(final String panelName,
                        final int row,
                        final int column,
                        final double radius) {
        this.panelName = panelName;
        this.row = row;
        this.column = column;
        this.radius = radius;
    }

    public String getPanelName() {
        return panelName;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public double getRadius() {
        return radius;
    }

    @Override
    public String toString() {
        return panelName + " (" + row + ", " + column + ") r=" + radius;
    }
}
