/*
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.detector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.detector.spec.Bounds;

/**
 * Physical coordinates for every address of a raw data array.
 *
 * <p>All per-pixel arrays are row-major with {@link #getColumns()} entries per row, matching the
 * pixel layout of an ImageJ processor for the raw data.  Coordinates are in meters.
 * Addresses that are not covered by a panel (or that were excluded as bad) are invalid,
 * carry NaN coordinates, and do not map to a canvas cell.</p>
 *
 * <p>Instances are immutable and keep no reference to the geometry they were built from,
 * so one map can be shared by any number of concurrent frame assemblies.</p>
 */
public class PixelMap {

    private final int rows;
    private final int columns;
    private final double[] x;
    private final double[] y;
    private final double[] z;
    private final double[] r;
    private final double[] phi;
    private final int[] panelIndex;
    private final boolean[] valid;
    private final int[] cellIndex;
    private final List<String> panelNames;
    private final double centerX;
    private final double centerY;
    private final Bounds bounds;
    private final CanvasGrid canvas;

    PixelMap(final int rows,
             final int columns,
             final double[] x,
             final double[] y,
             final double[] z,
             final double[] r,
             final double[] phi,
             final int[] panelIndex,
             final boolean[] valid,
             final int[] cellIndex,
             final List<String> panelNames,
             final double centerX,
             final double centerY,
             final Bounds bounds,
             final CanvasGrid canvas) {
        this.rows = rows;
        this.columns = columns;
        this.x = x;
        this.y = y;
        this.z = z;
        this.r = r;
        this.phi = phi;
        this.panelIndex = panelIndex;
        this.valid = valid;
        this.cellIndex = cellIndex;
        this.panelNames = Collections.unmodifiableList(new ArrayList<>(panelNames));
        this.centerX = centerX;
        this.centerY = centerY;
        this.bounds = bounds;
        this.canvas = canvas;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int getPixelCount() {
        return x.length;
    }

    public double getX(final int row,
                       final int column) {
        return x[index(row, column)];
    }

    public double getY(final int row,
                       final int column) {
        return y[index(row, column)];
    }

    public double getZ(final int row,
                       final int column) {
        return z[index(row, column)];
    }

    /**
     * @return distance in the x/y plane from the reference center.
     */
    public double getRadius(final int row,
                            final int column) {
        return r[index(row, column)];
    }

    /**
     * @return angle (radians) between the x axis and the vector from the reference center to the pixel.
     */
    public double getPhi(final int row,
                         final int column) {
        return phi[index(row, column)];
    }

    public boolean isValid(final int row,
                           final int column) {
        return valid[index(row, column)];
    }

    /**
     * @return name of the panel containing the address, or null if no panel covers it.
     */
    public String getPanelName(final int row,
                               final int column) {
        final int i = panelIndex[index(row, column)];
        return i < 0 ? null : panelNames.get(i);
    }

    /**
     * @return row-major canvas index for the address, or -1 if the address is invalid.
     */
    public int getCellIndex(final int row,
                            final int column) {
        return cellIndex[index(row, column)];
    }

    public double[] getXArray() {
        return x.clone();
    }

    public double[] getYArray() {
        return y.clone();
    }

    public double[] getZArray() {
        return z.clone();
    }

    public double[] getRadiusArray() {
        return r.clone();
    }

    public double[] getPhiArray() {
        return phi.clone();
    }

    public boolean[] getValidArray() {
        return valid.clone();
    }

    public int getValidPixelCount() {
        int count = 0;
        for (final boolean v : valid) {
            if (v) {
                count++;
            }
        }
        return count;
    }

    public List<String> getPanelNames() {
        return panelNames;
    }

    public double getCenterX() {
        return centerX;
    }

    public double getCenterY() {
        return centerY;
    }

    /**
     * @return physical bounds of all valid pixel positions.
     */
    public Bounds getBounds() {
        return bounds;
    }

    public CanvasGrid getCanvas() {
        return canvas;
    }

    /**
     * @return the valid pixel closest to the reference center (first one in row-major order on ties).
     */
    public PixelAddress findInnermostPixel() {
        int found = -1;
        for (int i = 0; i < r.length; i++) {
            if (valid[i] && ((found < 0) || (r[i] < r[found]))) {
                found = i;
            }
        }
        return toAddress(found);
    }

    /**
     * @return the valid pixel furthest from the reference center (first one in row-major order on ties).
     */
    public PixelAddress findOutermostPixel() {
        int found = -1;
        for (int i = 0; i < r.length; i++) {
            if (valid[i] && ((found < 0) || (r[i] > r[found]))) {
                found = i;
            }
        }
        return toAddress(found);
    }

    int getCellIndexAtOffset(final int offset) {
        return cellIndex[offset];
    }

    private PixelAddress toAddress(final int index) {
        PixelAddress address = null;
        if (index > -1) {
            address = new PixelAddress(panelNames.get(panelIndex[index]), index / columns, index % columns, r[index]);
        }
        return address;
    }

    private int index(final int row,
                      final int column) {
        if ((row < 0) || (row >= rows) || (column < 0) || (column >= columns)) {
            throw new IndexOutOfBoundsException("address (" + row + ", " + column + ") is outside " +
                                                rows + "x" + columns + " pixel map");
        }
        return row * columns + column;
    }

}
