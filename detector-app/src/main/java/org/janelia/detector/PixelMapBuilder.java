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
import java.util.Arrays;
import java.util.List;

import org.janelia.detector.spec.BadRegion;
import org.janelia.detector.spec.Bounds;
import org.janelia.detector.spec.DegeneratePanelException;
import org.janelia.detector.spec.DetectorGeometry;
import org.janelia.detector.spec.InconsistentGeometryException;
import org.janelia.detector.spec.Panel;
import org.janelia.detector.spec.Vector3D;
import org.janelia.detector.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a {@link PixelMap} from a {@link DetectorGeometry}.
 *
 * <p>For every raw address (row, column) of a panel the physical position is the affine map</p>
 * <pre>
 *   position = pitch * (corner + (column - min_fs) * fs + (row - min_ss) * ss)
 * </pre>
 * <p>with z additionally offset by the panel's camera length and {@code coffset}.</p>
 *
 * <p>Builds are pure functions of the geometry and the builder's parameters, so a builder
 * may be shared between threads.  Callers are expected to keep the resulting map for as long
 * as the geometry stays the same.</p>
 */
public class PixelMapBuilder {

    private final AssemblyParameters parameters;

    public PixelMapBuilder() {
        this(new AssemblyParameters());
    }

    public PixelMapBuilder(final AssemblyParameters parameters)
            throws IllegalArgumentException {
        parameters.validate();
        this.parameters = parameters;
    }

    public AssemblyParameters getParameters() {
        return parameters;
    }

    /**
     * @param  geometry  detector description.
     *
     * @return coordinates and canvas placement for every raw address described by the geometry.
     *
     * @throws org.janelia.detector.spec.EmptyGeometryException
     *   if the geometry has no panels.
     *
     * @throws DegeneratePanelException
     *   if a panel has parallel scan vectors or produces non-finite coordinates.
     *
     * @throws InconsistentGeometryException
     *   if every pixel was excluded as bad.
     */
    public PixelMap build(final DetectorGeometry geometry)
            throws IllegalArgumentException {

        final ProcessTimer timer = new ProcessTimer();

        geometry.validate();

        final int rows = geometry.getRawHeight();
        final int columns = geometry.getRawWidth();
        final long pixelCount = (long) rows * columns;
        if (pixelCount > Integer.MAX_VALUE) {
            throw new InconsistentGeometryException("raw data shape " + rows + "x" + columns + " is too large");
        }

        final int n = (int) pixelCount;
        final double[] x = new double[n];
        final double[] y = new double[n];
        final double[] z = new double[n];
        final double[] r = new double[n];
        final double[] phi = new double[n];
        final int[] panelIndex = new int[n];
        final boolean[] valid = new boolean[n];

        Arrays.fill(x, Double.NaN);
        Arrays.fill(y, Double.NaN);
        Arrays.fill(z, Double.NaN);
        Arrays.fill(r, Double.NaN);
        Arrays.fill(phi, Double.NaN);
        Arrays.fill(panelIndex, -1);

        final double centerX;
        final double centerY;
        if (parameters.hasBeamCenter()) {
            centerX = parameters.getBeamCenterX();
            centerY = parameters.getBeamCenterY();
        } else if (geometry.hasBeamCenter()) {
            centerX = geometry.getBeamCenterX();
            centerY = geometry.getBeamCenterY();
        } else {
            centerX = 0.0;
            centerY = 0.0;
        }

        final List<BadRegion> badRegions = parameters.isExcludeBadRegions() ?
                                           geometry.getBadRegions() : new ArrayList<>();

        final List<Panel> panels = geometry.getPanels();
        final List<String> panelNames = new ArrayList<>(panels.size());

        for (int p = 0; p < panels.size(); p++) {
            final Panel panel = panels.get(p);
            panelNames.add(panel.getName());
            mapPanel(panel, p, columns, centerX, centerY, badRegions, x, y, z, r, phi, panelIndex, valid);
        }

        final Bounds bounds = findBounds(x, y, z, valid);
        final CanvasGrid canvas = buildCanvas(geometry, bounds, centerX, centerY);

        final int[] cellIndex = new int[n];
        for (int i = 0; i < n; i++) {
            cellIndex[i] = valid[i] ? canvas.getCellIndex(x[i], y[i]) : -1;
        }

        final PixelMap pixelMap = new PixelMap(rows, columns, x, y, z, r, phi, panelIndex, valid, cellIndex,
                                               panelNames, centerX, centerY, bounds, canvas);

        LOG.info("build: exit, mapped {} panels with {} valid pixels onto {}x{} canvas in {} ms",
                 panels.size(), pixelMap.getValidPixelCount(), canvas.getWidth(), canvas.getHeight(),
                 timer.getElapsedMilliseconds());

        return pixelMap;
    }

    private static void mapPanel(final Panel panel,
                                 final int p,
                                 final int columns,
                                 final double centerX,
                                 final double centerY,
                                 final List<BadRegion> badRegions,
                                 final double[] x,
                                 final double[] y,
                                 final double[] z,
                                 final double[] r,
                                 final double[] phi,
                                 final int[] panelIndex,
                                 final boolean[] valid)
            throws DegeneratePanelException {

        final double pitch = panel.getPixelPitch();
        final double zOffset = panel.getZOffset();
        final Vector3D corner = panel.getCorner();
        final Vector3D fs = panel.getFs();
        final Vector3D ss = panel.getSs();

        for (int row = panel.getMinSs(); row <= panel.getMaxSs(); row++) {

            final int dSs = row - panel.getMinSs();
            final double rowX = corner.getX() + dSs * ss.getX();
            final double rowY = corner.getY() + dSs * ss.getY();
            final double rowZ = corner.getZ() + dSs * ss.getZ();

            for (int column = panel.getMinFs(); column <= panel.getMaxFs(); column++) {

                final int dFs = column - panel.getMinFs();

                // detector pixel units
                final double px = rowX + dFs * fs.getX();
                final double py = rowY + dFs * fs.getY();
                final double pz = rowZ + dFs * fs.getZ();

                final double xMeters = px * pitch;
                final double yMeters = py * pitch;
                final double zMeters = zOffset + pz * pitch;

                if (! (Double.isFinite(xMeters) && Double.isFinite(yMeters) && Double.isFinite(zMeters))) {
                    throw new DegeneratePanelException(panel.getName(),
                                                       "non-finite position for raw address (" + row + ", " +
                                                       column + ")");
                }

                final double dx = xMeters - centerX;
                final double dy = yMeters - centerY;

                final int i = row * columns + column;
                x[i] = xMeters;
                y[i] = yMeters;
                z[i] = zMeters;
                r[i] = Math.sqrt(dx * dx + dy * dy);
                phi[i] = Math.atan2(dy, dx);
                panelIndex[i] = p;
                valid[i] = ! isBad(badRegions, panel.getName(), row, column, px, py);
            }
        }
    }

    private static boolean isBad(final List<BadRegion> badRegions,
                                 final String panelName,
                                 final int row,
                                 final int column,
                                 final double px,
                                 final double py) {
        for (final BadRegion badRegion : badRegions) {
            if (badRegion.contains(panelName, row, column, px, py)) {
                return true;
            }
        }
        return false;
    }

    private static Bounds findBounds(final double[] x,
                                     final double[] y,
                                     final double[] z,
                                     final boolean[] valid)
            throws InconsistentGeometryException {

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double minZ = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        double maxZ = Double.NEGATIVE_INFINITY;
        boolean foundValidPixel = false;

        for (int i = 0; i < x.length; i++) {
            if (valid[i]) {
                foundValidPixel = true;
                minX = Math.min(minX, x[i]);
                minY = Math.min(minY, y[i]);
                minZ = Math.min(minZ, z[i]);
                maxX = Math.max(maxX, x[i]);
                maxY = Math.max(maxY, y[i]);
                maxZ = Math.max(maxZ, z[i]);
            }
        }

        if (! foundValidPixel) {
            throw new InconsistentGeometryException("every detector pixel is excluded by a bad region");
        }

        return new Bounds(minX, minY, minZ, maxX, maxY, maxZ);
    }

    private CanvasGrid buildCanvas(final DetectorGeometry geometry,
                                   final Bounds bounds,
                                   final double centerX,
                                   final double centerY)
            throws IllegalArgumentException {

        final double cellSize;
        if (parameters.getVisualizationPixelSize() == null) {
            double smallestPitch = Double.POSITIVE_INFINITY;
            for (final Panel panel : geometry.getPanels()) {
                smallestPitch = Math.min(smallestPitch, panel.getPixelPitch());
            }
            cellSize = smallestPitch;
        } else {
            cellSize = parameters.getVisualizationPixelSize();
        }

        final CanvasGrid canvas;
        if (parameters.getCanvasMode() == CanvasMode.CENTERED) {

            final double halfX = Math.max(Math.abs(bounds.getMaxX() - centerX), Math.abs(bounds.getMinX() - centerX));
            final double halfY = Math.max(Math.abs(bounds.getMaxY() - centerY), Math.abs(bounds.getMinY() - centerY));
            final long halfCellsX = (long) Math.floor(halfX / cellSize + CanvasGrid.BOUNDARY_TOLERANCE) + 1;
            final long halfCellsY = (long) Math.floor(halfY / cellSize + CanvasGrid.BOUNDARY_TOLERANCE) + 1;

            canvas = new CanvasGrid(centerX - halfCellsX * cellSize,
                                    centerY - halfCellsY * cellSize,
                                    cellSize,
                                    toCellCount(2 * halfCellsX),
                                    toCellCount(2 * halfCellsY));

        } else {

            final long cellsX = (long) Math.floor(bounds.getDeltaX() / cellSize + CanvasGrid.BOUNDARY_TOLERANCE) + 1;
            final long cellsY = (long) Math.floor(bounds.getDeltaY() / cellSize + CanvasGrid.BOUNDARY_TOLERANCE) + 1;

            canvas = new CanvasGrid(bounds.getMinX(),
                                    bounds.getMinY(),
                                    cellSize,
                                    toCellCount(cellsX),
                                    toCellCount(cellsY));
        }

        LOG.debug("buildCanvas: bounds {} mapped to canvas {}", bounds, canvas);

        return canvas;
    }

    private static int toCellCount(final long cells)
            throws IllegalArgumentException {
        if (cells > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("canvas dimension of " + cells +
                                               " cells is too large, increase the visualization pixel size");
        }
        return (int) cells;
    }

    private static final Logger LOG = LoggerFactory.getLogger(PixelMapBuilder.class);
}
