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

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

import java.io.Serializable;

import org.janelia.detector.json.JsonUtils;

/**
 * Options for pixel map construction and frame assembly.
 * Command line tools include these through a {@link com.beust.jcommander.ParametersDelegate}.
 */
@Parameters
public class AssemblyParameters
        implements Serializable {

    @Parameter(
            names = "--visualizationPixelSize",
            description = "Size (meters) of one canvas cell, default is the smallest panel pixel pitch")
    private Double visualizationPixelSize;

    @Parameter(
            names = "--fillValue",
            description = "Value for canvas cells that receive no detector data")
    private double fillValue;

    @Parameter(
            names = "--beamCenterX",
            description = "Reference center x (meters) for radius calculations, overrides the geometry")
    private Double beamCenterX;

    @Parameter(
            names = "--beamCenterY",
            description = "Reference center y (meters) for radius calculations, overrides the geometry")
    private Double beamCenterY;

    @Parameter(
            names = "--collisionPolicy",
            description = "Which raw pixel wins when several map to the same canvas cell")
    private CollisionPolicy collisionPolicy;

    @Parameter(
            names = "--canvasMode",
            description = "Canvas placement: smallest bounding box or centered on the reference center")
    private CanvasMode canvasMode;

    @Parameter(
            names = "--excludeBadRegions",
            description = "Treat pixels in the geometry's bad regions as invalid",
            arity = 0)
    private boolean excludeBadRegions;

    public AssemblyParameters() {
        this(null, DEFAULT_FILL_VALUE, null, null, CollisionPolicy.LAST_WRITE_WINS, CanvasMode.BOUNDING_BOX, false);
    }

    public AssemblyParameters(final Double visualizationPixelSize,
                              final double fillValue,
                              final Double beamCenterX,
                              final Double beamCenterY,
                              final CollisionPolicy collisionPolicy,
                              final CanvasMode canvasMode,
                              final boolean excludeBadRegions) {
        this.visualizationPixelSize = visualizationPixelSize;
        this.fillValue = fillValue;
        this.beamCenterX = beamCenterX;
        this.beamCenterY = beamCenterY;
        this.collisionPolicy = collisionPolicy;
        this.canvasMode = canvasMode;
        this.excludeBadRegions = excludeBadRegions;
    }

    public static AssemblyParameters withVisualizationPixelSize(final double visualizationPixelSize) {
        final AssemblyParameters parameters = new AssemblyParameters();
        parameters.visualizationPixelSize = visualizationPixelSize;
        return parameters;
    }

    /**
     * @return configured canvas cell size in meters, or null if the geometry should determine it.
     */
    public Double getVisualizationPixelSize() {
        return visualizationPixelSize;
    }

    public double getFillValue() {
        return fillValue;
    }

    public boolean hasBeamCenter() {
        return beamCenterX != null;
    }

    public Double getBeamCenterX() {
        return beamCenterX;
    }

    public Double getBeamCenterY() {
        return beamCenterY;
    }

    public CollisionPolicy getCollisionPolicy() {
        return collisionPolicy == null ? CollisionPolicy.LAST_WRITE_WINS : collisionPolicy;
    }

    public CanvasMode getCanvasMode() {
        return canvasMode == null ? CanvasMode.BOUNDING_BOX : canvasMode;
    }

    public boolean isExcludeBadRegions() {
        return excludeBadRegions;
    }

    public AssemblyParameters withFillValue(final double changedFillValue) {
        return new AssemblyParameters(visualizationPixelSize, changedFillValue, beamCenterX, beamCenterY,
                                      collisionPolicy, canvasMode, excludeBadRegions);
    }

    public AssemblyParameters withBeamCenter(final Double changedBeamCenterX,
                                             final Double changedBeamCenterY) {
        return new AssemblyParameters(visualizationPixelSize, fillValue, changedBeamCenterX, changedBeamCenterY,
                                      collisionPolicy, canvasMode, excludeBadRegions);
    }

    public AssemblyParameters withCollisionPolicy(final CollisionPolicy changedCollisionPolicy) {
        return new AssemblyParameters(visualizationPixelSize, fillValue, beamCenterX, beamCenterY,
                                      changedCollisionPolicy, canvasMode, excludeBadRegions);
    }

    public AssemblyParameters withCanvasMode(final CanvasMode changedCanvasMode) {
        return new AssemblyParameters(visualizationPixelSize, fillValue, beamCenterX, beamCenterY,
                                      collisionPolicy, changedCanvasMode, excludeBadRegions);
    }

    public AssemblyParameters withExcludeBadRegions(final boolean changedExcludeBadRegions) {
        return new AssemblyParameters(visualizationPixelSize, fillValue, beamCenterX, beamCenterY,
                                      collisionPolicy, canvasMode, changedExcludeBadRegions);
    }

    /**
     * @throws IllegalArgumentException
     *   if any option is out of range.
     */
    public void validate() throws IllegalArgumentException {
        if ((visualizationPixelSize != null) &&
            (! (Double.isFinite(visualizationPixelSize) && visualizationPixelSize > 0.0))) {
            throw new IllegalArgumentException("visualizationPixelSize must be a positive number");
        }
        if ((beamCenterX == null) != (beamCenterY == null)) {
            throw new IllegalArgumentException("beamCenterX and beamCenterY must be specified together");
        }
        if ((beamCenterX != null) && (! (Double.isFinite(beamCenterX) && Double.isFinite(beamCenterY)))) {
            throw new IllegalArgumentException("beam center coordinates must be finite");
        }
    }

    @Override
    public String toString() {
        return JSON_HELPER.toJson(this);
    }

    public static final double DEFAULT_FILL_VALUE = 0.0;

    private static final JsonUtils.Helper<AssemblyParameters> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, AssemblyParameters.class);
}
