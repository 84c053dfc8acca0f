package org.janelia.detector.client;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.detector.CanvasGrid;
import org.janelia.detector.PixelAddress;
import org.janelia.detector.PixelMap;
import org.janelia.detector.spec.BeamSpec;
import org.janelia.detector.spec.Bounds;
import org.janelia.detector.spec.DetectorGeometry;
import org.janelia.detector.spec.Panel;

/**
 * JSON friendly overview of a geometry and the pixel map derived from it.
 */
public class GeometrySummary
        implements Serializable {

    private final int rawWidth;
    private final int rawHeight;
    private final int validPixelCount;
    private final BeamSpec beam;
    private final Double wavelength;
    private final List<PanelSummary> panels;
    private final Bounds bounds;
    private final CanvasGrid canvas;
    private final PixelAddress innermostPixel;
    private final PixelAddress outermostPixel;

    public GeometrySummary(final DetectorGeometry geometry,
                           final PixelMap pixelMap) {
        this.rawWidth = pixelMap.getColumns();
        this.rawHeight = pixelMap.getRows();
        this.validPixelCount = pixelMap.getValidPixelCount();
        this.beam = geometry.getBeam();
        this.wavelength = beam.getWavelength();
        this.panels = new ArrayList<>();
        for (final Panel panel : geometry.getPanels()) {
            this.panels.add(new PanelSummary(panel));
        }
        this.bounds = pixelMap.getBounds();
        this.canvas = pixelMap.getCanvas();
        this.innermostPixel = pixelMap.findInnermostPixel();
        this.outermostPixel = pixelMap.findOutermostPixel();
    }

    public int getRawWidth() {
        return rawWidth;
    }

    public int getRawHeight() {
        return rawHeight;
    }

    public int getValidPixelCount() {
        return validPixelCount;
    }

    public Double getWavelength() {
        return wavelength;
    }

    public List<PanelSummary> getPanels() {
        return panels;
    }

    public CanvasGrid getCanvas() {
        return canvas;
    }

    public PixelAddress getInnermostPixel() {
        return innermostPixel;
    }

    public PixelAddress getOutermostPixel() {
        return outermostPixel;
    }

    public static class PanelSummary
            implements Serializable {

        private final String name;
        private final String fsRange;
        private final String ssRange;
        private final double pixelPitch;
        private final double zOffset;

        PanelSummary(final Panel panel) {
            this.name = panel.getName();
            this.fsRange = panel.getMinFs() + ".." + panel.getMaxFs();
            this.ssRange = panel.getMinSs() + ".." + panel.getMaxSs();
            this.pixelPitch = panel.getPixelPitch();
            this.zOffset = panel.getZOffset();
        }

        public String getName() {
            return name;
        }

        public double getPixelPitch() {
            return pixelPitch;
        }
    }
}
