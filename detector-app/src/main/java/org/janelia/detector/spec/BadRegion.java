package org.janelia.detector.spec;

import java.io.Serializable;

/**
 * A named detector region whose pixels should not be treated as valid data.
 * A region is either bounded in raw array coordinates (fs/ss) or in physical
 * coordinates (x/y, detector pixel units), never both.
 */
public class BadRegion
        implements Serializable {

    private final String name;
    private final boolean rawCoordinates;
    private final Double minX;
    private final Double maxX;
    private final Double minY;
    private final Double maxY;
    private final int minFs;
    private final int maxFs;
    private final int minSs;
    private final int maxSs;
    private final String panel;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private BadRegion() {
        this(null, false, null, null, null, null, 0, 0, 0, 0, null);
    }

    private BadRegion(final String name,
                      final boolean rawCoordinates,
                      final Double minX,
                      final Double maxX,
                      final Double minY,
                      final Double maxY,
                      final int minFs,
                      final int maxFs,
                      final int minSs,
                      final int maxSs,
                      final String panel) {
        this.name = name;
        this.rawCoordinates = rawCoordinates;
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
        this.minFs = minFs;
        this.maxFs = maxFs;
        this.minSs = minSs;
        this.maxSs = maxSs;
        this.panel = panel;
    }

    public static BadRegion forRawRange(final String name,
                                        final int minFs,
                                        final int maxFs,
                                        final int minSs,
                                        final int maxSs,
                                        final String panel) {
        return new BadRegion(name, true, null, null, null, null, minFs, maxFs, minSs, maxSs, panel);
    }

    public static BadRegion forPhysicalRange(final String name,
                                             final Double minX,
                                             final Double maxX,
                                             final Double minY,
                                             final Double maxY,
                                             final String panel) {
        return new BadRegion(name, false, minX, maxX, minY, maxY, 0, 0, 0, 0, panel);
    }

    public String getName() {
        return name;
    }

    public boolean isRawCoordinates() {
        return rawCoordinates;
    }

    public String getPanel() {
        return panel;
    }

    /**
     * @param  panelName  name of the panel containing the pixel.
     * @param  row        raw row (slow-scan) index.
     * @param  column     raw column (fast-scan) index.
     * @param  x          physical x in detector pixel units.
     * @param  y          physical y in detector pixel units.
     *
     * @return true if the specified pixel lies within this region.
     */
    public boolean contains(final String panelName,
                            final int row,
                            final int column,
                            final double x,
                            final double y) {

        if ((panel != null) && (! panel.equals(panelName))) {
            return false;
        }

        final boolean isInside;
        if (rawCoordinates) {
            isInside = (column >= minFs) && (column <= maxFs) && (row >= minSs) && (row <= maxSs);
        } else {
            isInside = isWithin(x, minX, maxX) && isWithin(y, minY, maxY);
        }
        return isInside;
    }

    // unspecified physical limits are unbounded
    private static boolean isWithin(final double value,
                                    final Double min,
                                    final Double max) {
        return ((min == null) || (value >= min)) && ((max == null) || (value <= max));
    }

    @Override
    public String toString() {
        final String range;
        if (rawCoordinates) {
            range = "fs " + minFs + ".." + maxFs + ", ss " + minSs + ".." + maxSs;
        } else {
            range = "x " + minX + ".." + maxX + ", y " + minY + ".." + maxY;
        }
        return name + " [" + range + (panel == null ? "" : ", panel " + panel) + "]";
    }
}
