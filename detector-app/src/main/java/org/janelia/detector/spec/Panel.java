package org.janelia.detector.spec;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * A rectangular sub-region of the detector read out as one contiguous block of the raw data array.
 *
 * <p>Raw columns are the fast-scan (fs) axis and raw rows are the slow-scan (ss) axis.
 * The corner and scan vectors are expressed in detector pixel units; multiplying by the
 * pixel pitch ({@code 1 / res}) converts them to meters.</p>
 */
public class Panel
        implements Serializable {

    /** Relative in-plane determinant below which fs and ss are considered parallel. */
    public static final double DEGENERATE_TOLERANCE = 1.0e-9;

    private final String name;
    private final int minFs;
    private final int maxFs;
    private final int minSs;
    private final int maxSs;
    private final double res;
    private final Vector3D corner;
    private final Vector3D fs;
    private final Vector3D ss;
    private final Double clen;
    private final String clenFrom;
    private final double coffset;
    private final PanelMetadata metadata;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private Panel() {
        this.name = null;
        this.minFs = 0;
        this.maxFs = 0;
        this.minSs = 0;
        this.maxSs = 0;
        this.res = 1.0;
        this.corner = null;
        this.fs = null;
        this.ss = null;
        this.clen = null;
        this.clenFrom = null;
        this.coffset = 0.0;
        this.metadata = null;
    }

    public Panel(final String name,
                 final int minFs,
                 final int maxFs,
                 final int minSs,
                 final int maxSs,
                 final double res,
                 final Vector3D corner,
                 final Vector3D fs,
                 final Vector3D ss)
            throws IllegalArgumentException {
        this(name, minFs, maxFs, minSs, maxSs, res, corner, fs, ss, null, null, 0.0, PanelMetadata.EMPTY);
    }

    public Panel(final String name,
                 final int minFs,
                 final int maxFs,
                 final int minSs,
                 final int maxSs,
                 final double res,
                 final Vector3D corner,
                 final Vector3D fs,
                 final Vector3D ss,
                 final Double clen,
                 final String clenFrom,
                 final double coffset,
                 final PanelMetadata metadata)
            throws IllegalArgumentException {
        this.name = name;
        this.minFs = minFs;
        this.maxFs = maxFs;
        this.minSs = minSs;
        this.maxSs = maxSs;
        this.res = res;
        this.corner = corner;
        this.fs = fs;
        this.ss = ss;
        this.clen = clen;
        this.clenFrom = clenFrom;
        this.coffset = coffset;
        this.metadata = metadata;
        validate();
    }

    public String getName() {
        return name;
    }

    public int getMinFs() {
        return minFs;
    }

    public int getMaxFs() {
        return maxFs;
    }

    public int getMinSs() {
        return minSs;
    }

    public int getMaxSs() {
        return maxSs;
    }

    /**
     * @return resolution in pixels per meter.
     */
    public double getRes() {
        return res;
    }

    /**
     * @return physical size of one pixel in meters.
     */
    @JsonIgnore
    public double getPixelPitch() {
        return 1.0 / res;
    }

    public Vector3D getCorner() {
        return corner;
    }

    public Vector3D getFs() {
        return fs;
    }

    public Vector3D getSs() {
        return ss;
    }

    public Double getClen() {
        return clen;
    }

    /**
     * @return location (e.g. an HDF5 path) from which the camera length is read at acquisition time,
     *         or null if the camera length is fixed.
     */
    public String getClenFrom() {
        return clenFrom;
    }

    public double getCoffset() {
        return coffset;
    }

    public PanelMetadata getMetadata() {
        return metadata == null ? PanelMetadata.EMPTY : metadata;
    }

    /**
     * @return z position (meters) of the panel plane, zero when the camera length is not fixed.
     */
    @JsonIgnore
    public double getZOffset() {
        return (clen == null ? 0.0 : clen) + coffset;
    }

    /**
     * @return number of raw columns (fast-scan pixels).
     */
    @JsonIgnore
    public int getWidth() {
        return maxFs - minFs + 1;
    }

    /**
     * @return number of raw rows (slow-scan pixels).
     */
    @JsonIgnore
    public int getHeight() {
        return maxSs - minSs + 1;
    }

    @JsonIgnore
    public long getPixelCount() {
        return (long) getWidth() * getHeight();
    }

    public boolean contains(final int row,
                            final int column) {
        return (row >= minSs) && (row <= maxSs) && (column >= minFs) && (column <= maxFs);
    }

    public boolean overlaps(final Panel other) {
        return (minFs <= other.maxFs) && (other.minFs <= maxFs) &&
               (minSs <= other.maxSs) && (other.minSs <= maxSs);
    }

    /**
     * @return true if the fast-scan and slow-scan vectors, projected onto the detector (x, y) plane,
     *         are (nearly) parallel or zero length.
     */
    @JsonIgnore
    public boolean isDegenerate() {
        final double fsInPlane = Math.hypot(fs.getX(), fs.getY());
        final double ssInPlane = Math.hypot(ss.getX(), ss.getY());
        final double scale = fsInPlane * ssInPlane;
        final double determinant = (fs.getX() * ss.getY()) - (fs.getY() * ss.getX());
        return (scale == 0.0) || (Math.abs(determinant) < DEGENERATE_TOLERANCE * scale);
    }

    /**
     * @throws DegeneratePanelException
     *   if this panel's scan vectors do not span a plane.
     */
    public void validateScanVectors() throws DegeneratePanelException {
        if (isDegenerate()) {
            throw new DegeneratePanelException(name, "fast-scan vector " + fs + " and slow-scan vector " + ss +
                                                     " do not span the detector plane");
        }
    }

    /**
     * @throws IllegalArgumentException
     *   if any attribute is missing or out of range.
     */
    public void validate() throws IllegalArgumentException {

        if ((name == null) || name.trim().isEmpty()) {
            throw new IllegalArgumentException("panel name must be specified");
        }
        if ((minFs < 0) || (minSs < 0)) {
            throw new IllegalArgumentException("panel " + name + " has negative extents");
        }
        if ((maxFs < minFs) || (maxSs < minSs)) {
            throw new IllegalArgumentException("panel " + name + " has max extents below min extents");
        }
        // raw width and height are max + 1
        if ((maxFs == Integer.MAX_VALUE) || (maxSs == Integer.MAX_VALUE)) {
            throw new IllegalArgumentException("panel " + name + " has max extents that exceed the raw data range");
        }
        if (! (Double.isFinite(res) && res > 0.0)) {
            throw new IllegalArgumentException("panel " + name + " has invalid res " + res);
        }
        if ((corner == null) || (fs == null) || (ss == null)) {
            throw new IllegalArgumentException("panel " + name + " is missing corner or scan vectors");
        }
        if (! (corner.isFinite() && fs.isFinite() && ss.isFinite())) {
            throw new IllegalArgumentException("panel " + name + " has non-finite corner or scan vectors");
        }
    }

    @Override
    public String toString() {
        return name + " [fs " + minFs + ".." + maxFs + ", ss " + minSs + ".." + maxSs + "]";
    }
}
