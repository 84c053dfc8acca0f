package org.janelia.detector.spec;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Objects;

/**
 * Coordinate bound ranges.
 */
public class Bounds implements Serializable {

    private final Double minX;
    private final Double minY;
    private final Double minZ;
    private final Double maxX;
    private final Double maxY;
    private final Double maxZ;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private Bounds() {
        this(null, null, null, null, null, null);
    }

    public Bounds(final Double minX,
                  final Double minY,
                  final Double minZ,
                  final Double maxX,
                  final Double maxY,
                  final Double maxZ) {
        this.minX = minX;
        this.minY = minY;
        this.minZ = minZ;
        this.maxX = maxX;
        this.maxY = maxY;
        this.maxZ = maxZ;
    }

    public Double getMinX() {
        return minX;
    }

    public Double getMinY() {
        return minY;
    }

    public Double getMinZ() {
        return minZ;
    }

    public Double getMaxX() {
        return maxX;
    }

    public Double getMaxY() {
        return maxY;
    }

    public Double getMaxZ() {
        return maxZ;
    }

    @JsonIgnore
    public double getDeltaX() {
        return maxX - minX;
    }

    @JsonIgnore
    public double getDeltaY() {
        return maxY - minY;
    }

    @Override
    public String toString() {
        return String.format("[[%12.6g, %12.6g, %12.6g], [%12.6g, %12.6g, %12.6g]]",
                             minX, minY, minZ, maxX, maxY, maxZ);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        final Bounds bounds = (Bounds) o;

        return Objects.equals(minX, bounds.minX) &&
               Objects.equals(minY, bounds.minY) &&
               Objects.equals(minZ, bounds.minZ) &&
               Objects.equals(maxX, bounds.maxX) &&
               Objects.equals(maxY, bounds.maxY) &&
               Objects.equals(maxZ, bounds.maxZ);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minX, minY, minZ, maxX, maxY, maxZ);
    }
}
