package org.janelia.detector.geom;

import org.janelia.detector.spec.BadRegion;

/**
 * Mutable attribute accumulator for one bad region while a geometry is parsed.
 */
class BadRegionAttributes {

    private enum Kind { UNDEFINED, RAW, PHYSICAL }

    private Kind kind = Kind.UNDEFINED;

    Double minX;
    Double maxX;
    Double minY;
    Double maxY;
    int minFs;
    int maxFs;
    int minSs;
    int maxSs;
    String panel;

    void setRaw(final int lineNumber,
                final String key)
            throws GeometryParseException {
        setKind(Kind.RAW, lineNumber, key);
    }

    void setPhysical(final int lineNumber,
                     final String key)
            throws GeometryParseException {
        setKind(Kind.PHYSICAL, lineNumber, key);
    }

    BadRegion toBadRegion(final String name)
            throws GeometryParseException {
        final BadRegion badRegion;
        switch (kind) {
            case RAW:
                badRegion = BadRegion.forRawRange(name, minFs, maxFs, minSs, maxSs, panel);
                break;
            case PHYSICAL:
                badRegion = BadRegion.forPhysicalRange(name, minX, maxX, minY, maxY, panel);
                break;
            default:
                throw new GeometryParseException("please specify the coordinate ranges for bad region " + name,
                                                 null, name);
        }
        return badRegion;
    }

    private void setKind(final Kind newKind,
                         final int lineNumber,
                         final String key)
            throws GeometryParseException {
        if (kind == Kind.UNDEFINED) {
            kind = newKind;
        } else if (kind != newKind) {
            throw new GeometryParseException("x/y and fs/ss ranges cannot be mixed in a bad region",
                                             lineNumber, key);
        }
    }
}
