package org.janelia.detector.geom;

import java.util.ArrayList;
import java.util.List;

import org.janelia.detector.spec.Panel;
import org.janelia.detector.spec.PanelMetadata;
import org.janelia.detector.spec.PanelMetadata.BadRowDirection;
import org.janelia.detector.spec.Vector3D;

/**
 * Mutable attribute accumulator for one panel (or for the panel defaults) while a geometry is parsed.
 */
class PanelAttributes {

    Integer minFs;
    Integer maxFs;
    Integer minSs;
    Integer maxSs;
    Double cornerX;
    Double cornerY;
    Double res;
    Vector3D fs;
    Vector3D ss;
    Double clen;
    String clenFrom;
    double coffset;
    Double aduPerEv;
    Double aduPerPhoton;
    String maxAdu;
    String data;
    String mask;
    String maskFile;
    String saturationMap;
    String saturationMapFile;
    BadRowDirection badRowDirection;
    boolean noIndex;
    List<String> dimStructure;

    Integer firstLineNumber;

    PanelAttributes() {
        this.coffset = 0.0;
        this.noIndex = false;
    }

    /**
     * @return a new accumulator starting from the current values of this one.
     */
    PanelAttributes copy() {
        final PanelAttributes copy = new PanelAttributes();
        copy.minFs = minFs;
        copy.maxFs = maxFs;
        copy.minSs = minSs;
        copy.maxSs = maxSs;
        copy.cornerX = cornerX;
        copy.cornerY = cornerY;
        copy.res = res;
        copy.fs = fs;
        copy.ss = ss;
        copy.clen = clen;
        copy.clenFrom = clenFrom;
        copy.coffset = coffset;
        copy.aduPerEv = aduPerEv;
        copy.aduPerPhoton = aduPerPhoton;
        copy.maxAdu = maxAdu;
        copy.data = data;
        copy.mask = mask;
        copy.maskFile = maskFile;
        copy.saturationMap = saturationMap;
        copy.saturationMapFile = saturationMapFile;
        copy.badRowDirection = badRowDirection;
        copy.noIndex = noIndex;
        copy.dimStructure = dimStructure == null ? null : new ArrayList<>(dimStructure);
        return copy;
    }

    void setDim(final int index,
                final String value) {
        if (dimStructure == null) {
            dimStructure = new ArrayList<>();
        }
        while (dimStructure.size() <= index) {
            dimStructure.add(null);
        }
        dimStructure.set(index, value);
    }

    /**
     * @return names of required attributes that have not been set.
     */
    List<String> getMissingRequiredAttributes() {
        final List<String> missing = new ArrayList<>();
        addIfMissing(minFs, "min_fs", missing);
        addIfMissing(maxFs, "max_fs", missing);
        addIfMissing(minSs, "min_ss", missing);
        addIfMissing(maxSs, "max_ss", missing);
        addIfMissing(cornerX, "corner_x", missing);
        addIfMissing(cornerY, "corner_y", missing);
        addIfMissing(res, "res", missing);
        addIfMissing(fs, "fs", missing);
        addIfMissing(ss, "ss", missing);
        return missing;
    }

    Panel toPanel(final String name) {
        final PanelMetadata metadata = new PanelMetadata(aduPerEv,
                                                         aduPerPhoton,
                                                         maxAdu,
                                                         data,
                                                         mask,
                                                         maskFile,
                                                         saturationMap,
                                                         saturationMapFile,
                                                         badRowDirection,
                                                         noIndex,
                                                         dimStructure);
        return new Panel(name,
                         minFs,
                         maxFs,
                         minSs,
                         maxSs,
                         res,
                         new Vector3D(cornerX, cornerY),
                         fs,
                         ss,
                         clen,
                         clenFrom,
                         coffset,
                         metadata);
    }

    private static void addIfMissing(final Object value,
                                     final String attributeName,
                                     final List<String> missing) {
        if (value == null) {
            missing.add(attributeName);
        }
    }
}
