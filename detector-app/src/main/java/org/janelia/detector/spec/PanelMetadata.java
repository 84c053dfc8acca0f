package org.janelia.detector.spec;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Readout attributes for a panel that do not influence pixel positions.
 * They are kept so that a parsed geometry retains everything the source described.
 */
public class PanelMetadata
        implements Serializable {

    public static final PanelMetadata EMPTY =
            new PanelMetadata(null, null, null, null, null, null, null, null, null, false, null);

    private final Double aduPerEv;
    private final Double aduPerPhoton;
    private final String maxAdu;
    private final String data;
    private final String mask;
    private final String maskFile;
    private final String saturationMap;
    private final String saturationMapFile;
    private final BadRowDirection badRowDirection;
    private final boolean noIndex;
    private final List<String> dimStructure;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private PanelMetadata() {
        this(null, null, null, null, null, null, null, null, null, false, null);
    }

    public PanelMetadata(final Double aduPerEv,
                         final Double aduPerPhoton,
                         final String maxAdu,
                         final String data,
                         final String mask,
                         final String maskFile,
                         final String saturationMap,
                         final String saturationMapFile,
                         final BadRowDirection badRowDirection,
                         final boolean noIndex,
                         final List<String> dimStructure) {
        this.aduPerEv = aduPerEv;
        this.aduPerPhoton = aduPerPhoton;
        this.maxAdu = maxAdu;
        this.data = data;
        this.mask = mask;
        this.maskFile = maskFile;
        this.saturationMap = saturationMap;
        this.saturationMapFile = saturationMapFile;
        this.badRowDirection = badRowDirection;
        this.noIndex = noIndex;
        this.dimStructure = dimStructure == null ? null : new ArrayList<>(dimStructure);
    }

    public Double getAduPerEv() {
        return aduPerEv;
    }

    public Double getAduPerPhoton() {
        return aduPerPhoton;
    }

    public String getMaxAdu() {
        return maxAdu;
    }

    public String getData() {
        return data;
    }

    public String getMask() {
        return mask;
    }

    public String getMaskFile() {
        return maskFile;
    }

    public String getSaturationMap() {
        return saturationMap;
    }

    public String getSaturationMapFile() {
        return saturationMapFile;
    }

    public BadRowDirection getBadRowDirection() {
        return badRowDirection == null ? BadRowDirection.NONE : badRowDirection;
    }

    public boolean isNoIndex() {
        return noIndex;
    }

    /**
     * @return layout of the panel's data dimensions ("ss", "fs", "%" placeholder, or fixed index),
     *         defaults to [ss, fs].
     */
    public List<String> getDimStructure() {
        final List<String> structure;
        if (dimStructure == null) {
            structure = DEFAULT_DIM_STRUCTURE;
        } else {
            structure = Collections.unmodifiableList(dimStructure);
        }
        return structure;
    }

    public static final List<String> DEFAULT_DIM_STRUCTURE =
            Collections.unmodifiableList(Arrays.asList("ss", "fs"));

    /**
     * Direction of bad rows for a panel.
     */
    public enum BadRowDirection {
        FAST_SCAN, SLOW_SCAN, NONE
    }
}
