package org.janelia.detector.geom;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.janelia.detector.spec.BadRegion;
import org.janelia.detector.spec.BeamSpec;
import org.janelia.detector.spec.DetectorGeometry;
import org.janelia.detector.spec.Panel;
import org.janelia.detector.spec.PanelMetadata.BadRowDirection;
import org.janelia.detector.spec.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses CrystFEL style geometry text into a {@link DetectorGeometry}.
 *
 * <p>The text is line oriented:</p>
 * <ul>
 *   <li>lines starting with {@code ;} or {@code #} are comments, text after a {@code ;} or {@code #} is ignored,</li>
 *   <li>{@code panel/attribute = value} assigns an attribute of a named panel,</li>
 *   <li>{@code badName/attribute = value} (first path element starting with "bad") describes a bad region,</li>
 *   <li>{@code attribute = value} assigns a global parameter, or a default for every panel declared later.</li>
 * </ul>
 *
 * <p>Unknown attributes are ignored.  Whitespace inside values is removed, so
 * {@code fs = -0.0024x +0.9999y} is read as {@code -0.0024x+0.9999y}.</p>
 *
 * <p>Each call to {@link #parse} uses its own state, so the parser can be used from multiple threads.</p>
 */
public class GeometryParser {

    private final PanelAttributes defaultPanel;
    private final Map<String, PanelAttributes> panelAttributes;
    private final Map<String, BadRegionAttributes> badRegionAttributes;
    private final Map<String, List<String>> rigidGroups;
    private final Map<String, List<String>> rigidGroupCollections;

    private Double photonEnergy;
    private String photonEnergyFrom;
    private double photonEnergyScale;
    private Double beamCenterX;
    private Double beamCenterY;
    private long maskGood;
    private long maskBad;

    private GeometryParser() {
        this.defaultPanel = new PanelAttributes();
        this.panelAttributes = new LinkedHashMap<>();
        this.badRegionAttributes = new LinkedHashMap<>();
        this.rigidGroups = new LinkedHashMap<>();
        this.rigidGroupCollections = new LinkedHashMap<>();
        this.photonEnergy = null;
        this.photonEnergyFrom = null;
        this.photonEnergyScale = 1.0;
        this.beamCenterX = null;
        this.beamCenterY = null;
        this.maskGood = 0;
        this.maskBad = 0;
    }

    /**
     * @param  text  complete geometry description.
     *
     * @return the parsed and validated geometry.
     *
     * @throws GeometryParseException
     *   if the text is malformed or a panel is missing a required attribute.
     *
     * @throws org.janelia.detector.spec.InconsistentGeometryException
     *   if the described panels overlap, are degenerate, or if no panels are described.
     */
    public static DetectorGeometry parse(final String text)
            throws IllegalArgumentException {

        if (text == null) {
            throw new GeometryParseException("geometry text must be specified", null, null);
        }

        final GeometryParser parser = new GeometryParser();

        int lineNumber = 0;
        try (final BufferedReader reader = new BufferedReader(new StringReader(text))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                parser.parseLine(line, lineNumber);
            }
        } catch (final IOException e) {
            // not expected for string readers
            throw new GeometryParseException("failed to read geometry text", lineNumber, null, e);
        }

        final DetectorGeometry geometry = parser.buildGeometry();

        LOG.debug("parse: parsed {} lines into {} panels and {} bad regions",
                  lineNumber, geometry.getPanelCount(), geometry.getBadRegions().size());

        return geometry;
    }

    private static int firstCommentIndex(final String line) {
        final int semicolon = line.indexOf(';');
        final int hash = line.indexOf('#');
        if (semicolon < 0) {
            return hash;
        } else if (hash < 0) {
            return semicolon;
        }
        return Math.min(semicolon, hash);
    }

    private void parseLine(final String line,
                           final int lineNumber)
            throws GeometryParseException {

        final String trimmedLine = line.trim();
        if (trimmedLine.isEmpty() || trimmedLine.startsWith(";") || trimmedLine.startsWith("#")) {
            return;
        }

        final int commentStart = firstCommentIndex(trimmedLine);
        final String content = commentStart > -1 ? trimmedLine.substring(0, commentStart) : trimmedLine;

        final int equalsIndex = content.indexOf('=');
        if (equalsIndex < 0) {
            LOG.debug("parseLine: ignoring line {} without assignment: '{}'", lineNumber, line);
            return;
        }

        final String key = content.substring(0, equalsIndex).trim();
        final String value = WHITESPACE.matcher(content.substring(equalsIndex + 1)).replaceAll("");

        if (key.isEmpty() || value.isEmpty()) {
            LOG.debug("parseLine: ignoring incomplete assignment on line {}: '{}'", lineNumber, line);
            return;
        }

        final String[] path = Arrays.stream(key.split("/")).filter(s -> ! s.isEmpty()).toArray(String[]::new);

        if (path.length < 2) {
            parseTopLevel(key, value, lineNumber);
        } else if (path[0].startsWith("bad")) {
            final BadRegionAttributes bad = badRegionAttributes.computeIfAbsent(path[0],
                                                                                name -> new BadRegionAttributes());
            parseBadRegionField(path[1], value, bad, lineNumber);
        } else {
            PanelAttributes panel = panelAttributes.get(path[0]);
            if (panel == null) {
                panel = defaultPanel.copy();
                panel.firstLineNumber = lineNumber;
                panelAttributes.put(path[0], panel);
            }
            parsePanelField(path[1], value, panel, lineNumber);
        }
    }

    private void parseTopLevel(final String key,
                               final String value,
                               final int lineNumber)
            throws GeometryParseException {

        if ("mask_good".equals(key)) {
            maskGood = parseMaskBits(key, value, lineNumber);
        } else if ("mask_bad".equals(key)) {
            maskBad = parseMaskBits(key, value, lineNumber);
        } else if ("photon_energy".equals(key)) {
            if (value.startsWith("/")) {
                photonEnergy = null;
                photonEnergyFrom = value;
            } else {
                photonEnergy = parseDouble(key, value, lineNumber);
                photonEnergyFrom = null;
            }
        } else if ("photon_energy_scale".equals(key)) {
            photonEnergyScale = parseDouble(key, value, lineNumber);
        } else if ("beam_center_x".equals(key)) {
            beamCenterX = parseDouble(key, value, lineNumber);
        } else if ("beam_center_y".equals(key)) {
            beamCenterY = parseDouble(key, value, lineNumber);
        } else if (key.startsWith(RIGID_GROUP_COLLECTION_PREFIX)) {
            rigidGroupCollections.put(key.substring(RIGID_GROUP_COLLECTION_PREFIX.length()), splitList(value));
        } else if (key.startsWith(RIGID_GROUP_PREFIX)) {
            rigidGroups.put(key.substring(RIGID_GROUP_PREFIX.length()), splitList(value));
        } else {
            parsePanelField(key, value, defaultPanel, lineNumber);
        }
    }

    private void parsePanelField(final String key,
                                 final String value,
                                 final PanelAttributes panel,
                                 final int lineNumber)
            throws GeometryParseException {

        switch (key) {
            case "min_fs":
                panel.minFs = parseInt(key, value, lineNumber);
                break;
            case "max_fs":
                panel.maxFs = parseInt(key, value, lineNumber);
                break;
            case "min_ss":
                panel.minSs = parseInt(key, value, lineNumber);
                break;
            case "max_ss":
                panel.maxSs = parseInt(key, value, lineNumber);
                break;
            case "corner_x":
                panel.cornerX = parseDouble(key, value, lineNumber);
                break;
            case "corner_y":
                panel.cornerY = parseDouble(key, value, lineNumber);
                break;
            case "res":
                panel.res = parseDouble(key, value, lineNumber);
                break;
            case "fs":
                panel.fs = parseDirection(key, value, lineNumber);
                break;
            case "ss":
                panel.ss = parseDirection(key, value, lineNumber);
                break;
            case "clen":
                try {
                    panel.clen = Double.parseDouble(value);
                    panel.clenFrom = null;
                } catch (final NumberFormatException e) {
                    // camera length is read from the data at acquisition time
                    panel.clen = null;
                    panel.clenFrom = value;
                }
                break;
            case "coffset":
                panel.coffset = parseDouble(key, value, lineNumber);
                break;
            case "adu_per_eV":
                panel.aduPerEv = parseDouble(key, value, lineNumber);
                break;
            case "adu_per_photon":
                panel.aduPerPhoton = parseDouble(key, value, lineNumber);
                break;
            case "max_adu":
                panel.maxAdu = value;
                break;
            case "data":
                panel.data = parseDataLocation(key, value, lineNumber);
                break;
            case "mask":
                panel.mask = parseDataLocation(key, value, lineNumber);
                break;
            case "mask_file":
                panel.maskFile = value;
                break;
            case "saturation_map":
                panel.saturationMap = value;
                break;
            case "saturation_map_file":
                panel.saturationMapFile = value;
                break;
            case "badrow_direction":
                panel.badRowDirection = parseBadRowDirection(value, lineNumber);
                break;
            case "no_index":
                panel.noIndex = parseBoolean(value);
                break;
            default:
                if (key.startsWith("dim")) {
                    parseDim(key, value, panel, lineNumber);
                } else {
                    LOG.debug("parsePanelField: ignoring unknown field '{}' on line {}", key, lineNumber);
                }
        }
    }

    private void parseBadRegionField(final String key,
                                     final String value,
                                     final BadRegionAttributes bad,
                                     final int lineNumber)
            throws GeometryParseException {

        switch (key) {
            case "min_x":
                bad.setPhysical(lineNumber, key);
                bad.minX = parseDouble(key, value, lineNumber);
                break;
            case "max_x":
                bad.setPhysical(lineNumber, key);
                bad.maxX = parseDouble(key, value, lineNumber);
                break;
            case "min_y":
                bad.setPhysical(lineNumber, key);
                bad.minY = parseDouble(key, value, lineNumber);
                break;
            case "max_y":
                bad.setPhysical(lineNumber, key);
                bad.maxY = parseDouble(key, value, lineNumber);
                break;
            case "min_fs":
                bad.setRaw(lineNumber, key);
                bad.minFs = parseInt(key, value, lineNumber);
                break;
            case "max_fs":
                bad.setRaw(lineNumber, key);
                bad.maxFs = parseInt(key, value, lineNumber);
                break;
            case "min_ss":
                bad.setRaw(lineNumber, key);
                bad.minSs = parseInt(key, value, lineNumber);
                break;
            case "max_ss":
                bad.setRaw(lineNumber, key);
                bad.maxSs = parseInt(key, value, lineNumber);
                break;
            case "panel":
                bad.panel = value;
                break;
            default:
                LOG.debug("parseBadRegionField: ignoring unknown field '{}' on line {}", key, lineNumber);
        }
    }

    private DetectorGeometry buildGeometry()
            throws IllegalArgumentException {

        final List<Panel> panels = new ArrayList<>(panelAttributes.size());
        for (final Map.Entry<String, PanelAttributes> entry : panelAttributes.entrySet()) {
            final String name = entry.getKey();
            final PanelAttributes attributes = entry.getValue();
            final List<String> missing = attributes.getMissingRequiredAttributes();
            if (missing.size() > 0) {
                throw new GeometryParseException("panel " + name + " is missing required attribute(s) " + missing,
                                                 attributes.firstLineNumber, name + "/" + missing.get(0));
            }
            try {
                panels.add(attributes.toPanel(name));
            } catch (final IllegalArgumentException e) {
                throw new GeometryParseException(e.getMessage(), attributes.firstLineNumber, name, e);
            }
        }

        validateDimStructures();

        final List<BadRegion> badRegions = new ArrayList<>(badRegionAttributes.size());
        for (final Map.Entry<String, BadRegionAttributes> entry : badRegionAttributes.entrySet()) {
            badRegions.add(entry.getValue().toBadRegion(entry.getKey()));
        }

        for (final Map.Entry<String, List<String>> entry : rigidGroups.entrySet()) {
            for (final String panelName : entry.getValue()) {
                if (! panelAttributes.containsKey(panelName)) {
                    throw new GeometryParseException("cannot add panel to rigid group " + entry.getKey() +
                                                     ", panel not found: " + panelName,
                                                     null, RIGID_GROUP_PREFIX + entry.getKey());
                }
            }
        }

        for (final Map.Entry<String, List<String>> entry : rigidGroupCollections.entrySet()) {
            for (final String groupName : entry.getValue()) {
                if (! rigidGroups.containsKey(groupName)) {
                    throw new GeometryParseException("cannot add rigid group to collection " + entry.getKey() +
                                                     ", rigid group not found: " + groupName,
                                                     null, RIGID_GROUP_COLLECTION_PREFIX + entry.getKey());
                }
            }
        }

        if ((beamCenterX == null) != (beamCenterY == null)) {
            throw new GeometryParseException("beam_center_x and beam_center_y must be specified together",
                                             null, beamCenterX == null ? "beam_center_x" : "beam_center_y");
        }

        final BeamSpec beam = new BeamSpec(photonEnergy, photonEnergyFrom, photonEnergyScale);

        final DetectorGeometry geometry = new DetectorGeometry(panels,
                                                               beam,
                                                               beamCenterX,
                                                               beamCenterY,
                                                               badRegions,
                                                               rigidGroups,
                                                               rigidGroupCollections,
                                                               maskGood,
                                                               maskBad);
        geometry.validate();

        return geometry;
    }

    private void validateDimStructures()
            throws GeometryParseException {

        Integer dimLength = null;
        Integer dataPlaceholders = null;
        Integer maskPlaceholders = null;

        for (final Map.Entry<String, PanelAttributes> entry : panelAttributes.entrySet()) {

            final String name = entry.getKey();
            final PanelAttributes attributes = entry.getValue();
            final List<String> dims = attributes.dimStructure == null ?
                                      Arrays.asList("ss", "fs") : attributes.dimStructure;

            int foundSs = 0;
            int foundFs = 0;
            int foundPlaceholder = 0;
            for (int i = 0; i < dims.size(); i++) {
                final String dim = dims.get(i);
                if (dim == null) {
                    throw new GeometryParseException("dimension " + i + " for panel " + name + " is undefined",
                                                     null, name + "/dim" + i);
                } else if ("ss".equals(dim)) {
                    foundSs++;
                } else if ("fs".equals(dim)) {
                    foundFs++;
                } else if ("%".equals(dim)) {
                    foundPlaceholder++;
                }
            }

            if ((foundSs != 1) || (foundFs != 1)) {
                throw new GeometryParseException("exactly one slow scan and one fast scan dim coordinate is " +
                                                 "needed (found " + foundSs + " ss and " + foundFs +
                                                 " fs for panel " + name + ")", null, name + "/dim");
            }
            if (foundPlaceholder > 1) {
                throw new GeometryParseException("only one placeholder dim coordinate is allowed (found " +
                                                 foundPlaceholder + " for panel " + name + ")",
                                                 null, name + "/dim");
            }

            if (dimLength == null) {
                dimLength = dims.size();
            } else if (dimLength != dims.size()) {
                throw new GeometryParseException("number of dim coordinates must be the same for all panels",
                                                 null, name + "/dim");
            }

            if (dataPlaceholders == null) {
                dataPlaceholders = foundPlaceholder;
            } else if (dataPlaceholders != foundPlaceholder) {
                throw new GeometryParseException("all panels' data entries must have the same number of " +
                                                 "placeholders", null, name + "/dim");
            }

            final int panelMaskPlaceholders = countPlaceholders(attributes.mask);
            if (maskPlaceholders == null) {
                maskPlaceholders = panelMaskPlaceholders;
            } else if (maskPlaceholders != panelMaskPlaceholders) {
                throw new GeometryParseException("all panels' mask entries must have the same number of " +
                                                 "placeholders", null, name + "/mask");
            }
        }

        if ((maskPlaceholders != null) && (maskPlaceholders > dataPlaceholders)) {
            throw new GeometryParseException("number of placeholders in mask cannot be larger than the " +
                                             "number for data", null, "mask");
        }
    }

    private static int countPlaceholders(final String location) {
        int count = 0;
        if (location != null) {
            for (int i = 0; i < location.length(); i++) {
                if (location.charAt(i) == '%') {
                    count++;
                }
            }
        }
        return count;
    }

    private static void parseDim(final String key,
                                 final String value,
                                 final PanelAttributes panel,
                                 final int lineNumber)
            throws GeometryParseException {

        final String indexText = key.substring(3);
        final int index;
        try {
            index = Integer.parseInt(indexText);
        } catch (final NumberFormatException e) {
            throw new GeometryParseException("'dim' must be followed by a number, e.g. 'dim0'", lineNumber, key, e);
        }
        if (index < 0) {
            throw new GeometryParseException("invalid dimension number " + index, lineNumber, key);
        }

        if ("ss".equals(value) || "fs".equals(value) || "%".equals(value) || value.chars().allMatch(Character::isDigit)) {
            panel.setDim(index, value);
        } else {
            throw new GeometryParseException("invalid dim entry '" + value + "'", lineNumber, key);
        }
    }

    private static BadRowDirection parseBadRowDirection(final String value,
                                                        final int lineNumber) {
        final BadRowDirection direction;
        switch (value) {
            case "x":
            case "f":
                direction = BadRowDirection.FAST_SCAN;
                break;
            case "y":
            case "s":
                direction = BadRowDirection.SLOW_SCAN;
                break;
            case "-":
                direction = BadRowDirection.NONE;
                break;
            default:
                LOG.warn("parseBadRowDirection: badrow_direction on line {} must be x, y, f, s, or '-', " +
                         "assuming '-' for '{}'", lineNumber, value);
                direction = BadRowDirection.NONE;
        }
        return direction;
    }

    private static boolean parseBoolean(final String value) {
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private static String parseDataLocation(final String key,
                                            final String value,
                                            final int lineNumber)
            throws GeometryParseException {
        if (! value.startsWith("/")) {
            throw new GeometryParseException("invalid data location '" + value + "'", lineNumber, key);
        }
        return value;
    }

    private static List<String> splitList(final String value) {
        final List<String> list = new ArrayList<>();
        for (final String item : value.split(",")) {
            if (! item.isEmpty()) {
                list.add(item);
            }
        }
        return list;
    }

    private static long parseMaskBits(final String key,
                                      final String value,
                                      final int lineNumber)
            throws GeometryParseException {
        try {
            final long bits;
            if (value.startsWith("0x") || value.startsWith("0X")) {
                bits = Long.parseLong(value.substring(2), 16);
            } else {
                bits = Long.parseLong(value);
            }
            return bits;
        } catch (final NumberFormatException e) {
            throw new GeometryParseException("invalid mask value '" + value + "'", lineNumber, key, e);
        }
    }

    private static int parseInt(final String key,
                                final String value,
                                final int lineNumber)
            throws GeometryParseException {
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new GeometryParseException("invalid integer value '" + value + "'", lineNumber, key, e);
        }
    }

    private static double parseDouble(final String key,
                                      final String value,
                                      final int lineNumber)
            throws GeometryParseException {
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw new GeometryParseException("invalid numeric value '" + value + "'", lineNumber, key, e);
        }
    }

    private static Vector3D parseDirection(final String key,
                                           final String value,
                                           final int lineNumber)
            throws GeometryParseException {
        try {
            return ScanDirectionParser.parse(value);
        } catch (final IllegalArgumentException e) {
            throw new GeometryParseException(e.getMessage(), lineNumber, key, e);
        }
    }

    private static final String RIGID_GROUP_PREFIX = "rigid_group_";
    private static final String RIGID_GROUP_COLLECTION_PREFIX = "rigid_group_collection_";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Logger LOG = LoggerFactory.getLogger(GeometryParser.class);
}
