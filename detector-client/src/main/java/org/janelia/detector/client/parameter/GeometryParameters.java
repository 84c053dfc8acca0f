package org.janelia.detector.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.janelia.detector.geom.GeometryParser;
import org.janelia.detector.spec.DetectorGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parameters for locating a geometry file.
 */
public class GeometryParameters implements Serializable {

    @Parameter(
            names = "--geometry",
            description = "Path of the geometry (.geom) file",
            required = true)
    public String geometryPath;

    public GeometryParameters() {
    }

    /**
     * @return geometry parsed from the configured file.
     *
     * @throws IllegalArgumentException
     *   if the file cannot be read or does not contain a valid geometry.
     */
    public DetectorGeometry loadGeometry()
            throws IllegalArgumentException {

        final Path path = Paths.get(geometryPath).toAbsolutePath();

        LOG.info("loadGeometry: loading {}", path);

        final String text;
        try {
            text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new IllegalArgumentException("failed to read geometry file " + path, e);
        }

        return GeometryParser.parse(text);
    }

    private static final Logger LOG = LoggerFactory.getLogger(GeometryParameters.class);
}
