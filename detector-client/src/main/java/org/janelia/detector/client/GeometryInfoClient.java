package org.janelia.detector.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.janelia.detector.AssemblyParameters;
import org.janelia.detector.PixelMap;
import org.janelia.detector.PixelMapBuilder;
import org.janelia.detector.client.parameter.CommandLineParameters;
import org.janelia.detector.client.parameter.GeometryParameters;
import org.janelia.detector.json.JsonUtils;
import org.janelia.detector.spec.DetectorGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client that parses a geometry file, builds its pixel map, and reports a JSON summary
 * (panels, physical bounds, canvas size, innermost and outermost pixels).
 */
public class GeometryInfoClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public GeometryParameters geometry = new GeometryParameters();

        @ParametersDelegate
        public AssemblyParameters assembly = new AssemblyParameters();

        @Parameter(
                names = "--json",
                description = "File for the JSON summary (omit to log the summary)")
        public String jsonPath;

        @Override
        public String getToolDescription() {
            return "Parses a detector geometry file and summarizes its panels, bounds and canvas.";
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final GeometryInfoClient client = new GeometryInfoClient(parameters);
                client.writeSummary();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public GeometryInfoClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public GeometrySummary buildSummary()
            throws IllegalArgumentException {
        final DetectorGeometry geometry = parameters.geometry.loadGeometry();
        final PixelMap pixelMap = new PixelMapBuilder(parameters.assembly).build(geometry);
        return new GeometrySummary(geometry, pixelMap);
    }

    public void writeSummary()
            throws IllegalArgumentException, IOException {

        final String json = JsonUtils.MAPPER.writeValueAsString(buildSummary());

        if (parameters.jsonPath == null) {
            LOG.info("writeSummary: summary is\n{}", json);
        } else {
            final Path path = Paths.get(parameters.jsonPath).toAbsolutePath();
            Files.write(path, json.getBytes(StandardCharsets.UTF_8));
            LOG.info("writeSummary: saved {}", path);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(GeometryInfoClient.class);
}
