package org.janelia.detector.client;

import org.janelia.detector.ShapeMismatchException;
import org.janelia.detector.geom.GeometryParseException;
import org.janelia.detector.spec.DegeneratePanelException;
import org.janelia.detector.spec.InconsistentGeometryException;
import org.janelia.detector.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a detector command line client so that every run ends with an exit log message
 * and an exit status that tells scripts why processing stopped.
 *
 * <p>Geometry problems and raw data that does not fit the geometry are reported with their
 * own status and a one line message; anything else is logged with its stack trace.</p>
 */
public abstract class ClientRunner {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INVALID_GEOMETRY = 2;
    public static final int EXIT_SHAPE_MISMATCH = 3;

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the client and exits the JVM with the resulting status.
     */
    public void run() {
        System.exit(runAndGetExitStatus());
    }

    /**
     * Runs the client with consistent log statements.
     * Absence of the standard exit log message indicates that the client was terminated abnormally.
     *
     * @return exit status for the run.
     */
    public int runAndGetExitStatus() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int exitStatus;
        try {
            runClient(args);
            exitStatus = EXIT_SUCCESS;
        } catch (final GeometryParseException e) {
            LOG.error("run: geometry could not be parsed (line {}, key '{}'): {}",
                      e.getLineNumber(), e.getKey(), e.getMessage());
            exitStatus = EXIT_INVALID_GEOMETRY;
        } catch (final DegeneratePanelException e) {
            LOG.error("run: panel {} cannot be mapped: {}", e.getPanelName(), e.getMessage());
            exitStatus = EXIT_INVALID_GEOMETRY;
        } catch (final InconsistentGeometryException e) {
            LOG.error("run: geometry is inconsistent: {}", e.getMessage());
            exitStatus = EXIT_INVALID_GEOMETRY;
        } catch (final ShapeMismatchException e) {
            LOG.error("run: raw data does not match geometry: {}", e.getMessage());
            exitStatus = EXIT_SHAPE_MISMATCH;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            exitStatus = EXIT_FAILURE;
        }

        if (exitStatus == EXIT_SUCCESS) {
            LOG.info("run: exit, processing completed in {}", processTimer);
        } else {
            LOG.info("run: exit, processing failed with status {} after {}", exitStatus, processTimer);
        }

        return exitStatus;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
