package org.janelia.detector.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.detector.json.JsonUtils;

/**
 * Base parameters for the detector command line tools.
 *
 * <p>Subclasses describe what their tool does through {@link #getToolDescription()};
 * the description is printed above the option list whenever usage is shown.</p>
 */
public abstract class CommandLineParameters implements Serializable {

    public static final String STANDALONE_JAR = "detector-client-standalone.jar";

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    private transient JCommander jCommander;

    public CommandLineParameters() {
        this.help = false;
        this.jCommander = null;
    }

    /**
     * @return one line summary of the tool these parameters drive.
     */
    public abstract String getToolDescription();

    /**
     * Parses the arguments for the tool that encloses this parameters class,
     * exiting after usage is shown.
     */
    public void parse(final String[] args) throws IllegalArgumentException {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * @return true if the arguments were parsed and no help was requested.
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass,
                         final boolean exitOnHelpOrFailure) throws IllegalArgumentException {

        jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp " + STANDALONE_JAR + " " + programClass.getName());

        String failureMessage = null;
        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            failureMessage = pe.getMessage();
        }

        final boolean parsed = (failureMessage == null) && (! help);

        if (! parsed) {
            jCommander.getConsole().println("\n" + getToolDescription() + "\n");
            if (failureMessage != null) {
                jCommander.getConsole().println("ERROR: failed to parse command line arguments\n\n" +
                                                failureMessage + "\n");
            }
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            }
        }

        return parsed;
    }

    /**
     * @return string representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

}
