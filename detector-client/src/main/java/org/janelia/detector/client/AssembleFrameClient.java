package org.janelia.detector.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.ImageProcessor;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.janelia.detector.AssembledFrame;
import org.janelia.detector.AssemblyParameters;
import org.janelia.detector.FrameAssembler;
import org.janelia.detector.PixelMap;
import org.janelia.detector.PixelMapBuilder;
import org.janelia.detector.client.parameter.CommandLineParameters;
import org.janelia.detector.client.parameter.GeometryParameters;
import org.janelia.detector.spec.DetectorGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client that assembles raw detector frames (single image TIFF files, one column per
 * fast-scan pixel) into visualization frames.  For each input {@code name.tif} the client
 * writes {@code name.assembled.tif} and {@code name.mask.tif} to the output directory.
 * The pixel map is built once and shared by all frames.
 */
public class AssembleFrameClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public GeometryParameters geometry = new GeometryParameters();

        @ParametersDelegate
        public AssemblyParameters assembly = new AssemblyParameters();

        @Parameter(
                names = "--data",
                description = "Raw data TIFF file(s) to assemble",
                variableArity = true,
                required = true)
        public List<String> dataPaths;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for assembled frames and masks",
                required = true)
        public String outputDirectory;

        @Parameter(
                names = "--numberOfThreads",
                description = "Number of frames to assemble concurrently")
        public int numberOfThreads = 1;

        @Override
        public String getToolDescription() {
            return "Assembles raw detector TIFF frames into visualization frames and validity masks.";
        }

        public void validateInputAndOutput() throws IllegalArgumentException {

            for (final String dataPath : dataPaths) {
                final File file = new File(dataPath).getAbsoluteFile();
                if (! file.canRead()) {
                    throw new IllegalArgumentException("--data " + file.getAbsolutePath() + " must be readable");
                }
            }

            final File directory = new File(outputDirectory).getAbsoluteFile();
            if (! directory.exists()) {
                if (! directory.mkdirs()) {
                    throw new IllegalArgumentException("failed to create outputDirectory " +
                                                       directory.getAbsolutePath());
                }
            } else if (! directory.isDirectory() || ! directory.canWrite()) {
                throw new IllegalArgumentException("--outputDirectory " + directory.getAbsolutePath() +
                                                   " must be a writable directory");
            }
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);
                parameters.validateInputAndOutput();

                LOG.info("runClient: entry, parameters={}", parameters);

                final AssembleFrameClient client = new AssembleFrameClient(parameters);
                client.assembleAndSave();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public AssembleFrameClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @return the files written (assembled frame and mask for each input, in input order).
     *
     * @throws IllegalArgumentException
     *   if the geometry or any raw data file cannot be loaded, or if raw data does not match the geometry.
     */
    public List<File> assembleAndSave()
            throws IllegalArgumentException {

        final DetectorGeometry geometry = parameters.geometry.loadGeometry();
        final PixelMap pixelMap = new PixelMapBuilder(parameters.assembly).build(geometry);
        final FrameAssembler assembler = new FrameAssembler(parameters.assembly);

        final List<ImageProcessor> rawDataList = new ArrayList<>(parameters.dataPaths.size());
        for (final String dataPath : parameters.dataPaths) {
            rawDataList.add(openRawData(dataPath));
        }

        final List<AssembledFrame> frames = assembler.assembleAll(pixelMap, rawDataList, parameters.numberOfThreads);

        final File outputDirectory = new File(parameters.outputDirectory).getAbsoluteFile();
        final List<File> savedFiles = new ArrayList<>(frames.size() * 2);
        for (int i = 0; i < frames.size(); i++) {
            final String baseName = getBaseName(parameters.dataPaths.get(i));
            final AssembledFrame frame = frames.get(i);
            savedFiles.add(saveTiff(frame.toFrameImagePlus(baseName),
                                    new File(outputDirectory, baseName + ".assembled.tif")));
            savedFiles.add(saveTiff(frame.toMaskImagePlus(baseName + " mask"),
                                    new File(outputDirectory, baseName + ".mask.tif")));
        }

        return savedFiles;
    }

    static String getBaseName(final String path) {
        final String name = new File(path).getName();
        final int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(0, dotIndex) : name;
    }

    private static ImageProcessor openRawData(final String dataPath)
            throws IllegalArgumentException {
        final File file = new File(dataPath).getAbsoluteFile();
        final ImagePlus imagePlus = new Opener().openImage(file.getAbsolutePath());
        if (imagePlus == null) {
            throw new IllegalArgumentException("failed to open raw data " + file.getAbsolutePath());
        }
        if (imagePlus.getStackSize() > 1) {
            LOG.warn("openRawData: only the first of {} slices in {} will be assembled",
                     imagePlus.getStackSize(), file.getAbsolutePath());
        }
        LOG.info("openRawData: loaded {}x{} {}-bit data from {}",
                 imagePlus.getWidth(), imagePlus.getHeight(), imagePlus.getBitDepth(), file.getAbsolutePath());
        return imagePlus.getProcessor();
    }

    private static File saveTiff(final ImagePlus imagePlus,
                                 final File file)
            throws IllegalArgumentException {
        if (! new FileSaver(imagePlus).saveAsTiff(file.getAbsolutePath())) {
            throw new IllegalArgumentException("failed to save " + file.getAbsolutePath());
        }
        LOG.info("saveTiff: saved {}", file.getAbsolutePath());
        return file;
    }

    private static final Logger LOG = LoggerFactory.getLogger(AssembleFrameClient.class);
}
