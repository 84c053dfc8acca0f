/*
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.detector;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places raw detector data onto the visualization canvas of a {@link PixelMap}.
 *
 * <p>Raw pixels are visited in row-major order.  When several raw pixels land in the same canvas cell,
 * the configured {@link CollisionPolicy} decides which value is kept; collisions are not errors.
 * Cells that receive no data hold the configured fill value and stay unmasked.</p>
 *
 * <p>Assembly keeps no state between calls, so frames sharing one pixel map can be
 * assembled concurrently.</p>
 */
public class FrameAssembler {

    private final AssemblyParameters parameters;

    public FrameAssembler() {
        this(new AssemblyParameters());
    }

    public FrameAssembler(final AssemblyParameters parameters)
            throws IllegalArgumentException {
        parameters.validate();
        this.parameters = parameters;
    }

    public AssemblyParameters getParameters() {
        return parameters;
    }

    /**
     * @param  pixelMap  coordinates for the geometry that produced the raw data.
     * @param  rawData   raw frame with one column per fast-scan pixel and one row per slow-scan pixel.
     *
     * @return canvas sized frame of the same type as the raw data, plus its validity mask.
     *
     * @throws ShapeMismatchException
     *   if the raw data shape differs from the pixel map shape.
     *
     * @throws IllegalArgumentException
     *   if the fill value cannot be stored in the raw data type.
     */
    public AssembledFrame assemble(final PixelMap pixelMap,
                                   final ImageProcessor rawData)
            throws ShapeMismatchException {

        if ((rawData.getWidth() != pixelMap.getColumns()) || (rawData.getHeight() != pixelMap.getRows())) {
            throw new ShapeMismatchException(pixelMap.getColumns(), pixelMap.getRows(),
                                             rawData.getWidth(), rawData.getHeight());
        }

        final double fillValue = parameters.getFillValue();
        validateFillValue(fillValue, rawData);

        final CanvasGrid canvas = pixelMap.getCanvas();
        final ImageProcessor frame = rawData.createProcessor(canvas.getWidth(), canvas.getHeight());
        final ByteProcessor mask = new ByteProcessor(canvas.getWidth(), canvas.getHeight());

        final boolean isFloat = rawData instanceof FloatProcessor;
        final int cellCount = canvas.getWidth() * canvas.getHeight();

        if (fillValue != 0.0) {
            for (int cell = 0; cell < cellCount; cell++) {
                if (isFloat) {
                    frame.setf(cell, (float) fillValue);
                } else {
                    frame.set(cell, (int) fillValue);
                }
            }
        }

        final boolean keepFirst = parameters.getCollisionPolicy() == CollisionPolicy.FIRST_WRITE_WINS;
        final int pixelCount = pixelMap.getPixelCount();

        for (int i = 0; i < pixelCount; i++) {

            final int cell = pixelMap.getCellIndexAtOffset(i);
            if (cell < 0) {
                continue;
            }
            if (keepFirst && (mask.get(cell) != 0)) {
                continue;
            }

            if (isFloat) {
                frame.setf(cell, rawData.getf(i));
            } else {
                frame.set(cell, rawData.get(i));
            }
            mask.set(cell, AssembledFrame.VALID_MASK_VALUE);
        }

        LOG.debug("assemble: exit, assembled {}x{} frame", canvas.getWidth(), canvas.getHeight());

        return new AssembledFrame(frame, mask, canvas);
    }

    /**
     * Assembles several raw frames that share the same pixel map.
     *
     * @param  pixelMap         coordinates for the geometry that produced the raw data.
     * @param  rawDataList      raw frames to assemble.
     * @param  numberOfThreads  number of frames to assemble concurrently.
     *
     * @return assembled frames in the same order as the raw frames.
     *
     * @throws ShapeMismatchException
     *   if any raw data shape differs from the pixel map shape.
     */
    public List<AssembledFrame> assembleAll(final PixelMap pixelMap,
                                            final List<ImageProcessor> rawDataList,
                                            final int numberOfThreads)
            throws IllegalArgumentException {

        LOG.info("assembleAll: entry, {} frames, numberOfThreads={}", rawDataList.size(), numberOfThreads);

        final List<AssembledFrame> frames = new ArrayList<>(rawDataList.size());

        if (numberOfThreads < 2) {

            for (final ImageProcessor rawData : rawDataList) {
                frames.add(assemble(pixelMap, rawData));
            }

        } else {

            final ExecutorService executorService = Executors.newFixedThreadPool(numberOfThreads);
            try {
                final List<Future<AssembledFrame>> futures = new ArrayList<>(rawDataList.size());
                for (final ImageProcessor rawData : rawDataList) {
                    futures.add(executorService.submit(() -> assemble(pixelMap, rawData)));
                }
                for (final Future<AssembledFrame> future : futures) {
                    frames.add(future.get());
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while assembling frames", e);
            } catch (final ExecutionException e) {
                final Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("failed to assemble frame", cause);
            } finally {
                executorService.shutdownNow();
            }

        }

        LOG.info("assembleAll: exit, assembled {} frames", frames.size());

        return frames;
    }

    /**
     * @throws IllegalArgumentException
     *   if the fill value is not exactly representable by the raw data processor type.
     */
    static void validateFillValue(final double fillValue,
                                  final ImageProcessor rawData)
            throws IllegalArgumentException {

        final boolean representable;
        if (rawData instanceof FloatProcessor) {
            representable = Double.isNaN(fillValue) || (Math.abs(fillValue) <= Float.MAX_VALUE);
        } else {
            final double maxValue;
            if (rawData instanceof ByteProcessor) {
                maxValue = 255;
            } else if (rawData instanceof ShortProcessor) {
                maxValue = 65535;
            } else if (rawData instanceof ColorProcessor) {
                maxValue = 0xffffff;
            } else {
                throw new IllegalArgumentException("unsupported raw data type " + rawData.getClass().getSimpleName());
            }
            representable = (fillValue >= 0) && (fillValue <= maxValue) && (fillValue == Math.rint(fillValue));
        }

        if (! representable) {
            throw new IllegalArgumentException("fill value " + fillValue + " cannot be stored in " +
                                               rawData.getBitDepth() + "-bit raw data");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameAssembler.class);
}
