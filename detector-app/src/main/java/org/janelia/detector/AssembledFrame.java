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

import ij.ImagePlus;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

/**
 * Canvas sized visualization of one raw data frame together with its validity mask.
 *
 * <p>The frame processor has the same type as the raw data it was assembled from.
 * Mask cells are 255 where detector data was written and 0 for gaps.
 * Both processors belong to this frame and should be treated as read-only by callers.</p>
 */
public class AssembledFrame {

    public static final int VALID_MASK_VALUE = 255;

    private final ImageProcessor frame;
    private final ByteProcessor mask;
    private final CanvasGrid canvas;

    AssembledFrame(final ImageProcessor frame,
                   final ByteProcessor mask,
                   final CanvasGrid canvas) {
        this.frame = frame;
        this.mask = mask;
        this.canvas = canvas;
    }

    public ImageProcessor getFrame() {
        return frame;
    }

    public ByteProcessor getMask() {
        return mask;
    }

    public CanvasGrid getCanvas() {
        return canvas;
    }

    public int getWidth() {
        return frame.getWidth();
    }

    public int getHeight() {
        return frame.getHeight();
    }

    public boolean isValid(final int x,
                           final int y) {
        return mask.get(x, y) != 0;
    }

    public int getValidCellCount() {
        final byte[] pixels = (byte[]) mask.getPixels();
        int count = 0;
        for (final byte b : pixels) {
            if (b != 0) {
                count++;
            }
        }
        return count;
    }

    public ImagePlus toFrameImagePlus(final String title) {
        return new ImagePlus(title, frame);
    }

    public ImagePlus toMaskImagePlus(final String title) {
        return new ImagePlus(title, mask);
    }

    @Override
    public String toString() {
        return "{width=" + getWidth() + ", height=" + getHeight() + ", bitDepth=" + frame.getBitDepth() + '}';
    }
}
