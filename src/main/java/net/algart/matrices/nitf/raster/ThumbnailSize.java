/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2025 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.matrices.nitf.raster;

import net.algart.matrices.nitf.NitfTools;

/**
 * Sizes of a thumbnail with the given aspect ratio, containing approximately
 * <code>size<sup>2</sup></code> pixels:
 * <code>width = &lfloor;sqrt(aspect*size<sup>2</sup>)&rfloor;</code>,
 * <code>height = &lfloor;size<sup>2</sup>/width&rfloor;</code> (both at least 1).
 */
public final class ThumbnailSize {
    private final int sizeX;
    private final int sizeY;

    private ThumbnailSize(int sizeX, int sizeY) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
    }

    public static ThumbnailSize of(double aspect, int size) {
        if (!(aspect > 0.0) || Double.isInfinite(aspect)) {
            throw new IllegalArgumentException("Aspect ratio must be a positive finite number, but it is " +
                    aspect);
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Zero or negative thumbnail size = " + size);
        }
        if (size > NitfTools.MAX_THUMBNAIL_SIZE) {
            throw new IllegalArgumentException("Too large thumbnail size = " + size +
                    " > " + NitfTools.MAX_THUMBNAIL_SIZE);
        }
        final double area = (double) size * (double) size;
        final double maxSide = (double) NitfTools.MAX_THUMBNAIL_SIZE * NitfTools.MAX_THUMBNAIL_SIZE;
        // - extremely elongated images: the result must be less than 2^31 pixels
        final int sizeX = (int) Math.max(1.0, Math.min(maxSide, Math.sqrt(aspect * area)));
        final int sizeY = (int) Math.max(1.0, Math.min(maxSide, area / sizeX));
        return new ThumbnailSize(sizeX, sizeY);
    }

    public int sizeX() {
        return sizeX;
    }

    public int sizeY() {
        return sizeY;
    }

    @Override
    public String toString() {
        return sizeX + "x" + sizeY;
    }
}
