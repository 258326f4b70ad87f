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

import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.matrices.nitf.NitfTools;

import java.util.Locale;
import java.util.Objects;

/**
 * Resizing of {@link RgbaRaster} by averaging: when compressing, every resulting pixel is the average
 * of the source pixels, covered by its rectangle (see {@link Matrices.ResizingMethod#AVERAGING}).
 * All 4 channels, including alpha, are averaged independently.
 */
public final class AreaAveragingScaler {
    private static final System.Logger LOG = System.getLogger(AreaAveragingScaler.class.getName());

    private AreaAveragingScaler() {
    }

    public static RgbaRaster resize(RgbaRaster source, int newSizeX, int newSizeY) {
        Objects.requireNonNull(source, "Null source raster");
        if (newSizeX <= 0 || newSizeY <= 0) {
            throw new IllegalArgumentException("Zero or negative new sizes " + newSizeX + "x" + newSizeY);
        }
        if (source.sizeX() == 0 || source.sizeY() == 0) {
            throw new IllegalArgumentException("Cannot resize empty raster " + source);
        }
        final long t1 = NitfTools.debugTime();
        final Matrix<? extends PArray> resized = Matrices.asResized(
                Matrices.ResizingMethod.AVERAGING,
                source.asMatrix(),
                RgbaRaster.NUMBER_OF_CHANNELS, newSizeX, newSizeY).clone();
        final RgbaRaster result = RgbaRaster.newRaster(newSizeX, newSizeY);
        resized.array().getData(0, result.data());
        if (NitfTools.BUILT_IN_TIMING) {
            final long t2 = NitfTools.debugTime();
            LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                    "%s resized %dx%d to %dx%d in %.3f ms",
                    AreaAveragingScaler.class.getSimpleName(),
                    source.sizeX(), source.sizeY(), newSizeX, newSizeY, (t2 - t1) * 1e-6));
        }
        return result;
    }

    /**
     * Makes a thumbnail, containing approximately <code>size<sup>2</sup></code> pixels
     * and preserving the proportions <code>aspect = width / height</code> (see {@link ThumbnailSize}).
     *
     * @param source source raster.
     * @param aspect required aspect ratio (usually the ratio of the significant image sizes).
     * @param size   thumbnail size.
     * @return the thumbnail.
     */
    public static RgbaRaster thumbnail(RgbaRaster source, double aspect, int size) {
        final ThumbnailSize thumbnailSize = ThumbnailSize.of(aspect, size);
        return resize(source, thumbnailSize.sizeX(), thumbnailSize.sizeY());
    }
}
