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

import java.util.Objects;

/**
 * Simple point-wise corrections of {@link RgbaRaster}. The alpha channel is never changed.
 */
public final class RasterAdjustments {
    private RasterAdjustments() {
    }

    /**
     * Adds the given value to R, G, B components of every pixel; the results are clamped to 0..255.
     *
     * @param raster raster to correct (in place).
     * @param value  additive brightness correction, can be negative.
     * @return the same raster.
     */
    public static RgbaRaster brighten(RgbaRaster raster, int value) {
        Objects.requireNonNull(raster, "Null raster");
        if (value == 0) {
            return raster;
        }
        final byte[] data = raster.data();
        final int sizeX = raster.sizeX();
        NitfTools.indexes(raster.sizeY()).forEach(y -> {
            final int from = y * sizeX * RgbaRaster.NUMBER_OF_CHANNELS;
            final int to = from + sizeX * RgbaRaster.NUMBER_OF_CHANNELS;
            for (int disp = from; disp < to; disp += RgbaRaster.NUMBER_OF_CHANNELS) {
                for (int c = 0; c < 3; c++) {
                    data[disp + c] = (byte) NitfTools.clampToUnsignedByte((data[disp + c] & 0xFF) + value);
                }
            }
        });
        return raster;
    }

    /**
     * Changes the contrast of R, G, B components: every component <i>v</i> is replaced with
     * <code>((v/255 &minus; 0.5) * f + 0.5) * 255</code>, clamped to 0..255 and truncated,
     * where <code>f = ((100 + contrast) / 100)<sup>2</sup></code>.
     * Positive values increase the contrast, negative decrease it.
     *
     * @param raster   raster to correct (in place).
     * @param contrast contrast correction in percents.
     * @return the same raster.
     */
    public static RgbaRaster contrast(RgbaRaster raster, float contrast) {
        Objects.requireNonNull(raster, "Null raster");
        if (Float.isNaN(contrast)) {
            throw new IllegalArgumentException("Contrast is NaN");
        }
        if (contrast == 0.0f) {
            return raster;
        }
        final float factor = contrastFactor(contrast);
        final byte[] table = new byte[256];
        for (int v = 0; v < 256; v++) {
            final float d = ((v / 255.0f - 0.5f) * factor + 0.5f) * 255.0f;
            table[v] = (byte) NitfTools.clampToUnsignedByte(d);
        }
        final byte[] data = raster.data();
        final int sizeX = raster.sizeX();
        NitfTools.indexes(raster.sizeY()).forEach(y -> {
            final int from = y * sizeX * RgbaRaster.NUMBER_OF_CHANNELS;
            final int to = from + sizeX * RgbaRaster.NUMBER_OF_CHANNELS;
            for (int disp = from; disp < to; disp += RgbaRaster.NUMBER_OF_CHANNELS) {
                for (int c = 0; c < 3; c++) {
                    data[disp + c] = table[data[disp + c] & 0xFF];
                }
            }
        });
        return raster;
    }

    static float contrastFactor(float contrast) {
        final float f = (100.0f + contrast) / 100.0f;
        return f * f;
    }
}
