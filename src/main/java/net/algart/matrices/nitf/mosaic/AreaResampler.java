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

package net.algart.matrices.nitf.mosaic;

import net.algart.matrices.nitf.NitfTools;
import net.algart.matrices.nitf.raster.RgbaRaster;
import net.algart.matrices.nitf.remap.RemapCalibration;

import java.util.Locale;
import java.util.Objects;

/**
 * Down-sampling of a complex {@link MosaicIndex} into a gray thumbnail.
 * Every sample is remapped into 0..255 intensity <b>before</b> averaging.
 *
 * <p>The resulting pixel <code>(x, y)</code> covers the source rectangle
 * <code>[x*ratioX, (x+1)*ratioX) x [y*ratioY, (y+1)*ratioY)</code>. The integer bounds
 * <code>left..right</code>, <code>bottom..top</code> are the ceilings of the rectangle sides, clamped into
 * the source. If the rectangle contains whole source rows and columns, the result is their average;
 * if only rows (columns) are present, the result is a linear interpolation between two neighbouring columns
 * (rows), averaged along the other axis; if the rectangle lies inside a single source pixel,
 * the result is the bilinear interpolation of 4 neighbours. Neighbour indexes are clamped into the source.</p>
 */
public final class AreaResampler {
    private static final System.Logger LOG = System.getLogger(AreaResampler.class.getName());

    private AreaResampler() {
    }

    public static RgbaRaster resample(MosaicIndex mosaic, RemapCalibration calibration, int sizeX, int sizeY) {
        Objects.requireNonNull(mosaic, "Null mosaic");
        Objects.requireNonNull(calibration, "Null calibration");
        if (sizeX <= 0 || sizeY <= 0) {
            throw new IllegalArgumentException("Zero or negative result sizes " + sizeX + "x" + sizeY);
        }
        final int rows = mosaic.totalRows();
        final int columns = mosaic.columns();
        if (rows == 0) {
            throw new IllegalArgumentException("Cannot resample empty mosaic " + mosaic);
        }
        final long t1 = NitfTools.debugTime();
        final double ratioX = (double) columns / (double) sizeX;
        final double ratioY = (double) rows / (double) sizeY;
        final byte[] gray = new byte[sizeX * sizeY];
        NitfTools.indexes(sizeY).forEach(y -> {
            final double bottomF = y * ratioY;
            final double topF = bottomF + ratioY;
            final int bottom = clamp((int) Math.ceil(bottomF), 0, rows - 1);
            final int top = clamp((int) Math.ceil(topF), bottom, rows);
            final double fractionY = 0.5 * (fraction(bottomF) + fraction(topF));
            final int nextRow = Math.min(bottom + 1, rows - 1);
            for (int x = 0, disp = y * sizeX; x < sizeX; x++, disp++) {
                final double leftF = x * ratioX;
                final double rightF = leftF + ratioX;
                final int left = clamp((int) Math.ceil(leftF), 0, columns - 1);
                final int right = clamp((int) Math.ceil(rightF), left, columns);
                final double fractionX = 0.5 * (fraction(leftF) + fraction(rightF));
                final int nextColumn = Math.min(left + 1, columns - 1);
                final double value;
                if (bottom != top && left != right) {
                    long sum = 0;
                    for (int row = bottom; row < top; row++) {
                        for (int column = left; column < right; column++) {
                            sum += mosaic.remap(calibration, row, column);
                        }
                    }
                    value = (double) sum / ((long) (top - bottom) * (long) (right - left));
                } else if (bottom != top) {
                    long sumLeft = 0;
                    long sumRight = 0;
                    for (int row = bottom; row < top; row++) {
                        sumLeft += mosaic.remap(calibration, row, left);
                        sumRight += mosaic.remap(calibration, row, nextColumn);
                    }
                    final int n = top - bottom;
                    value = interpolate((double) sumLeft / n, (double) sumRight / n, fractionX);
                } else if (left != right) {
                    long sumBottom = 0;
                    long sumTop = 0;
                    for (int column = left; column < right; column++) {
                        sumBottom += mosaic.remap(calibration, bottom, column);
                        sumTop += mosaic.remap(calibration, nextRow, column);
                    }
                    final int n = right - left;
                    value = interpolate((double) sumBottom / n, (double) sumTop / n, fractionY);
                } else {
                    final int v00 = mosaic.remap(calibration, bottom, left);
                    final int v01 = mosaic.remap(calibration, bottom, nextColumn);
                    final int v10 = mosaic.remap(calibration, nextRow, left);
                    final int v11 = mosaic.remap(calibration, nextRow, nextColumn);
                    value = interpolate(
                            interpolate(v00, v01, fractionX),
                            interpolate(v10, v11, fractionX),
                            fractionY);
                }
                gray[disp] = (byte) NitfTools.clampToUnsignedByte(value);
            }
        });
        if (NitfTools.BUILT_IN_TIMING) {
            final long t2 = NitfTools.debugTime();
            LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                    "%s resampled %s to %dx%d in %.3f ms",
                    AreaResampler.class.getSimpleName(), mosaic, sizeX, sizeY, (t2 - t1) * 1e-6));
        }
        return RgbaRaster.ofGray(sizeX, sizeY, gray);
    }

    private static double interpolate(double a, double b, double fraction) {
        return a + fraction * (b - a);
    }

    private static double fraction(double value) {
        return value - Math.floor(value);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }
}
