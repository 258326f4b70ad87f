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

package net.algart.matrices.nitf.remap;

import net.algart.matrices.nitf.CalibrationDegenerateException;
import net.algart.matrices.nitf.NitfException;
import net.algart.matrices.nitf.NitfTools;
import net.algart.matrices.nitf.raster.RgbaRaster;
import net.algart.matrices.nitf.segments.RawPlane;

import java.util.Objects;

/**
 * Density remap: compression of wide-dynamic-range amplitudes of complex (SAR) samples
 * into 8-bit display intensities.
 */
public final class DensityRemap {
    private static final System.Logger LOG = System.getLogger(DensityRemap.class.getName());

    public static final double HALF_DENSITY = 127.0;

    private DensityRemap() {
    }

    /**
     * Calibrates the remap by the mean amplitude of all <code>rows*columns</code> complex samples
     * of the plane.
     *
     * <p>Note: non-finite amplitudes are excluded from the sum, but the sum is divided by the total
     * number of samples <code>rows*columns</code>, including non-finite ones.</p>
     *
     * @param plane   raw plane with complex samples, row by row.
     * @param rows    number of rows.
     * @param columns number of columns.
     * @return new calibration.
     * @throws NitfException if the plane is too short or the mean amplitude is not positive.
     */
    public static RemapCalibration calibrate(RawPlane plane, int rows, int columns) throws NitfException {
        return calibrate(plane, rows, columns, -1);
    }

    public static RemapCalibration calibrate(RawPlane plane, int rows, int columns, int segmentIndex)
            throws NitfException {
        Objects.requireNonNull(plane, "Null plane");
        final double sum = sumOfFiniteAmplitudes(plane, rows, columns, segmentIndex);
        final long count = (long) rows * (long) columns;
        final double mean = count == 0 ? Double.NaN : sum / count;
        LOG.log(System.Logger.Level.DEBUG, () -> "Mean amplitude of " + columns + "x" + rows +
                " complex samples: " + mean);
        try {
            return RemapCalibration.ofMeanAmplitude(mean);
        } catch (CalibrationDegenerateException e) {
            if (segmentIndex >= 0) {
                throw new CalibrationDegenerateException(segmentIndex, mean);
            }
            throw e;
        }
    }

    /**
     * Returns the sum of all finite amplitudes in the first <code>rows*columns</code> complex samples.
     * Rows are summed in parallel, but the row sums are added sequentially, so the result
     * does not depend on the number of threads.
     *
     * @param plane        raw plane with complex samples.
     * @param rows         number of rows.
     * @param columns      number of columns.
     * @param segmentIndex index of the segment for error messages, or -1.
     * @return sum of finite amplitudes.
     * @throws NitfException if the plane is too short.
     */
    public static double sumOfFiniteAmplitudes(RawPlane plane, int rows, int columns, int segmentIndex)
            throws NitfException {
        Objects.requireNonNull(plane, "Null plane");
        checkSizes(plane, rows, columns, segmentIndex);
        final double[] rowSums = new double[rows];
        NitfTools.indexes(rows).forEach(y -> {
            double sum = 0.0;
            for (int x = 0, i = y * columns; x < columns; x++, i++) {
                final float amplitude = ComplexSamples.amplitude(plane, i);
                if (Float.isFinite(amplitude)) {
                    sum += amplitude;
                }
            }
            rowSums[y] = sum;
        });
        double result = 0.0;
        for (double rowSum : rowSums) {
            result += rowSum;
        }
        return result;
    }

    /**
     * Remaps one complex sample into 0..255 intensity:
     * <code>density = slope * max(amplitude, eps) + constant</code>;
     * if <code>density &le; 127</code>, the result is <code>density</code>,
     * else <code>0.5 * (density + 127)</code>; then the result is clamped to 0..255 and truncated.
     * NaN amplitude is processed as <code>eps</code>.
     *
     * @param calibration remap parameters.
     * @param re          real part.
     * @param im          imaginary part.
     * @return intensity 0..255.
     */
    public static int apply(RemapCalibration calibration, float re, float im) {
        return applyToAmplitude(calibration, ComplexSamples.amplitude(re, im));
    }

    public static int apply(RemapCalibration calibration, RawPlane plane, int sampleIndex) {
        return applyToAmplitude(calibration, ComplexSamples.amplitude(plane, sampleIndex));
    }

    public static int applyToAmplitude(RemapCalibration calibration, float amplitude) {
        Objects.requireNonNull(calibration, "Null calibration");
        final double eps = calibration.eps();
        final double a = amplitude >= eps ? amplitude : eps;
        // - NaN is also replaced with eps
        final double density = calibration.slope() * a + calibration.constant();
        final double result = density <= HALF_DENSITY ? density : 0.5 * (density + HALF_DENSITY);
        return NitfTools.clampToUnsignedByte(result);
    }

    /**
     * Remaps all <code>rows*columns</code> samples of the plane into an opaque gray raster
     * <code>columns x rows</code> at full resolution.
     *
     * @param calibration remap parameters.
     * @param plane       raw plane with complex samples.
     * @param rows        number of rows.
     * @param columns     number of columns.
     * @return gray raster.
     * @throws NitfException if the plane is too short.
     */
    public static RgbaRaster render(RemapCalibration calibration, RawPlane plane, int rows, int columns)
            throws NitfException {
        Objects.requireNonNull(calibration, "Null calibration");
        Objects.requireNonNull(plane, "Null plane");
        checkSizes(plane, rows, columns, -1);
        final byte[] gray = new byte[rows * columns];
        NitfTools.indexes(rows).forEach(y -> {
            for (int x = 0, i = y * columns; x < columns; x++, i++) {
                gray[i] = (byte) apply(calibration, plane, i);
            }
        });
        return RgbaRaster.ofGray(columns, rows, gray);
    }

    static void checkSizes(RawPlane plane, int rows, int columns, int segmentIndex) throws NitfException {
        if (rows < 0) {
            throw new IllegalArgumentException("Negative number of rows = " + rows);
        }
        if (columns < 0) {
            throw new IllegalArgumentException("Negative number of columns = " + columns);
        }
        final long required = (long) rows * (long) columns * ComplexSamples.BYTES_PER_SAMPLE;
        if (plane.length() < required) {
            throw segmentIndex >= 0 ?
                    new NitfException(segmentIndex, tooShortMessage(plane, rows, columns, required)) :
                    new NitfException(tooShortMessage(plane, rows, columns, required));
        }
    }

    private static String tooShortMessage(RawPlane plane, int rows, int columns, long required) {
        return "too short complex data: " + plane.length() + " bytes instead of " + required +
                " bytes, required for " + columns + "x" + rows + " complex samples";
    }
}
