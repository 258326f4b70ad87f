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

/**
 * Parameters of the logarithmic density remap of amplitudes: <code>eps</code>, <code>slope</code>
 * and <code>constant</code>, derived from the mean amplitude of the data.
 * The remapped density is <code>slope * max(amplitude, eps) + constant</code>
 * (see {@link DensityRemap#apply(RemapCalibration, float, float)}); note that the logarithm participates
 * only in the calculation of the slope and the constant.
 *
 * <p>This object is immutable and can be shared between threads.</p>
 */
public final class RemapCalibration {
    public static final double EPS = 1e-5;
    public static final double DENSITY_MIN = 30.0;
    public static final double DENSITY_MAX = 255.0;
    public static final double HIGH_MULTIPLIER = 40.0;
    public static final double LOW_MULTIPLIER = 0.8;

    private final double meanAmplitude;
    private final double eps;
    private final double slope;
    private final double constant;

    private RemapCalibration(double meanAmplitude, double eps, double slope, double constant) {
        this.meanAmplitude = meanAmplitude;
        this.eps = eps;
        this.slope = slope;
        this.constant = constant;
    }

    /**
     * Creates calibration for the given mean amplitude:
     * <code>c<sub>low</sub> = 0.8 * mean</code>, <code>c<sub>high</sub> = 40 * c<sub>low</sub></code>,
     * <code>slope = (255 &minus; 30) / log10(c<sub>high</sub> / c<sub>low</sub>)</code>,
     * <code>constant = 30 &minus; slope * log10(c<sub>low</sub>)</code>.
     *
     * @param meanAmplitude mean amplitude of the data.
     * @return new calibration.
     * @throws CalibrationDegenerateException if the mean is zero, negative, infinite or NaN.
     */
    public static RemapCalibration ofMeanAmplitude(double meanAmplitude) throws CalibrationDegenerateException {
        if (!(meanAmplitude > 0.0) || Double.isInfinite(meanAmplitude)) {
            throw new CalibrationDegenerateException(meanAmplitude);
        }
        final double low = LOW_MULTIPLIER * meanAmplitude;
        final double high = HIGH_MULTIPLIER * low;
        final double slope = (DENSITY_MAX - DENSITY_MIN) / Math.log10(high / low);
        final double constant = DENSITY_MIN - slope * Math.log10(low);
        return new RemapCalibration(meanAmplitude, EPS, slope, constant);
    }

    public double meanAmplitude() {
        return meanAmplitude;
    }

    public double eps() {
        return eps;
    }

    public double slope() {
        return slope;
    }

    public double constant() {
        return constant;
    }

    @Override
    public String toString() {
        return "remap calibration: mean amplitude " + meanAmplitude +
                ", slope " + slope + ", constant " + constant + ", eps " + eps;
    }
}
