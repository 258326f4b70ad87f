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

package net.algart.matrices.nitf;

/**
 * Thrown when the remap calibration cannot be built from the data: the mean amplitude
 * is zero, negative or not a finite number, so its logarithm is undefined.
 */
public class CalibrationDegenerateException extends NitfException {
    private final double meanAmplitude;

    public CalibrationDegenerateException(double meanAmplitude) {
        super(message(meanAmplitude));
        this.meanAmplitude = meanAmplitude;
    }

    public CalibrationDegenerateException(int segmentIndex, double meanAmplitude) {
        super(segmentIndex, message(meanAmplitude));
        this.meanAmplitude = meanAmplitude;
    }

    public double meanAmplitude() {
        return meanAmplitude;
    }

    private static String message(double meanAmplitude) {
        return "cannot calibrate amplitude remap: mean amplitude " + meanAmplitude +
                " is not a positive finite number";
    }
}
