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

import net.algart.matrices.nitf.segments.RawPlane;

import java.util.Objects;

/**
 * Access to complex samples, stored in {@link RawPlane} as pairs of big-endian 32-bit IEEE floats:
 * real (I) part, then imaginary (Q) part.
 */
public final class ComplexSamples {
    public static final int BYTES_PER_SAMPLE = 8;

    private ComplexSamples() {
    }

    public static float real(RawPlane plane, int sampleIndex) {
        return plane.getFloat(byteOffset(sampleIndex));
    }

    public static float imaginary(RawPlane plane, int sampleIndex) {
        return plane.getFloat(byteOffset(sampleIndex) + 4);
    }

    /**
     * Returns the amplitude (absolute value) of the sample with the given index.
     *
     * @param plane       raw plane with complex samples.
     * @param sampleIndex index of the sample (not of the byte).
     * @return amplitude of the sample.
     */
    public static float amplitude(RawPlane plane, int sampleIndex) {
        Objects.requireNonNull(plane, "Null plane");
        final int offset = byteOffset(sampleIndex);
        return amplitude(plane.getFloat(offset), plane.getFloat(offset + 4));
    }

    /**
     * Returns <code>sqrt(re<sup>2</sup>+im<sup>2</sup>)</code>, clamped to
     * <code>&plusmn;Float.MAX_VALUE</code>. NaN is returned without changes.
     *
     * @param re real part.
     * @param im imaginary part.
     * @return amplitude.
     */
    public static float amplitude(float re, float im) {
        final double result = Math.sqrt((double) re * re + (double) im * im);
        if (result > Float.MAX_VALUE) {
            return Float.MAX_VALUE;
        }
        if (result < -Float.MAX_VALUE) {
            return -Float.MAX_VALUE;
        }
        return (float) result;
    }

    public static int numberOfSamples(RawPlane plane) {
        Objects.requireNonNull(plane, "Null plane");
        return plane.length() / BYTES_PER_SAMPLE;
    }

    private static int byteOffset(int sampleIndex) {
        if (sampleIndex < 0) {
            throw new IndexOutOfBoundsException("Negative sample index = " + sampleIndex);
        }
        final long offset = (long) sampleIndex * BYTES_PER_SAMPLE;
        if (offset > Integer.MAX_VALUE - BYTES_PER_SAMPLE) {
            throw new IndexOutOfBoundsException("Too large sample index = " + sampleIndex);
        }
        return (int) offset;
    }
}
