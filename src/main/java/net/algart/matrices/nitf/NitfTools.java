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

import java.util.stream.IntStream;

/**
 * Utility methods and global settings of this library.
 *
 * @author Daniel Alievsky
 */
public class NitfTools {
    /**
     * Default size of the thumbnail: the thumbnail contains approximately
     * <code>size<sup>2</sup></code> pixels. Can be changed by the system property
     * <code>net.algart.matrices.nitf.defaultThumbnailSize</code>.
     */
    public static final int DEFAULT_THUMBNAIL_SIZE = (int) Math.min(Integer.MAX_VALUE, Math.max(1,
            net.algart.arrays.Arrays.SystemSettings.getLongProperty(
                    "net.algart.matrices.nitf.defaultThumbnailSize", 256)));

    /**
     * Maximal allowed thumbnail size: <code>size<sup>2</sup></code> must fit into Java array of RGBA pixels.
     */
    public static final int MAX_THUMBNAIL_SIZE = 16384;

    /**
     * Whether pixel-level loops (decoding, remapping, resampling) are executed in parallel.
     * The results do not depend on this flag; <code>false</code> value can help while debugging.
     */
    public static final boolean PARALLEL_EXECUTION = getBooleanProperty(
            "net.algart.matrices.nitf.parallel", true);

    public static final boolean BUILT_IN_TIMING = getBooleanProperty(
            "net.algart.matrices.nitf.timing", false);

    private NitfTools() {
    }

    /**
     * Converts a real value into an unsigned byte 0..255: the value is clamped to 0..255 range
     * and then truncated (rounded towards zero). <code>NaN</code> is converted to 0.
     *
     * @param value any real value.
     * @return integer in 0..255 range.
     */
    public static int clampToUnsignedByte(double value) {
        if (!(value > 0.0)) {
            // - including NaN
            return 0;
        }
        if (value >= 255.0) {
            return 255;
        }
        return (int) value;
    }

    public static int clampToUnsignedByte(int value) {
        return value < 0 ? 0 : Math.min(value, 255);
    }

    /**
     * Returns the stream <code>0, 1, ..., count-1</code>, parallel if {@link #PARALLEL_EXECUTION} is set.
     * Every index must be processed independently: the order of execution is not defined.
     *
     * @param count number of elements.
     * @return stream of indexes.
     */
    public static IntStream indexes(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative count = " + count);
        }
        final IntStream result = IntStream.range(0, count);
        return PARALLEL_EXECUTION ? result.parallel() : result;
    }

    public static long debugTime() {
        return BUILT_IN_TIMING ? System.nanoTime() : 0;
    }

    static boolean getBooleanProperty(String propertyName, boolean defaultValue) {
        try {
            final String value = System.getProperty(propertyName);
            return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
        } catch (Exception e) {
            return defaultValue;
        }
    }
}
