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

import java.io.IOException;
import java.util.OptionalInt;

/**
 * Exception that occurs while decoding or rendering image segment data.
 *
 * <p>If the problem concerns a concrete image segment, the exception stores its index
 * (see {@link #segmentIndex()}); the message already contains it.</p>
 */
public class NitfException extends IOException {
    private final int segmentIndex;

    public NitfException(String message) {
        this(message, (Throwable) null);
    }

    public NitfException(String message, Throwable cause) {
        super(message, cause);
        this.segmentIndex = -1;
    }

    public NitfException(int segmentIndex, String message) {
        this(segmentIndex, message, null);
    }

    public NitfException(int segmentIndex, String message, Throwable cause) {
        super(segmentPrefix(segmentIndex) + message, cause);
        this.segmentIndex = segmentIndex;
    }

    /**
     * Returns the index of the image segment, where the problem occurred,
     * or an empty result if this exception is not related to a single segment.
     *
     * @return index of the segment (0, 1, 2, ...).
     */
    public OptionalInt segmentIndex() {
        return segmentIndex >= 0 ? OptionalInt.of(segmentIndex) : OptionalInt.empty();
    }

    static String segmentPrefix(int segmentIndex) {
        return segmentIndex >= 0 ? "Image segment #" + segmentIndex + ": " : "";
    }
}
