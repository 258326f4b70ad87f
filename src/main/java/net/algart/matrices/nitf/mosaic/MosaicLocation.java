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

import java.util.Objects;

/**
 * Position of a global mosaic row: index of the segment (in the mosaic list) and the row inside it.
 */
public final class MosaicLocation {
    private final int segmentIndex;
    private final int localRow;

    public MosaicLocation(int segmentIndex, int localRow) {
        if (segmentIndex < 0) {
            throw new IllegalArgumentException("Negative segment index = " + segmentIndex);
        }
        if (localRow < 0) {
            throw new IllegalArgumentException("Negative local row = " + localRow);
        }
        this.segmentIndex = segmentIndex;
        this.localRow = localRow;
    }

    public int segmentIndex() {
        return segmentIndex;
    }

    public int localRow() {
        return localRow;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final MosaicLocation that = (MosaicLocation) o;
        return segmentIndex == that.segmentIndex && localRow == that.localRow;
    }

    @Override
    public int hashCode() {
        return Objects.hash(segmentIndex, localRow);
    }

    @Override
    public String toString() {
        return "row " + localRow + " of segment " + segmentIndex;
    }
}
