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

package net.algart.matrices.nitf.pipeline;

import net.algart.matrices.nitf.NitfException;
import net.algart.matrices.nitf.raster.RgbaRaster;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of rendering one image segment: either the thumbnail or the exception that prevented it.
 */
public final class SegmentResult {
    private final int segmentIndex;
    private final RgbaRaster thumbnail;
    private final NitfException failure;

    private SegmentResult(int segmentIndex, RgbaRaster thumbnail, NitfException failure) {
        this.segmentIndex = segmentIndex;
        this.thumbnail = thumbnail;
        this.failure = failure;
    }

    public static SegmentResult success(int segmentIndex, RgbaRaster thumbnail) {
        Objects.requireNonNull(thumbnail, "Null thumbnail");
        return new SegmentResult(segmentIndex, thumbnail, null);
    }

    public static SegmentResult failure(int segmentIndex, NitfException failure) {
        Objects.requireNonNull(failure, "Null failure");
        return new SegmentResult(segmentIndex, null, failure);
    }

    public int segmentIndex() {
        return segmentIndex;
    }

    public boolean isSuccess() {
        return thumbnail != null;
    }

    /**
     * Returns the thumbnail.
     *
     * @return the thumbnail of the segment.
     * @throws IllegalStateException if the segment was not rendered.
     */
    public RgbaRaster thumbnail() {
        if (thumbnail == null) {
            throw new IllegalStateException("Segment #" + segmentIndex + " was not rendered: " +
                    failure.getMessage());
        }
        return thumbnail;
    }

    public Optional<NitfException> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return "segment #" + segmentIndex + ": " + (thumbnail != null ? thumbnail : "failed: " + failure);
    }
}
