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

import net.algart.matrices.nitf.segments.RawPlane;
import net.algart.matrices.nitf.segments.SegmentDescriptor;

import java.util.Objects;

/**
 * Image segment to render: its description and its raw pixel data.
 */
public final class SegmentSource {
    private final SegmentDescriptor descriptor;
    private final RawPlane plane;

    private SegmentSource(SegmentDescriptor descriptor, RawPlane plane) {
        this.descriptor = Objects.requireNonNull(descriptor, "Null segment descriptor");
        this.plane = Objects.requireNonNull(plane, "Null raw plane");
    }

    public static SegmentSource of(SegmentDescriptor descriptor, RawPlane plane) {
        return new SegmentSource(descriptor, plane);
    }

    public SegmentDescriptor descriptor() {
        return descriptor;
    }

    public RawPlane plane() {
        return plane;
    }

    public int segmentIndex() {
        return descriptor.segmentIndex();
    }

    @Override
    public String toString() {
        return descriptor + ", " + plane;
    }
}
