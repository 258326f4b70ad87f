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

import net.algart.matrices.nitf.CalibrationDegenerateException;
import net.algart.matrices.nitf.NitfException;
import net.algart.matrices.nitf.PixelValueType;
import net.algart.matrices.nitf.UnsupportedNitfFormatException;
import net.algart.matrices.nitf.UnsupportedRepresentationException;
import net.algart.matrices.nitf.remap.ComplexSamples;
import net.algart.matrices.nitf.remap.DensityRemap;
import net.algart.matrices.nitf.remap.RemapCalibration;
import net.algart.matrices.nitf.segments.RawPlane;
import net.algart.matrices.nitf.segments.SegmentDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Several complex planes with the same number of columns, stacked vertically (one after another)
 * into one logical image. Allows to address every sample by the global row and column.
 *
 * <p>This object is immutable and thread-safe.</p>
 */
public final class MosaicIndex {
    private static final System.Logger LOG = System.getLogger(MosaicIndex.class.getName());

    private final List<RawPlane> planes;
    private final int[] rowCounts;
    private final long[] rowOffsets;
    // - rowOffsets[k] = sum of rowCounts[0..k-1]; rowOffsets[n] = totalRows
    private final int columns;
    private final int totalRows;

    public MosaicIndex(List<RawPlane> planes, int[] rowCounts, int columns) {
        Objects.requireNonNull(planes, "Null planes");
        Objects.requireNonNull(rowCounts, "Null row counts");
        if (planes.isEmpty()) {
            throw new IllegalArgumentException("Empty list of planes");
        }
        if (planes.size() != rowCounts.length) {
            throw new IllegalArgumentException("Number of planes " + planes.size() +
                    " does not match the number of row counts " + rowCounts.length);
        }
        if (columns <= 0) {
            throw new IllegalArgumentException("Zero or negative number of columns = " + columns);
        }
        this.planes = Collections.unmodifiableList(new ArrayList<>(planes));
        this.rowCounts = rowCounts.clone();
        this.columns = columns;
        this.rowOffsets = new long[rowCounts.length + 1];
        for (int k = 0; k < this.rowCounts.length; k++) {
            Objects.requireNonNull(this.planes.get(k), "Null plane #" + k);
            if (this.rowCounts[k] < 0) {
                throw new IllegalArgumentException("Negative number of rows " + this.rowCounts[k] +
                        " in the plane #" + k);
            }
            final long required = (long) this.rowCounts[k] * (long) columns * ComplexSamples.BYTES_PER_SAMPLE;
            if (this.planes.get(k).length() < required) {
                throw new IllegalArgumentException("Plane #" + k + " is too short: " +
                        this.planes.get(k).length() + " bytes instead of " + required);
            }
            rowOffsets[k + 1] = rowOffsets[k] + this.rowCounts[k];
        }
        final long total = rowOffsets[rowCounts.length];
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large total number of rows " + total + " >= 2^31");
        }
        this.totalRows = (int) total;
    }

    /**
     * Creates the mosaic from image segments with complex samples. All segments must be
     * {@link net.algart.matrices.nitf.ImageRepresentation#NODISPLY NODISPLY}, not blocked, have the same
     * number of columns and contain 64-bit complex samples: 1 band of {@link PixelValueType#C C} type
     * or 2 bands (I and Q) of 32-bit {@link PixelValueType#R R} type.
     *
     * @param descriptors segment descriptions.
     * @param planes      raw planes of the segments.
     * @return new mosaic.
     * @throws NitfException if some segment is not suitable.
     */
    public static MosaicIndex ofSegments(List<SegmentDescriptor> descriptors, List<RawPlane> planes)
            throws NitfException {
        Objects.requireNonNull(descriptors, "Null descriptors");
        Objects.requireNonNull(planes, "Null planes");
        if (descriptors.isEmpty()) {
            throw new IllegalArgumentException("Empty list of segments");
        }
        if (descriptors.size() != planes.size()) {
            throw new IllegalArgumentException("Number of descriptors " + descriptors.size() +
                    " does not match the number of planes " + planes.size());
        }
        final int columns = descriptors.get(0).columns();
        final int[] rowCounts = new int[descriptors.size()];
        for (int k = 0; k < rowCounts.length; k++) {
            final SegmentDescriptor d = Objects.requireNonNull(descriptors.get(k), "Null descriptor #" + k);
            checkComplexSegment(d);
            if (d.columns() != columns) {
                throw new UnsupportedNitfFormatException(d.segmentIndex(), "cannot be stacked into the mosaic: " +
                        d.columns() + " columns instead of " + columns + " columns in the first segment");
            }
            final long required = (long) d.rows() * (long) columns * ComplexSamples.BYTES_PER_SAMPLE;
            if (planes.get(k).length() < required) {
                throw new NitfException(d.segmentIndex(), "too short complex data: " + planes.get(k).length() +
                        " bytes instead of " + required + " bytes");
            }
            rowCounts[k] = d.rows();
        }
        if (columns == 0) {
            throw new UnsupportedNitfFormatException(descriptors.get(0).segmentIndex(),
                    "empty complex image (0 columns)");
        }
        return new MosaicIndex(planes, rowCounts, columns);
    }

    public static void checkComplexSegment(SegmentDescriptor descriptor) throws NitfException {
        Objects.requireNonNull(descriptor, "Null descriptor");
        final int segmentIndex = descriptor.segmentIndex();
        if (!descriptor.isComplex()) {
            throw new UnsupportedRepresentationException(segmentIndex, descriptor.representation());
        }
        if (descriptor.isBlocked()) {
            throw new UnsupportedNitfFormatException(segmentIndex,
                    "blocked complex data are not supported");
        }
        final PixelValueType type = descriptor.pixelValueType();
        final boolean complexPairs = type == PixelValueType.C
                && descriptor.bitsPerPixel() == 64 && descriptor.numberOfBands() == 1;
        final boolean separateBands = type == PixelValueType.R
                && descriptor.bitsPerPixel() == 32 && descriptor.numberOfBands() == 2;
        if (!complexPairs && !separateBands) {
            throw new UnsupportedNitfFormatException(segmentIndex, "unsupported complex data layout: " +
                    descriptor.numberOfBands() + " bands of " + descriptor.bitsPerPixel() + "-bit " +
                    type.prettyName() + " values (only pairs of 32-bit float I/Q values are supported)");
        }
    }

    public int numberOfPlanes() {
        return planes.size();
    }

    public List<RawPlane> planes() {
        return planes;
    }

    public int rowCount(int planeIndex) {
        return rowCounts[planeIndex];
    }

    public int columns() {
        return columns;
    }

    public int totalRows() {
        return totalRows;
    }

    public long totalSamples() {
        return (long) totalRows * (long) columns;
    }

    /**
     * Finds the plane, containing the given global row, and the row inside this plane.
     * Planes with zero rows are never returned.
     *
     * @param row global row index.
     * @return plane index and local row.
     * @throws MosaicRowOutOfRangeException if <code>row &lt; 0</code> or <code>row &ge; totalRows()</code>.
     */
    public MosaicLocation resolve(long row) {
        final int planeIndex = planeIndex(row);
        return new MosaicLocation(planeIndex, (int) (row - rowOffsets[planeIndex]));
    }

    /**
     * Returns the remapped intensity 0..255 of the sample at the given global row and column.
     *
     * @param calibration remap parameters.
     * @param row         global row index.
     * @param column      column index.
     * @return remapped intensity.
     * @throws IndexOutOfBoundsException if the row or column is out of range.
     */
    public int remap(RemapCalibration calibration, long row, int column) {
        if (column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("Column " + column + " is out of range 0.." + (columns - 1));
        }
        final int planeIndex = planeIndex(row);
        final int localRow = (int) (row - rowOffsets[planeIndex]);
        return DensityRemap.apply(calibration, planes.get(planeIndex), localRow * columns + column);
    }

    /**
     * Calibrates the density remap for the whole mosaic: the mean amplitude is the sum of finite amplitudes
     * of all planes, divided by the total number of samples.
     *
     * @return calibration.
     * @throws NitfException if the mean amplitude is not positive.
     */
    public RemapCalibration calibrate() throws NitfException {
        double sum = 0.0;
        for (int k = 0; k < planes.size(); k++) {
            sum += DensityRemap.sumOfFiniteAmplitudes(planes.get(k), rowCounts[k], columns, -1);
        }
        final double mean = sum / totalSamples();
        LOG.log(System.Logger.Level.DEBUG, () -> "Mean amplitude of the mosaic " + this + ": " + mean);
        if (!(mean > 0.0) || Double.isInfinite(mean)) {
            throw new CalibrationDegenerateException(mean);
        }
        return RemapCalibration.ofMeanAmplitude(mean);
    }

    @Override
    public String toString() {
        return "mosaic " + columns + "x" + totalRows + " of " + planes.size() + " planes " +
                Arrays.toString(rowCounts);
    }

    private int planeIndex(long row) {
        if (row < 0 || row >= totalRows) {
            throw new MosaicRowOutOfRangeException(row, totalRows);
        }
        int index = Arrays.binarySearch(rowOffsets, row);
        if (index < 0) {
            // - insertion point minus 1: the last offset < row
            index = -index - 2;
        } else {
            // - exact start of a plane; skipping planes with zero rows, which start at the same offset
            while (rowOffsets[index + 1] == row) {
                index++;
            }
        }
        return index;
    }
}
