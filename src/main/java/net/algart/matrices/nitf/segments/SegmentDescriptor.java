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

package net.algart.matrices.nitf.segments;

import net.algart.matrices.nitf.ImageRepresentation;
import net.algart.matrices.nitf.PixelValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Description of one image segment: everything, that is necessary to interpret its raw pixel plane.
 * Usually created by the parser of the container file (which is out of scope of this library)
 * via {@link Builder}.
 *
 * <p>This object is immutable.</p>
 */
public final class SegmentDescriptor {
    private final int segmentIndex;
    private final int rows;
    private final int columns;
    private final PixelValueType pixelValueType;
    private final ImageRepresentation representation;
    private final int bitsPerPixel;
    private final int actualBitsPerPixel;
    private final int numberOfBands;
    private final int blocksPerRow;
    private final int blocksPerColumn;
    private final int pixelsPerBlockHorizontal;
    private final int pixelsPerBlockVertical;
    private final List<BandInfo> bands;

    private SegmentDescriptor(Builder builder) {
        this.segmentIndex = builder.segmentIndex;
        this.rows = builder.rows;
        this.columns = builder.columns;
        this.pixelValueType = builder.pixelValueType;
        this.representation = Objects.requireNonNull(builder.representation, "Null image representation");
        this.bitsPerPixel = builder.bitsPerPixel;
        this.actualBitsPerPixel = builder.actualBitsPerPixel > 0 ? builder.actualBitsPerPixel : builder.bitsPerPixel;
        this.numberOfBands = builder.numberOfBands;
        this.blocksPerRow = builder.blocksPerRow;
        this.blocksPerColumn = builder.blocksPerColumn;
        // - 0 in NPPBH/NPPBV means "the whole extent", allowed for a single block only
        if ((builder.pixelsPerBlockHorizontal == 0 && blocksPerRow > 1)
                || (builder.pixelsPerBlockVertical == 0 && blocksPerColumn > 1)) {
            throw new IllegalArgumentException("Zero number of pixels per block " +
                    builder.pixelsPerBlockHorizontal + "x" + builder.pixelsPerBlockVertical +
                    " is allowed only for single block, but there are " +
                    blocksPerRow + "x" + blocksPerColumn + " blocks");
        }
        this.pixelsPerBlockHorizontal = builder.pixelsPerBlockHorizontal == 0 ?
                columns : builder.pixelsPerBlockHorizontal;
        this.pixelsPerBlockVertical = builder.pixelsPerBlockVertical == 0 ?
                rows : builder.pixelsPerBlockVertical;
        this.bands = Collections.unmodifiableList(new ArrayList<>(builder.bands));
        if (!bands.isEmpty() && bands.size() != numberOfBands) {
            throw new IllegalArgumentException("Number of band descriptions " + bands.size() +
                    " does not match the number of bands " + numberOfBands);
        }
        final long rasterSize = (long) rasterSizeX() * (long) rasterSizeY();
        if (rasterSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large segment raster " + rasterSizeX() + "x" + rasterSizeY() +
                    " (>= 2^31 pixels)");
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static SegmentDescriptor ofUnblocked(
            int segmentIndex,
            ImageRepresentation representation,
            int rows,
            int columns,
            int numberOfBands) {
        return newBuilder()
                .setSegmentIndex(segmentIndex)
                .setRepresentation(representation)
                .setDimensions(rows, columns)
                .setNumberOfBands(numberOfBands)
                .build();
    }

    public int segmentIndex() {
        return segmentIndex;
    }

    /**
     * Number of significant rows (NROWS).
     *
     * @return image height.
     */
    public int rows() {
        return rows;
    }

    /**
     * Number of significant columns (NCOLS).
     *
     * @return image width.
     */
    public int columns() {
        return columns;
    }

    public PixelValueType pixelValueType() {
        return pixelValueType;
    }

    public ImageRepresentation representation() {
        return representation;
    }

    /**
     * Number of bits per pixel per band (NBPP).
     *
     * @return bits per pixel.
     */
    public int bitsPerPixel() {
        return bitsPerPixel;
    }

    public int actualBitsPerPixel() {
        return actualBitsPerPixel;
    }

    public int bytesPerSample() {
        return bitsPerPixel / 8;
    }

    public int numberOfBands() {
        return numberOfBands;
    }

    public int blocksPerRow() {
        return blocksPerRow;
    }

    public int blocksPerColumn() {
        return blocksPerColumn;
    }

    public int numberOfBlocks() {
        return blocksPerRow * blocksPerColumn;
    }

    public int pixelsPerBlockHorizontal() {
        return pixelsPerBlockHorizontal;
    }

    public int pixelsPerBlockVertical() {
        return pixelsPerBlockVertical;
    }

    public List<BandInfo> bands() {
        return bands;
    }

    public boolean isBlocked() {
        return blocksPerRow != 1 || blocksPerColumn != 1;
    }

    /**
     * Returns <code>true</code> if this segment contains complex (I/Q) radar samples,
     * that should be rendered via amplitude remapping instead of block decoding.
     *
     * @return whether this is a not-for-display (complex) segment.
     */
    public boolean isComplex() {
        return representation.isNoDisplay();
    }

    /**
     * Width of the decoded raster: the significant number of columns for a single block per row,
     * or the full tiled width <code>blocksPerRow * pixelsPerBlockHorizontal</code> in other case.
     *
     * @return width of the decoded raster.
     */
    public int rasterSizeX() {
        return blocksPerRow < 2 ? columns : blocksPerRow * pixelsPerBlockHorizontal;
    }

    public int rasterSizeY() {
        return blocksPerColumn < 2 ? rows : blocksPerColumn * pixelsPerBlockVertical;
    }

    public long blockSizeInBytes() {
        return (long) bytesPerSample() * (long) pixelsPerBlockHorizontal * (long) pixelsPerBlockVertical
                * (long) numberOfBands;
    }

    @Override
    public String toString() {
        return "image segment #" + segmentIndex + ": " + columns + "x" + rows + " " + representation.code() +
                ", " + numberOfBands + " band" + (numberOfBands == 1 ? "" : "s") +
                ", " + bitsPerPixel + " bits per pixel" +
                (actualBitsPerPixel != bitsPerPixel ? " (" + actualBitsPerPixel + " actual)" : "") +
                ", " + pixelValueType.prettyName() + " values" +
                (isBlocked() ?
                        ", " + blocksPerRow + "x" + blocksPerColumn + " blocks " +
                                pixelsPerBlockHorizontal + "x" + pixelsPerBlockVertical :
                        ", not blocked");
    }

    public static final class Builder {
        private int segmentIndex = 0;
        private int rows = 0;
        private int columns = 0;
        private PixelValueType pixelValueType = PixelValueType.INT;
        private ImageRepresentation representation = null;
        private int bitsPerPixel = 8;
        private int actualBitsPerPixel = 0;
        private int numberOfBands = 1;
        private int blocksPerRow = 1;
        private int blocksPerColumn = 1;
        private int pixelsPerBlockHorizontal = 0;
        private int pixelsPerBlockVertical = 0;
        private final List<BandInfo> bands = new ArrayList<>();

        private Builder() {
        }

        public Builder setSegmentIndex(int segmentIndex) {
            if (segmentIndex < 0) {
                throw new IllegalArgumentException("Negative segment index = " + segmentIndex);
            }
            this.segmentIndex = segmentIndex;
            return this;
        }

        public Builder setDimensions(int rows, int columns) {
            if (rows < 0) {
                throw new IllegalArgumentException("Negative number of rows = " + rows);
            }
            if (columns < 0) {
                throw new IllegalArgumentException("Negative number of columns = " + columns);
            }
            this.rows = rows;
            this.columns = columns;
            return this;
        }

        public Builder setPixelValueType(PixelValueType pixelValueType) {
            this.pixelValueType = Objects.requireNonNull(pixelValueType, "Null pixel value type");
            return this;
        }

        public Builder setRepresentation(ImageRepresentation representation) {
            this.representation = Objects.requireNonNull(representation, "Null image representation");
            return this;
        }

        public Builder setBitsPerPixel(int bitsPerPixel) {
            if (bitsPerPixel <= 0) {
                throw new IllegalArgumentException("Zero or negative bits per pixel = " + bitsPerPixel);
            }
            this.bitsPerPixel = bitsPerPixel;
            return this;
        }

        public Builder setActualBitsPerPixel(int actualBitsPerPixel) {
            if (actualBitsPerPixel < 0) {
                throw new IllegalArgumentException("Negative actual bits per pixel = " + actualBitsPerPixel);
            }
            this.actualBitsPerPixel = actualBitsPerPixel;
            return this;
        }

        public Builder setNumberOfBands(int numberOfBands) {
            if (numberOfBands <= 0) {
                throw new IllegalArgumentException("Zero or negative number of bands = " + numberOfBands);
            }
            this.numberOfBands = numberOfBands;
            return this;
        }

        public Builder setBlocks(int blocksPerRow, int blocksPerColumn) {
            if (blocksPerRow <= 0 || blocksPerColumn <= 0) {
                throw new IllegalArgumentException("Zero or negative number of blocks " +
                        blocksPerRow + "x" + blocksPerColumn);
            }
            this.blocksPerRow = blocksPerRow;
            this.blocksPerColumn = blocksPerColumn;
            return this;
        }

        public Builder setPixelsPerBlock(int pixelsPerBlockHorizontal, int pixelsPerBlockVertical) {
            if (pixelsPerBlockHorizontal < 0 || pixelsPerBlockVertical < 0) {
                throw new IllegalArgumentException("Negative number of pixels per block " +
                        pixelsPerBlockHorizontal + "x" + pixelsPerBlockVertical);
            }
            this.pixelsPerBlockHorizontal = pixelsPerBlockHorizontal;
            this.pixelsPerBlockVertical = pixelsPerBlockVertical;
            return this;
        }

        public Builder setBands(List<BandInfo> bands) {
            Objects.requireNonNull(bands, "Null bands");
            this.bands.clear();
            for (BandInfo band : bands) {
                this.bands.add(Objects.requireNonNull(band, "Null band in the list"));
            }
            return this;
        }

        public Builder addBand(BandInfo band) {
            this.bands.add(Objects.requireNonNull(band, "Null band"));
            return this;
        }

        public SegmentDescriptor build() {
            return new SegmentDescriptor(this);
        }
    }
}
