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
import net.algart.matrices.nitf.NitfException;
import net.algart.matrices.nitf.NitfTools;
import net.algart.matrices.nitf.UnsupportedBitDepthException;
import net.algart.matrices.nitf.UnsupportedNitfFormatException;
import net.algart.matrices.nitf.UnsupportedRepresentationException;
import net.algart.matrices.nitf.raster.RgbaRaster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decoder of uncompressed image segments with {@link ImageRepresentation#MONO MONO},
 * {@link ImageRepresentation#RGB RGB} and {@link ImageRepresentation#RGB_LUT RGB/LUT} representations
 * into {@link RgbaRaster}.
 *
 * <p>Blocked segments are decoded into the full tiled extent
 * <code>blocksPerRow*pixelsPerBlockHorizontal x blocksPerColumn*pixelsPerBlockVertical</code>
 * (along the axes, containing 2 or more blocks); the pixels outside the significant
 * <code>columns x rows</code> area are transparent (alpha=0).</p>
 */
public final class BlockDecoder {
    private static final System.Logger LOG = System.getLogger(BlockDecoder.class.getName());
    private static final boolean LOGGABLE_TRACE = LOG.isLoggable(System.Logger.Level.TRACE);

    private BlockDecoder() {
    }

    public static RgbaRaster decode(SegmentDescriptor descriptor, RawPlane plane) throws NitfException {
        Objects.requireNonNull(descriptor, "Null segment descriptor");
        Objects.requireNonNull(plane, "Null raw plane");
        if (LOGGABLE_TRACE) {
            LOG.log(System.Logger.Level.TRACE, () -> headerDump(descriptor, plane));
        }
        checkSupported(descriptor);
        final long t1 = NitfTools.debugTime();
        final RgbaRaster result = RgbaRaster.newRaster(descriptor.rasterSizeX(), descriptor.rasterSizeY());
        final int[][] palette = palette(descriptor);
        if (descriptor.isBlocked()) {
            decodeBlocked(descriptor, plane, palette, result);
        } else {
            decodeUnblocked(descriptor, plane, palette, result);
        }
        if (NitfTools.BUILT_IN_TIMING) {
            final long t2 = NitfTools.debugTime();
            LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                    "%s decoded segment #%d %dx%d %s (%d blocks) in %.3f ms, %.3f MB/s",
                    BlockDecoder.class.getSimpleName(),
                    descriptor.segmentIndex(), result.sizeX(), result.sizeY(),
                    descriptor.representation().code(), descriptor.numberOfBlocks(),
                    (t2 - t1) * 1e-6, plane.length() / 1048576.0 / ((t2 - t1) * 1e-9)));
        }
        return result;
    }

    /**
     * Returns the list of all blocks of the segment in the order of their storage in the raw plane:
     * <code>index = xIndex + yIndex * blocksPerRow</code>.
     *
     * @param descriptor segment description.
     * @return unmodifiable list of blocks.
     */
    public static List<BlockInfo> blocks(SegmentDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "Null segment descriptor");
        final int blocksPerRow = descriptor.blocksPerRow();
        final int blocksPerColumn = descriptor.blocksPerColumn();
        final int blockSizeX = descriptor.pixelsPerBlockHorizontal();
        final int blockSizeY = descriptor.pixelsPerBlockVertical();
        final List<BlockInfo> result = new ArrayList<>(blocksPerRow * blocksPerColumn);
        for (int yIndex = 0; yIndex < blocksPerColumn; yIndex++) {
            for (int xIndex = 0; xIndex < blocksPerRow; xIndex++) {
                result.add(new BlockInfo(xIndex + yIndex * blocksPerRow,
                        xIndex * blockSizeX, yIndex * blockSizeY, blockSizeX, blockSizeY));
            }
        }
        return Collections.unmodifiableList(result);
    }

    static void checkSupported(SegmentDescriptor descriptor) throws NitfException {
        final int segmentIndex = descriptor.segmentIndex();
        final int bitsPerPixel = descriptor.bitsPerPixel();
        if (bitsPerPixel % 8 != 0 || bitsPerPixel != 8) {
            throw new UnsupportedBitDepthException(segmentIndex, bitsPerPixel);
        }
        final ImageRepresentation representation = descriptor.representation();
        if (!representation.isBlockDecodable()) {
            throw new UnsupportedRepresentationException(segmentIndex, representation);
        }
        final int requiredBands = representation == ImageRepresentation.RGB ? 3 : 1;
        if (descriptor.numberOfBands() != requiredBands) {
            throw new UnsupportedNitfFormatException(segmentIndex, "image representation " +
                    representation.code() + " requires " + requiredBands + " band" +
                    (requiredBands == 1 ? "" : "s") + ", but " + descriptor.numberOfBands() + " bands found");
        }
    }

    private static int[][] palette(SegmentDescriptor descriptor) throws NitfException {
        if (descriptor.representation() != ImageRepresentation.RGB_LUT) {
            return null;
        }
        final List<BandInfo> bands = descriptor.bands();
        final BandInfo band = bands.isEmpty() ? null : bands.get(0);
        if (band == null || band.numberOfLookupTables() < 3) {
            throw new NitfException(descriptor.segmentIndex(), "RGB/LUT image requires 3 lookup tables " +
                    "in the band #0, but " + (band == null ? "no band information" :
                    band.numberOfLookupTables() + " tables") + " found");
        }
        if (band.numberOfLookupEntries() < 256) {
            throw new NitfException(descriptor.segmentIndex(), "RGB/LUT image requires 256 entries " +
                    "in every lookup table, but only " + band.numberOfLookupEntries() + " entries found");
        }
        final int[][] result = new int[3][256];
        for (int k = 0; k < 3; k++) {
            for (int i = 0; i < 256; i++) {
                result[k][i] = band.lookup(k, i);
            }
        }
        return result;
    }

    private static void decodeUnblocked(
            SegmentDescriptor descriptor,
            RawPlane plane,
            int[][] palette,
            RgbaRaster result) throws NitfException {
        final int sizeX = result.sizeX();
        final int bands = descriptor.numberOfBands();
        final long required = (long) result.numberOfPixels() * bands;
        checkLength(descriptor, plane, required);
        final byte[] data = result.data();
        NitfTools.indexes(result.sizeY()).forEach(y -> {
            int srcDisp = y * sizeX * bands;
            int disp = y * sizeX * RgbaRaster.NUMBER_OF_CHANNELS;
            for (int x = 0; x < sizeX; x++, srcDisp += bands, disp += RgbaRaster.NUMBER_OF_CHANNELS) {
                putPixel(data, disp, plane, srcDisp, bands, palette, 255);
            }
        });
    }

    private static void decodeBlocked(
            SegmentDescriptor descriptor,
            RawPlane plane,
            int[][] palette,
            RgbaRaster result) throws NitfException {
        final List<BlockInfo> blocks = blocks(descriptor);
        final long blockSize = descriptor.blockSizeInBytes();
        checkLength(descriptor, plane, blockSize * blocks.size());
        final int bands = descriptor.numberOfBands();
        final int rows = descriptor.rows();
        final int columns = descriptor.columns();
        final int sizeX = result.sizeX();
        final int sizeY = result.sizeY();
        final byte[] data = result.data();
        NitfTools.indexes(blocks.size()).forEach(k -> {
            final BlockInfo block = blocks.get(k);
            int srcDisp = (int) (block.index() * blockSize);
            for (int y = block.y(); y < block.toY(); y++) {
                for (int x = block.x(); x < block.toX(); x++, srcDisp += bands) {
                    if (x >= sizeX || y >= sizeY) {
                        // - a single block along this axis, larger than the significant extent
                        continue;
                    }
                    final int alpha = x >= columns || y >= rows ? 0 : 255;
                    final int disp = (y * sizeX + x) * RgbaRaster.NUMBER_OF_CHANNELS;
                    putPixel(data, disp, plane, srcDisp, bands, palette, alpha);
                }
            }
        });
    }

    private static void putPixel(
            byte[] data,
            int disp,
            RawPlane plane,
            int srcDisp,
            int bands,
            int[][] palette,
            int alpha) {
        if (palette != null) {
            final int index = plane.getUnsignedByte(srcDisp);
            data[disp] = (byte) palette[0][index];
            data[disp + 1] = (byte) palette[1][index];
            data[disp + 2] = (byte) palette[2][index];
        } else if (bands == 3) {
            data[disp] = (byte) plane.getUnsignedByte(srcDisp);
            data[disp + 1] = (byte) plane.getUnsignedByte(srcDisp + 1);
            data[disp + 2] = (byte) plane.getUnsignedByte(srcDisp + 2);
        } else {
            final byte v = (byte) plane.getUnsignedByte(srcDisp);
            data[disp] = v;
            data[disp + 1] = v;
            data[disp + 2] = v;
        }
        data[disp + 3] = (byte) alpha;
    }

    private static void checkLength(SegmentDescriptor descriptor, RawPlane plane, long required)
            throws NitfException {
        if (plane.length() < required) {
            throw new NitfException(descriptor.segmentIndex(), "too short raw data: " + plane.length() +
                    " bytes instead of " + required + " bytes, required for " +
                    descriptor.rasterSizeX() + "x" + descriptor.rasterSizeY() + " " +
                    descriptor.representation().code() + " image");
        }
    }

    private static String headerDump(SegmentDescriptor descriptor, RawPlane plane) {
        final StringBuilder sb = new StringBuilder();
        sb.append("Image segment #").append(descriptor.segmentIndex()).append(String.format(Locale.US,
                "%n  rows: %d, columns: %d%n  pixel value type: %s%n  representation: %s%n" +
                        "  bands: %d%n  bits per pixel: %d (actual %d)%n" +
                        "  blocks per row: %d, blocks per column: %d%n" +
                        "  pixels per block: %dx%d",
                descriptor.rows(), descriptor.columns(),
                descriptor.pixelValueType().code(), descriptor.representation().code(),
                descriptor.numberOfBands(), descriptor.bitsPerPixel(), descriptor.actualBitsPerPixel(),
                descriptor.blocksPerRow(), descriptor.blocksPerColumn(),
                descriptor.pixelsPerBlockHorizontal(), descriptor.pixelsPerBlockVertical()));
        final List<BandInfo> bands = descriptor.bands();
        for (int k = 0; k < bands.size(); k++) {
            sb.append(String.format(Locale.US, "%n  band #%d: %s", k, bands.get(k)));
        }
        sb.append(String.format(Locale.US, "%n  data length: %d", plane.length()));
        return sb.toString();
    }
}
