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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SegmentDescriptorTest {

    @Test
    void testUnblockedDefaults() {
        SegmentDescriptor d = SegmentDescriptor.ofUnblocked(2, ImageRepresentation.MONO, 30, 40, 1);
        assertThat(d.segmentIndex()).isEqualTo(2);
        assertThat(d.isBlocked()).isFalse();
        assertThat(d.pixelsPerBlockHorizontal()).isEqualTo(40);
        assertThat(d.pixelsPerBlockVertical()).isEqualTo(30);
        assertThat(d.rasterSizeX()).isEqualTo(40);
        assertThat(d.rasterSizeY()).isEqualTo(30);
        assertThat(d.bitsPerPixel()).isEqualTo(8);
        assertThat(d.actualBitsPerPixel()).isEqualTo(8);
        assertThat(d.pixelValueType()).isEqualTo(PixelValueType.INT);
        assertThat(d.isComplex()).isFalse();
    }

    @Test
    void testBlockedRasterSizes() {
        SegmentDescriptor d = SegmentDescriptor.newBuilder()
                .setRepresentation(ImageRepresentation.RGB)
                .setNumberOfBands(3)
                .setDimensions(100, 150)
                .setBlocks(3, 2)
                .setPixelsPerBlock(64, 64)
                .build();
        assertThat(d.isBlocked()).isTrue();
        assertThat(d.numberOfBlocks()).isEqualTo(6);
        assertThat(d.rasterSizeX()).isEqualTo(192);
        assertThat(d.rasterSizeY()).isEqualTo(128);
        assertThat(d.blockSizeInBytes()).isEqualTo(64 * 64 * 3);
    }

    @Test
    void testSingleBlockAlongAxisUsesSignificantExtent() {
        SegmentDescriptor d = SegmentDescriptor.newBuilder()
                .setRepresentation(ImageRepresentation.MONO)
                .setDimensions(100, 50)
                .setBlocks(1, 4)
                .setPixelsPerBlock(64, 32)
                .build();
        assertThat(d.rasterSizeX()).isEqualTo(50);
        assertThat(d.rasterSizeY()).isEqualTo(128);
    }

    @Test
    void testZeroPixelsPerBlockRequiresSingleBlock() {
        assertThatThrownBy(() -> SegmentDescriptor.newBuilder()
                .setRepresentation(ImageRepresentation.MONO)
                .setDimensions(10, 10)
                .setBlocks(2, 1)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testBandsMustMatch() {
        assertThatThrownBy(() -> SegmentDescriptor.newBuilder()
                .setRepresentation(ImageRepresentation.RGB)
                .setNumberOfBands(3)
                .setDimensions(10, 10)
                .setBands(List.of(BandInfo.of("R")))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SegmentDescriptor.newBuilder().setDimensions(10, 10).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testBandInfo() {
        byte[] red = new byte[256];
        red[7] = (byte) 200;
        BandInfo band = BandInfo.ofPalette(red, new byte[256], new byte[256]);
        red[7] = 0;
        assertThat(band.representation()).isEqualTo("LU");
        assertThat(band.numberOfLookupTables()).isEqualTo(3);
        assertThat(band.numberOfLookupEntries()).isEqualTo(256);
        assertThat(band.lookup(0, 7)).isEqualTo(200);
        assertThat(band.lookupTable(0)[7]).isEqualTo((byte) 200);
        assertThat(BandInfo.of(" M ").representation()).isEqualTo("M");
        assertThat(BandInfo.of("M").numberOfLookupEntries()).isZero();
        assertThatThrownBy(() -> BandInfo.ofPalette(new byte[256], new byte[255], new byte[256]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
