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

package net.algart.matrices.nitf.raster;

import net.algart.arrays.Matrix;
import net.algart.arrays.UpdatableByteArray;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RgbaRasterTest {

    @Test
    void testPixelAccess() {
        RgbaRaster raster = RgbaRaster.newRaster(3, 2);
        assertThat(raster.getARGB(2, 1)).isZero();
        raster.setPixel(2, 1, 10, 20, 30, 40);
        assertThat(raster.getRed(2, 1)).isEqualTo(10);
        assertThat(raster.getGreen(2, 1)).isEqualTo(20);
        assertThat(raster.getBlue(2, 1)).isEqualTo(30);
        assertThat(raster.getAlpha(2, 1)).isEqualTo(40);
        assertThat(raster.offset(2, 1)).isEqualTo(20);
        raster.setPixel(0, 0, 0x1FF, -1, 256, 0x180);
        assertThat(raster.getARGB(0, 0)).isEqualTo(0x80FFFF00);
        assertThatThrownBy(() -> raster.setPixel(0, 2, 1, 1, 1, 1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> raster.getRed(3, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> raster.getRed(0, -1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testGray() {
        RgbaRaster raster = RgbaRaster.ofGray(2, 1, new byte[]{7, (byte) 255});
        assertThat(raster.data()).containsExactly(7, 7, 7, -1, -1, -1, -1, -1);
        assertThatThrownBy(() -> RgbaRaster.ofGray(2, 2, new byte[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testWrapRequiresExactLength() {
        byte[] data = new byte[8];
        RgbaRaster raster = RgbaRaster.wrap(2, 1, data);
        data[4] = 99;
        assertThat(raster.getRed(1, 0)).isEqualTo(99);
        assertThatThrownBy(() -> RgbaRaster.wrap(2, 2, data)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbaRaster.newRaster(-1, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCopyIsIndependent() {
        RgbaRaster raster = RgbaRaster.newRaster(1, 1);
        RgbaRaster copy = raster.copy();
        copy.setPixel(0, 0, 1, 2, 3, 4);
        assertThat(raster.getARGB(0, 0)).isZero();
        assertThat(copy.getARGB(0, 0)).isEqualTo(0x04010203);
    }

    @Test
    void testBufferedImageConversion() {
        RgbaRaster raster = RgbaRaster.newRaster(2, 2);
        raster.setPixel(0, 0, 255, 0, 0, 255);
        raster.setPixel(1, 0, 0, 128, 0, 255);
        raster.setPixel(0, 1, 1, 2, 3, 0);
        raster.setPixel(1, 1, 200, 100, 50, 128);
        BufferedImage image = raster.toBufferedImage();
        assertThat(image.getType()).isEqualTo(BufferedImage.TYPE_INT_ARGB);
        assertThat(image.getRGB(0, 0)).isEqualTo(0xFFFF0000);
        assertThat(image.getRGB(1, 1)).isEqualTo(0x80C86432);
        RgbaRaster back = RgbaRaster.fromBufferedImage(image);
        assertThat(back.data()).isEqualTo(raster.data());
    }

    @Test
    void testMatrixView() {
        RgbaRaster raster = RgbaRaster.newRaster(3, 2);
        raster.setPixel(2, 1, 10, 20, 30, 40);
        Matrix<UpdatableByteArray> matrix = raster.asMatrix();
        assertThat(matrix.dim(0)).isEqualTo(4);
        assertThat(matrix.dim(1)).isEqualTo(3);
        assertThat(matrix.dim(2)).isEqualTo(2);
        assertThat(matrix.array().getDouble(matrix.index(1, 2, 1))).isEqualTo(20.0);
        assertThat(matrix.array().getDouble(matrix.index(3, 2, 1))).isEqualTo(40.0);
        matrix.array().setDouble(matrix.index(0, 0, 0), 77.0);
        assertThat(raster.getRed(0, 0)).isEqualTo(77);
    }
}
