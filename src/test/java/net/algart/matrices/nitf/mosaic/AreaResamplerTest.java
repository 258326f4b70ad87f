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

import net.algart.matrices.nitf.raster.RgbaRaster;
import net.algart.matrices.nitf.remap.DensityRemap;
import net.algart.matrices.nitf.remap.RemapCalibration;
import net.algart.matrices.nitf.segments.RawPlane;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AreaResamplerTest {

    private static void checkUniform(int rows, int columns, int sizeX, int sizeY) throws Exception {
        MosaicIndex mosaic = new MosaicIndex(
                List.of(MosaicIndexTest.uniformPlane(rows * columns, 0.0f, 1.0f)), new int[]{rows}, columns);
        RemapCalibration calibration = RemapCalibration.ofMeanAmplitude(5.0);
        int expected = DensityRemap.apply(calibration, 0.0f, 1.0f);
        RgbaRaster result = AreaResampler.resample(mosaic, calibration, sizeX, sizeY);
        assertThat(result.sizeX()).isEqualTo(sizeX);
        assertThat(result.sizeY()).isEqualTo(sizeY);
        for (int y = 0; y < sizeY; y++) {
            for (int x = 0; x < sizeX; x++) {
                assertThat(result.getRed(x, y)).as("pixel (%d, %d)", x, y).isEqualTo(expected);
                assertThat(result.getAlpha(x, y)).isEqualTo(255);
            }
        }
    }

    @Test
    void testUniformDownsampling() throws Exception {
        checkUniform(8, 8, 2, 2);
        checkUniform(9, 7, 3, 2);
    }

    @Test
    void testUniformUpsampling() throws Exception {
        checkUniform(2, 2, 8, 8);
        checkUniform(3, 5, 11, 7);
    }

    @Test
    void testUniformMixedScales() throws Exception {
        checkUniform(2, 8, 2, 8);
        checkUniform(8, 2, 8, 2);
    }

    @Test
    void testAverageOfWholeSamples() throws Exception {
        ByteBuffer buffer = ByteBuffer.allocate(4 * 8);
        float[] amplitudes = {0.5f, 1.0f, 2.0f, 1.0f};
        for (float a : amplitudes) {
            buffer.putFloat(a).putFloat(0.0f);
        }
        MosaicIndex mosaic = new MosaicIndex(List.of(RawPlane.wrap(buffer.array())), new int[]{2}, 2);
        RemapCalibration calibration = RemapCalibration.ofMeanAmplitude(5.0);
        RgbaRaster result = AreaResampler.resample(mosaic, calibration, 1, 1);
        // 15, 85, 176, 85
        assertThat(result.getRed(0, 0)).isEqualTo((15 + 85 + 176 + 85) / 4);
    }

    private static MosaicIndex realPlane(int rows, int columns, float... amplitudes) {
        ByteBuffer buffer = ByteBuffer.allocate(amplitudes.length * 8);
        for (float a : amplitudes) {
            buffer.putFloat(a).putFloat(0.0f);
        }
        return new MosaicIndex(List.of(RawPlane.wrap(buffer.array())), new int[]{rows}, columns);
    }

    @Test
    void testRemappedLevels() throws Exception {
        RemapCalibration calibration = RemapCalibration.ofMeanAmplitude(5.0);
        assertThat(DensityRemap.apply(calibration, 0.5f, 0.0f)).isEqualTo(15);
        assertThat(DensityRemap.apply(calibration, 1.0f, 0.0f)).isEqualTo(85);
        assertThat(DensityRemap.apply(calibration, 2.0f, 0.0f)).isEqualTo(176);
    }

    @Test
    void testUpsamplingBlendsEachAxisWithItsOwnFraction() throws Exception {
        // remapped levels:
        //  15  85 176
        //  85 176  15
        // 176  15  85
        MosaicIndex mosaic = realPlane(3, 3,
                0.5f, 1.0f, 2.0f,
                1.0f, 2.0f, 0.5f,
                2.0f, 0.5f, 1.0f);
        // 3 -> 6 columns: pixel x=1 covers [0.5, 1.0), fraction 0.25;
        // 3 -> 12 rows: pixel y=1 covers [0.25, 0.5), fraction 0.375
        RgbaRaster result = AreaResampler.resample(mosaic, RemapCalibration.ofMeanAmplitude(5.0), 6, 12);
        assertThat(result.getRed(0, 0)).isEqualTo(15);
        // whole row 0, columns 1..2: 85 + 0.25 * (176 - 85) = 107.75
        assertThat(result.getRed(1, 0)).isEqualTo(107);
        // whole column 0, rows 1..2: 85 + 0.375 * (176 - 85) = 119.125
        assertThat(result.getRed(0, 1)).isEqualTo(119);
        // bilinear: 135.75 + 0.375 * (32.5 - 135.75) = 97.03125
        assertThat(result.getRed(1, 1)).isEqualTo(97);
        assertThat(result.getAlpha(1, 1)).isEqualTo(255);
    }

    @Test
    void testRowBlendAveragesWholeColumns() throws Exception {
        // rows 1..2 of remapped levels: 85 176 15 176 / 176 15 85 15
        MosaicIndex mosaic = realPlane(3, 4,
                0.5f, 1.0f, 2.0f, 1.0f,
                1.0f, 2.0f, 0.5f, 2.0f,
                2.0f, 0.5f, 1.0f, 0.5f);
        RgbaRaster result = AreaResampler.resample(mosaic, RemapCalibration.ofMeanAmplitude(5.0), 2, 12);
        // columns 2..3: row 1 average 95.5, row 2 average 50; 95.5 + 0.375 * (50 - 95.5) = 78.4375
        assertThat(result.getRed(1, 1)).isEqualTo(78);
    }

    @Test
    void testColumnBlendAveragesWholeRows() throws Exception {
        // rows 2..3 of remapped levels: 176 15 85 / 85 176 15
        MosaicIndex mosaic = realPlane(4, 3,
                0.5f, 1.0f, 2.0f,
                1.0f, 2.0f, 0.5f,
                2.0f, 0.5f, 1.0f,
                1.0f, 2.0f, 0.5f);
        RgbaRaster result = AreaResampler.resample(mosaic, RemapCalibration.ofMeanAmplitude(5.0), 6, 2);
        // rows 2..3: column 1 average 95.5, column 2 average 50; 95.5 + 0.25 * (50 - 95.5) = 84.125
        assertThat(result.getRed(1, 1)).isEqualTo(84);
    }

    @Test
    void testIllegalSizes() {
        MosaicIndex mosaic = new MosaicIndex(
                List.of(MosaicIndexTest.uniformPlane(4, 1.0f, 0.0f)), new int[]{2}, 2);
        assertThatThrownBy(() -> AreaResampler.resample(mosaic, RemapCalibration.ofMeanAmplitude(1.0), 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
