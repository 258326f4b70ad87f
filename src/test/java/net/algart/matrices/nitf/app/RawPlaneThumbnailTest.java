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

package net.algart.matrices.nitf.app;

import net.algart.matrices.nitf.ImageRepresentation;
import net.algart.matrices.nitf.segments.SegmentDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RawPlaneThumbnailTest {

    @TempDir
    Path tempDir;

    private Path monoFile(String name, int length, int value) throws Exception {
        byte[] data = new byte[length];
        Arrays.fill(data, (byte) value);
        return Files.write(tempDir.resolve(name), data);
    }

    @Test
    void testMonoThumbnail() throws Exception {
        Path file = monoFile("plane.raw", 16, 77);
        Path output = tempDir.resolve("thumbnails");
        List<Path> result = RawPlaneThumbnail.doMain(new String[]{
                "-size=8", "-output=" + output, "MONO", "4", "4", file.toString()}, false);
        assertThat(result).containsExactly(output.resolve("plane_8.png"));
        BufferedImage image = ImageIO.read(result.get(0).toFile());
        assertThat(image.getWidth()).isEqualTo(8);
        assertThat(image.getHeight()).isEqualTo(8);
        assertThat(image.getRGB(7, 7)).isEqualTo(0xFF4D4D4D);
    }

    @Test
    void testMemoryMappingAndPrefix() throws Exception {
        Path file = monoFile("plane.raw", 16, 10);
        List<Path> result = RawPlaneThumbnail.doMain(new String[]{
                "-mmap", "-size=4", "-brightness=5", "-prefix=mapped", "-output=" + tempDir,
                "MONO", "auto", "4", file.toString()}, false);
        assertThat(result).containsExactly(tempDir.resolve("mapped_4.png"));
        assertThat(ImageIO.read(result.get(0).toFile()).getRGB(0, 0)).isEqualTo(0xFF0F0F0F);
    }

    @Test
    void testIndividualFiles() throws Exception {
        Path first = monoFile("a.raw", 16, 1);
        Path second = monoFile("b.raw", 16, 2);
        List<Path> result = RawPlaneThumbnail.doMain(new String[]{
                "-individual", "-size=4", "-output=" + tempDir, "MONO", "4", "4",
                first.toString(), second.toString()}, false);
        assertThat(result).containsExactly(tempDir.resolve("a_0_4.png"), tempDir.resolve("a_1_4.png"));
    }

    @Test
    void testComplexWithAutomaticRows() throws Exception {
        ByteBuffer buffer = ByteBuffer.allocate(6 * 8);
        for (int k = 0; k < 6; k++) {
            buffer.putFloat(3.0f).putFloat(4.0f);
        }
        Path file = Files.write(tempDir.resolve("sar.cplx"), buffer.array());
        RawPlaneThumbnail thumbnail = new RawPlaneThumbnail();
        SegmentDescriptor descriptor = thumbnail.descriptor(0, ImageRepresentation.NODISPLY, "auto", 3, 48);
        assertThat(descriptor.rows()).isEqualTo(2);
        assertThat(descriptor.bitsPerPixel()).isEqualTo(64);
        assertThat(descriptor.isComplex()).isTrue();
        List<Path> result = RawPlaneThumbnail.doMain(new String[]{
                "-size=6", "-geometry=1,1,0,0", "-output=" + tempDir, "NODISPLY", "auto", "3", file.toString()},
                false);
        assertThat(result).containsExactly(tempDir.resolve("sar_6.png"));
    }

    @Test
    void testBlockedLayout() throws Exception {
        RawPlaneThumbnail thumbnail = new RawPlaneThumbnail();
        thumbnail.blocks = new int[]{2, 2, 2, 2};
        SegmentDescriptor descriptor = thumbnail.descriptor(1, ImageRepresentation.MONO, "3", 3, 16);
        assertThat(descriptor.isBlocked()).isTrue();
        assertThat(descriptor.rasterSizeX()).isEqualTo(4);
    }

    @Test
    void testPaletteIsRequired() {
        RawPlaneThumbnail thumbnail = new RawPlaneThumbnail();
        assertThatThrownBy(() -> thumbnail.descriptor(0, ImageRepresentation.RGB_LUT, "1", 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        thumbnail.palette = new byte[768];
        assertThat(thumbnail.descriptor(0, ImageRepresentation.RGB_LUT, "1", 1, 1).bands()).hasSize(1);
    }

    @Test
    void testArguments() throws Exception {
        assertThat(RawPlaneThumbnail.doMain(new String[]{"MONO", "4", "4"}, false)).isNull();
        assertThatThrownBy(() -> RawPlaneThumbnail.doMain(new String[]{"-unknown", "MONO", "1", "1", "x"}, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(RawPlaneThumbnail.stem(Paths.get("dir", "image.ntf.raw"))).isEqualTo("image.ntf");
        assertThat(RawPlaneThumbnail.stem(Paths.get(".hidden"))).isEqualTo(".hidden");
    }
}
