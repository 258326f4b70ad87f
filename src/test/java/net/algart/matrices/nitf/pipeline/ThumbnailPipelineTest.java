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

import net.algart.matrices.nitf.ImageRepresentation;
import net.algart.matrices.nitf.NitfException;
import net.algart.matrices.nitf.PixelValueType;
import net.algart.matrices.nitf.UnsupportedNitfFormatException;
import net.algart.matrices.nitf.UnsupportedRepresentationException;
import net.algart.matrices.nitf.awt.RasterEncoder;
import net.algart.matrices.nitf.mosaic.SensorGeometry;
import net.algart.matrices.nitf.raster.RgbaRaster;
import net.algart.matrices.nitf.remap.DensityRemap;
import net.algart.matrices.nitf.remap.RemapCalibration;
import net.algart.matrices.nitf.segments.RawPlane;
import net.algart.matrices.nitf.segments.SegmentDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThumbnailPipelineTest {

    @TempDir
    Path tempDir;

    private static SegmentSource mono(int segmentIndex, int rows, int columns, int value) {
        byte[] data = new byte[rows * columns];
        Arrays.fill(data, (byte) value);
        return SegmentSource.of(
                SegmentDescriptor.ofUnblocked(segmentIndex, ImageRepresentation.MONO, rows, columns, 1),
                RawPlane.wrap(data));
    }

    private static SegmentSource complex(int segmentIndex, int rows, int columns, float amplitude) {
        ByteBuffer buffer = ByteBuffer.allocate(rows * columns * 8);
        for (int k = 0; k < rows * columns; k++) {
            buffer.putFloat(amplitude).putFloat(0.0f);
        }
        SegmentDescriptor descriptor = SegmentDescriptor.newBuilder()
                .setSegmentIndex(segmentIndex)
                .setRepresentation(ImageRepresentation.NODISPLY)
                .setPixelValueType(PixelValueType.C)
                .setBitsPerPixel(64)
                .setDimensions(rows, columns)
                .build();
        return SegmentSource.of(descriptor, RawPlane.wrap(buffer.array()));
    }

    private static SegmentSource unsupported(int segmentIndex) {
        return SegmentSource.of(
                SegmentDescriptor.ofUnblocked(segmentIndex, ImageRepresentation.MULTI, 2, 2, 1),
                RawPlane.wrap(new byte[4]));
    }

    @Test
    void testSingleSegmentWritesStillImage() throws Exception {
        ThumbnailPipeline pipeline = new ThumbnailPipeline().setSize(8);
        Path folder = tempDir.resolve("out");
        List<Path> files = pipeline.write(List.of(mono(0, 2, 4, 90)), folder, "product");
        assertThat(files).containsExactly(folder.resolve("product_8.png"));
        BufferedImage image = ImageIO.read(files.get(0).toFile());
        // aspect 2: sqrt(2 * 64) = 11, 64 / 11 = 5
        assertThat(image.getWidth()).isEqualTo(11);
        assertThat(image.getHeight()).isEqualTo(5);
        assertThat(image.getRGB(3, 2)).isEqualTo(0xFF5A5A5A);
    }

    @Test
    void testSeveralSegmentsMakeAnimation() throws Exception {
        ThumbnailPipeline pipeline = new ThumbnailPipeline().setSize(4);
        List<SegmentSource> sources = List.of(mono(0, 4, 4, 10), mono(1, 4, 4, 200));
        assertThat(pipeline.resolveOutputMode(sources)).isEqualTo(OutputMode.ANIMATION);
        List<Path> files = pipeline.write(sources, tempDir, "movie");
        assertThat(files).containsExactly(tempDir.resolve("movie_4.gif"));
        assertThat(Files.size(files.get(0))).isPositive();
    }

    @Test
    void testPerSegmentFiles() throws Exception {
        ThumbnailPipeline pipeline = new ThumbnailPipeline()
                .setSize(4)
                .setOutputMode(OutputMode.PER_SEGMENT);
        List<Path> files = pipeline.write(List.of(mono(0, 4, 4, 10), mono(1, 4, 4, 200)), tempDir, "p");
        assertThat(files).containsExactly(tempDir.resolve("p_0_4.png"), tempDir.resolve("p_1_4.png"));
        assertThat(ImageIO.read(files.get(1).toFile()).getRGB(0, 0)).isEqualTo(0xFFC8C8C8);
    }

    @Test
    void testComplexSegmentsMakeMosaic() throws Exception {
        ThumbnailPipeline pipeline = new ThumbnailPipeline().setSize(8);
        List<SegmentSource> sources = List.of(complex(0, 2, 4, 1.0f), complex(1, 2, 4, 1.0f));
        assertThat(pipeline.resolveOutputMode(sources)).isEqualTo(OutputMode.SINGLE);
        List<Path> files = pipeline.write(sources, tempDir, "sar");
        assertThat(files).containsExactly(tempDir.resolve("sar_8.png"));
        BufferedImage image = ImageIO.read(files.get(0).toFile());
        assertThat(image.getWidth()).isEqualTo(8);
        assertThat(image.getHeight()).isEqualTo(8);
        int expected = DensityRemap.apply(RemapCalibration.ofMeanAmplitude(1.0), 1.0f, 0.0f);
        assertThat(image.getRGB(5, 6) & 0xFF).isEqualTo(expected);
    }

    @Test
    void testMosaicCalibrationIsCommon() throws Exception {
        ThumbnailPipeline pipeline = new ThumbnailPipeline().setSize(4);
        // mean amplitude: (8 * 3 + 8 * 1) / 16 = 2
        RgbaRaster thumbnail = pipeline.makeMosaicThumbnail(
                List.of(complex(0, 2, 4, 3.0f), complex(1, 2, 4, 1.0f)));
        RemapCalibration calibration = RemapCalibration.ofMeanAmplitude(2.0);
        assertThat(thumbnail.getRed(0, 0)).isEqualTo(DensityRemap.apply(calibration, 3.0f, 0.0f));
        assertThat(thumbnail.getRed(0, 3)).isEqualTo(DensityRemap.apply(calibration, 1.0f, 0.0f));
    }

    @Test
    void testSensorGeometryChangesMosaicProportions() throws Exception {
        List<SegmentSource> sources = List.of(complex(0, 4, 4, 1.0f), complex(1, 4, 4, 1.0f));
        RgbaRaster plain = new ThumbnailPipeline().setSize(11).makeMosaicThumbnail(sources);
        // 8x4 mosaic, aspect 0.5: sqrt(60.5) = 7, 121 / 7 = 17
        assertThat(plain.sizeX()).isEqualTo(7);
        assertThat(plain.sizeY()).isEqualTo(17);
        RgbaRaster corrected = new ThumbnailPipeline()
                .setSize(11)
                .setSensorGeometry(SensorGeometry.ofDegrees(1.0, 1.0, 60.0, 0.0))
                .makeMosaicThumbnail(sources);
        // column resolution is half of row resolution, aspect 0.25: sqrt(30.25) = 5, 121 / 5 = 24
        assertThat(corrected.sizeX()).isEqualTo(5);
        assertThat(corrected.sizeY()).isEqualTo(24);
    }

    @Test
    void testSingleComplexSegmentKeepsColumnsToRows() throws Exception {
        ThumbnailPipeline pipeline = new ThumbnailPipeline()
                .setSize(10)
                .setSensorGeometry(SensorGeometry.ofDegrees(1.0, 1.0, 60.0, 0.0));
        RgbaRaster thumbnail = pipeline.makeThumbnail(complex(0, 4, 4, 1.0f));
        assertThat(thumbnail.sizeX()).isEqualTo(10);
        assertThat(thumbnail.sizeY()).isEqualTo(10);
        RgbaRaster wide = pipeline.makeThumbnail(complex(1, 2, 8, 1.0f));
        // aspect 4: sqrt(400) = 20, 100 / 20 = 5
        assertThat(wide.sizeX()).isEqualTo(20);
        assertThat(wide.sizeY()).isEqualTo(5);
    }

    @Test
    void testBestEffortSkipsBadSegments() throws Exception {
        RecordingEncoder encoder = new RecordingEncoder();
        ThumbnailPipeline pipeline = new ThumbnailPipeline()
                .setSize(4)
                .setEncoder(encoder)
                .setFailurePolicy(FailurePolicy.BEST_EFFORT);
        List<SegmentSource> sources = List.of(mono(0, 4, 4, 1), unsupported(1), mono(2, 4, 4, 3));
        List<SegmentResult> results = pipeline.makeThumbnails(sources);
        assertThat(results).hasSize(3);
        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(1).isSuccess()).isFalse();
        assertThat(results.get(1).failure()).containsInstanceOf(UnsupportedRepresentationException.class);
        assertThatThrownBy(() -> results.get(1).thumbnail()).isInstanceOf(IllegalStateException.class);

        pipeline.write(sources, tempDir, "best");
        assertThat(encoder.animations).hasSize(1);
        assertThat(encoder.animations.get(0)).hasSize(2);
        assertThat(encoder.animations.get(0).get(1).getRed(0, 0)).isEqualTo(3);
    }

    @Test
    void testFailFastStopsAtFirstBadSegment() {
        RecordingEncoder encoder = new RecordingEncoder();
        ThumbnailPipeline pipeline = new ThumbnailPipeline().setSize(4).setEncoder(encoder);
        List<SegmentSource> sources = List.of(mono(0, 4, 4, 1), unsupported(1), mono(2, 4, 4, 3));
        assertThatThrownBy(() -> pipeline.write(sources, tempDir, "fast"))
                .isInstanceOfSatisfying(UnsupportedRepresentationException.class,
                        e -> assertThat(e.segmentIndex()).hasValue(1));
        assertThat(encoder.animations).isEmpty();
    }

    @Test
    void testNothingRendered() {
        ThumbnailPipeline pipeline = new ThumbnailPipeline()
                .setEncoder(new RecordingEncoder())
                .setFailurePolicy(FailurePolicy.BEST_EFFORT);
        assertThatThrownBy(() -> pipeline.write(List.of(unsupported(0), unsupported(1)), tempDir, "none"))
                .isInstanceOf(NitfException.class)
                .hasMessageContaining("None of 2");
    }

    @Test
    void testBrightnessAndContrast() throws Exception {
        ThumbnailPipeline pipeline = new ThumbnailPipeline().setSize(2).setBrightness(20);
        RgbaRaster thumbnail = pipeline.makeThumbnail(mono(0, 4, 4, 100));
        assertThat(thumbnail.getRed(1, 1)).isEqualTo(120);
        assertThat(thumbnail.getAlpha(1, 1)).isEqualTo(255);
        pipeline.setBrightness(0).setContrast(-50.0f);
        assertThat(pipeline.makeThumbnail(mono(0, 4, 4, 0)).getRed(0, 0)).isEqualTo(95);
    }

    @Test
    void testEmptySegment() {
        ThumbnailPipeline pipeline = new ThumbnailPipeline();
        assertThatThrownBy(() -> pipeline.makeThumbnail(mono(3, 0, 4, 0)))
                .isInstanceOfSatisfying(UnsupportedNitfFormatException.class,
                        e -> assertThat(e.segmentIndex()).hasValue(3));
        assertThatThrownBy(() -> pipeline.makeMosaicThumbnail(List.of(complex(0, 0, 4, 1.0f))))
                .isInstanceOf(UnsupportedNitfFormatException.class);
    }

    @Test
    void testResolveOutputMode() {
        ThumbnailPipeline pipeline = new ThumbnailPipeline();
        assertThat(pipeline.getOutputMode()).isEqualTo(OutputMode.AUTO);
        assertThat(pipeline.resolveOutputMode(List.of(mono(0, 1, 1, 0)))).isEqualTo(OutputMode.SINGLE);
        List<SegmentSource> mixed = List.of(mono(0, 1, 1, 0), complex(1, 1, 1, 1.0f));
        assertThat(pipeline.resolveOutputMode(mixed)).isEqualTo(OutputMode.ANIMATION);
        pipeline.setOutputMode(OutputMode.PER_SEGMENT);
        assertThat(pipeline.resolveOutputMode(mixed)).isEqualTo(OutputMode.PER_SEGMENT);
        assertThat(pipeline.resolveOutputMode(List.of(complex(0, 1, 1, 1.0f)))).isEqualTo(OutputMode.SINGLE);
    }

    @Test
    void testIllegalSettings() {
        ThumbnailPipeline pipeline = new ThumbnailPipeline();
        assertThat(pipeline.getSize()).isEqualTo(256);
        assertThatThrownBy(() -> pipeline.setSize(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pipeline.setSize(16385)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pipeline.setContrast(Float.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pipeline.write(List.of(), tempDir, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RecordingEncoder implements RasterEncoder {
        final List<RgbaRaster> stills = new ArrayList<>();
        final List<List<RgbaRaster>> animations = new ArrayList<>();

        @Override
        public void writeStill(Path file, RgbaRaster raster) {
            stills.add(raster);
        }

        @Override
        public void writeAnimation(Path file, List<RgbaRaster> frames) {
            animations.add(new ArrayList<>(frames));
        }

        @Override
        public String stillExtension() {
            return "png";
        }

        @Override
        public String animationExtension() {
            return "gif";
        }
    }
}
