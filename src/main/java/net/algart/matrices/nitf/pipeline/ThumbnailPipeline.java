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
import net.algart.matrices.nitf.NitfTools;
import net.algart.matrices.nitf.UnsupportedNitfFormatException;
import net.algart.matrices.nitf.awt.ImageIORasterEncoder;
import net.algart.matrices.nitf.awt.RasterEncoder;
import net.algart.matrices.nitf.mosaic.AreaResampler;
import net.algart.matrices.nitf.mosaic.MosaicIndex;
import net.algart.matrices.nitf.mosaic.SensorGeometry;
import net.algart.matrices.nitf.raster.AreaAveragingScaler;
import net.algart.matrices.nitf.raster.RasterAdjustments;
import net.algart.matrices.nitf.raster.RgbaRaster;
import net.algart.matrices.nitf.raster.ThumbnailSize;
import net.algart.matrices.nitf.remap.DensityRemap;
import net.algart.matrices.nitf.remap.RemapCalibration;
import net.algart.matrices.nitf.segments.BlockDecoder;
import net.algart.matrices.nitf.segments.RawPlane;
import net.algart.matrices.nitf.segments.SegmentDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders image segments into thumbnails and writes them into image files.
 *
 * <p>Usual segments (MONO, RGB, RGB/LUT) are decoded by {@link BlockDecoder} and reduced by
 * {@link AreaAveragingScaler}, preserving the proportions of the significant area.
 * Complex (NODISPLY) segments are remapped by {@link DensityRemap} and reduced by {@link AreaResampler};
 * if all segments of the product are complex, they are stacked into one {@link MosaicIndex} with
 * common calibration, and the proportions are corrected by {@link SensorGeometry} (if it is specified).
 * Then the brightness and the contrast are adjusted (if non-zero).</p>
 *
 * <p>This class is not thread-safe, but the rendering itself is multithreading
 * (see {@link NitfTools#PARALLEL_EXECUTION}).</p>
 */
public final class ThumbnailPipeline {
    private static final System.Logger LOG = System.getLogger(ThumbnailPipeline.class.getName());
    private static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    private int size = NitfTools.DEFAULT_THUMBNAIL_SIZE;
    private int brightness = 0;
    private float contrast = 0.0f;
    private OutputMode outputMode = OutputMode.AUTO;
    private FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;
    private SensorGeometry sensorGeometry = null;
    private RasterEncoder encoder = new ImageIORasterEncoder();

    public ThumbnailPipeline() {
    }

    public int getSize() {
        return size;
    }

    /**
     * Sets the thumbnail size: every thumbnail will contain approximately <code>size<sup>2</sup></code> pixels.
     *
     * @param size new thumbnail size.
     * @return a reference to this object.
     */
    public ThumbnailPipeline setSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Zero or negative thumbnail size = " + size);
        }
        if (size > NitfTools.MAX_THUMBNAIL_SIZE) {
            throw new IllegalArgumentException("Too large thumbnail size = " + size +
                    " > " + NitfTools.MAX_THUMBNAIL_SIZE);
        }
        this.size = size;
        return this;
    }

    public int getBrightness() {
        return brightness;
    }

    public ThumbnailPipeline setBrightness(int brightness) {
        this.brightness = brightness;
        return this;
    }

    public float getContrast() {
        return contrast;
    }

    public ThumbnailPipeline setContrast(float contrast) {
        if (Float.isNaN(contrast)) {
            throw new IllegalArgumentException("Contrast is NaN");
        }
        this.contrast = contrast;
        return this;
    }

    public OutputMode getOutputMode() {
        return outputMode;
    }

    public ThumbnailPipeline setOutputMode(OutputMode outputMode) {
        this.outputMode = Objects.requireNonNull(outputMode, "Null output mode");
        return this;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public ThumbnailPipeline setFailurePolicy(FailurePolicy failurePolicy) {
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "Null failure policy");
        return this;
    }

    public SensorGeometry getSensorGeometry() {
        return sensorGeometry;
    }

    /**
     * Sets the collection geometry of complex segments, used to correct the proportions of the mosaic thumbnail
     * (see {@link #makeMosaicThumbnail(List)}). Thumbnails of single segments always preserve
     * <code>columns/rows</code>. May be {@code null}: then the mosaic aspect ratio is <code>columns/rows</code>.
     *
     * @param sensorGeometry new geometry; can be {@code null}.
     * @return a reference to this object.
     */
    public ThumbnailPipeline setSensorGeometry(SensorGeometry sensorGeometry) {
        this.sensorGeometry = sensorGeometry;
        return this;
    }

    public RasterEncoder getEncoder() {
        return encoder;
    }

    public ThumbnailPipeline setEncoder(RasterEncoder encoder) {
        this.encoder = Objects.requireNonNull(encoder, "Null encoder");
        return this;
    }

    /**
     * Renders one segment into the thumbnail, including brightness/contrast adjustment.
     *
     * @param source the segment.
     * @return the thumbnail.
     * @throws NitfException if the segment cannot be rendered.
     */
    public RgbaRaster makeThumbnail(SegmentSource source) throws NitfException {
        Objects.requireNonNull(source, "Null source");
        final SegmentDescriptor descriptor = source.descriptor();
        checkNotEmpty(descriptor);
        final long t1 = NitfTools.debugTime();
        final RgbaRaster result;
        if (descriptor.isComplex()) {
            MosaicIndex.checkComplexSegment(descriptor);
            final RawPlane plane = source.plane();
            final RemapCalibration calibration = DensityRemap.calibrate(
                    plane, descriptor.rows(), descriptor.columns(), descriptor.segmentIndex());
            final MosaicIndex mosaic = MosaicIndex.ofSegments(
                    Collections.singletonList(descriptor), Collections.singletonList(plane));
            result = resample(mosaic, calibration, aspect(descriptor));
        } else {
            final RgbaRaster raster = BlockDecoder.decode(descriptor, source.plane());
            result = AreaAveragingScaler.thumbnail(raster, aspect(descriptor), size);
        }
        adjust(result);
        if (NitfTools.BUILT_IN_TIMING) {
            final long t2 = NitfTools.debugTime();
            LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                    "%s rendered segment #%d into %dx%d thumbnail in %.3f ms",
                    getClass().getSimpleName(), descriptor.segmentIndex(),
                    result.sizeX(), result.sizeY(), (t2 - t1) * 1e-6));
        }
        return result;
    }

    /**
     * Stacks all segments, which must be complex, into one mosaic and renders it into the thumbnail.
     * The remap is calibrated once for the whole mosaic.
     *
     * @param sources the segments in the order of stacking (from top to bottom).
     * @return the thumbnail.
     * @throws NitfException if the segments cannot be rendered.
     */
    public RgbaRaster makeMosaicThumbnail(List<SegmentSource> sources) throws NitfException {
        Objects.requireNonNull(sources, "Null sources");
        final List<SegmentDescriptor> descriptors = new ArrayList<>();
        final List<RawPlane> planes = new ArrayList<>();
        for (SegmentSource source : sources) {
            Objects.requireNonNull(source, "Null source in the list");
            descriptors.add(source.descriptor());
            planes.add(source.plane());
        }
        final MosaicIndex mosaic = MosaicIndex.ofSegments(descriptors, planes);
        if (mosaic.totalRows() == 0) {
            throw new UnsupportedNitfFormatException("Empty mosaic: all " + sources.size() +
                    " image segments have zero rows");
        }
        if (LOGGABLE_DEBUG) {
            LOG.log(System.Logger.Level.DEBUG, "Rendering " + mosaic);
        }
        final RemapCalibration calibration = mosaic.calibrate();
        final SensorGeometry geometry = sensorGeometry != null ? sensorGeometry : SensorGeometry.unit();
        final double aspect = geometry.displayAspect(mosaic.totalRows(), mosaic.columns());
        if (LOGGABLE_DEBUG) {
            LOG.log(System.Logger.Level.DEBUG, String.format(Locale.US,
                    "Resolution %.5f x %.5f, aspect ratio %.5f",
                    geometry.rowResolution(), geometry.columnResolution(), aspect));
        }
        final RgbaRaster result = resample(mosaic, calibration, aspect);
        adjust(result);
        return result;
    }

    /**
     * Renders one segment, catching rendering problems.
     *
     * @param source the segment.
     * @return the thumbnail or the failure.
     */
    public SegmentResult segmentThumbnail(SegmentSource source) {
        Objects.requireNonNull(source, "Null source");
        try {
            return SegmentResult.success(source.segmentIndex(), makeThumbnail(source));
        } catch (NitfException e) {
            LOG.log(System.Logger.Level.WARNING, "Skipping image segment #" + source.segmentIndex() +
                    ": " + e.getMessage());
            return SegmentResult.failure(source.segmentIndex(), e);
        }
    }

    /**
     * Renders every segment separately according to the current {@link #getFailurePolicy() failure policy}.
     *
     * @param sources the segments.
     * @return results for all segments in the same order.
     * @throws NitfException in {@link FailurePolicy#FAIL_FAST} mode, if some segment cannot be rendered.
     */
    public List<SegmentResult> makeThumbnails(List<SegmentSource> sources) throws NitfException {
        Objects.requireNonNull(sources, "Null sources");
        final List<SegmentResult> results = new ArrayList<>();
        for (SegmentSource source : sources) {
            Objects.requireNonNull(source, "Null source in the list");
            if (failurePolicy == FailurePolicy.FAIL_FAST) {
                try {
                    results.add(SegmentResult.success(source.segmentIndex(), makeThumbnail(source)));
                } catch (NitfException e) {
                    LOG.log(System.Logger.Level.ERROR, e.getMessage());
                    throw e;
                }
            } else {
                results.add(segmentThumbnail(source));
            }
        }
        return results;
    }

    /**
     * Applies brightness and then contrast correction, if they are non-zero.
     *
     * @param raster the raster to correct (in place).
     * @return the same raster.
     */
    public RgbaRaster adjust(RgbaRaster raster) {
        Objects.requireNonNull(raster, "Null raster");
        if (brightness != 0) {
            LOG.log(System.Logger.Level.DEBUG, "Adjusting brightness");
            RasterAdjustments.brighten(raster, brightness);
        }
        if (contrast != 0.0f) {
            LOG.log(System.Logger.Level.DEBUG, "Adjusting contrast");
            RasterAdjustments.contrast(raster, contrast);
        }
        return raster;
    }

    /**
     * Returns the output mode, that will be really used for the given segments.
     * A single segment always produces a still image. {@link OutputMode#AUTO} is resolved to
     * {@link OutputMode#SINGLE}, if all segments are complex, or to {@link OutputMode#ANIMATION} in other case.
     *
     * @param sources the segments.
     * @return actual output mode (never {@link OutputMode#AUTO}).
     */
    public OutputMode resolveOutputMode(List<SegmentSource> sources) {
        Objects.requireNonNull(sources, "Null sources");
        if (sources.size() <= 1) {
            return OutputMode.SINGLE;
        }
        if (outputMode != OutputMode.AUTO) {
            return outputMode;
        }
        return allComplex(sources) ? OutputMode.SINGLE : OutputMode.ANIMATION;
    }

    /**
     * Renders the segments and writes the resulting image files into the given folder:
     * <code>stem_size.png</code> (still image), <code>stem_index_size.png</code> (image per segment)
     * or <code>stem_size.gif</code> (animation); the extensions are provided by the {@link #getEncoder() encoder}.
     *
     * @param sources the segments.
     * @param folder  output folder; created if it does not exist.
     * @param stem    beginning of the file names.
     * @return list of written files.
     * @throws IOException in a case of I/O error or if the segments cannot be rendered.
     */
    public List<Path> write(List<SegmentSource> sources, Path folder, String stem) throws IOException {
        Objects.requireNonNull(sources, "Null sources");
        Objects.requireNonNull(folder, "Null folder");
        Objects.requireNonNull(stem, "Null stem");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("No image segments to write");
        }
        Files.createDirectories(folder);
        final OutputMode mode = resolveOutputMode(sources);
        LOG.log(System.Logger.Level.DEBUG, () -> "Writing " + sources.size() + " segments in " + mode + " mode");
        final List<Path> result = new ArrayList<>();
        switch (mode) {
            case SINGLE -> {
                final RgbaRaster thumbnail = sources.size() > 1 && allComplex(sources) ?
                        makeMosaicThumbnail(sources) :
                        makeThumbnail(sources.get(0));
                final Path file = folder.resolve(stem + "_" + size + "." + encoder.stillExtension());
                encoder.writeStill(file, thumbnail);
                result.add(file);
            }
            case PER_SEGMENT -> {
                final List<SegmentResult> results = makeThumbnails(sources);
                for (int k = 0; k < results.size(); k++) {
                    final SegmentResult segmentResult = results.get(k);
                    if (segmentResult.isSuccess()) {
                        final Path file = folder.resolve(
                                stem + "_" + k + "_" + size + "." + encoder.stillExtension());
                        encoder.writeStill(file, segmentResult.thumbnail());
                        result.add(file);
                    }
                }
            }
            case ANIMATION -> {
                final List<RgbaRaster> frames = new ArrayList<>();
                for (SegmentResult segmentResult : makeThumbnails(sources)) {
                    if (segmentResult.isSuccess()) {
                        frames.add(segmentResult.thumbnail());
                    }
                }
                if (frames.isEmpty()) {
                    throw new NitfException("None of " + sources.size() + " image segments can be rendered");
                }
                final Path file = folder.resolve(stem + "_" + size + "." + encoder.animationExtension());
                encoder.writeAnimation(file, frames);
                result.add(file);
            }
            default -> throw new AssertionError("Unresolved output mode " + mode);
        }
        for (Path file : result) {
            LOG.log(System.Logger.Level.INFO, "Finished writing " + file);
        }
        return result;
    }

    @Override
    public String toString() {
        return "thumbnail pipeline: size " + size + ", brightness " + brightness + ", contrast " + contrast +
                ", " + outputMode + " output, " + failurePolicy + " policy" +
                (sensorGeometry != null ? ", " + sensorGeometry : "");
    }

    private RgbaRaster resample(MosaicIndex mosaic, RemapCalibration calibration, double aspect) {
        final ThumbnailSize thumbnailSize = ThumbnailSize.of(aspect, size);
        return AreaResampler.resample(mosaic, calibration, thumbnailSize.sizeX(), thumbnailSize.sizeY());
    }

    private static double aspect(SegmentDescriptor descriptor) {
        return (double) descriptor.columns() / (double) descriptor.rows();
    }

    private static boolean allComplex(List<SegmentSource> sources) {
        for (SegmentSource source : sources) {
            if (!source.descriptor().isComplex()) {
                return false;
            }
        }
        return true;
    }

    private static void checkNotEmpty(SegmentDescriptor descriptor) throws NitfException {
        if (descriptor.rows() == 0 || descriptor.columns() == 0) {
            throw new UnsupportedNitfFormatException(descriptor.segmentIndex(),
                    "empty image " + descriptor.columns() + "x" + descriptor.rows());
        }
    }
}
