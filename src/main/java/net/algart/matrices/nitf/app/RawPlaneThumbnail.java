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
import net.algart.matrices.nitf.NitfTools;
import net.algart.matrices.nitf.PixelValueType;
import net.algart.matrices.nitf.mosaic.SensorGeometry;
import net.algart.matrices.nitf.pipeline.FailurePolicy;
import net.algart.matrices.nitf.pipeline.OutputMode;
import net.algart.matrices.nitf.pipeline.SegmentSource;
import net.algart.matrices.nitf.pipeline.ThumbnailPipeline;
import net.algart.matrices.nitf.segments.BandInfo;
import net.algart.matrices.nitf.segments.RawPlane;
import net.algart.matrices.nitf.segments.SegmentDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Makes thumbnails of raw image segment data: every file contains uncompressed pixels of one segment,
 * the layout of the pixels is specified in the command line.
 */
public class RawPlaneThumbnail {
    int size = NitfTools.DEFAULT_THUMBNAIL_SIZE;
    int brightness = 0;
    float contrast = 0.0f;
    boolean individual = false;
    boolean bestEffort = false;
    boolean memoryMapping = false;
    SensorGeometry geometry = null;
    Path outputFolder = Paths.get(".");
    String prefix = null;
    byte[] palette = null;
    int[] blocks = null;
    // - blocksPerRow, blocksPerColumn, pixelsPerBlockHorizontal, pixelsPerBlockVertical

    public static void main(String[] args) throws IOException {
        doMain(args, true);
    }

    /**
     * Executes the command.
     *
     * @param args       command-line arguments.
     * @param printUsage whether to print the usage message if there are not enough arguments.
     * @return list of written files or {@code null} if there are not enough arguments.
     * @throws IOException in a case of I/O error or if the data cannot be rendered.
     */
    public static List<Path> doMain(String[] args, boolean printUsage) throws IOException {
        final RawPlaneThumbnail thumbnail = new RawPlaneThumbnail();
        int startArgIndex = 0;
        while (args.length > startArgIndex && args[startArgIndex].startsWith("-")) {
            final String arg = args[startArgIndex];
            final String lower = arg.toLowerCase(Locale.ROOT);
            if (lower.startsWith("-size=")) {
                thumbnail.size = Integer.parseInt(value(arg));
            } else if (lower.startsWith("-brightness=")) {
                thumbnail.brightness = Integer.parseInt(value(arg));
            } else if (lower.startsWith("-contrast=")) {
                thumbnail.contrast = Float.parseFloat(value(arg));
            } else if (lower.equals("-individual")) {
                thumbnail.individual = true;
            } else if (lower.equals("-besteffort")) {
                thumbnail.bestEffort = true;
            } else if (lower.equals("-mmap")) {
                thumbnail.memoryMapping = true;
            } else if (lower.startsWith("-output=")) {
                thumbnail.outputFolder = Paths.get(value(arg));
            } else if (lower.startsWith("-prefix=")) {
                thumbnail.prefix = value(arg);
            } else if (lower.startsWith("-palette=")) {
                thumbnail.palette = Files.readAllBytes(Paths.get(value(arg)));
            } else if (lower.startsWith("-blocks=")) {
                thumbnail.blocks = parseIntegers(value(arg), 4, "-blocks");
            } else if (lower.startsWith("-geometry=")) {
                final double[] g = parseDoubles(value(arg), 4, "-geometry");
                thumbnail.geometry = SensorGeometry.ofDegrees(g[0], g[1], g[2], g[3]);
            } else {
                throw new IllegalArgumentException("Unknown option " + arg);
            }
            startArgIndex++;
        }
        if (args.length < startArgIndex + 4) {
            if (printUsage) {
                printUsage();
            }
            return null;
        }
        final ImageRepresentation representation = ImageRepresentation.ofCode(args[startArgIndex++]);
        final String rows = args[startArgIndex++];
        final int columns = Integer.parseInt(args[startArgIndex++]);
        final List<Path> files = new ArrayList<>();
        for (String file : Arrays.asList(args).subList(startArgIndex, args.length)) {
            files.add(Paths.get(file));
        }
        return thumbnail.makeThumbnails(representation, rows, columns, files);
    }

    public List<Path> makeThumbnails(
            ImageRepresentation representation,
            String rows,
            int columns,
            List<Path> files) throws IOException {
        final List<SegmentSource> sources = new ArrayList<>();
        for (int k = 0; k < files.size(); k++) {
            final Path file = files.get(k);
            final long fileLength = Files.size(file);
            final SegmentDescriptor descriptor = descriptor(k, representation, rows, columns, fileLength);
            System.out.printf("Reading %s: %s%n", file, descriptor);
            final RawPlane plane = memoryMapping ?
                    RawPlane.map(file, 0, fileLength) :
                    RawPlane.read(file, 0, fileLength);
            sources.add(SegmentSource.of(descriptor, plane));
        }
        final ThumbnailPipeline pipeline = new ThumbnailPipeline()
                .setSize(size)
                .setBrightness(brightness)
                .setContrast(contrast)
                .setOutputMode(individual ? OutputMode.PER_SEGMENT : OutputMode.AUTO)
                .setFailurePolicy(bestEffort ? FailurePolicy.BEST_EFFORT : FailurePolicy.FAIL_FAST)
                .setSensorGeometry(geometry);
        final String stem = prefix != null ? prefix : stem(files.get(0));
        final List<Path> result = pipeline.write(sources, outputFolder, stem);
        for (Path file : result) {
            System.out.printf("Written %s%n", file);
        }
        return result;
    }

    SegmentDescriptor descriptor(
            int segmentIndex,
            ImageRepresentation representation,
            String rows,
            int columns,
            long fileLength) {
        final SegmentDescriptor.Builder builder = SegmentDescriptor.newBuilder()
                .setSegmentIndex(segmentIndex)
                .setRepresentation(representation);
        final int bytesPerPixel;
        switch (representation) {
            case RGB -> {
                builder.setNumberOfBands(3);
                bytesPerPixel = 3;
            }
            case RGB_LUT -> {
                if (palette == null) {
                    throw new IllegalArgumentException("RGB/LUT representation requires -palette option");
                }
                if (palette.length < 768) {
                    throw new IllegalArgumentException("Palette file must contain 768 bytes " +
                            "(256 red, 256 green, 256 blue), but it contains " + palette.length + " bytes");
                }
                builder.addBand(BandInfo.ofPalette(
                        Arrays.copyOfRange(palette, 0, 256),
                        Arrays.copyOfRange(palette, 256, 512),
                        Arrays.copyOfRange(palette, 512, 768)));
                bytesPerPixel = 1;
            }
            case NODISPLY -> {
                builder.setPixelValueType(PixelValueType.C).setBitsPerPixel(64);
                bytesPerPixel = 8;
            }
            default -> bytesPerPixel = 1;
        }
        final int numberOfRows;
        if (rows.equalsIgnoreCase("auto")) {
            final long rowLength = (long) columns * bytesPerPixel;
            if (rowLength == 0 || fileLength / rowLength > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Cannot detect number of rows for " + columns +
                        " columns and " + fileLength + " bytes");
            }
            numberOfRows = (int) (fileLength / rowLength);
        } else {
            numberOfRows = Integer.parseInt(rows);
        }
        builder.setDimensions(numberOfRows, columns);
        if (blocks != null) {
            builder.setBlocks(blocks[0], blocks[1]).setPixelsPerBlock(blocks[2], blocks[3]);
        }
        return builder.build();
    }

    static String stem(Path file) {
        final String name = file.getFileName().toString();
        final int p = name.lastIndexOf('.');
        return p > 0 ? name.substring(0, p) : name;
    }

    private static String value(String option) {
        return option.substring(option.indexOf('=') + 1);
    }

    private static int[] parseIntegers(String s, int count, String option) {
        final String[] values = s.split("[,x]");
        if (values.length != count) {
            throw new IllegalArgumentException(option + " requires " + count + " values: " + s);
        }
        final int[] result = new int[count];
        for (int k = 0; k < count; k++) {
            result[k] = Integer.parseInt(values[k].trim());
        }
        return result;
    }

    private static double[] parseDoubles(String s, int count, String option) {
        final String[] values = s.split(",");
        if (values.length != count) {
            throw new IllegalArgumentException(option + " requires " + count + " values: " + s);
        }
        final double[] result = new double[count];
        for (int k = 0; k < count; k++) {
            result[k] = Double.parseDouble(values[k].trim());
        }
        return result;
    }

    private static void printUsage() {
        System.out.printf("Usage:%n    %s [-size=N] [-brightness=B] [-contrast=C] [-individual] [-bestEffort] " +
                        "[-mmap] [-output=folder] [-prefix=name] [-palette=palette.bin] " +
                        "[-blocks=perRow,perColumn,width,height] " +
                        "[-geometry=rowSpacing,columnSpacing,grazeDegrees,twistDegrees] " +
                        "MONO|RGB|RGB/LUT|NODISPLY rows|auto columns file1 [file2 ...]%n",
                RawPlaneThumbnail.class.getSimpleName());
        System.out.println("""
                Every file contains uncompressed pixels of one image segment: 8-bit samples \
                (MONO, RGB pixel-interleaved, RGB/LUT indexes) or pairs of big-endian 32-bit floats (NODISPLY).
                The thumbnail contains approximately size^2 pixels (default 256^2).
                Several NODISPLY files are stacked into one mosaic; other multi-segment products are written
                as GIF animation, or as separate PNG images with -individual option.
                -palette file contains 768 bytes: 256 red, 256 green, 256 blue lookup values.
                -bestEffort skips segments that cannot be rendered instead of stopping.
                -mmap maps the files into memory instead of reading them.""");
    }
}
