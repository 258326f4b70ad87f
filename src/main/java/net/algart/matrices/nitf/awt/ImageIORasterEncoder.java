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

package net.algart.matrices.nitf.awt;

import net.algart.matrices.nitf.raster.RgbaRaster;

import javax.imageio.IIOException;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * {@link RasterEncoder} based on the standard <code>javax.imageio</code> plugins:
 * PNG for still images and GIF with NETSCAPE2.0 looping extension for animations.
 */
public class ImageIORasterEncoder implements RasterEncoder {
    public static final String STILL_FORMAT = "png";
    public static final String ANIMATION_FORMAT = "gif";

    private static final System.Logger LOG = System.getLogger(ImageIORasterEncoder.class.getName());

    private static final String GIF_IMAGE_METADATA_FORMAT = "javax_imageio_gif_image_1.0";

    private int frameDelay = 0;

    public ImageIORasterEncoder() {
    }

    /**
     * Returns the delay between animation frames in hundredths of a second.
     * Default value is 0.
     *
     * @return frame delay.
     */
    public int getFrameDelay() {
        return frameDelay;
    }

    public ImageIORasterEncoder setFrameDelay(int frameDelay) {
        if (frameDelay < 0 || frameDelay > 0xFFFF) {
            throw new IllegalArgumentException("Frame delay " + frameDelay + " is out of range 0..65535");
        }
        this.frameDelay = frameDelay;
        return this;
    }

    @Override
    public void writeStill(Path file, RgbaRaster raster) throws IOException {
        Objects.requireNonNull(file, "Null file");
        Objects.requireNonNull(raster, "Null raster");
        final BufferedImage image = raster.toBufferedImage();
        final ImageWriter writer = getWriter(STILL_FORMAT);
        try (OutputStream out = Files.newOutputStream(file);
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            writer.write(image);
        } finally {
            writer.dispose();
        }
        LOG.log(System.Logger.Level.DEBUG, () -> "Written " + raster + " into " + file);
    }

    @Override
    public void writeAnimation(Path file, List<RgbaRaster> frames) throws IOException {
        Objects.requireNonNull(file, "Null file");
        Objects.requireNonNull(frames, "Null frames");
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("Empty list of animation frames");
        }
        final ImageWriter writer = getWriter(ANIMATION_FORMAT);
        try (OutputStream out = Files.newOutputStream(file);
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            final ImageWriteParam writeParam = writer.getDefaultWriteParam();
            writer.prepareWriteSequence(null);
            for (int k = 0, n = frames.size(); k < n; k++) {
                final RgbaRaster frame = Objects.requireNonNull(frames.get(k), "Null frame #" + k);
                final BufferedImage image = frame.toBufferedImage();
                final IIOMetadata metadata = writer.getDefaultImageMetadata(
                        ImageTypeSpecifier.createFromRenderedImage(image), writeParam);
                configureFrameMetadata(metadata, frameDelay, k == 0);
                writer.writeToSequence(new IIOImage(image, null, metadata), writeParam);
            }
            writer.endWriteSequence();
        } finally {
            writer.dispose();
        }
        LOG.log(System.Logger.Level.DEBUG, () -> "Written " + frames.size() + " frames into " + file);
    }

    @Override
    public String stillExtension() {
        return STILL_FORMAT;
    }

    @Override
    public String animationExtension() {
        return ANIMATION_FORMAT;
    }

    public static ImageWriter getWriter(String formatName) throws IIOException {
        Objects.requireNonNull(formatName, "Null format name");
        final Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName);
        if (!writers.hasNext()) {
            throw new IIOException("Cannot write " + formatName.toUpperCase() + ": no necessary registered plugin");
        }
        return writers.next();
    }

    private static void configureFrameMetadata(IIOMetadata metadata, int frameDelay, boolean firstFrame)
            throws IIOInvalidTreeException {
        final IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(GIF_IMAGE_METADATA_FORMAT);

        final IIOMetadataNode control = getOrCreateNode(root, "GraphicControlExtension");
        control.setAttribute("disposalMethod", "none");
        control.setAttribute("userInputFlag", "FALSE");
        control.setAttribute("transparentColorFlag", "FALSE");
        control.setAttribute("delayTime", Integer.toString(frameDelay));
        control.setAttribute("transparentColorIndex", "0");

        if (firstFrame) {
            final IIOMetadataNode extensions = getOrCreateNode(root, "ApplicationExtensions");
            final IIOMetadataNode loop = new IIOMetadataNode("ApplicationExtension");
            loop.setAttribute("applicationID", "NETSCAPE");
            loop.setAttribute("authenticationCode", "2.0");
            loop.setUserObject(new byte[]{0x1, 0x0, 0x0});
            // - sub-block 1, loop count 0 (little-endian): infinite looping
            extensions.appendChild(loop);
        }
        metadata.setFromTree(GIF_IMAGE_METADATA_FORMAT, root);
    }

    private static IIOMetadataNode getOrCreateNode(IIOMetadataNode root, String nodeName) {
        for (int i = 0; i < root.getLength(); i++) {
            if (root.item(i).getNodeName().equals(nodeName)) {
                return (IIOMetadataNode) root.item(i);
            }
        }
        final IIOMetadataNode node = new IIOMetadataNode(nodeName);
        root.appendChild(node);
        return node;
    }
}
