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

import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.SimpleMemoryModel;
import net.algart.arrays.UpdatableByteArray;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.Objects;

/**
 * 8-bit RGBA image: interleaved array of bytes R, G, B, A, R, G, B, A, ...,
 * rows follow each other from top to bottom.
 *
 * <p>This class is not thread-safe, but several threads may write <b>different</b> pixels simultaneously.</p>
 */
public final class RgbaRaster {
    public static final int NUMBER_OF_CHANNELS = 4;

    private final int sizeX;
    private final int sizeY;
    private final byte[] data;

    private RgbaRaster(int sizeX, int sizeY, byte[] data) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.data = data;
    }

    /**
     * Creates new raster, filled by zero: all pixels are transparent black.
     *
     * @param sizeX width.
     * @param sizeY height.
     * @return new raster.
     */
    public static RgbaRaster newRaster(int sizeX, int sizeY) {
        return new RgbaRaster(sizeX, sizeY, new byte[checkSizes(sizeX, sizeY)]);
    }

    public static RgbaRaster wrap(int sizeX, int sizeY, byte[] data) {
        Objects.requireNonNull(data, "Null data");
        final int length = checkSizes(sizeX, sizeY);
        if (data.length != length) {
            throw new IllegalArgumentException("Data array length " + data.length +
                    " does not match " + sizeX + "x" + sizeY + " RGBA raster (" + length + " bytes)");
        }
        return new RgbaRaster(sizeX, sizeY, data);
    }

    /**
     * Creates opaque raster, where R=G=B are equal to the given gray values.
     *
     * @param sizeX width.
     * @param sizeY height.
     * @param gray  gray intensities, <code>sizeX * sizeY</code> elements.
     * @return new raster.
     */
    public static RgbaRaster ofGray(int sizeX, int sizeY, byte[] gray) {
        Objects.requireNonNull(gray, "Null gray");
        final RgbaRaster result = newRaster(sizeX, sizeY);
        if (gray.length != sizeX * sizeY) {
            throw new IllegalArgumentException("Gray array length " + gray.length +
                    " does not match " + sizeX + "x" + sizeY);
        }
        final byte[] data = result.data;
        for (int i = 0, disp = 0; i < gray.length; i++, disp += NUMBER_OF_CHANNELS) {
            data[disp] = gray[i];
            data[disp + 1] = gray[i];
            data[disp + 2] = gray[i];
            data[disp + 3] = (byte) 255;
        }
        return result;
    }

    public static RgbaRaster fromBufferedImage(BufferedImage image) {
        Objects.requireNonNull(image, "Null image");
        final RgbaRaster result = newRaster(image.getWidth(), image.getHeight());
        for (int y = 0; y < result.sizeY; y++) {
            for (int x = 0; x < result.sizeX; x++) {
                final int argb = image.getRGB(x, y);
                result.setPixel(x, y, argb >>> 16, argb >>> 8, argb, argb >>> 24);
            }
        }
        return result;
    }

    public int sizeX() {
        return sizeX;
    }

    public int sizeY() {
        return sizeY;
    }

    public int numberOfPixels() {
        return sizeX * sizeY;
    }

    /**
     * Returns the internal data array: changes in it are reflected in this raster.
     *
     * @return interleaved RGBA bytes.
     */
    public byte[] data() {
        return data;
    }

    public int offset(int x, int y) {
        checkCoordinates(x, y);
        return (y * sizeX + x) * NUMBER_OF_CHANNELS;
    }

    /**
     * Sets the pixel; only 8 low bits of every component are used.
     *
     * @param x x-coordinate of the pixel.
     * @param y y-coordinate of the pixel.
     * @param r red component.
     * @param g green component.
     * @param b blue component.
     * @param a alpha component (255 means opaque).
     * @throws IndexOutOfBoundsException if the pixel is out of this raster.
     */
    public void setPixel(int x, int y, int r, int g, int b, int a) {
        final int disp = offset(x, y);
        data[disp] = (byte) r;
        data[disp + 1] = (byte) g;
        data[disp + 2] = (byte) b;
        data[disp + 3] = (byte) a;
    }

    public int getRed(int x, int y) {
        return data[offset(x, y)] & 0xFF;
    }

    public int getGreen(int x, int y) {
        return data[offset(x, y) + 1] & 0xFF;
    }

    public int getBlue(int x, int y) {
        return data[offset(x, y) + 2] & 0xFF;
    }

    public int getAlpha(int x, int y) {
        return data[offset(x, y) + 3] & 0xFF;
    }

    public int getARGB(int x, int y) {
        final int disp = offset(x, y);
        return (data[disp + 3] & 0xFF) << 24
                | (data[disp] & 0xFF) << 16
                | (data[disp + 1] & 0xFF) << 8
                | (data[disp + 2] & 0xFF);
    }

    public RgbaRaster copy() {
        return new RgbaRaster(sizeX, sizeY, data.clone());
    }

    /**
     * Returns a view of this raster as AlgART 3-dimensional matrix <code>4 x sizeX x sizeY</code>:
     * the first coordinate is the channel index. The matrix is backed by the same data array.
     *
     * @return matrix view of this raster.
     */
    public Matrix<UpdatableByteArray> asMatrix() {
        return Matrices.matrix(SimpleMemoryModel.asUpdatableByteArray(data), NUMBER_OF_CHANNELS, sizeX, sizeY);
    }

    public BufferedImage toBufferedImage() {
        final BufferedImage result = new BufferedImage(sizeX, sizeY, BufferedImage.TYPE_INT_ARGB);
        final int[] pixels = ((DataBufferInt) result.getRaster().getDataBuffer()).getData();
        for (int i = 0, disp = 0; i < pixels.length; i++, disp += NUMBER_OF_CHANNELS) {
            pixels[i] = (data[disp + 3] & 0xFF) << 24
                    | (data[disp] & 0xFF) << 16
                    | (data[disp + 1] & 0xFF) << 8
                    | (data[disp + 2] & 0xFF);
        }
        return result;
    }

    @Override
    public String toString() {
        return "RGBA raster " + sizeX + "x" + sizeY;
    }

    private void checkCoordinates(int x, int y) {
        if (x < 0 || x >= sizeX || y < 0 || y >= sizeY) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is out of raster " +
                    sizeX + "x" + sizeY);
        }
    }

    private static int checkSizes(int sizeX, int sizeY) {
        if (sizeX < 0) {
            throw new IllegalArgumentException("Negative sizeX = " + sizeX);
        }
        if (sizeY < 0) {
            throw new IllegalArgumentException("Negative sizeY = " + sizeY);
        }
        final long length = (long) sizeX * (long) sizeY * NUMBER_OF_CHANNELS;
        if (length > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large RGBA raster " + sizeX + "x" + sizeY +
                    " (>= 2^31 bytes)");
        }
        return (int) length;
    }
}
