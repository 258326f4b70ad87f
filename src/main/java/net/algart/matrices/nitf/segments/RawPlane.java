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

import net.algart.arrays.TooLargeArrayException;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.handle.FileHandle;
import org.scijava.io.location.FileLocation;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Uncompressed pixel data of one image segment: read-only view of a sequence of bytes.
 *
 * <p>All access methods are absolute (they do not change any position) and check the bounds:
 * an attempt to read outside the plane leads to <code>IndexOutOfBoundsException</code>.
 * Multi-byte values are big-endian.
 * So, this object can be safely shared between several threads.</p>
 */
public final class RawPlane {
    private final ByteBuffer data;

    private RawPlane(ByteBuffer data) {
        this.data = data.slice().asReadOnlyBuffer().order(ByteOrder.BIG_ENDIAN);
    }

    public static RawPlane wrap(byte[] data) {
        Objects.requireNonNull(data, "Null data");
        return new RawPlane(ByteBuffer.wrap(data));
    }

    /**
     * Creates a view of the remaining bytes of the given buffer (between its position and limit).
     * The data are not copied: further changes in the buffer content will be visible in the plane.
     *
     * @param data the byte buffer.
     * @return new raw plane.
     */
    public static RawPlane wrap(ByteBuffer data) {
        Objects.requireNonNull(data, "Null data");
        return new RawPlane(data);
    }

    /**
     * Maps the specified region of the file into memory.
     *
     * @param file   the file containing image segment data.
     * @param offset position of the first byte of the segment data in the file.
     * @param length length of the segment data.
     * @return new raw plane.
     * @throws IOException           in a case of I/O error.
     * @throws TooLargeArrayException if <code>length &gt; Integer.MAX_VALUE</code>.
     */
    public static RawPlane map(Path file, long offset, long length) throws IOException {
        Objects.requireNonNull(file, "Null file");
        checkRange(offset, length);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            final long fileSize = channel.size();
            if (offset + length > fileSize) {
                throw new IOException("File " + file + " is too short (" + fileSize + " bytes) to map " +
                        length + " bytes at position " + offset);
            }
            return new RawPlane(channel.map(FileChannel.MapMode.READ_ONLY, offset, length));
        }
    }

    /**
     * Reads the specified region of the stream into memory.
     *
     * @param stream input stream.
     * @param offset position of the first byte of the segment data in the stream.
     * @param length length of the segment data.
     * @return new raw plane.
     * @throws IOException            in a case of I/O error, in particular, if the stream is exhausted.
     * @throws TooLargeArrayException if <code>length &gt; Integer.MAX_VALUE</code>.
     */
    public static RawPlane read(DataHandle<? extends Location> stream, long offset, long length)
            throws IOException {
        Objects.requireNonNull(stream, "Null stream");
        checkRange(offset, length);
        final byte[] data = new byte[(int) length];
        stream.seek(offset);
        final int result = length == 0 ? 0 : stream.read(data);
        if (result < data.length) {
            throw new IOException("Stream exhausted at " + offset +
                    ": loaded " + result + " bytes instead of " + data.length +
                    " (" + stream.get() + ")");
        }
        return wrap(data);
    }

    public static RawPlane read(Path file, long offset, long length) throws IOException {
        try (DataHandle<Location> stream = getFileHandle(file)) {
            return read(stream, offset, length);
        }
    }

    public int length() {
        return data.limit();
    }

    public int getUnsignedByte(int index) {
        return data.get(index) & 0xFF;
    }

    public float getFloat(int index) {
        return data.getFloat(index);
    }

    /**
     * Copies <code>length</code> bytes, starting from <code>index</code>, into the specified Java array.
     *
     * @param index      index of the first byte in this plane.
     * @param dest       destination array.
     * @param destOffset starting position in the destination array.
     * @param length     number of bytes to copy.
     */
    public void getBytes(int index, byte[] dest, int destOffset, int length) {
        Objects.requireNonNull(dest, "Null dest");
        Objects.checkFromIndexSize(index, length, data.limit());
        data.duplicate().position(index).get(dest, destOffset, length);
    }

    @Override
    public String toString() {
        return "raw plane " + data.limit() + " bytes" + (data.isDirect() ? " (direct)" : "");
    }

    @SuppressWarnings("rawtypes, unchecked")
    static DataHandle<Location> getFileHandle(Path file) {
        Objects.requireNonNull(file, "Null file");
        FileHandle fileHandle = new FileHandle(new FileLocation(file.toFile()));
        fileHandle.setLittleEndian(false);
        return (DataHandle) fileHandle;
    }

    private static void checkRange(long offset, long length) {
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offset = " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Negative length = " + length);
        }
        if (length > Integer.MAX_VALUE) {
            throw new TooLargeArrayException("Too large raw plane: " + length + " bytes >= 2^31");
        }
    }
}
