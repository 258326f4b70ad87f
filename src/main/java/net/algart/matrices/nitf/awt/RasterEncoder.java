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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writer of the resulting rasters into image files.
 */
public interface RasterEncoder {
    /**
     * Writes a single still image.
     *
     * @param file   resulting file.
     * @param raster image to write.
     * @throws IOException in a case of I/O error.
     */
    void writeStill(Path file, RgbaRaster raster) throws IOException;

    /**
     * Writes an infinitely looping animation: frames are shown in the order of the list.
     * Frames may have different sizes.
     *
     * @param file   resulting file.
     * @param frames animation frames; must not be empty.
     * @throws IOException in a case of I/O error.
     */
    void writeAnimation(Path file, List<RgbaRaster> frames) throws IOException;

    /**
     * Returns the file extension for still images, for example, <code>"png"</code>.
     *
     * @return extension without dot.
     */
    String stillExtension();

    String animationExtension();
}
