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

package net.algart.matrices.nitf;

import java.util.Objects;
import java.util.Optional;

/**
 * Image representation (IREP field of the image subheader): the way how the bands
 * of the image segment should be interpreted for display.
 *
 * <p>Only {@link #MONO}, {@link #RGB} and {@link #RGB_LUT} are decoded by the block decoder;
 * {@link #NODISPLY} segments with complex samples are rendered via amplitude remapping.
 * Other values are recognized but reported as unsupported.</p>
 */
public enum ImageRepresentation {
    /**
     * Monochrome: one band, the sample is a gray intensity.
     */
    MONO("MONO"),
    /**
     * Three bands: red, green, blue.
     */
    RGB("RGB"),
    /**
     * One band, every sample is an index in three 256-entry lookup tables (red, green, blue).
     */
    RGB_LUT("RGB/LUT"),
    MULTI("MULTI"),
    /**
     * Data not intended for direct display, for example, complex SAR samples (SICD).
     */
    NODISPLY("NODISPLY"),
    NVECTOR("NVECTOR"),
    POLAR("POLAR"),
    VPH("VPH"),
    YCBCR601("YCbCr601");

    private final String code;

    ImageRepresentation(String code) {
        this.code = code;
    }

    /**
     * Returns the value of the IREP field, for example, <code>"RGB/LUT"</code>.
     *
     * @return string code of this representation.
     */
    public String code() {
        return code;
    }

    public boolean isBlockDecodable() {
        return this == MONO || this == RGB || this == RGB_LUT;
    }

    public boolean isNoDisplay() {
        return this == NODISPLY;
    }

    public static ImageRepresentation ofCode(String code) {
        Objects.requireNonNull(code, "Null representation code");
        return fromCode(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown image representation: \"" + code + "\""));
    }

    /**
     * Returns an {@link Optional} containing the representation with the given {@link #code()}
     * (case-insensitive, leading/trailing spaces ignored, as in the fixed-width header field).
     * Also accepts the name of the enum constant.
     *
     * @param code IREP value; may be {@code null}.
     * @return an optional representation.
     */
    public static Optional<ImageRepresentation> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        final String trimmed = code.trim();
        for (ImageRepresentation representation : values()) {
            if (representation.code.equalsIgnoreCase(trimmed) || representation.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(representation);
            }
        }
        return Optional.empty();
    }
}
