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
 * Pixel value type (PVTYPE field of the image subheader).
 */
public enum PixelValueType {
    INT("INT", "integer"),
    B("B", "bi-level"),
    SI("SI", "signed integer"),
    R("R", "real"),
    C("C", "complex");

    private final String code;
    private final String prettyName;

    PixelValueType(String code, String prettyName) {
        this.code = code;
        this.prettyName = prettyName;
    }

    public String code() {
        return code;
    }

    public String prettyName() {
        return prettyName;
    }

    public boolean isComplex() {
        return this == C;
    }

    public static PixelValueType ofCode(String code) {
        Objects.requireNonNull(code, "Null pixel value type code");
        return fromCode(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown pixel value type: \"" + code + "\""));
    }

    public static Optional<PixelValueType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        final String trimmed = code.trim();
        for (PixelValueType type : values()) {
            if (type.code.equalsIgnoreCase(trimmed)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
