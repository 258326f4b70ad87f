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

import java.util.Objects;

/**
 * Per-band information of an image segment: band representation (IREPBAND),
 * subcategory (ISUBCAT) and optional lookup tables (LUTD).
 *
 * <p>This object is immutable: lookup tables are cloned while creation and while returning.</p>
 */
public final class BandInfo {
    private final String representation;
    private final String subcategory;
    private final byte[][] lookupTables;

    public BandInfo(String representation, String subcategory, byte[][] lookupTables) {
        this.representation = Objects.requireNonNull(representation, "Null band representation").trim();
        this.subcategory = Objects.requireNonNull(subcategory, "Null band subcategory").trim();
        Objects.requireNonNull(lookupTables, "Null lookup tables");
        this.lookupTables = new byte[lookupTables.length][];
        for (int k = 0; k < lookupTables.length; k++) {
            Objects.requireNonNull(lookupTables[k], "Null lookup table #" + k);
            if (lookupTables[k].length != lookupTables[0].length) {
                throw new IllegalArgumentException("Lookup tables of one band have different lengths: " +
                        "table #" + k + " contains " + lookupTables[k].length + " entries instead of " +
                        lookupTables[0].length);
            }
            this.lookupTables[k] = lookupTables[k].clone();
        }
    }

    public static BandInfo of(String representation) {
        return new BandInfo(representation, "", new byte[0][]);
    }

    /**
     * Creates a band, containing 3 lookup tables red, green, blue, as required for RGB/LUT segments.
     *
     * @param red   red lookup table.
     * @param green green lookup table.
     * @param blue  blue lookup table.
     * @return new band description with <code>"LU"</code> band representation.
     */
    public static BandInfo ofPalette(byte[] red, byte[] green, byte[] blue) {
        return new BandInfo("LU", "", new byte[][]{red, green, blue});
    }

    public String representation() {
        return representation;
    }

    public String subcategory() {
        return subcategory;
    }

    public int numberOfLookupTables() {
        return lookupTables.length;
    }

    /**
     * Returns the number of entries in every lookup table (NELUT), or 0 if there are no tables.
     *
     * @return number of entries.
     */
    public int numberOfLookupEntries() {
        return lookupTables.length == 0 ? 0 : lookupTables[0].length;
    }

    public byte[] lookupTable(int index) {
        return lookupTables[index].clone();
    }

    int lookup(int tableIndex, int entry) {
        return lookupTables[tableIndex][entry] & 0xFF;
    }

    @Override
    public String toString() {
        return "band " + (representation.isEmpty() ? "(no representation)" : representation) +
                (subcategory.isEmpty() ? "" : ", subcategory " + subcategory) +
                (lookupTables.length == 0 ? "" :
                        ", " + lookupTables.length + " lookup tables x " + numberOfLookupEntries() + " entries");
    }
}
