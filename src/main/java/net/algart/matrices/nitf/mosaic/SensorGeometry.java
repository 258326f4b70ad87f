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

package net.algart.matrices.nitf.mosaic;

/**
 * Collection geometry of a complex (SAR) image, necessary to display it with correct proportions:
 * sample spacings along rows and columns and grazing and twist angles (in radians).
 * Usually extracted from the image metadata by an external parser.
 */
public final class SensorGeometry {
    private final double rowSampleSpacing;
    private final double columnSampleSpacing;
    private final double grazingAngle;
    private final double twistAngle;

    private SensorGeometry(double rowSampleSpacing, double columnSampleSpacing, double grazingAngle,
                           double twistAngle) {
        this.rowSampleSpacing = checkFinite(rowSampleSpacing, "row sample spacing");
        this.columnSampleSpacing = checkFinite(columnSampleSpacing, "column sample spacing");
        this.grazingAngle = checkFinite(grazingAngle, "grazing angle");
        this.twistAngle = checkFinite(twistAngle, "twist angle");
    }

    public static SensorGeometry of(
            double rowSampleSpacing,
            double columnSampleSpacing,
            double grazingAngle,
            double twistAngle) {
        return new SensorGeometry(rowSampleSpacing, columnSampleSpacing, grazingAngle, twistAngle);
    }

    public static SensorGeometry ofDegrees(
            double rowSampleSpacing,
            double columnSampleSpacing,
            double grazingAngleInDegrees,
            double twistAngleInDegrees) {
        return new SensorGeometry(rowSampleSpacing, columnSampleSpacing,
                Math.toRadians(grazingAngleInDegrees), Math.toRadians(twistAngleInDegrees));
    }

    /**
     * Geometry with unit sample spacings and zero angles: display aspect is equal to the ratio
     * <code>columns/rows</code>.
     *
     * @return trivial geometry.
     */
    public static SensorGeometry unit() {
        return new SensorGeometry(1.0, 1.0, 0.0, 0.0);
    }

    public double rowSampleSpacing() {
        return rowSampleSpacing;
    }

    public double columnSampleSpacing() {
        return columnSampleSpacing;
    }

    public double grazingAngle() {
        return grazingAngle;
    }

    public double twistAngle() {
        return twistAngle;
    }

    /**
     * Returns <code>|rowSampleSpacing / cos(grazingAngle)|</code>.
     *
     * @return ground resolution along rows.
     */
    public double rowResolution() {
        return Math.abs(rowSampleSpacing / Math.cos(grazingAngle));
    }

    /**
     * Returns <code>sqrt((tan(graze)*tan(twist)*rowSampleSpacing)<sup>2</sup> +
     * (columnSampleSpacing/cos(twist))<sup>2</sup>)</code>.
     *
     * @return ground resolution along columns.
     */
    public double columnResolution() {
        final double a = Math.tan(grazingAngle) * Math.tan(twistAngle) * rowSampleSpacing;
        final double b = columnSampleSpacing / Math.cos(twistAngle);
        return Math.sqrt(a * a + b * b);
    }

    /**
     * Returns the aspect ratio (width / height) of the image with the given sizes, corrected
     * by the ground resolutions: <code>columns*columnResolution / (rows*rowResolution)</code>.
     *
     * @param rows    total number of rows.
     * @param columns number of columns.
     * @return display aspect ratio.
     * @throws IllegalArgumentException if the result is not a positive finite number.
     */
    public double displayAspect(long rows, long columns) {
        final double result = (columns * columnResolution()) / (rows * rowResolution());
        if (!(result > 0.0) || Double.isInfinite(result)) {
            throw new IllegalArgumentException("Cannot calculate display aspect ratio of " + columns + "x" + rows +
                    " image for " + this + ": the result " + result + " is not a positive finite number");
        }
        return result;
    }

    @Override
    public String toString() {
        return "sensor geometry: sample spacing " + rowSampleSpacing + " (rows), " + columnSampleSpacing +
                " (columns), grazing angle " + Math.toDegrees(grazingAngle) +
                " degrees, twist angle " + Math.toDegrees(twistAngle) + " degrees";
    }

    private static double checkFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Illegal " + name + " = " + value);
        }
        return value;
    }
}
