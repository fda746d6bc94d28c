/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
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
package com.github.tinemuz.radctrl.geom;

/**
 * Reference ellipsoid of revolution given by its equatorial radius and
 * first eccentricity.
 *
 * @param a equatorial radius (meters)
 * @param e first eccentricity, in [0, 1)
 */
public record Ellipsoid(double a, double e) {

    /** WGS-84 reference ellipsoid. */
    public static final Ellipsoid WGS84 = new Ellipsoid(6378137.0, 0.0818191908426);

    /** Polar (minor) radius b = a * sqrt(1 - e^2). */
    public double b() {
        return a * Math.sqrt(1 - e * e);
    }

    /**
     * Prime vertical radius of curvature at a geodetic latitude.
     *
     * @param latDeg geodetic latitude (degrees)
     * @return N(lat) = a / sqrt(1 - e^2 sin^2(lat)) in meters
     */
    public double n(double latDeg) {
        double s = e * Math.sin(Math.toRadians(latDeg));
        return a / Math.sqrt(1 - s * s);
    }
}
