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
package com.github.tinemuz.radctrl.path;

import java.time.Instant;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/** Magnetic field along a path, in the local (u east, v north, w up) frame. */
@FunctionalInterface
public interface MagneticFieldProvider {

    /** No field anywhere; lines are not Zeeman split. */
    MagneticFieldProvider NONE = (lat, lon, alt, time) -> Vector3D.ZERO;

    /**
     * @param latDeg   geodetic latitude (degrees)
     * @param lonDeg   longitude (degrees)
     * @param altitude height above the ellipsoid (meters)
     * @param time     time of evaluation
     * @return field in tesla
     */
    Vector3D fieldAt(double latDeg, double lonDeg, double altitude, Instant time);
}
