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

import static com.github.tinemuz.radctrl.geom.Trig.asind;
import static com.github.tinemuz.radctrl.geom.Trig.atan2d;
import static com.github.tinemuz.radctrl.geom.Trig.cosd;
import static com.github.tinemuz.radctrl.geom.Trig.hypot;
import static com.github.tinemuz.radctrl.geom.Trig.sind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Pairwise position conversions, looked up by (from, to).
 *
 * <p>Every pair of {@link PositionType} values has an entry. Spherical and
 * ellipsoidal coordinates have no direct formula between them and go through
 * Cartesian coordinates.</p>
 */
final class PositionConversions {

    @FunctionalInterface
    interface Conversion {
        double[] apply(double[] from, Ellipsoid ell);
    }

    private static final Map<PositionType, Map<PositionType, Conversion>> TABLE =
            new EnumMap<>(PositionType.class);

    static {
        for (PositionType t : PositionType.values()) {
            Map<PositionType, Conversion> row = new EnumMap<>(PositionType.class);
            row.put(t, (p, ell) -> p.clone());
            TABLE.put(t, row);
        }
        TABLE.get(PositionType.SPHERICAL).put(PositionType.CARTESIAN, PositionConversions::sphericalToCartesian);
        TABLE.get(PositionType.ELLIPSOIDAL).put(PositionType.CARTESIAN, PositionConversions::ellipsoidalToCartesian);
        TABLE.get(PositionType.CARTESIAN).put(PositionType.SPHERICAL, PositionConversions::cartesianToSpherical);
        TABLE.get(PositionType.CARTESIAN).put(PositionType.ELLIPSOIDAL, PositionConversions::cartesianToEllipsoidal);
        TABLE.get(PositionType.SPHERICAL)
                .put(PositionType.ELLIPSOIDAL,
                        (p, ell) -> cartesianToEllipsoidal(sphericalToCartesian(p, ell), ell));
        TABLE.get(PositionType.ELLIPSOIDAL)
                .put(PositionType.SPHERICAL,
                        (p, ell) -> cartesianToSpherical(ellipsoidalToCartesian(p, ell), ell));
    }

    private PositionConversions() {}

    static double[] convert(PositionType from, PositionType to, double[] p, Ellipsoid ell) {
        return TABLE.get(from).get(to).apply(p, ell);
    }

    static double[] sphericalToCartesian(double[] p, Ellipsoid ell) {
        double r = p[0];
        double lat = p[1];
        double lon = p[2];
        return new double[] {
            r * cosd(lat) * cosd(lon), r * cosd(lat) * sind(lon), r * sind(lat)
        };
    }

    static double[] ellipsoidalToCartesian(double[] p, Ellipsoid ell) {
        double h = p[0];
        double lat = p[1];
        double lon = p[2];
        double n = ell.n(lat);
        double e2 = ell.e() * ell.e();
        return new double[] {
            (n + h) * cosd(lon) * cosd(lat),
            (n + h) * sind(lon) * cosd(lat),
            (n * (1 - e2) + h) * sind(lat)
        };
    }

    static double[] cartesianToSpherical(double[] p, Ellipsoid ell) {
        double r = hypot(p[0], p[1], p[2]);
        return new double[] {r, asind(p[2] / r), atan2d(p[1], p[0])};
    }

    /**
     * Closed-form geodetic inversion after Zeng, "Explicitly computing
     * geodetic coordinates from Cartesian coordinates", EPS 65, 291-296
     * (2013). Points on the polar axis are handled by two explicit branches:
     * the centre maps to the equatorial antipode, everything else to a pole.
     */
    static double[] cartesianToEllipsoidal(double[] p, Ellipsoid ell) {
        final double x = p[0];
        final double y = p[1];
        final double z = p[2];
        final double a = ell.a();
        final double e = ell.e();
        final double b = ell.b();
        final double axisTolerance = 1 / a;
        final double minorAxisTolerance = 1 / b;

        if (Math.abs(x) > axisTolerance || Math.abs(y) > axisTolerance) {
            final double e2 = e * e;
            final double e4 = e2 * e2;
            final double dz = Math.sqrt(1 - e2) * z;
            final double r = Math.hypot(x, y);
            final double a2 = a * a;
            final double b2 = b * b;
            final double e2p = (a2 - b2) / b2;
            final double f = 54 * b2 * z * z;
            final double g = r * r + dz * dz - e2 * (a2 - b2);
            final double c = e4 * f * r * r / (g * g * g);
            final double s = Math.cbrt(1 + c + Math.sqrt(c * c + 2 * c));
            final double k = s + 1 / s + 1;
            final double fp = f / (3 * k * k * g * g);
            final double q = Math.sqrt(1 + 2 * e4 * fp);
            final double r0 =
                    (-fp * e2 * r) / (1 + q)
                            + Math.sqrt(
                                    0.5 * a2 * (1 + 1 / q)
                                            - fp * dz * dz / (q * (1 + q))
                                            - 0.5 * fp * r * r);
            final double u = Math.hypot(r - e2 * r0, z);
            final double v = Math.hypot(r - e2 * r0, dz);
            final double z0 = b2 * z / (a * v);
            return new double[] {
                u * (1 - b2 / (a * v)), atan2d(z + e2p * z0, r), atan2d(y, x)
            };
        } else if (Math.abs(z) < minorAxisTolerance) {
            return new double[] {-a, 0, 180};
        } else {
            return new double[] {Math.abs(z) - b, z < 0 ? -90 : 90, 0};
        }
    }
}
