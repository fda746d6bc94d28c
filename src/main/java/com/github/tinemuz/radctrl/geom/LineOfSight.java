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

import static com.github.tinemuz.radctrl.geom.Trig.acosd;
import static com.github.tinemuz.radctrl.geom.Trig.atan2d;
import static com.github.tinemuz.radctrl.geom.Trig.cosd;
import static com.github.tinemuz.radctrl.geom.Trig.sind;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A direction scaled by a magnitude, in Cartesian or local spherical form.
 *
 * <p>The spherical form is defined in the local frame of the position it is
 * attached to: zenith angle from the local radial direction, azimuth
 * clockwise from north, and the norm as third component. Converting between
 * forms therefore needs that {@link Position} and its {@link Ellipsoid}.</p>
 */
public final class LineOfSight {
    // |lat| above 90 - POLE_TOLERANCE_DEG uses the polar frame
    static final double POLE_TOLERANCE_DEG = 1e-4;

    @FunctionalInterface
    private interface Conversion {
        double[] apply(double[] los, Position spherical);
    }

    private static final Map<LosType, Map<LosType, Conversion>> TABLE = new EnumMap<>(LosType.class);

    static {
        for (LosType t : LosType.values()) {
            Map<LosType, Conversion> row = new EnumMap<>(LosType.class);
            row.put(t, (l, p) -> l.clone());
            TABLE.put(t, row);
        }
        TABLE.get(LosType.CARTESIAN).put(LosType.SPHERICAL, LineOfSight::cartesianToSpherical);
        TABLE.get(LosType.SPHERICAL).put(LosType.CARTESIAN, LineOfSight::sphericalToCartesian);
    }

    private final LosType type;
    private final double c0;
    private final double c1;
    private final double c2;

    public LineOfSight(LosType type, double c0, double c1, double c2) {
        this.type = Objects.requireNonNull(type, "type");
        this.c0 = c0;
        this.c1 = c1;
        this.c2 = c2;
    }

    public static LineOfSight cartesian(double dx, double dy, double dz) {
        return new LineOfSight(LosType.CARTESIAN, dx, dy, dz);
    }

    public static LineOfSight spherical(double zenithDeg, double azimuthDeg, double dr) {
        return new LineOfSight(LosType.SPHERICAL, zenithDeg, azimuthDeg, dr);
    }

    public LosType type() {
        return type;
    }

    public double[] components() {
        return new double[] {c0, c1, c2};
    }

    public double dx() {
        require(LosType.CARTESIAN, "dx");
        return c0;
    }

    public double dy() {
        require(LosType.CARTESIAN, "dy");
        return c1;
    }

    public double dz() {
        require(LosType.CARTESIAN, "dz");
        return c2;
    }

    public double zenith() {
        require(LosType.SPHERICAL, "zenith");
        return c0;
    }

    public double azimuth() {
        require(LosType.SPHERICAL, "azimuth");
        return c1;
    }

    public double dr() {
        require(LosType.SPHERICAL, "dr");
        return c2;
    }

    public double norm() {
        if (type == LosType.SPHERICAL) return Math.abs(c2);
        return Trig.hypot(c0, c1, c2);
    }

    /** Same direction, magnitude multiplied by {@code k}. */
    public LineOfSight scale(double k) {
        if (type == LosType.SPHERICAL) return new LineOfSight(type, c0, c1, c2 * k);
        return new LineOfSight(type, c0 * k, c1 * k, c2 * k);
    }

    /** Opposite direction, same magnitude. */
    public LineOfSight negate() {
        if (type == LosType.SPHERICAL) {
            double az = (c1 + 180) % 360;
            return new LineOfSight(type, 180 - c0, az, c2);
        }
        return new LineOfSight(type, -c0, -c1, -c2);
    }

    /**
     * This vector as a Cartesian displacement.
     *
     * @throws UnsupportedOperationException for a spherical line of sight,
     *     which has no position-free Cartesian meaning
     */
    public Position asDisplacement() {
        if (type != LosType.CARTESIAN) {
            throw new UnsupportedOperationException(
                    "Displacement from a " + type + " line of sight is not yet supported");
        }
        return Position.cartesian(c0, c1, c2);
    }

    /**
     * Convert to another representation at the given position.
     *
     * @param target representation to convert to
     * @param at     position the line of sight is attached to
     * @param ell    ellipsoid of {@code at}
     */
    public LineOfSight to(LosType target, Position at, Ellipsoid ell) {
        if (target == type) return this;
        double[] out = TABLE.get(type).get(target).apply(components(), at.to(PositionType.SPHERICAL, ell));
        return new LineOfSight(target, out[0], out[1], out[2]);
    }

    private static double[] cartesianToSpherical(double[] l, Position p) {
        final double dx = l[0];
        final double dy = l[1];
        final double dz = l[2];
        final double norm = Trig.hypot(dx, dy, dz);
        if (Math.abs(p.lat()) > 90 - POLE_TOLERANCE_DEG) {
            double up = p.lat() > 0 ? dz : -dz;
            return new double[] {acosd(up / norm), atan2d(dy, dx), norm};
        }

        final double r = p.r();
        final double slat = sind(p.lat());
        final double clat = cosd(p.lat());
        final double slon = sind(p.lon());
        final double clon = cosd(p.lon());

        final double dr = (clat * clon * dx + slat * dz + clat * slon * dy) / norm;
        final double dlat = (-slat * clon * dx + clat * dz - slat * slon * dy) / (norm * r);
        final double dlon = (-slon / clat * dx + clon / clat * dy) / (norm * r);

        final double za = acosd(Math.max(-1, Math.min(1, dr)));
        double aa = acosd(r * dlat / sind(za));
        if (Double.isNaN(aa)) {
            // straight up or down, or rounding pushed the cosine past one
            aa = dlat >= 0 ? 0 : 180;
        } else if (dlon < 0) {
            aa = -aa;
        }
        return new double[] {za, aa, norm};
    }

    private static double[] sphericalToCartesian(double[] l, Position p) {
        final double norm = l[2];
        final double sza = sind(l[0]);
        final double cza = cosd(l[0]);
        final double saa = sind(l[1]);
        final double caa = cosd(l[1]);
        if (Math.abs(p.lat()) > 90 - POLE_TOLERANCE_DEG) {
            // longitude partials diverge at the pole
            return new double[] {
                norm * sza * caa, norm * sza * saa, norm * (p.lat() > 0 ? cza : -cza)
            };
        }

        final double slat = sind(p.lat());
        final double clat = cosd(p.lat());
        final double slon = sind(p.lon());
        final double clon = cosd(p.lon());

        final double dr = cza;
        final double dlat = sza * caa;
        final double dlon = sza * saa;

        return new double[] {
            norm * (clat * clon * dr - slat * clon * dlat - slon * dlon),
            norm * (clat * slon * dr - slat * slon * dlat + clon * dlon),
            norm * (slat * dr + clat * dlat)
        };
    }

    private void require(LosType expected, String component) {
        if (type != expected) {
            throw new IllegalStateException(
                    component + " is undefined for a " + type + " line of sight");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineOfSight)) return false;
        LineOfSight l = (LineOfSight) o;
        return type == l.type
                && Double.compare(c0, l.c0) == 0
                && Double.compare(c1, l.c1) == 0
                && Double.compare(c2, l.c2) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, c0, c1, c2);
    }

    @Override
    public String toString() {
        return type + Arrays.toString(components());
    }
}
