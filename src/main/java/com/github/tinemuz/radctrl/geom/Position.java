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

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A timestamped point in space in one of three coordinate representations.
 *
 * <p>The three components are interpreted strictly according to the
 * {@link PositionType}: {@code x, y, z} for Cartesian, {@code r, lat, lon}
 * for spherical and {@code h, lat, lon} for ellipsoidal coordinates. Asking a
 * position for a component of another representation throws
 * {@link IllegalStateException}; use {@link #to(PositionType, Ellipsoid)}
 * first.</p>
 *
 * <p>Instances are immutable.</p>
 */
public final class Position {
    private final PositionType type;
    private final Instant time;
    private final double c0;
    private final double c1;
    private final double c2;

    public Position(PositionType type, Instant time, double c0, double c1, double c2) {
        this.type = Objects.requireNonNull(type, "type");
        this.time = Objects.requireNonNull(time, "time");
        this.c0 = c0;
        this.c1 = c1;
        this.c2 = c2;
    }

    public static Position cartesian(double x, double y, double z) {
        return new Position(PositionType.CARTESIAN, Instant.EPOCH, x, y, z);
    }

    public static Position cartesian(Instant time, double x, double y, double z) {
        return new Position(PositionType.CARTESIAN, time, x, y, z);
    }

    public static Position spherical(double r, double latDeg, double lonDeg) {
        return new Position(PositionType.SPHERICAL, Instant.EPOCH, r, latDeg, lonDeg);
    }

    public static Position spherical(Instant time, double r, double latDeg, double lonDeg) {
        return new Position(PositionType.SPHERICAL, time, r, latDeg, lonDeg);
    }

    public static Position ellipsoidal(double h, double latDeg, double lonDeg) {
        return new Position(PositionType.ELLIPSOIDAL, Instant.EPOCH, h, latDeg, lonDeg);
    }

    public static Position ellipsoidal(Instant time, double h, double latDeg, double lonDeg) {
        return new Position(PositionType.ELLIPSOIDAL, time, h, latDeg, lonDeg);
    }

    public PositionType type() {
        return type;
    }

    public Instant time() {
        return time;
    }

    /** Raw components in representation order. */
    public double[] components() {
        return new double[] {c0, c1, c2};
    }

    public double x() {
        require(PositionType.CARTESIAN, "x");
        return c0;
    }

    public double y() {
        require(PositionType.CARTESIAN, "y");
        return c1;
    }

    public double z() {
        require(PositionType.CARTESIAN, "z");
        return c2;
    }

    public double r() {
        require(PositionType.SPHERICAL, "r");
        return c0;
    }

    public double h() {
        require(PositionType.ELLIPSOIDAL, "h");
        return c0;
    }

    public double lat() {
        if (type == PositionType.CARTESIAN) {
            throw new IllegalStateException("lat is undefined for a CARTESIAN position");
        }
        return c1;
    }

    public double lon() {
        if (type == PositionType.CARTESIAN) {
            throw new IllegalStateException("lon is undefined for a CARTESIAN position");
        }
        return c2;
    }

    /**
     * Convert to another representation. The timestamp is carried over.
     *
     * @param target representation to convert to
     * @param ell    ellipsoid the ellipsoidal representation refers to
     * @return this position expressed in {@code target} coordinates
     */
    public Position to(PositionType target, Ellipsoid ell) {
        if (target == type) return this;
        double[] out = PositionConversions.convert(type, target, components(), ell);
        return new Position(target, time, out[0], out[1], out[2]);
    }

    /**
     * Vector sum of this position and {@code offset}, both taken as Cartesian,
     * returned in this position's representation with this position's time.
     */
    public Position plus(Position offset, Ellipsoid ell) {
        Position a = to(PositionType.CARTESIAN, ell);
        Position b = offset.to(PositionType.CARTESIAN, ell);
        Position sum =
                new Position(
                        PositionType.CARTESIAN, time, a.c0 + b.c0, a.c1 + b.c1, a.c2 + b.c2);
        return sum.to(type, ell);
    }

    /** Same position, timestamp advanced by the time light at {@code speed} needs for {@code distance}. */
    public Position plusTravel(double distance, double speed) {
        long nanos = Math.round(Math.abs(distance / speed) * 1e9);
        return withTime(time.plus(Duration.ofNanos(nanos)));
    }

    public Position withTime(Instant newTime) {
        return new Position(type, newTime, c0, c1, c2);
    }

    /** Height above the ellipsoid (meters). */
    public double altitude(Ellipsoid ell) {
        return to(PositionType.ELLIPSOIDAL, ell).c0;
    }

    private void require(PositionType expected, String component) {
        if (type != expected) {
            throw new IllegalStateException(
                    component + " is undefined for a " + type + " position");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position p = (Position) o;
        return type == p.type
                && time.equals(p.time)
                && Double.compare(c0, p.c0) == 0
                && Double.compare(c1, p.c1) == 0
                && Double.compare(c2, p.c2) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, time, c0, c1, c2);
    }

    @Override
    public String toString() {
        return type + "@" + time + Arrays.toString(components());
    }
}
