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

import java.util.Objects;

/**
 * Navigation state: a Cartesian position, a Cartesian line of sight and the
 * ellipsoid both refer to.
 *
 * <p>Whatever representation the inputs come in, they are collapsed into
 * this triple on construction. Instances are immutable; {@link Navigator}
 * produces new states from old ones.</p>
 */
public final class Nav {
    private final Position pos;
    private final LineOfSight los;
    private final Ellipsoid ell;

    public Nav(Position pos, LineOfSight los, Ellipsoid ell) {
        this.ell = Objects.requireNonNull(ell, "ell");
        this.pos = pos.to(PositionType.CARTESIAN, ell);
        this.los = los.to(LosType.CARTESIAN, pos, ell);
    }

    public Position position() {
        return pos;
    }

    public LineOfSight los() {
        return los;
    }

    public Ellipsoid ellipsoid() {
        return ell;
    }

    public double altitude() {
        return pos.altitude(ell);
    }

    /** Line of sight in the local spherical frame (zenith, azimuth, norm). */
    public LineOfSight localLos() {
        return los.to(LosType.SPHERICAL, pos, ell);
    }

    /** Same position and ellipsoid, looking the other way. */
    public Nav reversed() {
        return new Nav(pos, los.negate(), ell);
    }

    /** Cartesian distance between the positions of two states. */
    public double distanceTo(Nav other) {
        return Trig.hypot(
                other.pos.x() - pos.x(), other.pos.y() - pos.y(), other.pos.z() - pos.z());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Nav)) return false;
        Nav n = (Nav) o;
        return pos.equals(n.pos) && los.equals(n.los) && ell.equals(n.ell);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pos, los, ell);
    }

    @Override
    public String toString() {
        return "Nav{" + pos + ", " + los + ", " + ell + "}";
    }
}
