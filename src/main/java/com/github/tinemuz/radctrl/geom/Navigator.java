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

import com.github.tinemuz.radctrl.Constants;

/**
 * Moves navigation states along their line of sight.
 *
 * <p>Both stepping operations are pure: they return a new {@link Nav} and
 * never modify the input. Elapsed time is added to the position timestamp as
 * {@code |distance| / propagationSpeed}.</p>
 */
public final class Navigator {
    /** Roots closer to zero than this fraction of the shell radius count as zero. */
    static final double ROOT_TOLERANCE = 1e-9;

    private final double propagationSpeed;

    /** Navigator propagating at the speed of light in vacuum. */
    public Navigator() {
        this(Constants.SPEED_OF_LIGHT);
    }

    public Navigator(double propagationSpeed) {
        if (!(propagationSpeed > 0)) {
            throw new IllegalArgumentException(
                    "Propagation speed must be positive, got " + propagationSpeed);
        }
        this.propagationSpeed = propagationSpeed;
    }

    public double propagationSpeed() {
        return propagationSpeed;
    }

    /**
     * Advance by {@code distance} along the line of sight (negative moves
     * backward), stopping at the reference surface if it lies in between.
     */
    public Nav step(Nav nav, double distance) {
        double dist = distance;
        Intersection hit = intersect(nav, 0, dist >= 0);
        switch (hit.type()) {
            case FORWARD_OUTSIDE:
                if (dist > hit.minStep()) dist = hit.minStep();
                break;
            case FORWARD_INSIDE:
                if (dist > hit.maxStep()) dist = hit.maxStep();
                break;
            case BACKWARD_OUTSIDE:
                if (dist < hit.maxStep()) dist = hit.maxStep();
                break;
            case BACKWARD_INSIDE:
                if (dist < hit.minStep()) dist = hit.minStep();
                break;
            default:
                break;
        }
        return move(nav, dist);
    }

    /**
     * Move to the nearest crossing of the shell {@code altitude} meters above
     * the reference ellipsoid. A ray that never meets the shell is returned
     * unchanged.
     */
    public Nav stepToAltitude(Nav nav, double altitude) {
        Intersection hit = intersect(nav, altitude, true);
        if (hit.type() == MovingTarget.COMPLETE_MISS) return nav;
        double dist =
                Math.abs(hit.minStep()) < Math.abs(hit.maxStep()) ? hit.minStep() : hit.maxStep();
        if (Double.isNaN(dist)) return nav;
        return move(nav, dist);
    }

    /**
     * Intersect the ray with the ellipsoid grown by {@code altitude}.
     *
     * <p>Moving forward from outside, the first crossing is the smaller
     * root; from inside it is the larger one. Moving backward mirrors this.</p>
     *
     * @param altitude offset of the shell above the ellipsoid (meters)
     * @param forward  direction of travel along the line of sight
     */
    public Intersection intersect(Nav nav, double altitude, boolean forward) {
        final Position pos = nav.position();
        final LineOfSight los = nav.los();
        final double x0 = pos.x();
        final double y0 = pos.y();
        final double z0 = pos.z();
        final double dx = los.dx();
        final double dy = los.dy();
        final double dz = los.dz();
        final double a = nav.ellipsoid().a() + altitude;
        final double b = nav.ellipsoid().b() + altitude;
        final double a2 = a * a;
        final double b2 = b * b;

        final double cxz = dx * z0 - dz * x0;
        final double cyz = dy * z0 - dz * y0;
        final double cxy = dx * y0 - dy * x0;
        final double disc =
                a2 * a2 * dz * dz
                        + a2 * b2 * (dx * dx + dy * dy)
                        - a2 * (cxz * cxz + cyz * cyz)
                        - b2 * cxy * cxy;
        // a tangent ray touches the shell without crossing it
        if (!(disc > 0)) return Intersection.completeMiss();

        final double sqr = Math.sqrt(disc);
        final double term = -a2 * dz * z0 - b2 * dx * x0 - b2 * dy * y0;
        final double invden = 1 / (a2 * dz * dz + b2 * dx * dx + b2 * dy * dy);
        final double tolerance = ROOT_TOLERANCE * a / los.norm();
        final double t0 = snap((term + b * sqr) * invden, tolerance);
        final double t1 = snap((term - b * sqr) * invden, tolerance);
        final double lo = Math.min(t0, t1);
        final double hi = Math.max(t0, t1);

        if (forward) {
            if (hi <= 0) return new Intersection(MovingTarget.FORWARD_MISS, lo, hi);
            if (lo >= 0) return new Intersection(MovingTarget.FORWARD_OUTSIDE, lo, hi);
            return new Intersection(MovingTarget.FORWARD_INSIDE, lo, hi);
        } else {
            if (lo >= 0) return new Intersection(MovingTarget.BACKWARD_MISS, lo, hi);
            if (hi <= 0) return new Intersection(MovingTarget.BACKWARD_OUTSIDE, lo, hi);
            return new Intersection(MovingTarget.BACKWARD_INSIDE, lo, hi);
        }
    }

    private Nav move(Nav nav, double dist) {
        Ellipsoid ell = nav.ellipsoid();
        Position moved =
                nav.position()
                        .plus(nav.los().scale(dist).asDisplacement(), ell)
                        .plusTravel(dist, propagationSpeed);
        return new Nav(moved, nav.los(), ell);
    }

    private static double snap(double t, double tolerance) {
        return Math.abs(t) < tolerance ? 0 : t;
    }
}
