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
package com.github.tinemuz.radctrl.absorption;

import com.github.tinemuz.radctrl.Constants;
import org.apache.commons.math3.fraction.Fraction;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Zeeman splitting of a rotational transition between an upper state
 * {@code Ju} and a lower state {@code Jl}.
 *
 * <p>Sublines of one polarization class are indexed {@code 0 .. count-1}
 * by their upper-state magnetic quantum number, starting at
 * {@link #start}. The caller must pass a valid transition
 * ({@code |Ju - Jl| <= 1}, not both zero); this is not checked.</p>
 *
 * @param gu Landé factor of the upper state
 * @param gl Landé factor of the lower state
 */
public record Zeeman(double gu, double gl) {
    private static final double HZ_PER_TESLA = Constants.BOHR_MAGNETON / Constants.PLANCK;

    public static final Zeeman NONE = new Zeeman(0, 0);

    /** Change of M from the upper to the lower state. */
    public static int dM(Polarization type) {
        switch (type) {
            case SIGMA_MINUS:
                return -1;
            case SIGMA_PLUS:
                return 1;
            default:
                return 0;
        }
    }

    /** First upper-state M of the class. */
    public static Fraction start(Fraction ju, Fraction jl, Polarization type) {
        switch (type) {
            case SIGMA_MINUS: {
                int cmp = ju.compareTo(jl);
                Fraction first = ju.negate();
                return cmp < 0 ? first : cmp == 0 ? first.add(1) : first.add(2);
            }
            case PI:
                return min(ju, jl).negate();
            case SIGMA_PLUS:
                return ju.negate();
            default:
                return Fraction.ZERO;
        }
    }

    /** Last upper-state M of the class, inclusive. */
    public static Fraction end(Fraction ju, Fraction jl, Polarization type) {
        switch (type) {
            case SIGMA_MINUS:
                return ju;
            case PI:
                return min(ju, jl);
            case SIGMA_PLUS: {
                int cmp = ju.compareTo(jl);
                return cmp < 0 ? ju : cmp == 0 ? ju.subtract(1) : ju.subtract(2);
            }
            default:
                return Fraction.ZERO;
        }
    }

    /** Number of sublines in the class. */
    public static int count(Fraction ju, Fraction jl, Polarization type) {
        return end(ju, jl, type).subtract(start(ju, jl, type)).intValue() + 1;
    }

    public static Fraction mu(Fraction ju, Fraction jl, Polarization type, int n) {
        return start(ju, jl, type).add(n);
    }

    public static Fraction ml(Fraction ju, Fraction jl, Polarization type, int n) {
        return mu(ju, jl, type, n).add(dM(type));
    }

    /**
     * Share of the unsplit line strength that the class carries, times three:
     * the class weight in the propagation matrix is this factor over 3.
     */
    public static double polarizationFactor(Polarization type) {
        switch (type) {
            case SIGMA_MINUS:
            case SIGMA_PLUS:
                return 0.75;
            case PI:
                return 1.5;
            default:
                return 1.0;
        }
    }

    /** Relative strength of subline {@code n}; sums to 1 over each class. */
    public double strength(Fraction ju, Fraction jl, Polarization type, int n) {
        if (type == Polarization.NONE) return 1.0;
        Fraction ml = ml(ju, jl, type, n);
        Fraction mu = mu(ju, jl, type, n);
        Fraction dm = new Fraction(dM(type));
        double w = Wigner.threeJ(jl, Fraction.ONE, ju, ml, dm.negate(), mu.negate());
        return 3 * w * w;
    }

    /** Frequency shift of subline {@code n} per unit field (Hz/T). */
    public double splitting(Fraction ju, Fraction jl, Polarization type, int n) {
        return HZ_PER_TESLA
                * (ml(ju, jl, type, n).doubleValue() * gl - mu(ju, jl, type, n).doubleValue() * gu);
    }

    /**
     * Angles between a magnetic field and a line of sight.
     *
     * @param u  field towards east
     * @param v  field towards north
     * @param w  field upwards
     * @param za zenith angle of the line of sight (degrees)
     * @param aa azimuth of the line of sight, east of north (degrees)
     * @return {@code theta}, the field to sight angle, and {@code eta}, the
     *     rotation of the field projection about the sight (degrees);
     *     both zero without a field
     */
    public static Angles angles(double u, double v, double w, double za, double aa) {
        if (u == 0 && v == 0 && w == 0) {
            return new Angles(0, 0);
        }
        double z = Math.toRadians(za);
        double a = Math.toRadians(aa);
        Vector3D n = new Vector3D(Math.cos(a) * Math.sin(z), Math.sin(a) * Math.sin(z), Math.cos(z));
        Vector3D ev = new Vector3D(Math.cos(a) * Math.cos(z), Math.sin(a) * Math.cos(z), -Math.sin(z));
        // local x is north, y is east
        Vector3D nH = new Vector3D(v, u, w).normalize();
        Vector3D inplane = nH.subtract(nH.dotProduct(n), n);

        double cosTheta = Math.max(-1, Math.min(1, n.dotProduct(nH)));
        double eta = Math.atan2(ev.dotProduct(inplane), ev.crossProduct(inplane).dotProduct(n));
        return new Angles(Math.toDegrees(Math.acos(cosTheta)), Math.toDegrees(eta));
    }

    private static Fraction min(Fraction x, Fraction y) {
        return x.compareTo(y) <= 0 ? x : y;
    }

    /** Field geometry of a Zeeman calculation, in degrees. */
    public record Angles(double theta, double eta) {}
}
