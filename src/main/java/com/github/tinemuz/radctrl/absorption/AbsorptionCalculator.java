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
import com.github.tinemuz.radctrl.path.AtmosphericState;
import java.util.List;
import org.apache.commons.math3.fraction.Fraction;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Propagation matrix of an atmospheric state from line-by-line absorption
 * with Lorentz line shapes and Zeeman splitting.
 */
public final class AbsorptionCalculator {
    // indices into the accumulated coefficients
    private static final int I = 0;
    private static final int Q = 1;
    private static final int U = 2;
    private static final int V = 3;
    private static final int RHO_Q = 4;
    private static final int RHO_U = 5;
    private static final int RHO_V = 6;

    private AbsorptionCalculator() {}

    /**
     * @param state   atmosphere at the point
     * @param zenith  zenith angle of the line of sight (degrees)
     * @param azimuth azimuth of the line of sight (degrees)
     * @param bands   absorption data
     * @param f       frequency (Hz)
     * @param n       Stokes dimension, 1 to 4
     * @return the {@code n x n} propagation matrix (1/m); zero in vacuum and
     *     where no band covers {@code f}
     */
    public static RealMatrix propagationMatrix(
            AtmosphericState state, double zenith, double azimuth, List<Band> bands, double f, int n) {
        if (n < 1 || n > 4) {
            throw new IllegalArgumentException("Stokes dimension must be 1 to 4, got " + n);
        }
        if (state.isVacuum()) {
            return MatrixUtils.createRealMatrix(n, n);
        }
        Vector3D b = state.magneticField();
        double field = b.getNorm();
        Zeeman.Angles angles = Zeeman.angles(b.getX(), b.getY(), b.getZ(), zenith, azimuth);

        double[] coef = new double[7];
        double t = state.temperature();
        double p = state.pressure();
        for (Band band : bands) {
            double vmr = state.vmr(band.species());
            if (vmr == 0 || !band.covers(f)) continue;
            double density = vmr * p / (Constants.BOLTZMANN * t);
            double ratio = band.referenceTemperature() / t;
            for (Line line : band.lines()) {
                double scale = density * line.intensity() * Math.pow(ratio, 1.5);
                double width = line.gamma() * p * Math.pow(ratio, line.temperatureExponent());
                if (field == 0) {
                    coef[I] += scale * lorentz(f - line.f0(), width);
                } else {
                    addSplit(coef, scale, width, f, line, field, angles);
                }
            }
        }
        return fill(coef).getSubMatrix(0, n - 1, 0, n - 1);
    }

    private static void addSplit(
            double[] coef, double scale, double width, double f, Line line, double field, Zeeman.Angles angles) {
        Fraction ju = line.ju();
        Fraction jl = line.jl();
        double theta = Math.toRadians(angles.theta());
        double eta = Math.toRadians(angles.eta());
        double sin2 = Math.sin(theta) * Math.sin(theta);
        double cos = Math.cos(theta);
        double cos2eta = Math.cos(2 * eta);
        double sin2eta = Math.sin(2 * eta);

        for (Polarization type : Polarization.SPLIT) {
            double weight = Zeeman.polarizationFactor(type) / 3;
            double absorption = 0;
            double dispersion = 0;
            int count = Zeeman.count(ju, jl, type);
            for (int i = 0; i < count; i++) {
                double s = line.zeeman().strength(ju, jl, type, i);
                if (s == 0) continue;
                double d = f - line.f0() - line.zeeman().splitting(ju, jl, type, i) * field;
                absorption += s * lorentz(d, width);
                dispersion += s * lorentzDispersion(d, width);
            }
            absorption *= scale * weight;
            dispersion *= scale * weight;

            double gi;
            double gq;
            double gu;
            double gv;
            if (type == Polarization.PI) {
                gi = sin2;
                gq = sin2 * cos2eta;
                gu = sin2 * sin2eta;
                gv = 0;
            } else {
                gi = 1 + cos * cos;
                gq = -sin2 * cos2eta;
                gu = -sin2 * sin2eta;
                gv = type == Polarization.SIGMA_PLUS ? 2 * cos : -2 * cos;
            }
            coef[I] += gi * absorption;
            coef[Q] += gq * absorption;
            coef[U] += gu * absorption;
            coef[V] += gv * absorption;
            coef[RHO_Q] += gq * dispersion;
            coef[RHO_U] += gu * dispersion;
            coef[RHO_V] += gv * dispersion;
        }
    }

    private static RealMatrix fill(double[] c) {
        return MatrixUtils.createRealMatrix(new double[][] {
            {c[I], c[Q], c[U], c[V]},
            {c[Q], c[I], c[RHO_V], -c[RHO_U]},
            {c[U], -c[RHO_V], c[I], c[RHO_Q]},
            {c[V], c[RHO_U], -c[RHO_Q], c[I]}
        });
    }

    /** Lorentz absorption profile (1/Hz). */
    static double lorentz(double detuning, double width) {
        return width / (Math.PI * (detuning * detuning + width * width));
    }

    /** Lorentz dispersion profile (1/Hz). */
    static double lorentzDispersion(double detuning, double width) {
        return detuning / (Math.PI * (detuning * detuning + width * width));
    }
}
