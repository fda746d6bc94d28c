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
package com.github.tinemuz.radctrl.rte;

import com.github.tinemuz.radctrl.absorption.AbsorptionCalculator;
import com.github.tinemuz.radctrl.absorption.Band;
import com.github.tinemuz.radctrl.geom.LineOfSight;
import com.github.tinemuz.radctrl.path.AtmosphericState;
import com.github.tinemuz.radctrl.path.PathPoint;
import java.util.List;
import java.util.stream.IntStream;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polarized radiative transfer along a path, integrated from the far
 * boundary (last point) to the sensor (point 0).
 *
 * <p>The layer between points {@code L} and {@code L+1} has the mean
 * propagation matrix {@code K} and mean Planck source {@code B} of its end
 * points and the length {@code ds} of the straight segment between them:</p>
 *
 * <pre>
 *   I_L = T_L I_{L+1} + (1 - T_L) B_L e1,   T_L = exp(-K_L ds)
 * </pre>
 *
 * <p>A layer touching a vacuum point neither absorbs nor emits. Frequencies
 * are independent and integrated in parallel.</p>
 */
public final class ForwardCalculations {
    private static final Logger log = LoggerFactory.getLogger(ForwardCalculations.class);

    private ForwardCalculations() {}

    /**
     * Radiance on an evenly spaced grid of {@code size} frequencies from
     * {@code flow} to {@code fupp}, without derivatives.
     *
     * @param rad0 boundary radiance, one per frequency
     */
    public static Results compute(
            List<RadiationVector> rad0,
            List<PathPoint> path,
            List<Band> bands,
            double flow,
            double fupp,
            int size) {
        return compute(rad0, path, bands, linearGrid(flow, fupp, size), List.of(), List.of());
    }

    /**
     * Radiance and its Jacobian.
     *
     * @param rad0        boundary radiance at the last path point, one per frequency
     * @param path        points from the sensor (index 0) to the far boundary
     * @param bands       absorption data, not modified while this runs
     * @param frequencies frequency grid (Hz)
     * @param targets     quantities to differentiate against
     * @param components  Stokes components stored in the Jacobian
     * @throws IllegalArgumentException on inconsistent sizes
     */
    public static Results compute(
            List<RadiationVector> rad0,
            List<PathPoint> path,
            List<Band> bands,
            double[] frequencies,
            List<DerivativeTarget> targets,
            List<StokesComponent> components) {
        validate(rad0, path, frequencies, components);
        final int stokes = rad0.get(0).size();
        final int points = path.size();
        Results results = new Results(rad0, points, frequencies, targets, components);

        double[] zenith = new double[points];
        double[] azimuth = new double[points];
        for (int p = 0; p < points; p++) {
            // the path stores the photon direction; absorption wants the viewing direction
            // angles are in the geocentric local frame; the field is geodetic east/north/up (<0.2 deg apart)
            LineOfSight view = path.get(p).nav().reversed().localLos();
            zenith[p] = view.zenith();
            azimuth[p] = view.azimuth();
        }

        IntStream.range(0, frequencies.length)
                .parallel()
                .forEach(i -> integrate(results, i, frequencies[i], rad0.get(i), path, bands, targets,
                        stokes, zenith, azimuth));
        log.debug("Integrated {} frequencies over {} points with {} derivative targets",
                frequencies.length, points, targets.size());
        return results;
    }

    private static void integrate(
            Results results,
            int fi,
            double f,
            RadiationVector boundary,
            List<PathPoint> path,
            List<Band> bands,
            List<DerivativeTarget> targets,
            int stokes,
            double[] zenith,
            double[] azimuth) {
        final int points = path.size();
        RealMatrix[] k = new RealMatrix[points];
        double[] b = new double[points];
        for (int p = 0; p < points; p++) {
            AtmosphericState state = path.get(p).state();
            k[p] = AbsorptionCalculator.propagationMatrix(state, zenith[p], azimuth[p], bands, f, stokes);
            b[p] = Planck.radiance(f, state.temperature());
        }

        final boolean derivatives = !targets.isEmpty();
        RealMatrix[][] dk = null;
        double[][] db = null;
        JacobianAccumulator acc = null;
        if (derivatives) {
            dk = new RealMatrix[targets.size()][points];
            db = new double[targets.size()][points];
            for (int j = 0; j < targets.size(); j++) {
                DerivativeTarget target = targets.get(j);
                for (int p = 0; p < points; p++) {
                    AtmosphericState state = path.get(p).state();
                    dk[j][p] = dPropagationMatrix(target, state, zenith[p], azimuth[p], bands, f, stokes);
                    db[j][p] = target.type() == DerivativeTarget.TargetType.TEMPERATURE && !state.isVacuum()
                            ? Planck.dRadianceDt(f, state.temperature())
                            : 0;
                }
            }
            acc = new JacobianAccumulator(targets.size(), points, stokes);
        }

        final RealMatrix identity = MatrixUtils.createRealIdentityMatrix(stokes);
        final RealVector e1 = new ArrayRealVector(stokes);
        e1.setEntry(0, 1);

        RealVector radiance = boundary.asRealVector();
        for (int layer = points - 2; layer >= 0; layer--) {
            int far = layer + 1;
            if (path.get(layer).state().isVacuum() || path.get(far).state().isVacuum()) {
                results.set(layer, fi, RadiationVector.of(radiance));
                continue;
            }
            double ds = path.get(layer).nav().distanceTo(path.get(far).nav());
            RealMatrix a = k[layer].add(k[far]).scalarMultiply(-ds / 2);
            double source = (b[layer] + b[far]) / 2;
            RealMatrix t = MatrixExponential.exp(a);
            RealVector fromSource = radiance.subtract(e1.mapMultiply(source));

            if (derivatives) {
                acc.propagate(t, far);
                RealMatrix emission = identity.subtract(t);
                for (int j = 0; j < targets.size(); j++) {
                    for (int p = layer; p <= far; p++) {
                        RealMatrix dt = MatrixExponential.frechet(a, dk[j][p].scalarMultiply(-ds / 2));
                        RealVector local = dt.operate(fromSource)
                                .add(emission.operate(e1).mapMultiply(db[j][p] / 2));
                        acc.add(j, p, local);
                    }
                }
            }

            radiance = t.operate(fromSource).add(e1.mapMultiply(source));
            results.set(layer, fi, RadiationVector.of(radiance));
        }
        if (derivatives) {
            acc.writeTo(results.jacobian(), fi);
        }
    }

    // Central difference of the propagation matrix with respect to one target
    private static RealMatrix dPropagationMatrix(
            DerivativeTarget target,
            AtmosphericState state,
            double zenith,
            double azimuth,
            List<Band> bands,
            double f,
            int stokes) {
        if (state.isVacuum()) {
            return MatrixUtils.createRealMatrix(stokes, stokes);
        }
        RealMatrix up = AbsorptionCalculator.propagationMatrix(
                target.perturb(state, 1), zenith, azimuth, bands, f, stokes);
        RealMatrix down = AbsorptionCalculator.propagationMatrix(
                target.perturb(state, -1), zenith, azimuth, bands, f, stokes);
        return up.subtract(down).scalarMultiply(1 / (2 * target.perturbation()));
    }

    /** {@code size} evenly spaced frequencies; a single frequency is {@code flow}. */
    public static double[] linearGrid(double flow, double fupp, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Frequency grid needs at least one point, got " + size);
        }
        double[] grid = new double[size];
        for (int i = 0; i < size; i++) {
            grid[i] = size == 1 ? flow : flow + i * (fupp - flow) / (size - 1);
        }
        return grid;
    }

    private static void validate(
            List<RadiationVector> rad0,
            List<PathPoint> path,
            double[] frequencies,
            List<StokesComponent> components) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Path has no points");
        }
        if (frequencies.length == 0) {
            throw new IllegalArgumentException("No frequencies to compute");
        }
        if (rad0.size() != frequencies.length) {
            throw new IllegalArgumentException("Got " + rad0.size() + " boundary vectors for "
                    + frequencies.length + " frequencies");
        }
        int stokes = rad0.get(0).size();
        for (RadiationVector v : rad0) {
            if (v.size() != stokes) {
                throw new IllegalArgumentException("Boundary vectors mix Stokes dimensions "
                        + stokes + " and " + v.size());
            }
        }
        for (StokesComponent c : components) {
            if (c.index() >= stokes) {
                throw new IllegalArgumentException(c + " is not available with Stokes dimension " + stokes);
            }
        }
    }
}
