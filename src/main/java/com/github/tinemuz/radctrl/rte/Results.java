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

import java.util.ArrayList;
import java.util.List;

/**
 * Radiance at every path point and frequency, plus the Jacobian of the
 * sensor radiance. Point 0 is the sensor; the last point holds the boundary
 * radiance.
 */
public final class Results {
    private final int stokes;
    private final double[] frequencies;
    private final RadiationVector[][] radiance; // [point][frequency]
    private final Jacobian jacobian;

    Results(
            List<RadiationVector> rad0,
            int points,
            double[] frequencies,
            List<DerivativeTarget> targets,
            List<StokesComponent> components) {
        this.stokes = rad0.get(0).size();
        this.frequencies = frequencies.clone();
        this.radiance = new RadiationVector[points][frequencies.length];
        this.jacobian = new Jacobian(targets, points, frequencies.length, components);
        for (int i = 0; i < frequencies.length; i++) {
            radiance[points - 1][i] = rad0.get(i);
        }
    }

    void set(int point, int frequency, RadiationVector value) {
        radiance[point][frequency] = value;
    }

    /** Stokes dimension of every vector in these results. */
    public int stokes() {
        return stokes;
    }

    public double[] frequencies() {
        return frequencies.clone();
    }

    public int points() {
        return radiance.length;
    }

    public RadiationVector radiance(int point, int frequency) {
        return radiance[point][frequency];
    }

    /** Radiance arriving at the sensor, one vector per frequency. */
    public List<RadiationVector> sensorResults() {
        List<RadiationVector> out = new ArrayList<>(frequencies.length);
        for (int i = 0; i < frequencies.length; i++) {
            out.add(radiance[0][i]);
        }
        return out;
    }

    public Jacobian jacobian() {
        return jacobian;
    }
}
