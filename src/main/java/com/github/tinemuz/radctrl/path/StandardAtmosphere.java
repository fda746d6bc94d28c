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

import java.util.Map;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * ICAO standard atmosphere, simplified to a troposphere with a linear lapse
 * rate and an isothermal layer above 11 km, carrying fixed mixing ratios.
 */
public final class StandardAtmosphere implements Atmosphere {
    private static final double T0 = 288.15;     // K
    private static final double P0 = 101_325.0;  // Pa
    private static final double LAPSE = 0.0065;  // K/m
    private static final double R = 287.05;      // J/(kg K)
    private static final double G = 9.80665;     // m/s^2
    private static final double TROPOPAUSE = 11_000.0;

    private final Map<String, Double> vmr;

    /** @param vmr volume mixing ratio per species, constant with height */
    public StandardAtmosphere(Map<String, Double> vmr) {
        this.vmr = Map.copyOf(vmr);
    }

    /** Dry air with 20.95 % oxygen. */
    public static StandardAtmosphere oxygen() {
        return new StandardAtmosphere(Map.of("O2", 0.2095));
    }

    public static double temperature(double h) {
        if (h < 0) h = 0;
        return h <= TROPOPAUSE ? T0 - LAPSE * h : T0 - LAPSE * TROPOPAUSE;
    }

    public static double pressure(double h) {
        if (h < 0) h = 0;
        if (h <= TROPOPAUSE) {
            return P0 * Math.pow(temperature(h) / T0, G / (R * LAPSE));
        }
        double t11 = temperature(TROPOPAUSE);
        double p11 = P0 * Math.pow(t11 / T0, G / (R * LAPSE));
        return p11 * Math.exp(-G * (h - TROPOPAUSE) / (R * t11));
    }

    @Override
    public AtmosphericState stateAt(double altitude, double latDeg, double lonDeg) {
        return new AtmosphericState(temperature(altitude), pressure(altitude), vmr, Vector3D.ZERO);
    }
}
