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

import java.util.HashMap;
import java.util.Map;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Local atmospheric conditions at one path point.
 *
 * @param temperature    kelvin
 * @param pressure       pascal
 * @param vmr            volume mixing ratio per species name
 * @param magneticField  field (u east, v north, w up) in tesla
 */
public record AtmosphericState(
        double temperature, double pressure, Map<String, Double> vmr, Vector3D magneticField) {

    /** Outside the atmosphere: no gas, no extinction, no emission. */
    public static final AtmosphericState VACUUM =
            new AtmosphericState(0, 0, Map.of(), Vector3D.ZERO);

    public AtmosphericState {
        vmr = Map.copyOf(vmr);
    }

    public boolean isVacuum() {
        return pressure <= 0 || temperature <= 0;
    }

    public double vmr(String species) {
        return vmr.getOrDefault(species, 0.0);
    }

    public AtmosphericState withTemperature(double t) {
        return new AtmosphericState(t, pressure, vmr, magneticField);
    }

    public AtmosphericState withVmr(String species, double value) {
        Map<String, Double> copy = new HashMap<>(vmr);
        copy.put(species, value);
        return new AtmosphericState(temperature, pressure, copy, magneticField);
    }

    public AtmosphericState withMagneticField(Vector3D field) {
        return new AtmosphericState(temperature, pressure, vmr, field);
    }
}
