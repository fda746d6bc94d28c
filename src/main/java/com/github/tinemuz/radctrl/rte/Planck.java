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

import static com.github.tinemuz.radctrl.Constants.BOLTZMANN;
import static com.github.tinemuz.radctrl.Constants.PLANCK;
import static com.github.tinemuz.radctrl.Constants.SPEED_OF_LIGHT;

import com.github.tinemuz.radctrl.Constants;

/** Black-body spectral radiance per unit frequency (W m^-2 sr^-1 Hz^-1). */
public final class Planck {

    private Planck() {}

    public static double radiance(double f, double temperature) {
        if (!(temperature > 0)) return 0;
        double x = PLANCK * f / (BOLTZMANN * temperature);
        return scale(f) / Math.expm1(x);
    }

    /** Derivative of {@link #radiance} with respect to temperature. */
    public static double dRadianceDt(double f, double temperature) {
        if (!(temperature > 0)) return 0;
        double x = PLANCK * f / (BOLTZMANN * temperature);
        double em1 = Math.expm1(x);
        return scale(f) * x * (em1 + 1) / (temperature * em1 * em1);
    }

    /** Cosmic microwave background, a common boundary radiance for upward views. */
    public static double cosmicBackground(double f) {
        return radiance(f, Constants.COSMIC_BACKGROUND_TEMPERATURE);
    }

    private static double scale(double f) {
        return 2 * PLANCK * f * f * f / (SPEED_OF_LIGHT * SPEED_OF_LIGHT);
    }
}
