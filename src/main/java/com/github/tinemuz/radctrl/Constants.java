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
package com.github.tinemuz.radctrl;

/** Physical constants (SI, CODATA 2018 exact values where defined). */
public final class Constants {
    /** Speed of light in vacuum (m/s). */
    public static final double SPEED_OF_LIGHT = 299_792_458.0;

    /** Planck constant (J s). */
    public static final double PLANCK = 6.626_070_15e-34;

    /** Boltzmann constant (J/K). */
    public static final double BOLTZMANN = 1.380_649e-23;

    /** Bohr magneton (J/T). */
    public static final double BOHR_MAGNETON = 9.274_010_0783e-24;

    /** Cosmic microwave background temperature (K). */
    public static final double COSMIC_BACKGROUND_TEMPERATURE = 2.7255;

    private Constants() {}
}
