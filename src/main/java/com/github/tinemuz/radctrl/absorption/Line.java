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

import org.apache.commons.math3.fraction.Fraction;

/**
 * One spectral line.
 *
 * @param f0                  line centre (Hz)
 * @param intensity           integrated intensity at the band reference temperature (m^2 Hz)
 * @param gamma               pressure broadening half width (Hz/Pa)
 * @param temperatureExponent temperature exponent of the broadening
 * @param ju                  upper-state rotational quantum number
 * @param jl                  lower-state rotational quantum number
 * @param zeeman              Landé factors of the two states
 */
public record Line(
        double f0,
        double intensity,
        double gamma,
        double temperatureExponent,
        Fraction ju,
        Fraction jl,
        Zeeman zeeman) {}
