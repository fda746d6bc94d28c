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

import static org.junit.jupiter.api.Assertions.*;

import org.apache.commons.math3.fraction.Fraction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WignerTest {

    @Test
    @DisplayName("Known integer symbols")
    void integerValues() {
        assertEquals(-Math.sqrt(1.0 / 3), threeJ(1, 1, 0, 0, 0, 0), 1e-15);
        assertEquals(Math.sqrt(1.0 / 6), threeJ(1, 1, 1, 1, -1, 0), 1e-15);
        assertEquals(0, threeJ(1, 1, 1, 0, 0, 0), 1e-15);
    }

    @Test
    @DisplayName("Known half-integer symbol")
    void halfIntegerValue() {
        assertEquals(Math.sqrt(1.0 / 6), threeJ(0.5, 0.5, 1, 0.5, -0.5, 0), 1e-15);
    }

    @Test
    @DisplayName("Swapping two columns multiplies by (-1)^(j1+j2+j3)")
    void columnSwap() {
        assertEquals(-threeJ(1, 1, 1, 1, -1, 0), threeJ(1, 1, 1, -1, 1, 0), 1e-15);
        assertEquals(threeJ(2, 1, 1, 1, 0, -1), threeJ(1, 2, 1, 0, 1, -1), 1e-15);
    }

    @Test
    @DisplayName("Selection rules give zero")
    void selectionRules() {
        assertEquals(0, threeJ(1, 1, 1, 1, 1, 0));
        assertEquals(0, threeJ(1, 1, 3, 0, 0, 0));
        assertEquals(0, threeJ(1, 1, 0, 2, -2, 0));
    }

    @Test
    @DisplayName("Squares over m1 and m2 sum to 1/(2 j3 + 1)")
    void orthogonality() {
        double j1 = 1.5;
        double j2 = 1;
        double j3 = 2.5;
        double m3 = 0.5;
        double sum = 0;
        for (double m1 = -j1; m1 <= j1; m1++) {
            for (double m2 = -j2; m2 <= j2; m2++) {
                double w = threeJ(j1, j2, j3, m1, m2, m3);
                sum += w * w;
            }
        }
        assertEquals(1 / (2 * j3 + 1), sum, 1e-14);
    }

    @Test
    @DisplayName("Arguments must be multiples of one half")
    void rejectsThirds() {
        Fraction third = new Fraction(1, 3);
        assertThrows(IllegalArgumentException.class,
                () -> Wigner.threeJ(third, Fraction.ONE, Fraction.ONE, Fraction.ZERO, Fraction.ZERO, Fraction.ZERO));
    }

    private static double threeJ(double j1, double j2, double j3, double m1, double m2, double m3) {
        return Wigner.threeJ(half(j1), half(j2), half(j3), half(m1), half(m2), half(m3));
    }

    private static Fraction half(double x) {
        return new Fraction((int) Math.round(2 * x), 2);
    }
}
