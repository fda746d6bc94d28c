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
import org.apache.commons.math3.util.CombinatoricsUtils;

/** Wigner 3j symbols for integer and half-integer arguments. */
public final class Wigner {

    private Wigner() {}

    /**
     * The 3j symbol {@code (j1 j2 j3; m1 m2 m3)} by the Racah formula.
     * Selection-rule violations give 0.
     *
     * @throws IllegalArgumentException if an argument is not a multiple of 1/2
     */
    public static double threeJ(Fraction j1, Fraction j2, Fraction j3, Fraction m1, Fraction m2, Fraction m3) {
        // work in doubled integers so half-integers stay exact
        int tj1 = twice(j1);
        int tj2 = twice(j2);
        int tj3 = twice(j3);
        int tm1 = twice(m1);
        int tm2 = twice(m2);
        int tm3 = twice(m3);

        if (tm1 + tm2 + tm3 != 0) return 0;
        if (tj3 < Math.abs(tj1 - tj2) || tj3 > tj1 + tj2) return 0;
        if (Math.abs(tm1) > tj1 || Math.abs(tm2) > tj2 || Math.abs(tm3) > tj3) return 0;
        if (odd(tj1 + tm1) || odd(tj2 + tm2) || odd(tj3 + tm3) || odd(tj1 + tj2 + tj3)) return 0;

        int a = (tj1 + tj2 - tj3) / 2;
        int b = (tj1 - tj2 + tj3) / 2;
        int c = (-tj1 + tj2 + tj3) / 2;
        int total = (tj1 + tj2 + tj3) / 2;
        double triangle = f(a) * f(b) * f(c) / f(total + 1);
        double norm = f((tj1 + tm1) / 2) * f((tj1 - tm1) / 2)
                * f((tj2 + tm2) / 2) * f((tj2 - tm2) / 2)
                * f((tj3 + tm3) / 2) * f((tj3 - tm3) / 2);

        int k1 = (tj1 - tm1) / 2;
        int k2 = (tj2 + tm2) / 2;
        int k3 = (tj3 - tj2 + tm1) / 2;
        int k4 = (tj3 - tj1 - tm2) / 2;
        int kmin = Math.max(0, Math.max(-k3, -k4));
        int kmax = Math.min(a, Math.min(k1, k2));
        double sum = 0;
        for (int k = kmin; k <= kmax; k++) {
            double term = 1.0 / (f(k) * f(a - k) * f(k1 - k) * f(k2 - k) * f(k3 + k) * f(k4 + k));
            sum += (k % 2 == 0) ? term : -term;
        }
        int phase = (tj1 - tj2 - tm3) / 2;
        double sign = odd(phase) ? -1 : 1;
        return sign * Math.sqrt(triangle * norm) * sum;
    }

    private static int twice(Fraction x) {
        int num = 2 * x.getNumerator();
        int den = x.getDenominator();
        if (num % den != 0) {
            throw new IllegalArgumentException("Not a multiple of 1/2: " + x);
        }
        return num / den;
    }

    private static boolean odd(int n) {
        return (n & 1) != 0;
    }

    private static double f(int n) {
        return CombinatoricsUtils.factorialDouble(n);
    }
}
