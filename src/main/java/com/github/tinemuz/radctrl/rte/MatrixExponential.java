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

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Matrix exponential by scaling and squaring with a diagonal (6, 6) Padé
 * approximant, and its Fréchet derivative.
 */
final class MatrixExponential {
    private static final int ORDER = 6;
    private static final double[] PADE = padeCoefficients(ORDER);
    // scale until the norm is at most this
    private static final double SCALED_NORM = 0.5;

    private MatrixExponential() {}

    static RealMatrix exp(RealMatrix a) {
        double norm = a.getNorm();
        int squarings = norm > SCALED_NORM
                ? (int) Math.ceil(Math.log(norm / SCALED_NORM) / Math.log(2))
                : 0;
        RealMatrix x = a.scalarMultiply(Math.pow(2, -squarings));

        int n = a.getRowDimension();
        RealMatrix power = MatrixUtils.createRealIdentityMatrix(n);
        RealMatrix num = power.scalarMultiply(PADE[0]);
        RealMatrix den = power.scalarMultiply(PADE[0]);
        for (int k = 1; k <= ORDER; k++) {
            power = power.multiply(x);
            RealMatrix term = power.scalarMultiply(PADE[k]);
            num = num.add(term);
            den = (k % 2 == 0) ? den.add(term) : den.subtract(term);
        }
        RealMatrix result = new LUDecomposition(den).getSolver().solve(num);
        for (int i = 0; i < squarings; i++) {
            result = result.multiply(result);
        }
        return result;
    }

    /**
     * Directional derivative of {@code exp} at {@code a} along {@code e},
     * read off the upper-right block of {@code exp([[a, e], [0, a]])}.
     */
    static RealMatrix frechet(RealMatrix a, RealMatrix e) {
        int n = a.getRowDimension();
        RealMatrix block = MatrixUtils.createRealMatrix(2 * n, 2 * n);
        block.setSubMatrix(a.getData(), 0, 0);
        block.setSubMatrix(e.getData(), 0, n);
        block.setSubMatrix(a.getData(), n, n);
        return exp(block).getSubMatrix(0, n - 1, n, 2 * n - 1);
    }

    private static double[] padeCoefficients(int q) {
        double[] c = new double[q + 1];
        c[0] = 1;
        for (int k = 1; k <= q; k++) {
            c[k] = c[k - 1] * (q - k + 1) / (k * (2.0 * q - k + 1));
        }
        return c;
    }
}
