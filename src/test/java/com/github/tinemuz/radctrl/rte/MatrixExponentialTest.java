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

import static org.junit.jupiter.api.Assertions.*;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MatrixExponentialTest {

    @Nested
    @DisplayName("Exponential")
    class ExpTests {

        @Test
        @DisplayName("The zero matrix maps to the identity")
        void zero() {
            RealMatrix e = MatrixExponential.exp(MatrixUtils.createRealMatrix(3, 3));

            assertMatrix(MatrixUtils.createRealIdentityMatrix(3), e, 0);
        }

        @Test
        @DisplayName("Diagonal matrices exponentiate entrywise")
        void diagonal() {
            RealMatrix e = MatrixExponential.exp(MatrixUtils.createRealDiagonalMatrix(new double[] {1, -2, 0.25}));

            assertEquals(Math.E, e.getEntry(0, 0), 1e-14);
            assertEquals(Math.exp(-2), e.getEntry(1, 1), 1e-15);
            assertEquals(Math.exp(0.25), e.getEntry(2, 2), 1e-14);
            assertEquals(0, e.getEntry(0, 1), 1e-16);
        }

        @Test
        @DisplayName("Large arguments are scaled and squared")
        void largeNorm() {
            RealMatrix e = MatrixExponential.exp(MatrixUtils.createRealMatrix(new double[][] {{-50}}));

            assertEquals(Math.exp(-50), e.getEntry(0, 0), Math.exp(-50) * 1e-12);
        }

        @Test
        @DisplayName("A rotation generator gives a rotation")
        void rotation() {
            double t = 2.5;
            RealMatrix e = MatrixExponential.exp(MatrixUtils.createRealMatrix(new double[][] {{0, -t}, {t, 0}}));

            RealMatrix expected = MatrixUtils.createRealMatrix(new double[][] {
                {Math.cos(t), -Math.sin(t)},
                {Math.sin(t), Math.cos(t)}
            });
            assertMatrix(expected, e, 1e-13);
        }

        @Test
        @DisplayName("An absorbing and polarizing matrix keeps the scalar attenuation")
        void commutingParts() {
            // -k I - q J with J the I/Q exchange has eigenvalues -k - q and -k + q
            double k = 3;
            double q = 1;
            RealMatrix e = MatrixExponential.exp(MatrixUtils.createRealMatrix(new double[][] {{-k, -q}, {-q, -k}}));

            assertEquals(Math.exp(-k) * Math.cosh(q), e.getEntry(0, 0), 1e-14);
            assertEquals(-Math.exp(-k) * Math.sinh(q), e.getEntry(0, 1), 1e-14);
        }
    }

    @Nested
    @DisplayName("Frechet derivative")
    class FrechetTests {

        @Test
        @DisplayName("Along the identity it is the exponential itself")
        void alongIdentity() {
            RealMatrix a = MatrixUtils.createRealIdentityMatrix(2).scalarMultiply(-0.7);
            RealMatrix l = MatrixExponential.frechet(a, MatrixUtils.createRealIdentityMatrix(2));

            assertMatrix(MatrixExponential.exp(a), l, 1e-14);
        }

        @Test
        @DisplayName("Matches a central difference for non-commuting matrices")
        void centralDifference() {
            RealMatrix a = MatrixUtils.createRealMatrix(new double[][] {
                {-1.2, 0.3, 0.1},
                {0.3, -1.2, 0.4},
                {0.1, -0.4, -1.2}
            });
            RealMatrix e = MatrixUtils.createRealMatrix(new double[][] {
                {0.5, -0.2, 0},
                {-0.2, 0.5, 0.7},
                {0, -0.7, 0.5}
            });
            double h = 1e-5;
            RealMatrix numeric = MatrixExponential.exp(a.add(e.scalarMultiply(h)))
                    .subtract(MatrixExponential.exp(a.subtract(e.scalarMultiply(h))))
                    .scalarMultiply(1 / (2 * h));

            assertMatrix(numeric, MatrixExponential.frechet(a, e), 1e-8);
        }
    }

    private static void assertMatrix(RealMatrix expected, RealMatrix actual, double tolerance) {
        assertEquals(expected.getRowDimension(), actual.getRowDimension());
        assertEquals(expected.getColumnDimension(), actual.getColumnDimension());
        for (int i = 0; i < expected.getRowDimension(); i++) {
            for (int j = 0; j < expected.getColumnDimension(); j++) {
                assertEquals(expected.getEntry(i, j), actual.getEntry(i, j), tolerance, "entry " + i + "," + j);
            }
        }
    }
}
