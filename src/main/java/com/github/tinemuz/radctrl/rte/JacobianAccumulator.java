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

import java.util.List;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Derivatives of the radiance entering the current layer with respect to
 * every target at every path point, for one frequency. Owned by a single
 * integration walk.
 */
final class JacobianAccumulator {
    private final RealVector[][] d; // [target][point]

    JacobianAccumulator(int targets, int points, int stokes) {
        d = new RealVector[targets][points];
        for (RealVector[] row : d) {
            for (int p = 0; p < points; p++) {
                row[p] = new ArrayRealVector(stokes);
            }
        }
    }

    /** Carry all derivatives through a layer with transmission {@code t}. */
    void propagate(RealMatrix t, int firstPoint) {
        for (RealVector[] row : d) {
            for (int p = firstPoint; p < row.length; p++) {
                row[p] = t.operate(row[p]);
            }
        }
    }

    /** Add the layer's own dependence on the target at one of its end points. */
    void add(int target, int point, RealVector local) {
        d[target][point] = d[target][point].add(local);
    }

    /** Write the accumulated sensor derivatives into the Jacobian. */
    void writeTo(Jacobian jacobian, int frequency) {
        List<StokesComponent> components = jacobian.components();
        for (int j = 0; j < d.length; j++) {
            for (int p = 0; p < d[j].length; p++) {
                for (int c = 0; c < components.size(); c++) {
                    jacobian.set(j, p, frequency, c, d[j][p].getEntry(components.get(c).index()));
                }
            }
        }
    }
}
