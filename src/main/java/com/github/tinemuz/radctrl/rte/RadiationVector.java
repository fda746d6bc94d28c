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

import java.util.Arrays;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

/** Immutable Stokes vector with 1 to 4 components (W m^-2 sr^-1 Hz^-1). */
public final class RadiationVector {
    private final double[] stokes;

    public RadiationVector(double... stokes) {
        if (stokes.length < 1 || stokes.length > 4) {
            throw new IllegalArgumentException("Stokes dimension must be 1 to 4, got " + stokes.length);
        }
        this.stokes = stokes.clone();
    }

    /** Unpolarized radiation of the given intensity. */
    public static RadiationVector unpolarized(double intensity, int size) {
        if (size < 1 || size > 4) {
            throw new IllegalArgumentException("Stokes dimension must be 1 to 4, got " + size);
        }
        double[] s = new double[size];
        s[0] = intensity;
        return new RadiationVector(s);
    }

    static RadiationVector of(RealVector v) {
        return new RadiationVector(v.toArray());
    }

    public int size() {
        return stokes.length;
    }

    public double get(int i) {
        return stokes[i];
    }

    public double get(StokesComponent c) {
        if (c.index() >= stokes.length) {
            throw new IllegalArgumentException(c + " is not part of a " + stokes.length + "-component vector");
        }
        return stokes[c.index()];
    }

    public double[] toArray() {
        return stokes.clone();
    }

    RealVector asRealVector() {
        return new ArrayRealVector(stokes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RadiationVector)) return false;
        return Arrays.equals(stokes, ((RadiationVector) o).stokes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(stokes);
    }

    @Override
    public String toString() {
        return Arrays.toString(stokes);
    }
}
