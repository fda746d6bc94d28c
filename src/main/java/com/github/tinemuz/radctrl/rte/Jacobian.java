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

/**
 * Derivatives of the sensor radiance with respect to each target at each
 * path point, laid out as {@code [target][point][frequency][component]}.
 */
public final class Jacobian {
    private final List<DerivativeTarget> targets;
    private final List<StokesComponent> components;
    private final int points;
    private final int frequencies;
    private final double[] values;

    Jacobian(List<DerivativeTarget> targets, int points, int frequencies, List<StokesComponent> components) {
        this.targets = List.copyOf(targets);
        this.components = List.copyOf(components);
        this.points = points;
        this.frequencies = frequencies;
        this.values = new double[targets.size() * points * frequencies * components.size()];
    }

    public List<DerivativeTarget> targets() {
        return targets;
    }

    public List<StokesComponent> components() {
        return components;
    }

    public int points() {
        return points;
    }

    public int frequencies() {
        return frequencies;
    }

    /**
     * @throws IllegalArgumentException if {@code component} was not requested
     */
    public double get(int target, int point, int frequency, StokesComponent component) {
        int c = components.indexOf(component);
        if (c < 0) {
            throw new IllegalArgumentException(component + " was not requested; have " + components);
        }
        return values[offset(target, point, frequency, c)];
    }

    void set(int target, int point, int frequency, int componentSlot, double value) {
        values[offset(target, point, frequency, componentSlot)] = value;
    }

    private int offset(int target, int point, int frequency, int c) {
        return ((target * points + point) * frequencies + frequency) * components.size() + c;
    }
}
