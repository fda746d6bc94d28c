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
package com.github.tinemuz.radctrl.geom;

/**
 * Result of intersecting a ray with an ellipsoidal shell.
 *
 * <p>Steps are in units of the line-of-sight vector: the crossing points are
 * {@code pos + step * los}. For {@link MovingTarget#COMPLETE_MISS} both steps
 * are NaN, otherwise {@code minStep <= maxStep}.</p>
 */
public record Intersection(MovingTarget type, double minStep, double maxStep) {

    static Intersection completeMiss() {
        return new Intersection(MovingTarget.COMPLETE_MISS, Double.NaN, Double.NaN);
    }

    public boolean isMiss() {
        return type == MovingTarget.COMPLETE_MISS
                || type == MovingTarget.FORWARD_MISS
                || type == MovingTarget.BACKWARD_MISS;
    }
}
