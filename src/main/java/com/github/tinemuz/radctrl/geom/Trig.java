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

// Degree-based trigonometry shared by the conversion code
final class Trig {
    private Trig() {}

    static double sind(double deg) {
        return Math.sin(Math.toRadians(deg));
    }

    static double cosd(double deg) {
        return Math.cos(Math.toRadians(deg));
    }

    static double asind(double x) {
        return Math.toDegrees(Math.asin(x));
    }

    static double acosd(double x) {
        return Math.toDegrees(Math.acos(x));
    }

    static double atan2d(double y, double x) {
        return Math.toDegrees(Math.atan2(y, x));
    }

    static double hypot(double x, double y, double z) {
        return Math.hypot(Math.hypot(x, y), z);
    }
}
