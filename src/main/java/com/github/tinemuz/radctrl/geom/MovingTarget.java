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

/** Classification of a line/ellipsoid intersection relative to the direction of travel. */
public enum MovingTarget {
    /** Moving forward from inside the shell; the exit is ahead. */
    FORWARD_INSIDE,
    /** Moving forward from outside the shell; both crossings are ahead. */
    FORWARD_OUTSIDE,
    /** Moving forward, both crossings are behind. */
    FORWARD_MISS,
    /** Moving backward from inside the shell. */
    BACKWARD_INSIDE,
    /** Moving backward from outside the shell; both crossings are behind. */
    BACKWARD_OUTSIDE,
    /** Moving backward, both crossings are ahead. */
    BACKWARD_MISS,
    /** The line never meets the shell. */
    COMPLETE_MISS
}
