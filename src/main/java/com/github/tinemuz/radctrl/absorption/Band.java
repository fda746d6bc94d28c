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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Lines of one absorbing species sharing a reference temperature and cut-off. */
public final class Band {
    private final String species;
    private final double referenceTemperature;
    private final double cutoff;
    private final List<Line> lines;

    /**
     * @param referenceTemperature temperature the line intensities refer to (K)
     * @param cutoff               distance from the outermost lines beyond which
     *                             the band does not absorb (Hz)
     */
    public Band(String species, double referenceTemperature, double cutoff, List<Line> lines) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Band of " + species + " has no lines");
        }
        if (!(referenceTemperature > 0)) {
            throw new IllegalArgumentException("Reference temperature must be positive, got " + referenceTemperature);
        }
        this.species = Objects.requireNonNull(species, "species");
        this.referenceTemperature = referenceTemperature;
        this.cutoff = cutoff;
        List<Line> sorted = new ArrayList<>(lines);
        sorted.sort(Comparator.comparingDouble(Line::f0));
        this.lines = List.copyOf(sorted);
    }

    public String species() {
        return species;
    }

    public double referenceTemperature() {
        return referenceTemperature;
    }

    public double cutoff() {
        return cutoff;
    }

    /** Lines in increasing frequency. */
    public List<Line> lines() {
        return lines;
    }

    public boolean covers(double f) {
        return f >= lines.get(0).f0() - cutoff && f <= lines.get(lines.size() - 1).f0() + cutoff;
    }

    @Override
    public String toString() {
        return "Band{" + species + ", " + lines.size() + " lines, "
                + lines.get(0).f0() + ".." + lines.get(lines.size() - 1).f0() + " Hz}";
    }
}
