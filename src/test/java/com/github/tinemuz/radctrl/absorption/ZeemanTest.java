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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.radctrl.Constants;
import org.apache.commons.math3.fraction.Fraction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ZeemanTest {

    private static final Zeeman G2 = new Zeeman(2.0, 2.0);

    @Nested
    @DisplayName("Polarization classes")
    class ClassTests {

        @Test
        @DisplayName("Polarization factors are 0.75, 1.5, 0.75 and 1")
        void polarizationFactors() {
            assertEquals(0.75, Zeeman.polarizationFactor(Polarization.SIGMA_MINUS));
            assertEquals(1.5, Zeeman.polarizationFactor(Polarization.PI));
            assertEquals(0.75, Zeeman.polarizationFactor(Polarization.SIGMA_PLUS));
            assertEquals(1.0, Zeeman.polarizationFactor(Polarization.NONE));
        }

        @Test
        @DisplayName("Class weights of a split line add up to one")
        void classWeights() {
            double total = 0;
            for (Polarization p : Polarization.SPLIT) total += Zeeman.polarizationFactor(p) / 3;
            assertEquals(1.0, total, 1e-15);
        }

        @Test
        @DisplayName("Change of M per class")
        void dM() {
            assertEquals(-1, Zeeman.dM(Polarization.SIGMA_MINUS));
            assertEquals(0, Zeeman.dM(Polarization.PI));
            assertEquals(1, Zeeman.dM(Polarization.SIGMA_PLUS));
            assertEquals(0, Zeeman.dM(Polarization.NONE));
        }
    }

    @Nested
    @DisplayName("M ranges")
    class RangeTests {

        @Test
        @DisplayName("Equal J: 2J sigma sublines and 2J+1 pi sublines")
        void equalJ() {
            Fraction j = new Fraction(2);

            assertEquals(new Fraction(-1), Zeeman.start(j, j, Polarization.SIGMA_MINUS));
            assertEquals(new Fraction(2), Zeeman.end(j, j, Polarization.SIGMA_MINUS));
            assertEquals(4, Zeeman.count(j, j, Polarization.SIGMA_MINUS));
            assertEquals(5, Zeeman.count(j, j, Polarization.PI));
            assertEquals(new Fraction(-2), Zeeman.start(j, j, Polarization.SIGMA_PLUS));
            assertEquals(new Fraction(1), Zeeman.end(j, j, Polarization.SIGMA_PLUS));
        }

        @Test
        @DisplayName("Upper J above lower J")
        void upperAbove() {
            Fraction ju = new Fraction(3, 2);
            Fraction jl = new Fraction(1, 2);

            assertEquals(new Fraction(1, 2), Zeeman.start(ju, jl, Polarization.SIGMA_MINUS));
            assertEquals(2, Zeeman.count(ju, jl, Polarization.SIGMA_MINUS));
            assertEquals(2, Zeeman.count(ju, jl, Polarization.PI));
            assertEquals(new Fraction(-1, 2), Zeeman.end(ju, jl, Polarization.SIGMA_PLUS));
        }

        @Test
        @DisplayName("Lower state M follows the change of M")
        void lowerM() {
            Fraction ju = new Fraction(1);
            Fraction jl = new Fraction(2);

            assertEquals(new Fraction(-1), Zeeman.mu(ju, jl, Polarization.SIGMA_MINUS, 0));
            assertEquals(new Fraction(-2), Zeeman.ml(ju, jl, Polarization.SIGMA_MINUS, 0));
            assertEquals(new Fraction(2), Zeeman.ml(ju, jl, Polarization.SIGMA_PLUS, 2));
        }

        @Test
        @DisplayName("No polarization is a single unsplit line")
        void none() {
            Fraction j = new Fraction(3);

            assertEquals(1, Zeeman.count(j, j, Polarization.NONE));
            assertEquals(1.0, G2.strength(j, j, Polarization.NONE, 0));
            assertEquals(0.0, G2.splitting(j, j, Polarization.NONE, 0), 0);
        }
    }

    @Nested
    @DisplayName("Strengths and splitting")
    class StrengthTests {

        @ParameterizedTest(name = "Ju={0}, Jl={1}")
        @CsvSource({"1, 0", "0, 1", "1, 1", "2, 1", "1, 2", "5/2, 3/2", "3/2, 3/2", "7/2, 9/2", "5, 5", "12, 13"})
        @DisplayName("Strengths sum to one in every class")
        void strengthsSumToOne(String ju, String jl) {
            Fraction upper = parse(ju);
            Fraction lower = parse(jl);
            for (Polarization p : Polarization.SPLIT) {
                double sum = 0;
                for (int n = 0; n < Zeeman.count(upper, lower, p); n++) {
                    double s = G2.strength(upper, lower, p, n);
                    assertTrue(s >= 0);
                    sum += s;
                }
                assertEquals(1.0, sum, 1e-12, p.toString());
            }
        }

        @Test
        @DisplayName("Splitting is (Ml gl - Mu gu) Bohr magnetons over Planck")
        void splitting() {
            Fraction ju = new Fraction(1);
            Fraction jl = new Fraction(0);
            Zeeman z = new Zeeman(2.0, 0.0);
            double c = Constants.BOHR_MAGNETON / Constants.PLANCK;

            // sigma+ has Mu = -1, Ml = 0
            assertEquals(2.0 * c, z.splitting(ju, jl, Polarization.SIGMA_PLUS, 0), 1e-3);
            assertEquals(-2.0 * c, z.splitting(ju, jl, Polarization.SIGMA_MINUS, 0), 1e-3);
            assertEquals(0.0, z.splitting(ju, jl, Polarization.PI, 0), 0);
        }
    }

    @Nested
    @DisplayName("Field geometry")
    class AngleTests {

        @Test
        @DisplayName("No field gives zero angles")
        void zeroField() {
            assertEquals(new Zeeman.Angles(0, 0), Zeeman.angles(0, 0, 0, 35, 120));
        }

        @Test
        @DisplayName("Field along and against the line of sight")
        void parallel() {
            assertEquals(0, Zeeman.angles(0, 0, 5e-5, 0, 0).theta(), 1e-9);
            assertEquals(180, Zeeman.angles(0, 0, -5e-5, 0, 0).theta(), 1e-9);
        }

        @Test
        @DisplayName("Field across the line of sight")
        void perpendicular() {
            Zeeman.Angles north = Zeeman.angles(0, 3e-5, 0, 0, 0);
            Zeeman.Angles east = Zeeman.angles(3e-5, 0, 0, 0, 0);

            assertEquals(90, north.theta(), 1e-9);
            assertEquals(90, north.eta(), 1e-9);
            assertEquals(90, east.theta(), 1e-9);
            assertEquals(0, east.eta(), 1e-9);
        }

        @Test
        @DisplayName("Angles do not depend on field strength")
        void scaleFree() {
            Zeeman.Angles weak = Zeeman.angles(1e-6, -2e-6, 3e-6, 60, 200);
            Zeeman.Angles strong = Zeeman.angles(1e-4, -2e-4, 3e-4, 60, 200);

            assertEquals(weak.theta(), strong.theta(), 1e-9);
            assertEquals(weak.eta(), strong.eta(), 1e-9);
        }
    }

    private static Fraction parse(String s) {
        String[] parts = s.trim().split("/");
        return parts.length == 1
                ? new Fraction(Integer.parseInt(parts[0]))
                : new Fraction(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }
}
