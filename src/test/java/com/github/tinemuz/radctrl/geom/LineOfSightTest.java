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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LineOfSightTest {

    private static final Ellipsoid ELL = Ellipsoid.WGS84;

    @Nested
    @DisplayName("Conversion at a position")
    class ConversionTests {

        @Test
        @DisplayName("Spherical to Cartesian and back")
        void roundTrip() {
            Position at = Position.ellipsoidal(0, 30, 40);
            LineOfSight los = LineOfSight.spherical(60, 45, 2);

            LineOfSight back = los.to(LosType.CARTESIAN, at, ELL).to(LosType.SPHERICAL, at, ELL);

            assertEquals(60, back.zenith(), 1e-9);
            assertEquals(45, back.azimuth(), 1e-9);
            assertEquals(2, back.dr(), 1e-12);
        }

        @Test
        @DisplayName("Westward azimuths come back negative")
        void westward() {
            Position at = Position.spherical(7e6, -20, 100);
            LineOfSight back = LineOfSight.spherical(120, -70, 1)
                    .to(LosType.CARTESIAN, at, ELL)
                    .to(LosType.SPHERICAL, at, ELL);

            assertEquals(120, back.zenith(), 1e-9);
            assertEquals(-70, back.azimuth(), 1e-9);
        }

        @Test
        @DisplayName("Zenith and north at the origin meridian")
        void localFrame() {
            Position at = Position.spherical(7e6, 0, 0);

            assertVector(1, 0, 0, LineOfSight.spherical(0, 0, 1).to(LosType.CARTESIAN, at, ELL));
            assertVector(0, 0, 1, LineOfSight.spherical(90, 0, 1).to(LosType.CARTESIAN, at, ELL));
            assertVector(0, 1, 0, LineOfSight.spherical(90, 90, 1).to(LosType.CARTESIAN, at, ELL));
        }

        @Test
        @DisplayName("At the pole both directions use the polar frame")
        void pole() {
            Position at = Position.spherical(7e6, 90, 0);

            assertVector(0, 0, 1, LineOfSight.spherical(0, 0, 1).to(LosType.CARTESIAN, at, ELL));
            LineOfSight up = LineOfSight.cartesian(0, 0, 3).to(LosType.SPHERICAL, at, ELL);
            assertEquals(0, up.zenith(), 1e-12);
            assertEquals(3, up.dr(), 1e-12);

            Position south = Position.spherical(7e6, -90, 0);
            LineOfSight down = LineOfSight.cartesian(0, 0, 1).to(LosType.SPHERICAL, south, ELL);
            assertEquals(180, down.zenith(), 1e-12);
        }

        @Test
        @DisplayName("Straight up is reported with zenith zero")
        void straightUp() {
            Position at = Position.spherical(7e6, 10, 10);
            LineOfSight cart = LineOfSight.spherical(0, 0, 1).to(LosType.CARTESIAN, at, ELL);
            LineOfSight sph = cart.to(LosType.SPHERICAL, at, ELL);

            assertEquals(0, sph.zenith(), 1e-6);
            assertFalse(Double.isNaN(sph.azimuth()));
        }
    }

    @Nested
    @DisplayName("Vector operations")
    class OperationTests {

        @Test
        @DisplayName("Negating a spherical vector flips zenith and azimuth")
        void negateSpherical() {
            LineOfSight n = LineOfSight.spherical(30, 270, 2).negate();

            assertEquals(150, n.zenith(), 1e-12);
            assertEquals(90, n.azimuth(), 1e-12);
            assertEquals(2, n.dr(), 1e-12);
        }

        @Test
        @DisplayName("Negating a spherical vector agrees with negating its Cartesian form")
        void negateConsistent() {
            Position at = Position.ellipsoidal(0, 10, 20);
            LineOfSight los = LineOfSight.spherical(70, 30, 1);

            LineOfSight viaSpherical = los.negate().to(LosType.CARTESIAN, at, ELL);
            LineOfSight viaCartesian = los.to(LosType.CARTESIAN, at, ELL).negate();

            assertVector(viaCartesian.dx(), viaCartesian.dy(), viaCartesian.dz(), viaSpherical);
        }

        @Test
        @DisplayName("Norm and scale")
        void normAndScale() {
            LineOfSight c = LineOfSight.cartesian(2, 3, 6);

            assertEquals(7, c.norm(), 1e-12);
            assertEquals(14, c.scale(2).norm(), 1e-12);
            assertEquals(3, LineOfSight.spherical(10, 20, -3).norm(), 0);
        }

        @Test
        @DisplayName("Only a Cartesian vector is a displacement")
        void displacement() {
            assertEquals(Position.cartesian(1, 2, 3), LineOfSight.cartesian(1, 2, 3).asDisplacement());
            assertThrows(UnsupportedOperationException.class,
                    () -> LineOfSight.spherical(0, 0, 1).asDisplacement());
        }

        @Test
        @DisplayName("Components of another representation are rejected")
        void wrongTag() {
            assertThrows(IllegalStateException.class, () -> LineOfSight.cartesian(1, 0, 0).zenith());
            assertThrows(IllegalStateException.class, () -> LineOfSight.spherical(0, 0, 1).dx());
        }
    }

    private static void assertVector(double x, double y, double z, LineOfSight los) {
        assertEquals(x, los.dx(), 1e-9, "dx");
        assertEquals(y, los.dy(), 1e-9, "dy");
        assertEquals(z, los.dz(), 1e-9, "dz");
    }
}
