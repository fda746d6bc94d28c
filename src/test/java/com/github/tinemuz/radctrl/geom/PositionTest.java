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

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PositionTest {

    private static final Ellipsoid ELL = new Ellipsoid(6378137.0, 0.0818);

    @Nested
    @DisplayName("Ellipsoidal and Cartesian")
    class EllipsoidalTests {

        @Test
        @DisplayName("45N 0E at 10 km survives a round trip through Cartesian")
        void referencePoint() {
            Position start = Position.ellipsoidal(10_000, 45, 0);
            Position back = start.to(PositionType.CARTESIAN, ELL).to(PositionType.ELLIPSOIDAL, ELL);

            assertEquals(45, back.lat(), 1e-9);
            assertEquals(0, back.lon(), 1e-9);
            assertEquals(10_000, back.h(), 1e-2);
        }

        @Test
        @DisplayName("Round trip over latitudes, longitudes and heights")
        void roundTripGrid() {
            for (double lat = -85; lat <= 85; lat += 17) {
                for (double lon = -170; lon <= 170; lon += 34) {
                    for (double h : new double[] {-400, 0, 8_848, 400_000}) {
                        Position back = Position.ellipsoidal(h, lat, lon)
                                .to(PositionType.CARTESIAN, ELL)
                                .to(PositionType.ELLIPSOIDAL, ELL);
                        String at = "at " + lat + ", " + lon + ", " + h;
                        assertEquals(lat, back.lat(), 1e-8, at);
                        assertEquals(lon, back.lon(), 1e-8, at);
                        assertEquals(h, back.h(), 1e-4, at);
                    }
                }
            }
        }

        @Test
        @DisplayName("Equator at zero height lies on the equatorial radius")
        void equatorialRadius() {
            Position p = Position.ellipsoidal(0, 0, 90).to(PositionType.CARTESIAN, ELL);

            assertEquals(0, p.x(), 1e-6);
            assertEquals(ELL.a(), p.y(), 1e-6);
            assertEquals(0, p.z(), 1e-6);
        }

        @Test
        @DisplayName("A point on the polar axis takes the pole branch")
        void poleBranch() {
            Position p = Position.cartesian(0, 0, ELL.b() + 100).to(PositionType.ELLIPSOIDAL, ELL);

            assertEquals(90, p.lat(), 1e-12);
            assertEquals(0, p.lon(), 1e-12);
            assertEquals(100, p.h(), 1e-6);

            Position south = Position.cartesian(0, 0, -ELL.b() - 50).to(PositionType.ELLIPSOIDAL, ELL);
            assertEquals(-90, south.lat(), 1e-12);
            assertEquals(50, south.h(), 1e-6);
        }

        @Test
        @DisplayName("The centre of the ellipsoid takes the centre branch")
        void centreBranch() {
            Position p = Position.cartesian(0, 0, 0).to(PositionType.ELLIPSOIDAL, ELL);

            assertEquals(-ELL.a(), p.h(), 1e-9);
            assertEquals(0, p.lat(), 1e-12);
            assertEquals(180, p.lon(), 1e-12);
        }
    }

    @Nested
    @DisplayName("Spherical")
    class SphericalTests {

        @Test
        @DisplayName("Cartesian to spherical and back is exact to rounding")
        void cartesianRoundTrip() {
            double[][] points = {{1e6, 2e6, 3e6}, {-4e6, 1e5, -2e6}, {7e6, -7e6, 1}};
            for (double[] xyz : points) {
                Position back = Position.cartesian(xyz[0], xyz[1], xyz[2])
                        .to(PositionType.SPHERICAL, ELL)
                        .to(PositionType.CARTESIAN, ELL);
                assertEquals(xyz[0], back.x(), 1e-6);
                assertEquals(xyz[1], back.y(), 1e-6);
                assertEquals(xyz[2], back.z(), 1e-6);
            }
        }

        @Test
        @DisplayName("Spherical radius is the distance from the centre")
        void radius() {
            Position s = Position.cartesian(3e6, 4e6, 0).to(PositionType.SPHERICAL, ELL);

            assertEquals(5e6, s.r(), 1e-6);
            assertEquals(0, s.lat(), 1e-12);
            assertEquals(Math.toDegrees(Math.atan2(4, 3)), s.lon(), 1e-12);
        }

        @Test
        @DisplayName("Spherical and ellipsoidal convert through Cartesian")
        void sphericalToEllipsoidal() {
            Position e = Position.ellipsoidal(1_000, 30, 60);
            Position viaSpherical = e.to(PositionType.SPHERICAL, ELL).to(PositionType.ELLIPSOIDAL, ELL);

            assertEquals(30, viaSpherical.lat(), 1e-9);
            assertEquals(60, viaSpherical.lon(), 1e-9);
            assertEquals(1_000, viaSpherical.h(), 1e-4);
        }
    }

    @Nested
    @DisplayName("Accessors and arithmetic")
    class AccessorTests {

        @Test
        @DisplayName("Components of another representation are rejected")
        void wrongTag() {
            Position c = Position.cartesian(1, 2, 3);

            assertThrows(IllegalStateException.class, c::lat);
            assertThrows(IllegalStateException.class, c::h);
            assertThrows(IllegalStateException.class, () -> Position.spherical(1, 0, 0).x());
        }

        @Test
        @DisplayName("Conversion keeps the timestamp")
        void keepsTime() {
            Instant t = Instant.parse("2024-03-01T12:00:00Z");
            Position p = Position.ellipsoidal(t, 0, 10, 20).to(PositionType.CARTESIAN, ELL);

            assertEquals(t, p.time());
        }

        @Test
        @DisplayName("Plus adds Cartesian offsets and keeps the representation")
        void plus() {
            Position sum = Position.cartesian(1, 2, 3).plus(Position.cartesian(1, 1, 1), ELL);
            assertEquals(Position.cartesian(2, 3, 4), sum);

            Position lifted = Position.ellipsoidal(0, 0, 0).plus(Position.cartesian(500, 0, 0), ELL);
            assertEquals(PositionType.ELLIPSOIDAL, lifted.type());
            assertEquals(500, lifted.h(), 1e-6);
        }

        @Test
        @DisplayName("Travel time is distance over speed")
        void travel() {
            Position p = Position.cartesian(0, 0, 0).plusTravel(-30, 10);

            assertEquals(Instant.EPOCH.plusSeconds(3), p.time());
        }
    }
}
