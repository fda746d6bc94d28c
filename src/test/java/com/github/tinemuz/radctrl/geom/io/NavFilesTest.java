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
package com.github.tinemuz.radctrl.geom.io;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.radctrl.geom.Ellipsoid;
import com.github.tinemuz.radctrl.geom.LineOfSight;
import com.github.tinemuz.radctrl.geom.Nav;
import com.github.tinemuz.radctrl.geom.Position;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class NavFilesTest {

    @TempDir
    Path dir;

    @Nested
    @DisplayName("Round trips")
    class RoundTripTests {

        @ParameterizedTest
        @EnumSource(NavFormat.class)
        @DisplayName("Written states read back equal")
        void roundTrip(NavFormat format) {
            Path file = dir.resolve("nav." + format);
            List<Nav> navs = List.of(sample(0), sample(1), sample(2));
            try (NavWriter out = NavFiles.openWriter(file, format)) {
                for (Nav n : navs) out.write(n);
            }

            try (NavReader in = NavFiles.openReader(file, format)) {
                assertEquals(navs, in.readAll());
                assertEquals(Optional.empty(), in.read());
            }
        }

        @ParameterizedTest
        @EnumSource(NavFormat.class)
        @DisplayName("Appending keeps earlier records")
        void append(NavFormat format) {
            Path file = dir.resolve("append." + format);
            try (NavWriter out = NavFiles.openWriter(file, format)) {
                out.write(sample(0));
            }
            try (NavWriter out = NavFiles.openAppender(file, format)) {
                out.write(sample(1));
            }

            try (NavReader in = NavFiles.openReader(file, format)) {
                assertEquals(List.of(sample(0), sample(1)), in.readAll());
            }
        }

        @ParameterizedTest
        @EnumSource(NavFormat.class)
        @DisplayName("Opening a writer truncates")
        void truncate(NavFormat format) {
            Path file = dir.resolve("trunc." + format);
            try (NavWriter out = NavFiles.openWriter(file, format)) {
                out.write(sample(0));
                out.write(sample(1));
            }
            try (NavWriter out = NavFiles.openWriter(file, format)) {
                out.write(sample(2));
            }

            try (NavReader in = NavFiles.openReader(file, format)) {
                assertEquals(List.of(sample(2)), in.readAll());
            }
        }
    }

    @Nested
    @DisplayName("Text layout")
    class TextTests {

        @Test
        @DisplayName("One line of nine whitespace-separated fields per state")
        void layout() throws IOException {
            Path file = dir.resolve("layout.txt");
            try (NavWriter out = NavFiles.openWriter(file, NavFormat.TEXT)) {
                out.write(sample(0));
            }

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            assertEquals(1, lines.size());
            String[] fields = lines.get(0).split("\\s+");
            assertEquals(9, fields.length);
            assertEquals(sample(0).position().time(), Instant.parse(fields[0]));
        }

        @Test
        @DisplayName("Blank lines are skipped and spacing is free")
        void lenient() throws IOException {
            Path file = dir.resolve("lenient.txt");
            Files.writeString(file,
                    "\n  1970-01-01T00:00:00Z   1.0 2.0 3.0\t0.0 0.0 1.0 6378137.0 0.0\n\n",
                    StandardCharsets.UTF_8);

            try (NavReader in = NavFiles.openReader(file, NavFormat.TEXT)) {
                List<Nav> navs = in.readAll();
                assertEquals(1, navs.size());
                assertEquals(3.0, navs.get(0).position().z());
                assertEquals(new Ellipsoid(6378137.0, 0.0), navs.get(0).ellipsoid());
            }
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("A missing file is reported with its path")
        void missing() {
            Path file = dir.resolve("absent.txt");
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> NavFiles.openReader(file, NavFormat.TEXT));

            assertTrue(e.getMessage().contains(file.toString()));
            assertTrue(e.getMessage().contains("does not exist"));
        }

        @Test
        @DisplayName("A malformed text line names the line number")
        void malformed() throws IOException {
            Path file = dir.resolve("bad.txt");
            Files.writeString(file,
                    NavFiles.format(sample(0)) + "\n1970-01-01T00:00:00Z 1 2 3\n",
                    StandardCharsets.UTF_8);

            try (NavReader in = NavFiles.openReader(file, NavFormat.TEXT)) {
                assertTrue(in.read().isPresent());
                IllegalStateException e = assertThrows(IllegalStateException.class, in::read);
                assertTrue(e.getMessage().contains("line 2"), e.getMessage());
            }
        }

        @Test
        @DisplayName("An unparsable number is malformed")
        void notANumber() throws IOException {
            Path file = dir.resolve("nan.txt");
            Files.writeString(file, "1970-01-01T00:00:00Z 1 2 three 0 0 1 6378137 0\n", StandardCharsets.UTF_8);

            try (NavReader in = NavFiles.openReader(file, NavFormat.TEXT)) {
                assertThrows(IllegalStateException.class, in::readAll);
            }
        }

        @Test
        @DisplayName("A binary file cut inside a record is truncated")
        void truncatedBinary() throws IOException {
            Path file = dir.resolve("cut.bin");
            try (OutputStream raw = Files.newOutputStream(file);
                    DataOutputStream out = new DataOutputStream(raw)) {
                out.writeLong(0);
                out.writeInt(0);
                out.writeDouble(1.0);
            }

            try (NavReader in = NavFiles.openReader(file, NavFormat.BINARY)) {
                IllegalStateException e = assertThrows(IllegalStateException.class, in::read);
                assertTrue(e.getMessage().contains("Truncated"), e.getMessage());
            }
        }

        @Test
        @DisplayName("Trailing bytes after the last binary record are a truncated record")
        void trailingBytes() throws IOException {
            Path file = dir.resolve("trailing.bin");
            try (NavWriter out = NavFiles.openWriter(file, NavFormat.BINARY)) {
                out.write(sample(1));
            }
            Files.write(file, new byte[] {1, 2, 3}, StandardOpenOption.APPEND);

            try (NavReader in = NavFiles.openReader(file, NavFormat.BINARY)) {
                assertTrue(in.read().isPresent());
                IllegalStateException e = assertThrows(IllegalStateException.class, in::read);
                assertTrue(e.getMessage().contains("Truncated"), e.getMessage());
                assertTrue(e.getMessage().contains(file.toString()), e.getMessage());
            }
        }
    }

    private static Nav sample(int i) {
        Instant t = Instant.parse("2024-06-01T10:15:30.123456789Z").plusSeconds(i);
        return new Nav(
                Position.ellipsoidal(t, 1000.0 * i + 0.1, 10 + i, -20.5 * i),
                LineOfSight.cartesian(0.1 * i, -0.3, 0.9 + i),
                Ellipsoid.WGS84);
    }
}
