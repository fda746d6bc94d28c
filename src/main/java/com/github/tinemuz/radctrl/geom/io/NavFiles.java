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

import com.github.tinemuz.radctrl.geom.Ellipsoid;
import com.github.tinemuz.radctrl.geom.LineOfSight;
import com.github.tinemuz.radctrl.geom.Nav;
import com.github.tinemuz.radctrl.geom.Position;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link NavReader} and {@link NavWriter} handles.
 *
 * <p>Every I/O or format problem is logged and rethrown as an
 * {@link IllegalStateException} naming the file.</p>
 */
public final class NavFiles {
    private static final Logger log = LoggerFactory.getLogger(NavFiles.class);
    private static final int FIELDS = 9;
    // epoch second, nanos, eight doubles
    private static final int RECORD_BYTES = Long.BYTES + Integer.BYTES + (FIELDS - 1) * Double.BYTES;

    private NavFiles() {}

    public static NavReader openReader(Path path, NavFormat format) {
        if (!Files.exists(path)) {
            log.error("Navigation file '{}' does not exist", path);
            throw new IllegalStateException("\"" + path + "\" does not exist.  Cannot read it.");
        }
        try {
            return format == NavFormat.TEXT
                    ? new TextReader(path, Files.newBufferedReader(path, StandardCharsets.UTF_8))
                    : new BinaryReader(
                            path, new DataInputStream(new BufferedInputStream(Files.newInputStream(path))));
        } catch (IOException e) {
            throw failure("open", path, e);
        }
    }

    /** Writer that truncates any existing file. */
    public static NavWriter openWriter(Path path, NavFormat format) {
        return open(path, format, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    /** Writer that appends to an existing file, creating it if needed. */
    public static NavWriter openAppender(Path path, NavFormat format) {
        return open(path, format, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private static NavWriter open(Path path, NavFormat format, StandardOpenOption... options) {
        try {
            OutputStream out = Files.newOutputStream(path, options);
            return format == NavFormat.TEXT
                    ? new TextWriter(
                            path,
                            new BufferedWriter(
                                    new OutputStreamWriter(out, StandardCharsets.UTF_8)))
                    : new BinaryWriter(path, new DataOutputStream(new BufferedOutputStream(out)));
        } catch (IOException e) {
            throw failure("open", path, e);
        }
    }

    static String format(Nav nav) {
        Position p = nav.position();
        LineOfSight l = nav.los();
        Ellipsoid e = nav.ellipsoid();
        return p.time() + " " + p.x() + ' ' + p.y() + ' ' + p.z() + ' '
                + l.dx() + ' ' + l.dy() + ' ' + l.dz() + ' '
                + e.a() + ' ' + e.e();
    }

    static Nav parse(String line) {
        String[] toks = line.trim().split("\\s+");
        if (toks.length != FIELDS) {
            throw new IllegalArgumentException(
                    "expected " + FIELDS + " fields but found " + toks.length);
        }
        Instant time = Instant.parse(toks[0]);
        double[] v = new double[FIELDS - 1];
        for (int i = 0; i < v.length; i++) v[i] = Double.parseDouble(toks[i + 1]);
        return assemble(time, v);
    }

    private static Nav assemble(Instant time, double[] v) {
        Ellipsoid ell = new Ellipsoid(v[6], v[7]);
        return new Nav(
                Position.cartesian(time, v[0], v[1], v[2]),
                LineOfSight.cartesian(v[3], v[4], v[5]),
                ell);
    }

    private static IllegalStateException failure(String action, Path path, Exception cause) {
        log.error("Failed to {} navigation file '{}'", action, path, cause);
        return new IllegalStateException(
                "Failed to " + action + " navigation file '" + path + "'", cause);
    }

    private static final class TextReader implements NavReader {
        private final Path path;
        private final BufferedReader in;
        private int lineNumber;

        TextReader(Path path, BufferedReader in) {
            this.path = path;
            this.in = in;
        }

        @Override
        public Optional<Nav> read() {
            try {
                String line;
                while ((line = in.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) continue;
                    return Optional.of(parse(line));
                }
                return Optional.empty();
            } catch (IOException e) {
                throw failure("read", path, e);
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.error("Malformed navigation record at line {} of '{}'", lineNumber, path);
                throw new IllegalStateException(
                        "Malformed navigation record at line " + lineNumber + " of '" + path + "'", e);
            }
        }

        @Override
        public List<Nav> readAll() {
            List<Nav> out = new ArrayList<>();
            for (Optional<Nav> n = read(); n.isPresent(); n = read()) out.add(n.get());
            return out;
        }

        @Override
        public void close() {
            try {
                in.close();
            } catch (IOException e) {
                throw failure("close", path, e);
            }
        }
    }

    private static final class BinaryReader implements NavReader {
        private final Path path;
        private final DataInputStream in;

        BinaryReader(Path path, DataInputStream in) {
            this.path = path;
            this.in = in;
        }

        @Override
        public Optional<Nav> read() {
            byte[] record = new byte[RECORD_BYTES];
            try {
                int first = in.read();
                if (first < 0) return Optional.empty();
                record[0] = (byte) first;
                in.readFully(record, 1, RECORD_BYTES - 1);
            } catch (EOFException e) {
                log.error("Truncated navigation record in '{}'", path);
                throw new IllegalStateException("Truncated navigation record in '" + path + "'", e);
            } catch (IOException e) {
                throw failure("read", path, e);
            }
            ByteBuffer buf = ByteBuffer.wrap(record);
            Instant time = Instant.ofEpochSecond(buf.getLong(), buf.getInt());
            double[] v = new double[FIELDS - 1];
            for (int i = 0; i < v.length; i++) v[i] = buf.getDouble();
            return Optional.of(assemble(time, v));
        }

        @Override
        public List<Nav> readAll() {
            List<Nav> out = new ArrayList<>();
            for (Optional<Nav> n = read(); n.isPresent(); n = read()) out.add(n.get());
            return out;
        }

        @Override
        public void close() {
            try {
                in.close();
            } catch (IOException e) {
                throw failure("close", path, e);
            }
        }
    }

    private static final class TextWriter implements NavWriter {
        private final Path path;
        private final Writer out;

        TextWriter(Path path, Writer out) {
            this.path = path;
            this.out = out;
        }

        @Override
        public void write(Nav nav) {
            try {
                out.write(format(nav));
                out.write('\n');
            } catch (IOException e) {
                throw failure("write", path, e);
            }
        }

        @Override
        public void close() {
            try {
                out.close();
            } catch (IOException e) {
                throw failure("close", path, e);
            }
        }
    }

    private static final class BinaryWriter implements NavWriter {
        private final Path path;
        private final DataOutputStream out;

        BinaryWriter(Path path, DataOutputStream out) {
            this.path = path;
            this.out = out;
        }

        @Override
        public void write(Nav nav) {
            Position p = nav.position();
            LineOfSight l = nav.los();
            try {
                out.writeLong(p.time().getEpochSecond());
                out.writeInt(p.time().getNano());
                out.writeDouble(p.x());
                out.writeDouble(p.y());
                out.writeDouble(p.z());
                out.writeDouble(l.dx());
                out.writeDouble(l.dy());
                out.writeDouble(l.dz());
                out.writeDouble(nav.ellipsoid().a());
                out.writeDouble(nav.ellipsoid().e());
            } catch (IOException e) {
                throw failure("write", path, e);
            }
        }

        @Override
        public void close() {
            try {
                out.close();
            } catch (IOException e) {
                throw failure("close", path, e);
            }
        }
    }
}
