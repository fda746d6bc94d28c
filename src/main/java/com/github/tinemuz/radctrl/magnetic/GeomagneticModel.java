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
package com.github.tinemuz.radctrl.magnetic;

import com.github.tinemuz.radctrl.path.MagneticFieldProvider;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spherical-harmonic geomagnetic field model in the IGRF table format.
 *
 * <p>The coefficient table has a {@code g/h n m} header row listing the
 * epochs (decimal years, optionally followed by {@code SV}) and one row per
 * Gauss coefficient: {@code g n m v1 v2 ... [sv]}. Degrees up to 13 are
 * used; missing coefficients are zero. Between epochs the coefficients are
 * interpolated linearly, before the first epoch the first column is used, and
 * after the last epoch secular variation is applied for at most five
 * years.</p>
 *
 * <p>Instances are immutable once loaded and may be shared between
 * threads; each thread evaluates in its own scratch workspace.</p>
 */
public final class GeomagneticModel implements MagneticFieldProvider {
    private static final Logger log = LoggerFactory.getLogger(GeomagneticModel.class);
    // WGS-84 ellipsoid parameters (km) and IAU reference radius (km)
    private static final double A_KM = 6378.137;
    private static final double B_KM = 6356.7523142;
    private static final double RE_KM = 6371.2;
    private static final int MAX_N = 13;
    // secular variation is published for degrees up to 8 only
    private static final int MAX_SV_N = 8;
    private static final double MAX_EXTRAPOLATION_YEARS = 5.0;
    private static final double NANOTESLA = 1e-9;
    private static final double[][] SCHMIDT = schmidtFactors(MAX_N);

    private final String source;
    private final double[] epochs;
    private final double[][][] g; // g[n][m][epoch]
    private final double[][][] h; // h[n][m][epoch]
    private final double[][] svG;
    private final double[][] svH;
    private final ThreadLocal<Workspace> work = ThreadLocal.withInitial(Workspace::new);
    private volatile boolean warnedExtrapolation = false;

    private GeomagneticModel(
            String source, double[] epochs, double[][][] g, double[][][] h, double[][] svG, double[][] svH) {
        this.source = source;
        this.epochs = epochs;
        this.g = g;
        this.h = h;
        this.svG = svG;
        this.svH = svH;
    }

    /**
     * Load a coefficient table from the classpath.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static GeomagneticModel fromResource(String resource) {
        InputStream in = GeomagneticModel.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Geomagnetic coefficients '{}' not found on classpath", resource);
            throw new IllegalStateException(
                    "Geomagnetic coefficients '" + resource + "' not found on classpath");
        }
        return load(in, resource);
    }

    /**
     * Load a coefficient table from a stream, which is closed afterwards.
     *
     * @param source name used in log and error messages
     * @throws IllegalStateException if the table cannot be read or parsed
     */
    public static GeomagneticModel load(InputStream in, String source) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parse(br, source);
        } catch (IOException e) {
            log.error("Failed to read geomagnetic coefficients '{}'", source, e);
            throw new IllegalStateException("Failed to read geomagnetic coefficients '" + source + "'", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse geomagnetic coefficients '{}'", source, e);
            throw new IllegalStateException("Failed to parse geomagnetic coefficients '" + source + "'", e);
        }
    }

    private static GeomagneticModel parse(BufferedReader br, String source) throws IOException {
        List<Double> years = new ArrayList<>();
        List<String[]> rows = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] toks = line.split("\\s+");
            if (toks[0].equals("g/h")) {
                years.clear();
                for (int i = 1; i < toks.length; i++) {
                    if (isNumber(toks[i])) years.add(Double.parseDouble(toks[i]));
                }
            } else if ((toks[0].equals("g") || toks[0].equals("h")) && toks.length >= 4) {
                rows.add(toks);
            }
        }
        if (years.isEmpty()) {
            throw new IllegalArgumentException("no epoch header ('g/h n m ...') in " + source);
        }
        double[] epochs = years.stream().mapToDouble(Double::doubleValue).toArray();
        int count = epochs.length;
        double[][][] g = new double[MAX_N + 1][MAX_N + 1][count];
        double[][][] h = new double[MAX_N + 1][MAX_N + 1][count];
        double[][] svG = new double[MAX_N + 1][MAX_N + 1];
        double[][] svH = new double[MAX_N + 1][MAX_N + 1];
        for (String[] toks : rows) {
            int n = Integer.parseInt(toks[1]);
            int m = Integer.parseInt(toks[2]);
            if (n < 1 || n > MAX_N || m < 0 || m > n) continue;
            boolean isG = toks[0].equals("g");
            double[] target = isG ? g[n][m] : h[n][m];
            int values = toks.length - 3;
            for (int i = 0; i < Math.min(values, count); i++) {
                target[i] = Double.parseDouble(toks[3 + i]);
            }
            if (values > count) {
                (isG ? svG : svH)[n][m] = Double.parseDouble(toks[3 + count]);
            }
        }
        log.debug("Loaded geomagnetic coefficients '{}' with {} epochs ({} to {})",
                source, count, epochs[0], epochs[count - 1]);
        return new GeomagneticModel(source, epochs, g, h, svG, svH);
    }

    /**
     * Evaluate the field at a WGS-84 geodetic location and time.
     *
     * @param latDeg         geodetic latitude (degrees, north positive)
     * @param lonDeg         longitude (degrees, east positive)
     * @param altitudeMeters height above the ellipsoid (meters)
     * @param epochMillis    UTC time as epoch milliseconds
     * @return field in the north-east-down frame, nanotesla
     */
    public Field compute(double latDeg, double lonDeg, double altitudeMeters, long epochMillis) {
        // keep latitude slightly inside [-90, 90]; the east component divides by cos(lat)
        double lat = Math.max(-90.0 + 1e-5, Math.min(latDeg, 90.0 - 1e-5));
        Workspace ws = work.get();

        double gcLat = geocentric(ws, lat, altitudeMeters / 1000.0);
        double lon = Math.toRadians(lonDeg);
        legendre(ws, Math.PI / 2 - gcLat);
        for (int m = 0; m <= MAX_N; m++) {
            ws.cosMLon[m] = Math.cos(m * lon);
            ws.sinMLon[m] = Math.sin(m * lon);
        }
        double ratio = RE_KM / ws.radiusKm;
        ws.relPow[0] = ratio * ratio;
        for (int n = 1; n <= MAX_N; n++) ws.relPow[n] = ws.relPow[n - 1] * ratio;
        coefficientsAt(ws, decimalYear(epochMillis));

        double north = 0; // -dV/dtheta direction
        double east = 0;
        double down = 0;
        double invCosLat = 1.0 / Math.cos(gcLat);
        for (int n = 1; n <= MAX_N; n++) {
            double rn = ws.relPow[n]; // (a/r)^(n+2)
            for (int m = 0; m <= n; m++) {
                double a = ws.gnm[n][m] * ws.cosMLon[m] + ws.hnm[n][m] * ws.sinMLon[m];
                double b = ws.gnm[n][m] * ws.sinMLon[m] - ws.hnm[n][m] * ws.cosMLon[m];
                north += rn * a * ws.dp[n][m];
                if (m != 0) east += rn * m * b * ws.p[n][m] * invCosLat;
                down -= rn * (n + 1) * a * ws.p[n][m];
            }
        }

        // rotate from the geocentric to the geodetic local frame
        double tilt = Math.toRadians(lat) - gcLat;
        double c = Math.cos(tilt);
        double s = Math.sin(tilt);
        return new Field(north * c + down * s, east, -north * s + down * c);
    }

    /** Field in tesla, east/north/up. */
    @Override
    public Vector3D fieldAt(double latDeg, double lonDeg, double altitude, Instant time) {
        Field f = compute(latDeg, lonDeg, altitude, time.toEpochMilli());
        return new Vector3D(f.yEastNt * NANOTESLA, f.xNorthNt * NANOTESLA, -f.zDownNt * NANOTESLA);
    }

    public double firstEpoch() {
        return epochs[0];
    }

    public double lastEpoch() {
        return epochs[epochs.length - 1];
    }

    /** Whether the clamped-extrapolation warning has been logged. */
    boolean warnedExtrapolation() {
        return warnedExtrapolation;
    }

    // Fill ws.gnm/ws.hnm with the coefficients valid at the given decimal year
    private void coefficientsAt(Workspace ws, double year) {
        int last = epochs.length - 1;
        if (year <= epochs[0]) {
            copyColumn(ws, 0, 0, 0);
        } else if (year <= epochs[last]) {
            int hi = upperBound(epochs, year);
            int lo = hi - 1;
            copyColumn(ws, lo, hi, (year - epochs[lo]) / (epochs[hi] - epochs[lo]));
        } else {
            double ahead = year - epochs[last];
            if (ahead > MAX_EXTRAPOLATION_YEARS && !warnedExtrapolation) {
                synchronized (this) {
                    if (!warnedExtrapolation) {
                        warnedExtrapolation = true;
                        log.warn("Requested time is {} years beyond latest epoch {} of '{}'; "
                                        + "results are clamped to {}",
                                String.format("%.2f", ahead),
                                String.format("%.1f", epochs[last]),
                                source,
                                String.format("%.1f", epochs[last] + MAX_EXTRAPOLATION_YEARS));
                    }
                }
            }
            double dt = Math.min(ahead, MAX_EXTRAPOLATION_YEARS);
            for (int n = 1; n <= MAX_N; n++) {
                boolean useSv = n <= MAX_SV_N;
                for (int m = 0; m <= n; m++) {
                    ws.gnm[n][m] = g[n][m][last] + (useSv ? dt * svG[n][m] : 0);
                    ws.hnm[n][m] = h[n][m][last] + (useSv ? dt * svH[n][m] : 0);
                }
            }
        }
    }

    private void copyColumn(Workspace ws, int lo, int hi, double t) {
        for (int n = 1; n <= MAX_N; n++) {
            for (int m = 0; m <= n; m++) {
                ws.gnm[n][m] = g[n][m][lo] + t * (g[n][m][hi] - g[n][m][lo]);
                ws.hnm[n][m] = h[n][m][lo] + t * (h[n][m][hi] - h[n][m][lo]);
            }
        }
    }

    private static double decimalYear(long epochMillis) {
        Instant t = Instant.ofEpochMilli(epochMillis);
        int year = t.atZone(ZoneOffset.UTC).getYear();
        long start = LocalDate.of(year, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        long end = LocalDate.of(year + 1, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        return year + (double) (epochMillis - start) / (end - start);
    }

    /** First index with arr[index] >= x, or the last index. */
    private static int upperBound(double[] arr, double x) {
        int lo = 0;
        int hi = arr.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] < x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    // Geodetic latitude/altitude to geocentric latitude (returned, radians); radius into ws
    private static double geocentric(Workspace ws, double gdLatDeg, double altKm) {
        double a2 = A_KM * A_KM;
        double b2 = B_KM * B_KM;
        double lat = Math.toRadians(gdLatDeg);
        double clat = Math.cos(lat);
        double slat = Math.sin(lat);
        double rho = Math.sqrt(a2 * clat * clat + b2 * slat * slat);
        ws.radiusKm =
                Math.sqrt(altKm * altKm
                        + 2 * altKm * rho
                        + (a2 * a2 * clat * clat + b2 * b2 * slat * slat)
                                / (a2 * clat * clat + b2 * slat * slat));
        return Math.atan(slat / clat * (rho * altKm + b2) / (rho * altKm + a2));
    }

    /**
     * Schmidt quasi-normalised associated Legendre functions P_n^m(cos theta)
     * and their theta derivatives, by the Gauss-normalised recursion.
     */
    private static void legendre(Workspace ws, double theta) {
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        double[][] p = ws.pGauss;
        double[][] dp = ws.dpGauss;
        p[0][0] = 1.0;
        dp[0][0] = 0.0;
        for (int n = 1; n <= MAX_N; n++) {
            for (int m = 0; m <= n; m++) {
                if (n == m) {
                    p[n][m] = sin * p[n - 1][m - 1];
                    dp[n][m] = cos * p[n - 1][m - 1] + sin * dp[n - 1][m - 1];
                } else if (n == 1 || m == n - 1) {
                    p[n][m] = cos * p[n - 1][m];
                    dp[n][m] = -sin * p[n - 1][m] + cos * dp[n - 1][m];
                } else {
                    double k = ((n - 1.0) * (n - 1.0) - m * m) / ((2.0 * n - 1) * (2.0 * n - 3));
                    p[n][m] = cos * p[n - 1][m] - k * p[n - 2][m];
                    dp[n][m] = -sin * p[n - 1][m] + cos * dp[n - 1][m] - k * dp[n - 2][m];
                }
            }
        }
        for (int n = 0; n <= MAX_N; n++) {
            for (int m = 0; m <= n; m++) {
                ws.p[n][m] = p[n][m] * SCHMIDT[n][m];
                ws.dp[n][m] = dp[n][m] * SCHMIDT[n][m];
            }
        }
    }

    private static double[][] schmidtFactors(int maxN) {
        double[][] s = new double[maxN + 1][];
        s[0] = new double[] {1.0};
        for (int n = 1; n <= maxN; n++) {
            s[n] = new double[n + 1];
            s[n][0] = s[n - 1][0] * (2.0 * n - 1) / n;
            for (int m = 1; m <= n; m++) {
                s[n][m] = s[n][m - 1] * Math.sqrt((n - m + 1.0) * (m == 1 ? 2 : 1) / (n + m));
            }
        }
        return s;
    }

    /** Field vector in the north-east-down frame, nanotesla, with derived angles. */
    public static final class Field {
        public final double xNorthNt;
        public final double yEastNt;
        /** Positive downward. */
        public final double zDownNt;
        public final double hHorizontalNt;
        public final double fTotalNt;
        /** Degrees east of geographic north. */
        public final double declinationDeg;
        /** Degrees, positive downward. */
        public final double inclinationDeg;

        private Field(double x, double y, double z) {
            this.xNorthNt = x;
            this.yEastNt = y;
            this.zDownNt = z;
            this.hHorizontalNt = Math.hypot(x, y);
            this.fTotalNt = Math.sqrt(x * x + y * y + z * z);
            this.declinationDeg = Math.toDegrees(Math.atan2(y, x));
            this.inclinationDeg = Math.toDegrees(Math.atan2(z, hHorizontalNt));
        }
    }

    private static final class Workspace {
        final double[][] pGauss = new double[MAX_N + 1][MAX_N + 1];
        final double[][] dpGauss = new double[MAX_N + 1][MAX_N + 1];
        final double[][] p = new double[MAX_N + 1][MAX_N + 1];
        final double[][] dp = new double[MAX_N + 1][MAX_N + 1];
        final double[][] gnm = new double[MAX_N + 1][MAX_N + 1];
        final double[][] hnm = new double[MAX_N + 1][MAX_N + 1];
        final double[] sinMLon = new double[MAX_N + 1];
        final double[] cosMLon = new double[MAX_N + 1];
        final double[] relPow = new double[MAX_N + 1];
        double radiusKm;
    }

    private static boolean isNumber(String token) {
        try {
            Double.parseDouble(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
