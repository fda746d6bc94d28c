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
package com.github.tinemuz.radctrl.path;

import com.github.tinemuz.radctrl.geom.Ellipsoid;
import com.github.tinemuz.radctrl.geom.Intersection;
import com.github.tinemuz.radctrl.geom.LineOfSight;
import com.github.tinemuz.radctrl.geom.MovingTarget;
import com.github.tinemuz.radctrl.geom.Nav;
import com.github.tinemuz.radctrl.geom.Navigator;
import com.github.tinemuz.radctrl.geom.Position;
import com.github.tinemuz.radctrl.geom.PositionType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the propagation path seen by a sensor by stepping a navigation
 * state through the atmosphere.
 *
 * <p>The sensor state looks along its viewing direction. The path ends where
 * that view leaves the atmosphere (the shell at {@code topAltitude}) or hits
 * the surface, whichever comes first. Points are then produced by walking
 * from that far end back to the sensor in equal steps no longer than
 * {@code stepLength}, so every point carries the photon direction and the
 * timestamps grow towards the sensor, reaching the sensor time at index 0.</p>
 */
public final class PathBuilder {
    private static final Logger log = LoggerFactory.getLogger(PathBuilder.class);
    // points this far above the top shell still count as inside (meters)
    private static final double TOP_TOLERANCE = 1e-3;

    private final Navigator navigator;
    private final Atmosphere atmosphere;
    private final MagneticFieldProvider magneticField;
    private final double topAltitude;
    private final double stepLength;

    /**
     * @param topAltitude altitude of the top of the atmosphere (meters)
     * @param stepLength  longest distance between two points inside the atmosphere (meters)
     */
    public PathBuilder(
            Navigator navigator,
            Atmosphere atmosphere,
            MagneticFieldProvider magneticField,
            double topAltitude,
            double stepLength) {
        if (!(stepLength > 0)) {
            throw new IllegalArgumentException("Step length must be positive, got " + stepLength);
        }
        this.navigator = Objects.requireNonNull(navigator, "navigator");
        this.atmosphere = Objects.requireNonNull(atmosphere, "atmosphere");
        this.magneticField = Objects.requireNonNull(magneticField, "magneticField");
        this.topAltitude = topAltitude;
        this.stepLength = stepLength;
    }

    /** Path with 100 km top and 1 km steps, at the speed of light. */
    public PathBuilder(Atmosphere atmosphere, MagneticFieldProvider magneticField) {
        this(new Navigator(), atmosphere, magneticField, 100_000.0, 1_000.0);
    }

    /**
     * @param sensor sensor position and viewing direction
     * @return points ordered from the sensor (index 0) to the far boundary
     */
    public List<PathPoint> build(Nav sensor) {
        final Ellipsoid ell = sensor.ellipsoid();
        final LineOfSight view = sensor.los().scale(1 / sensor.los().norm());
        final Nav unitSensor = new Nav(sensor.position(), view, ell);

        Intersection top = navigator.intersect(unitSensor, topAltitude, true);
        double near;
        double far;
        switch (top.type()) {
            case FORWARD_INSIDE:
                near = 0;
                far = top.maxStep();
                break;
            case FORWARD_OUTSIDE:
                near = top.minStep();
                far = top.maxStep();
                break;
            default:
                log.debug("View from {} never enters the atmosphere", sensor.position());
                return List.of(point(unitSensor.reversed()));
        }
        Intersection ground = navigator.intersect(unitSensor, 0, true);
        if (ground.type() == MovingTarget.FORWARD_OUTSIDE
                && ground.minStep() < far) {
            far = ground.minStep();
        }
        if (far <= near) {
            return List.of(point(unitSensor.reversed()));
        }

        double inside = far - near;
        int steps = (int) Math.max(1, Math.ceil(inside / stepLength));
        double d = inside / steps;
        // sum the rounded step durations so the last point lands on the sensor time
        long travelNanos = steps * nanos(d) + (near > 0 ? nanos(near) : 0);
        Position sensorPos = unitSensor.position();
        Position farPos =
                sensorPos
                        .plus(view.scale(far).asDisplacement(), ell)
                        .withTime(sensorPos.time().minus(Duration.ofNanos(travelNanos)));
        Nav nav = new Nav(farPos, view.negate(), ell);

        List<PathPoint> points = new ArrayList<>();
        points.add(point(nav));
        for (int i = 0; i < steps; i++) {
            nav = navigator.step(nav, d);
            points.add(point(nav));
        }
        if (near > 0) {
            nav = navigator.step(nav, near);
            points.add(point(nav));
        }
        Collections.reverse(points);
        log.debug("Built path of {} points over {} m", points.size(), String.format("%.1f", far));
        return List.copyOf(points);
    }

    private long nanos(double distance) {
        return Math.round(Math.abs(distance / navigator.propagationSpeed()) * 1e9);
    }

    private PathPoint point(Nav nav) {
        Position geo = nav.position().to(PositionType.ELLIPSOIDAL, nav.ellipsoid());
        double h = geo.h();
        if (h > topAltitude + TOP_TOLERANCE) {
            return new PathPoint(nav, AtmosphericState.VACUUM);
        }
        AtmosphericState state =
                atmosphere
                        .stateAt(h, geo.lat(), geo.lon())
                        .withMagneticField(magneticField.fieldAt(geo.lat(), geo.lon(), h, geo.time()));
        return new PathPoint(nav, state);
    }
}
