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
package com.github.tinemuz.radctrl.rte;

import com.github.tinemuz.radctrl.path.AtmosphericState;
import java.util.Objects;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * A retrieval parameter the radiance is differentiated against, evaluated
 * independently at every path point.
 *
 * @param type         which quantity
 * @param species      absorbing species for {@link TargetType#VMR}, otherwise {@code null}
 * @param perturbation half step of the central difference used for the
 *                     propagation matrix, in the unit of the quantity
 */
public record DerivativeTarget(TargetType type, String species, double perturbation) {

    public enum TargetType {
        TEMPERATURE,
        VMR,
        MAGNETIC_U,
        MAGNETIC_V,
        MAGNETIC_W
    }

    public DerivativeTarget {
        Objects.requireNonNull(type, "type");
        if (type == TargetType.VMR && species == null) {
            throw new IllegalArgumentException("VMR target needs a species");
        }
        if (!(perturbation > 0)) {
            throw new IllegalArgumentException("Perturbation must be positive, got " + perturbation);
        }
    }

    /** Temperature, perturbed by 0.1 K. */
    public static DerivativeTarget temperature() {
        return new DerivativeTarget(TargetType.TEMPERATURE, null, 0.1);
    }

    /** Volume mixing ratio of a species, perturbed by 1e-6. */
    public static DerivativeTarget vmr(String species) {
        return new DerivativeTarget(TargetType.VMR, species, 1e-6);
    }

    /** One component of the magnetic field, perturbed by 100 nT. */
    public static DerivativeTarget magnetic(TargetType component) {
        if (component != TargetType.MAGNETIC_U
                && component != TargetType.MAGNETIC_V
                && component != TargetType.MAGNETIC_W) {
            throw new IllegalArgumentException("Not a magnetic field component: " + component);
        }
        return new DerivativeTarget(component, null, 1e-7);
    }

    /** The state with this target's quantity shifted by {@code steps} perturbations. */
    AtmosphericState perturb(AtmosphericState state, double steps) {
        double d = steps * perturbation;
        Vector3D b = state.magneticField();
        switch (type) {
            case TEMPERATURE:
                return state.withTemperature(state.temperature() + d);
            case VMR:
                return state.withVmr(species, state.vmr(species) + d);
            case MAGNETIC_U:
                return state.withMagneticField(b.add(new Vector3D(d, 0, 0)));
            case MAGNETIC_V:
                return state.withMagneticField(b.add(new Vector3D(0, d, 0)));
            case MAGNETIC_W:
                return state.withMagneticField(b.add(new Vector3D(0, 0, d)));
            default:
                throw new IllegalStateException("Unknown target type " + type);
        }
    }

    @Override
    public String toString() {
        return type == TargetType.VMR ? "VMR(" + species + ")" : type.toString();
    }
}
