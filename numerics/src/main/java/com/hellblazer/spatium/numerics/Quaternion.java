/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Spatium.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.spatium.numerics;

import com.hellblazer.spatium.numerics.scalar.Scalar;
import com.hellblazer.spatium.numerics.scalar.ScalarType;

import javax.vecmath.Quat4d;
import java.util.List;
import java.util.Objects;

/**
 * Immutable quaternion (x, y, z, w), w being the real part. A unit quaternion represents a rotation; unit length is a
 * soft contract that {@link #normalize()} restores after accumulated error.
 * <p>
 * Products are Hamilton products. {@code a.multiply(b)} rotates by b first and then by a, which is why
 * {@link #concatenate(Quaternion)} reverses its operands.
 *
 * @param <S> the scalar representation
 * @author hal.hildebrand
 */
public final class Quaternion<S extends Scalar<S>> {

    private static final double SLERP_EPSILON = 1e-6;

    public final S x;
    public final S y;
    public final S z;
    public final S w;

    public Quaternion(S x, S y, S z, S w) {
        this.x = Objects.requireNonNull(x, "x");
        this.y = Objects.requireNonNull(y, "y");
        this.z = Objects.requireNonNull(z, "z");
        this.w = Objects.requireNonNull(w, "w");
    }

    /**
     * Rotation of {@code angle} radians about a unit axis
     */
    public static <S extends Scalar<S>> Quaternion<S> createFromAxisAngle(Vector3<S> axis, S angle) {
        var half = angle.multiply(angle.type().half());
        var sin = half.sin();
        return new Quaternion<>(axis.x.multiply(sin), axis.y.multiply(sin), axis.z.multiply(sin), half.cos());
    }

    /**
     * Rotation part of a row-vector affine matrix; the upper 3x3 block must be orthonormal
     */
    public static <S extends Scalar<S>> Quaternion<S> createFromRotationMatrix(Matrix4x4<S> m) {
        var type = m.m11.type();
        var one = type.one();
        var half = type.half();
        var trace = m.m11.add(m.m22).add(m.m33);

        if (trace.isPositive()) {
            var s = trace.add(one).sqrt();
            var inv = half.divide(s);
            return new Quaternion<>(m.m23.subtract(m.m32).multiply(inv), m.m31.subtract(m.m13).multiply(inv),
                                    m.m12.subtract(m.m21).multiply(inv), s.multiply(half));
        }
        if (m.m11.compareTo(m.m22) >= 0 && m.m11.compareTo(m.m33) >= 0) {
            var s = one.add(m.m11).subtract(m.m22).subtract(m.m33).sqrt();
            var inv = half.divide(s);
            return new Quaternion<>(s.multiply(half), m.m12.add(m.m21).multiply(inv), m.m13.add(m.m31).multiply(inv),
                                    m.m23.subtract(m.m32).multiply(inv));
        }
        if (m.m22.compareTo(m.m33) > 0) {
            var s = one.add(m.m22).subtract(m.m11).subtract(m.m33).sqrt();
            var inv = half.divide(s);
            return new Quaternion<>(m.m21.add(m.m12).multiply(inv), s.multiply(half), m.m32.add(m.m23).multiply(inv),
                                    m.m31.subtract(m.m13).multiply(inv));
        }
        var s = one.add(m.m33).subtract(m.m11).subtract(m.m22).sqrt();
        var inv = half.divide(s);
        return new Quaternion<>(m.m31.add(m.m13).multiply(inv), m.m32.add(m.m23).multiply(inv), s.multiply(half),
                                m.m12.subtract(m.m21).multiply(inv));
    }

    /**
     * Yaw about Y, pitch about X and roll about Z, applied roll first
     */
    public static <S extends Scalar<S>> Quaternion<S> createFromYawPitchRoll(S yaw, S pitch, S roll) {
        var half = yaw.type().half();
        var halfRoll = roll.multiply(half);
        var sr = halfRoll.sin();
        var cr = halfRoll.cos();
        var halfPitch = pitch.multiply(half);
        var sp = halfPitch.sin();
        var cp = halfPitch.cos();
        var halfYaw = yaw.multiply(half);
        var sy = halfYaw.sin();
        var cy = halfYaw.cos();

        return new Quaternion<>(cy.multiply(sp).multiply(cr).add(sy.multiply(cp).multiply(sr)),
                                sy.multiply(cp).multiply(cr).subtract(cy.multiply(sp).multiply(sr)),
                                cy.multiply(cp).multiply(sr).subtract(sy.multiply(sp).multiply(cr)),
                                cy.multiply(cp).multiply(cr).add(sy.multiply(sp).multiply(sr)));
    }

    public static <S extends Scalar<S>> Quaternion<S> from(ScalarType<S> type, Quat4d q) {
        return of(type, q.x, q.y, q.z, q.w);
    }

    public static <S extends Scalar<S>> Quaternion<S> identity(ScalarType<S> type) {
        return new Quaternion<>(type.zero(), type.zero(), type.zero(), type.one());
    }

    public static <S extends Scalar<S>> Quaternion<S> of(ScalarType<S> type, double x, double y, double z, double w) {
        return new Quaternion<>(type.of(x), type.of(y), type.of(z), type.of(w));
    }

    public static <S extends Scalar<S>> Quaternion<S> of(Vector3<S> vector, S w) {
        return new Quaternion<>(vector.x, vector.y, vector.z, w);
    }

    public Quaternion<S> add(Quaternion<S> other) {
        return new Quaternion<>(x.add(other.x), y.add(other.y), z.add(other.z), w.add(other.w));
    }

    /**
     * The rotation that applies this one and then the other
     */
    public Quaternion<S> concatenate(Quaternion<S> other) {
        return other.multiply(this);
    }

    public Quaternion<S> conjugate() {
        return new Quaternion<>(x.negate(), y.negate(), z.negate(), w);
    }

    public Quaternion<S> divide(Quaternion<S> other) {
        return multiply(other.inverse());
    }

    public S dot(Quaternion<S> other) {
        return x.multiply(other.x).add(y.multiply(other.y)).add(z.multiply(other.z)).add(w.multiply(other.w));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Quaternion<?> other && x.equals(other.x) && y.equals(other.y) && z.equals(other.z)
        && w.equals(other.w);
    }

    public Vector3<S> getVector() {
        return new Vector3<>(x, y, z);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z, w);
    }

    public Quaternion<S> inverse() {
        return conjugate().multiply(lengthSquared().type().one().divide(lengthSquared()));
    }

    public boolean isIdentity() {
        return x.isZero() && y.isZero() && z.isZero() && w.compareTo(w.type().one()) == 0;
    }

    public boolean isNearlyEqualTo(Quaternion<S> other) {
        return x.isNearlyEqualTo(other.x) && y.isNearlyEqualTo(other.y) && z.isNearlyEqualTo(other.z)
        && w.isNearlyEqualTo(other.w);
    }

    /**
     * True when both quaternions represent the same rotation, q and -q included
     */
    public boolean isSameRotationAs(Quaternion<S> other) {
        return isNearlyEqualTo(other) || isNearlyEqualTo(other.negate());
    }

    public S length() {
        return lengthSquared().sqrt();
    }

    public S lengthSquared() {
        return dot(this);
    }

    /**
     * Normalized component-wise interpolation along the shorter arc
     */
    public Quaternion<S> lerp(Quaternion<S> other, S amount) {
        var type = amount.type();
        var t1 = type.one().subtract(amount);
        var target = dot(other).isNegative() ? other.negate() : other;
        return multiply(t1).add(target.multiply(amount)).normalize();
    }

    public Quaternion<S> multiply(S factor) {
        return new Quaternion<>(x.multiply(factor), y.multiply(factor), z.multiply(factor), w.multiply(factor));
    }

    /**
     * Hamilton product {@code this * other}
     */
    public Quaternion<S> multiply(Quaternion<S> other) {
        var cx = y.multiply(other.z).subtract(z.multiply(other.y));
        var cy = z.multiply(other.x).subtract(x.multiply(other.z));
        var cz = x.multiply(other.y).subtract(y.multiply(other.x));
        var dot = x.multiply(other.x).add(y.multiply(other.y)).add(z.multiply(other.z));

        return new Quaternion<>(x.multiply(other.w).add(other.x.multiply(w)).add(cx),
                                y.multiply(other.w).add(other.y.multiply(w)).add(cy),
                                z.multiply(other.w).add(other.z.multiply(w)).add(cz), w.multiply(other.w).subtract(dot));
    }

    public <T extends Scalar<T>> Quaternion<T> narrowTo(ScalarType<T> target) {
        return new Quaternion<>(target.convert(x), target.convert(y), target.convert(z), target.convert(w));
    }

    public Quaternion<S> negate() {
        return new Quaternion<>(x.negate(), y.negate(), z.negate(), w.negate());
    }

    public Quaternion<S> normalize() {
        var inverseLength = w.type().one().divide(length());
        return multiply(inverseLength);
    }

    /**
     * Spherical interpolation along the shorter arc. Nearly coincident inputs fall back to linear weights, where the
     * sine denominator vanishes.
     */
    public Quaternion<S> slerp(Quaternion<S> other, S amount) {
        var type = amount.type();
        var one = type.one();
        var cosOmega = dot(other);
        var flip = false;
        if (cosOmega.isNegative()) {
            flip = true;
            cosOmega = cosOmega.negate();
        }

        S s1;
        S s2;
        if (cosOmega.compareTo(one.subtract(type.of(SLERP_EPSILON))) > 0) {
            s1 = one.subtract(amount);
            s2 = flip ? amount.negate() : amount;
        } else {
            var omega = cosOmega.acos();
            var inverseSin = one.divide(omega.sin());
            s1 = one.subtract(amount).multiply(omega).sin().multiply(inverseSin);
            var s = amount.multiply(omega).sin().multiply(inverseSin);
            s2 = flip ? s.negate() : s;
        }
        return multiply(s1).add(other.multiply(s2)).normalize();
    }

    public Quaternion<S> subtract(Quaternion<S> other) {
        return new Quaternion<>(x.subtract(other.x), y.subtract(other.y), z.subtract(other.z), w.subtract(other.w));
    }

    /**
     * Decompose a rotation into a unit axis and an angle in [0, 2 pi]. A rotation by (nearly) zero radians has no
     * defined axis; unit X is reported.
     */
    public AxisAngle<S> toAxisAngle() {
        var type = w.type();
        var one = type.one();
        var unit = normalize();
        var cw = unit.w.max(one.negate()).min(one);
        var angle = type.two().multiply(cw.acos());
        var s = one.subtract(cw.square()).max(type.zero()).sqrt();
        if (s.isNearlyZero()) {
            return new AxisAngle<>(Vector3.unitX(type), type.zero());
        }
        return new AxisAngle<>(new Vector3<>(unit.x.divide(s), unit.y.divide(s), unit.z.divide(s)), angle);
    }

    public List<S> toList() {
        return List.of(x, y, z, w);
    }

    /**
     * Component copy; {@code Quat4d}'s four-argument constructor normalizes, so fields are assigned directly
     */
    public Quat4d toQuat4d() {
        var q = new Quat4d();
        q.x = x.doubleValue();
        q.y = y.doubleValue();
        q.z = z.doubleValue();
        q.w = w.doubleValue();
        return q;
    }

    @Override
    public String toString() {
        return "{" + x + ", " + y + ", " + z + ", " + w + "}";
    }

    public ScalarType<S> type() {
        return w.type();
    }

    /**
     * @throws IllegalArgumentException if the target cannot hold every value of this quaternion's representation
     */
    public <T extends Scalar<T>> Quaternion<T> widenTo(ScalarType<T> target) {
        if (!target.canRepresent(type())) {
            throw new IllegalArgumentException(
            "Conversion from " + type().name() + " to " + target.name() + " narrows; use narrowTo");
        }
        return narrowTo(target);
    }

    public record AxisAngle<S extends Scalar<S>>(Vector3<S> axis, S angle) {
    }
}
