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

import java.util.Objects;

/**
 * Immutable 2D affine transform in row-vector convention. The third column is implicitly (0, 0, 1):
 *
 * <pre>
 *  | m11 m12 0 |
 *  | m21 m22 0 |
 *  | m31 m32 1 |
 * </pre>
 * <p>
 * {@code a.multiply(b)} applies a first, then b.
 *
 * @param <S> the scalar representation
 * @author hal.hildebrand
 */
public final class Matrix3x2<S extends Scalar<S>> {

    /**
     * Angles within a thousandth of a degree of a quarter turn snap to exact sines and cosines
     */
    private static final double ROTATION_SNAP = Math.PI / 180.0 / 1000.0;

    public final S m11;
    public final S m12;
    public final S m21;
    public final S m22;
    public final S m31;
    public final S m32;

    public Matrix3x2(S m11, S m12, S m21, S m22, S m31, S m32) {
        this.m11 = Objects.requireNonNull(m11, "m11");
        this.m12 = Objects.requireNonNull(m12, "m12");
        this.m21 = Objects.requireNonNull(m21, "m21");
        this.m22 = Objects.requireNonNull(m22, "m22");
        this.m31 = Objects.requireNonNull(m31, "m31");
        this.m32 = Objects.requireNonNull(m32, "m32");
    }

    /**
     * Rotation by {@code radians}, counter-clockwise about the origin
     */
    public static <S extends Scalar<S>> Matrix3x2<S> createRotation(S radians) {
        var type = radians.type();
        var zero = type.zero();
        var sinCos = snappedSinCos(radians);
        var c = sinCos.cos();
        var s = sinCos.sin();
        return new Matrix3x2<>(c, s, s.negate(), c, zero, zero);
    }

    public static <S extends Scalar<S>> Matrix3x2<S> createRotation(S radians, Vector2<S> center) {
        var one = radians.type().one();
        var sinCos = snappedSinCos(radians);
        var c = sinCos.cos();
        var s = sinCos.sin();
        var oneMinusC = one.subtract(c);
        var x = center.x.multiply(oneMinusC).add(center.y.multiply(s));
        var y = center.y.multiply(oneMinusC).subtract(center.x.multiply(s));
        return new Matrix3x2<>(c, s, s.negate(), c, x, y);
    }

    public static <S extends Scalar<S>> Matrix3x2<S> createScale(S scale) {
        return createScale(new Vector2<>(scale, scale));
    }

    public static <S extends Scalar<S>> Matrix3x2<S> createScale(Vector2<S> scales) {
        var zero = scales.type().zero();
        return new Matrix3x2<>(scales.x, zero, zero, scales.y, zero, zero);
    }

    /**
     * Scale about a center point, which stays fixed
     */
    public static <S extends Scalar<S>> Matrix3x2<S> createScale(Vector2<S> scales, Vector2<S> center) {
        var one = scales.type().one();
        var zero = scales.type().zero();
        var tx = center.x.multiply(one.subtract(scales.x));
        var ty = center.y.multiply(one.subtract(scales.y));
        return new Matrix3x2<>(scales.x, zero, zero, scales.y, tx, ty);
    }

    /**
     * Skew by the given angles: x is sheared by {@code tan(radiansX)} of y, y by {@code tan(radiansY)} of x
     */
    public static <S extends Scalar<S>> Matrix3x2<S> createSkew(S radiansX, S radiansY) {
        var type = radiansX.type();
        return new Matrix3x2<>(type.one(), radiansY.tan(), radiansX.tan(), type.one(), type.zero(), type.zero());
    }

    public static <S extends Scalar<S>> Matrix3x2<S> createSkew(S radiansX, S radiansY, Vector2<S> center) {
        var type = radiansX.type();
        var xTan = radiansX.tan();
        var yTan = radiansY.tan();
        return new Matrix3x2<>(type.one(), yTan, xTan, type.one(), center.y.negate().multiply(xTan),
                               center.x.negate().multiply(yTan));
    }

    public static <S extends Scalar<S>> Matrix3x2<S> createTranslation(Vector2<S> position) {
        var type = position.type();
        return new Matrix3x2<>(type.one(), type.zero(), type.zero(), type.one(), position.x, position.y);
    }

    public static <S extends Scalar<S>> Matrix3x2<S> identity(ScalarType<S> type) {
        return new Matrix3x2<>(type.one(), type.zero(), type.zero(), type.one(), type.zero(), type.zero());
    }

    private static <S extends Scalar<S>> SinCos<S> snappedSinCos(S radians) {
        var type = radians.type();
        var zero = type.zero();
        var one = type.one();
        var epsilon = type.of(ROTATION_SNAP);
        var angle = radians.ieeeRemainder(type.tau());
        var halfPi = type.halfPi();
        var pi = type.pi();

        if (within(angle, zero, epsilon)) {
            return new SinCos<>(zero, one);
        }
        if (within(angle, halfPi, epsilon)) {
            return new SinCos<>(one, zero);
        }
        if (within(angle, pi.negate(), epsilon) || within(angle, pi, epsilon)) {
            return new SinCos<>(zero, one.negate());
        }
        if (within(angle, halfPi.negate(), epsilon)) {
            return new SinCos<>(one.negate(), zero);
        }
        return new SinCos<>(angle.sin(), angle.cos());
    }

    private static <S extends Scalar<S>> boolean within(S angle, S target, S epsilon) {
        return angle.subtract(target).abs().compareTo(epsilon) < 0;
    }

    public Matrix3x2<S> add(Matrix3x2<S> other) {
        return new Matrix3x2<>(m11.add(other.m11), m12.add(other.m12), m21.add(other.m21), m22.add(other.m22),
                               m31.add(other.m31), m32.add(other.m32));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Matrix3x2<?> o && m11.equals(o.m11) && m12.equals(o.m12) && m21.equals(o.m21)
        && m22.equals(o.m22) && m31.equals(o.m31) && m32.equals(o.m32);
    }

    /**
     * Determinant of the implicit 3x3 matrix, which reduces to that of the linear 2x2 block
     */
    public S getDeterminant() {
        return m11.multiply(m22).subtract(m21.multiply(m12));
    }

    public Vector2<S> getTranslation() {
        return new Vector2<>(m31, m32);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m11, m12, m21, m22, m31, m32);
    }

    public Inversion<S> invert() {
        var type = m11.type();
        var det = getDeterminant();
        if (det.abs().isNearlyZero()) {
            return new Inversion<>(false, identity(type));
        }
        var inv = type.one().divide(det);
        return new Inversion<>(true, new Matrix3x2<>(m22.multiply(inv), m12.negate().multiply(inv),
                                                     m21.negate().multiply(inv), m11.multiply(inv),
                                                     m21.multiply(m32).subtract(m31.multiply(m22)).multiply(inv),
                                                     m31.multiply(m12).subtract(m11.multiply(m32)).multiply(inv)));
    }

    public boolean isIdentity() {
        var one = m11.type().one();
        return m11.compareTo(one) == 0 && m22.compareTo(one) == 0 && m12.isZero() && m21.isZero() && m31.isZero()
        && m32.isZero();
    }

    public boolean isNearlyEqualTo(Matrix3x2<S> o) {
        return m11.isNearlyEqualTo(o.m11) && m12.isNearlyEqualTo(o.m12) && m21.isNearlyEqualTo(o.m21)
        && m22.isNearlyEqualTo(o.m22) && m31.isNearlyEqualTo(o.m31) && m32.isNearlyEqualTo(o.m32);
    }

    public Matrix3x2<S> lerp(Matrix3x2<S> other, S amount) {
        return add(other.subtract(this).multiply(amount));
    }

    public Matrix3x2<S> multiply(Matrix3x2<S> o) {
        return new Matrix3x2<>(m11.multiply(o.m11).add(m12.multiply(o.m21)), m11.multiply(o.m12).add(m12.multiply(o.m22)),
                               m21.multiply(o.m11).add(m22.multiply(o.m21)), m21.multiply(o.m12).add(m22.multiply(o.m22)),
                               m31.multiply(o.m11).add(m32.multiply(o.m21)).add(o.m31),
                               m31.multiply(o.m12).add(m32.multiply(o.m22)).add(o.m32));
    }

    public Matrix3x2<S> multiply(S factor) {
        return new Matrix3x2<>(m11.multiply(factor), m12.multiply(factor), m21.multiply(factor), m22.multiply(factor),
                               m31.multiply(factor), m32.multiply(factor));
    }

    public Matrix3x2<S> negate() {
        return new Matrix3x2<>(m11.negate(), m12.negate(), m21.negate(), m22.negate(), m31.negate(), m32.negate());
    }

    public Matrix3x2<S> subtract(Matrix3x2<S> other) {
        return new Matrix3x2<>(m11.subtract(other.m11), m12.subtract(other.m12), m21.subtract(other.m21),
                               m22.subtract(other.m22), m31.subtract(other.m31), m32.subtract(other.m32));
    }

    @Override
    public String toString() {
        return "{ {" + m11 + " " + m12 + "} {" + m21 + " " + m22 + "} {" + m31 + " " + m32 + "} }";
    }

    /**
     * Outcome of an inversion. A singular matrix reports {@code success == false} with the identity as its matrix.
     */
    public record Inversion<S extends Scalar<S>>(boolean success, Matrix3x2<S> matrix) {
    }

    private record SinCos<S extends Scalar<S>>(S sin, S cos) {
    }
}
