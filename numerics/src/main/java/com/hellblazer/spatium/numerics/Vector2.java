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

import javax.vecmath.Tuple2d;
import javax.vecmath.Vector2d;
import java.lang.reflect.Array;
import java.util.List;
import java.util.Objects;

/**
 * Immutable 2D vector over any {@link Scalar} representation.
 *
 * @param <S> the scalar representation
 * @author hal.hildebrand
 */
public final class Vector2<S extends Scalar<S>> {

    public final S x;
    public final S y;

    public Vector2(S x, S y) {
        this.x = Objects.requireNonNull(x, "x");
        this.y = Objects.requireNonNull(y, "y");
    }

    public static <S extends Scalar<S>> Vector2<S> create(S[] values, int start) {
        if (start < 0 || values.length - start < 2) {
            throw new IllegalArgumentException(
            "Need 2 elements from index " + start + ", have " + Math.max(0, values.length - start));
        }
        return new Vector2<>(values[start], values[start + 1]);
    }

    public static <S extends Scalar<S>> Vector2<S> from(ScalarType<S> type, Tuple2d tuple) {
        return of(type, tuple.x, tuple.y);
    }

    public static <S extends Scalar<S>> Vector2<S> of(ScalarType<S> type, double x, double y) {
        return new Vector2<>(type.of(x), type.of(y));
    }

    public static <S extends Scalar<S>> Vector2<S> of(S x, S y) {
        return new Vector2<>(x, y);
    }

    public static <S extends Scalar<S>> Vector2<S> one(ScalarType<S> type) {
        return new Vector2<>(type.one(), type.one());
    }

    public static <S extends Scalar<S>> Vector2<S> unitX(ScalarType<S> type) {
        return new Vector2<>(type.one(), type.zero());
    }

    public static <S extends Scalar<S>> Vector2<S> unitY(ScalarType<S> type) {
        return new Vector2<>(type.zero(), type.one());
    }

    public static <S extends Scalar<S>> Vector2<S> zero(ScalarType<S> type) {
        return new Vector2<>(type.zero(), type.zero());
    }

    public Vector2<S> abs() {
        return new Vector2<>(x.abs(), y.abs());
    }

    public Vector2<S> add(Vector2<S> other) {
        return new Vector2<>(x.add(other.x), y.add(other.y));
    }

    /**
     * Unsigned angle in radians, from the perp-dot and dot products
     */
    public S angle(Vector2<S> other) {
        var perpDot = x.multiply(other.y).subtract(y.multiply(other.x));
        return perpDot.abs().atan2(dot(other));
    }

    public Vector2<S> clamp(Vector2<S> min, Vector2<S> max) {
        return new Vector2<>(x.max(min.x).min(max.x), y.max(min.y).min(max.y));
    }

    public void copyTo(S[] destination, int start) {
        if (start < 0 || destination.length - start < 2) {
            throw new IllegalArgumentException(
            "Need room for 2 elements from index " + start + " in array of length " + destination.length);
        }
        destination[start] = x;
        destination[start + 1] = y;
    }

    public S distance(Vector2<S> other) {
        return subtract(other).length();
    }

    public S distanceSquared(Vector2<S> other) {
        return subtract(other).lengthSquared();
    }

    public Vector2<S> divide(S divisor) {
        return new Vector2<>(x.divide(divisor), y.divide(divisor));
    }

    public Vector2<S> divide(Vector2<S> other) {
        return new Vector2<>(x.divide(other.x), y.divide(other.y));
    }

    public S dot(Vector2<S> other) {
        return x.multiply(other.x).add(y.multiply(other.y));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Vector2<?> other && x.equals(other.x) && y.equals(other.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    public boolean isNearlyEqualTo(Vector2<S> other) {
        return x.isNearlyEqualTo(other.x) && y.isNearlyEqualTo(other.y);
    }

    public boolean isNearlyZero() {
        return x.isNearlyZero() && y.isNearlyZero();
    }

    public boolean isZero() {
        return x.isZero() && y.isZero();
    }

    /**
     * Euclidean length, computed with the components scaled by the larger magnitude
     */
    public S length() {
        var scale = x.abs().max(y.abs());
        if (scale.isZero() || !scale.isFinite()) {
            return lengthSquared().sqrt();
        }
        return divide(scale).lengthSquared().sqrt().multiply(scale);
    }

    public S lengthSquared() {
        return dot(this);
    }

    public Vector2<S> lerp(Vector2<S> other, S amount) {
        return add(other.subtract(this).multiply(amount));
    }

    public Vector2<S> max(Vector2<S> other) {
        return new Vector2<>(x.max(other.x), y.max(other.y));
    }

    public Vector2<S> min(Vector2<S> other) {
        return new Vector2<>(x.min(other.x), y.min(other.y));
    }

    public Vector2<S> multiply(S factor) {
        return new Vector2<>(x.multiply(factor), y.multiply(factor));
    }

    public Vector2<S> multiply(Vector2<S> other) {
        return new Vector2<>(x.multiply(other.x), y.multiply(other.y));
    }

    public <T extends Scalar<T>> Vector2<T> narrowTo(ScalarType<T> target) {
        return new Vector2<>(target.convert(x), target.convert(y));
    }

    public Vector2<S> negate() {
        return new Vector2<>(x.negate(), y.negate());
    }

    /**
     * Unit vector in the same direction; a zero vector yields NaN components
     */
    public Vector2<S> normalize() {
        return divide(length());
    }

    public Vector2<S> reflect(Vector2<S> normal) {
        var two = type().two();
        return subtract(normal.multiply(two.multiply(dot(normal))));
    }

    /**
     * Counter-clockwise rotation about the origin
     */
    public Vector2<S> rotate(S radians) {
        var cos = radians.cos();
        var sin = radians.sin();
        return new Vector2<>(x.multiply(cos).subtract(y.multiply(sin)), x.multiply(sin).add(y.multiply(cos)));
    }

    public Vector2<S> sqrt() {
        return new Vector2<>(x.sqrt(), y.sqrt());
    }

    public Vector2<S> subtract(Vector2<S> other) {
        return new Vector2<>(x.subtract(other.x), y.subtract(other.y));
    }

    @SuppressWarnings("unchecked")
    public S[] toArray() {
        var array = (S[]) Array.newInstance(x.getClass(), 2);
        copyTo(array, 0);
        return array;
    }

    public List<S> toList() {
        return List.of(x, y);
    }

    @Override
    public String toString() {
        return "<" + x + ", " + y + ">";
    }

    public Vector2d toVector2d() {
        return new Vector2d(x.doubleValue(), y.doubleValue());
    }

    public Vector2<S> transform(Matrix3x2<S> m) {
        return new Vector2<>(x.multiply(m.m11).add(y.multiply(m.m21)).add(m.m31),
                             x.multiply(m.m12).add(y.multiply(m.m22)).add(m.m32));
    }

    /**
     * Treats this vector as (x, y, 0, 1)
     */
    public Vector2<S> transform(Matrix4x4<S> m) {
        return new Vector2<>(x.multiply(m.m11).add(y.multiply(m.m21)).add(m.m41),
                             x.multiply(m.m12).add(y.multiply(m.m22)).add(m.m42));
    }

    /**
     * Rotate (x, y, 0) by the quaternion and drop z
     */
    public Vector2<S> transform(Quaternion<S> rotation) {
        var one = type().one();
        var x2 = rotation.x.add(rotation.x);
        var y2 = rotation.y.add(rotation.y);
        var z2 = rotation.z.add(rotation.z);

        var wz2 = rotation.w.multiply(z2);
        var xx2 = rotation.x.multiply(x2);
        var xy2 = rotation.x.multiply(y2);
        var yy2 = rotation.y.multiply(y2);
        var zz2 = rotation.z.multiply(z2);

        return new Vector2<>(x.multiply(one.subtract(yy2).subtract(zz2)).add(y.multiply(xy2.subtract(wz2))),
                             x.multiply(xy2.add(wz2)).add(y.multiply(one.subtract(xx2).subtract(zz2))));
    }

    public Vector2<S> transformNormal(Matrix3x2<S> m) {
        return new Vector2<>(x.multiply(m.m11).add(y.multiply(m.m21)), x.multiply(m.m12).add(y.multiply(m.m22)));
    }

    public Vector2<S> transformNormal(Matrix4x4<S> m) {
        return new Vector2<>(x.multiply(m.m11).add(y.multiply(m.m21)), x.multiply(m.m12).add(y.multiply(m.m22)));
    }

    public ScalarType<S> type() {
        return x.type();
    }

    /**
     * @throws IllegalArgumentException if the target cannot hold every value of this vector's representation
     */
    public <T extends Scalar<T>> Vector2<T> widenTo(ScalarType<T> target) {
        if (!target.canRepresent(type())) {
            throw new IllegalArgumentException(
            "Conversion from " + type().name() + " to " + target.name() + " narrows; use narrowTo");
        }
        return narrowTo(target);
    }
}
