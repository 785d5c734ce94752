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

import javax.vecmath.Tuple4d;
import javax.vecmath.Vector4d;
import java.lang.reflect.Array;
import java.util.List;
import java.util.Objects;

/**
 * Immutable 4D vector over any {@link Scalar} representation. Mostly seen as a homogeneous coordinate: a position has
 * {@code w = 1}, a direction {@code w = 0}.
 *
 * @param <S> the scalar representation
 * @author hal.hildebrand
 */
public final class Vector4<S extends Scalar<S>> {

    public final S x;
    public final S y;
    public final S z;
    public final S w;

    public Vector4(S x, S y, S z, S w) {
        this.x = Objects.requireNonNull(x, "x");
        this.y = Objects.requireNonNull(y, "y");
        this.z = Objects.requireNonNull(z, "z");
        this.w = Objects.requireNonNull(w, "w");
    }

    /**
     * Create from the four elements of {@code values} beginning at {@code start}
     *
     * @throws IllegalArgumentException if fewer than four elements are available from start
     */
    public static <S extends Scalar<S>> Vector4<S> create(S[] values, int start) {
        if (start < 0 || values.length - start < 4) {
            throw new IllegalArgumentException(
            "Need 4 elements from index " + start + ", have " + Math.max(0, values.length - start));
        }
        return new Vector4<>(values[start], values[start + 1], values[start + 2], values[start + 3]);
    }

    public static <S extends Scalar<S>> Vector4<S> from(ScalarType<S> type, Tuple4d tuple) {
        return of(type, tuple.x, tuple.y, tuple.z, tuple.w);
    }

    public static <S extends Scalar<S>> Vector4<S> of(ScalarType<S> type, double x, double y, double z, double w) {
        return new Vector4<>(type.of(x), type.of(y), type.of(z), type.of(w));
    }

    public static <S extends Scalar<S>> Vector4<S> of(Vector3<S> xyz, S w) {
        return new Vector4<>(xyz.x, xyz.y, xyz.z, w);
    }

    public static <S extends Scalar<S>> Vector4<S> one(ScalarType<S> type) {
        return splat(type.one());
    }

    /**
     * Homogeneous form of a 2D position: {@code (x, y, 0, 1)}
     */
    public static <S extends Scalar<S>> Vector4<S> position(Vector2<S> position) {
        var type = position.type();
        return new Vector4<>(position.x, position.y, type.zero(), type.one());
    }

    /**
     * Homogeneous form of a 3D position: {@code (x, y, z, 1)}
     */
    public static <S extends Scalar<S>> Vector4<S> position(Vector3<S> position) {
        return of(position, position.type().one());
    }

    public static <S extends Scalar<S>> Vector4<S> splat(S value) {
        return new Vector4<>(value, value, value, value);
    }

    public static <S extends Scalar<S>> Vector4<S> unitW(ScalarType<S> type) {
        return new Vector4<>(type.zero(), type.zero(), type.zero(), type.one());
    }

    public static <S extends Scalar<S>> Vector4<S> unitX(ScalarType<S> type) {
        return new Vector4<>(type.one(), type.zero(), type.zero(), type.zero());
    }

    public static <S extends Scalar<S>> Vector4<S> unitY(ScalarType<S> type) {
        return new Vector4<>(type.zero(), type.one(), type.zero(), type.zero());
    }

    public static <S extends Scalar<S>> Vector4<S> unitZ(ScalarType<S> type) {
        return new Vector4<>(type.zero(), type.zero(), type.one(), type.zero());
    }

    public static <S extends Scalar<S>> Vector4<S> zero(ScalarType<S> type) {
        return splat(type.zero());
    }

    public Vector4<S> abs() {
        return new Vector4<>(x.abs(), y.abs(), z.abs(), w.abs());
    }

    public Vector4<S> add(Vector4<S> other) {
        return new Vector4<>(x.add(other.x), y.add(other.y), z.add(other.z), w.add(other.w));
    }

    public Vector4<S> clamp(Vector4<S> min, Vector4<S> max) {
        return new Vector4<>(x.max(min.x).min(max.x), y.max(min.y).min(max.y), z.max(min.z).min(max.z),
                             w.max(min.w).min(max.w));
    }

    public void copyTo(S[] destination, int start) {
        if (start < 0 || destination.length - start < 4) {
            throw new IllegalArgumentException(
            "Need room for 4 elements from index " + start + " in array of length " + destination.length);
        }
        destination[start] = x;
        destination[start + 1] = y;
        destination[start + 2] = z;
        destination[start + 3] = w;
    }

    public S distance(Vector4<S> other) {
        return subtract(other).length();
    }

    public S distanceSquared(Vector4<S> other) {
        return subtract(other).lengthSquared();
    }

    public Vector4<S> divide(S divisor) {
        return new Vector4<>(x.divide(divisor), y.divide(divisor), z.divide(divisor), w.divide(divisor));
    }

    public Vector4<S> divide(Vector4<S> other) {
        return new Vector4<>(x.divide(other.x), y.divide(other.y), z.divide(other.z), w.divide(other.w));
    }

    public S dot(Vector4<S> other) {
        return x.multiply(other.x).add(y.multiply(other.y)).add(z.multiply(other.z)).add(w.multiply(other.w));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Vector4<?> other && x.equals(other.x) && y.equals(other.y) && z.equals(other.z)
        && w.equals(other.w);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z, w);
    }

    public boolean isNearlyEqualTo(Vector4<S> other) {
        return x.isNearlyEqualTo(other.x) && y.isNearlyEqualTo(other.y) && z.isNearlyEqualTo(other.z)
        && w.isNearlyEqualTo(other.w);
    }

    public boolean isNearlyZero() {
        return x.isNearlyZero() && y.isNearlyZero() && z.isNearlyZero() && w.isNearlyZero();
    }

    public boolean isZero() {
        return x.isZero() && y.isZero() && z.isZero() && w.isZero();
    }

    /**
     * Euclidean length, computed with the components scaled by the largest magnitude
     */
    public S length() {
        var scale = x.abs().max(y.abs()).max(z.abs()).max(w.abs());
        if (scale.isZero() || !scale.isFinite()) {
            return lengthSquared().sqrt();
        }
        return divide(scale).lengthSquared().sqrt().multiply(scale);
    }

    public S lengthSquared() {
        return dot(this);
    }

    /**
     * Linear interpolation: {@code this + (other - this) * amount}
     */
    public Vector4<S> lerp(Vector4<S> other, S amount) {
        return add(other.subtract(this).multiply(amount));
    }

    public Vector4<S> max(Vector4<S> other) {
        return new Vector4<>(x.max(other.x), y.max(other.y), z.max(other.z), w.max(other.w));
    }

    public Vector4<S> min(Vector4<S> other) {
        return new Vector4<>(x.min(other.x), y.min(other.y), z.min(other.z), w.min(other.w));
    }

    public Vector4<S> multiply(S factor) {
        return new Vector4<>(x.multiply(factor), y.multiply(factor), z.multiply(factor), w.multiply(factor));
    }

    public Vector4<S> multiply(Vector4<S> other) {
        return new Vector4<>(x.multiply(other.x), y.multiply(other.y), z.multiply(other.z), w.multiply(other.w));
    }

    public <T extends Scalar<T>> Vector4<T> narrowTo(ScalarType<T> target) {
        return new Vector4<>(target.convert(x), target.convert(y), target.convert(z), target.convert(w));
    }

    public Vector4<S> negate() {
        return new Vector4<>(x.negate(), y.negate(), z.negate(), w.negate());
    }

    /**
     * Unit vector in the same direction; NaN components for the zero vector
     */
    public Vector4<S> normalize() {
        return divide(length());
    }

    /**
     * Reflect about a hyperplane with the given unit normal: {@code v - 2 (v . n) n}
     */
    public Vector4<S> reflect(Vector4<S> normal) {
        return subtract(normal.multiply(type().two().multiply(dot(normal))));
    }

    public Vector4<S> sqrt() {
        return new Vector4<>(x.sqrt(), y.sqrt(), z.sqrt(), w.sqrt());
    }

    public Vector4<S> subtract(Vector4<S> other) {
        return new Vector4<>(x.subtract(other.x), y.subtract(other.y), z.subtract(other.z), w.subtract(other.w));
    }

    @SuppressWarnings("unchecked")
    public S[] toArray() {
        var array = (S[]) Array.newInstance(x.getClass(), 4);
        copyTo(array, 0);
        return array;
    }

    public List<S> toList() {
        return List.of(x, y, z, w);
    }

    @Override
    public String toString() {
        return "<" + x + ", " + y + ", " + z + ", " + w + ">";
    }

    public Vector4d toVector4d() {
        return new Vector4d(x.doubleValue(), y.doubleValue(), z.doubleValue(), w.doubleValue());
    }

    /**
     * Full homogeneous transform, row-vector convention: {@code v * M}
     */
    public Vector4<S> transform(Matrix4x4<S> m) {
        return new Vector4<>(x.multiply(m.m11).add(y.multiply(m.m21)).add(z.multiply(m.m31)).add(w.multiply(m.m41)),
                             x.multiply(m.m12).add(y.multiply(m.m22)).add(z.multiply(m.m32)).add(w.multiply(m.m42)),
                             x.multiply(m.m13).add(y.multiply(m.m23)).add(z.multiply(m.m33)).add(w.multiply(m.m43)),
                             x.multiply(m.m14).add(y.multiply(m.m24)).add(z.multiply(m.m34)).add(w.multiply(m.m44)));
    }

    /**
     * Rotate the spatial part by a unit quaternion; w is carried through unchanged
     */
    public Vector4<S> transform(Quaternion<S> rotation) {
        return of(xyz().transform(rotation), w);
    }

    public ScalarType<S> type() {
        return x.type();
    }

    /**
     * Precision-preserving conversion.
     *
     * @throws IllegalArgumentException if the target cannot hold every value of this vector's representation
     */
    public <T extends Scalar<T>> Vector4<T> widenTo(ScalarType<T> target) {
        if (!target.canRepresent(type())) {
            throw new IllegalArgumentException(
            "Conversion from " + type().name() + " to " + target.name() + " narrows; use narrowTo");
        }
        return narrowTo(target);
    }

    /**
     * The spatial part, w dropped
     */
    public Vector3<S> xyz() {
        return new Vector3<>(x, y, z);
    }
}
