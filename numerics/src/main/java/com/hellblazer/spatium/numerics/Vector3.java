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

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.lang.reflect.Array;
import java.util.List;
import java.util.Objects;

/**
 * Immutable 3D vector over any {@link Scalar} representation. Used both for points and for directions; no operation
 * assumes unit length unless documented.
 *
 * @param <S> the scalar representation
 * @author hal.hildebrand
 */
public final class Vector3<S extends Scalar<S>> {

    public final S x;
    public final S y;
    public final S z;

    public Vector3(S x, S y, S z) {
        this.x = Objects.requireNonNull(x, "x");
        this.y = Objects.requireNonNull(y, "y");
        this.z = Objects.requireNonNull(z, "z");
    }

    /**
     * Create from {@code values[start]}, {@code values[start + 1]} and {@code values[start + 2]}
     *
     * @throws IllegalArgumentException if fewer than three elements are available from start
     */
    public static <S extends Scalar<S>> Vector3<S> create(S[] values, int start) {
        if (start < 0 || values.length - start < 3) {
            throw new IllegalArgumentException(
            "Need 3 elements from index " + start + ", have " + Math.max(0, values.length - start));
        }
        return new Vector3<>(values[start], values[start + 1], values[start + 2]);
    }

    public static <S extends Scalar<S>> Vector3<S> from(ScalarType<S> type, Tuple3d tuple) {
        return of(type, tuple.x, tuple.y, tuple.z);
    }

    public static <S extends Scalar<S>> Vector3<S> of(ScalarType<S> type, double x, double y, double z) {
        return new Vector3<>(type.of(x), type.of(y), type.of(z));
    }

    public static <S extends Scalar<S>> Vector3<S> of(S x, S y, S z) {
        return new Vector3<>(x, y, z);
    }

    public static <S extends Scalar<S>> Vector3<S> one(ScalarType<S> type) {
        return splat(type.one());
    }

    public static <S extends Scalar<S>> Vector3<S> splat(S value) {
        return new Vector3<>(value, value, value);
    }

    public static <S extends Scalar<S>> Vector3<S> unitX(ScalarType<S> type) {
        return new Vector3<>(type.one(), type.zero(), type.zero());
    }

    public static <S extends Scalar<S>> Vector3<S> unitY(ScalarType<S> type) {
        return new Vector3<>(type.zero(), type.one(), type.zero());
    }

    public static <S extends Scalar<S>> Vector3<S> unitZ(ScalarType<S> type) {
        return new Vector3<>(type.zero(), type.zero(), type.one());
    }

    public static <S extends Scalar<S>> Vector3<S> zero(ScalarType<S> type) {
        return splat(type.zero());
    }

    public Vector3<S> abs() {
        return new Vector3<>(x.abs(), y.abs(), z.abs());
    }

    public Vector3<S> add(Vector3<S> other) {
        return new Vector3<>(x.add(other.x), y.add(other.y), z.add(other.z));
    }

    /**
     * @return the unsigned angle between this vector and the other, in radians
     */
    public S angle(Vector3<S> other) {
        return cross(other).length().atan2(dot(other));
    }

    /**
     * Parallel (or anti-parallel) test via the cross product.
     *
     * @param allowSmallError true to accept a nearly zero cross product, false to require an exact zero
     */
    public boolean areParallel(Vector3<S> other, boolean allowSmallError) {
        var cross = cross(other);
        return allowSmallError ? cross.isNearlyZero() : cross.isZero();
    }

    public boolean areParallel(Vector3<S> other) {
        return areParallel(other, true);
    }

    public Vector3<S> clamp(Vector3<S> min, Vector3<S> max) {
        return new Vector3<>(x.max(min.x).min(max.x), y.max(min.y).min(max.y), z.max(min.z).min(max.z));
    }

    public void copyTo(S[] destination, int start) {
        if (start < 0 || destination.length - start < 3) {
            throw new IllegalArgumentException(
            "Need room for 3 elements from index " + start + " in array of length " + destination.length);
        }
        destination[start] = x;
        destination[start + 1] = y;
        destination[start + 2] = z;
    }

    /**
     * Right-handed cross product
     */
    public Vector3<S> cross(Vector3<S> other) {
        return new Vector3<>(y.multiply(other.z).subtract(z.multiply(other.y)),
                             z.multiply(other.x).subtract(x.multiply(other.z)),
                             x.multiply(other.y).subtract(y.multiply(other.x)));
    }

    public S distance(Vector3<S> other) {
        return subtract(other).length();
    }

    public S distanceSquared(Vector3<S> other) {
        return subtract(other).lengthSquared();
    }

    public Vector3<S> divide(S divisor) {
        return new Vector3<>(x.divide(divisor), y.divide(divisor), z.divide(divisor));
    }

    public Vector3<S> divide(Vector3<S> other) {
        return new Vector3<>(x.divide(other.x), y.divide(other.y), z.divide(other.z));
    }

    public S dot(Vector3<S> other) {
        return x.multiply(other.x).add(y.multiply(other.y)).add(z.multiply(other.z));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Vector3<?> other && x.equals(other.x) && y.equals(other.y) && z.equals(other.z);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    public boolean isNearlyEqualTo(Vector3<S> other) {
        return x.isNearlyEqualTo(other.x) && y.isNearlyEqualTo(other.y) && z.isNearlyEqualTo(other.z);
    }

    public boolean isNearlyZero() {
        return x.isNearlyZero() && y.isNearlyZero() && z.isNearlyZero();
    }

    public boolean isZero() {
        return x.isZero() && y.isZero() && z.isZero();
    }

    /**
     * Euclidean length. The components are divided by the largest magnitude before squaring, so the result is finite
     * whenever the length itself is representable.
     */
    public S length() {
        var scale = x.abs().max(y.abs()).max(z.abs());
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
    public Vector3<S> lerp(Vector3<S> other, S amount) {
        return add(other.subtract(this).multiply(amount));
    }

    public Vector3<S> max(Vector3<S> other) {
        return new Vector3<>(x.max(other.x), y.max(other.y), z.max(other.z));
    }

    public Vector3<S> min(Vector3<S> other) {
        return new Vector3<>(x.min(other.x), y.min(other.y), z.min(other.z));
    }

    public Vector3<S> multiply(S factor) {
        return new Vector3<>(x.multiply(factor), y.multiply(factor), z.multiply(factor));
    }

    public Vector3<S> multiply(Vector3<S> other) {
        return new Vector3<>(x.multiply(other.x), y.multiply(other.y), z.multiply(other.z));
    }

    /**
     * Lossy conversion to another representation; each component is rounded to the target's precision.
     */
    public <T extends Scalar<T>> Vector3<T> narrowTo(ScalarType<T> target) {
        return new Vector3<>(target.convert(x), target.convert(y), target.convert(z));
    }

    public Vector3<S> negate() {
        return new Vector3<>(x.negate(), y.negate(), z.negate());
    }

    /**
     * Unit vector in the same direction. A zero vector has no direction: its components come back NaN, so callers that
     * can see one should check {@link #isZero()} first.
     */
    public Vector3<S> normalize() {
        return divide(length());
    }

    /**
     * Reflect about a plane with the given unit normal: {@code v - 2 (v . n) n}
     */
    public Vector3<S> reflect(Vector3<S> normal) {
        var two = type().two();
        return subtract(normal.multiply(two.multiply(dot(normal))));
    }

    /**
     * The rotation carrying this vector's direction onto the other's. Both are normalized first, so only direction
     * matters. Same-direction inputs give the identity, and opposite inputs a half turn about an axis perpendicular
     * to this vector.
     *
     * @return the rotation, or a quaternion of NaN components if either vector is zero and so has no direction
     */
    public Quaternion<S> rotationTo(Vector3<S> other) {
        var type = type();
        if (isZero() || other.isZero()) {
            var nan = type.nan();
            return new Quaternion<>(nan, nan, nan, nan);
        }
        var from = normalize();
        var to = other.normalize();
        var dot = from.dot(to);
        if (from.areParallel(to)) {
            if (dot.isPositive()) {
                return Quaternion.identity(type);
            }
            var axis = from.cross(unitX(type));
            if (axis.isNearlyZero()) {
                axis = from.cross(unitY(type));
            }
            return Quaternion.of(axis.normalize(), type.zero());
        }
        return Quaternion.of(from.cross(to), type.one().add(dot)).normalize();
    }

    public Vector3<S> sqrt() {
        return new Vector3<>(x.sqrt(), y.sqrt(), z.sqrt());
    }

    public Vector3<S> subtract(Vector3<S> other) {
        return new Vector3<>(x.subtract(other.x), y.subtract(other.y), z.subtract(other.z));
    }

    @SuppressWarnings("unchecked")
    public S[] toArray() {
        var array = (S[]) Array.newInstance(x.getClass(), 3);
        copyTo(array, 0);
        return array;
    }

    public List<S> toList() {
        return List.of(x, y, z);
    }

    public Point3d toPoint3d() {
        return new Point3d(x.doubleValue(), y.doubleValue(), z.doubleValue());
    }

    @Override
    public String toString() {
        return "<" + x + ", " + y + ", " + z + ">";
    }

    public Vector3d toVector3d() {
        return new Vector3d(x.doubleValue(), y.doubleValue(), z.doubleValue());
    }

    /**
     * Transform a position by an affine matrix, row-vector convention: {@code v * M}, translation included
     */
    public Vector3<S> transform(Matrix4x4<S> m) {
        return new Vector3<>(x.multiply(m.m11).add(y.multiply(m.m21)).add(z.multiply(m.m31)).add(m.m41),
                             x.multiply(m.m12).add(y.multiply(m.m22)).add(z.multiply(m.m32)).add(m.m42),
                             x.multiply(m.m13).add(y.multiply(m.m23)).add(z.multiply(m.m33)).add(m.m43));
    }

    /**
     * Rotate by a unit quaternion. Expands {@code q v q^-1} with doubled components instead of two Hamilton products.
     */
    public Vector3<S> transform(Quaternion<S> rotation) {
        var one = type().one();
        var x2 = rotation.x.add(rotation.x);
        var y2 = rotation.y.add(rotation.y);
        var z2 = rotation.z.add(rotation.z);

        var wx2 = rotation.w.multiply(x2);
        var wy2 = rotation.w.multiply(y2);
        var wz2 = rotation.w.multiply(z2);
        var xx2 = rotation.x.multiply(x2);
        var xy2 = rotation.x.multiply(y2);
        var xz2 = rotation.x.multiply(z2);
        var yy2 = rotation.y.multiply(y2);
        var yz2 = rotation.y.multiply(z2);
        var zz2 = rotation.z.multiply(z2);

        return new Vector3<>(
        x.multiply(one.subtract(yy2).subtract(zz2)).add(y.multiply(xy2.subtract(wz2))).add(z.multiply(xz2.add(wy2))),
        x.multiply(xy2.add(wz2)).add(y.multiply(one.subtract(xx2).subtract(zz2))).add(z.multiply(yz2.subtract(wx2))),
        x.multiply(xz2.subtract(wy2)).add(y.multiply(yz2.add(wx2))).add(z.multiply(one.subtract(xx2).subtract(yy2))));
    }

    /**
     * Transform a direction: the matrix's translation row is ignored
     */
    public Vector3<S> transformNormal(Matrix4x4<S> m) {
        return new Vector3<>(x.multiply(m.m11).add(y.multiply(m.m21)).add(z.multiply(m.m31)),
                             x.multiply(m.m12).add(y.multiply(m.m22)).add(z.multiply(m.m32)),
                             x.multiply(m.m13).add(y.multiply(m.m23)).add(z.multiply(m.m33)));
    }

    public ScalarType<S> type() {
        return x.type();
    }

    /**
     * Precision-preserving conversion.
     *
     * @throws IllegalArgumentException if the target cannot hold every value of this vector's representation
     */
    public <T extends Scalar<T>> Vector3<T> widenTo(ScalarType<T> target) {
        if (!target.canRepresent(type())) {
            throw new IllegalArgumentException(
            "Conversion from " + type().name() + " to " + target.name() + " narrows; use narrowTo");
        }
        return narrowTo(target);
    }
}
