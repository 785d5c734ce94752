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

import java.util.Objects;

/**
 * Immutable plane {@code normal . p + d = 0}. With a unit normal, {@link #dotCoordinate(Vector3)} is the signed
 * distance of a point, positive on the side the normal faces.
 *
 * @param <S> the scalar representation
 * @author hal.hildebrand
 */
public final class Plane<S extends Scalar<S>> {

    public final Vector3<S> normal;
    public final S          d;

    public Plane(Vector3<S> normal, S d) {
        this.normal = Objects.requireNonNull(normal, "normal");
        this.d = Objects.requireNonNull(d, "d");
    }

    /**
     * Plane through three points; the normal follows the right-hand rule over p1, p2, p3
     */
    public static <S extends Scalar<S>> Plane<S> createFromVertices(Vector3<S> p1, Vector3<S> p2, Vector3<S> p3) {
        var normal = p2.subtract(p1).cross(p3.subtract(p1)).normalize();
        return new Plane<>(normal, normal.dot(p1).negate());
    }

    public static <S extends Scalar<S>> Plane<S> of(S x, S y, S z, S d) {
        return new Plane<>(new Vector3<>(x, y, z), d);
    }

    public static <S extends Scalar<S>> Plane<S> of(Vector4<S> coefficients) {
        return new Plane<>(coefficients.xyz(), coefficients.w);
    }

    /**
     * Dot product of the coefficients (normal, d) with a homogeneous vector. A position (w = 1) gives
     * {@link #dotCoordinate(Vector3)}, a direction (w = 0) gives {@link #dotNormal(Vector3)}.
     */
    public S dot(Vector4<S> value) {
        return toVector4().dot(value);
    }

    public S dotCoordinate(Vector3<S> point) {
        return normal.dot(point).add(d);
    }

    public S dotNormal(Vector3<S> vector) {
        return normal.dot(vector);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Plane<?> other && normal.equals(other.normal) && d.equals(other.d);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normal, d);
    }

    public boolean isNearlyEqualTo(Plane<S> other) {
        return normal.isNearlyEqualTo(other.normal) && d.isNearlyEqualTo(other.d);
    }

    /**
     * Scale so the normal has unit length. Already-unit planes are returned as is.
     */
    public Plane<S> normalize() {
        var lengthSquared = normal.lengthSquared();
        var one = d.type().one();
        if (lengthSquared.subtract(one).isNearlyZero()) {
            return this;
        }
        var inverse = one.divide(lengthSquared.sqrt());
        return new Plane<>(normal.multiply(inverse), d.multiply(inverse));
    }

    @Override
    public String toString() {
        return "{normal: " + normal + ", d: " + d + "}";
    }

    /**
     * The coefficients (normal.x, normal.y, normal.z, d)
     */
    public Vector4<S> toVector4() {
        return Vector4.of(normal, d);
    }

    /**
     * Transform by an affine matrix. Planes are covariant: the coefficients are multiplied by the transpose of the
     * inverse. A singular matrix leaves the plane unchanged.
     */
    public Plane<S> transform(Matrix4x4<S> matrix) {
        var m = matrix.invert().matrix();
        var x = normal.x;
        var y = normal.y;
        var z = normal.z;
        var w = d;
        return of(x.multiply(m.m11).add(y.multiply(m.m12)).add(z.multiply(m.m13)).add(w.multiply(m.m14)),
                  x.multiply(m.m21).add(y.multiply(m.m22)).add(z.multiply(m.m23)).add(w.multiply(m.m24)),
                  x.multiply(m.m31).add(y.multiply(m.m32)).add(z.multiply(m.m33)).add(w.multiply(m.m34)),
                  x.multiply(m.m41).add(y.multiply(m.m42)).add(z.multiply(m.m43)).add(w.multiply(m.m44)));
    }

    /**
     * Rotate about the origin
     */
    public Plane<S> transform(Quaternion<S> rotation) {
        return new Plane<>(normal.transform(rotation), d);
    }
}
