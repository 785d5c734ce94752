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
package com.hellblazer.spatium.shapes;

import com.hellblazer.spatium.numerics.Quaternion;
import com.hellblazer.spatium.numerics.Vector3;
import com.hellblazer.spatium.numerics.scalar.Scalar;
import com.hellblazer.spatium.numerics.scalar.ScalarType;

import java.util.Objects;
import java.util.Optional;

/**
 * Base of the closed family of solid shapes. Every shape is immutable: a change of pose or size yields a new instance,
 * and derived facts are computed once at construction.
 * <p>
 * The position of a shape is its reference point: the centre for most kinds, the midpoint of a line, the apex of a
 * frustum. {@link #getContainingRadius()} is measured from it.
 *
 * @param <S> the scalar representation
 * @author hal.hildebrand
 */
public abstract sealed class Shape<S extends Scalar<S>>
permits Capsule, Cone, Cuboid, Cylinder, Ellipsoid, Frustum, HollowSphere, Line, SinglePoint, Sphere, Torus {

    protected final Vector3<S> position;

    protected Shape(Vector3<S> position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    /**
     * Inclusive comparison, tolerant of rounding at the boundary
     */
    static <S extends Scalar<S>> boolean atMost(S value, S limit) {
        return value.compareTo(limit) <= 0 || value.isNearlyEqualTo(limit);
    }

    /**
     * Coordinate 0, 1 or 2 of a vector
     */
    static <S extends Scalar<S>> S component(Vector3<S> vector, int index) {
        return switch (index) {
            case 0 -> vector.x;
            case 1 -> vector.y;
            default -> vector.z;
        };
    }

    /**
     * Unit direction of an axis; a zero axis falls back to +Y so that degenerate shapes stay well defined
     */
    static <S extends Scalar<S>> Vector3<S> direction(Vector3<S> axis) {
        return axis.isZero() ? Vector3.unitY(axis.type()) : axis.normalize();
    }

    /**
     * {@code sqrt(a^2 + b^2)} without overflow of the intermediate squares
     */
    static <S extends Scalar<S>> S hypot(S a, S b) {
        return new Vector3<>(a, b, a.type().zero()).length();
    }

    static <S extends Scalar<S>> S requireNonNegative(S value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNaN() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0: " + value);
        }
        return value;
    }

    /**
     * Unit vector along {@code vector} with the component parallel to {@code axis} (a unit vector) removed, or null
     * when the two are parallel
     */
    static <S extends Scalar<S>> Vector3<S> perpendicular(Vector3<S> vector, Vector3<S> axis) {
        var radial = vector.subtract(axis.multiply(vector.dot(axis)));
        return radial.isNearlyZero() ? null : radial.normalize();
    }

    public abstract Shape<S> getCloneWithRotation(Quaternion<S> rotation);

    /**
     * The point at which this shape, moving along {@code path}, first touches {@code other}.
     * <p>
     * The mover is swept as a capsule of its containing radius, so the answer is conservative for non-spherical
     * shapes.
     *
     * @return the position of this shape's reference point at first contact, or empty if no contact occurs along the
     * path
     */
    public Optional<Vector3<S>> getCollisionPoint(Vector3<S> path, Shape<S> other) {
        var sweep = new Capsule<>(path, getContainingRadius(), position.add(path.multiply(type().half())));
        return sweep.getCollisionPoint(other);
    }

    /**
     * Radius of a sphere about {@link #getPosition()} which contains the whole shape
     */
    public abstract S getContainingRadius();

    public abstract Shape<S> getCopyAtPosition(Vector3<S> position);

    /**
     * The point of this shape with the greatest Y coordinate
     */
    public abstract Vector3<S> getHighestPoint();

    /**
     * The point of this shape with the least Y coordinate
     */
    public abstract Vector3<S> getLowestPoint();

    public Vector3<S> getPosition() {
        return position;
    }

    /**
     * The orientation of this shape. Kinds whose orientation is carried by an axis, or which have none, report the
     * identity.
     */
    public Quaternion<S> getRotation() {
        return Quaternion.identity(type());
    }

    public abstract ShapeType getShapeType();

    /**
     * The shortest extent of the shape along its own principal axes, before rotation
     */
    public abstract S getSmallestDimension();

    /**
     * The point of the shape, or of its convex hull, furthest in the given direction. Drives the GJK query.
     */
    public abstract Vector3<S> getSupport(Vector3<S> direction);

    public abstract S getVolume();

    public boolean intersects(Shape<S> other) {
        return ShapeIntersector.intersects(this, other);
    }

    /**
     * @return true if the point lies inside the shape or on its boundary
     */
    public abstract boolean isPointWithin(Vector3<S> point);

    /**
     * Multiply every linear dimension by {@code factor}. Zero collapses the shape to a degenerate one at the same
     * position.
     *
     * @throws IllegalArgumentException if the factor is negative
     */
    public abstract Shape<S> scaleByDimension(S factor);

    /**
     * Scale uniformly so that the volume is multiplied by {@code factor}
     *
     * @throws IllegalArgumentException if the factor is negative
     */
    public Shape<S> scaleVolume(S factor) {
        return scaleByDimension(requireNonNegative(factor, "factor").cbrt());
    }

    public ScalarType<S> type() {
        return position.type();
    }
}
