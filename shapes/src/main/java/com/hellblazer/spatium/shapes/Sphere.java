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

import java.util.Objects;

/**
 * A solid ball
 *
 * @author hal.hildebrand
 */
public final class Sphere<S extends Scalar<S>> extends Shape<S> {

    private final S radius;
    private final S volume;

    public Sphere(S radius, Vector3<S> position) {
        super(position);
        this.radius = requireNonNegative(radius, "radius");
        volume = ballVolume(radius);
    }

    static <S extends Scalar<S>> S ballVolume(S radius) {
        var type = radius.type();
        return type.pi().multiply(radius.cube()).multiply(type.of(4L)).divide(type.of(3L));
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Sphere<?> other && radius.equals(other.radius) && position.equals(other.position);
    }

    @Override
    public Sphere<S> getCloneWithRotation(Quaternion<S> rotation) {
        return this;
    }

    @Override
    public S getContainingRadius() {
        return radius;
    }

    @Override
    public Sphere<S> getCopyAtPosition(Vector3<S> position) {
        return new Sphere<>(radius, position);
    }

    @Override
    public Vector3<S> getHighestPoint() {
        return position.add(Vector3.unitY(type()).multiply(radius));
    }

    @Override
    public Vector3<S> getLowestPoint() {
        return position.subtract(Vector3.unitY(type()).multiply(radius));
    }

    public S getRadius() {
        return radius;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.SPHERE;
    }

    @Override
    public S getSmallestDimension() {
        return radius.multiply(type().two());
    }

    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        if (direction.isZero()) {
            return position;
        }
        return position.add(direction.normalize().multiply(radius));
    }

    @Override
    public S getVolume() {
        return volume;
    }

    @Override
    public int hashCode() {
        return Objects.hash(radius, position);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        return atMost(point.distance(position), radius);
    }

    @Override
    public Sphere<S> scaleByDimension(S factor) {
        return new Sphere<>(radius.multiply(requireNonNegative(factor, "factor")), position);
    }

    @Override
    public String toString() {
        return "Sphere{radius=" + radius + ", position=" + position + "}";
    }
}
