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
 * A solid right circular cylinder whose axis runs through the position, half its length to either side
 *
 * @author hal.hildebrand
 */
public final class Cylinder<S extends Scalar<S>> extends Shape<S> {

    private final Vector3<S> axis;
    private final S          radius;
    private final Vector3<S> unitAxis;
    private final S          halfLength;
    private final S          containingRadius;
    private final Vector3<S> highest;
    private final Vector3<S> lowest;

    public Cylinder(Vector3<S> axis, S radius, Vector3<S> position) {
        super(position);
        this.axis = Objects.requireNonNull(axis, "axis");
        this.radius = requireNonNegative(radius, "radius");
        unitAxis = direction(axis);
        halfLength = axis.length().multiply(type().half());
        containingRadius = hypot(halfLength, radius);
        highest = getSupport(Vector3.unitY(type()));
        lowest = getSupport(Vector3.unitY(type()).negate());
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Cylinder<?> other && axis.equals(other.axis) && radius.equals(other.radius)
        && position.equals(other.position);
    }

    public Vector3<S> getAxis() {
        return axis;
    }

    @Override
    public Cylinder<S> getCloneWithRotation(Quaternion<S> rotation) {
        return new Cylinder<>(axis.transform(rotation), radius, position);
    }

    @Override
    public S getContainingRadius() {
        return containingRadius;
    }

    @Override
    public Cylinder<S> getCopyAtPosition(Vector3<S> position) {
        return new Cylinder<>(axis, radius, position);
    }

    public S getHalfLength() {
        return halfLength;
    }

    @Override
    public Vector3<S> getHighestPoint() {
        return highest;
    }

    @Override
    public Vector3<S> getLowestPoint() {
        return lowest;
    }

    public S getRadius() {
        return radius;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.CYLINDER;
    }

    @Override
    public S getSmallestDimension() {
        return radius.multiply(type().two()).min(halfLength.multiply(type().two()));
    }

    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        var along = direction.dot(unitAxis);
        var cap = position.add(unitAxis.multiply(along.isNegative() ? halfLength.negate() : halfLength));
        var radial = perpendicular(direction, unitAxis);
        return radial == null ? cap : cap.add(radial.multiply(radius));
    }

    /**
     * Unit direction of the axis
     */
    public Vector3<S> getUnitAxis() {
        return unitAxis;
    }

    @Override
    public S getVolume() {
        return type().pi().multiply(radius.square()).multiply(halfLength.multiply(type().two()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(axis, radius, position);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        var offset = point.subtract(position);
        var along = offset.dot(unitAxis);
        var radial = offset.subtract(unitAxis.multiply(along));
        return atMost(along.abs(), halfLength) && atMost(radial.length(), radius);
    }

    @Override
    public Cylinder<S> scaleByDimension(S factor) {
        requireNonNegative(factor, "factor");
        return new Cylinder<>(axis.multiply(factor), radius.multiply(factor), position);
    }

    @Override
    public String toString() {
        return "Cylinder{axis=" + axis + ", radius=" + radius + ", position=" + position + "}";
    }
}
