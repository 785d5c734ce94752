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
 * A solid right circular cone. The apex lies half the axis behind the position, the circular base of the given radius
 * half the axis ahead of it.
 *
 * @author hal.hildebrand
 */
public final class Cone<S extends Scalar<S>> extends Shape<S> {

    private final Vector3<S> axis;
    private final S          radius;
    private final Vector3<S> unitAxis;
    private final Vector3<S> apex;
    private final Vector3<S> baseCenter;
    private final S          length;
    private final S          containingRadius;
    private final Vector3<S> highest;
    private final Vector3<S> lowest;

    public Cone(Vector3<S> axis, S radius, Vector3<S> position) {
        super(position);
        this.axis = Objects.requireNonNull(axis, "axis");
        this.radius = requireNonNegative(radius, "radius");
        unitAxis = direction(axis);
        var halfAxis = axis.multiply(type().half());
        apex = position.subtract(halfAxis);
        baseCenter = position.add(halfAxis);
        length = axis.length();
        containingRadius = hypot(halfAxis.length(), radius);
        highest = getSupport(Vector3.unitY(type()));
        lowest = getSupport(Vector3.unitY(type()).negate());
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Cone<?> other && axis.equals(other.axis) && radius.equals(other.radius)
        && position.equals(other.position);
    }

    public Vector3<S> getApex() {
        return apex;
    }

    public Vector3<S> getAxis() {
        return axis;
    }

    public Vector3<S> getBaseCenter() {
        return baseCenter;
    }

    @Override
    public Cone<S> getCloneWithRotation(Quaternion<S> rotation) {
        return new Cone<>(axis.transform(rotation), radius, position);
    }

    @Override
    public S getContainingRadius() {
        return containingRadius;
    }

    @Override
    public Cone<S> getCopyAtPosition(Vector3<S> position) {
        return new Cone<>(axis, radius, position);
    }

    /**
     * Distance from a point to the solid cone; zero inside
     */
    public S getDistanceTo(Vector3<S> point) {
        var zero = type().zero();
        var offset = point.subtract(apex);
        var along = offset.dot(unitAxis);
        var radial = offset.subtract(unitAxis.multiply(along)).length();
        if (contains(along, radial)) {
            return zero;
        }
        // the solid is the revolution of the triangle apex, base centre, rim in the (along, radial) half plane
        var p = new Vector3<>(along, radial, zero);
        var origin = Vector3.zero(type());
        var base = new Vector3<>(length, zero, zero);
        var rim = new Vector3<>(length, radius, zero);
        var toSide = Segments.closestPoint(origin, rim, p).distance(p);
        var toBase = Segments.closestPoint(base, rim, p).distance(p);
        return toSide.min(toBase);
    }

    @Override
    public Vector3<S> getHighestPoint() {
        return highest;
    }

    public S getLength() {
        return length;
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
        return ShapeType.CONE;
    }

    @Override
    public S getSmallestDimension() {
        return radius.multiply(type().two()).min(length);
    }

    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        var radial = perpendicular(direction, unitAxis);
        var rim = radial == null ? baseCenter : baseCenter.add(radial.multiply(radius));
        return apex.dot(direction).compareTo(rim.dot(direction)) > 0 ? apex : rim;
    }

    @Override
    public S getVolume() {
        return type().pi().multiply(radius.square()).multiply(length).divide(type().of(3L));
    }

    @Override
    public int hashCode() {
        return Objects.hash(axis, radius, position);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        var offset = point.subtract(apex);
        var along = offset.dot(unitAxis);
        return contains(along, offset.subtract(unitAxis.multiply(along)).length());
    }

    @Override
    public Cone<S> scaleByDimension(S factor) {
        requireNonNegative(factor, "factor");
        return new Cone<>(axis.multiply(factor), radius.multiply(factor), position);
    }

    @Override
    public String toString() {
        return "Cone{axis=" + axis + ", radius=" + radius + ", position=" + position + "}";
    }

    private boolean contains(S along, S radial) {
        if (!atMost(type().zero(), along) || !atMost(along, length)) {
            return false;
        }
        if (length.isZero()) {
            return atMost(radial, radius);
        }
        return atMost(radial.multiply(length), radius.multiply(along));
    }
}
