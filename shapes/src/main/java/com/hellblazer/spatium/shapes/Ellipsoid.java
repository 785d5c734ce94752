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
 * A solid oriented ellipsoid. The axis values are the semi-axes along the local X, Y and Z axes.
 *
 * @author hal.hildebrand
 */
public final class Ellipsoid<S extends Scalar<S>> extends Shape<S> {

    private final S             axisX;
    private final S             axisY;
    private final S             axisZ;
    private final Quaternion<S> rotation;
    private final Vector3<S>    highest;
    private final Vector3<S>    lowest;

    public Ellipsoid(S axisX, S axisY, S axisZ, Vector3<S> position) {
        this(axisX, axisY, axisZ, position, Quaternion.identity(position.type()));
    }

    public Ellipsoid(S axisX, S axisY, S axisZ, Vector3<S> position, Quaternion<S> rotation) {
        super(position);
        this.axisX = requireNonNegative(axisX, "axisX");
        this.axisY = requireNonNegative(axisY, "axisY");
        this.axisZ = requireNonNegative(axisZ, "axisZ");
        this.rotation = Objects.requireNonNull(rotation, "rotation");
        highest = getSupport(Vector3.unitY(type()));
        lowest = getSupport(Vector3.unitY(type()).negate());
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Ellipsoid<?> other && axisX.equals(other.axisX) && axisY.equals(other.axisY)
        && axisZ.equals(other.axisZ) && position.equals(other.position) && rotation.equals(other.rotation);
    }

    public S getAxisX() {
        return axisX;
    }

    public S getAxisY() {
        return axisY;
    }

    public S getAxisZ() {
        return axisZ;
    }

    @Override
    public Ellipsoid<S> getCloneWithRotation(Quaternion<S> rotation) {
        return new Ellipsoid<>(axisX, axisY, axisZ, position, rotation);
    }

    @Override
    public S getContainingRadius() {
        return axisX.max(axisY).max(axisZ);
    }

    @Override
    public Ellipsoid<S> getCopyAtPosition(Vector3<S> position) {
        return new Ellipsoid<>(axisX, axisY, axisZ, position, rotation);
    }

    @Override
    public Vector3<S> getHighestPoint() {
        return highest;
    }

    @Override
    public Vector3<S> getLowestPoint() {
        return lowest;
    }

    @Override
    public Quaternion<S> getRotation() {
        return rotation;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.ELLIPSOID;
    }

    @Override
    public S getSmallestDimension() {
        return axisX.min(axisY).min(axisZ).multiply(type().two());
    }

    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        var d = direction.transform(rotation.conjugate());
        var scaled = new Vector3<>(axisX.square().multiply(d.x), axisY.square().multiply(d.y),
                                   axisZ.square().multiply(d.z));
        var norm = scaled.dot(d).sqrt();
        if (norm.isZero()) {
            return position;
        }
        return scaled.divide(norm).transform(rotation).add(position);
    }

    @Override
    public S getVolume() {
        var type = type();
        return type.pi().multiply(axisX).multiply(axisY).multiply(axisZ).multiply(type.of(4L)).divide(type.of(3L));
    }

    @Override
    public int hashCode() {
        return Objects.hash(axisX, axisY, axisZ, position, rotation);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        var local = point.subtract(position).transform(rotation.conjugate());
        var x = normalizedSquare(local.x, axisX);
        var y = normalizedSquare(local.y, axisY);
        var z = normalizedSquare(local.z, axisZ);
        if (x == null || y == null || z == null) {
            return false;
        }
        return atMost(x.add(y).add(z), type().one());
    }

    @Override
    public Ellipsoid<S> scaleByDimension(S factor) {
        requireNonNegative(factor, "factor");
        return new Ellipsoid<>(axisX.multiply(factor), axisY.multiply(factor), axisZ.multiply(factor), position,
                               rotation);
    }

    @Override
    public String toString() {
        return "Ellipsoid{axisX=" + axisX + ", axisY=" + axisY + ", axisZ=" + axisZ + ", position=" + position
        + ", rotation=" + rotation + "}";
    }

    /**
     * Squared coordinate in units of its semi-axis, or null if a flattened axis rules the point out
     */
    private S normalizedSquare(S coordinate, S semiAxis) {
        if (semiAxis.isZero()) {
            return coordinate.isNearlyZero() ? type().zero() : null;
        }
        return coordinate.divide(semiAxis).square();
    }
}
