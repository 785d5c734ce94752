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

import java.util.List;
import java.util.Objects;

/**
 * An oriented box. The three axis values are full edge lengths along the local X, Y and Z axes, centred on the
 * position.
 *
 * @author hal.hildebrand
 */
public final class Cuboid<S extends Scalar<S>> extends Shape<S> {

    private final S                axisX;
    private final S                axisY;
    private final S                axisZ;
    private final Quaternion<S>    rotation;
    private final Vector3<S>       halfExtents;
    private final List<Vector3<S>> corners;
    private final Vector3<S>       highest;
    private final Vector3<S>       lowest;

    public Cuboid(S axisX, S axisY, S axisZ, Vector3<S> position) {
        this(axisX, axisY, axisZ, position, Quaternion.identity(position.type()));
    }

    public Cuboid(S axisX, S axisY, S axisZ, Vector3<S> position, Quaternion<S> rotation) {
        super(position);
        this.axisX = requireNonNegative(axisX, "axisX");
        this.axisY = requireNonNegative(axisY, "axisY");
        this.axisZ = requireNonNegative(axisZ, "axisZ");
        this.rotation = Objects.requireNonNull(rotation, "rotation");
        var half = type().half();
        halfExtents = new Vector3<>(axisX.multiply(half), axisY.multiply(half), axisZ.multiply(half));

        var hx = halfExtents.x;
        var hy = halfExtents.y;
        var hz = halfExtents.z;
        corners = List.of(toWorld(new Vector3<>(hx.negate(), hy.negate(), hz.negate())),
                          toWorld(new Vector3<>(hx, hy.negate(), hz.negate())),
                          toWorld(new Vector3<>(hx, hy, hz.negate())),
                          toWorld(new Vector3<>(hx.negate(), hy, hz.negate())),
                          toWorld(new Vector3<>(hx.negate(), hy.negate(), hz)),
                          toWorld(new Vector3<>(hx, hy.negate(), hz)), toWorld(new Vector3<>(hx, hy, hz)),
                          toWorld(new Vector3<>(hx.negate(), hy, hz)));
        var top = corners.get(0);
        var bottom = corners.get(0);
        for (var corner : corners) {
            if (corner.y.compareTo(top.y) > 0) {
                top = corner;
            }
            if (corner.y.compareTo(bottom.y) < 0) {
                bottom = corner;
            }
        }
        highest = top;
        lowest = bottom;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Cuboid<?> other && axisX.equals(other.axisX) && axisY.equals(other.axisY)
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
    public Cuboid<S> getCloneWithRotation(Quaternion<S> rotation) {
        return new Cuboid<>(axisX, axisY, axisZ, position, rotation);
    }

    @Override
    public S getContainingRadius() {
        return halfExtents.length();
    }

    @Override
    public Cuboid<S> getCopyAtPosition(Vector3<S> position) {
        return new Cuboid<>(axisX, axisY, axisZ, position, rotation);
    }

    /**
     * The eight corners: the four of the local -Z face counter-clockwise from (-x, -y), then the four of the +Z face
     * in the same order
     */
    public List<Vector3<S>> getCorners() {
        return corners;
    }

    public Vector3<S> getHalfExtents() {
        return halfExtents;
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
        return ShapeType.CUBOID;
    }

    @Override
    public S getSmallestDimension() {
        return axisX.min(axisY).min(axisZ);
    }

    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        var local = direction.transform(rotation.conjugate());
        return toWorld(new Vector3<>(signed(halfExtents.x, local.x), signed(halfExtents.y, local.y),
                                     signed(halfExtents.z, local.z)));
    }

    @Override
    public S getVolume() {
        return axisX.multiply(axisY).multiply(axisZ);
    }

    @Override
    public int hashCode() {
        return Objects.hash(axisX, axisY, axisZ, position, rotation);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        var local = toLocal(point);
        return atMost(local.x.abs(), halfExtents.x) && atMost(local.y.abs(), halfExtents.y)
        && atMost(local.z.abs(), halfExtents.z);
    }

    @Override
    public Cuboid<S> scaleByDimension(S factor) {
        requireNonNegative(factor, "factor");
        return new Cuboid<>(axisX.multiply(factor), axisY.multiply(factor), axisZ.multiply(factor), position,
                            rotation);
    }

    @Override
    public String toString() {
        return "Cuboid{axisX=" + axisX + ", axisY=" + axisY + ", axisZ=" + axisZ + ", position=" + position
        + ", rotation=" + rotation + "}";
    }

    /**
     * Express a world point in the box frame, where the box spans {@code [-halfExtents, halfExtents]}
     */
    Vector3<S> toLocal(Vector3<S> point) {
        return point.subtract(position).transform(rotation.conjugate());
    }

    /**
     * Express a world direction in the box frame
     */
    Vector3<S> toLocalDirection(Vector3<S> direction) {
        return direction.transform(rotation.conjugate());
    }

    private S signed(S extent, S component) {
        return component.isNegative() ? extent.negate() : extent;
    }

    private Vector3<S> toWorld(Vector3<S> local) {
        return local.transform(rotation).add(position);
    }
}
