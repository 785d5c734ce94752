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
 * A spherical shell: the region between two concentric spheres
 *
 * @author hal.hildebrand
 */
public final class HollowSphere<S extends Scalar<S>> extends Shape<S> {

    private final S innerRadius;
    private final S outerRadius;
    private final S volume;

    /**
     * @throws IllegalArgumentException if a radius is negative or the inner radius exceeds the outer
     */
    public HollowSphere(S innerRadius, S outerRadius, Vector3<S> position) {
        super(position);
        this.innerRadius = requireNonNegative(innerRadius, "innerRadius");
        this.outerRadius = requireNonNegative(outerRadius, "outerRadius");
        if (innerRadius.compareTo(outerRadius) > 0) {
            throw new IllegalArgumentException(
            "innerRadius must not exceed outerRadius: " + innerRadius + " > " + outerRadius);
        }
        volume = Sphere.ballVolume(outerRadius).subtract(Sphere.ballVolume(innerRadius));
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof HollowSphere<?> other && innerRadius.equals(other.innerRadius) && outerRadius.equals(
        other.outerRadius) && position.equals(other.position);
    }

    @Override
    public HollowSphere<S> getCloneWithRotation(Quaternion<S> rotation) {
        return this;
    }

    @Override
    public S getContainingRadius() {
        return outerRadius;
    }

    @Override
    public HollowSphere<S> getCopyAtPosition(Vector3<S> position) {
        return new HollowSphere<>(innerRadius, outerRadius, position);
    }

    @Override
    public Vector3<S> getHighestPoint() {
        return position.add(Vector3.unitY(type()).multiply(outerRadius));
    }

    public S getInnerRadius() {
        return innerRadius;
    }

    @Override
    public Vector3<S> getLowestPoint() {
        return position.subtract(Vector3.unitY(type()).multiply(outerRadius));
    }

    public S getOuterRadius() {
        return outerRadius;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.HOLLOW_SPHERE;
    }

    @Override
    public S getSmallestDimension() {
        return outerRadius.multiply(type().two());
    }

    /**
     * Support of the outer ball, which is the convex hull of the shell
     */
    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        if (direction.isZero()) {
            return position;
        }
        return position.add(direction.normalize().multiply(outerRadius));
    }

    @Override
    public S getVolume() {
        return volume;
    }

    @Override
    public int hashCode() {
        return Objects.hash(innerRadius, outerRadius, position);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        var distance = point.distance(position);
        return atMost(innerRadius, distance) && atMost(distance, outerRadius);
    }

    @Override
    public HollowSphere<S> scaleByDimension(S factor) {
        requireNonNegative(factor, "factor");
        return new HollowSphere<>(innerRadius.multiply(factor), outerRadius.multiply(factor), position);
    }

    @Override
    public String toString() {
        return "HollowSphere{innerRadius=" + innerRadius + ", outerRadius=" + outerRadius + ", position=" + position
        + "}";
    }
}
