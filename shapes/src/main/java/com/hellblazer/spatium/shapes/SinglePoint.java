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

/**
 * A single point in space, with no extent
 *
 * @author hal.hildebrand
 */
public final class SinglePoint<S extends Scalar<S>> extends Shape<S> {

    public SinglePoint(Vector3<S> position) {
        super(position);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SinglePoint<?> other && position.equals(other.position);
    }

    @Override
    public SinglePoint<S> getCloneWithRotation(Quaternion<S> rotation) {
        return this;
    }

    @Override
    public S getContainingRadius() {
        return type().zero();
    }

    @Override
    public SinglePoint<S> getCopyAtPosition(Vector3<S> position) {
        return new SinglePoint<>(position);
    }

    @Override
    public Vector3<S> getHighestPoint() {
        return position;
    }

    @Override
    public Vector3<S> getLowestPoint() {
        return position;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.SINGLE_POINT;
    }

    @Override
    public S getSmallestDimension() {
        return type().zero();
    }

    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        return position;
    }

    @Override
    public S getVolume() {
        return type().zero();
    }

    @Override
    public int hashCode() {
        return position.hashCode();
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        return position.isNearlyEqualTo(point);
    }

    @Override
    public SinglePoint<S> scaleByDimension(S factor) {
        requireNonNegative(factor, "factor");
        return this;
    }

    @Override
    public String toString() {
        return "SinglePoint{" + position + "}";
    }
}
