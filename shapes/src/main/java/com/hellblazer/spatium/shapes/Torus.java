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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A solid ring torus. The centre circle of radius {@code majorRadius} lies in the local XZ plane; the tube around it
 * has radius {@code minorRadius}.
 *
 * @author hal.hildebrand
 */
public final class Torus<S extends Scalar<S>> extends Shape<S> {

    private final S             majorRadius;
    private final S             minorRadius;
    private final Quaternion<S> rotation;
    private final Vector3<S>    normal;
    private final Vector3<S>    highest;
    private final Vector3<S>    lowest;

    public Torus(S majorRadius, S minorRadius, Vector3<S> position) {
        this(majorRadius, minorRadius, position, Quaternion.identity(position.type()));
    }

    /**
     * @throws IllegalArgumentException if a radius is negative or the minor radius exceeds the major
     */
    public Torus(S majorRadius, S minorRadius, Vector3<S> position, Quaternion<S> rotation) {
        super(position);
        this.majorRadius = requireNonNegative(majorRadius, "majorRadius");
        this.minorRadius = requireNonNegative(minorRadius, "minorRadius");
        if (minorRadius.compareTo(majorRadius) > 0) {
            throw new IllegalArgumentException(
            "minorRadius must not exceed majorRadius: " + minorRadius + " > " + majorRadius);
        }
        this.rotation = Objects.requireNonNull(rotation, "rotation");
        normal = Vector3.unitY(type()).transform(rotation);

        var up = Vector3.unitY(type());
        var toward = perpendicular(up, normal);
        var rim = toward == null ? Vector3.zero(type()) : toward.multiply(majorRadius);
        highest = position.add(rim).add(up.multiply(minorRadius));
        lowest = position.subtract(rim).subtract(up.multiply(minorRadius));
    }

    /**
     * The ring approximated by capsules along the chords of the centre circle
     *
     * @param segments the number of chords
     */
    public List<Capsule<S>> chords(int segments) {
        if (segments < 3) {
            throw new IllegalArgumentException("segments must be at least 3: " + segments);
        }
        var type = type();
        var u = Vector3.unitX(type).transform(rotation);
        var v = Vector3.unitZ(type).transform(rotation);
        var step = type.tau().divide(type.of((long) segments));
        var points = new ArrayList<Vector3<S>>(segments);
        for (int i = 0; i < segments; i++) {
            var angle = step.multiply(type.of((long) i));
            points.add(position.add(u.multiply(angle.cos().multiply(majorRadius)))
                               .add(v.multiply(angle.sin().multiply(majorRadius))));
        }
        var chords = new ArrayList<Capsule<S>>(segments);
        for (int i = 0; i < segments; i++) {
            var from = points.get(i);
            var to = points.get((i + 1) % segments);
            chords.add(new Capsule<>(to.subtract(from), minorRadius, from.add(to).multiply(type.half())));
        }
        return chords;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Torus<?> other && majorRadius.equals(other.majorRadius) && minorRadius.equals(
        other.minorRadius) && position.equals(other.position) && rotation.equals(other.rotation);
    }

    @Override
    public Torus<S> getCloneWithRotation(Quaternion<S> rotation) {
        return new Torus<>(majorRadius, minorRadius, position, rotation);
    }

    @Override
    public S getContainingRadius() {
        return majorRadius.add(minorRadius);
    }

    @Override
    public Torus<S> getCopyAtPosition(Vector3<S> position) {
        return new Torus<>(majorRadius, minorRadius, position, rotation);
    }

    /**
     * Distance from a point to the solid torus; zero inside
     */
    public S getDistanceTo(Vector3<S> point) {
        var tube = tubeDistance(point).subtract(minorRadius);
        return tube.isNegative() ? type().zero() : tube;
    }

    /**
     * Distance from a point to the furthest point of the torus
     */
    public S getFarthestDistanceFrom(Vector3<S> point) {
        var offset = point.subtract(position);
        var height = offset.dot(normal);
        var planar = offset.subtract(normal.multiply(height)).length();
        return hypot(planar.add(majorRadius), height).add(minorRadius);
    }

    @Override
    public Vector3<S> getHighestPoint() {
        return highest;
    }

    @Override
    public Vector3<S> getLowestPoint() {
        return lowest;
    }

    public S getMajorRadius() {
        return majorRadius;
    }

    public S getMinorRadius() {
        return minorRadius;
    }

    @Override
    public Quaternion<S> getRotation() {
        return rotation;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.TORUS;
    }

    @Override
    public S getSmallestDimension() {
        return minorRadius.multiply(type().two());
    }

    /**
     * Support of the convex hull of the torus
     */
    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        var planar = perpendicular(direction, normal);
        var rim = planar == null ? position : position.add(planar.multiply(majorRadius));
        return direction.isZero() ? rim : rim.add(direction.normalize().multiply(minorRadius));
    }

    @Override
    public S getVolume() {
        var type = type();
        return type.pi().square().multiply(type.two()).multiply(majorRadius).multiply(minorRadius.square());
    }

    @Override
    public int hashCode() {
        return Objects.hash(majorRadius, minorRadius, position, rotation);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        return atMost(tubeDistance(point), minorRadius);
    }

    @Override
    public Torus<S> scaleByDimension(S factor) {
        requireNonNegative(factor, "factor");
        return new Torus<>(majorRadius.multiply(factor), minorRadius.multiply(factor), position, rotation);
    }

    @Override
    public String toString() {
        return "Torus{majorRadius=" + majorRadius + ", minorRadius=" + minorRadius + ", position=" + position
        + ", rotation=" + rotation + "}";
    }

    /**
     * Distance from a point to the centre circle
     */
    private S tubeDistance(Vector3<S> point) {
        var offset = point.subtract(position);
        var height = offset.dot(normal);
        var planar = offset.subtract(normal.multiply(height)).length();
        return hypot(planar.subtract(majorRadius), height);
    }
}
