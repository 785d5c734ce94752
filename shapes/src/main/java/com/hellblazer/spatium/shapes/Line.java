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
 * A line segment. Its position is the midpoint; {@link #getPath()} runs from the start to the end.
 *
 * @author hal.hildebrand
 */
public final class Line<S extends Scalar<S>> extends Shape<S> {

    private final Vector3<S> path;
    private final Vector3<S> start;
    private final Vector3<S> end;
    private final S          length;

    public Line(Vector3<S> path, Vector3<S> position) {
        super(position);
        this.path = Objects.requireNonNull(path, "path");
        var halfPath = path.multiply(type().half());
        start = position.subtract(halfPath);
        end = position.add(halfPath);
        length = path.length();
    }

    /**
     * The segment beginning at {@code start} and following {@code path}
     */
    public static <S extends Scalar<S>> Line<S> fromStart(Vector3<S> start, Vector3<S> path) {
        return new Line<>(path, start.add(path.multiply(start.type().half())));
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Line<?> other && path.equals(other.path) && position.equals(other.position);
    }

    @Override
    public Line<S> getCloneWithRotation(Quaternion<S> rotation) {
        return new Line<>(path.transform(rotation), position);
    }

    @Override
    public S getContainingRadius() {
        return length.multiply(type().half());
    }

    @Override
    public Line<S> getCopyAtPosition(Vector3<S> position) {
        return new Line<>(path, position);
    }

    public PointDistance<S> getDistanceTo(Vector3<S> point) {
        var closest = Segments.closestPoint(start, end, point);
        return new PointDistance<>(closest.distance(point), closest);
    }

    public SegmentDistance<S> getDistanceTo(Line<S> other) {
        var closest = Segments.closestPoints(start, end, other.start, other.end);
        return new SegmentDistance<>(closest.first().distance(closest.second()), closest.first(), closest.second());
    }

    public Vector3<S> getEnd() {
        return end;
    }

    @Override
    public Vector3<S> getHighestPoint() {
        return end.y.compareTo(start.y) >= 0 ? end : start;
    }

    public S getLength() {
        return length;
    }

    @Override
    public Vector3<S> getLowestPoint() {
        return end.y.compareTo(start.y) >= 0 ? start : end;
    }

    public Vector3<S> getPath() {
        return path;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.LINE;
    }

    @Override
    public S getSmallestDimension() {
        return type().zero();
    }

    public Vector3<S> getStart() {
        return start;
    }

    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        return end.dot(direction).compareTo(start.dot(direction)) >= 0 ? end : start;
    }

    @Override
    public S getVolume() {
        return type().zero();
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, position);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        return Segments.closestPoint(start, end, point).isNearlyEqualTo(point);
    }

    @Override
    public Line<S> scaleByDimension(S factor) {
        return new Line<>(path.multiply(requireNonNegative(factor, "factor")), position);
    }

    @Override
    public String toString() {
        return "Line{path=" + path + ", position=" + position + "}";
    }

    /**
     * Distance from a segment to a point, with the closest point of the segment
     */
    public record PointDistance<S extends Scalar<S>>(S distance, Vector3<S> closestPoint) {
    }

    /**
     * Distance between two segments, with the closest point on each
     */
    public record SegmentDistance<S extends Scalar<S>>(S distance, Vector3<S> closestPoint,
                                                       Vector3<S> otherClosestPoint) {
    }
}
