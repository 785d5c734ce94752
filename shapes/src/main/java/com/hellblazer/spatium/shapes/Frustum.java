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

import com.hellblazer.spatium.numerics.Plane;
import com.hellblazer.spatium.numerics.Quaternion;
import com.hellblazer.spatium.numerics.Vector3;
import com.hellblazer.spatium.numerics.scalar.Scalar;

import java.util.List;
import java.util.Objects;

/**
 * A rectangular view frustum: the part of a pyramid between the near and far clipping planes.
 * <p>
 * The apex of the pyramid (the eye) is at the position. The axis, turned by the rotation, points from the apex to the
 * far plane and its length is the far plane distance. The field of view is the vertical half-angle; the horizontal
 * half-extent is the vertical one times the aspect ratio.
 *
 * @author hal.hildebrand
 */
public final class Frustum<S extends Scalar<S>> extends Shape<S> {

    private final S                aspectRatio;
    private final Vector3<S>       axis;
    private final S                fieldOfViewAngle;
    private final S                nearPlaneDistance;
    private final Quaternion<S>    rotation;
    private final S                farPlaneDistance;
    private final List<Vector3<S>> corners;
    private final List<Plane<S>>   planes;
    private final S                containingRadius;
    private final S                volume;
    private final S                smallestDimension;
    private final Vector3<S>       highest;
    private final Vector3<S>       lowest;

    public Frustum(S aspectRatio, Vector3<S> axis, S fieldOfViewAngle, S nearPlaneDistance, Vector3<S> position) {
        this(aspectRatio, axis, fieldOfViewAngle, nearPlaneDistance, position, Quaternion.identity(position.type()));
    }

    /**
     * @throws IllegalArgumentException if the aspect ratio is not positive, the field of view is outside (0, pi/2),
     *                                  or the near plane is negative or beyond the far plane
     */
    public Frustum(S aspectRatio, Vector3<S> axis, S fieldOfViewAngle, S nearPlaneDistance, Vector3<S> position,
                   Quaternion<S> rotation) {
        super(position);
        this.aspectRatio = Objects.requireNonNull(aspectRatio, "aspectRatio");
        this.axis = Objects.requireNonNull(axis, "axis");
        this.fieldOfViewAngle = Objects.requireNonNull(fieldOfViewAngle, "fieldOfViewAngle");
        this.nearPlaneDistance = requireNonNegative(nearPlaneDistance, "nearPlaneDistance");
        this.rotation = Objects.requireNonNull(rotation, "rotation");
        var type = type();
        var two = type.two();
        if (!aspectRatio.isPositive()) {
            throw new IllegalArgumentException("aspectRatio must be positive: " + aspectRatio);
        }
        if (!fieldOfViewAngle.isPositive() || fieldOfViewAngle.compareTo(type.halfPi()) >= 0) {
            throw new IllegalArgumentException("fieldOfViewAngle must be in (0, pi/2): " + fieldOfViewAngle);
        }
        farPlaneDistance = axis.length();
        if (nearPlaneDistance.compareTo(farPlaneDistance) > 0) {
            throw new IllegalArgumentException(
            "nearPlaneDistance must not exceed the far plane distance: " + nearPlaneDistance + " > "
            + farPlaneDistance);
        }

        var tan = fieldOfViewAngle.tan();
        var localForward = direction(axis);
        var x = localForward.x;
        var y = localForward.y;
        var z = localForward.z;
        var one = type.one();
        Vector3<S> localRight;
        Vector3<S> localUp;
        if (z.isNearlyEqualTo(type.negativeOne())) {
            localRight = new Vector3<>(type.zero(), type.negativeOne(), type.zero());
            localUp = new Vector3<>(type.negativeOne(), type.zero(), type.zero());
        } else {
            var a = one.divide(one.add(z));
            var b = x.negate().multiply(y).multiply(a);
            localRight = new Vector3<>(one.subtract(x.square().multiply(a)), b, x.negate());
            localUp = new Vector3<>(b, one.subtract(y.square().multiply(a)), y.negate());
        }
        var forward = localForward.transform(rotation);
        var right = localRight.transform(rotation);
        var up = localUp.transform(rotation);

        var nearHeight = nearPlaneDistance.multiply(tan);
        var nearWidth = nearHeight.multiply(aspectRatio);
        var farHeight = farPlaneDistance.multiply(tan);
        var farWidth = farHeight.multiply(aspectRatio);
        var nearCenter = position.add(forward.multiply(nearPlaneDistance));
        var farCenter = position.add(forward.multiply(farPlaneDistance));
        corners = List.of(corner(nearCenter, right, up, nearWidth.negate(), nearHeight.negate()),
                          corner(nearCenter, right, up, nearWidth, nearHeight.negate()),
                          corner(nearCenter, right, up, nearWidth, nearHeight),
                          corner(nearCenter, right, up, nearWidth.negate(), nearHeight),
                          corner(farCenter, right, up, farWidth.negate(), farHeight.negate()),
                          corner(farCenter, right, up, farWidth, farHeight.negate()),
                          corner(farCenter, right, up, farWidth, farHeight),
                          corner(farCenter, right, up, farWidth.negate(), farHeight));

        var interior = position.add(forward.multiply(nearPlaneDistance.add(farPlaneDistance).divide(two)));
        planes = List.of(new Plane<>(forward.negate(), forward.dot(nearCenter)),
                         new Plane<>(forward, forward.dot(farCenter).negate()),
                         outward(position, corners.get(4), corners.get(7), interior),
                         outward(position, corners.get(5), corners.get(6), interior),
                         outward(position, corners.get(4), corners.get(5), interior),
                         outward(position, corners.get(6), corners.get(7), interior));

        var tanSquared = tan.square();
        containingRadius = farPlaneDistance.multiply(
        one.add(tanSquared.multiply(one.add(aspectRatio.square()))).sqrt());
        volume = tanSquared.multiply(aspectRatio)
                           .multiply(type.of(4L))
                           .multiply(farPlaneDistance.cube().subtract(nearPlaneDistance.cube()))
                           .divide(type.of(3L));
        smallestDimension = farPlaneDistance.subtract(nearPlaneDistance)
                                            .min(nearWidth.multiply(two))
                                            .min(nearHeight.multiply(two));

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

    private static <S extends Scalar<S>> Vector3<S> corner(Vector3<S> center, Vector3<S> right, Vector3<S> up,
                                                           S width, S height) {
        return center.add(right.multiply(width)).add(up.multiply(height));
    }

    /**
     * Plane through three points, with its normal facing away from the interior point
     */
    private static <S extends Scalar<S>> Plane<S> outward(Vector3<S> p1, Vector3<S> p2, Vector3<S> p3,
                                                          Vector3<S> interior) {
        var plane = Plane.createFromVertices(p1, p2, p3);
        if (plane.dotCoordinate(interior).isPositive()) {
            return new Plane<>(plane.normal.negate(), plane.d.negate());
        }
        return plane;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Frustum<?> other && aspectRatio.equals(other.aspectRatio) && axis.equals(other.axis)
        && fieldOfViewAngle.equals(other.fieldOfViewAngle) && nearPlaneDistance.equals(other.nearPlaneDistance)
        && position.equals(other.position) && rotation.equals(other.rotation);
    }

    public S getAspectRatio() {
        return aspectRatio;
    }

    public Vector3<S> getAxis() {
        return axis;
    }

    @Override
    public Frustum<S> getCloneWithRotation(Quaternion<S> rotation) {
        return new Frustum<>(aspectRatio, axis, fieldOfViewAngle, nearPlaneDistance, position, rotation);
    }

    @Override
    public S getContainingRadius() {
        return containingRadius;
    }

    @Override
    public Frustum<S> getCopyAtPosition(Vector3<S> position) {
        return new Frustum<>(aspectRatio, axis, fieldOfViewAngle, nearPlaneDistance, position, rotation);
    }

    /**
     * The eight corners: the near rectangle counter-clockwise from bottom left as seen from the apex, then the far
     * rectangle in the same order
     */
    public List<Vector3<S>> getCorners() {
        return corners;
    }

    public S getFarPlaneDistance() {
        return farPlaneDistance;
    }

    public S getFieldOfViewAngle() {
        return fieldOfViewAngle;
    }

    @Override
    public Vector3<S> getHighestPoint() {
        return highest;
    }

    @Override
    public Vector3<S> getLowestPoint() {
        return lowest;
    }

    public S getNearPlaneDistance() {
        return nearPlaneDistance;
    }

    /**
     * The bounding planes, normals facing outward: near, far, left, right, bottom, top
     */
    public List<Plane<S>> getPlanes() {
        return planes;
    }

    @Override
    public Quaternion<S> getRotation() {
        return rotation;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.FRUSTUM;
    }

    @Override
    public S getSmallestDimension() {
        return smallestDimension;
    }

    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        var best = corners.get(0);
        var bestDot = best.dot(direction);
        for (var corner : corners) {
            var dot = corner.dot(direction);
            if (dot.compareTo(bestDot) > 0) {
                best = corner;
                bestDot = dot;
            }
        }
        return best;
    }

    @Override
    public S getVolume() {
        return volume;
    }

    @Override
    public int hashCode() {
        return Objects.hash(aspectRatio, axis, fieldOfViewAngle, nearPlaneDistance, position, rotation);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        if (farPlaneDistance.isZero()) {
            return position.isNearlyEqualTo(point);
        }
        var zero = type().zero();
        for (var plane : planes) {
            if (!atMost(plane.dotCoordinate(point), zero)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Frustum<S> scaleByDimension(S factor) {
        requireNonNegative(factor, "factor");
        return new Frustum<>(aspectRatio, axis.multiply(factor), fieldOfViewAngle, nearPlaneDistance.multiply(factor),
                             position, rotation);
    }

    @Override
    public String toString() {
        return "Frustum{aspectRatio=" + aspectRatio + ", axis=" + axis + ", fieldOfViewAngle=" + fieldOfViewAngle
        + ", nearPlaneDistance=" + nearPlaneDistance + ", position=" + position + ", rotation=" + rotation + "}";
    }
}
