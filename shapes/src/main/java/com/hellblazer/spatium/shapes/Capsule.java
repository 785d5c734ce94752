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
import java.util.Optional;

/**
 * A capsule: every point within {@code radius} of a segment. The segment is {@code axis} long and centred on the
 * position.
 * <p>
 * A capsule is also what a moving sphere sweeps out, which makes it the vehicle for
 * {@link #getCollisionPoint(Shape)}.
 *
 * @author hal.hildebrand
 */
public final class Capsule<S extends Scalar<S>> extends Shape<S> {

    /** Corner index pairs of the twelve edges of a {@link Cuboid#getCorners()} box */
    private static final int[][] CUBOID_EDGES = { { 0, 1 }, { 1, 2 }, { 2, 3 }, { 3, 0 }, { 4, 5 }, { 5, 6 }, { 6, 7 },
                                                  { 7, 4 }, { 0, 4 }, { 1, 5 }, { 2, 6 }, { 3, 7 } };

    private final Vector3<S> axis;
    private final S          radius;
    private final Vector3<S> start;
    private final Vector3<S> end;
    private final S          length;
    private final S          volume;

    public Capsule(Vector3<S> axis, S radius, Vector3<S> position) {
        super(position);
        this.axis = Objects.requireNonNull(axis, "axis");
        this.radius = requireNonNegative(radius, "radius");
        var halfAxis = axis.multiply(type().half());
        start = position.subtract(halfAxis);
        end = position.add(halfAxis);
        length = axis.length();
        volume = type().pi().multiply(radius.square()).multiply(length).add(Sphere.ballVolume(radius));
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Capsule<?> other && axis.equals(other.axis) && radius.equals(other.radius)
        && position.equals(other.position);
    }

    public Vector3<S> getAxis() {
        return axis;
    }

    @Override
    public Capsule<S> getCloneWithRotation(Quaternion<S> rotation) {
        return new Capsule<>(axis.transform(rotation), radius, position);
    }

    /**
     * The point at which a sphere of this capsule's radius, travelling from {@link #getStart()} along the axis, first
     * touches {@code target}.
     * <p>
     * Points, spheres, lines, capsules and cuboids are solved exactly. Any other kind must intersect this capsule, and
     * is then replaced by its containing sphere to place the contact.
     *
     * @return the centre of the travelling sphere at first contact, or empty if no contact occurs before
     * {@link #getEnd()}
     */
    public Optional<Vector3<S>> getCollisionPoint(Shape<S> target) {
        Optional<S> contact;
        if (target instanceof SinglePoint<S> point) {
            contact = ballContact(point.getPosition(), type().zero());
        } else if (target instanceof Sphere<S> sphere) {
            contact = ballContact(sphere.getPosition(), sphere.getRadius());
        } else if (target instanceof Line<S> line) {
            contact = segmentContact(line.getStart(), line.getEnd(), type().zero());
        } else if (target instanceof Capsule<S> capsule) {
            contact = segmentContact(capsule.start, capsule.end, capsule.radius);
        } else if (target instanceof Cuboid<S> cuboid) {
            contact = cuboidContact(cuboid);
        } else if (intersects(target)) {
            contact = ballContact(target.getPosition(), target.getContainingRadius());
        } else {
            contact = Optional.empty();
        }
        return contact.map(t -> t.isZero() ? start : start.add(axis.normalize().multiply(t)));
    }

    @Override
    public S getContainingRadius() {
        return length.multiply(type().half()).add(radius);
    }

    @Override
    public Capsule<S> getCopyAtPosition(Vector3<S> position) {
        return new Capsule<>(axis, radius, position);
    }

    public Vector3<S> getEnd() {
        return end;
    }

    @Override
    public Vector3<S> getHighestPoint() {
        var top = end.y.compareTo(start.y) >= 0 ? end : start;
        return top.add(Vector3.unitY(type()).multiply(radius));
    }

    public S getLength() {
        return length;
    }

    @Override
    public Vector3<S> getLowestPoint() {
        var bottom = end.y.compareTo(start.y) >= 0 ? start : end;
        return bottom.subtract(Vector3.unitY(type()).multiply(radius));
    }

    public S getRadius() {
        return radius;
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.CAPSULE;
    }

    @Override
    public S getSmallestDimension() {
        return radius.multiply(type().two());
    }

    public Vector3<S> getStart() {
        return start;
    }

    @Override
    public Vector3<S> getSupport(Vector3<S> direction) {
        var tip = end.dot(direction).compareTo(start.dot(direction)) >= 0 ? end : start;
        if (direction.isZero()) {
            return tip;
        }
        return tip.add(direction.normalize().multiply(radius));
    }

    @Override
    public S getVolume() {
        return volume;
    }

    @Override
    public int hashCode() {
        return Objects.hash(axis, radius, position);
    }

    @Override
    public boolean isPointWithin(Vector3<S> point) {
        return atMost(Segments.closestPoint(start, end, point).distance(point), radius);
    }

    @Override
    public Capsule<S> scaleByDimension(S factor) {
        requireNonNegative(factor, "factor");
        return new Capsule<>(axis.multiply(factor), radius.multiply(factor), position);
    }

    @Override
    public String toString() {
        return "Capsule{axis=" + axis + ", radius=" + radius + ", position=" + position + "}";
    }

    /**
     * Earliest travel distance at which the moving sphere touches a ball of the given centre and radius
     */
    private Optional<S> ballContact(Vector3<S> center, S targetRadius) {
        var reach = radius.add(targetRadius);
        var offset = start.subtract(center);
        if (atMost(offset.length(), reach)) {
            return Optional.of(type().zero());
        }
        if (length.isZero()) {
            return Optional.empty();
        }
        var u = axis.normalize();
        var b = u.dot(offset);
        var miss = offset.subtract(u.multiply(b)).length();
        if (!atMost(miss, reach)) {
            return Optional.empty();
        }
        // half chord sqrt(reach^2 - miss^2), factored so neither square is formed
        var halfChord = reach.subtract(miss).max(type().zero()).sqrt().multiply(reach.add(miss).sqrt());
        return withinPath(b.negate().subtract(halfChord));
    }

    /**
     * Earliest travel distance at which the centre enters the box grown by {@code halfExtents}, with the centre and
     * unit direction given in the box frame
     */
    private Optional<S> boxEntry(Vector3<S> origin, Vector3<S> direction, Vector3<S> halfExtents) {
        var near = type().zero();
        var far = length;
        for (int i = 0; i < 3; i++) {
            var p = component(origin, i);
            var d = component(direction, i);
            var h = component(halfExtents, i);
            if (d.isNearlyZero()) {
                if (!atMost(p.abs(), h)) {
                    return Optional.empty();
                }
                continue;
            }
            var t1 = h.negate().subtract(p).divide(d);
            var t2 = h.subtract(p).divide(d);
            near = near.max(t1.min(t2));
            far = far.min(t1.max(t2));
            if (!atMost(near, far)) {
                return Optional.empty();
            }
        }
        return withinPath(near);
    }

    /**
     * Earliest travel distance at which the moving sphere touches the box. The box grown by the radius is the union of
     * three boxes, each grown along a single axis, and the capsules of that radius about the twelve edges.
     */
    private Optional<S> cuboidContact(Cuboid<S> cuboid) {
        var half = cuboid.getHalfExtents();
        var local = cuboid.toLocal(start);
        if (atMost(local.clamp(half.negate(), half).distance(local), radius)) {
            return Optional.of(type().zero());
        }
        if (length.isZero()) {
            return Optional.empty();
        }
        var direction = cuboid.toLocalDirection(axis.normalize());
        var zero = type().zero();
        Optional<S> earliest = Optional.empty();
        for (int i = 0; i < 3; i++) {
            var grown = half.add(new Vector3<>(i == 0 ? radius : zero, i == 1 ? radius : zero,
                                               i == 2 ? radius : zero));
            earliest = earlier(earliest, boxEntry(local, direction, grown));
        }
        var corners = cuboid.getCorners();
        for (var edge : CUBOID_EDGES) {
            earliest = earlier(earliest, segmentContact(corners.get(edge[0]), corners.get(edge[1]), zero));
        }
        return earliest;
    }

    private Optional<S> earlier(Optional<S> a, Optional<S> b) {
        if (a.isEmpty()) {
            return b;
        }
        return b.isPresent() && b.get().compareTo(a.get()) < 0 ? b : a;
    }

    /**
     * Earliest travel distance at which the moving sphere comes within {@code targetRadius} of segment [a, b]
     */
    private Optional<S> segmentContact(Vector3<S> a, Vector3<S> b, S targetRadius) {
        var reach = radius.add(targetRadius);
        if (atMost(Segments.closestPoint(a, b, start).distance(start), reach)) {
            return Optional.of(type().zero());
        }
        if (length.isZero()) {
            return Optional.empty();
        }
        var earliest = earlier(ballContact(a, targetRadius), ballContact(b, targetRadius));

        var segment = b.subtract(a);
        var segmentLength = segment.length();
        if (segmentLength.isNearlyZero()) {
            return earliest;
        }
        // entry into the infinite cylinder about the segment, kept only where it lands between the end caps
        var w = segment.divide(segmentLength);
        var u = axis.normalize();
        var m = start.subtract(a);
        var mPerp = m.subtract(w.multiply(m.dot(w)));
        var uPerp = u.subtract(w.multiply(u.dot(w)));
        var qa = uPerp.lengthSquared();
        if (qa.isNearlyZero()) {
            return earliest;
        }
        var qb = mPerp.dot(uPerp);
        var qc = mPerp.lengthSquared().subtract(reach.square());
        var discriminant = qb.square().subtract(qa.multiply(qc));
        if (discriminant.isNegative()) {
            return earliest;
        }
        var side = withinPath(qb.negate().subtract(discriminant.sqrt()).divide(qa));
        if (side.isEmpty()) {
            return earliest;
        }
        var along = m.add(u.multiply(side.get())).dot(w);
        var betweenCaps = atMost(type().zero(), along) && atMost(along, segmentLength);
        return betweenCaps ? earlier(earliest, side) : earliest;
    }

    private Optional<S> withinPath(S t) {
        if (t.isNaN() || !atMost(type().zero(), t) || !atMost(t, length)) {
            return Optional.empty();
        }
        return Optional.of(t.max(type().zero()).min(length));
    }
}
