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

import com.hellblazer.spatium.numerics.Vector3;
import com.hellblazer.spatium.numerics.scalar.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static com.hellblazer.spatium.shapes.Shape.atMost;
import static com.hellblazer.spatium.shapes.Shape.component;

/**
 * Intersection tests between every pair of shape kinds.
 * <p>
 * Each unordered pair of kinds is implemented once: the arguments are put in ascending {@link ShapeType} order before
 * dispatch, so {@code test(a, b) == test(b, a)} holds by construction. Pairs without a closed form fall through to
 * GJK, except the torus, which is not convex and is approximated by capsules along the chords of its centre circle.
 *
 * @author hal.hildebrand
 */
public final class ShapeIntersector {

    /** Chords approximating the ring of a torus */
    public static final int TORUS_SEGMENTS = 32;

    private static final Logger           log     = LoggerFactory.getLogger(ShapeIntersector.class);
    private static final ShapeIntersector DEFAULT = new ShapeIntersector(GjkConfig.defaultConfig());

    private final Gjk gjk;

    public ShapeIntersector(GjkConfig config) {
        gjk = new Gjk(config);
    }

    /**
     * Distance from a point to the furthest point of a shape
     */
    static <S extends Scalar<S>> S farthestDistance(Shape<S> shape, Vector3<S> from) {
        var center = shape.getPosition().distance(from);
        return switch (shape.getShapeType()) {
            case SINGLE_POINT -> center;
            case SPHERE, HOLLOW_SPHERE, ELLIPSOID -> center.add(shape.getContainingRadius());
            case LINE -> {
                var line = (Line<S>) shape;
                yield line.getStart().distance(from).max(line.getEnd().distance(from));
            }
            case CAPSULE -> {
                var capsule = (Capsule<S>) shape;
                yield capsule.getStart().distance(from).max(capsule.getEnd().distance(from)).add(capsule.getRadius());
            }
            case CUBOID -> farthestCorner(((Cuboid<S>) shape).getCorners(), from);
            case FRUSTUM -> farthestCorner(((Frustum<S>) shape).getCorners(), from);
            case CYLINDER -> {
                var cylinder = (Cylinder<S>) shape;
                var unit = cylinder.getUnitAxis();
                var offset = unit.multiply(cylinder.getHalfLength());
                var radius = cylinder.getRadius();
                yield farthestOnRim(cylinder.getPosition().add(offset), unit, radius, from).max(
                farthestOnRim(cylinder.getPosition().subtract(offset), unit, radius, from));
            }
            case CONE -> {
                var cone = (Cone<S>) shape;
                var unit = Shape.direction(cone.getAxis());
                var rim = farthestOnRim(cone.getBaseCenter(), unit, cone.getRadius(), from);
                yield cone.getApex().distance(from).max(rim);
            }
            case TORUS -> ((Torus<S>) shape).getFarthestDistanceFrom(from);
            case NONE -> throw new IllegalArgumentException("Unsupported shape type: " + shape.getShapeType());
        };
    }

    public static <S extends Scalar<S>> boolean intersects(Shape<S> a, Shape<S> b) {
        return DEFAULT.test(a, b);
    }

    private static <S extends Scalar<S>> S farthestCorner(Iterable<Vector3<S>> corners, Vector3<S> from) {
        S farthest = null;
        for (var corner : corners) {
            var distance = corner.distance(from);
            farthest = farthest == null ? distance : farthest.max(distance);
        }
        return farthest;
    }

    /**
     * Distance from a point to the furthest point of a circle with the given centre, unit normal and radius
     */
    private static <S extends Scalar<S>> S farthestOnRim(Vector3<S> center, Vector3<S> normal, S radius,
                                                         Vector3<S> from) {
        var offset = from.subtract(center);
        var axial = offset.dot(normal);
        var radial = offset.subtract(normal.multiply(axial)).length();
        return Shape.hypot(axial, radial.add(radius));
    }

    private static <S extends Scalar<S>> boolean lineVsCuboid(Line<S> line, Cuboid<S> cuboid) {
        var type = line.type();
        var origin = cuboid.toLocal(line.getStart());
        var path = cuboid.toLocalDirection(line.getPath());
        var half = cuboid.getHalfExtents();
        var near = type.zero();
        var far = type.one();
        for (int i = 0; i < 3; i++) {
            var p = component(origin, i);
            var d = component(path, i);
            var h = component(half, i);
            if (d.isNearlyZero()) {
                if (!atMost(p.abs(), h)) {
                    return false;
                }
                continue;
            }
            var t1 = h.negate().subtract(p).divide(d);
            var t2 = h.subtract(p).divide(d);
            near = near.max(t1.min(t2));
            far = far.min(t1.max(t2));
            if (!atMost(near, far)) {
                return false;
            }
        }
        return true;
    }

    private static <S extends Scalar<S>> boolean outOfReach(Shape<S> a, Shape<S> b) {
        var reach = a.getContainingRadius().add(b.getContainingRadius());
        return !atMost(a.getPosition().distance(b.getPosition()), reach);
    }

    private static <S extends Scalar<S>> boolean segmentsWithin(Vector3<S> p1, Vector3<S> q1, Vector3<S> p2,
                                                                Vector3<S> q2, S reach) {
        return atMost(Segments.distance(p1, q1, p2, q2), reach);
    }

    private static <S extends Scalar<S>> boolean sphereVsCapsule(Sphere<S> sphere, Capsule<S> capsule) {
        var closest = Segments.closestPoint(capsule.getStart(), capsule.getEnd(), sphere.getPosition());
        return atMost(closest.distance(sphere.getPosition()), sphere.getRadius().add(capsule.getRadius()));
    }

    private static <S extends Scalar<S>> boolean sphereVsCone(Sphere<S> sphere, Cone<S> cone) {
        return atMost(cone.getDistanceTo(sphere.getPosition()), sphere.getRadius());
    }

    private static <S extends Scalar<S>> boolean sphereVsCuboid(Sphere<S> sphere, Cuboid<S> cuboid) {
        var local = cuboid.toLocal(sphere.getPosition());
        var half = cuboid.getHalfExtents();
        var closest = local.clamp(half.negate(), half);
        return atMost(closest.distance(local), sphere.getRadius());
    }

    private static <S extends Scalar<S>> boolean sphereVsCylinder(Sphere<S> sphere, Cylinder<S> cylinder) {
        var unit = cylinder.getUnitAxis();
        var halfLength = cylinder.getHalfLength();
        var radius = cylinder.getRadius();
        var offset = sphere.getPosition().subtract(cylinder.getPosition());
        var along = offset.dot(unit);
        var radial = offset.subtract(unit.multiply(along));
        var radialLength = radial.length();
        var clampedRadial = atMost(radialLength, radius) ? radial : radial.multiply(radius.divide(radialLength));
        var closest = unit.multiply(along.max(halfLength.negate()).min(halfLength)).add(clampedRadial);
        return atMost(closest.distance(offset), sphere.getRadius());
    }

    private static <S extends Scalar<S>> boolean sphereVsLine(Sphere<S> sphere, Line<S> line) {
        var closest = Segments.closestPoint(line.getStart(), line.getEnd(), sphere.getPosition());
        return atMost(closest.distance(sphere.getPosition()), sphere.getRadius());
    }

    private static <S extends Scalar<S>> boolean sphereVsSphere(Sphere<S> a, Sphere<S> b) {
        return atMost(a.getPosition().distance(b.getPosition()), a.getRadius().add(b.getRadius()));
    }

    private static <S extends Scalar<S>> boolean sphereVsTorus(Sphere<S> sphere, Torus<S> torus) {
        return atMost(torus.getDistanceTo(sphere.getPosition()), sphere.getRadius());
    }

    public Gjk getGjk() {
        return gjk;
    }

    /**
     * @return true if the shapes touch or overlap
     */
    public <S extends Scalar<S>> boolean test(Shape<S> a, Shape<S> b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.getShapeType().getValue() > b.getShapeType().getValue()) {
            return dispatch(b, a);
        }
        return dispatch(a, b);
    }

    /**
     * @param first  the shape of lower or equal type tag
     * @param second the shape of higher or equal type tag
     */
    private <S extends Scalar<S>> boolean dispatch(Shape<S> first, Shape<S> second) {
        if (second instanceof SinglePoint<S> point) {
            return first.isPointWithin(point.getPosition());
        }
        if (first instanceof SinglePoint<S> point) {
            return second.isPointWithin(point.getPosition());
        }
        if (outOfReach(first, second)) {
            return false;
        }
        if (first instanceof HollowSphere<S> hollow) {
            return hollowVs(hollow, second);
        }
        if (second instanceof HollowSphere<S> hollow) {
            return hollowVs(hollow, first);
        }
        if (second instanceof Torus<S> torus) {
            return torusVs(torus, first);
        }
        var kind = second.getShapeType();
        return switch (first.getShapeType()) {
            case CAPSULE -> {
                var capsule = (Capsule<S>) first;
                yield switch (kind) {
                    case CAPSULE -> {
                        var other = (Capsule<S>) second;
                        yield segmentsWithin(capsule.getStart(), capsule.getEnd(), other.getStart(), other.getEnd(),
                                             capsule.getRadius().add(other.getRadius()));
                    }
                    case LINE -> {
                        var line = (Line<S>) second;
                        yield segmentsWithin(capsule.getStart(), capsule.getEnd(), line.getStart(), line.getEnd(),
                                             capsule.getRadius());
                    }
                    case SPHERE -> sphereVsCapsule((Sphere<S>) second, capsule);
                    default -> gjk.intersects(first, second);
                };
            }
            case CONE -> kind == ShapeType.SPHERE ? sphereVsCone((Sphere<S>) second, (Cone<S>) first)
                                                  : gjk.intersects(first, second);
            case CUBOID -> switch (kind) {
                case LINE -> lineVsCuboid((Line<S>) second, (Cuboid<S>) first);
                case SPHERE -> sphereVsCuboid((Sphere<S>) second, (Cuboid<S>) first);
                default -> gjk.intersects(first, second);
            };
            case CYLINDER -> kind == ShapeType.SPHERE ? sphereVsCylinder((Sphere<S>) second, (Cylinder<S>) first)
                                                      : gjk.intersects(first, second);
            case ELLIPSOID, FRUSTUM -> gjk.intersects(first, second);
            case LINE -> {
                var line = (Line<S>) first;
                yield switch (kind) {
                    case LINE -> {
                        var other = (Line<S>) second;
                        yield segmentsWithin(line.getStart(), line.getEnd(), other.getStart(), other.getEnd(),
                                             line.type().zero());
                    }
                    case SPHERE -> sphereVsLine((Sphere<S>) second, line);
                    default -> gjk.intersects(first, second);
                };
            }
            case SPHERE -> sphereVsSphere((Sphere<S>) first, (Sphere<S>) second);
            default -> throw new IllegalStateException(
            "Unexpected pair: " + first.getShapeType() + ", " + second.getShapeType());
        };
    }

    /**
     * A shell meets a shape that reaches its outer ball without lying wholly inside the cavity
     */
    private <S extends Scalar<S>> boolean hollowVs(HollowSphere<S> hollow, Shape<S> other) {
        var outer = new Sphere<>(hollow.getOuterRadius(), hollow.getPosition());
        return test(other, outer) && atMost(hollow.getInnerRadius(),
                                            farthestDistance(other, hollow.getPosition()));
    }

    private <S extends Scalar<S>> boolean torusVs(Torus<S> torus, Shape<S> other) {
        if (other instanceof Sphere<S> sphere) {
            return sphereVsTorus(sphere, torus);
        }
        log.trace("Approximating torus ring with {} chords against {}", TORUS_SEGMENTS, other.getShapeType());
        for (var chord : torus.chords(TORUS_SEGMENTS)) {
            if (test(chord, other)) {
                return true;
            }
        }
        return false;
    }
}
