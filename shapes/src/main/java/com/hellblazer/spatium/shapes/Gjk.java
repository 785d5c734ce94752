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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Gilbert-Johnson-Keerthi intersection test for convex shapes, driven by {@link Shape#getSupport(Vector3)}.
 * <p>
 * The simplex grows inside the Minkowski difference A - B toward the origin; the shapes intersect exactly when the
 * difference contains the origin. The newest simplex point is always held at index 0.
 *
 * @author hal.hildebrand
 */
public final class Gjk {
    private static final Logger log = LoggerFactory.getLogger(Gjk.class);

    private final GjkConfig config;

    public Gjk() {
        this(GjkConfig.defaultConfig());
    }

    public Gjk(GjkConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    private static <S extends Scalar<S>> boolean positive(S value) {
        return value.signum() > 0;
    }

    private static <S extends Scalar<S>> Vector3<S> support(Shape<S> a, Shape<S> b, Vector3<S> direction) {
        return a.getSupport(direction).subtract(b.getSupport(direction.negate()));
    }

    /**
     * (a x b) x c
     */
    private static <S extends Scalar<S>> Vector3<S> tripleCross(Vector3<S> a, Vector3<S> b, Vector3<S> c) {
        return a.cross(b).cross(c);
    }

    public GjkConfig getConfig() {
        return config;
    }

    /**
     * @return true if the convex hulls of the two shapes touch or overlap. Reaching the iteration cap without a
     * separating direction counts as touching.
     */
    public <S extends Scalar<S>> boolean intersects(Shape<S> a, Shape<S> b) {
        var direction = b.getPosition().subtract(a.getPosition());
        if (direction.isZero()) {
            direction = Vector3.unitX(a.type());
        }
        var simplex = new ArrayList<Vector3<S>>(4);
        var point = support(a, b, direction);
        simplex.add(point);
        direction = point.negate();

        for (int i = 0; i < config.maxIterations(); i++) {
            if (direction.isZero()) {
                return true;
            }
            point = support(a, b, direction);
            if (point.dot(direction).isNegative()) {
                return false;
            }
            simplex.add(0, point);
            direction = evolve(simplex);
            if (direction == null) {
                return true;
            }
        }
        log.debug("GJK reached {} iterations between {} and {}", config.maxIterations(), a.getShapeType(),
                  b.getShapeType());
        return true;
    }

    /**
     * Reduce the simplex to the feature nearest the origin and pick the next search direction
     *
     * @return the next direction, or null if the simplex encloses the origin
     */
    private <S extends Scalar<S>> Vector3<S> evolve(List<Vector3<S>> simplex) {
        return switch (simplex.size()) {
            case 2 -> line(simplex);
            case 3 -> triangle(simplex);
            case 4 -> tetrahedron(simplex);
            default -> throw new IllegalStateException("Invalid simplex size: " + simplex.size());
        };
    }

    private <S extends Scalar<S>> Vector3<S> line(List<Vector3<S>> simplex) {
        var a = simplex.get(0);
        var b = simplex.get(1);
        var ab = b.subtract(a);
        var ao = a.negate();
        if (positive(ab.dot(ao))) {
            var direction = tripleCross(ab, ao, ab);
            // a zero normal means the origin lies on the segment
            return direction.isZero() ? null : direction;
        }
        simplex.remove(1);
        return ao;
    }

    private <S extends Scalar<S>> Vector3<S> tetrahedron(List<Vector3<S>> simplex) {
        var a = simplex.get(0);
        var b = simplex.get(1);
        var c = simplex.get(2);
        var d = simplex.get(3);
        var ab = b.subtract(a);
        var ac = c.subtract(a);
        var ad = d.subtract(a);
        var ao = a.negate();
        var abc = ab.cross(ac);

        if (abc.dot(ad).isZero()) {
            // flat tetrahedron: fall back to the newest face
            simplex.remove(3);
            return triangle(simplex);
        }
        if (positive(abc.dot(ao))) {
            simplex.remove(3);
            return triangle(simplex);
        }
        if (positive(ac.cross(ad).dot(ao))) {
            simplex.remove(1);
            return triangle(simplex);
        }
        if (positive(ad.cross(ab).dot(ao))) {
            simplex.clear();
            simplex.addAll(List.of(a, d, b));
            return triangle(simplex);
        }
        return null;
    }

    private <S extends Scalar<S>> Vector3<S> triangle(List<Vector3<S>> simplex) {
        var a = simplex.get(0);
        var b = simplex.get(1);
        var c = simplex.get(2);
        var ab = b.subtract(a);
        var ac = c.subtract(a);
        var ao = a.negate();
        var abc = ab.cross(ac);

        if (abc.isZero()) {
            // collinear points: keep the newest edge
            simplex.remove(2);
            return line(simplex);
        }
        if (positive(abc.cross(ac).dot(ao))) {
            if (positive(ac.dot(ao))) {
                simplex.remove(1);
                var direction = tripleCross(ac, ao, ac);
                return direction.isZero() ? null : direction;
            }
            simplex.remove(2);
            return line(simplex);
        }
        if (positive(ab.cross(abc).dot(ao))) {
            simplex.remove(2);
            return line(simplex);
        }
        var side = abc.dot(ao);
        if (positive(side)) {
            return abc;
        }
        if (side.isNegative()) {
            simplex.set(1, c);
            simplex.set(2, b);
            return abc.negate();
        }
        // the origin lies in the triangle
        return null;
    }
}
