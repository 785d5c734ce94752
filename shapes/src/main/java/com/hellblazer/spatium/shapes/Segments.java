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

/**
 * Closest-point queries on line segments
 *
 * @author hal.hildebrand
 */
final class Segments {

    private Segments() {
    }

    /**
     * The point on segment [start, end] closest to {@code point}
     */
    static <S extends Scalar<S>> Vector3<S> closestPoint(Vector3<S> start, Vector3<S> end, Vector3<S> point) {
        var v = end.subtract(start);
        var length = v.length();
        if (length.isNearlyZero()) {
            return start;
        }
        var t = clamp01(point.subtract(start).dot(v.divide(length)).divide(length));
        return start.add(v.multiply(t));
    }

    /**
     * The pair of closest points between segments [p1, q1] and [p2, q2]. Degenerate segments are treated as points.
     * The parameters along each segment are solved on copies scaled to unit size, so they do not depend on magnitude.
     */
    static <S extends Scalar<S>> Closest<S> closestPoints(Vector3<S> p1, Vector3<S> q1, Vector3<S> p2,
                                                          Vector3<S> q2) {
        var type = p1.type();
        var zero = type.zero();
        var d1 = q1.subtract(p1);
        var d2 = q2.subtract(p2);
        var r = p1.subtract(p2);
        var scale = largestComponent(d1).max(largestComponent(d2)).max(largestComponent(r));
        if (!scale.isZero() && scale.isFinite()) {
            d1 = d1.divide(scale);
            d2 = d2.divide(scale);
            r = r.divide(scale);
        }
        var a = d1.lengthSquared();
        var e = d2.lengthSquared();
        var f = d2.dot(r);

        S s;
        S t;
        if (a.isNearlyZero() && e.isNearlyZero()) {
            s = zero;
            t = zero;
        } else if (a.isNearlyZero()) {
            s = zero;
            t = clamp01(f.divide(e));
        } else {
            var c = d1.dot(r);
            if (e.isNearlyZero()) {
                t = zero;
                s = clamp01(c.negate().divide(a));
            } else {
                var b = d1.dot(d2);
                var denominator = a.multiply(e).subtract(b.square());
                s = denominator.isZero() ? zero : clamp01(b.multiply(f).subtract(c.multiply(e)).divide(denominator));
                t = b.multiply(s).add(f).divide(e);
                if (t.isNegative()) {
                    t = zero;
                    s = clamp01(c.negate().divide(a));
                } else if (t.compareTo(type.one()) > 0) {
                    t = type.one();
                    s = clamp01(b.subtract(c).divide(a));
                }
            }
        }
        return new Closest<>(p1.add(q1.subtract(p1).multiply(s)), p2.add(q2.subtract(p2).multiply(t)));
    }

    static <S extends Scalar<S>> S distance(Vector3<S> p1, Vector3<S> q1, Vector3<S> p2, Vector3<S> q2) {
        var closest = closestPoints(p1, q1, p2, q2);
        return closest.first().distance(closest.second());
    }

    private static <S extends Scalar<S>> S clamp01(S value) {
        var type = value.type();
        return value.max(type.zero()).min(type.one());
    }

    private static <S extends Scalar<S>> S largestComponent(Vector3<S> vector) {
        return vector.x.abs().max(vector.y.abs()).max(vector.z.abs());
    }

    record Closest<S extends Scalar<S>>(Vector3<S> first, Vector3<S> second) {
    }
}
