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
package com.hellblazer.spatium.numerics;

import com.hellblazer.spatium.numerics.scalar.DoubleScalar;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Algebraic laws of the rotation and vector types over generated inputs
 *
 * @author hal.hildebrand
 */
public class AlgebraPropertiesTest {

    private static final double EPSILON = 1e-9;

    private static void assertSameRotation(Quaternion<DoubleScalar> expected, Quaternion<DoubleScalar> actual) {
        assertEquals(1.0, Math.abs(expected.dot(actual).doubleValue()), EPSILON,
                     expected + " and " + actual + " differ");
    }

    @Property
    @Label("Lerp of unit quaternions is unit length")
    void lerpIsUnit(@ForAll("rotations") Quaternion<DoubleScalar> a, @ForAll("rotations") Quaternion<DoubleScalar> b,
                    @ForAll @DoubleRange(min = 0.0, max = 1.0) double t) {
        assertEquals(1.0, a.lerp(b, DoubleScalar.of(t)).length().doubleValue(), EPSILON);
    }

    @Property
    @Label("Normalize is idempotent")
    void normalizeIsIdempotent(@ForAll("directions") Vector3<DoubleScalar> v) {
        var once = v.normalize();
        var twice = once.normalize();
        assertEquals(once.x.doubleValue(), twice.x.doubleValue(), EPSILON);
        assertEquals(once.y.doubleValue(), twice.y.doubleValue(), EPSILON);
        assertEquals(once.z.doubleValue(), twice.z.doubleValue(), EPSILON);
    }

    @Property
    @Label("Quaternion normalize is idempotent")
    void quaternionNormalizeIsIdempotent(@ForAll("rotations") Quaternion<DoubleScalar> q) {
        var scaled = q.multiply(DoubleScalar.of(3.5)).normalize();
        assertSameRotation(q, scaled);
        assertEquals(1.0, scaled.normalize().length().doubleValue(), EPSILON);
    }

    @Property
    @Label("Rotation preserves length")
    void rotationPreservesLength(@ForAll("rotations") Quaternion<DoubleScalar> q,
                                 @ForAll("directions") Vector3<DoubleScalar> v) {
        assertEquals(v.length().doubleValue(), v.transform(q).length().doubleValue(), EPSILON * 100);
    }

    @Property
    @Label("rotationTo carries one direction onto another")
    void rotationToAlignsDirections(@ForAll("directions") Vector3<DoubleScalar> a,
                                    @ForAll("directions") Vector3<DoubleScalar> b) {
        var rotated = a.transform(a.rotationTo(b)).normalize();
        var target = b.normalize();
        assertEquals(0.0, rotated.subtract(target).length().doubleValue(), 1e-6, a + " -> " + b);
    }

    @Property
    @Label("Slerp of unit quaternions is unit length")
    void slerpIsUnit(@ForAll("rotations") Quaternion<DoubleScalar> a, @ForAll("rotations") Quaternion<DoubleScalar> b,
                     @ForAll @DoubleRange(min = 0.0, max = 1.0) double t) {
        assertEquals(1.0, a.slerp(b, DoubleScalar.of(t)).length().doubleValue(), EPSILON);
    }

    @Property
    @Label("Slerp takes the shortest path regardless of sign")
    void slerpIgnoresSign(@ForAll("rotations") Quaternion<DoubleScalar> a,
                          @ForAll("rotations") Quaternion<DoubleScalar> b,
                          @ForAll @DoubleRange(min = 0.0, max = 1.0) double t) {
        var amount = DoubleScalar.of(t);
        assertSameRotation(a.slerp(b, amount), a.slerp(b.negate(), amount));
    }

    @Provide
    Arbitrary<Vector3<DoubleScalar>> directions() {
        var component = Arbitraries.doubles().between(-100.0, 100.0);
        return Combinators.combine(component, component, component)
                          .as((x, y, z) -> Vector3.of(DoubleScalar.TYPE, x, y, z))
                          .filter(v -> v.length().doubleValue() > 1e-3);
    }

    @Provide
    Arbitrary<Quaternion<DoubleScalar>> rotations() {
        var angle = Arbitraries.doubles().between(-6.28318530, 6.28318530).ofScale(8);
        return Combinators.combine(directions(), angle)
                          .as((axis, radians) -> Quaternion.createFromAxisAngle(axis.normalize(),
                                                                                DoubleScalar.of(radians)));
    }
}
