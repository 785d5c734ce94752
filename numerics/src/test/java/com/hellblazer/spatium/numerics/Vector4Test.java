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
import com.hellblazer.spatium.numerics.scalar.SingleScalar;
import org.junit.jupiter.api.Test;

import javax.vecmath.Vector4d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class Vector4Test {

    private static final double EPSILON = 1e-12;

    private static void assertVector(double x, double y, double z, double w, Vector4<DoubleScalar> actual) {
        assertEquals(x, actual.x.doubleValue(), EPSILON, "x of " + actual);
        assertEquals(y, actual.y.doubleValue(), EPSILON, "y of " + actual);
        assertEquals(z, actual.z.doubleValue(), EPSILON, "z of " + actual);
        assertEquals(w, actual.w.doubleValue(), EPSILON, "w of " + actual);
    }

    private static DoubleScalar d(double value) {
        return DoubleScalar.of(value);
    }

    private static Vector4<DoubleScalar> v(double x, double y, double z, double w) {
        return Vector4.of(DoubleScalar.TYPE, x, y, z, w);
    }

    private static Vector3<DoubleScalar> v(double x, double y, double z) {
        return Vector3.of(DoubleScalar.TYPE, x, y, z);
    }

    @Test
    public void testArithmetic() {
        var a = v(1, 2, 3, 4);
        var b = v(4, -5, 6, -1);
        assertEquals(v(5, -3, 9, 3), a.add(b));
        assertEquals(v(-3, 7, -3, 5), a.subtract(b));
        assertEquals(v(4, -10, 18, -4), a.multiply(b));
        assertEquals(v(2, 4, 6, 8), a.multiply(d(2)));
        assertEquals(v(0.5, 1, 1.5, 2), a.divide(d(2)));
        assertEquals(v(-1, -2, -3, -4), a.negate());
        assertEquals(v(4, 5, 6, 1), b.abs());
        assertEquals(v(1, -5, 3, -1), a.min(b));
        assertEquals(v(4, 2, 6, 4), a.max(b));
        assertEquals(v(1, 0, 3, 0), b.clamp(Vector4.zero(DoubleScalar.TYPE), v(1, 2, 3, 4)));
        assertEquals(8.0, a.dot(b).doubleValue());
        assertEquals(30.0, a.lengthSquared().doubleValue());
        assertEquals(v(2.5, -1.5, 4.5, 1.5), a.lerp(b, d(0.5)));
        assertEquals(v(1, 2, 3, 4), v(1, 4, 9, 16).sqrt());
        assertEquals(v(1, 1, 0, 0), v(1, -1, 0, 0).reflect(Vector4.unitY(DoubleScalar.TYPE)));
    }

    @Test
    public void testArrays() {
        var values = new DoubleScalar[] { d(9), d(1), d(2), d(3), d(4) };
        var vector = Vector4.create(values, 1);
        assertEquals(v(1, 2, 3, 4), vector);
        assertArrayEquals(new DoubleScalar[] { d(1), d(2), d(3), d(4) }, vector.toArray());
        assertEquals(vector.toList(), List.of(d(1), d(2), d(3), d(4)));
        assertThrows(IllegalArgumentException.class, () -> vector.copyTo(new DoubleScalar[4], 1), "short array");
        assertThrows(IllegalArgumentException.class, () -> Vector4.create(values, 2), "short source");
    }

    @Test
    public void testConstants() {
        var type = DoubleScalar.TYPE;
        assertEquals(v(0, 0, 0, 0), Vector4.zero(type));
        assertEquals(v(1, 1, 1, 1), Vector4.one(type));
        assertEquals(v(1, 0, 0, 0), Vector4.unitX(type));
        assertEquals(v(0, 1, 0, 0), Vector4.unitY(type));
        assertEquals(v(0, 0, 1, 0), Vector4.unitZ(type));
        assertEquals(v(0, 0, 0, 1), Vector4.unitW(type));
        assertTrue(Vector4.zero(type).isZero());
        assertTrue(v(1e-20, 0, 0, -1e-20).isNearlyZero());
        assertFalse(Vector4.unitW(type).isNearlyZero());
    }

    @Test
    public void testConversions() {
        var single = Vector4.of(SingleScalar.TYPE, 1, 2, 3, 4);
        var widened = single.widenTo(DoubleScalar.TYPE);
        assertEquals(v(1, 2, 3, 4), widened);
        assertThrows(IllegalArgumentException.class, () -> widened.widenTo(SingleScalar.TYPE),
                     "double to single narrows");
        assertEquals(single, widened.narrowTo(SingleScalar.TYPE));
        assertEquals(new Vector4d(1, 2, 3, 4), widened.toVector4d());
        assertEquals(widened, Vector4.from(DoubleScalar.TYPE, new Vector4d(1, 2, 3, 4)));
        assertEquals(v(1, 2, 3), widened.xyz());
    }

    @Test
    public void testExtremeLengths() {
        assertEquals(5e200, v(1e200, 2e200, 2e200, 4e200).length().doubleValue(), 1e188);
        assertEquals(5e-200, v(1e-200, 2e-200, 2e-200, 4e-200).length().doubleValue(), 1e-212);
        assertEquals(5.0, v(1, 2, 2, 4).length().doubleValue(), EPSILON);
        assertEquals(0.0, Vector4.zero(DoubleScalar.TYPE).length().doubleValue());

        var single = Vector4.of(SingleScalar.TYPE, 1e19, 2e19, 2e19, 4e19);
        assertTrue(single.lengthSquared().isInfinite());
        assertEquals(5e19, single.length().doubleValue(), 1e13);
    }

    @Test
    public void testNormalizeAndDistance() {
        var unit = v(0, 3, 0, 4).normalize();
        assertVector(0, 0.6, 0, 0.8, unit);
        assertEquals(1.0, unit.length().doubleValue(), EPSILON);
        assertTrue(Vector4.zero(DoubleScalar.TYPE).normalize().x.isNaN());

        assertEquals(5.0, v(1, 1, 1, 1).distance(v(2, 3, 3, 5)).doubleValue(), EPSILON);
        assertEquals(25.0, v(1, 1, 1, 1).distanceSquared(v(2, 3, 3, 5)).doubleValue(), EPSILON);
    }

    @Test
    public void testPositions() {
        assertEquals(v(3, 4, 5, 1), Vector4.position(v(3, 4, 5)));
        assertEquals(v(3, 4, 0, 1), Vector4.position(Vector2.of(DoubleScalar.TYPE, 3, 4)));
        assertEquals(v(3, 4, 5, 0), Vector4.of(v(3, 4, 5), d(0)));
    }

    @Test
    public void testTransformByMatrix() {
        var translation = Matrix4x4.createTranslation(v(10, 20, 30));
        assertEquals(v(11, 22, 33, 1), Vector4.position(v(1, 2, 3)).transform(translation));
        assertEquals(v(1, 2, 3, 0), Vector4.of(v(1, 2, 3), d(0)).transform(translation), "directions do not move");

        var affine = Matrix4x4.createFromAxisAngle(v(1, 2, 3).normalize(), d(0.7)).withTranslation(v(-1, 5, 2));
        var point = v(-4, 0.5, 2);
        var expected = point.transform(affine);
        var actual = Vector4.position(point).transform(affine);
        assertVector(expected.x.doubleValue(), expected.y.doubleValue(), expected.z.doubleValue(), 1, actual);

        var projection = Matrix4x4.createPerspectiveFieldOfView(d(1.0), d(1.5), d(0.1), d(100));
        var homogeneous = v(0.5, -0.25, -3, 1);
        var reference = homogeneous.toVector4d();
        projection.toMatrix4d().transform(reference);
        assertVector(reference.x, reference.y, reference.z, reference.w, homogeneous.transform(projection));
        assertEquals(3.0, homogeneous.transform(projection).w.doubleValue(), EPSILON, "w carries the depth");
    }

    @Test
    public void testTransformByQuaternion() {
        var quarter = Quaternion.createFromAxisAngle(v(0, 0, 1), d(Math.PI / 2));
        assertVector(0, 1, 0, 7, v(1, 0, 0, 7).transform(quarter));

        var rotation = Quaternion.createFromAxisAngle(v(1, 2, 3).normalize(), d(0.7));
        var expected = v(-4, 0.5, 2).transform(rotation);
        var actual = Vector4.position(v(-4, 0.5, 2)).transform(rotation);
        assertVector(expected.x.doubleValue(), expected.y.doubleValue(), expected.z.doubleValue(), 1, actual);
    }
}
