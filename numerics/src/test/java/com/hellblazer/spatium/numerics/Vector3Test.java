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

import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class Vector3Test {

    private static final double EPSILON = 1e-12;

    private static void assertVector(double x, double y, double z, Vector3<DoubleScalar> actual) {
        assertEquals(x, actual.x.doubleValue(), EPSILON, "x of " + actual);
        assertEquals(y, actual.y.doubleValue(), EPSILON, "y of " + actual);
        assertEquals(z, actual.z.doubleValue(), EPSILON, "z of " + actual);
    }

    private static Vector3<DoubleScalar> v(double x, double y, double z) {
        return Vector3.of(DoubleScalar.TYPE, x, y, z);
    }

    @Test
    public void testAngle() {
        assertEquals(Math.PI / 2, v(1, 0, 0).angle(v(0, 3, 0)).doubleValue(), EPSILON);
        assertEquals(Math.PI, v(1, 0, 0).angle(v(-2, 0, 0)).doubleValue(), EPSILON);
        assertEquals(Math.PI / 4, v(1, 0, 0).angle(v(1, 1, 0)).doubleValue(), EPSILON);
    }

    @Test
    public void testArithmetic() {
        var a = v(1, 2, 3);
        var b = v(4, -5, 6);
        assertEquals(v(5, -3, 9), a.add(b));
        assertEquals(v(-3, 7, -3), a.subtract(b));
        assertEquals(v(4, -10, 18), a.multiply(b));
        assertEquals(v(2, 4, 6), a.multiply(DoubleScalar.of(2)));
        assertEquals(v(0.5, 1, 1.5), a.divide(DoubleScalar.of(2)));
        assertEquals(v(-1, -2, -3), a.negate());
        assertEquals(v(4, 5, 6), b.abs());
        assertEquals(v(1, -5, 3), a.min(b));
        assertEquals(v(4, 2, 6), a.max(b));
        assertEquals(v(1, 0, 3), b.clamp(v(0, 0, 0), v(1, 2, 3)));
        assertEquals(12.0, a.dot(b).doubleValue());
        assertEquals(14.0, a.lengthSquared().doubleValue());
        assertEquals(v(2.5, -1.5, 4.5), a.lerp(b, DoubleScalar.of(0.5)));
        assertEquals(v(1, 2, 3), v(1, 4, 9).sqrt());
    }

    @Test
    public void testArrays() {
        var values = new DoubleScalar[] { DoubleScalar.of(9), DoubleScalar.of(1), DoubleScalar.of(2),
                                          DoubleScalar.of(3) };
        var vector = Vector3.create(values, 1);
        assertEquals(v(1, 2, 3), vector);

        var copy = new DoubleScalar[4];
        vector.copyTo(copy, 1);
        assertNull(copy[0]);
        assertEquals(DoubleScalar.of(3), copy[3]);
        assertEquals(3, vector.toArray().length);

        assertThrows(IllegalArgumentException.class, () -> vector.copyTo(new DoubleScalar[3], 1), "short array");
        assertThrows(IllegalArgumentException.class, () -> Vector3.create(values, 2), "short source");
    }

    @Test
    public void testCrossIsRightHanded() {
        var x = Vector3.unitX(DoubleScalar.TYPE);
        var y = Vector3.unitY(DoubleScalar.TYPE);
        assertEquals(Vector3.unitZ(DoubleScalar.TYPE), x.cross(y));
        assertEquals(Vector3.unitZ(DoubleScalar.TYPE).negate(), y.cross(x));
    }

    @Test
    public void testDistance() {
        assertEquals(5.0, v(1, 1, 1).distance(v(4, 5, 1)).doubleValue());
        assertEquals(25.0, v(1, 1, 1).distanceSquared(v(4, 5, 1)).doubleValue());
    }

    @Test
    public void testExtremeLengths() {
        assertEquals(5e200, v(3e200, 4e200, 0).length().doubleValue(), 5e188);
        assertEquals(5e-200, v(3e-200, 0, 4e-200).length().doubleValue(), 5e-212);
        assertEquals(1e300, v(1e300, 0, 0).distance(v(-1e300, 0, 0)).doubleValue() / 2, 1e288);
        assertEquals(1.0, v(1e300, 1e300, 1e300).normalize().length().doubleValue(), EPSILON);

        var single = Vector3.of(SingleScalar.TYPE, 3e19, 4e19, 0);
        assertEquals(5e19, single.length().doubleValue(), 5e13);
        assertTrue(single.lengthSquared().isInfinite(), "the square itself overflows");
        assertTrue(v(Double.POSITIVE_INFINITY, 1, 0).length().isInfinite());
        assertTrue(v(Double.NaN, 1, 0).length().isNaN());
        assertEquals(0.0, v(0, 0, 0).length().doubleValue());
    }

    @Test
    public void testNormalize() {
        assertVector(0.6, 0.8, 0, v(3, 4, 0).normalize());
        var zero = Vector3.zero(DoubleScalar.TYPE);
        assertTrue(zero.isZero());
        assertTrue(zero.normalize().x.isNaN(), "a zero vector has no direction");
    }

    @Test
    public void testParallel() {
        assertTrue(v(1, 2, 3).areParallel(v(2, 4, 6), false));
        assertTrue(v(1, 2, 3).areParallel(v(-1, -2, -3)));
        assertFalse(v(1, 2, 3).areParallel(v(1, 2, 4)));
        assertTrue(v(1, 0, 0).areParallel(v(1, 1e-17, 0), true), "within tolerance");
        assertFalse(v(1, 0, 0).areParallel(v(1, 1e-17, 0), false), "strict");
    }

    @Test
    public void testPrecisionConversion() {
        var single = Vector3.of(SingleScalar.TYPE, 1.5, -2, 0.25);
        var widened = single.widenTo(DoubleScalar.TYPE);
        assertEquals(v(1.5, -2, 0.25), widened);
        assertThrows(IllegalArgumentException.class, () -> widened.widenTo(SingleScalar.TYPE),
                     "double to single narrows");
        var narrowed = v(1.0 / 3.0, 0, 0).narrowTo(SingleScalar.TYPE);
        assertEquals(1.0f / 3.0f, (float) narrowed.x.doubleValue());
    }

    @Test
    public void testReflect() {
        assertVector(1, 1, 0, v(1, -1, 0).reflect(Vector3.unitY(DoubleScalar.TYPE)));
    }

    @Test
    public void testRotationTo() {
        var a = v(0, 0, 2);
        var b = v(0, 3, 0);
        var rotation = a.rotationTo(b);
        assertEquals(1.0, rotation.length().doubleValue(), EPSILON);
        assertVector(0, 2, 0, a.transform(rotation));

        assertTrue(a.rotationTo(a).isIdentity(), "equal vectors need no rotation");
    }

    @Test
    public void testRotationToOpposite() {
        var a = Vector3.unitX(DoubleScalar.TYPE);
        var b = a.negate();
        var rotation = a.rotationTo(b);
        assertEquals(1.0, rotation.length().doubleValue(), EPSILON, "a valid rotation");
        assertVector(-1, 0, 0, a.transform(rotation));
        assertEquals(Math.PI, rotation.toAxisAngle().angle().doubleValue(), EPSILON, "a half turn");

        var c = v(0, -5, 0);
        assertVector(0, 5, 0, c.transform(c.rotationTo(c.negate())));
    }

    @Test
    public void testRotationToZero() {
        var zero = Vector3.zero(DoubleScalar.TYPE);
        var unitY = Vector3.unitY(DoubleScalar.TYPE);
        for (var rotation : List.of(zero.rotationTo(unitY), unitY.rotationTo(zero), zero.rotationTo(zero))) {
            assertTrue(rotation.w.isNaN(), "no direction to rotate from");
            assertTrue(rotation.x.isNaN());
        }

        var tiny = v(1e-20, 0, 0);
        assertVector(0, 1, 0, tiny.transform(tiny.rotationTo(unitY)).normalize());
        assertTrue(tiny.rotationTo(v(3, 0, 0)).isIdentity(), "same direction at any length");
    }

    @Test
    public void testTransformMatchesVecmath() {
        var rotation = Quaternion.createFromAxisAngle(v(1, 2, 3).normalize(), DoubleScalar.of(0.7));
        var point = v(-4, 0.5, 2);
        var transformed = point.transform(rotation);

        var matrix = new Matrix4d();
        matrix.set(rotation.toQuat4d());
        var expected = point.toPoint3d();
        matrix.transform(expected);
        assertVector(expected.x, expected.y, expected.z, transformed);
        assertEquals(Vector3.from(DoubleScalar.TYPE, new Point3d(1, 2, 3)), v(1, 2, 3));
        assertEquals(new Quat4d(0, 0, 0, 1), Quaternion.identity(DoubleScalar.TYPE).toQuat4d());
    }

    @Test
    public void testTransformByMatrix() {
        var translation = Matrix4x4.createTranslation(v(10, 0, 0));
        assertVector(11, 2, 3, v(1, 2, 3).transform(translation));
        assertVector(1, 2, 3, v(1, 2, 3).transformNormal(translation));

        var rotation = Matrix4x4.createRotationZ(DoubleScalar.of(Math.PI / 2));
        assertVector(-2, 1, 3, v(1, 2, 3).transform(rotation));
    }
}
