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
import org.junit.jupiter.api.Test;

import javax.vecmath.Matrix4d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class Matrix4x4Test {

    private static final double EPSILON = 1e-12;

    private static void assertMatrix(Matrix4d expected, Matrix4d actual) {
        for (var row = 0; row < 4; row++) {
            for (var column = 0; column < 4; column++) {
                assertEquals(expected.getElement(row, column), actual.getElement(row, column), EPSILON,
                             "element " + row + "," + column);
            }
        }
    }

    private static void assertVector(double x, double y, double z, Vector3<DoubleScalar> actual) {
        assertEquals(x, actual.x.doubleValue(), EPSILON, "x of " + actual);
        assertEquals(y, actual.y.doubleValue(), EPSILON, "y of " + actual);
        assertEquals(z, actual.z.doubleValue(), EPSILON, "z of " + actual);
    }

    private static DoubleScalar d(double value) {
        return DoubleScalar.of(value);
    }

    private static Matrix4x4<DoubleScalar> sample() {
        return Matrix4x4.createFromYawPitchRoll(d(0.3), d(-1.1), d(2.0))
                        .multiply(Matrix4x4.createScale(Vector3.of(DoubleScalar.TYPE, 2, 0.5, 3)))
                        .multiply(Matrix4x4.createTranslation(v(4, -5, 6)));
    }

    private static Vector3<DoubleScalar> v(double x, double y, double z) {
        return Vector3.of(DoubleScalar.TYPE, x, y, z);
    }

    @Test
    public void testAxisAngleMatchesQuaternion() {
        var axis = v(2, -1, 0.5).normalize();
        var angle = d(1.7);
        var fromAxis = Matrix4x4.createFromAxisAngle(axis, angle);
        var fromQuaternion = Matrix4x4.createFromQuaternion(Quaternion.createFromAxisAngle(axis, angle));
        assertMatrix(fromQuaternion.toMatrix4d(), fromAxis.toMatrix4d());
    }

    @Test
    public void testCameras() {
        var eye = v(0, 0, 10);
        var view = Matrix4x4.createLookAt(eye, v(0, 0, 0), Vector3.unitY(DoubleScalar.TYPE));
        assertVector(0, 0, 0, eye.transform(view));
        assertVector(0, 0, -10, v(0, 0, 0).transform(view));

        var world = Matrix4x4.createWorld(v(1, 2, 3), v(0, 0, -1), Vector3.unitY(DoubleScalar.TYPE));
        assertVector(1, 2, 3, Vector3.zero(DoubleScalar.TYPE).transform(world));
        assertTrue(world.multiply(Matrix4x4.createTranslation(v(-1, -2, -3))).isIdentity());

        var orthographic = Matrix4x4.createOrthographic(d(4), d(2), d(1), d(11));
        assertVector(0.5, 1, 0.1, v(1, 1, -2).transform(orthographic));
    }

    @Test
    public void testDeterminantMatchesVecmath() {
        var m = sample();
        assertEquals(m.toMatrix4d().determinant(), m.getDeterminant().doubleValue(), 1e-9);
        assertEquals(3.0, m.getDeterminant().doubleValue(), 1e-9, "product of the scale factors");
    }

    @Test
    public void testInvert() {
        var m = sample();
        var inversion = m.invert();
        assertTrue(inversion.success());
        var expected = m.toMatrix4d();
        expected.invert();
        assertMatrix(expected, inversion.matrix().toMatrix4d());

        var singular = Matrix4x4.createScale(v(1, 0, 1)).invert();
        assertFalse(singular.success());
        assertTrue(singular.matrix().isIdentity());
    }

    @Test
    public void testMultiplyMatchesVecmath() {
        var a = sample();
        var b = Matrix4x4.createRotationX(d(0.9)).multiply(Matrix4x4.createTranslation(v(1, 1, 1)));
        var expected = new Matrix4d();
        // column vectors compose right to left
        expected.mul(b.toMatrix4d(), a.toMatrix4d());
        assertMatrix(expected, a.multiply(b).toMatrix4d());
        assertEquals(a, Matrix4x4.from(DoubleScalar.TYPE, a.toMatrix4d()));
    }

    @Test
    public void testPerspectiveFieldOfView() {
        var fov = d(Math.PI / 2);
        var projection = Matrix4x4.createPerspectiveFieldOfView(fov, d(2), d(1), d(100));
        assertEquals(1.0, projection.m22.doubleValue(), EPSILON, "y scale");
        assertEquals(0.5, projection.m11.doubleValue(), EPSILON, "x scale");
        assertEquals(-1.0, projection.m34.doubleValue());
        assertTrue(projection.m21.isZero());

        var infinite = Matrix4x4.createPerspectiveFieldOfView(fov, d(1), d(1), d(Double.POSITIVE_INFINITY));
        assertEquals(-1.0, infinite.m33.doubleValue());

        assertThrows(IllegalArgumentException.class,
                     () -> Matrix4x4.createPerspectiveFieldOfView(d(0), d(1), d(1), d(10)));
        assertThrows(IllegalArgumentException.class,
                     () -> Matrix4x4.createPerspectiveFieldOfView(d(Math.PI), d(1), d(1), d(10)));
        assertThrows(IllegalArgumentException.class,
                     () -> Matrix4x4.createPerspectiveFieldOfView(fov, d(1), d(-1), d(10)));
        assertThrows(IllegalArgumentException.class,
                     () -> Matrix4x4.createPerspectiveFieldOfView(fov, d(1), d(1), d(0)));
        assertThrows(IllegalArgumentException.class,
                     () -> Matrix4x4.createPerspectiveFieldOfView(fov, d(1), d(10), d(10)));
        assertThrows(IllegalArgumentException.class, () -> Matrix4x4.createPerspective(d(2), d(2), d(5), d(1)));
    }

    @Test
    public void testQuaternionMatchesVecmath() {
        var q = Quaternion.createFromAxisAngle(v(1, 1, -1).normalize(), d(2.2));
        var expected = new Matrix4d();
        expected.set(q.toQuat4d());
        assertMatrix(expected, Matrix4x4.createFromQuaternion(q).toMatrix4d());

        var identity = Matrix4x4.identity(DoubleScalar.TYPE);
        assertMatrix(expected, identity.transform(q).toMatrix4d());
    }

    @Test
    public void testReflectionAndShadow() {
        var floor = Plane.of(d(0), d(2), d(0), d(0));
        assertVector(1, -2, 3, v(1, 2, 3).transform(Matrix4x4.createReflection(floor)));

        var raised = Plane.of(d(0), d(1), d(0), d(-1));
        assertVector(1, 0, 3, v(1, 2, 3).transform(Matrix4x4.createReflection(raised)));

        var shadow = Matrix4x4.createShadow(v(1, 1, 0), floor);
        assertVector(-2, 0, 0, v(0, 2, 0).transform(shadow));
        assertVector(3, 0, 4, v(3, 0, 4).transform(shadow));
    }

    @Test
    public void testRotationsAreRightHanded() {
        var quarter = d(Math.PI / 2);
        assertVector(0, 0, 1, Vector3.unitY(DoubleScalar.TYPE).transform(Matrix4x4.createRotationX(quarter)));
        assertVector(1, 0, 0, Vector3.unitZ(DoubleScalar.TYPE).transform(Matrix4x4.createRotationY(quarter)));
        assertVector(0, 1, 0, Vector3.unitX(DoubleScalar.TYPE).transform(Matrix4x4.createRotationZ(quarter)));

        var center = v(1, 2, 3);
        assertVector(1, 2, 3, center.transform(Matrix4x4.createRotationX(quarter, center)));
        assertVector(1, 2, 3, center.transform(Matrix4x4.createRotationY(quarter, center)));
        assertVector(1, 2, 3, center.transform(Matrix4x4.createRotationZ(quarter, center)));
        assertVector(1, 2, 3, center.transform(Matrix4x4.createScale(v(3, 4, 5), center)));
    }

    @Test
    public void testTranspose() {
        var m = sample();
        assertEquals(m, m.transpose().transpose());
        assertEquals(m.m12, m.transpose().m21);
        assertEquals(v(4, -5, 6), m.getTranslation());
    }
}
