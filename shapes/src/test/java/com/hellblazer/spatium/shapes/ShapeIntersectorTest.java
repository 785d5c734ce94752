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
import com.hellblazer.spatium.numerics.scalar.DoubleScalar;
import com.hellblazer.spatium.numerics.scalar.SingleScalar;
import org.junit.jupiter.api.Test;

import static com.hellblazer.spatium.shapes.ShapeTest.d;
import static com.hellblazer.spatium.shapes.ShapeTest.v;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Pairwise intersection, checked in both argument orders
 *
 * @author hal.hildebrand
 */
public class ShapeIntersectorTest {

    private static void assertIntersects(Shape<DoubleScalar> a, Shape<DoubleScalar> b) {
        assertTrue(a.intersects(b), a + " should intersect " + b);
        assertTrue(b.intersects(a), b + " should intersect " + a);
    }

    private static void assertSeparate(Shape<DoubleScalar> a, Shape<DoubleScalar> b) {
        assertFalse(a.intersects(b), a + " should not intersect " + b);
        assertFalse(b.intersects(a), b + " should not intersect " + a);
    }

    private static Quaternion<DoubleScalar> about(Vector3<DoubleScalar> axis, double radians) {
        return Quaternion.createFromAxisAngle(axis, d(radians));
    }

    private static Cuboid<DoubleScalar> cube(double edge, Vector3<DoubleScalar> position) {
        return new Cuboid<>(d(edge), d(edge), d(edge), position);
    }

    @Test
    public void testCapsuleAndSphere() {
        var capsule = new Capsule<>(v(0, 4, 0), d(1), v(0, 0, 0));
        assertIntersects(capsule, new Sphere<>(d(1), v(1.9, 0, 0)));
        assertSeparate(capsule, new Sphere<>(d(1), v(2.1, 0, 0)));
        assertIntersects(capsule, new Sphere<>(d(1), v(0, 3.9, 0)));
        assertSeparate(capsule, new Sphere<>(d(1), v(0, 4.1, 0)));
    }

    @Test
    public void testCapsuleAndSegments() {
        var capsule = new Capsule<>(v(0, 4, 0), d(1), v(0, 0, 0));
        assertIntersects(capsule, new Capsule<>(v(0, 0, 4), d(0.5), v(1.4, 0, 0)));
        assertSeparate(capsule, new Capsule<>(v(0, 0, 4), d(0.5), v(1.6, 0, 0)));
        assertIntersects(capsule, new Line<>(v(0, 0, 4), v(0.9, 1, 0)));
        assertSeparate(capsule, new Line<>(v(0, 0, 4), v(1.1, 1, 0)));
    }

    @Test
    public void testConvexPairs() {
        var box = cube(2, v(0, 0, 0));
        assertIntersects(box, cube(2, v(1.9, 0, 0)));
        assertSeparate(box, cube(2, v(2.1, 0, 0)));

        var diamond = new Cuboid<>(d(2), d(2), d(2), v(2.3, 0, 0), about(Vector3.unitZ(DoubleScalar.TYPE),
                                                                          Math.PI / 4));
        assertIntersects(box, diamond);
        assertSeparate(box, diamond.getCopyAtPosition(v(2.5, 0, 0)));

        var ellipsoid = new Ellipsoid<>(d(1), d(2), d(3), v(0, 0, 0));
        assertIntersects(ellipsoid, new Cylinder<>(v(0, 2, 0), d(0.5), v(1.4, 0, 0)));
        assertSeparate(ellipsoid, new Cylinder<>(v(0, 2, 0), d(0.5), v(1.6, 0, 0)));
        assertIntersects(ellipsoid, new Line<>(v(0, 0, 10), v(0.9, 0, 0)));
        assertSeparate(ellipsoid, new Line<>(v(0, 0, 10), v(1.1, 0, 0)));

        var frustum = new Frustum<>(d(1), v(0, 0, 10), d(Math.PI / 4), d(1), v(0, 0, 0));
        assertIntersects(frustum, cube(1, v(0, 0, 5)));
        assertIntersects(frustum, cube(1, v(5.6, 0, 5)));
        assertSeparate(frustum, cube(1, v(6.5, 0, 5)));

        var capsule = new Capsule<>(v(0, 4, 0), d(1), v(0, 0, 0));
        assertIntersects(capsule, box.getCopyAtPosition(v(1.9, 0, 0)));
        assertSeparate(capsule, box.getCopyAtPosition(v(2.9, 0, 0)));

        var cone = new Cone<>(v(0, 2, 0), d(1), v(0, 0, 0));
        assertIntersects(cone, cube(1, v(1.4, 1, 0)));
        assertSeparate(cone, cube(1, v(1.6, 1, 0)));

        var cylinder = new Cylinder<>(v(0, 4, 0), d(1), v(0, 0, 0));
        assertIntersects(cylinder, cylinder.getCopyAtPosition(v(1.9, 0, 0)));
        assertSeparate(cylinder, cylinder.getCopyAtPosition(v(2.1, 0, 0)));
    }

    @Test
    public void testCustomIterationCap() {
        var intersector = new ShapeIntersector(new GjkConfig(8));
        assertEquals(8, intersector.getGjk().getConfig().maxIterations());
        assertTrue(intersector.test(cube(2, v(0, 0, 0)), cube(2, v(1, 0, 0))));
        assertFalse(intersector.test(cube(2, v(0, 0, 0)), cube(2, v(3, 0, 0))));
    }

    @Test
    public void testExtremeDoubleMagnitudes() {
        var big = new Sphere<>(d(5e200), v(0, 0, 0));
        assertFalse(big.isPointWithin(v(9e200, 0, 0)));
        assertTrue(big.isPointWithin(v(4e200, 0, 0)));
        assertSeparate(big, new Sphere<>(d(3e200), v(9e200, 0, 0)));
        assertIntersects(big, new Sphere<>(d(3e200), v(7e200, 0, 0)));

        var box = cube(2e200, v(0, 0, 0));
        assertSeparate(box, new Sphere<>(d(1e200), v(2.5e200, 0, 0)));
        assertIntersects(box, new Sphere<>(d(1e200), v(1.5e200, 1.5e200, 0)));

        var capsule = new Capsule<>(v(0, 4e200, 0), d(1e200), v(0, 0, 0));
        assertSeparate(capsule, new Sphere<>(d(1e200), v(3e200, 0, 0)));
        assertSeparate(capsule, new Line<>(v(0, 0, 4e200), v(1.5e200, 0, 0)));
        assertIntersects(capsule, new Line<>(v(0, 0, 4e200), v(0.5e200, 0, 0)));
        assertSeparate(new Sphere<>(d(1e200), v(0, 0, 0)), new Line<>(v(0, 4e200, 0), v(2e200, 0, 0)));
    }

    @Test
    public void testExtremeSingleMagnitudes() {
        var type = SingleScalar.TYPE;
        var big = new Sphere<>(SingleScalar.of(5e19f), Vector3.zero(type));
        var far = new Sphere<>(SingleScalar.of(3e19f), Vector3.of(type, 9e19, 0, 0));
        var near = new Sphere<>(SingleScalar.of(3e19f), Vector3.of(type, 7e19, 0, 0));
        assertFalse(big.intersects(far));
        assertFalse(far.intersects(big));
        assertTrue(big.intersects(near));
        assertTrue(near.intersects(big));
        assertFalse(big.isPointWithin(Vector3.of(type, 9e19, 0, 0)));

        var shell = new HollowSphere<>(SingleScalar.of(2e19f), SingleScalar.of(5e19f), Vector3.zero(type));
        assertTrue(shell.isPointWithin(Vector3.of(type, 0, 3e19, 0)));
        assertFalse(shell.isPointWithin(Vector3.of(type, 0, 6e19, 0)));
        assertFalse(shell.isPointWithin(Vector3.of(type, 0, 1e19, 0)));

        var cylinder = new Cylinder<>(Vector3.of(type, 0, 4e19, 0), SingleScalar.of(1e19f), Vector3.zero(type));
        assertFalse(cylinder.isPointWithin(Vector3.of(type, 3e19, 0, 0)));
        assertFalse(cylinder.intersects(new Sphere<>(SingleScalar.of(1e19f), Vector3.of(type, 3e19, 0, 0))));
    }

    @Test
    public void testHollowSphere() {
        var shell = new HollowSphere<>(d(2), d(3), v(0, 0, 0));
        assertSeparate(shell, new Sphere<>(d(0.5), v(0, 0, 0)));
        assertIntersects(shell, new Sphere<>(d(0.5), v(1.8, 0, 0)));
        assertSeparate(shell, new Sphere<>(d(0.5), v(3.6, 0, 0)));
        assertSeparate(shell, cube(1, v(0, 0, 0)));
        assertIntersects(shell, cube(3, v(0, 0, 0)));
        assertSeparate(shell, new HollowSphere<>(d(0.5), d(1), v(0, 0, 0)));
        assertIntersects(shell, new HollowSphere<>(d(1), d(2.5), v(0, 0, 0)));
        assertIntersects(shell, new Torus<>(d(2.5), d(0.2), v(0, 0, 0)));
        assertSeparate(shell, new Torus<>(d(1), d(0.5), v(0, 0, 0)));
    }

    @Test
    public void testLineAndCuboid() {
        var box = cube(2, v(0, 0, 0));
        assertSeparate(box, new Line<>(v(4, -4, 0), v(0, 2.2, 0)));
        assertIntersects(box, new Line<>(v(4, -4, 0), v(0, 1.8, 0)));
        assertIntersects(box, new Line<>(v(0.5, 0, 0), v(0, 0, 0)));
        assertSeparate(box, new Line<>(v(4, 0, 0), v(0, 1.1, 0)));

        var turned = box.getCloneWithRotation(about(Vector3.unitZ(DoubleScalar.TYPE), Math.PI / 4));
        assertIntersects(turned, new Line<>(v(0, 0, 4), v(1.3, 0, 0)));
        assertSeparate(turned, new Line<>(v(0, 0, 4), v(1.5, 0, 0)));
    }

    @Test
    public void testLines() {
        var line = new Line<>(v(4, 0, 0), v(0, 0, 0));
        assertIntersects(line, new Line<>(v(0, 4, 0), v(1, 0, 0)));
        assertSeparate(line, new Line<>(v(0, 4, 0), v(1, 0, 0.5)));
        assertSeparate(line, new Line<>(v(0, 4, 0), v(3, 0, 0)));
    }

    @Test
    public void testPoints() {
        var point = new SinglePoint<>(v(0.5, 0, 0));
        assertIntersects(point, new Sphere<>(d(1), v(0, 0, 0)));
        assertIntersects(point, point.getCopyAtPosition(v(0.5, 0, 0)));
        assertSeparate(point, point.getCopyAtPosition(v(0.6, 0, 0)));
        assertIntersects(point, new Torus<>(d(0.5), d(0.1), v(0, 0, 0)));
        assertSeparate(point, new Torus<>(d(3), d(1), v(0, 0, 0)));
        assertSeparate(point, new HollowSphere<>(d(1), d(2), v(0, 0, 0)));
        assertIntersects(point, new Line<>(v(2, 0, 0), v(0, 0, 0)));
    }

    @Test
    public void testSphereAndCone() {
        var cone = new Cone<>(v(0, 2, 0), d(1), v(0, 0, 0));
        assertIntersects(cone, new Sphere<>(d(0.1), v(0.6, 0, 0)));
        assertSeparate(cone, new Sphere<>(d(0.08), v(0.6, 0, 0)));
        assertIntersects(cone, new Sphere<>(d(0.5), v(0, -1.4, 0)));
        assertSeparate(cone, new Sphere<>(d(0.5), v(0, -1.6, 0)));
    }

    @Test
    public void testSphereAndCuboid() {
        var box = cube(2, v(0, 0, 0));
        assertSeparate(box, new Sphere<>(d(1), v(1.8, 1.8, 0)));
        assertIntersects(box, new Sphere<>(d(1), v(1.5, 1.5, 0)));
        assertIntersects(box, new Sphere<>(d(1), v(1.9, 0, 0)));
        assertIntersects(box, new Sphere<>(d(0.1), v(0, 0, 0)));

        var turned = box.getCloneWithRotation(about(Vector3.unitZ(DoubleScalar.TYPE), Math.PI / 4));
        assertSeparate(turned, new Sphere<>(d(1), v(1.8, 1.8, 0)));
        assertIntersects(turned, new Sphere<>(d(0.5), v(1.8, 0, 0)));
    }

    @Test
    public void testSphereAndCylinder() {
        var cylinder = new Cylinder<>(v(0, 4, 0), d(1), v(0, 0, 0));
        assertIntersects(cylinder, new Sphere<>(d(0.5), v(1.4, 0, 0)));
        assertSeparate(cylinder, new Sphere<>(d(0.5), v(1.6, 0, 0)));
        assertIntersects(cylinder, new Sphere<>(d(0.5), v(1.3, 2.3, 0)));
        assertSeparate(cylinder, new Sphere<>(d(0.5), v(1.4, 2.4, 0)));
    }

    @Test
    public void testSphereAndLine() {
        var ball = new Sphere<>(d(1), v(0, 0, 0));
        assertSeparate(ball, new Line<>(v(0, 0, 2), v(0, 0, 2.5)));
        assertIntersects(ball, new Line<>(v(0, 0, 2), v(0, 0, 1.5)));
        assertSeparate(ball, new Line<>(v(4, 0, 0), v(0, 1.5, 0)));
        assertIntersects(ball, new Line<>(v(4, 0, 0), v(0, 0.9, 0)));
        assertIntersects(ball, new Line<>(v(0, 0, 0), v(0.5, 0, 0)));
    }

    @Test
    public void testSpheres() {
        var big = new Sphere<>(d(5), v(0, 0, 0));
        assertIntersects(big, new Sphere<>(d(3), v(7, 0, 0)));
        assertIntersects(big, new Sphere<>(d(3), v(8, 0, 0)));
        assertSeparate(big, new Sphere<>(d(3), v(9, 0, 0)));
        assertIntersects(big, new Sphere<>(d(1), v(0, 0, 0)));
    }

    @Test
    public void testTorus() {
        var torus = new Torus<>(d(3), d(1), v(0, 0, 0));
        assertSeparate(torus, new Sphere<>(d(0.5), v(0, 0, 0)));
        assertIntersects(torus, new Sphere<>(d(2.1), v(0, 0, 0)));
        assertIntersects(torus, new Sphere<>(d(0.5), v(0, 1.4, 3)));

        assertSeparate(torus, cube(1, v(0, 0, 0)));
        assertIntersects(torus, cube(1, v(3, 0, 0)));
        assertSeparate(torus, cube(1, v(0, 2.5, 0)));

        assertSeparate(torus, new Line<>(v(0, 10, 0), v(0, 0, 0)));
        assertIntersects(torus, new Line<>(v(0, 10, 0), v(3, 0, 0)));

        assertIntersects(torus, torus.getCopyAtPosition(v(6.5, 0, 0)));
        assertSeparate(torus, torus.getCopyAtPosition(v(8.5, 0, 0)));

        var link = new Torus<>(d(3), d(1), v(3, 0, 0), about(Vector3.unitX(DoubleScalar.TYPE), Math.PI / 2));
        assertSeparate(torus, link);
    }

    @Test
    public void testNullArguments() {
        var ball = new Sphere<>(d(1), v(0, 0, 0));
        assertThrows(NullPointerException.class, () -> ShapeIntersector.intersects(ball, null));
    }
}
