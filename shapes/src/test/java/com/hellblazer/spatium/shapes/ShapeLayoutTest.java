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
import com.hellblazer.spatium.numerics.scalar.DecimalScalar;
import com.hellblazer.spatium.numerics.scalar.DoubleScalar;
import com.hellblazer.spatium.numerics.scalar.HugeNumber;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.hellblazer.spatium.shapes.ShapeTest.d;
import static com.hellblazer.spatium.shapes.ShapeTest.v;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ShapeLayoutTest {

    private static List<Double> doubles(ShapeLayout.Record<DoubleScalar> record) {
        var values = new ArrayList<Double>();
        for (var value : record.values()) {
            values.add(value.doubleValue());
        }
        return values;
    }

    @Test
    public void testDecodeRecomputesDerivedFacts() {
        var record = new ShapeLayout.Record<>(ShapeType.CUBOID,
                                              List.of(d(2), d(4), d(6), d(0), d(0), d(0), d(0), d(0), d(0), d(1)));
        var cuboid = (Cuboid<DoubleScalar>) ShapeLayout.decode(record);
        assertEquals(Math.sqrt(14), cuboid.getContainingRadius().doubleValue(), 1e-9);
        assertEquals(48.0, cuboid.getVolume().doubleValue(), 1e-9);
        assertTrue(cuboid.getRotation().isIdentity(), "identity rotation");
    }

    @Test
    public void testEveryKindSurvives() {
        var turn = Quaternion.createFromAxisAngle(Vector3.unitZ(DoubleScalar.TYPE), d(0.3));
        List<Shape<DoubleScalar>> shapes = List.of(new Capsule<>(v(0, 4, 0), d(1), v(1, 2, 3)),
                                                   new Cone<>(v(0, 2, 0), d(1), v(1, 2, 3)),
                                                   new Cuboid<>(d(2), d(4), d(6), v(1, 2, 3), turn),
                                                   new Cylinder<>(v(1, 1, 0), d(0.5), v(1, 2, 3)),
                                                   new Ellipsoid<>(d(1), d(2), d(3), v(1, 2, 3), turn),
                                                   new Frustum<>(d(1.5), v(0, 0, 10), d(0.6), d(1), v(1, 2, 3),
                                                                 turn), new HollowSphere<>(d(1), d(2), v(1, 2, 3)),
                                                   new Line<>(v(4, 0, 0), v(1, 2, 3)),
                                                   new SinglePoint<>(v(1, 2, 3)), new Sphere<>(d(2), v(1, 2, 3)),
                                                   new Torus<>(d(3), d(1), v(1, 2, 3), turn),
                                                   new Sphere<>(d(0), v(0, 0, 0)),
                                                   new Cuboid<>(d(0), d(0), d(0), v(0, 0, 0)));
        for (var shape : shapes) {
            var record = ShapeLayout.encode(shape);
            assertEquals(shape.getShapeType(), record.type());
            assertEquals(shape, ShapeLayout.decode(record), shape.getShapeType().toString());
        }
    }

    @Test
    public void testExtremeMagnitudes() {
        var type = HugeNumber.TYPE;
        var huge = HugeNumber.of(1.5, 100000);
        var tiny = HugeNumber.of(1.5, -100000);
        var sphere = new Sphere<>(huge, Vector3.of(type, 1, 2, 3));
        assertEquals(sphere, ShapeLayout.decode(ShapeLayout.encode(sphere)));

        var cuboid = new Cuboid<>(huge, tiny, huge, new Vector3<>(huge, tiny, type.zero()));
        var decoded = ShapeLayout.decode(ShapeLayout.encode(cuboid));
        assertEquals(cuboid, decoded);
        assertEquals(cuboid.getVolume(), decoded.getVolume());

        var decimal = new Line<>(Vector3.of(DecimalScalar.TYPE, 1, 0, 0),
                                 new Vector3<>(DecimalScalar.of("0.1"), DecimalScalar.of("0.2"),
                                               DecimalScalar.of("0.3")));
        assertEquals(decimal, ShapeLayout.decode(ShapeLayout.encode(decimal)));
    }

    @Test
    public void testInvalidRecords() {
        assertThrows(IllegalArgumentException.class,
                     () -> ShapeLayout.decode(new ShapeLayout.Record<>(ShapeType.SPHERE, List.of(d(1), d(0), d(0)))));
        assertThrows(IllegalArgumentException.class, () -> ShapeLayout.decode(
        new ShapeLayout.Record<>(ShapeType.SPHERE, List.of(d(1), d(0), d(0), d(0), d(0)))));
        assertThrows(IllegalArgumentException.class,
                     () -> ShapeLayout.decode(new ShapeLayout.Record<DoubleScalar>(ShapeType.NONE, List.of())));
        assertThrows(IllegalArgumentException.class, () -> ShapeLayout.decode(
        new ShapeLayout.Record<>(ShapeType.HOLLOW_SPHERE, List.of(d(3), d(2), d(0), d(0), d(0)))));
        assertThrows(NullPointerException.class, () -> new ShapeLayout.Record<>(null, List.of(d(1))));
    }

    @Test
    public void testOrder() {
        var capsule = ShapeLayout.encode(new Capsule<>(v(1, 2, 3), d(4), v(5, 6, 7)));
        assertEquals(List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0), doubles(capsule));

        var torus = ShapeLayout.encode(new Torus<>(d(3), d(1), v(5, 6, 7)));
        assertEquals(List.of(3.0, 1.0, 5.0, 6.0, 7.0, 0.0, 0.0, 0.0, 1.0), doubles(torus));

        var frustum = ShapeLayout.encode(new Frustum<>(d(1.5), v(0, 0, 10), d(0.6), d(1), v(5, 6, 7)));
        assertEquals(List.of(1.5, 0.0, 0.0, 10.0, 0.6, 1.0, 5.0, 6.0, 7.0, 0.0, 0.0, 0.0, 1.0), doubles(frustum));

        assertEquals(3, ShapeLayout.encode(new SinglePoint<>(v(1, 2, 3))).values().size());
        assertEquals(5, ShapeLayout.encode(new HollowSphere<>(d(1), d(2), v(0, 0, 0))).values().size());
        assertEquals(10, ShapeLayout.encode(new Ellipsoid<>(d(1), d(2), d(3), v(0, 0, 0))).values().size());
    }

    @Test
    public void testRecordIsImmutable() {
        var values = new ArrayList<>(List.of(d(1), d(0), d(0), d(0)));
        var record = new ShapeLayout.Record<>(ShapeType.SPHERE, values);
        values.clear();
        assertEquals(4, record.values().size());
        assertThrows(UnsupportedOperationException.class, () -> record.values().add(d(2)));
    }
}
