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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Canonical flat layout of a shape: its type tag and the ordered scalars of its defining parameters. Vectors are
 * flattened as x, y, z and quaternions as x, y, z, w. Derived facts are never stored; decoding recomputes them.
 *
 * @author hal.hildebrand
 */
public final class ShapeLayout {

    private ShapeLayout() {
    }

    public static <S extends Scalar<S>> Shape<S> decode(Record<S> record) {
        Objects.requireNonNull(record, "record");
        var in = new Reader<>(record);
        Shape<S> shape = switch (record.type()) {
            case CAPSULE -> new Capsule<>(in.vector(), in.scalar(), in.vector());
            case CONE -> new Cone<>(in.vector(), in.scalar(), in.vector());
            case CUBOID -> new Cuboid<>(in.scalar(), in.scalar(), in.scalar(), in.vector(), in.quaternion());
            case CYLINDER -> new Cylinder<>(in.vector(), in.scalar(), in.vector());
            case ELLIPSOID -> new Ellipsoid<>(in.scalar(), in.scalar(), in.scalar(), in.vector(), in.quaternion());
            case FRUSTUM -> new Frustum<>(in.scalar(), in.vector(), in.scalar(), in.scalar(), in.vector(),
                                          in.quaternion());
            case HOLLOW_SPHERE -> new HollowSphere<>(in.scalar(), in.scalar(), in.vector());
            case LINE -> new Line<>(in.vector(), in.vector());
            case SINGLE_POINT -> new SinglePoint<>(in.vector());
            case SPHERE -> new Sphere<>(in.scalar(), in.vector());
            case TORUS -> new Torus<>(in.scalar(), in.scalar(), in.vector(), in.quaternion());
            case NONE -> throw new IllegalArgumentException("Cannot decode shape type NONE");
        };
        in.finish();
        return shape;
    }

    public static <S extends Scalar<S>> Record<S> encode(Shape<S> shape) {
        var out = new ArrayList<S>();
        switch (shape.getShapeType()) {
            case CAPSULE -> {
                var capsule = (Capsule<S>) shape;
                out.addAll(capsule.getAxis().toList());
                out.add(capsule.getRadius());
            }
            case CONE -> {
                var cone = (Cone<S>) shape;
                out.addAll(cone.getAxis().toList());
                out.add(cone.getRadius());
            }
            case CUBOID -> {
                var cuboid = (Cuboid<S>) shape;
                out.addAll(List.of(cuboid.getAxisX(), cuboid.getAxisY(), cuboid.getAxisZ()));
            }
            case CYLINDER -> {
                var cylinder = (Cylinder<S>) shape;
                out.addAll(cylinder.getAxis().toList());
                out.add(cylinder.getRadius());
            }
            case ELLIPSOID -> {
                var ellipsoid = (Ellipsoid<S>) shape;
                out.addAll(List.of(ellipsoid.getAxisX(), ellipsoid.getAxisY(), ellipsoid.getAxisZ()));
            }
            case FRUSTUM -> {
                var frustum = (Frustum<S>) shape;
                out.add(frustum.getAspectRatio());
                out.addAll(frustum.getAxis().toList());
                out.add(frustum.getFieldOfViewAngle());
                out.add(frustum.getNearPlaneDistance());
            }
            case HOLLOW_SPHERE -> {
                var hollow = (HollowSphere<S>) shape;
                out.add(hollow.getInnerRadius());
                out.add(hollow.getOuterRadius());
            }
            case LINE -> out.addAll(((Line<S>) shape).getPath().toList());
            case SINGLE_POINT -> {
            }
            case SPHERE -> out.add(((Sphere<S>) shape).getRadius());
            case TORUS -> {
                var torus = (Torus<S>) shape;
                out.add(torus.getMajorRadius());
                out.add(torus.getMinorRadius());
            }
            case NONE -> throw new IllegalArgumentException("Cannot encode shape type NONE");
        }
        out.addAll(shape.getPosition().toList());
        switch (shape.getShapeType()) {
            case CUBOID, ELLIPSOID, FRUSTUM, TORUS -> out.addAll(shape.getRotation().toList());
            default -> {
            }
        }
        return new Record<>(shape.getShapeType(), out);
    }

    /**
     * A shape's type tag with its ordered defining scalars
     */
    public record Record<S extends Scalar<S>>(ShapeType type, List<S> values) {
        public Record {
            Objects.requireNonNull(type, "type");
            values = List.copyOf(values);
        }
    }

    private static final class Reader<S extends Scalar<S>> {
        private final Record<S> record;
        private       int       next;

        private Reader(Record<S> record) {
            this.record = record;
        }

        private void finish() {
            if (next != record.values().size()) {
                throw new IllegalArgumentException(
                "Expected " + next + " values for " + record.type() + ", found " + record.values().size());
            }
        }

        private Quaternion<S> quaternion() {
            return new Quaternion<>(scalar(), scalar(), scalar(), scalar());
        }

        private S scalar() {
            if (next >= record.values().size()) {
                throw new IllegalArgumentException(
                "Too few values for " + record.type() + ": " + record.values().size());
            }
            return record.values().get(next++);
        }

        private Vector3<S> vector() {
            return new Vector3<>(scalar(), scalar(), scalar());
        }
    }
}
