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

import com.hellblazer.spatium.numerics.scalar.Scalar;
import com.hellblazer.spatium.numerics.scalar.ScalarType;

import javax.vecmath.Matrix4d;
import java.util.Objects;

/**
 * Immutable 4x4 homogeneous transform in row-vector convention: a point transforms as {@code v * M}, and the
 * translation lives in the fourth row. {@code a.multiply(b)} applies a first, then b.
 * <p>
 * {@link Matrix4d} uses column vectors, so conversion in either direction transposes.
 *
 * @param <S> the scalar representation
 * @author hal.hildebrand
 */
public final class Matrix4x4<S extends Scalar<S>> {

    public final S m11, m12, m13, m14;
    public final S m21, m22, m23, m24;
    public final S m31, m32, m33, m34;
    public final S m41, m42, m43, m44;

    public Matrix4x4(S m11, S m12, S m13, S m14, S m21, S m22, S m23, S m24, S m31, S m32, S m33, S m34, S m41, S m42,
                     S m43, S m44) {
        this.m11 = Objects.requireNonNull(m11, "m11");
        this.m12 = Objects.requireNonNull(m12, "m12");
        this.m13 = Objects.requireNonNull(m13, "m13");
        this.m14 = Objects.requireNonNull(m14, "m14");
        this.m21 = Objects.requireNonNull(m21, "m21");
        this.m22 = Objects.requireNonNull(m22, "m22");
        this.m23 = Objects.requireNonNull(m23, "m23");
        this.m24 = Objects.requireNonNull(m24, "m24");
        this.m31 = Objects.requireNonNull(m31, "m31");
        this.m32 = Objects.requireNonNull(m32, "m32");
        this.m33 = Objects.requireNonNull(m33, "m33");
        this.m34 = Objects.requireNonNull(m34, "m34");
        this.m41 = Objects.requireNonNull(m41, "m41");
        this.m42 = Objects.requireNonNull(m42, "m42");
        this.m43 = Objects.requireNonNull(m43, "m43");
        this.m44 = Objects.requireNonNull(m44, "m44");
    }

    /**
     * Embed a 2D affine transform, leaving z untouched
     */
    public Matrix4x4(Matrix3x2<S> m) {
        this(m.m11, m.m12, m.m11.type().zero(), m.m11.type().zero(), m.m21, m.m22, m.m11.type().zero(),
             m.m11.type().zero(), m.m11.type().zero(), m.m11.type().zero(), m.m11.type().one(), m.m11.type().zero(),
             m.m31, m.m32, m.m11.type().zero(), m.m11.type().one());
    }

    /**
     * Rotation of {@code angle} radians about a unit axis
     */
    public static <S extends Scalar<S>> Matrix4x4<S> createFromAxisAngle(Vector3<S> axis, S angle) {
        var type = angle.type();
        var zero = type.zero();
        var one = type.one();
        var x = axis.x;
        var y = axis.y;
        var z = axis.z;
        var sa = angle.sin();
        var ca = angle.cos();
        var xx = x.square();
        var yy = y.square();
        var zz = z.square();
        var xy = x.multiply(y);
        var xz = x.multiply(z);
        var yz = y.multiply(z);

        return new Matrix4x4<>(xx.add(ca.multiply(one.subtract(xx))),
                               xy.subtract(ca.multiply(xy)).add(sa.multiply(z)),
                               xz.subtract(ca.multiply(xz)).subtract(sa.multiply(y)), zero,
                               xy.subtract(ca.multiply(xy)).subtract(sa.multiply(z)),
                               yy.add(ca.multiply(one.subtract(yy))),
                               yz.subtract(ca.multiply(yz)).add(sa.multiply(x)), zero,
                               xz.subtract(ca.multiply(xz)).add(sa.multiply(y)),
                               yz.subtract(ca.multiply(yz)).subtract(sa.multiply(x)),
                               zz.add(ca.multiply(one.subtract(zz))), zero, zero, zero, zero, one);
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createFromQuaternion(Quaternion<S> q) {
        var type = q.type();
        var zero = type.zero();
        var one = type.one();
        var two = type.two();
        var xx = q.x.square();
        var yy = q.y.square();
        var zz = q.z.square();
        var xy = q.x.multiply(q.y);
        var wz = q.z.multiply(q.w);
        var xz = q.z.multiply(q.x);
        var wy = q.y.multiply(q.w);
        var yz = q.y.multiply(q.z);
        var wx = q.x.multiply(q.w);

        return new Matrix4x4<>(one.subtract(two.multiply(yy.add(zz))), two.multiply(xy.add(wz)),
                               two.multiply(xz.subtract(wy)), zero, two.multiply(xy.subtract(wz)),
                               one.subtract(two.multiply(zz.add(xx))), two.multiply(yz.add(wx)), zero,
                               two.multiply(xz.add(wy)), two.multiply(yz.subtract(wx)),
                               one.subtract(two.multiply(yy.add(xx))), zero, zero, zero, zero, one);
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createFromYawPitchRoll(S yaw, S pitch, S roll) {
        return createFromQuaternion(Quaternion.createFromYawPitchRoll(yaw, pitch, roll));
    }

    /**
     * View matrix for a camera at {@code position} looking at {@code target}
     */
    public static <S extends Scalar<S>> Matrix4x4<S> createLookAt(Vector3<S> position, Vector3<S> target,
                                                                  Vector3<S> up) {
        var type = position.type();
        var zero = type.zero();
        var zAxis = position.subtract(target).normalize();
        var xAxis = up.cross(zAxis).normalize();
        var yAxis = zAxis.cross(xAxis);

        return new Matrix4x4<>(xAxis.x, yAxis.x, zAxis.x, zero, xAxis.y, yAxis.y, zAxis.y, zero, xAxis.z, yAxis.z,
                               zAxis.z, zero, xAxis.dot(position).negate(), yAxis.dot(position).negate(),
                               zAxis.dot(position).negate(), type.one());
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createOrthographic(S width, S height, S near, S far) {
        var type = width.type();
        var zero = type.zero();
        var two = type.two();
        var range = near.subtract(far);
        return new Matrix4x4<>(two.divide(width), zero, zero, zero, zero, two.divide(height), zero, zero, zero, zero,
                               type.one().divide(range), zero, zero, zero, near.divide(range), type.one());
    }

    /**
     * Perspective projection from the view volume's dimensions at the near plane. An infinite far distance is
     * accepted.
     *
     * @throws IllegalArgumentException if either distance is not positive or near is not less than far
     */
    public static <S extends Scalar<S>> Matrix4x4<S> createPerspective(S width, S height, S near, S far) {
        validateDepth(near, far);
        var type = width.type();
        var zero = type.zero();
        var two = type.two();
        var negFarRange = negFarRange(near, far);
        return new Matrix4x4<>(two.multiply(near).divide(width), zero, zero, zero, zero,
                               two.multiply(near).divide(height), zero, zero, zero, zero, negFarRange,
                               type.negativeOne(), zero, zero, near.multiply(negFarRange), zero);
    }

    /**
     * @param fieldOfView full vertical field of view in radians, in (0, pi)
     * @throws IllegalArgumentException for a field of view outside (0, pi) or an invalid depth range
     */
    public static <S extends Scalar<S>> Matrix4x4<S> createPerspectiveFieldOfView(S fieldOfView, S aspectRatio, S near,
                                                                                  S far) {
        var type = fieldOfView.type();
        if (!fieldOfView.isPositive() || fieldOfView.compareTo(type.pi()) >= 0) {
            throw new IllegalArgumentException("fieldOfView must be in (0, pi): " + fieldOfView);
        }
        validateDepth(near, far);
        var zero = type.zero();
        var yScale = type.one().divide(fieldOfView.multiply(type.half()).tan());
        var xScale = yScale.divide(aspectRatio);
        var negFarRange = negFarRange(near, far);
        return new Matrix4x4<>(xScale, zero, zero, zero, zero, yScale, zero, zero, zero, zero, negFarRange,
                               type.negativeOne(), zero, zero, near.multiply(negFarRange), zero);
    }

    /**
     * Reflection through a plane
     */
    public static <S extends Scalar<S>> Matrix4x4<S> createReflection(Plane<S> plane) {
        var p = plane.normalize();
        var type = p.d.type();
        var zero = type.zero();
        var one = type.one();
        var a = p.normal.x;
        var b = p.normal.y;
        var c = p.normal.z;
        var minusTwo = type.two().negate();
        var fa = minusTwo.multiply(a);
        var fb = minusTwo.multiply(b);
        var fc = minusTwo.multiply(c);

        return new Matrix4x4<>(fa.multiply(a).add(one), fb.multiply(a), fc.multiply(a), zero, fa.multiply(b),
                               fb.multiply(b).add(one), fc.multiply(b), zero, fa.multiply(c), fb.multiply(c),
                               fc.multiply(c).add(one), zero, fa.multiply(p.d), fb.multiply(p.d), fc.multiply(p.d),
                               one);
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createRotationX(S radians) {
        var type = radians.type();
        var zero = type.zero();
        var one = type.one();
        var c = radians.cos();
        var s = radians.sin();
        return new Matrix4x4<>(one, zero, zero, zero, zero, c, s, zero, zero, s.negate(), c, zero, zero, zero, zero,
                               one);
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createRotationX(S radians, Vector3<S> center) {
        var one = radians.type().one();
        var c = radians.cos();
        var s = radians.sin();
        var y = center.y.multiply(one.subtract(c)).add(center.z.multiply(s));
        var z = center.z.multiply(one.subtract(c)).subtract(center.y.multiply(s));
        return createRotationX(radians).withTranslation(new Vector3<>(radians.type().zero(), y, z));
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createRotationY(S radians) {
        var type = radians.type();
        var zero = type.zero();
        var one = type.one();
        var c = radians.cos();
        var s = radians.sin();
        return new Matrix4x4<>(c, zero, s.negate(), zero, zero, one, zero, zero, s, zero, c, zero, zero, zero, zero,
                               one);
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createRotationY(S radians, Vector3<S> center) {
        var one = radians.type().one();
        var c = radians.cos();
        var s = radians.sin();
        var x = center.x.multiply(one.subtract(c)).subtract(center.z.multiply(s));
        var z = center.z.multiply(one.subtract(c)).add(center.x.multiply(s));
        return createRotationY(radians).withTranslation(new Vector3<>(x, radians.type().zero(), z));
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createRotationZ(S radians) {
        var type = radians.type();
        var zero = type.zero();
        var one = type.one();
        var c = radians.cos();
        var s = radians.sin();
        return new Matrix4x4<>(c, s, zero, zero, s.negate(), c, zero, zero, zero, zero, one, zero, zero, zero, zero,
                               one);
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createRotationZ(S radians, Vector3<S> center) {
        var one = radians.type().one();
        var c = radians.cos();
        var s = radians.sin();
        var x = center.x.multiply(one.subtract(c)).add(center.y.multiply(s));
        var y = center.y.multiply(one.subtract(c)).subtract(center.x.multiply(s));
        return createRotationZ(radians).withTranslation(new Vector3<>(x, y, radians.type().zero()));
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createScale(S scale) {
        return createScale(Vector3.splat(scale));
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createScale(Vector3<S> scales) {
        var type = scales.type();
        var zero = type.zero();
        return new Matrix4x4<>(scales.x, zero, zero, zero, zero, scales.y, zero, zero, zero, zero, scales.z, zero,
                               zero, zero, zero, type.one());
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createScale(Vector3<S> scales, Vector3<S> center) {
        var one = Vector3.one(scales.type());
        return createScale(scales).withTranslation(center.multiply(one.subtract(scales)));
    }

    /**
     * Flatten geometry onto a plane as if cast by a directional light
     *
     * @param lightDirection direction from which the light arrives
     */
    public static <S extends Scalar<S>> Matrix4x4<S> createShadow(Vector3<S> lightDirection, Plane<S> plane) {
        var p = plane.normalize();
        var zero = p.d.type().zero();
        var dot = p.normal.dot(lightDirection);
        var a = p.normal.x.negate();
        var b = p.normal.y.negate();
        var c = p.normal.z.negate();
        var d = p.d.negate();
        var lx = lightDirection.x;
        var ly = lightDirection.y;
        var lz = lightDirection.z;

        return new Matrix4x4<>(a.multiply(lx).add(dot), a.multiply(ly), a.multiply(lz), zero, b.multiply(lx),
                               b.multiply(ly).add(dot), b.multiply(lz), zero, c.multiply(lx), c.multiply(ly),
                               c.multiply(lz).add(dot), zero, d.multiply(lx), d.multiply(ly), d.multiply(lz), dot);
    }

    public static <S extends Scalar<S>> Matrix4x4<S> createTranslation(Vector3<S> position) {
        return identity(position.type()).withTranslation(position);
    }

    /**
     * World matrix placing an object at {@code position}, facing {@code forward}
     */
    public static <S extends Scalar<S>> Matrix4x4<S> createWorld(Vector3<S> position, Vector3<S> forward,
                                                                 Vector3<S> up) {
        var type = position.type();
        var zero = type.zero();
        var zAxis = forward.negate().normalize();
        var xAxis = up.cross(zAxis).normalize();
        var yAxis = zAxis.cross(xAxis);

        return new Matrix4x4<>(xAxis.x, xAxis.y, xAxis.z, zero, yAxis.x, yAxis.y, yAxis.z, zero, zAxis.x, zAxis.y,
                               zAxis.z, zero, position.x, position.y, position.z, type.one());
    }

    public static <S extends Scalar<S>> Matrix4x4<S> from(ScalarType<S> type, Matrix4d m) {
        return new Matrix4x4<>(type.of(m.m00), type.of(m.m10), type.of(m.m20), type.of(m.m30), type.of(m.m01),
                               type.of(m.m11), type.of(m.m21), type.of(m.m31), type.of(m.m02), type.of(m.m12),
                               type.of(m.m22), type.of(m.m32), type.of(m.m03), type.of(m.m13), type.of(m.m23),
                               type.of(m.m33));
    }

    public static <S extends Scalar<S>> Matrix4x4<S> identity(ScalarType<S> type) {
        var zero = type.zero();
        var one = type.one();
        return new Matrix4x4<>(one, zero, zero, zero, zero, one, zero, zero, zero, zero, one, zero, zero, zero, zero,
                               one);
    }

    private static <S extends Scalar<S>> S negFarRange(S near, S far) {
        if (far.isInfinite() && far.isPositive()) {
            return far.type().negativeOne();
        }
        return far.divide(near.subtract(far));
    }

    private static <S extends Scalar<S>> void validateDepth(S near, S far) {
        if (!near.isPositive()) {
            throw new IllegalArgumentException("nearPlaneDistance must be positive: " + near);
        }
        if (!far.isPositive()) {
            throw new IllegalArgumentException("farPlaneDistance must be positive: " + far);
        }
        if (near.compareTo(far) >= 0) {
            throw new IllegalArgumentException(
            "nearPlaneDistance must be less than farPlaneDistance: " + near + " >= " + far);
        }
    }

    public Matrix4x4<S> add(Matrix4x4<S> o) {
        return new Matrix4x4<>(m11.add(o.m11), m12.add(o.m12), m13.add(o.m13), m14.add(o.m14), m21.add(o.m21),
                               m22.add(o.m22), m23.add(o.m23), m24.add(o.m24), m31.add(o.m31), m32.add(o.m32),
                               m33.add(o.m33), m34.add(o.m34), m41.add(o.m41), m42.add(o.m42), m43.add(o.m43),
                               m44.add(o.m44));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Matrix4x4<?> o)) {
            return false;
        }
        return m11.equals(o.m11) && m12.equals(o.m12) && m13.equals(o.m13) && m14.equals(o.m14) && m21.equals(o.m21)
        && m22.equals(o.m22) && m23.equals(o.m23) && m24.equals(o.m24) && m31.equals(o.m31) && m32.equals(o.m32)
        && m33.equals(o.m33) && m34.equals(o.m34) && m41.equals(o.m41) && m42.equals(o.m42) && m43.equals(o.m43)
        && m44.equals(o.m44);
    }

    /**
     * Laplace expansion along the first row, sharing the 2x2 minors of the lower two rows
     */
    public S getDeterminant() {
        var kpLo = m33.multiply(m44).subtract(m34.multiply(m43));
        var jpLn = m32.multiply(m44).subtract(m34.multiply(m42));
        var joKn = m32.multiply(m43).subtract(m33.multiply(m42));
        var ipLm = m31.multiply(m44).subtract(m34.multiply(m41));
        var ioKm = m31.multiply(m43).subtract(m33.multiply(m41));
        var inJm = m31.multiply(m42).subtract(m32.multiply(m41));

        return m11.multiply(m22.multiply(kpLo).subtract(m23.multiply(jpLn)).add(m24.multiply(joKn)))
                  .subtract(m12.multiply(m21.multiply(kpLo).subtract(m23.multiply(ipLm)).add(m24.multiply(ioKm))))
                  .add(m13.multiply(m21.multiply(jpLn).subtract(m22.multiply(ipLm)).add(m24.multiply(inJm))))
                  .subtract(m14.multiply(m21.multiply(joKn).subtract(m22.multiply(ioKm)).add(m23.multiply(inJm))));
    }

    public Vector3<S> getTranslation() {
        return new Vector3<>(m41, m42, m43);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m11, m12, m13, m14, m21, m22, m23, m24, m31, m32, m33, m34, m41, m42, m43, m44);
    }

    /**
     * Cofactor inversion. A nearly singular matrix yields {@code (false, identity)}.
     */
    public Inversion<S> invert() {
        var type = m11.type();
        S a = m11, b = m12, c = m13, d = m14;
        S e = m21, f = m22, g = m23, h = m24;
        S i = m31, j = m32, k = m33, l = m34;
        S m = m41, n = m42, o = m43, p = m44;

        var kpLo = k.multiply(p).subtract(l.multiply(o));
        var jpLn = j.multiply(p).subtract(l.multiply(n));
        var joKn = j.multiply(o).subtract(k.multiply(n));
        var ipLm = i.multiply(p).subtract(l.multiply(m));
        var ioKm = i.multiply(o).subtract(k.multiply(m));
        var inJm = i.multiply(n).subtract(j.multiply(m));

        var a11 = f.multiply(kpLo).subtract(g.multiply(jpLn)).add(h.multiply(joKn));
        var a12 = e.multiply(kpLo).subtract(g.multiply(ipLm)).add(h.multiply(ioKm)).negate();
        var a13 = e.multiply(jpLn).subtract(f.multiply(ipLm)).add(h.multiply(inJm));
        var a14 = e.multiply(joKn).subtract(f.multiply(ioKm)).add(g.multiply(inJm)).negate();

        var det = a.multiply(a11).add(b.multiply(a12)).add(c.multiply(a13)).add(d.multiply(a14));
        if (det.abs().isNearlyZero()) {
            return new Inversion<>(false, identity(type));
        }
        var inv = type.one().divide(det);

        var gpHo = g.multiply(p).subtract(h.multiply(o));
        var fpHn = f.multiply(p).subtract(h.multiply(n));
        var foGn = f.multiply(o).subtract(g.multiply(n));
        var epHm = e.multiply(p).subtract(h.multiply(m));
        var eoGm = e.multiply(o).subtract(g.multiply(m));
        var enFm = e.multiply(n).subtract(f.multiply(m));

        var glHk = g.multiply(l).subtract(h.multiply(k));
        var flHj = f.multiply(l).subtract(h.multiply(j));
        var fkGj = f.multiply(k).subtract(g.multiply(j));
        var elHi = e.multiply(l).subtract(h.multiply(i));
        var ekGi = e.multiply(k).subtract(g.multiply(i));
        var ejFi = e.multiply(j).subtract(f.multiply(i));

        var r12 = b.multiply(kpLo).subtract(c.multiply(jpLn)).add(d.multiply(joKn)).negate();
        var r22 = a.multiply(kpLo).subtract(c.multiply(ipLm)).add(d.multiply(ioKm));
        var r32 = a.multiply(jpLn).subtract(b.multiply(ipLm)).add(d.multiply(inJm)).negate();
        var r42 = a.multiply(joKn).subtract(b.multiply(ioKm)).add(c.multiply(inJm));

        var r13 = b.multiply(gpHo).subtract(c.multiply(fpHn)).add(d.multiply(foGn));
        var r23 = a.multiply(gpHo).subtract(c.multiply(epHm)).add(d.multiply(eoGm)).negate();
        var r33 = a.multiply(fpHn).subtract(b.multiply(epHm)).add(d.multiply(enFm));
        var r43 = a.multiply(foGn).subtract(b.multiply(eoGm)).add(c.multiply(enFm)).negate();

        var r14 = b.multiply(glHk).subtract(c.multiply(flHj)).add(d.multiply(fkGj)).negate();
        var r24 = a.multiply(glHk).subtract(c.multiply(elHi)).add(d.multiply(ekGi));
        var r34 = a.multiply(flHj).subtract(b.multiply(elHi)).add(d.multiply(ejFi)).negate();
        var r44 = a.multiply(fkGj).subtract(b.multiply(ekGi)).add(c.multiply(ejFi));

        var inverse = new Matrix4x4<>(a11, r12, r13, r14, a12, r22, r23, r24, a13, r32, r33, r34, a14, r42, r43, r44);
        return new Inversion<>(true, inverse.multiply(inv));
    }

    public boolean isIdentity() {
        var one = m11.type().one();
        return m11.compareTo(one) == 0 && m22.compareTo(one) == 0 && m33.compareTo(one) == 0 && m44.compareTo(one) == 0
        && m12.isZero() && m13.isZero() && m14.isZero() && m21.isZero() && m23.isZero() && m24.isZero()
        && m31.isZero() && m32.isZero() && m34.isZero() && m41.isZero() && m42.isZero() && m43.isZero();
    }

    public boolean isNearlyEqualTo(Matrix4x4<S> o) {
        return m11.isNearlyEqualTo(o.m11) && m12.isNearlyEqualTo(o.m12) && m13.isNearlyEqualTo(o.m13)
        && m14.isNearlyEqualTo(o.m14) && m21.isNearlyEqualTo(o.m21) && m22.isNearlyEqualTo(o.m22)
        && m23.isNearlyEqualTo(o.m23) && m24.isNearlyEqualTo(o.m24) && m31.isNearlyEqualTo(o.m31)
        && m32.isNearlyEqualTo(o.m32) && m33.isNearlyEqualTo(o.m33) && m34.isNearlyEqualTo(o.m34)
        && m41.isNearlyEqualTo(o.m41) && m42.isNearlyEqualTo(o.m42) && m43.isNearlyEqualTo(o.m43)
        && m44.isNearlyEqualTo(o.m44);
    }

    public Matrix4x4<S> lerp(Matrix4x4<S> other, S amount) {
        return add(other.subtract(this).multiply(amount));
    }

    public Matrix4x4<S> multiply(Matrix4x4<S> o) {
        return new Matrix4x4<>(row(m11, m12, m13, m14, o.m11, o.m21, o.m31, o.m41),
                               row(m11, m12, m13, m14, o.m12, o.m22, o.m32, o.m42),
                               row(m11, m12, m13, m14, o.m13, o.m23, o.m33, o.m43),
                               row(m11, m12, m13, m14, o.m14, o.m24, o.m34, o.m44),
                               row(m21, m22, m23, m24, o.m11, o.m21, o.m31, o.m41),
                               row(m21, m22, m23, m24, o.m12, o.m22, o.m32, o.m42),
                               row(m21, m22, m23, m24, o.m13, o.m23, o.m33, o.m43),
                               row(m21, m22, m23, m24, o.m14, o.m24, o.m34, o.m44),
                               row(m31, m32, m33, m34, o.m11, o.m21, o.m31, o.m41),
                               row(m31, m32, m33, m34, o.m12, o.m22, o.m32, o.m42),
                               row(m31, m32, m33, m34, o.m13, o.m23, o.m33, o.m43),
                               row(m31, m32, m33, m34, o.m14, o.m24, o.m34, o.m44),
                               row(m41, m42, m43, m44, o.m11, o.m21, o.m31, o.m41),
                               row(m41, m42, m43, m44, o.m12, o.m22, o.m32, o.m42),
                               row(m41, m42, m43, m44, o.m13, o.m23, o.m33, o.m43),
                               row(m41, m42, m43, m44, o.m14, o.m24, o.m34, o.m44));
    }

    public Matrix4x4<S> multiply(S f) {
        return new Matrix4x4<>(m11.multiply(f), m12.multiply(f), m13.multiply(f), m14.multiply(f), m21.multiply(f),
                               m22.multiply(f), m23.multiply(f), m24.multiply(f), m31.multiply(f), m32.multiply(f),
                               m33.multiply(f), m34.multiply(f), m41.multiply(f), m42.multiply(f), m43.multiply(f),
                               m44.multiply(f));
    }

    public Matrix4x4<S> negate() {
        return new Matrix4x4<>(m11.negate(), m12.negate(), m13.negate(), m14.negate(), m21.negate(), m22.negate(),
                               m23.negate(), m24.negate(), m31.negate(), m32.negate(), m33.negate(), m34.negate(),
                               m41.negate(), m42.negate(), m43.negate(), m44.negate());
    }

    public Matrix4x4<S> subtract(Matrix4x4<S> o) {
        return add(o.negate());
    }

    public Matrix4d toMatrix4d() {
        return new Matrix4d(m11.doubleValue(), m21.doubleValue(), m31.doubleValue(), m41.doubleValue(),
                            m12.doubleValue(), m22.doubleValue(), m32.doubleValue(), m42.doubleValue(),
                            m13.doubleValue(), m23.doubleValue(), m33.doubleValue(), m43.doubleValue(),
                            m14.doubleValue(), m24.doubleValue(), m34.doubleValue(), m44.doubleValue());
    }

    @Override
    public String toString() {
        return "{ {" + m11 + " " + m12 + " " + m13 + " " + m14 + "} {" + m21 + " " + m22 + " " + m23 + " " + m24
        + "} {" + m31 + " " + m32 + " " + m33 + " " + m34 + "} {" + m41 + " " + m42 + " " + m43 + " " + m44 + "} }";
    }

    /**
     * Follow this transform by a rotation
     */
    public Matrix4x4<S> transform(Quaternion<S> rotation) {
        return multiply(createFromQuaternion(rotation));
    }

    public Matrix4x4<S> transpose() {
        return new Matrix4x4<>(m11, m21, m31, m41, m12, m22, m32, m42, m13, m23, m33, m43, m14, m24, m34, m44);
    }

    public Matrix4x4<S> withTranslation(Vector3<S> translation) {
        return new Matrix4x4<>(m11, m12, m13, m14, m21, m22, m23, m24, m31, m32, m33, m34, translation.x,
                               translation.y, translation.z, m44);
    }

    private S row(S r1, S r2, S r3, S r4, S c1, S c2, S c3, S c4) {
        return r1.multiply(c1).add(r2.multiply(c2)).add(r3.multiply(c3)).add(r4.multiply(c4));
    }

    /**
     * Outcome of an inversion. A singular matrix reports {@code success == false} with the identity as its matrix.
     */
    public record Inversion<S extends Scalar<S>>(boolean success, Matrix4x4<S> matrix) {
    }
}
