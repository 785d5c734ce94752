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
package com.hellblazer.spatium.numerics.scalar;

import java.math.BigDecimal;

/**
 * IEEE 754 single precision scalar. Elementary functions are evaluated in double precision and rounded.
 *
 * @author hal.hildebrand
 */
public final class SingleScalar implements Scalar<SingleScalar> {

    public static final ScalarType<SingleScalar> TYPE = new ScalarType<>() {
        private final SingleScalar epsilon = new SingleScalar(Tolerances.singleEpsilon());

        @Override
        public SingleScalar convert(Scalar<?> value) {
            if (value instanceof SingleScalar d) {
                return d;
            }
            return of(value.doubleValue());
        }

        @Override
        public SingleScalar epsilon() {
            return epsilon;
        }

        @Override
        public long maxBinaryExponent() {
            return Float.MAX_EXPONENT;
        }

        @Override
        public String name() {
            return "single";
        }

        @Override
        public SingleScalar nan() {
            return NAN;
        }

        @Override
        public SingleScalar of(double value) {
            return SingleScalar.of(value);
        }

        @Override
        public SingleScalar of(long value) {
            return SingleScalar.of(value);
        }

        @Override
        public SingleScalar one() {
            return ONE;
        }

        @Override
        public SingleScalar parse(String text) {
            return SingleScalar.of(Float.parseFloat(text));
        }

        @Override
        public SingleScalar pi() {
            return PI;
        }

        @Override
        public int significandDigits() {
            return 6;
        }

        @Override
        public String toString() {
            return name();
        }

        @Override
        public SingleScalar zero() {
            return ZERO;
        }
    };

    private static final SingleScalar ZERO = new SingleScalar(0.0f);
    private static final SingleScalar ONE  = new SingleScalar(1.0f);
    private static final SingleScalar PI   = new SingleScalar((float) Math.PI);
    private static final SingleScalar NAN  = new SingleScalar(Float.NaN);

    private final float value;

    private SingleScalar(float value) {
        this.value = value;
    }

    public static SingleScalar of(double value) {
        return of((float) value);
    }

    public static SingleScalar of(float value) {
        if (value == 0.0f && Float.floatToRawIntBits(value) == 0) {
            return ZERO;
        }
        if (value == 1.0f) {
            return ONE;
        }
        return new SingleScalar(value);
    }

    @Override
    public SingleScalar abs() {
        return of(Math.abs(value));
    }

    @Override
    public SingleScalar acos() {
        return of(Math.acos(value));
    }

    @Override
    public SingleScalar add(SingleScalar other) {
        return of(value + other.value);
    }

    @Override
    public SingleScalar asin() {
        return of(Math.asin(value));
    }

    @Override
    public SingleScalar atan() {
        return of(Math.atan(value));
    }

    @Override
    public SingleScalar atan2(SingleScalar x) {
        return of(Math.atan2(value, x.value));
    }

    @Override
    public SingleScalar cbrt() {
        return of(Math.cbrt(value));
    }

    @Override
    public int compareTo(SingleScalar o) {
        if (value == o.value) {
            return 0;
        }
        return Float.compare(value, o.value);
    }

    @Override
    public SingleScalar cos() {
        return of(Math.cos(value));
    }

    @Override
    public SingleScalar divide(SingleScalar other) {
        return of(value / other.value);
    }

    @Override
    public double doubleValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SingleScalar other)) {
            return false;
        }
        return value == other.value || Float.isNaN(value) && Float.isNaN(other.value);
    }

    @Override
    public SingleScalar exp() {
        return of(Math.exp(value));
    }

    @Override
    public SingleScalar floor() {
        return of(Math.floor(value));
    }

    @Override
    public int hashCode() {
        return Float.hashCode(value == 0.0f ? 0.0f : value);
    }

    @Override
    public SingleScalar ieeeRemainder(SingleScalar divisor) {
        return of(Math.IEEEremainder(value, divisor.value));
    }

    @Override
    public boolean isInfinite() {
        return Float.isInfinite(value);
    }

    @Override
    public boolean isNaN() {
        return Float.isNaN(value);
    }

    @Override
    public SingleScalar log() {
        return of(Math.log(value));
    }

    @Override
    public SingleScalar multiply(SingleScalar other) {
        return of(value * other.value);
    }

    @Override
    public SingleScalar negate() {
        return of(-value);
    }

    @Override
    public SingleScalar pow(SingleScalar exponent) {
        return of(Math.pow(value, exponent.value));
    }

    @Override
    public int signum() {
        return (int) Math.signum(value);
    }

    @Override
    public SingleScalar sin() {
        return of(Math.sin(value));
    }

    @Override
    public SingleScalar sqrt() {
        return of(Math.sqrt(value));
    }

    @Override
    public SingleScalar subtract(SingleScalar other) {
        return of(value - other.value);
    }

    @Override
    public SingleScalar tan() {
        return of(Math.tan(value));
    }

    @Override
    public BigDecimal toBigDecimal() {
        if (!Float.isFinite(value)) {
            throw new ArithmeticException("No decimal form for " + value);
        }
        return new BigDecimal(Float.toString(value));
    }

    @Override
    public String toString() {
        return Float.toString(value);
    }

    @Override
    public ScalarType<SingleScalar> type() {
        return TYPE;
    }
}
