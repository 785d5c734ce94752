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
 * IEEE 754 double precision scalar.
 *
 * @author hal.hildebrand
 */
public final class DoubleScalar implements Scalar<DoubleScalar> {

    public static final ScalarType<DoubleScalar> TYPE = new ScalarType<>() {
        private final DoubleScalar epsilon = new DoubleScalar(Tolerances.doubleEpsilon());

        @Override
        public DoubleScalar convert(Scalar<?> value) {
            if (value instanceof DoubleScalar d) {
                return d;
            }
            return of(value.doubleValue());
        }

        @Override
        public DoubleScalar epsilon() {
            return epsilon;
        }

        @Override
        public long maxBinaryExponent() {
            return Double.MAX_EXPONENT;
        }

        @Override
        public String name() {
            return "double";
        }

        @Override
        public DoubleScalar nan() {
            return NAN;
        }

        @Override
        public DoubleScalar of(double value) {
            return DoubleScalar.of(value);
        }

        @Override
        public DoubleScalar of(long value) {
            return DoubleScalar.of(value);
        }

        @Override
        public DoubleScalar one() {
            return ONE;
        }

        @Override
        public DoubleScalar parse(String text) {
            return DoubleScalar.of(Double.parseDouble(text));
        }

        @Override
        public DoubleScalar pi() {
            return PI;
        }

        @Override
        public int significandDigits() {
            return 15;
        }

        @Override
        public String toString() {
            return name();
        }

        @Override
        public DoubleScalar zero() {
            return ZERO;
        }
    };

    private static final DoubleScalar ZERO = new DoubleScalar(0.0);
    private static final DoubleScalar ONE  = new DoubleScalar(1.0);
    private static final DoubleScalar PI   = new DoubleScalar(Math.PI);
    private static final DoubleScalar NAN  = new DoubleScalar(Double.NaN);

    private final double value;

    private DoubleScalar(double value) {
        this.value = value;
    }

    public static DoubleScalar of(double value) {
        if (value == 0.0 && Double.doubleToRawLongBits(value) == 0L) {
            return ZERO;
        }
        if (value == 1.0) {
            return ONE;
        }
        return new DoubleScalar(value);
    }

    @Override
    public DoubleScalar abs() {
        return of(Math.abs(value));
    }

    @Override
    public DoubleScalar acos() {
        return of(Math.acos(value));
    }

    @Override
    public DoubleScalar add(DoubleScalar other) {
        return of(value + other.value);
    }

    @Override
    public DoubleScalar asin() {
        return of(Math.asin(value));
    }

    @Override
    public DoubleScalar atan() {
        return of(Math.atan(value));
    }

    @Override
    public DoubleScalar atan2(DoubleScalar x) {
        return of(Math.atan2(value, x.value));
    }

    @Override
    public DoubleScalar cbrt() {
        return of(Math.cbrt(value));
    }

    @Override
    public int compareTo(DoubleScalar o) {
        if (value == o.value) {
            return 0;
        }
        return Double.compare(value, o.value);
    }

    @Override
    public DoubleScalar cos() {
        return of(Math.cos(value));
    }

    @Override
    public DoubleScalar divide(DoubleScalar other) {
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
        if (!(obj instanceof DoubleScalar other)) {
            return false;
        }
        return value == other.value || Double.isNaN(value) && Double.isNaN(other.value);
    }

    @Override
    public DoubleScalar exp() {
        return of(Math.exp(value));
    }

    @Override
    public DoubleScalar floor() {
        return of(Math.floor(value));
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value == 0.0 ? 0.0 : value);
    }

    @Override
    public DoubleScalar ieeeRemainder(DoubleScalar divisor) {
        return of(Math.IEEEremainder(value, divisor.value));
    }

    @Override
    public boolean isInfinite() {
        return Double.isInfinite(value);
    }

    @Override
    public boolean isNaN() {
        return Double.isNaN(value);
    }

    @Override
    public DoubleScalar log() {
        return of(Math.log(value));
    }

    @Override
    public DoubleScalar multiply(DoubleScalar other) {
        return of(value * other.value);
    }

    @Override
    public DoubleScalar negate() {
        return of(-value);
    }

    @Override
    public DoubleScalar pow(DoubleScalar exponent) {
        return of(Math.pow(value, exponent.value));
    }

    @Override
    public int signum() {
        return (int) Math.signum(value);
    }

    @Override
    public DoubleScalar sin() {
        return of(Math.sin(value));
    }

    @Override
    public DoubleScalar sqrt() {
        return of(Math.sqrt(value));
    }

    @Override
    public DoubleScalar subtract(DoubleScalar other) {
        return of(value - other.value);
    }

    @Override
    public DoubleScalar tan() {
        return of(Math.tan(value));
    }

    @Override
    public BigDecimal toBigDecimal() {
        if (!Double.isFinite(value)) {
            throw new ArithmeticException("No decimal form for " + value);
        }
        return BigDecimal.valueOf(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }

    @Override
    public ScalarType<DoubleScalar> type() {
        return TYPE;
    }
}
