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
import java.math.MathContext;
import java.util.Objects;

/**
 * A scalar with double precision but an effectively unbounded range: {@code mantissa * 2^exponent} where the mantissa
 * is a double with magnitude in [1, 2) and the exponent is a long. Zero, NaN and the infinities are held in the
 * mantissa with a zero exponent.
 * <p>
 * Arithmetic, roots, powers and comparison keep the full exponent range. The trigonometric functions evaluate in double
 * precision; their arguments beyond the double range have no meaningful phase anyway.
 * <p>
 * Text form is the double text when the value fits a double, otherwise {@code <mantissa>p<exponent>}, e.g.
 * {@code 1.5p4096}.
 *
 * @author hal.hildebrand
 */
public final class HugeNumber implements Scalar<HugeNumber> {

    private static final HugeNumber  ZERO            = new HugeNumber(0.0, 0L);
    private static final HugeNumber  ONE             = new HugeNumber(1.0, 0L);
    private static final HugeNumber  PI              = normalize(Math.PI, 0L);
    private static final HugeNumber  NAN             = new HugeNumber(Double.NaN, 0L);
    private static final BigDecimal  BIG_TWO         = BigDecimal.valueOf(2);
    private static final int         MAX_BIG_POWER   = 999_999_999;
    private static final MathContext CONTEXT         = MathContext.DECIMAL128;
    // exponents whose power of two is still a finite double, subnormals included
    private static final int         DOUBLE_EXPONENT = 1074;

    // after the constants: the epsilon below is normalized, and normalizing can return ONE
    public static final ScalarType<HugeNumber> TYPE = new ScalarType<>() {
        private final HugeNumber epsilon = HugeNumber.of(Tolerances.hugeEpsilon());

        @Override
        public HugeNumber convert(Scalar<?> value) {
            if (value instanceof HugeNumber h) {
                return h;
            }
            if (value instanceof DecimalScalar d && d.isFinite()) {
                return fromBigDecimal(d.toBigDecimal());
            }
            return HugeNumber.of(value.doubleValue());
        }

        @Override
        public HugeNumber epsilon() {
            return epsilon;
        }

        @Override
        public long maxBinaryExponent() {
            return Long.MAX_VALUE;
        }

        @Override
        public String name() {
            return "huge";
        }

        @Override
        public HugeNumber nan() {
            return NAN;
        }

        @Override
        public HugeNumber of(double value) {
            return HugeNumber.of(value);
        }

        @Override
        public HugeNumber of(long value) {
            return HugeNumber.of((double) value);
        }

        @Override
        public HugeNumber one() {
            return ONE;
        }

        @Override
        public HugeNumber parse(String text) {
            return HugeNumber.parse(text);
        }

        @Override
        public HugeNumber pi() {
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
        public HugeNumber zero() {
            return ZERO;
        }
    };

    private final double mantissa;
    private final long   exponent;

    private HugeNumber(double mantissa, long exponent) {
        this.mantissa = mantissa;
        this.exponent = exponent;
    }

    public static HugeNumber of(double value) {
        return normalize(value, 0L);
    }

    /**
     * @return {@code mantissa * 2^exponent}, normalized
     */
    public static HugeNumber of(double mantissa, long exponent) {
        return normalize(mantissa, exponent);
    }

    static HugeNumber fromBigDecimal(BigDecimal value) {
        if (value.signum() == 0) {
            return ZERO;
        }
        var asDouble = value.doubleValue();
        if (Double.isFinite(asDouble) && asDouble != 0.0 && Math.getExponent(asDouble) >= Double.MIN_EXPONENT) {
            return of(asDouble);
        }
        // binary exponent estimate from the decimal digits
        var estimate = (long) Math.floor(
        (value.precision() - value.scale() - 1) * DecimalScalar.LOG2_10);
        var scaled = value;
        var remaining = -estimate;
        while (remaining != 0) {
            var step = (int) Math.max(-MAX_BIG_POWER, Math.min(MAX_BIG_POWER, remaining));
            scaled = scaled.multiply(BIG_TWO.pow(step, CONTEXT), CONTEXT);
            remaining -= step;
        }
        return normalize(scaled.doubleValue(), estimate);
    }

    static HugeNumber parse(String text) {
        var trimmed = text.trim();
        var p = trimmed.indexOf('p');
        if (p < 0) {
            return of(Double.parseDouble(trimmed));
        }
        return of(Double.parseDouble(trimmed.substring(0, p)), Long.parseLong(trimmed.substring(p + 1)));
    }

    private static HugeNumber normalize(double mantissa, long exponent) {
        if (mantissa == 0.0) {
            return ZERO;
        }
        if (!Double.isFinite(mantissa)) {
            return new HugeNumber(mantissa, 0L);
        }
        var m = mantissa;
        var e = exponent;
        if (Math.getExponent(m) < Double.MIN_EXPONENT) {
            m = Math.scalb(m, 64);
            e -= 64;
        }
        var shift = Math.getExponent(m);
        m = Math.scalb(m, -shift);
        try {
            e = Math.addExact(e, shift);
        } catch (ArithmeticException overflow) {
            return e > 0 ? new HugeNumber(Math.copySign(Double.POSITIVE_INFINITY, m), 0L) : ZERO;
        }
        if (m == 1.0 && e == 0L) {
            return ONE;
        }
        return new HugeNumber(m, e);
    }

    private static long saturatingAdd(long a, long b) {
        var r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return a > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return r;
    }

    private static HugeNumber withExponent(double mantissa, long exponent) {
        if (exponent == Long.MAX_VALUE) {
            return new HugeNumber(Math.copySign(Double.POSITIVE_INFINITY, mantissa), 0L);
        }
        if (exponent == Long.MIN_VALUE) {
            return ZERO;
        }
        return normalize(mantissa, exponent);
    }

    @Override
    public HugeNumber abs() {
        return mantissa < 0 ? new HugeNumber(-mantissa, exponent) : this;
    }

    @Override
    public HugeNumber acos() {
        return of(Math.acos(doubleValue()));
    }

    @Override
    public HugeNumber add(HugeNumber other) {
        if (!isFinite() || !other.isFinite() || mantissa == 0.0 || other.mantissa == 0.0) {
            if (mantissa == 0.0) {
                return other;
            }
            if (other.mantissa == 0.0) {
                return this;
            }
            return of(mantissa + other.mantissa);
        }
        var larger = exponent >= other.exponent ? this : other;
        var smaller = larger == this ? other : this;
        var gap = larger.exponent - smaller.exponent;
        if (gap > 60) {
            return larger;
        }
        return normalize(larger.mantissa + Math.scalb(smaller.mantissa, (int) -gap), larger.exponent);
    }

    @Override
    public HugeNumber asin() {
        return of(Math.asin(doubleValue()));
    }

    @Override
    public HugeNumber atan() {
        return of(Math.atan(doubleValue()));
    }

    @Override
    public HugeNumber atan2(HugeNumber x) {
        if (!isFinite() || !x.isFinite() || mantissa == 0.0 || x.mantissa == 0.0) {
            return of(Math.atan2(doubleValue(), x.doubleValue()));
        }
        // only the ratio matters, so bring both into double range relative to the larger exponent
        var top = Math.max(exponent, x.exponent);
        var y = Math.scalb(mantissa, (int) Math.max(-2000, exponent - top));
        var xs = Math.scalb(x.mantissa, (int) Math.max(-2000, x.exponent - top));
        return of(Math.atan2(y, xs));
    }

    @Override
    public HugeNumber cbrt() {
        if (!isFinite() || mantissa == 0.0) {
            return this;
        }
        var third = Math.floorDiv(exponent, 3L);
        var rem = (int) Math.floorMod(exponent, 3L);
        return normalize(Math.cbrt(Math.scalb(mantissa, rem)), third);
    }

    @Override
    public int compareTo(HugeNumber o) {
        if (isNaN() || o.isNaN()) {
            return Boolean.compare(isNaN(), o.isNaN());
        }
        if (!isFinite() || !o.isFinite() || mantissa == 0.0 || o.mantissa == 0.0) {
            return Double.compare(mantissa, o.mantissa);
        }
        var sign = signum();
        if (sign != o.signum()) {
            return Integer.compare(sign, o.signum());
        }
        var magnitude = exponent != o.exponent ? Long.compare(exponent, o.exponent)
                                               : Double.compare(Math.abs(mantissa), Math.abs(o.mantissa));
        return sign * magnitude;
    }

    @Override
    public HugeNumber cos() {
        return of(Math.cos(doubleValue()));
    }

    @Override
    public HugeNumber divide(HugeNumber other) {
        if (!isFinite() || !other.isFinite() || mantissa == 0.0 || other.mantissa == 0.0) {
            return of(mantissa / other.mantissa);
        }
        return withExponent(mantissa / other.mantissa, saturatingAdd(exponent, -other.exponent));
    }

    @Override
    public double doubleValue() {
        if (!isFinite() || mantissa == 0.0) {
            return mantissa;
        }
        return Math.scalb(mantissa, (int) Math.max(-2000, Math.min(2000, exponent)));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof HugeNumber other)) {
            return false;
        }
        return Double.compare(mantissa, other.mantissa) == 0 && exponent == other.exponent;
    }

    @Override
    public HugeNumber exp() {
        if (isNaN()) {
            return this;
        }
        if (isFiniteDouble()) {
            var value = doubleValue();
            var direct = Math.exp(value);
            if (Double.isFinite(direct) && direct != 0.0) {
                return of(direct);
            }
        }
        // e^x = 2^(x log2 e)
        var power = doubleValue() / Math.log(2.0);
        return powerOfTwo(power);
    }

    @Override
    public HugeNumber floor() {
        if (!isFinite() || exponent >= 52) {
            return this;
        }
        return of(Math.floor(doubleValue()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(mantissa, exponent);
    }

    @Override
    public HugeNumber ieeeRemainder(HugeNumber divisor) {
        if (isFiniteDouble() && divisor.isFiniteDouble()) {
            return of(Math.IEEEremainder(doubleValue(), divisor.doubleValue()));
        }
        if (!isFinite() || !divisor.isFinite() || divisor.mantissa == 0.0) {
            return NAN;
        }
        var quotient = divide(divisor);
        if (quotient.exponent >= 52) {
            return ZERO;
        }
        var nearest = of(Math.rint(quotient.doubleValue()));
        return subtract(divisor.multiply(nearest));
    }

    @Override
    public boolean isInfinite() {
        return Double.isInfinite(mantissa);
    }

    @Override
    public boolean isNaN() {
        return Double.isNaN(mantissa);
    }

    @Override
    public HugeNumber log() {
        if (!isFinite() || mantissa <= 0.0) {
            return of(Math.log(mantissa));
        }
        return of(Math.log(mantissa) + exponent * Math.log(2.0));
    }

    /**
     * @return the binary exponent of a finite non-zero value
     */
    public long getExponent() {
        return exponent;
    }

    /**
     * @return the significand, in [1, 2) for finite non-zero values
     */
    public double getMantissa() {
        return mantissa;
    }

    @Override
    public HugeNumber multiply(HugeNumber other) {
        if (!isFinite() || !other.isFinite() || mantissa == 0.0 || other.mantissa == 0.0) {
            return of(mantissa * other.mantissa);
        }
        return withExponent(mantissa * other.mantissa, saturatingAdd(exponent, other.exponent));
    }

    @Override
    public HugeNumber negate() {
        if (mantissa == 0.0) {
            return this;
        }
        return new HugeNumber(-mantissa, exponent);
    }

    @Override
    public HugeNumber pow(HugeNumber y) {
        if (isFiniteDouble() && y.isFiniteDouble()) {
            var direct = Math.pow(doubleValue(), y.doubleValue());
            if (Double.isFinite(direct) && direct != 0.0 || Double.isNaN(direct)) {
                return of(direct);
            }
            if (direct == 0.0 && (mantissa == 0.0 || y.mantissa == 0.0)) {
                return of(direct);
            }
        }
        if (!isFinite() || !y.isFinite() || mantissa == 0.0) {
            return of(Math.pow(doubleValue(), y.doubleValue()));
        }
        var exponentValue = y.doubleValue();
        var integral = exponentValue == Math.rint(exponentValue);
        if (mantissa < 0 && !integral) {
            return NAN;
        }
        // |x|^y = 2^(y (log2 m + e))
        var log2 = Math.log(Math.abs(mantissa)) / Math.log(2.0) + exponent;
        var result = powerOfTwo(exponentValue * log2);
        var odd = integral && Math.abs(exponentValue) < 9.007199254740992E15 && ((long) exponentValue & 1L) == 1L;
        return mantissa < 0 && odd ? result.negate() : result;
    }

    @Override
    public int signum() {
        if (isNaN()) {
            return 0;
        }
        return (int) Math.signum(mantissa);
    }

    @Override
    public HugeNumber sin() {
        return of(Math.sin(doubleValue()));
    }

    @Override
    public HugeNumber sqrt() {
        if (!isFinite() || mantissa <= 0.0) {
            return of(Math.sqrt(mantissa));
        }
        var half = Math.floorDiv(exponent, 2L);
        var odd = Math.floorMod(exponent, 2L) == 1L;
        return normalize(Math.sqrt(odd ? mantissa * 2.0 : mantissa), half);
    }

    @Override
    public HugeNumber subtract(HugeNumber other) {
        return add(other.negate());
    }

    @Override
    public HugeNumber tan() {
        return of(Math.tan(doubleValue()));
    }

    /**
     * @throws ArithmeticException if the value is not finite or its exponent is beyond what BigDecimal can reach
     */
    @Override
    public BigDecimal toBigDecimal() {
        if (!isFinite()) {
            throw new ArithmeticException("No decimal form for " + mantissa);
        }
        if (mantissa == 0.0) {
            return BigDecimal.ZERO;
        }
        if (Math.abs(exponent) > MAX_BIG_POWER) {
            throw new ArithmeticException("Exponent out of decimal range: " + exponent);
        }
        return BigDecimal.valueOf(mantissa).multiply(BIG_TWO.pow((int) exponent, CONTEXT), CONTEXT);
    }

    @Override
    public String toString() {
        if (isFiniteDouble()) {
            return Double.toString(doubleValue());
        }
        return mantissa + "p" + exponent;
    }

    @Override
    public ScalarType<HugeNumber> type() {
        return TYPE;
    }

    private boolean isFiniteDouble() {
        if (!isFinite()) {
            return false;
        }
        return mantissa == 0.0 || exponent <= Double.MAX_EXPONENT && exponent >= -DOUBLE_EXPONENT + 52;
    }

    private HugeNumber powerOfTwo(double power) {
        if (Double.isNaN(power)) {
            return NAN;
        }
        if (power >= 9.2e18) {
            return of(Double.POSITIVE_INFINITY);
        }
        if (power <= -9.2e18) {
            return ZERO;
        }
        var whole = Math.floor(power);
        return normalize(Math.pow(2.0, power - whole), (long) whole);
    }
}
