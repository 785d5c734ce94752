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
import java.math.RoundingMode;

/**
 * Arbitrary precision decimal scalar, rounded to {@link MathContext#DECIMAL128} (34 significant digits).
 * <p>
 * {@link BigDecimal} has no NaN or infinity, so this type carries them as explicit states. Operations that would throw
 * in BigDecimal (division by zero, square root of a negative, logarithm of zero) produce those states instead, so the
 * generic algorithms see the same indeterminate-value behavior they get from the binary floating point types.
 *
 * @author hal.hildebrand
 */
public final class DecimalScalar implements Scalar<DecimalScalar> {

    public static final MathContext CONTEXT = MathContext.DECIMAL128;

    public static final ScalarType<DecimalScalar> TYPE = new ScalarType<>() {
        private final DecimalScalar epsilon = new DecimalScalar(new BigDecimal(Tolerances.decimalEpsilon()), 0.0);

        @Override
        public DecimalScalar convert(Scalar<?> value) {
            if (value instanceof DecimalScalar d) {
                return d;
            }
            if (!value.isFinite()) {
                return special(value.doubleValue());
            }
            return DecimalScalar.of(value.toBigDecimal());
        }

        @Override
        public DecimalScalar epsilon() {
            return epsilon;
        }

        @Override
        public long maxBinaryExponent() {
            // decimal exponent limit of a BigDecimal, in bits
            return (long) (Integer.MAX_VALUE * LOG2_10);
        }

        @Override
        public String name() {
            return "decimal";
        }

        @Override
        public DecimalScalar nan() {
            return NAN;
        }

        @Override
        public DecimalScalar of(double value) {
            return DecimalScalar.of(value);
        }

        @Override
        public DecimalScalar of(long value) {
            return DecimalScalar.of(BigDecimal.valueOf(value));
        }

        @Override
        public DecimalScalar one() {
            return ONE;
        }

        @Override
        public DecimalScalar parse(String text) {
            return DecimalScalar.parse(text);
        }

        @Override
        public DecimalScalar pi() {
            return PI;
        }

        @Override
        public int significandDigits() {
            return CONTEXT.getPrecision();
        }

        @Override
        public String toString() {
            return name();
        }

        @Override
        public DecimalScalar zero() {
            return ZERO;
        }
    };

    static final double LOG2_10 = 3.321928094887362;

    private static final DecimalScalar ZERO              = new DecimalScalar(BigDecimal.ZERO, 0.0);
    private static final DecimalScalar ONE               = new DecimalScalar(BigDecimal.ONE, 0.0);
    private static final DecimalScalar PI                = new DecimalScalar(BigDecimalMath.PI.round(CONTEXT), 0.0);
    private static final DecimalScalar HALF_PI           = new DecimalScalar(BigDecimalMath.HALF_PI.round(CONTEXT),
                                                                             0.0);
    private static final DecimalScalar NAN               = new DecimalScalar(null, Double.NaN);
    private static final DecimalScalar POSITIVE_INFINITY = new DecimalScalar(null, Double.POSITIVE_INFINITY);
    private static final DecimalScalar NEGATIVE_INFINITY = new DecimalScalar(null, Double.NEGATIVE_INFINITY);
    // beyond this exp() leaves the decimal exponent range
    private static final BigDecimal    EXP_LIMIT         = new BigDecimal("4.9e9");

    /** null when the value is NaN or infinite */
    private final BigDecimal value;
    private final double     special;

    private DecimalScalar(BigDecimal value, double special) {
        this.value = value;
        this.special = special;
    }

    public static DecimalScalar of(BigDecimal value) {
        if (value.signum() == 0) {
            return ZERO;
        }
        return new DecimalScalar(value.round(CONTEXT), 0.0);
    }

    public static DecimalScalar of(double value) {
        if (!Double.isFinite(value)) {
            return special(value);
        }
        return of(BigDecimal.valueOf(value));
    }

    public static DecimalScalar of(String value) {
        return parse(value);
    }

    static DecimalScalar parse(String text) {
        var trimmed = text.trim();
        switch (trimmed) {
            case "NaN":
                return NAN;
            case "Infinity":
            case "+Infinity":
                return POSITIVE_INFINITY;
            case "-Infinity":
                return NEGATIVE_INFINITY;
            default:
                return of(new BigDecimal(trimmed, CONTEXT));
        }
    }

    private static DecimalScalar special(double value) {
        if (Double.isNaN(value)) {
            return NAN;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? POSITIVE_INFINITY : NEGATIVE_INFINITY;
        }
        return of(value);
    }

    private static DecimalScalar signedInfinity(int sign) {
        return sign < 0 ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
    }

    @Override
    public DecimalScalar abs() {
        if (value == null) {
            return isNaN() ? NAN : POSITIVE_INFINITY;
        }
        return value.signum() < 0 ? new DecimalScalar(value.negate(), 0.0) : this;
    }

    @Override
    public DecimalScalar acos() {
        if (value == null || value.abs().compareTo(BigDecimal.ONE) > 0) {
            return NAN;
        }
        var root = BigDecimal.ONE.subtract(value.multiply(value, CONTEXT), CONTEXT).sqrt(CONTEXT);
        return of(BigDecimalMath.atan2(root, value, CONTEXT));
    }

    @Override
    public DecimalScalar add(DecimalScalar other) {
        if (value == null || other.value == null) {
            if (isNaN() || other.isNaN()) {
                return NAN;
            }
            if (value == null && other.value == null) {
                return special == other.special ? this : NAN;
            }
            return value == null ? this : other;
        }
        return of(value.add(other.value, CONTEXT));
    }

    @Override
    public DecimalScalar asin() {
        if (value == null || value.abs().compareTo(BigDecimal.ONE) > 0) {
            return NAN;
        }
        var root = BigDecimal.ONE.subtract(value.multiply(value, CONTEXT), CONTEXT).sqrt(CONTEXT);
        return of(BigDecimalMath.atan2(value, root, CONTEXT));
    }

    @Override
    public DecimalScalar atan() {
        if (value == null) {
            return isNaN() ? NAN : special > 0 ? HALF_PI : HALF_PI.negate();
        }
        return of(BigDecimalMath.atan(value, CONTEXT));
    }

    @Override
    public DecimalScalar atan2(DecimalScalar x) {
        if (value == null || x.value == null) {
            return special(Math.atan2(doubleValue(), x.doubleValue()));
        }
        return of(BigDecimalMath.atan2(value, x.value, CONTEXT));
    }

    @Override
    public DecimalScalar cbrt() {
        if (value == null) {
            return this;
        }
        return of(BigDecimalMath.cbrt(value, CONTEXT));
    }

    @Override
    public int compareTo(DecimalScalar o) {
        var rank = Integer.compare(rank(), o.rank());
        if (rank != 0) {
            return rank;
        }
        if (value == null) {
            return 0;
        }
        return value.compareTo(o.value);
    }

    @Override
    public DecimalScalar cos() {
        if (value == null) {
            return NAN;
        }
        return of(BigDecimalMath.cos(value, CONTEXT));
    }

    @Override
    public DecimalScalar divide(DecimalScalar other) {
        if (isNaN() || other.isNaN()) {
            return NAN;
        }
        if (value == null) {
            return other.value == null ? NAN : signedInfinity(signum() * nonZeroSign(other));
        }
        if (other.value == null) {
            return ZERO;
        }
        if (other.value.signum() == 0) {
            return value.signum() == 0 ? NAN : signedInfinity(value.signum());
        }
        return of(value.divide(other.value, CONTEXT));
    }

    @Override
    public double doubleValue() {
        return value == null ? special : value.doubleValue();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof DecimalScalar other && compareTo(other) == 0;
    }

    @Override
    public DecimalScalar exp() {
        if (value == null) {
            return isNaN() ? NAN : special > 0 ? POSITIVE_INFINITY : ZERO;
        }
        if (value.compareTo(EXP_LIMIT) > 0) {
            return POSITIVE_INFINITY;
        }
        if (value.compareTo(EXP_LIMIT.negate()) < 0) {
            return ZERO;
        }
        return of(BigDecimalMath.exp(value, CONTEXT));
    }

    @Override
    public DecimalScalar floor() {
        if (value == null) {
            return this;
        }
        return of(value.setScale(0, RoundingMode.FLOOR));
    }

    @Override
    public int hashCode() {
        if (value == null) {
            return Double.hashCode(special);
        }
        return value.stripTrailingZeros().hashCode();
    }

    @Override
    public DecimalScalar ieeeRemainder(DecimalScalar divisor) {
        if (value == null || divisor.value == null || divisor.value.signum() == 0) {
            return special(Math.IEEEremainder(doubleValue(), divisor.doubleValue()));
        }
        return of(BigDecimalMath.ieeeRemainder(value, divisor.value, CONTEXT));
    }

    @Override
    public boolean isInfinite() {
        return value == null && Double.isInfinite(special);
    }

    @Override
    public boolean isNaN() {
        return value == null && Double.isNaN(special);
    }

    @Override
    public DecimalScalar log() {
        if (value == null) {
            return isNaN() || special < 0 ? NAN : POSITIVE_INFINITY;
        }
        if (value.signum() < 0) {
            return NAN;
        }
        if (value.signum() == 0) {
            return NEGATIVE_INFINITY;
        }
        return of(BigDecimalMath.log(value, CONTEXT));
    }

    @Override
    public DecimalScalar multiply(DecimalScalar other) {
        if (isNaN() || other.isNaN()) {
            return NAN;
        }
        if (value == null || other.value == null) {
            if (signum() == 0 || other.signum() == 0) {
                return NAN;
            }
            return signedInfinity(signum() * other.signum());
        }
        return of(value.multiply(other.value, CONTEXT));
    }

    @Override
    public DecimalScalar negate() {
        if (value == null) {
            return isNaN() ? NAN : signedInfinity(-signum());
        }
        return value.signum() == 0 ? this : new DecimalScalar(value.negate(), 0.0);
    }

    @Override
    public DecimalScalar pow(DecimalScalar exponent) {
        if (value == null || exponent.value == null) {
            return special(Math.pow(doubleValue(), exponent.doubleValue()));
        }
        if (exponent.value.signum() == 0) {
            return ONE;
        }
        if (value.signum() == 0) {
            return exponent.value.signum() > 0 ? ZERO : POSITIVE_INFINITY;
        }
        if (value.signum() < 0 && !BigDecimalMath.isInteger(exponent.value)) {
            return NAN;
        }
        try {
            if (value.signum() > 0 && !BigDecimalMath.isInteger(exponent.value)) {
                var power = exponent.multiply(log());
                return power.exp();
            }
            return of(BigDecimalMath.pow(value, exponent.value, CONTEXT));
        } catch (ArithmeticException e) {
            // result outside the decimal exponent range
            return special(Math.pow(doubleValue(), exponent.doubleValue()));
        }
    }

    @Override
    public int signum() {
        if (value == null) {
            return isNaN() ? 0 : (int) Math.signum(special);
        }
        return value.signum();
    }

    @Override
    public DecimalScalar sin() {
        if (value == null) {
            return NAN;
        }
        return of(BigDecimalMath.sin(value, CONTEXT));
    }

    @Override
    public DecimalScalar sqrt() {
        if (value == null) {
            return isNaN() || special < 0 ? NAN : this;
        }
        if (value.signum() < 0) {
            return NAN;
        }
        return of(value.sqrt(CONTEXT));
    }

    @Override
    public DecimalScalar subtract(DecimalScalar other) {
        return add(other.negate());
    }

    @Override
    public DecimalScalar tan() {
        if (value == null) {
            return NAN;
        }
        var cos = BigDecimalMath.cos(value, CONTEXT);
        if (cos.signum() == 0) {
            return signedInfinity(BigDecimalMath.sin(value, CONTEXT).signum());
        }
        return of(BigDecimalMath.sin(value, CONTEXT).divide(cos, CONTEXT));
    }

    @Override
    public BigDecimal toBigDecimal() {
        if (value == null) {
            throw new ArithmeticException("No decimal form for " + special);
        }
        return value;
    }

    @Override
    public String toString() {
        return value == null ? Double.toString(special) : value.toString();
    }

    @Override
    public ScalarType<DecimalScalar> type() {
        return TYPE;
    }

    private int nonZeroSign(DecimalScalar other) {
        var sign = other.signum();
        return sign == 0 ? 1 : sign;
    }

    private int rank() {
        if (value != null) {
            return 1;
        }
        if (Double.isNaN(special)) {
            return 3;
        }
        return special > 0 ? 2 : 0;
    }
}
