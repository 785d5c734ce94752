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
 * The numeric contract every spatial algorithm is written against. A scalar is an immutable value of an ordered field
 * that also supplies the elementary functions the geometry needs.
 * <p>
 * Implementations follow IEEE 754 conventions for indeterminate results: dividing by zero, taking the square root of a
 * negative number or the arc cosine of a value outside [-1, 1] yields NaN or an infinity rather than throwing.
 *
 * @param <S> the implementing type
 * @author hal.hildebrand
 */
public interface Scalar<S extends Scalar<S>> extends Comparable<S> {

    /**
     * @return the descriptor holding this representation's constants, factories and tolerance
     */
    ScalarType<S> type();

    S add(S other);

    S subtract(S other);

    S multiply(S other);

    S divide(S other);

    S negate();

    S abs();

    /**
     * @return -1, 0 or 1 according to the sign of this value; 0 for NaN
     */
    int signum();

    S sqrt();

    S cbrt();

    S pow(S exponent);

    S exp();

    /**
     * Natural logarithm
     */
    S log();

    S sin();

    S cos();

    S tan();

    S asin();

    S acos();

    S atan();

    /**
     * Angle of the point (x, this), in (-pi, pi]
     *
     * @param x the abscissa; this value is the ordinate
     */
    S atan2(S x);

    /**
     * IEEE 754 remainder: {@code this - divisor * n} where n is the integer nearest {@code this / divisor}
     */
    S ieeeRemainder(S divisor);

    S floor();

    boolean isNaN();

    boolean isInfinite();

    double doubleValue();

    /**
     * @throws ArithmeticException if the value is NaN, infinite, or outside the range a BigDecimal can practically hold
     */
    BigDecimal toBigDecimal();

    default S square() {
        return multiply(self());
    }

    default S cube() {
        return multiply(self()).multiply(self());
    }

    default S min(S other) {
        return compareTo(other) <= 0 ? self() : other;
    }

    default S max(S other) {
        return compareTo(other) >= 0 ? self() : other;
    }

    default boolean isZero() {
        return signum() == 0 && !isNaN();
    }

    default boolean isNegative() {
        return signum() < 0;
    }

    default boolean isPositive() {
        return signum() > 0;
    }

    default boolean isFinite() {
        return !isNaN() && !isInfinite();
    }

    /**
     * @return true if the magnitude of this value is within the representation's nearly-zero epsilon
     */
    default boolean isNearlyZero() {
        if (isNaN()) {
            return false;
        }
        return abs().compareTo(type().epsilon()) <= 0;
    }

    /**
     * Relative comparison: equal values, values whose difference is within epsilon times the larger magnitude, or two
     * values that are both nearly zero.
     */
    default boolean isNearlyEqualTo(S other) {
        if (isNaN() || other.isNaN()) {
            return false;
        }
        if (compareTo(other) == 0) {
            return true;
        }
        if (isInfinite() || other.isInfinite()) {
            return false;
        }
        if (isNearlyZero() && other.isNearlyZero()) {
            return true;
        }
        var magnitude = abs().max(other.abs());
        return subtract(other).abs().compareTo(type().epsilon().multiply(magnitude)) <= 0;
    }

    @SuppressWarnings("unchecked")
    private S self() {
        return (S) this;
    }
}
