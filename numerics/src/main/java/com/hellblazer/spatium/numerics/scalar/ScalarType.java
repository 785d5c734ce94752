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

/**
 * Describes a scalar representation: its named constants, factories, tolerance and precision. Generic algorithms obtain
 * every constant they need from here, so a representation that cannot supply one (pi for an integer type, say) simply
 * cannot implement this interface.
 *
 * @param <S> the scalar type described
 * @author hal.hildebrand
 */
public interface ScalarType<S extends Scalar<S>> {

    String name();

    S zero();

    S one();

    S pi();

    /**
     * @return the magnitude at or below which a value is treated as zero
     */
    S epsilon();

    S nan();

    S of(double value);

    S of(long value);

    /**
     * Parse the canonical decimal text of a value, including "NaN", "Infinity" and "-Infinity"
     */
    S parse(String text);

    /**
     * @return decimal digits carried by the significand
     */
    int significandDigits();

    /**
     * @return the largest binary exponent a finite value can have
     */
    long maxBinaryExponent();

    /**
     * Convert a value of any representation into this one, rounding as needed
     *
     * @throws ArithmeticException if the value cannot be brought into this representation's range
     */
    S convert(Scalar<?> value);

    default S two() {
        return of(2L);
    }

    default S half() {
        return one().divide(two());
    }

    default S tau() {
        return pi().multiply(two());
    }

    default S halfPi() {
        return pi().divide(two());
    }

    default S negativeOne() {
        return one().negate();
    }

    /**
     * Widening test: true if every value of {@code source} is representable here without loss of precision or range.
     */
    default boolean canRepresent(ScalarType<?> source) {
        return significandDigits() >= source.significandDigits() && maxBinaryExponent() >= source.maxBinaryExponent();
    }
}
