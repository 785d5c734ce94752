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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The numeric contract, exercised identically over every representation
 *
 * @author hal.hildebrand
 */
public class ScalarContractTest {

    private static final double TOLERANCE = 1e-5;

    static Stream<ScalarType<?>> types() {
        return Stream.of(SingleScalar.TYPE, DoubleScalar.TYPE, DecimalScalar.TYPE, HugeNumber.TYPE);
    }

    private static <S extends Scalar<S>> void assertClose(double expected, S actual, String message) {
        assertEquals(expected, actual.doubleValue(), TOLERANCE * Math.max(1.0, Math.abs(expected)),
                     message + " (" + actual.type().name() + ")");
    }

    @ParameterizedTest
    @MethodSource("types")
    public void testConstants(ScalarType<?> type) {
        checkConstants(type);
    }

    @ParameterizedTest
    @MethodSource("types")
    public void testElementaryFunctions(ScalarType<?> type) {
        checkElementaryFunctions(type);
    }

    @ParameterizedTest
    @MethodSource("types")
    public void testFieldArithmetic(ScalarType<?> type) {
        checkFieldArithmetic(type);
    }

    @ParameterizedTest
    @MethodSource("types")
    public void testNaN(ScalarType<?> type) {
        checkNaN(type);
    }

    @ParameterizedTest
    @MethodSource("types")
    public void testRounding(ScalarType<?> type) {
        checkRounding(type);
    }

    @ParameterizedTest
    @MethodSource("types")
    public void testTolerance(ScalarType<?> type) {
        checkTolerance(type);
    }

    private <S extends Scalar<S>> void checkConstants(ScalarType<S> type) {
        assertTrue(type.zero().isZero(), "zero");
        assertEquals(0, type.one().compareTo(type.of(1L)), "one");
        assertEquals(0, type.two().compareTo(type.of(2L)), "two");
        assertClose(0.5, type.half(), "half");
        assertClose(Math.PI, type.pi(), "pi");
        assertClose(2 * Math.PI, type.tau(), "tau");
        assertClose(Math.PI / 2, type.halfPi(), "half pi");
        assertEquals(-1, type.negativeOne().signum(), "negative one");
        assertTrue(type.epsilon().isPositive(), "epsilon positive");
        assertEquals(0, type.parse("2.5").compareTo(type.of(2.5)), "parse");
    }

    private <S extends Scalar<S>> void checkElementaryFunctions(ScalarType<S> type) {
        assertClose(4.0, type.of(16L).sqrt(), "sqrt");
        assertClose(3.0, type.of(27L).cbrt(), "cbrt");
        assertClose(-2.0, type.of(-8L).cbrt(), "cbrt of negative");
        assertClose(1024.0, type.two().pow(type.of(10L)), "pow");
        assertClose(5.0, type.of(5L).log().exp(), "exp of log");
        assertClose(Math.E, type.one().exp(), "exp");
        assertClose(1.0, type.halfPi().sin(), "sin");
        assertClose(-1.0, type.pi().cos(), "cos");
        assertClose(1.0, type.pi().multiply(type.of(0.25)).tan(), "tan");
        assertClose(Math.PI / 6, type.half().asin(), "asin");
        assertClose(Math.PI / 3, type.half().acos(), "acos");
        assertClose(Math.PI / 4, type.one().atan(), "atan");
        assertClose(3 * Math.PI / 4, type.one().atan2(type.negativeOne()), "atan2 second quadrant");
        assertClose(-Math.PI / 2, type.negativeOne().atan2(type.zero()), "atan2 on the axis");
    }

    private <S extends Scalar<S>> void checkFieldArithmetic(ScalarType<S> type) {
        var two = type.of(2L);
        var three = type.of(3L);
        assertEquals(0, two.add(three).compareTo(type.of(5L)), "add");
        assertEquals(0, two.subtract(three).compareTo(type.of(-1L)), "subtract");
        assertEquals(0, two.multiply(three).compareTo(type.of(6L)), "multiply");
        assertClose(2.0 / 3.0, two.divide(three), "divide");
        assertEquals(0, two.negate().abs().compareTo(two), "negate and abs");
        assertEquals(-1, two.negate().signum(), "signum");
        assertEquals(0, two.square().compareTo(type.of(4L)), "square");
        assertEquals(0, two.cube().compareTo(type.of(8L)), "cube");
        assertEquals(0, two.min(three).compareTo(two), "min");
        assertEquals(0, two.max(three).compareTo(three), "max");
        assertTrue(two.compareTo(three) < 0, "ordering");
        assertTrue(two.isPositive() && two.negate().isNegative(), "sign predicates");
    }

    private <S extends Scalar<S>> void checkNaN(ScalarType<S> type) {
        var nan = type.nan();
        assertTrue(nan.isNaN(), "nan");
        assertFalse(nan.isFinite(), "nan is not finite");
        assertFalse(nan.isNearlyZero(), "nan is never nearly zero");
        assertFalse(nan.isNearlyEqualTo(nan), "nan is never nearly equal");
        assertTrue(type.zero().divide(type.zero()).isNaN(), "zero over zero");
        assertThrows(ArithmeticException.class, nan::toBigDecimal, "nan has no decimal form");
    }

    private <S extends Scalar<S>> void checkRounding(ScalarType<S> type) {
        assertEquals(0, type.of(-1.5).floor().compareTo(type.of(-2L)), "floor");
        assertEquals(0, type.of(7L).ieeeRemainder(type.of(4L)).compareTo(type.of(-1L)), "remainder rounds up");
        assertEquals(0, type.of(5L).ieeeRemainder(type.of(4L)).compareTo(type.one()), "remainder rounds down");
        assertClose(0.5, type.of(0.5).add(type.tau().multiply(type.of(3L))).ieeeRemainder(type.tau()),
                    "angle reduction");
    }

    private <S extends Scalar<S>> void checkTolerance(ScalarType<S> type) {
        var one = type.one();
        var halfEpsilon = type.epsilon().multiply(type.half());
        assertTrue(halfEpsilon.isNearlyZero(), "half epsilon is nearly zero");
        assertTrue(type.epsilon().isNearlyZero(), "epsilon itself is nearly zero");
        assertFalse(one.isNearlyZero(), "one is not nearly zero");
        assertTrue(one.isNearlyEqualTo(one.add(halfEpsilon)), "within relative epsilon");
        assertFalse(one.isNearlyEqualTo(type.of(1.1)), "outside relative epsilon");
        assertTrue(halfEpsilon.isNearlyEqualTo(halfEpsilon.negate()), "both nearly zero");

        var large = type.of(1.0e6);
        var nudged = large.add(large.multiply(halfEpsilon));
        assertTrue(large.isNearlyEqualTo(nudged), "epsilon scales with magnitude");
    }
}
