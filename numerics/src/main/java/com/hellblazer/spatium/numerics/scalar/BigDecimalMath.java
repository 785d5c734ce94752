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
 * Elementary functions over finite {@link BigDecimal} arguments. Series are summed in a working context ten digits wider
 * than the target and rounded once at the end. Callers handle domain errors; every argument here is in range.
 *
 * @author hal.hildebrand
 */
final class BigDecimalMath {

    static final BigDecimal PI      = new BigDecimal(
    "3.14159265358979323846264338327950288419716939937510582097494459230781640628620899");
    static final BigDecimal LN2     = new BigDecimal(
    "0.69314718055994530941723212145817656807550013436025525412068000949339362196969471");
    static final BigDecimal LN10    = new BigDecimal(
    "2.30258509299404568401799145468436420760110148862877297603332790096757260967735248");
    static final BigDecimal TWO     = BigDecimal.valueOf(2);
    static final BigDecimal THREE   = BigDecimal.valueOf(3);
    static final BigDecimal HALF_PI = PI.divide(TWO);
    static final BigDecimal TAU     = PI.multiply(TWO);

    private static final int MAX_TERMS = 2000;

    private BigDecimalMath() {
    }

    static BigDecimal atan(BigDecimal x, MathContext mc) {
        var work = widen(mc);
        if (x.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (x.signum() < 0) {
            return atan(x.negate(), mc).negate();
        }
        if (x.compareTo(BigDecimal.ONE) > 0) {
            return HALF_PI.subtract(atan(BigDecimal.ONE.divide(x, work), work), work).round(mc);
        }
        // atan(x) = 2 atan(x / (1 + sqrt(1 + x^2)))
        var doublings = 0;
        var tenth = new BigDecimal("0.1");
        var y = x;
        while (y.compareTo(tenth) > 0) {
            var root = BigDecimal.ONE.add(y.multiply(y, work), work).sqrt(work);
            y = y.divide(BigDecimal.ONE.add(root, work), work);
            doublings++;
        }
        var y2 = y.multiply(y, work);
        var power = y;
        var sum = y;
        var threshold = threshold(sum, work);
        for (var k = 1; k < MAX_TERMS; k++) {
            power = power.multiply(y2, work).negate();
            var term = power.divide(BigDecimal.valueOf(2L * k + 1), work);
            sum = sum.add(term, work);
            if (term.abs().compareTo(threshold) < 0) {
                break;
            }
        }
        return sum.multiply(TWO.pow(doublings), work).round(mc);
    }

    static BigDecimal atan2(BigDecimal y, BigDecimal x, MathContext mc) {
        var work = widen(mc);
        if (x.signum() == 0) {
            if (y.signum() == 0) {
                return BigDecimal.ZERO;
            }
            return y.signum() > 0 ? HALF_PI.round(mc) : HALF_PI.negate().round(mc);
        }
        var base = atan(y.divide(x, work), work);
        if (x.signum() > 0) {
            return base.round(mc);
        }
        return y.signum() >= 0 ? base.add(PI, work).round(mc) : base.subtract(PI, work).round(mc);
    }

    static BigDecimal cbrt(BigDecimal x, MathContext mc) {
        if (x.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (x.signum() < 0) {
            return cbrt(x.negate(), mc).negate();
        }
        var work = widen(mc);
        var y = exp(log(x, work).divide(THREE, work), work);
        // Newton: y <- y - (y^3 - x) / (3 y^2)
        for (var i = 0; i < 3; i++) {
            var y2 = y.multiply(y, work);
            y = y.subtract(y2.multiply(y, work).subtract(x, work).divide(THREE.multiply(y2, work), work), work);
        }
        return y.round(mc);
    }

    static BigDecimal cos(BigDecimal x, MathContext mc) {
        var work = widen(mc);
        return sin(HALF_PI.subtract(reduce(x, work), work), mc);
    }

    /**
     * @throws ArithmeticException if the result exceeds the decimal exponent range
     */
    static BigDecimal exp(BigDecimal x, MathContext mc) {
        if (x.signum() == 0) {
            return BigDecimal.ONE;
        }
        var work = widen(mc);
        if (x.signum() < 0) {
            return BigDecimal.ONE.divide(exp(x.negate(), work), work).round(mc);
        }
        var halvings = 0;
        var half = new BigDecimal("0.5");
        var y = x;
        while (y.compareTo(half) > 0) {
            y = y.divide(TWO, work);
            halvings++;
        }
        var term = BigDecimal.ONE;
        var sum = BigDecimal.ONE;
        var threshold = threshold(sum, work);
        for (var k = 1; k < MAX_TERMS; k++) {
            term = term.multiply(y, work).divide(BigDecimal.valueOf(k), work);
            sum = sum.add(term, work);
            if (term.compareTo(threshold) < 0) {
                break;
            }
        }
        for (var i = 0; i < halvings; i++) {
            sum = sum.multiply(sum, work);
        }
        return sum.round(mc);
    }

    /**
     * Remainder of x after subtracting the multiple of the divisor nearest x / divisor, ties to even
     */
    static BigDecimal ieeeRemainder(BigDecimal x, BigDecimal divisor, MathContext mc) {
        var work = widen(mc);
        var quotient = x.divide(divisor, work).setScale(0, RoundingMode.HALF_EVEN);
        return x.subtract(divisor.multiply(quotient, work), work).round(mc);
    }

    /**
     * Natural logarithm of a positive value
     */
    static BigDecimal log(BigDecimal x, MathContext mc) {
        var work = widen(mc);
        if (x.compareTo(BigDecimal.ONE) == 0) {
            return BigDecimal.ZERO;
        }
        // x = m * 10^k, 1 <= m < 10
        var k = x.precision() - x.scale() - 1;
        var m = x.movePointLeft(k);
        // ln(m) = 16 ln(m^(1/16)), then ln(r) = 2 atanh((r - 1) / (r + 1))
        var r = m;
        for (var i = 0; i < 4; i++) {
            r = r.sqrt(work);
        }
        var z = r.subtract(BigDecimal.ONE, work).divide(r.add(BigDecimal.ONE, work), work);
        var z2 = z.multiply(z, work);
        var power = z;
        var sum = z;
        if (z.signum() != 0) {
            var threshold = threshold(sum, work);
            for (var n = 1; n < MAX_TERMS; n++) {
                power = power.multiply(z2, work);
                var term = power.divide(BigDecimal.valueOf(2L * n + 1), work);
                sum = sum.add(term, work);
                if (term.abs().compareTo(threshold) < 0) {
                    break;
                }
            }
        }
        var lnM = sum.multiply(BigDecimal.valueOf(32), work);
        return lnM.add(LN10.multiply(BigDecimal.valueOf(k), work), work).round(mc);
    }

    static BigDecimal pow(BigDecimal x, BigDecimal y, MathContext mc) {
        var work = widen(mc);
        if (isInteger(y) && y.abs().compareTo(BigDecimal.valueOf(999_999_999)) <= 0) {
            return x.pow(y.intValueExact(), work).round(mc);
        }
        if (x.signum() < 0) {
            throw new ArithmeticException("Fractional power of a negative value");
        }
        return exp(y.multiply(log(x, work), work), mc);
    }

    static BigDecimal sin(BigDecimal x, MathContext mc) {
        var work = widen(mc);
        var r = reduce(x, work);
        if (r.compareTo(HALF_PI) > 0) {
            r = PI.subtract(r, work);
        } else if (r.compareTo(HALF_PI.negate()) < 0) {
            r = PI.negate().subtract(r, work);
        }
        if (r.signum() == 0) {
            return BigDecimal.ZERO;
        }
        var r2 = r.multiply(r, work);
        var term = r;
        var sum = r;
        var threshold = threshold(sum, work);
        for (var k = 1; k < MAX_TERMS; k++) {
            term = term.multiply(r2, work).negate().divide(BigDecimal.valueOf((2L * k) * (2L * k + 1)), work);
            sum = sum.add(term, work);
            if (term.abs().compareTo(threshold) < 0) {
                break;
            }
        }
        return sum.round(mc);
    }

    static BigDecimal tan(BigDecimal x, MathContext mc) {
        var work = widen(mc);
        return sin(x, work).divide(cos(x, work), work).round(mc);
    }

    static boolean isInteger(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    /**
     * Reduce an angle to [-pi, pi]
     */
    private static BigDecimal reduce(BigDecimal x, MathContext work) {
        if (x.abs().compareTo(PI) <= 0) {
            return x;
        }
        var turns = x.divide(TAU, work).setScale(0, RoundingMode.HALF_EVEN);
        return x.subtract(TAU.multiply(turns, work), work);
    }

    private static BigDecimal threshold(BigDecimal reference, MathContext work) {
        var magnitude = reference.signum() == 0 ? BigDecimal.ONE : reference.abs();
        return magnitude.movePointLeft(work.getPrecision() + 2);
    }

    private static MathContext widen(MathContext mc) {
        return new MathContext(mc.getPrecision() + 10, RoundingMode.HALF_EVEN);
    }
}
