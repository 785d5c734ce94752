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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nearly-zero epsilons for each scalar representation, resolved once at class load time.
 * <p>
 * Each default can be overridden with a system property:
 * <ul>
 *   <li><code>-Dspatium.epsilon.single=1e-6</code></li>
 *   <li><code>-Dspatium.epsilon.double=1e-15</code></li>
 *   <li><code>-Dspatium.epsilon.decimal=1e-15</code></li>
 *   <li><code>-Dspatium.epsilon.huge=1e-15</code></li>
 * </ul>
 * Values that do not parse as a positive finite number are ignored with a warning.
 *
 * @author hal.hildebrand
 */
public final class Tolerances {
    public static final String SINGLE_PROPERTY  = "spatium.epsilon.single";
    public static final String DOUBLE_PROPERTY  = "spatium.epsilon.double";
    public static final String DECIMAL_PROPERTY = "spatium.epsilon.decimal";
    public static final String HUGE_PROPERTY    = "spatium.epsilon.huge";

    static final double DEFAULT_SINGLE  = 1e-6;
    static final double DEFAULT_DOUBLE  = 1e-15;
    static final String DEFAULT_DECIMAL = "1e-15";
    static final double DEFAULT_HUGE    = 1e-15;

    private static final Logger log = LoggerFactory.getLogger(Tolerances.class);

    private static final float  SINGLE;
    private static final double DOUBLE;
    private static final String DECIMAL;
    private static final double HUGE;

    static {
        SINGLE = (float) resolve(SINGLE_PROPERTY, DEFAULT_SINGLE);
        DOUBLE = resolve(DOUBLE_PROPERTY, DEFAULT_DOUBLE);
        DECIMAL = resolveText(DECIMAL_PROPERTY, DEFAULT_DECIMAL);
        HUGE = resolve(HUGE_PROPERTY, DEFAULT_HUGE);
        log.info("Scalar tolerances: single={}, double={}, decimal={}, huge={}", SINGLE, DOUBLE, DECIMAL, HUGE);
    }

    private Tolerances() {
    }

    public static String decimalEpsilon() {
        return DECIMAL;
    }

    public static double doubleEpsilon() {
        return DOUBLE;
    }

    public static double hugeEpsilon() {
        return HUGE;
    }

    public static float singleEpsilon() {
        return SINGLE;
    }

    static Double parsePositive(String text) {
        if (text == null) {
            return null;
        }
        try {
            var value = Double.parseDouble(text.trim());
            if (!Double.isFinite(value) || value <= 0.0) {
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double resolve(String property, double defaultValue) {
        var text = System.getProperty(property);
        if (text == null) {
            return defaultValue;
        }
        var parsed = parsePositive(text);
        if (parsed == null) {
            log.warn("Ignoring {}={}: epsilon must be a positive finite number, using {}", property, text,
                     defaultValue);
            return defaultValue;
        }
        log.debug("Epsilon override {}={}", property, parsed);
        return parsed;
    }

    private static String resolveText(String property, String defaultValue) {
        var text = System.getProperty(property);
        if (text == null) {
            return defaultValue;
        }
        if (parsePositive(text) == null) {
            log.warn("Ignoring {}={}: epsilon must be a positive finite number, using {}", property, text,
                     defaultValue);
            return defaultValue;
        }
        log.debug("Epsilon override {}={}", property, text.trim());
        return text.trim();
    }
}
