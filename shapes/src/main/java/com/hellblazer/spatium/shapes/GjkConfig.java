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
package com.hellblazer.spatium.shapes;

/**
 * Configuration of the GJK intersection query.
 * <p>
 * Immutable; the {@code with} methods return modified copies.
 *
 * @author hal.hildebrand
 */
public final class GjkConfig {

    /** Default cap on simplex refinement steps */
    public static final int DEFAULT_MAX_ITERATIONS = 64;

    private static final GjkConfig DEFAULT = new GjkConfig(DEFAULT_MAX_ITERATIONS);

    private final int maxIterations;

    /**
     * @param maxIterations the cap on simplex refinement steps before the query gives up
     * @throws IllegalArgumentException if {@code maxIterations} is not positive
     */
    public GjkConfig(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public static GjkConfig defaultConfig() {
        return DEFAULT;
    }

    public int maxIterations() {
        return maxIterations;
    }

    @Override
    public String toString() {
        return "GjkConfig{maxIterations=" + maxIterations + "}";
    }

    public GjkConfig withMaxIterations(int newMaxIterations) {
        return new GjkConfig(newMaxIterations);
    }
}
