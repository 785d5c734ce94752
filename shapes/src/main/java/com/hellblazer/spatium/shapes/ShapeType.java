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
 * Stable integer tags identifying each kind of {@link Shape}. The values are part of the canonical layout and must
 * never be renumbered.
 *
 * @author hal.hildebrand
 */
public enum ShapeType {
    NONE(0), CAPSULE(1), CONE(2), CUBOID(3), CYLINDER(4), ELLIPSOID(5), FRUSTUM(6), HOLLOW_SPHERE(7), LINE(8),
    SINGLE_POINT(9), SPHERE(10), TORUS(11);

    private static final ShapeType[] BY_VALUE = new ShapeType[12];

    static {
        for (var type : values()) {
            BY_VALUE[type.value] = type;
        }
    }

    private final int value;

    ShapeType(int value) {
        this.value = value;
    }

    public static ShapeType fromValue(int value) {
        if (value < 0 || value >= BY_VALUE.length) {
            throw new IllegalArgumentException("Unknown shape type: " + value);
        }
        return BY_VALUE[value];
    }

    public int getValue() {
        return value;
    }
}
