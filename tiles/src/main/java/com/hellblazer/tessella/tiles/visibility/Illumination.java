/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Tessella.
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
package com.hellblazer.tessella.tiles.visibility;

/**
 * Combined light arriving at one coordinate.
 *
 * @param level brightness in [0, 1]
 * @param color color of the arriving light, already weighted by contribution
 * @author hal.hildebrand
 */
public record Illumination(double level, Rgb color) {
    public static final Illumination DARK = new Illumination(0.0, Rgb.BLACK);
}
