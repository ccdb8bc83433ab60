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
 * What is known about one visible coordinate.
 *
 * @param distance    lattice distance from the origin
 * @param blocksSight whether the coordinate is itself opaque; opaque coordinates are visible but hide what lies beyond
 * @param lightLevel  linear falloff from 1 at the origin to 0 at the radius
 * @author hal.hildebrand
 */
public record VisibilityState(int distance, boolean blocksSight, double lightLevel) {
}
