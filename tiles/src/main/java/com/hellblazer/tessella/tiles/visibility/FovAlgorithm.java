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
 * Field-of-view strategies, selectable per call.
 *
 * @author hal.hildebrand
 */
public enum FovAlgorithm {
    /**
     * Flood outward from the origin, stopping at blockers. Answers what is reachable within the radius rather than
     * what is in sight.
     */
    FLOOD_FILL,
    /** Trace a line to every coordinate in range. Slower, simple, and the reference for the others. */
    RAY_MARCHING,
    /**
     * Octant shadowcasting on square and isometric lattices, angular shadowcasting by ring on hexagonal and
     * triangular lattices.
     */
    SHADOWCASTING;
}
