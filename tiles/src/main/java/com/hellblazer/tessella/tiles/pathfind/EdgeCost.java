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
package com.hellblazer.tessella.tiles.pathfind;

import java.util.function.ToIntFunction;

/**
 * Cost of a single step between adjacent coordinates. Costs must be positive and never below the minimum step cost
 * declared by the query, otherwise the search heuristic would overestimate.
 *
 * @param <C> coordinate type
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface EdgeCost<C> {

    /**
     * Each step costs the terrain cost of the tile being entered.
     */
    static <C> EdgeCost<C> entering(ToIntFunction<? super C> terrain) {
        return (from, to) -> terrain.applyAsInt(to);
    }

    static <C> EdgeCost<C> uniform() {
        return (from, to) -> 1;
    }

    static <C> EdgeCost<C> uniform(int cost) {
        return (from, to) -> cost;
    }

    int cost(C from, C to);
}
