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
package com.hellblazer.tessella.tiles;

import com.hellblazer.tessella.tiles.coordinates.Coordinate;
import com.hellblazer.tessella.tiles.grid.ReadableGrid;
import com.hellblazer.tessella.tiles.pathfind.EdgeCost;

import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Read-only view of the world the engine computes over: which coordinates block movement or sight and what entering
 * them costs. Implemented by the caller's world or entity store; the engine never mutates it.
 *
 * @param <C> coordinate type
 * @author hal.hildebrand
 */
public interface WorldQuery<C extends Coordinate<C>> {

    /**
     * A world backed by grid values. Coordinates outside the grid, or without a value, block and cost 1.
     */
    static <C extends Coordinate<C>, T> WorldQuery<C> fromGrid(ReadableGrid<C, T> grid, Predicate<? super T> blocking,
                                                               ToIntFunction<? super T> terrainCost) {
        return new WorldQuery<>() {
            @Override
            public boolean isBlocking(C coordinate) {
                return grid.find(coordinate).map(blocking::test).orElse(true);
            }

            @Override
            public int terrainCost(C coordinate) {
                return grid.find(coordinate).map(terrainCost::applyAsInt).orElse(1);
            }
        };
    }

    default Predicate<C> accessible() {
        return c -> !isBlocking(c);
    }

    /**
     * Whether the coordinate is opaque. Defaults to movement blocking.
     */
    default boolean blocksSight(C coordinate) {
        return isBlocking(coordinate);
    }

    boolean isBlocking(C coordinate);

    /**
     * Step cost of entering a coordinate.
     */
    default EdgeCost<C> movementCost() {
        return EdgeCost.entering(this::terrainCost);
    }

    /**
     * Cost of entering the coordinate; must be positive for accessible coordinates.
     */
    int terrainCost(C coordinate);
}
