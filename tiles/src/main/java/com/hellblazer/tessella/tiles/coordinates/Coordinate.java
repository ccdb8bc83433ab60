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
package com.hellblazer.tessella.tiles.coordinates;

import com.hellblazer.tessella.geometry.Pixel;

import java.util.List;

/**
 * An immutable lattice position tagged with its {@link CoordinateSystem}. Arithmetic is closed: adding, subtracting
 * or scaling coordinates of one system yields a coordinate of the same system, and mixing systems of the same
 * coordinate type raises {@link com.hellblazer.tessella.tiles.TopologyMismatchException}. Mixing coordinate types is
 * rejected by the type parameter.
 * <p>
 * All algorithms of the engine are written once against this interface.
 *
 * @param <C> the concrete coordinate type
 * @author hal.hildebrand
 */
public interface Coordinate<C extends Coordinate<C>> {

    C add(C other);

    /**
     * Lattice distance in steps, under the metric of the coordinate system. Symmetric, and zero only for equal
     * coordinates.
     */
    int distance(C other);

    default boolean isNeighbor(C other) {
        return neighbors().contains(other);
    }

    /**
     * The adjacent coordinates in the stable order defined by the coordinate system. Algorithms break ties by this
     * order, so it is part of the contract.
     */
    List<C> neighbors();

    C scale(int factor);

    C subtract(C other);

    CoordinateSystem<C> system();

    /**
     * @return the world space center of this tile
     */
    Pixel toPixel(double tileSize);
}
