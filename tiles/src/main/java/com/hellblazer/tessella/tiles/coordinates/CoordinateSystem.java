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
import com.hellblazer.tessella.tiles.TopologyMismatchException;

/**
 * The tag of a coordinate: topology family plus orientation or connectivity. Implementations are enums, so identity
 * comparison decides whether two coordinates may be combined.
 * <p>
 * The column/row mapping projects a coordinate onto the rectangular index space used by grid storage. For every
 * system {@code at(column(c), row(c)).equals(c)}.
 *
 * @param <C> the coordinate type tagged by this system
 * @author hal.hildebrand
 */
public interface CoordinateSystem<C extends Coordinate<C>> {

    C at(int column, int row);

    /**
     * Radius of the circle inscribed in a tile, in world units.
     */
    double cellRadius(double tileSize);

    int column(C coordinate);

    /**
     * @return the tile whose area contains the world space point
     */
    C fromPixel(Pixel pixel, double tileSize);

    int neighborCount();

    default C requireSame(C coordinate) {
        if (coordinate.system() != this) {
            throw new TopologyMismatchException(this, coordinate.system());
        }
        return coordinate;
    }

    int row(C coordinate);

    Pixel toPixel(C coordinate, double tileSize);

    Topology topology();

    /**
     * The outline of the tile in world space, counter clockwise. Used to size the angular shadow a blocking tile
     * casts.
     */
    Pixel[] vertices(C coordinate, double tileSize);
}
