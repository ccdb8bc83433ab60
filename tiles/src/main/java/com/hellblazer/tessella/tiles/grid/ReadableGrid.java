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
package com.hellblazer.tessella.tiles.grid;

import com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException;
import com.hellblazer.tessella.tiles.coordinates.Coordinate;
import com.hellblazer.tessella.tiles.coordinates.CoordinateSystem;

import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read side of grid storage. Iteration is row-major (rows outer, columns inner), lazy, finite and restartable.
 *
 * @param <C> coordinate type
 * @param <T> stored value type
 * @author hal.hildebrand
 */
public interface ReadableGrid<C extends Coordinate<C>, T> {

    GridBounds bounds();

    Iterable<Cell<C, T>> cells();

    /**
     * True iff the coordinate lies inside the bounds. Never throws for out-of-bound coordinates.
     */
    boolean contains(C coordinate);

    /**
     * Every in-bound coordinate, row-major.
     */
    Iterable<C> coordinates();

    /**
     * Bounds-safe lookup: empty when out of bounds or when no value is present.
     */
    Optional<T> find(C coordinate);

    /**
     * @return the coordinate
     * @throws CoordinateOutOfBoundsException if the coordinate is outside the bounds
     */
    default C requireContains(C coordinate) {
        if (!contains(coordinate)) {
            throw new CoordinateOutOfBoundsException(coordinate, system().column(coordinate), system().row(coordinate),
                                                     bounds());
        }
        return coordinate;
    }

    default Stream<Cell<C, T>> stream() {
        return StreamSupport.stream(cells().spliterator(), false);
    }

    CoordinateSystem<C> system();
}
