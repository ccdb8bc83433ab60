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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Bounds and coordinate system bookkeeping shared by the dense and sparse grids.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractGrid<C extends Coordinate<C>, T> implements ReadableGrid<C, T> {

    protected final GridBounds          bounds;
    protected final CoordinateSystem<C> system;

    protected AbstractGrid(CoordinateSystem<C> system, GridBounds bounds) {
        this.system = Objects.requireNonNull(system, "system");
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    @Override
    public GridBounds bounds() {
        return bounds;
    }

    @Override
    public boolean contains(C coordinate) {
        system.requireSame(coordinate);
        return bounds.contains(system.column(coordinate), system.row(coordinate));
    }

    @Override
    public Iterable<C> coordinates() {
        return () -> new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < bounds.cellCount();
            }

            @Override
            public C next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return coordinateAt(next++);
            }
        };
    }

    @Override
    public CoordinateSystem<C> system() {
        return system;
    }

    protected C coordinateAt(int index) {
        return system.at(bounds.columnOf(index), bounds.rowOf(index));
    }

    /**
     * @return the row-major index of the coordinate
     * @throws CoordinateOutOfBoundsException if the coordinate is outside the bounds
     */
    protected int indexOf(C coordinate) {
        system.requireSame(coordinate);
        int column = system.column(coordinate);
        int row = system.row(coordinate);
        if (!bounds.contains(column, row)) {
            throw new CoordinateOutOfBoundsException(coordinate, column, row, bounds);
        }
        return bounds.index(column, row);
    }
}
