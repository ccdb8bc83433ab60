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

import com.hellblazer.tessella.tiles.coordinates.Coordinate;
import com.hellblazer.tessella.tiles.coordinates.CoordinateSystem;

import java.util.Optional;
import java.util.TreeMap;

/**
 * Grid that stores values for a subset of the coordinates inside its bounds. Cells are keyed by row-major index, so
 * iteration over occupied cells is row-major as well.
 * <p>
 * Thread Safety: not thread safe.
 *
 * @param <C> coordinate type
 * @param <T> value type
 * @author hal.hildebrand
 */
public class SparseGrid<C extends Coordinate<C>, T> extends AbstractGrid<C, T> {

    private final TreeMap<Integer, T> occupied = new TreeMap<>();

    public SparseGrid(CoordinateSystem<C> system, GridBounds bounds) {
        super(system, bounds);
    }

    @Override
    public Iterable<Cell<C, T>> cells() {
        return () -> occupied.entrySet()
                             .stream()
                             .map(e -> new Cell<>(coordinateAt(e.getKey()), e.getValue()))
                             .iterator();
    }

    public void clear() {
        occupied.clear();
    }

    public int count() {
        return occupied.size();
    }

    @Override
    public Optional<T> find(C coordinate) {
        if (!contains(coordinate)) {
            return Optional.empty();
        }
        return Optional.ofNullable(occupied.get(indexOf(coordinate)));
    }

    /**
     * @throws com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException if the coordinate is outside the bounds
     */
    public Optional<T> get(C coordinate) {
        return Optional.ofNullable(occupied.get(indexOf(coordinate)));
    }

    public boolean inBounds(C coordinate) {
        return contains(coordinate);
    }

    /**
     * Store the value, answering the value it replaced, if any.
     */
    public Optional<T> insert(C coordinate, T value) {
        if (value == null) {
            throw new IllegalArgumentException("Sparse grid values must not be null");
        }
        return Optional.ofNullable(occupied.put(indexOf(coordinate), value));
    }

    public boolean isOccupied(C coordinate) {
        return contains(coordinate) && occupied.containsKey(indexOf(coordinate));
    }

    public Optional<T> remove(C coordinate) {
        return Optional.ofNullable(occupied.remove(indexOf(coordinate)));
    }

    @Override
    public String toString() {
        return "SparseGrid[" + system + ", " + bounds + ", " + occupied.size() + " occupied]";
    }
}
