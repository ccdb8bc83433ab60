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

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Dense grid storing one value for every coordinate inside fixed bounds, in a flat row-major array. Indexed access is
 * O(1).
 * <p>
 * Thread Safety: a mutable grid is not thread safe. {@link #snapshot()} produces an immutable copy that may be shared
 * freely between threads.
 *
 * @param <C> coordinate type
 * @param <T> value type
 * @author hal.hildebrand
 */
public class Grid<C extends Coordinate<C>, T> extends AbstractGrid<C, T> {

    private final boolean  readOnly;
    private final Object[] values;

    private Grid(CoordinateSystem<C> system, GridBounds bounds, Object[] values, boolean readOnly) {
        super(system, bounds);
        this.values = values;
        this.readOnly = readOnly;
    }

    /**
     * A grid with every cell holding the same initial value.
     */
    public static <C extends Coordinate<C>, T> Grid<C, T> filled(CoordinateSystem<C> system, GridBounds bounds,
                                                                 T initial) {
        var values = new Object[bounds.cellCount()];
        Arrays.fill(values, initial);
        return new Grid<>(system, bounds, values, false);
    }

    /**
     * A grid initialized by evaluating the initializer once per coordinate, in row-major order.
     */
    public static <C extends Coordinate<C>, T> Grid<C, T> generate(CoordinateSystem<C> system, GridBounds bounds,
                                                                   Function<? super C, ? extends T> initializer) {
        var grid = new Grid<C, T>(system, bounds, new Object[bounds.cellCount()], false);
        for (int i = 0; i < grid.values.length; i++) {
            grid.values[i] = initializer.apply(grid.coordinateAt(i));
        }
        return grid;
    }

    @Override
    public Iterable<Cell<C, T>> cells() {
        return () -> new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < values.length;
            }

            @Override
            public Cell<C, T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int index = next++;
                return new Cell<>(coordinateAt(index), valueAt(index));
            }
        };
    }

    public void fill(T value) {
        checkWritable();
        Arrays.fill(values, value);
    }

    @Override
    public Optional<T> find(C coordinate) {
        if (!contains(coordinate)) {
            return Optional.empty();
        }
        return Optional.ofNullable(valueAt(indexOf(coordinate)));
    }

    /**
     * @throws com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException if the coordinate is outside the bounds
     */
    public T get(C coordinate) {
        return valueAt(indexOf(coordinate));
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Store the value, answering the previous one.
     *
     * @throws com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException if the coordinate is outside the bounds
     */
    public T set(C coordinate, T value) {
        checkWritable();
        int index = indexOf(coordinate);
        var previous = valueAt(index);
        values[index] = value;
        return previous;
    }

    /**
     * An immutable copy of the current contents.
     */
    public Grid<C, T> snapshot() {
        if (readOnly) {
            return this;
        }
        return new Grid<>(system, bounds, values.clone(), true);
    }

    @Override
    public String toString() {
        return "Grid[" + system + ", " + bounds + (readOnly ? ", read only]" : "]");
    }

    private void checkWritable() {
        if (readOnly) {
            throw new UnsupportedOperationException("Grid snapshot is read only");
        }
    }

    @SuppressWarnings("unchecked")
    private T valueAt(int index) {
        return (T) values[index];
    }
}
