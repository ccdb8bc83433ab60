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

import com.hellblazer.tessella.tiles.InvalidConfigurationException;

/**
 * Fixed rectangular extent of a grid in column/row index space.
 *
 * @author hal.hildebrand
 */
public record GridBounds(int minColumn, int minRow, int columns, int rows) {

    public GridBounds {
        if (columns <= 0 || rows <= 0) {
            throw new InvalidConfigurationException(
            "Grid bounds must have positive extent: " + columns + " x " + rows);
        }
        if ((long) columns * rows > Integer.MAX_VALUE - 8) {
            throw new InvalidConfigurationException("Grid bounds too large: " + columns + " x " + rows);
        }
        // the exclusive ends must be representable
        if ((long) minColumn + columns > Integer.MAX_VALUE || (long) minRow + rows > Integer.MAX_VALUE) {
            throw new InvalidConfigurationException(
            "Grid bounds exceed the index range: origin (" + minColumn + ", " + minRow + ") extent " + columns + " x "
            + rows);
        }
    }

    public static GridBounds of(int columns, int rows) {
        return new GridBounds(0, 0, columns, rows);
    }

    public int cellCount() {
        return columns * rows;
    }

    public int columnOf(int index) {
        return minColumn + index % columns;
    }

    public boolean contains(int column, int row) {
        return column >= minColumn && column < minColumn + columns && row >= minRow && row < minRow + rows;
    }

    /**
     * Row-major index of an in-bound position.
     */
    public int index(int column, int row) {
        return (row - minRow) * columns + (column - minColumn);
    }

    public int maxColumn() {
        return minColumn + columns - 1;
    }

    public int maxRow() {
        return minRow + rows - 1;
    }

    public int rowOf(int index) {
        return minRow + index / columns;
    }

    @Override
    public String toString() {
        return "Bounds[" + minColumn + ".." + maxColumn() + " x " + minRow + ".." + maxRow() + "]";
    }
}
