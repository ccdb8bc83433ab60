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

/**
 * A coordinate fell outside the fixed bounds of a grid.
 *
 * @author hal.hildebrand
 */
public class CoordinateOutOfBoundsException extends TilesException {
    private static final long serialVersionUID = 1L;

    private final int column;
    private final int row;

    public CoordinateOutOfBoundsException(Object coordinate, int column, int row, Object bounds) {
        super(ErrorKind.COORDINATE_OUT_OF_BOUNDS,
              coordinate + " (column " + column + ", row " + row + ") is outside " + bounds);
        this.column = column;
        this.row = row;
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }
}
