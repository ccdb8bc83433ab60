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

import java.util.ArrayList;
import java.util.List;

/**
 * Square lattice position.
 *
 * @author hal.hildebrand
 */
public record SquareCoordinate(int x, int y, Connectivity system) implements Coordinate<SquareCoordinate> {

    // right, left, up, down, then up-right, up-left, down-right, down-left
    private static final int[][] OFFSETS = { { 1, 0 }, { -1, 0 }, { 0, 1 }, { 0, -1 }, { 1, 1 }, { -1, 1 }, { 1, -1 },
                                             { -1, -1 } };

    public SquareCoordinate {
        if (system == null) {
            throw new IllegalArgumentException("Connectivity must not be null");
        }
    }

    public static SquareCoordinate eight(int x, int y) {
        return new SquareCoordinate(x, y, Connectivity.EIGHT);
    }

    public static SquareCoordinate four(int x, int y) {
        return new SquareCoordinate(x, y, Connectivity.FOUR);
    }

    @Override
    public SquareCoordinate add(SquareCoordinate other) {
        system.requireSame(other);
        return new SquareCoordinate(x + other.x, y + other.y, system);
    }

    @Override
    public int distance(SquareCoordinate other) {
        system.requireSame(other);
        int dx = Math.abs(x - other.x);
        int dy = Math.abs(y - other.y);
        return switch (system) {
            case FOUR -> dx + dy;
            case EIGHT -> Math.max(dx, dy);
        };
    }

    @Override
    public List<SquareCoordinate> neighbors() {
        var neighbors = new ArrayList<SquareCoordinate>(system.neighborCount());
        for (int i = 0; i < system.neighborCount(); i++) {
            neighbors.add(new SquareCoordinate(x + OFFSETS[i][0], y + OFFSETS[i][1], system));
        }
        return neighbors;
    }

    @Override
    public SquareCoordinate scale(int factor) {
        return new SquareCoordinate(x * factor, y * factor, system);
    }

    @Override
    public SquareCoordinate subtract(SquareCoordinate other) {
        system.requireSame(other);
        return new SquareCoordinate(x - other.x, y - other.y, system);
    }

    @Override
    public Pixel toPixel(double tileSize) {
        return system.toPixel(this, tileSize);
    }

    @Override
    public String toString() {
        return "Square[" + x + ", " + y + ", " + system + "]";
    }
}
