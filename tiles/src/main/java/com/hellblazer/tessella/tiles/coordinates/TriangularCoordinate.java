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
 * Triangular lattice position. Each triangle has three edge neighbors: left, right, and the triangle across its
 * horizontal edge (below for up-pointing triangles, above for down-pointing ones).
 *
 * @author hal.hildebrand
 */
public record TriangularCoordinate(int x, int y, TriangularLayout system) implements Coordinate<TriangularCoordinate> {

    public TriangularCoordinate {
        if (system == null) {
            throw new IllegalArgumentException("Layout must not be null");
        }
    }

    public static TriangularCoordinate of(int x, int y) {
        return new TriangularCoordinate(x, y, TriangularLayout.EDGE_CONNECTED);
    }

    @Override
    public TriangularCoordinate add(TriangularCoordinate other) {
        system.requireSame(other);
        return new TriangularCoordinate(x + other.x, y + other.y, system);
    }

    /**
     * Exact edge-graph distance. Crossing a row boundary upward is only possible from a down-pointing triangle and
     * downward only from an up-pointing one, and every horizontal step flips orientation; the horizontal step count
     * is the smallest value covering both the column offset and the required orientation changes with the parity of
     * the column offset.
     */
    @Override
    public int distance(TriangularCoordinate other) {
        system.requireSame(other);
        int dx = Math.abs(other.x - x);
        int dy = Math.abs(other.y - y);
        if (dy == 0) {
            return dx;
        }
        boolean aligned = other.y > y ? !isUpPointing() : isUpPointing();
        int required = dy - (aligned ? 1 : 0);
        int horizontal = Math.max(dx, required);
        if (((horizontal - dx) & 1) != 0) {
            horizontal++;
        }
        return dy + horizontal;
    }

    public boolean isUpPointing() {
        return ((x + y) & 1) == 0;
    }

    @Override
    public List<TriangularCoordinate> neighbors() {
        var vertical = isUpPointing() ? new TriangularCoordinate(x, y - 1, system) : new TriangularCoordinate(x, y + 1,
                                                                                                              system);
        return List.of(new TriangularCoordinate(x - 1, y, system), new TriangularCoordinate(x + 1, y, system),
                       vertical);
    }

    @Override
    public TriangularCoordinate scale(int factor) {
        return new TriangularCoordinate(x * factor, y * factor, system);
    }

    @Override
    public TriangularCoordinate subtract(TriangularCoordinate other) {
        system.requireSame(other);
        return new TriangularCoordinate(x - other.x, y - other.y, system);
    }

    @Override
    public Pixel toPixel(double tileSize) {
        return system.toPixel(this, tileSize);
    }
}
