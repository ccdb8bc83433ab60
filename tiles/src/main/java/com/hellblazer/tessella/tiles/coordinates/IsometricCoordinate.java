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
 * Isometric lattice position. Adjacency and distance are those of the 4-connected square lattice; only the world
 * space projection differs.
 *
 * @author hal.hildebrand
 */
public record IsometricCoordinate(int x, int y, IsometricProjection system)
implements Coordinate<IsometricCoordinate> {

    public IsometricCoordinate {
        if (system == null) {
            throw new IllegalArgumentException("Projection must not be null");
        }
    }

    public static IsometricCoordinate of(int x, int y) {
        return new IsometricCoordinate(x, y, IsometricProjection.DIAMOND);
    }

    @Override
    public IsometricCoordinate add(IsometricCoordinate other) {
        system.requireSame(other);
        return new IsometricCoordinate(x + other.x, y + other.y, system);
    }

    @Override
    public int distance(IsometricCoordinate other) {
        system.requireSame(other);
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    @Override
    public List<IsometricCoordinate> neighbors() {
        return List.of(new IsometricCoordinate(x + 1, y, system), new IsometricCoordinate(x - 1, y, system),
                       new IsometricCoordinate(x, y + 1, system), new IsometricCoordinate(x, y - 1, system));
    }

    @Override
    public IsometricCoordinate scale(int factor) {
        return new IsometricCoordinate(x * factor, y * factor, system);
    }

    @Override
    public IsometricCoordinate subtract(IsometricCoordinate other) {
        system.requireSame(other);
        return new IsometricCoordinate(x - other.x, y - other.y, system);
    }

    @Override
    public Pixel toPixel(double tileSize) {
        return system.toPixel(this, tileSize);
    }
}
