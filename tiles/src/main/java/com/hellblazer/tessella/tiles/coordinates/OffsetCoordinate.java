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
 * Hex lattice position in an offset layout, the natural key of rectangular hex maps. Arithmetic, distance and
 * adjacency are computed on the equivalent axial coordinate, so neighbor order matches {@link HexCoordinate}.
 *
 * @author hal.hildebrand
 */
public record OffsetCoordinate(int column, int row, OffsetLayout system) implements Coordinate<OffsetCoordinate> {

    public OffsetCoordinate {
        if (system == null) {
            throw new IllegalArgumentException("Layout must not be null");
        }
    }

    @Override
    public OffsetCoordinate add(OffsetCoordinate other) {
        system.requireSame(other);
        return system.fromAxial(toAxial().add(other.toAxial()));
    }

    @Override
    public int distance(OffsetCoordinate other) {
        system.requireSame(other);
        return toAxial().distance(other.toAxial());
    }

    @Override
    public List<OffsetCoordinate> neighbors() {
        var axial = toAxial().neighbors();
        var neighbors = new ArrayList<OffsetCoordinate>(axial.size());
        for (var hex : axial) {
            neighbors.add(system.fromAxial(hex));
        }
        return neighbors;
    }

    @Override
    public OffsetCoordinate scale(int factor) {
        return system.fromAxial(toAxial().scale(factor));
    }

    @Override
    public OffsetCoordinate subtract(OffsetCoordinate other) {
        system.requireSame(other);
        return system.fromAxial(toAxial().subtract(other.toAxial()));
    }

    public HexCoordinate toAxial() {
        return system.toAxial(this);
    }

    @Override
    public Pixel toPixel(double tileSize) {
        return system.toPixel(this, tileSize);
    }
}
