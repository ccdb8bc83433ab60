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
 * Axial hex lattice position (q, r); the implicit third cube component is {@code -q - r}.
 *
 * @author hal.hildebrand
 */
public record HexCoordinate(int q, int r, HexOrientation system) implements Coordinate<HexCoordinate> {

    private static final int[][] DIRECTIONS = { { 1, 0 }, { 1, -1 }, { 0, -1 }, { -1, 0 }, { -1, 1 }, { 0, 1 } };

    public HexCoordinate {
        if (system == null) {
            throw new IllegalArgumentException("Orientation must not be null");
        }
    }

    public static HexCoordinate flat(int q, int r) {
        return new HexCoordinate(q, r, HexOrientation.FLAT);
    }

    public static HexCoordinate pointy(int q, int r) {
        return new HexCoordinate(q, r, HexOrientation.POINTY);
    }

    @Override
    public HexCoordinate add(HexCoordinate other) {
        system.requireSame(other);
        return new HexCoordinate(q + other.q, r + other.r, system);
    }

    /**
     * The neighbor in one of the six directions, indexed as in {@link #neighbors()}.
     */
    public HexCoordinate direction(int index) {
        var d = DIRECTIONS[Math.floorMod(index, 6)];
        return new HexCoordinate(q + d[0], r + d[1], system);
    }

    @Override
    public int distance(HexCoordinate other) {
        system.requireSame(other);
        int dq = q - other.q;
        int dr = r - other.r;
        return (Math.abs(dq) + Math.abs(dr) + Math.abs(dq + dr)) / 2;
    }

    @Override
    public List<HexCoordinate> neighbors() {
        var neighbors = new ArrayList<HexCoordinate>(6);
        for (var d : DIRECTIONS) {
            neighbors.add(new HexCoordinate(q + d[0], r + d[1], system));
        }
        return neighbors;
    }

    /**
     * The hexes at exactly the given distance, starting at the corner reached by repeating direction 4 and walking
     * the six sides in direction order. A radius of 0 answers this hex alone.
     */
    public List<HexCoordinate> ring(int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative: " + radius);
        }
        if (radius == 0) {
            return List.of(this);
        }
        var ring = new ArrayList<HexCoordinate>(6 * radius);
        var d = DIRECTIONS[4];
        var current = new HexCoordinate(q + d[0] * radius, r + d[1] * radius, system);
        for (int side = 0; side < 6; side++) {
            for (int step = 0; step < radius; step++) {
                ring.add(current);
                current = current.direction(side);
            }
        }
        return ring;
    }

    /**
     * @return the cube coordinate {@code s = -q - r}
     */
    public int s() {
        return -q - r;
    }

    @Override
    public HexCoordinate scale(int factor) {
        return new HexCoordinate(q * factor, r * factor, system);
    }

    /**
     * All hexes within the radius, ring by ring from the center. Contains {@code 3 r (r + 1) + 1} hexes.
     */
    public List<HexCoordinate> spiral(int radius) {
        var spiral = new ArrayList<HexCoordinate>(3 * radius * (radius + 1) + 1);
        for (int k = 0; k <= radius; k++) {
            spiral.addAll(ring(k));
        }
        return spiral;
    }

    @Override
    public HexCoordinate subtract(HexCoordinate other) {
        system.requireSame(other);
        return new HexCoordinate(q - other.q, r - other.r, system);
    }

    public OffsetCoordinate toOffset(OffsetLayout layout) {
        return layout.fromAxial(this);
    }

    @Override
    public Pixel toPixel(double tileSize) {
        return system.toPixel(this, tileSize);
    }

    @Override
    public String toString() {
        return "Hex[" + q + ", " + r + ", " + system + "]";
    }
}
