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

/**
 * Square lattice connectivity. {@link #FOUR} moves orthogonally and measures Manhattan distance; {@link #EIGHT} adds
 * the diagonals and measures Chebyshev distance.
 *
 * @author hal.hildebrand
 */
public enum Connectivity implements CoordinateSystem<SquareCoordinate> {
    FOUR(4), EIGHT(8);

    private final int neighborCount;

    Connectivity(int neighborCount) {
        this.neighborCount = neighborCount;
    }

    @Override
    public SquareCoordinate at(int column, int row) {
        return new SquareCoordinate(column, row, this);
    }

    @Override
    public double cellRadius(double tileSize) {
        return tileSize / 2.0;
    }

    @Override
    public int column(SquareCoordinate coordinate) {
        return coordinate.x();
    }

    @Override
    public SquareCoordinate fromPixel(Pixel pixel, double tileSize) {
        return at((int) Math.round(pixel.x() / tileSize), (int) Math.round(pixel.y() / tileSize));
    }

    @Override
    public int neighborCount() {
        return neighborCount;
    }

    @Override
    public int row(SquareCoordinate coordinate) {
        return coordinate.y();
    }

    @Override
    public Pixel toPixel(SquareCoordinate coordinate, double tileSize) {
        return new Pixel(coordinate.x() * tileSize, coordinate.y() * tileSize);
    }

    @Override
    public Topology topology() {
        return Topology.SQUARE;
    }

    @Override
    public Pixel[] vertices(SquareCoordinate coordinate, double tileSize) {
        var c = toPixel(coordinate, tileSize);
        double h = tileSize / 2.0;
        return new Pixel[] { new Pixel(c.x() - h, c.y() - h), new Pixel(c.x() + h, c.y() - h),
                             new Pixel(c.x() + h, c.y() + h), new Pixel(c.x() - h, c.y() + h) };
    }
}
