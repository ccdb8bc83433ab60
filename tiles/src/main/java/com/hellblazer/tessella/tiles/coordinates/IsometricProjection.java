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
 * Diamond isometric projection of a 4-connected square lattice. A tile is a diamond {@code tileSize} wide and half
 * as tall.
 *
 * @author hal.hildebrand
 */
public enum IsometricProjection implements CoordinateSystem<IsometricCoordinate> {
    DIAMOND;

    @Override
    public IsometricCoordinate at(int column, int row) {
        return new IsometricCoordinate(column, row, this);
    }

    @Override
    public double cellRadius(double tileSize) {
        return tileSize / (2.0 * Math.sqrt(5.0));
    }

    @Override
    public int column(IsometricCoordinate coordinate) {
        return coordinate.x();
    }

    /**
     * Rounding in the un-projected frame is exact: the diamond of a tile maps to the unit square around it.
     */
    @Override
    public IsometricCoordinate fromPixel(Pixel pixel, double tileSize) {
        double u = pixel.x() / tileSize;
        double v = 2.0 * pixel.y() / tileSize;
        return at((int) Math.round(v + u), (int) Math.round(v - u));
    }

    @Override
    public int neighborCount() {
        return 4;
    }

    @Override
    public int row(IsometricCoordinate coordinate) {
        return coordinate.y();
    }

    @Override
    public Pixel toPixel(IsometricCoordinate coordinate, double tileSize) {
        int x = coordinate.x();
        int y = coordinate.y();
        return new Pixel((x - y) * tileSize / 2.0, (x + y) * tileSize / 4.0);
    }

    @Override
    public Topology topology() {
        return Topology.ISOMETRIC;
    }

    @Override
    public Pixel[] vertices(IsometricCoordinate coordinate, double tileSize) {
        var c = toPixel(coordinate, tileSize);
        double w = tileSize / 2.0;
        double h = tileSize / 4.0;
        return new Pixel[] { new Pixel(c.x(), c.y() - h), new Pixel(c.x() + w, c.y()), new Pixel(c.x(), c.y() + h),
                             new Pixel(c.x() - w, c.y()) };
    }
}
