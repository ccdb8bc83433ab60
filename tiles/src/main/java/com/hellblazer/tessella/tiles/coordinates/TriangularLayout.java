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
 * Equilateral triangle tiling with edge adjacency. Rows are {@code tileSize * sqrt(3) / 2} tall and y grows upward;
 * the triangle at (x, y) spans the horizontal interval starting at {@code x * tileSize / 2} and points up iff
 * {@code x + y} is even.
 *
 * @author hal.hildebrand
 */
public enum TriangularLayout implements CoordinateSystem<TriangularCoordinate> {
    EDGE_CONNECTED;

    private static final double EPSILON = 1e-9;

    private static double cross(double ax, double ay, double bx, double by, double px, double py) {
        return (bx - ax) * (py - ay) - (by - ay) * (px - ax);
    }

    @Override
    public TriangularCoordinate at(int column, int row) {
        return new TriangularCoordinate(column, row, this);
    }

    @Override
    public double cellRadius(double tileSize) {
        return tileSize / (2.0 * Math.sqrt(3.0));
    }

    @Override
    public int column(TriangularCoordinate coordinate) {
        return coordinate.x();
    }

    /**
     * Locates the row, then tests the candidate triangles of that row for containment. Falls back to the nearest
     * center for points on shared edges that round out of every candidate.
     */
    @Override
    public TriangularCoordinate fromPixel(Pixel pixel, double tileSize) {
        double h = rowHeight(tileSize);
        int row = (int) Math.floor(pixel.y() / h);
        int base = (int) Math.floor(2.0 * pixel.x() / tileSize);
        TriangularCoordinate nearest = null;
        double best = Double.MAX_VALUE;
        for (int column = base - 2; column <= base + 1; column++) {
            var candidate = at(column, row);
            if (contains(candidate, pixel, tileSize)) {
                return candidate;
            }
            double d = toPixel(candidate, tileSize).distanceSquared(pixel);
            if (d < best) {
                best = d;
                nearest = candidate;
            }
        }
        return nearest;
    }

    @Override
    public int neighborCount() {
        return 3;
    }

    @Override
    public int row(TriangularCoordinate coordinate) {
        return coordinate.y();
    }

    public double rowHeight(double tileSize) {
        return tileSize * Math.sqrt(3.0) / 2.0;
    }

    @Override
    public Pixel toPixel(TriangularCoordinate coordinate, double tileSize) {
        double h = rowHeight(tileSize);
        double cx = (coordinate.x() + 1) * tileSize / 2.0;
        double cy = coordinate.y() * h + (coordinate.isUpPointing() ? h / 3.0 : 2.0 * h / 3.0);
        return new Pixel(cx, cy);
    }

    @Override
    public Topology topology() {
        return Topology.TRIANGULAR;
    }

    /**
     * @return the three vertices of the triangle, counter clockwise
     */
    @Override
    public Pixel[] vertices(TriangularCoordinate coordinate, double tileSize) {
        double h = rowHeight(tileSize);
        double left = coordinate.x() * tileSize / 2.0;
        double bottom = coordinate.y() * h;
        if (coordinate.isUpPointing()) {
            return new Pixel[] { new Pixel(left, bottom), new Pixel(left + tileSize, bottom),
                                 new Pixel(left + tileSize / 2.0, bottom + h) };
        }
        return new Pixel[] { new Pixel(left + tileSize / 2.0, bottom), new Pixel(left + tileSize, bottom + h),
                             new Pixel(left, bottom + h) };
    }

    private boolean contains(TriangularCoordinate candidate, Pixel p, double tileSize) {
        var v = vertices(candidate, tileSize);
        double tolerance = -EPSILON * tileSize;
        for (int i = 0; i < 3; i++) {
            var a = v[i];
            var b = v[(i + 1) % 3];
            if (cross(a.x(), a.y(), b.x(), b.y(), p.x(), p.y()) < tolerance) {
                return false;
            }
        }
        return true;
    }
}
