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
 * Orientation of an axial hex lattice. The tile size is the hexagon's circumradius.
 *
 * @author hal.hildebrand
 */
public enum HexOrientation implements CoordinateSystem<HexCoordinate> {
    /** Vertex at the top, rows of hexes run horizontally. */
    POINTY,
    /** Edge at the top, columns of hexes run vertically. */
    FLAT;

    static final double SQRT_3 = Math.sqrt(3.0);

    /**
     * Cube rounding of fractional axial coordinates to the containing hex.
     */
    static int[] axialRound(double q, double r) {
        double s = -q - r;
        long rq = Math.round(q);
        long rr = Math.round(r);
        long rs = Math.round(s);
        double dq = Math.abs(rq - q);
        double dr = Math.abs(rr - r);
        double ds = Math.abs(rs - s);
        if (dq > dr && dq > ds) {
            rq = -rr - rs;
        } else if (dr > ds) {
            rr = -rq - rs;
        }
        return new int[] { (int) rq, (int) rr };
    }

    @Override
    public HexCoordinate at(int column, int row) {
        return new HexCoordinate(column, row, this);
    }

    @Override
    public double cellRadius(double tileSize) {
        return tileSize * SQRT_3 / 2.0;
    }

    @Override
    public int column(HexCoordinate coordinate) {
        return coordinate.q();
    }

    @Override
    public HexCoordinate fromPixel(Pixel pixel, double tileSize) {
        double px = pixel.x() / tileSize;
        double py = pixel.y() / tileSize;
        var rounded = switch (this) {
            case POINTY -> axialRound(SQRT_3 / 3.0 * px - py / 3.0, 2.0 / 3.0 * py);
            case FLAT -> axialRound(2.0 / 3.0 * px, -px / 3.0 + SQRT_3 / 3.0 * py);
        };
        return at(rounded[0], rounded[1]);
    }

    @Override
    public int neighborCount() {
        return 6;
    }

    @Override
    public int row(HexCoordinate coordinate) {
        return coordinate.r();
    }

    @Override
    public Pixel toPixel(HexCoordinate coordinate, double tileSize) {
        int q = coordinate.q();
        int r = coordinate.r();
        return switch (this) {
            case POINTY -> new Pixel(tileSize * SQRT_3 * (q + r / 2.0), tileSize * 1.5 * r);
            case FLAT -> new Pixel(tileSize * 1.5 * q, tileSize * SQRT_3 * (r + q / 2.0));
        };
    }

    @Override
    public Topology topology() {
        return Topology.HEXAGONAL;
    }

    /**
     * Corners start at 30 degrees for pointy hexes and at 0 degrees for flat ones.
     */
    @Override
    public Pixel[] vertices(HexCoordinate coordinate, double tileSize) {
        var c = toPixel(coordinate, tileSize);
        double offset = this == POINTY ? Math.PI / 6.0 : 0.0;
        var corners = new Pixel[6];
        for (int i = 0; i < 6; i++) {
            double theta = offset + i * Math.PI / 3.0;
            corners[i] = new Pixel(c.x() + tileSize * Math.cos(theta), c.y() + tileSize * Math.sin(theta));
        }
        return corners;
    }
}
