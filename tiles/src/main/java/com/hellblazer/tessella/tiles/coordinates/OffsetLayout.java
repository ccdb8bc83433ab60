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
import com.hellblazer.tessella.tiles.TopologyMismatchException;

/**
 * Offset (rectangular storage) layouts of a hex lattice. Rows are shifted for pointy hexes and columns for flat ones;
 * the parity names which rows or columns are pushed out by half a hex. Conversions to and from axial coordinates are
 * lossless, and all lattice math is performed in axial space.
 *
 * @author hal.hildebrand
 */
public enum OffsetLayout implements CoordinateSystem<OffsetCoordinate> {
    ODD_ROWS(HexOrientation.POINTY, true), EVEN_ROWS(HexOrientation.POINTY, false),
    ODD_COLUMNS(HexOrientation.FLAT, true), EVEN_COLUMNS(HexOrientation.FLAT, false);

    private final HexOrientation orientation;
    private final boolean        odd;

    OffsetLayout(HexOrientation orientation, boolean odd) {
        this.orientation = orientation;
        this.odd = odd;
    }

    @Override
    public OffsetCoordinate at(int column, int row) {
        return new OffsetCoordinate(column, row, this);
    }

    @Override
    public double cellRadius(double tileSize) {
        return orientation.cellRadius(tileSize);
    }

    @Override
    public int column(OffsetCoordinate coordinate) {
        return coordinate.column();
    }

    public OffsetCoordinate fromAxial(HexCoordinate hex) {
        if (hex.system() != orientation) {
            throw new TopologyMismatchException(orientation, hex.system());
        }
        int q = hex.q();
        int r = hex.r();
        return switch (this) {
            case ODD_ROWS -> at(q + (r - (r & 1)) / 2, r);
            case EVEN_ROWS -> at(q + (r + (r & 1)) / 2, r);
            case ODD_COLUMNS -> at(q, r + (q - (q & 1)) / 2);
            case EVEN_COLUMNS -> at(q, r + (q + (q & 1)) / 2);
        };
    }

    @Override
    public OffsetCoordinate fromPixel(Pixel pixel, double tileSize) {
        return fromAxial(orientation.fromPixel(pixel, tileSize));
    }

    public boolean isOdd() {
        return odd;
    }

    @Override
    public int neighborCount() {
        return 6;
    }

    public HexOrientation orientation() {
        return orientation;
    }

    @Override
    public int row(OffsetCoordinate coordinate) {
        return coordinate.row();
    }

    public HexCoordinate toAxial(OffsetCoordinate coordinate) {
        int col = coordinate.column();
        int row = coordinate.row();
        return switch (this) {
            case ODD_ROWS -> orientation.at(col - (row - (row & 1)) / 2, row);
            case EVEN_ROWS -> orientation.at(col - (row + (row & 1)) / 2, row);
            case ODD_COLUMNS -> orientation.at(col, row - (col - (col & 1)) / 2);
            case EVEN_COLUMNS -> orientation.at(col, row - (col + (col & 1)) / 2);
        };
    }

    @Override
    public Pixel toPixel(OffsetCoordinate coordinate, double tileSize) {
        return orientation.toPixel(toAxial(coordinate), tileSize);
    }

    @Override
    public Topology topology() {
        return Topology.HEXAGONAL;
    }

    @Override
    public Pixel[] vertices(OffsetCoordinate coordinate, double tileSize) {
        return orientation.vertices(toAxial(coordinate), tileSize);
    }
}
