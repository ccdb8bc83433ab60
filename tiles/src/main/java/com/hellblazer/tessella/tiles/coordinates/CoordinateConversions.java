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

/**
 * Conversions between topologies. Square and isometric lattices share an index space, so those conversions are exact.
 * Hex to square conversion uses the row-shifted index mapping, which preserves indices but not geometry; use
 * {@link #throughWorld(Coordinate, double, CoordinateSystem)} when the nearest tile in world space is wanted.
 *
 * @author hal.hildebrand
 */
public final class CoordinateConversions {

    private CoordinateConversions() {
    }

    public static SquareCoordinate hexToSquare(HexCoordinate hex, Connectivity connectivity) {
        return connectivity.at(hex.q() + hex.r() / 2, hex.r());
    }

    public static SquareCoordinate isometricToSquare(IsometricCoordinate iso, Connectivity connectivity) {
        return connectivity.at(iso.x(), iso.y());
    }

    public static HexCoordinate squareToHex(SquareCoordinate square, HexOrientation orientation) {
        return orientation.at(square.x() - square.y() / 2, square.y());
    }

    public static IsometricCoordinate squareToIsometric(SquareCoordinate square) {
        return IsometricCoordinate.of(square.x(), square.y());
    }

    /**
     * The tile of the target system whose area contains the world space center of the source tile.
     */
    public static <C extends Coordinate<C>, D extends Coordinate<D>> D throughWorld(C source, double tileSize,
                                                                                    CoordinateSystem<D> target) {
        return target.fromPixel(source.toPixel(tileSize), tileSize);
    }
}
