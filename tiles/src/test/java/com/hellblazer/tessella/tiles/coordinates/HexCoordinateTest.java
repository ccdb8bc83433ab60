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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class HexCoordinateTest {

    @ParameterizedTest
    @EnumSource(OffsetLayout.class)
    void testOffsetRoundTrip(OffsetLayout layout) {
        var orientation = layout.orientation();
        for (int q = -6; q <= 6; q++) {
            for (int r = -6; r <= 6; r++) {
                var hex = orientation.at(q, r);
                var offset = hex.toOffset(layout);
                assertEquals(hex, offset.toAxial());
                assertEquals(offset, layout.fromAxial(hex));
            }
        }
    }

    @Test
    void testOddRowOffsets() {
        // odd rows are pushed right by half a hex
        assertEquals(OffsetLayout.ODD_ROWS.at(0, 1), HexCoordinate.pointy(0, 1).toOffset(OffsetLayout.ODD_ROWS));
        assertEquals(OffsetLayout.ODD_ROWS.at(1, 2), HexCoordinate.pointy(0, 2).toOffset(OffsetLayout.ODD_ROWS));
        assertEquals(OffsetLayout.EVEN_ROWS.at(1, 1), HexCoordinate.pointy(0, 1).toOffset(OffsetLayout.EVEN_ROWS));
        assertEquals(OffsetLayout.ODD_COLUMNS.at(2, 1), HexCoordinate.flat(2, 0).toOffset(OffsetLayout.ODD_COLUMNS));
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 1, 2, 3, 5 })
    void testRingsAndSpirals(int radius) {
        var center = HexCoordinate.pointy(2, -3);
        var ring = center.ring(radius);
        assertEquals(radius == 0 ? 1 : 6 * radius, ring.size());
        for (var hex : ring) {
            assertEquals(radius, center.distance(hex));
        }
        var spiral = center.spiral(radius);
        assertEquals(3 * radius * (radius + 1) + 1, spiral.size());
        assertEquals(spiral.size(), new HashSet<>(spiral).size());
        assertEquals(spiral.size(), Lattice.ball(center, radius).size());
    }

    @Test
    void testDistance() {
        var origin = HexCoordinate.flat(0, 0);
        assertEquals(3, origin.distance(HexCoordinate.flat(3, -1)));
        assertEquals(4, origin.distance(HexCoordinate.flat(-2, -2)));
        assertEquals(-1, HexCoordinate.flat(3, -2).s());
        assertEquals(HexCoordinate.flat(1, 0), origin.direction(6));
    }
}
