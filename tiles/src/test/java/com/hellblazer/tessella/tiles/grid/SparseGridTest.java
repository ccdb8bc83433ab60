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
package com.hellblazer.tessella.tiles.grid;

import com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException;
import com.hellblazer.tessella.tiles.coordinates.TriangularCoordinate;
import com.hellblazer.tessella.tiles.coordinates.TriangularLayout;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SparseGridTest {

    @Test
    void testInsertRemove() {
        var grid = new SparseGrid<TriangularCoordinate, String>(TriangularLayout.EDGE_CONNECTED, GridBounds.of(6, 4));
        var a = TriangularCoordinate.of(5, 3);
        var b = TriangularCoordinate.of(1, 0);
        assertEquals(Optional.empty(), grid.get(a));
        assertEquals(Optional.empty(), grid.insert(a, "tree"));
        assertEquals(Optional.of("tree"), grid.insert(a, "rock"));
        grid.insert(b, "well");
        assertTrue(grid.isOccupied(a));
        assertEquals(2, grid.count());

        var order = new ArrayList<TriangularCoordinate>();
        grid.cells().forEach(cell -> order.add(cell.coordinate()));
        assertEquals(List.of(b, a), order);

        assertEquals(Optional.of("rock"), grid.remove(a));
        assertFalse(grid.isOccupied(a));
        assertEquals(Optional.empty(), grid.remove(a));
        assertEquals(1, grid.count());
    }

    @Test
    void testBounds() {
        var grid = new SparseGrid<TriangularCoordinate, String>(TriangularLayout.EDGE_CONNECTED, GridBounds.of(2, 2));
        var outside = TriangularCoordinate.of(2, 0);
        assertFalse(grid.inBounds(outside));
        assertFalse(grid.isOccupied(outside));
        assertEquals(Optional.empty(), grid.find(outside));
        assertThrows(CoordinateOutOfBoundsException.class, () -> grid.get(outside));
        assertThrows(CoordinateOutOfBoundsException.class, () -> grid.insert(outside, "x"));
        assertThrows(CoordinateOutOfBoundsException.class, () -> grid.remove(outside));
    }
}
