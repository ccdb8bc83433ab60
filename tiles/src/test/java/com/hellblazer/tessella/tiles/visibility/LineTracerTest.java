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
package com.hellblazer.tessella.tiles.visibility;

import com.hellblazer.tessella.tiles.TopologyMismatchException;
import com.hellblazer.tessella.tiles.coordinates.HexCoordinate;
import com.hellblazer.tessella.tiles.coordinates.SquareCoordinate;
import com.hellblazer.tessella.tiles.coordinates.TriangularCoordinate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class LineTracerTest {

    @Test
    void testEightConnectedTrace() {
        var line = LineTracer.trace(SquareCoordinate.eight(0, 0), SquareCoordinate.eight(4, 2));
        assertEquals(List.of(SquareCoordinate.eight(0, 0), SquareCoordinate.eight(1, 0), SquareCoordinate.eight(2, 1),
                             SquareCoordinate.eight(3, 1), SquareCoordinate.eight(4, 2)), line);
    }

    @Test
    void testTracesAreContiguous() {
        var random = new Random(3);
        for (int i = 0; i < 200; i++) {
            var origin = TriangularCoordinate.of(random.nextInt(20) - 10, random.nextInt(20) - 10);
            var target = TriangularCoordinate.of(random.nextInt(20) - 10, random.nextInt(20) - 10);
            var line = LineTracer.trace(origin, target);
            assertEquals(origin.distance(target) + 1, line.size());
            assertEquals(origin, line.get(0));
            assertEquals(target, line.get(line.size() - 1));
            for (int j = 1; j < line.size(); j++) {
                assertTrue(line.get(j - 1).neighbors().contains(line.get(j)));
            }
        }
    }

    @Test
    void testLineOfSight() {
        var origin = SquareCoordinate.four(0, 0);
        var target = SquareCoordinate.four(4, 0);
        assertFalse(LineTracer.lineOfSight(origin, target, SquareCoordinate.four(2, 0)::equals));
        assertTrue(LineTracer.lineOfSight(origin, target, SquareCoordinate.four(2, 1)::equals));
        // endpoints never block
        assertTrue(LineTracer.lineOfSight(origin, target, c -> c.equals(origin) || c.equals(target)));
        assertTrue(LineTracer.lineOfSight(origin, origin, c -> true));
    }

    @Test
    void testHexStraightLine() {
        var line = LineTracer.trace(HexCoordinate.pointy(0, 0), HexCoordinate.pointy(0, 3));
        assertEquals(List.of(HexCoordinate.pointy(0, 0), HexCoordinate.pointy(0, 1), HexCoordinate.pointy(0, 2),
                             HexCoordinate.pointy(0, 3)), line);
    }

    @Test
    void testMixedSystems() {
        assertThrows(TopologyMismatchException.class,
                     () -> LineTracer.trace(SquareCoordinate.four(0, 0), SquareCoordinate.eight(1, 1)));
    }
}
