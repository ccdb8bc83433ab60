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
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TriangularCoordinateTest {

    private static Map<TriangularCoordinate, Integer> breadthFirst(TriangularCoordinate origin, int limit) {
        var distances = new HashMap<TriangularCoordinate, Integer>();
        var queue = new ArrayDeque<TriangularCoordinate>();
        distances.put(origin, 0);
        queue.add(origin);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            int d = distances.get(current);
            if (d == limit) {
                continue;
            }
            for (var n : current.neighbors()) {
                if (!distances.containsKey(n)) {
                    distances.put(n, d + 1);
                    queue.add(n);
                }
            }
        }
        return distances;
    }

    @Test
    void testDistanceMatchesGraphDistance() {
        for (var origin : List.of(TriangularCoordinate.of(0, 0), TriangularCoordinate.of(1, 0),
                                  TriangularCoordinate.of(-3, 2), TriangularCoordinate.of(4, -5))) {
            var distances = breadthFirst(origin, 14);
            for (int x = origin.x() - 6; x <= origin.x() + 6; x++) {
                for (int y = origin.y() - 6; y <= origin.y() + 6; y++) {
                    var target = TriangularCoordinate.of(x, y);
                    assertEquals(distances.get(target), origin.distance(target), () -> origin + " -> " + target);
                }
            }
        }
    }

    @Test
    void testOrientationAndAdjacency() {
        var up = TriangularCoordinate.of(0, 0);
        var down = TriangularCoordinate.of(1, 0);
        assertTrue(up.isUpPointing());
        assertFalse(down.isUpPointing());
        assertEquals(List.of(TriangularCoordinate.of(-1, 0), TriangularCoordinate.of(1, 0),
                             TriangularCoordinate.of(0, -1)), up.neighbors());
        assertEquals(TriangularCoordinate.of(1, 1), down.neighbors().get(2));
    }

    @Test
    void testPixelLocatesContainingTriangle() {
        var layout = TriangularLayout.EDGE_CONNECTED;
        double size = 10.0;
        for (int x = -3; x <= 3; x++) {
            for (int y = -3; y <= 3; y++) {
                var c = TriangularCoordinate.of(x, y);
                var vertices = layout.vertices(c, size);
                var center = c.toPixel(size);
                // points pulled from the center toward each vertex stay inside the triangle
                for (var v : vertices) {
                    var inside = new Pixel(center.x() + 0.8 * (v.x() - center.x()),
                                           center.y() + 0.8 * (v.y() - center.y()));
                    assertEquals(c, layout.fromPixel(inside, size));
                }
            }
        }
    }
}
