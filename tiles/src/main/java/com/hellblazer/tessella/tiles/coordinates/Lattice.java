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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Neighborhood enumeration shared by the algorithms. Every supported metric is the step metric of its adjacency
 * graph, so breadth first layers are exactly the distance rings.
 *
 * @author hal.hildebrand
 */
public final class Lattice {

    private Lattice() {
    }

    /**
     * Every coordinate within the radius, nearest first, with neighbor order deciding the order inside a ring.
     */
    public static <C extends Coordinate<C>> List<C> ball(C origin, int radius) {
        var ball = new ArrayList<C>();
        rings(origin, radius).forEach(ball::addAll);
        return ball;
    }

    /**
     * The rings of coordinates at distance 0 through radius from the origin. Ring k is element k.
     */
    public static <C extends Coordinate<C>> List<List<C>> rings(C origin, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative: " + radius);
        }
        var rings = new ArrayList<List<C>>(radius + 1);
        var seen = new HashSet<C>();
        List<C> current = List.of(origin);
        seen.add(origin);
        rings.add(current);
        for (int k = 1; k <= radius; k++) {
            var next = new ArrayList<C>();
            for (var c : current) {
                for (var n : c.neighbors()) {
                    if (seen.add(n)) {
                        next.add(n);
                    }
                }
            }
            rings.add(next);
            current = next;
        }
        return rings;
    }
}
