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

import com.hellblazer.tessella.tiles.coordinates.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Digital lines on any lattice. Each step moves to a neighbor one unit closer to the target, choosing the neighbor
 * whose world space center lies nearest the ideal segment, with ties going to neighbor order. On a square lattice
 * this reproduces Bresenham's line; the same rule works unchanged for hexes and triangles.
 * <p>
 * Lines are not guaranteed symmetric: the line from a to b may differ from the reverse of the line from b to a.
 *
 * @author hal.hildebrand
 */
public final class LineTracer {
    private static final double EPSILON = 1e-9;

    private LineTracer() {
    }

    /**
     * True iff no coordinate strictly between origin and target blocks sight. The endpoints are never tested.
     */
    public static <C extends Coordinate<C>> boolean lineOfSight(C origin, C target, Predicate<? super C> blocking) {
        var line = trace(origin, target);
        for (int i = 1; i < line.size() - 1; i++) {
            if (blocking.test(line.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * The line from origin to target inclusive; its length is the lattice distance plus one.
     */
    public static <C extends Coordinate<C>> List<C> trace(C origin, C target) {
        origin.system().requireSame(target);
        int distance = origin.distance(target);
        var line = new ArrayList<C>(distance + 1);
        var from = origin.toPixel(1.0);
        var to = target.toPixel(1.0);
        var current = origin;
        line.add(current);
        while (distance > 0) {
            C best = null;
            double bestOffset = Double.MAX_VALUE;
            for (var neighbor : current.neighbors()) {
                if (neighbor.distance(target) != distance - 1) {
                    continue;
                }
                double offset = neighbor.toPixel(1.0).distanceToLine(from, to);
                if (offset < bestOffset - EPSILON) {
                    best = neighbor;
                    bestOffset = offset;
                }
            }
            if (best == null) {
                throw new IllegalStateException("No neighbor of " + current + " approaches " + target);
            }
            current = best;
            line.add(current);
            distance--;
        }
        return line;
    }
}
