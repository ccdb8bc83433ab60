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
package com.hellblazer.tessella.tiles.flowfield;

import com.hellblazer.tessella.tiles.coordinates.Coordinate;
import com.hellblazer.tessella.tiles.grid.GridBounds;
import com.hellblazer.tessella.tiles.grid.ReadableGrid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-coordinate integration costs toward a goal set and the direction of steepest descent, shared by any number of
 * agents. Following directions from a reachable coordinate strictly decreases integration cost until a goal is
 * reached, so paths never cycle.
 * <p>
 * Immutable and thread safe.
 *
 * @param <C> coordinate type
 * @author hal.hildebrand
 */
public final class FlowField<C extends Coordinate<C>> {
    /**
     * Integration cost of coordinates from which no goal can be reached.
     */
    public static final long UNREACHABLE = Long.MAX_VALUE;

    private static final int CONVERGENCE_INFLOW = 3;

    private final long[]             costs;
    private final int[]              directions;
    private final ReadableGrid<C, ?> grid;
    private final Set<C>             goals;

    FlowField(ReadableGrid<C, ?> grid, Set<C> goals, long[] costs, int[] directions) {
        this.grid = grid;
        this.goals = Set.copyOf(goals);
        this.costs = costs;
        this.directions = directions;
    }

    public FlowFieldAnalysis<C> analyze() {
        var bounds = bounds();
        int[] inflow = new int[costs.length];
        int reachable = 0;
        long max = 0;
        double total = 0;
        for (int i = 0; i < costs.length; i++) {
            if (costs[i] == UNREACHABLE) {
                continue;
            }
            reachable++;
            total += costs[i];
            max = Math.max(max, costs[i]);
            var next = step(i);
            if (next != null) {
                inflow[bounds.index(grid.system().column(next), grid.system().row(next))]++;
            }
        }
        var convergence = new ArrayList<C>();
        for (int i = 0; i < inflow.length; i++) {
            if (inflow[i] >= CONVERGENCE_INFLOW) {
                convergence.add(coordinateAt(i));
            }
        }
        return new FlowFieldAnalysis<>(costs.length, reachable, costs.length - reachable, goals.size(),
                                       reachable == 0 ? 0.0 : total / reachable, max, List.copyOf(convergence));
    }

    public GridBounds bounds() {
        return grid.bounds();
    }

    /**
     * The offset to add to the coordinate to take its next step; empty for goals and unreachable coordinates.
     *
     * @throws com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException if the coordinate is outside the bounds
     */
    public Optional<C> directionAt(C coordinate) {
        return nextStep(coordinate).map(next -> next.subtract(coordinate));
    }

    /**
     * Batch form of {@link #directionAt(Coordinate)}, preserving the iteration order of the request.
     */
    public Map<C, Optional<C>> directionsAt(Collection<C> coordinates) {
        var result = new LinkedHashMap<C, Optional<C>>();
        for (var c : coordinates) {
            result.put(c, directionAt(c));
        }
        return result;
    }

    public Set<C> goals() {
        return goals;
    }

    /**
     * @return the cost of the cheapest route to the nearest goal, or {@link #UNREACHABLE}
     * @throws com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException if the coordinate is outside the bounds
     */
    public long integrationCost(C coordinate) {
        return costs[indexOf(coordinate)];
    }

    public boolean isGoal(C coordinate) {
        return goals.contains(coordinate);
    }

    public boolean isReachable(C coordinate) {
        return grid.contains(coordinate) && costs[indexOf(coordinate)] != UNREACHABLE;
    }

    /**
     * @throws com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException if the coordinate is outside the bounds
     */
    public Optional<C> nextStep(C coordinate) {
        return Optional.ofNullable(step(indexOf(coordinate)));
    }

    /**
     * The coordinates visited by following directions from the coordinate to a goal, both inclusive. Empty if the
     * coordinate is unreachable.
     */
    public List<C> pathFrom(C coordinate) {
        int index = indexOf(coordinate);
        if (costs[index] == UNREACHABLE) {
            return List.of();
        }
        var path = new ArrayList<C>();
        for (C current = coordinate; current != null; current = step(indexOf(current))) {
            path.add(current);
        }
        return path;
    }

    private C coordinateAt(int index) {
        var bounds = bounds();
        return grid.system().at(bounds.columnOf(index), bounds.rowOf(index));
    }

    private int indexOf(C coordinate) {
        grid.requireContains(coordinate);
        return bounds().index(grid.system().column(coordinate), grid.system().row(coordinate));
    }

    private C step(int index) {
        int direction = directions[index];
        return direction < 0 ? null : coordinateAt(index).neighbors().get(direction);
    }
}
