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

import com.hellblazer.tessella.tiles.InvalidConfigurationException;
import com.hellblazer.tessella.tiles.coordinates.Coordinate;
import com.hellblazer.tessella.tiles.grid.ReadableGrid;
import com.hellblazer.tessella.tiles.pathfind.CostPropagation;
import com.hellblazer.tessella.tiles.pathfind.EdgeCost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.function.Predicate;

/**
 * Builds {@link FlowField}s by multi-source Dijkstra integration from the goals followed by a descent pass.
 * <p>
 * Integration runs backward: a coordinate's cost is the cheapest cost of walking from it to a goal, so when the
 * front expands from a coordinate into its neighbor the weight used is the cost of stepping from the neighbor onto
 * the coordinate. The descent pass points every reachable non-goal coordinate at its in-bounds neighbor with the
 * strictly lowest integration cost, ties going to neighbor order.
 * <p>
 * Thread Safety: stateless; {@link #buildAll} computes independent goal groups concurrently and requires the grid
 * and predicates to be safe for concurrent reads, e.g. a {@link com.hellblazer.tessella.tiles.grid.Grid#snapshot()}.
 *
 * @author hal.hildebrand
 */
public class FlowFieldCalculator {
    private static final Logger log = LoggerFactory.getLogger(FlowFieldCalculator.class);

    private final int parallelism;

    public FlowFieldCalculator() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public FlowFieldCalculator(int parallelism) {
        if (parallelism <= 0) {
            throw new InvalidConfigurationException("Parallelism must be positive: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    public <C extends Coordinate<C>> FlowField<C> build(ReadableGrid<C, ?> grid, Collection<? extends C> goals,
                                                        Predicate<? super C> accessible,
                                                        EdgeCost<? super C> cost) {
        return build(grid, goals, accessible, cost, Long.MAX_VALUE - 1);
    }

    /**
     * @param maxIntegrationCost coordinates whose integration cost would exceed this are left unreachable
     * @throws InvalidConfigurationException if there are no goals or an edge cost is not positive
     * @throws com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException if a goal is outside the grid
     */
    public <C extends Coordinate<C>> FlowField<C> build(ReadableGrid<C, ?> grid, Collection<? extends C> goals,
                                                        Predicate<? super C> accessible, EdgeCost<? super C> cost,
                                                        long maxIntegrationCost) {
        if (goals.isEmpty()) {
            throw new InvalidConfigurationException("Flow field requires at least one goal");
        }
        var goalSet = new LinkedHashSet<C>();
        for (var goal : goals) {
            goalSet.add(grid.requireContains(goal));
        }
        var system = grid.system();
        var bounds = grid.bounds();

        Predicate<C> traversable = c -> grid.contains(c) && accessible.test(c);
        var propagation = new CostPropagation<C>(traversable, (current, neighbor) -> cost.cost(neighbor, current), 1,
                                                 c -> 0L);
        for (var goal : goalSet) {
            propagation.seed(goal, 0);
        }
        propagation.run(c -> false, maxIntegrationCost);

        long[] costs = new long[bounds.cellCount()];
        Arrays.fill(costs, FlowField.UNREACHABLE);
        propagation.costs().forEach((c, integration) -> {
            if (integration <= maxIntegrationCost) {
                costs[bounds.index(system.column(c), system.row(c))] = integration;
            }
        });

        int[] directions = new int[costs.length];
        Arrays.fill(directions, -1);
        for (int i = 0; i < costs.length; i++) {
            if (costs[i] == FlowField.UNREACHABLE || costs[i] == 0) {
                continue;
            }
            var c = system.at(bounds.columnOf(i), bounds.rowOf(i));
            if (goalSet.contains(c)) {
                continue;
            }
            long best = costs[i];
            var neighbors = c.neighbors();
            for (int n = 0; n < neighbors.size(); n++) {
                var neighbor = neighbors.get(n);
                if (!grid.contains(neighbor)) {
                    continue;
                }
                long neighborCost = costs[bounds.index(system.column(neighbor), system.row(neighbor))];
                if (neighborCost < best) {
                    best = neighborCost;
                    directions[i] = n;
                }
            }
        }
        log.debug("Flow field over {} toward {} goals: {} coordinates settled, {} expanded", bounds, goalSet.size(),
                  propagation.costs().size(), propagation.expandedNodes());
        return new FlowField<>(grid, goalSet, costs, directions);
    }

    /**
     * Build one flow field per goal group concurrently.
     *
     * @return the fields, in goal group order
     * @throws InterruptedException if interrupted while waiting for the fields
     */
    public <C extends Coordinate<C>> List<FlowField<C>> buildAll(ReadableGrid<C, ?> grid,
                                                                 List<? extends Collection<? extends C>> goalGroups,
                                                                 Predicate<? super C> accessible,
                                                                 EdgeCost<? super C> cost)
    throws InterruptedException {
        var pool = new ForkJoinPool(parallelism);
        try {
            var futures = new ArrayList<Future<FlowField<C>>>(goalGroups.size());
            for (var goals : goalGroups) {
                futures.add(pool.submit(() -> build(grid, goals, accessible, cost)));
            }
            var fields = new ArrayList<FlowField<C>>(futures.size());
            for (var future : futures) {
                try {
                    fields.add(future.get());
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    throw new IllegalStateException("Flow field computation failed", e.getCause());
                }
            }
            return fields;
        } finally {
            pool.shutdown();
        }
    }

    public int parallelism() {
        return parallelism;
    }
}
