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
package com.hellblazer.tessella.tiles.pathfind;

import com.hellblazer.tessella.tiles.coordinates.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * A* search over any coordinate lattice.
 * <p>
 * The heuristic is the lattice distance to the nearest goal scaled by the query's minimum step cost, which is
 * admissible and consistent for every supported topology, so the first goal settled is reached by an optimal path.
 * Among frontier entries of equal priority the most recently discovered is expanded first, which makes results
 * deterministic for a given neighbor order.
 * <p>
 * The start coordinate is always occupiable; every other coordinate on the path must satisfy the query's
 * accessibility predicate and, when the query is confined to a grid, lie inside its bounds.
 * <p>
 * Thread Safety: stateless; concurrent searches are safe provided the query's predicates are.
 *
 * @author hal.hildebrand
 */
public class Pathfinder {
    private static final Logger log = LoggerFactory.getLogger(Pathfinder.class);

    private static <C> List<C> reconstruct(C goal, Map<C, C> predecessors) {
        var path = new ArrayList<C>();
        for (C current = goal; current != null; current = predecessors.get(current)) {
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * @throws com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException if the query is confined to a grid and the
     *                                                                      start or a goal lies outside it
     * @throws com.hellblazer.tessella.tiles.InvalidConfigurationException  if an edge cost is not positive or is
     *                                                                      below the query's minimum step cost
     */
    public <C extends Coordinate<C>> PathResult<C> find(PathQuery<C> query) {
        var start = query.start();
        var grid = query.grid();
        grid.ifPresent(g -> {
            g.requireContains(start);
            query.goals().forEach(g::requireContains);
        });

        if (query.goals().contains(start)) {
            return new PathResult.Found<>(List.of(start), 0, 0);
        }

        var goals = new HashSet<C>();
        for (var goal : query.goals()) {
            if (query.accessible().test(goal)) {
                goals.add(goal);
            }
        }
        if (goals.isEmpty()) {
            log.debug("No accessible goal for {}", query);
            return new PathResult.Failure<>(PathStatus.NO_PATH_EXISTS, 0);
        }

        Predicate<C> accessible = query.accessible()::test;
        Predicate<C> traversable = grid.<Predicate<C>>map(g -> c -> g.contains(c) && accessible.test(c))
                                       .orElse(accessible);
        int minimumStepCost = query.minimumStepCost();
        var cost = query.cost();
        var propagation = new CostPropagation<C>(traversable, cost::cost, minimumStepCost,
                                                 c -> heuristic(c, goals, minimumStepCost));
        propagation.seed(start, 0);
        var outcome = propagation.run(goals::contains, query.maxCost().orElse(Long.MAX_VALUE));

        PathResult<C> result = switch (outcome.termination()) {
            case REACHED -> {
                var goal = outcome.reached();
                yield new PathResult.Found<>(reconstruct(goal, propagation.predecessors()),
                                             propagation.costs().get(goal), propagation.expandedNodes());
            }
            case CEILING -> new PathResult.Failure<>(PathStatus.SEARCH_LIMIT_EXCEEDED, propagation.expandedNodes());
            case EXHAUSTED -> new PathResult.Failure<>(PathStatus.NO_PATH_EXISTS, propagation.expandedNodes());
        };
        log.debug("{}: {} after expanding {} nodes", query, result.status(), result.expandedNodes());
        return result;
    }

    private <C extends Coordinate<C>> long heuristic(C coordinate, Iterable<C> goals, int minimumStepCost) {
        long best = Long.MAX_VALUE;
        for (var goal : goals) {
            best = Math.min(best, coordinate.distance(goal));
        }
        return best * minimumStepCost;
    }
}
