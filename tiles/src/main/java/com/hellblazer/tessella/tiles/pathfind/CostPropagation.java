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

import com.hellblazer.tessella.tiles.InvalidConfigurationException;
import com.hellblazer.tessella.tiles.coordinates.Coordinate;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * Best-first cost propagation over a coordinate lattice: pop the cheapest frontier entry, relax its neighbors, record
 * predecessors. With a zero heuristic this is multi-source Dijkstra; with an admissible heuristic and a stopping
 * predicate it is A*.
 * <p>
 * Frontier entries are ordered by priority, and among equal priorities the most recently discovered entry pops first.
 * Stale entries are discarded lazily when popped. One instance performs one search.
 * <p>
 * Thread Safety: not thread safe; confined to the calling thread.
 *
 * @param <C> coordinate type
 * @author hal.hildebrand
 */
public final class CostPropagation<C extends Coordinate<C>> {

    private static final Comparator<Entry<?>> FRONTIER_ORDER = Comparator.<Entry<?>>comparingLong(e -> e.priority())
                                                                         .thenComparing(e -> e.sequence(),
                                                                                        Comparator.reverseOrder());
    private final Map<C, Long>               costs        = new HashMap<>();
    private final PriorityQueue<Entry<C>>    frontier     = new PriorityQueue<>(FRONTIER_ORDER);
    private final ToLongFunction<C>          heuristic;
    private final int                        minimumStepCost;
    private final Map<C, C>                  predecessors = new HashMap<>();
    private final StepCost<C>                stepCost;
    private final Predicate<? super C>       traversable;
    private       int                        expanded;
    private       long                       sequence;

    /**
     * @param traversable     whether a neighbor may be entered
     * @param stepCost        cost of moving the propagation front from the current coordinate to a neighbor
     * @param minimumStepCost lower bound every step cost must respect
     * @param heuristic       admissible estimate of the remaining cost, zero for Dijkstra
     */
    public CostPropagation(Predicate<? super C> traversable, StepCost<C> stepCost, int minimumStepCost,
                           ToLongFunction<C> heuristic) {
        if (minimumStepCost <= 0) {
            throw new InvalidConfigurationException("Minimum step cost must be positive: " + minimumStepCost);
        }
        this.traversable = traversable;
        this.stepCost = stepCost;
        this.minimumStepCost = minimumStepCost;
        this.heuristic = heuristic;
    }

    /**
     * @return the best known cost of the coordinate, if it has been reached
     */
    public Optional<Long> costOf(C coordinate) {
        return Optional.ofNullable(costs.get(coordinate));
    }

    /**
     * Live view of the best known costs.
     */
    public Map<C, Long> costs() {
        return costs;
    }

    public int expandedNodes() {
        return expanded;
    }

    /**
     * Live view of the predecessor links, pointing from each reached coordinate toward the seed it was reached from.
     */
    public Map<C, C> predecessors() {
        return predecessors;
    }

    /**
     * Run until the frontier is exhausted, a popped coordinate satisfies the stopping predicate, or the cheapest
     * frontier priority exceeds the ceiling.
     */
    public Outcome<C> run(Predicate<? super C> stop, long ceiling) {
        while (!frontier.isEmpty()) {
            var entry = frontier.poll();
            if (entry.cost() > costs.get(entry.coordinate())) {
                continue;
            }
            if (entry.priority() > ceiling) {
                return new Outcome<>(Termination.CEILING, null);
            }
            if (stop.test(entry.coordinate())) {
                return new Outcome<>(Termination.REACHED, entry.coordinate());
            }
            expanded++;
            for (var neighbor : entry.coordinate().neighbors()) {
                if (!traversable.test(neighbor)) {
                    continue;
                }
                long step = stepCost.cost(entry.coordinate(), neighbor);
                if (step <= 0 || step < minimumStepCost) {
                    throw new InvalidConfigurationException(
                    "Edge cost " + step + " from " + entry.coordinate() + " to " + neighbor
                    + " is below the minimum step cost " + minimumStepCost);
                }
                long candidate = entry.cost() + step;
                var known = costs.get(neighbor);
                if (known == null || candidate < known) {
                    costs.put(neighbor, candidate);
                    predecessors.put(neighbor, entry.coordinate());
                    push(neighbor, candidate);
                }
            }
        }
        return new Outcome<>(Termination.EXHAUSTED, null);
    }

    /**
     * Add a source at the given cost.
     */
    public void seed(C coordinate, long cost) {
        var known = costs.get(coordinate);
        if (known != null && known <= cost) {
            return;
        }
        costs.put(coordinate, cost);
        predecessors.remove(coordinate);
        push(coordinate, cost);
    }

    private void push(C coordinate, long cost) {
        frontier.add(new Entry<>(coordinate, cost, cost + heuristic.applyAsLong(coordinate), sequence++));
    }

    public enum Termination {
        /** The cheapest frontier priority exceeded the ceiling. */
        CEILING,
        /** Every reachable coordinate was settled. */
        EXHAUSTED,
        /** A coordinate satisfying the stopping predicate was settled. */
        REACHED;
    }

    @FunctionalInterface
    public interface StepCost<C> {
        long cost(C current, C neighbor);
    }

    /**
     * @param reached the settled coordinate that satisfied the stopping predicate, null for other terminations
     */
    public record Outcome<C>(Termination termination, C reached) {
    }

    private record Entry<C>(C coordinate, long cost, long priority, long sequence) {
    }
}
