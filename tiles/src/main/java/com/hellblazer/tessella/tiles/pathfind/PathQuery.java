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
import com.hellblazer.tessella.tiles.grid.ReadableGrid;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Predicate;

/**
 * An immutable path search request. Accessibility and step cost are supplied per query, so one world may be searched
 * under different movement rules concurrently.
 *
 * @param <C> coordinate type
 * @author hal.hildebrand
 */
public final class PathQuery<C extends Coordinate<C>> {

    private final Predicate<? super C> accessible;
    private final EdgeCost<? super C>  cost;
    private final Set<C>               goals;
    private final ReadableGrid<C, ?>   grid;
    private final OptionalLong         maxCost;
    private final int                  minimumStepCost;
    private final C                    start;

    private PathQuery(Builder<C> builder) {
        this.start = builder.start;
        this.goals = Set.copyOf(builder.goals);
        this.accessible = builder.accessible;
        this.cost = builder.cost;
        this.minimumStepCost = builder.minimumStepCost;
        this.maxCost = builder.maxCost;
        this.grid = builder.grid;
    }

    public static <C extends Coordinate<C>> Builder<C> from(C start) {
        return new Builder<>(start);
    }

    public Predicate<? super C> accessible() {
        return accessible;
    }

    public EdgeCost<? super C> cost() {
        return cost;
    }

    public Set<C> goals() {
        return goals;
    }

    /**
     * The grid whose bounds confine the search, if any.
     */
    public Optional<ReadableGrid<C, ?>> grid() {
        return Optional.ofNullable(grid);
    }

    public OptionalLong maxCost() {
        return maxCost;
    }

    public int minimumStepCost() {
        return minimumStepCost;
    }

    public C start() {
        return start;
    }

    @Override
    public String toString() {
        return "PathQuery[" + start + " -> " + goals + (maxCost.isPresent() ? ", max " + maxCost.getAsLong() : "")
        + "]";
    }

    public static class Builder<C extends Coordinate<C>> {
        private final Set<C>               goals           = new LinkedHashSet<>();
        private final C                    start;
        private       Predicate<? super C> accessible      = c -> true;
        private       EdgeCost<? super C>  cost            = EdgeCost.uniform();
        private       ReadableGrid<C, ?>   grid;
        private       OptionalLong         maxCost         = OptionalLong.empty();
        private       int                  minimumStepCost = 1;

        private Builder(C start) {
            this.start = Objects.requireNonNull(start, "start");
        }

        public Builder<C> accessible(Predicate<? super C> accessible) {
            this.accessible = Objects.requireNonNull(accessible, "accessible");
            return this;
        }

        public PathQuery<C> build() {
            if (goals.isEmpty()) {
                throw new InvalidConfigurationException("Path query requires at least one goal");
            }
            for (var goal : goals) {
                start.system().requireSame(goal);
            }
            return new PathQuery<>(this);
        }

        public Builder<C> cost(EdgeCost<? super C> cost) {
            this.cost = Objects.requireNonNull(cost, "cost");
            return this;
        }

        public Builder<C> goal(C goal) {
            goals.add(Objects.requireNonNull(goal, "goal"));
            return this;
        }

        public Builder<C> goals(Collection<? extends C> goals) {
            goals.forEach(this::goal);
            return this;
        }

        /**
         * Give up once every remaining route would cost more than the ceiling.
         */
        public Builder<C> maxCost(long ceiling) {
            if (ceiling < 0) {
                throw new InvalidConfigurationException("Maximum cost must be non-negative: " + ceiling);
            }
            this.maxCost = OptionalLong.of(ceiling);
            return this;
        }

        /**
         * Declare the cheapest possible step. Scales the distance heuristic; every edge cost must be at least this.
         */
        public Builder<C> minimumStepCost(int minimumStepCost) {
            if (minimumStepCost <= 0) {
                throw new InvalidConfigurationException("Minimum step cost must be positive: " + minimumStepCost);
            }
            this.minimumStepCost = minimumStepCost;
            return this;
        }

        /**
         * Confine the search to the bounds of the grid. Start and goals must lie inside it.
         */
        public Builder<C> within(ReadableGrid<C, ?> grid) {
            this.grid = Objects.requireNonNull(grid, "grid");
            return this;
        }
    }
}
