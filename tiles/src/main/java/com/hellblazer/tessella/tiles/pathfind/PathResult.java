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

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a path search. Failing to find a path is an ordinary outcome and is reported as a {@link Failure}
 * value rather than an exception.
 *
 * @param <C> coordinate type
 * @author hal.hildebrand
 */
public sealed interface PathResult<C> permits PathResult.Found, PathResult.Failure {

    /**
     * Nodes expanded by the search, for diagnostics.
     */
    int expandedNodes();

    default boolean isFound() {
        return status() == PathStatus.FOUND;
    }

    default Optional<List<C>> pathIfFound() {
        return this instanceof Found<C> found ? Optional.of(found.path()) : Optional.empty();
    }

    PathStatus status();

    /**
     * A path from start to goal inclusive. Consecutive coordinates are adjacent and the step costs sum to
     * {@code totalCost}.
     */
    record Found<C>(List<C> path, long totalCost, int expandedNodes) implements PathResult<C> {
        public Found {
            path = List.copyOf(path);
        }

        public C goal() {
            return path.get(path.size() - 1);
        }

        public C start() {
            return path.get(0);
        }

        @Override
        public PathStatus status() {
            return PathStatus.FOUND;
        }
    }

    record Failure<C>(PathStatus status, int expandedNodes) implements PathResult<C> {
        public Failure {
            if (status == PathStatus.FOUND) {
                throw new IllegalArgumentException("Failure cannot carry status FOUND");
            }
        }
    }
}
