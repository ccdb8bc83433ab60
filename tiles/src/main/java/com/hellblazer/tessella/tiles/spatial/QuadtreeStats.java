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
package com.hellblazer.tessella.tiles.spatial;

/**
 * Structural statistics of a {@link Quadtree}.
 *
 * @param fillRatio entities divided by the total leaf capacity
 * @author hal.hildebrand
 */
public record QuadtreeStats(int totalNodes, int leafNodes, int internalNodes, int emptyLeaves, int maxDepth,
                            int totalEntities, int maxEntitiesPerLeaf, double averageEntitiesPerLeaf,
                            double fillRatio) {

    @Override
    public String toString() {
        return String.format("QuadtreeStats[nodes=%d (leaves=%d, internal=%d, empty=%d), depth=%d, entities=%d, "
                             + "max/leaf=%d, avg/leaf=%.2f, fill=%.2f]", totalNodes, leafNodes, internalNodes,
                             emptyLeaves, maxDepth, totalEntities, maxEntitiesPerLeaf, averageEntitiesPerLeaf,
                             fillRatio);
    }
}
