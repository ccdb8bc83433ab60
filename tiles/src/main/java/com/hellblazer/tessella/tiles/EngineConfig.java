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
package com.hellblazer.tessella.tiles;

import com.hellblazer.tessella.tiles.spatial.Quadtree;
import com.hellblazer.tessella.tiles.visibility.FovAlgorithm;
import com.hellblazer.tessella.tiles.visibility.MixingRule;

import java.util.Objects;

/**
 * Tunables of a {@link TileEngine}, set fluently.
 *
 * @author hal.hildebrand
 */
public class EngineConfig {

    private FovAlgorithm fovAlgorithm            = FovAlgorithm.SHADOWCASTING;
    private long         maxPathCost             = Long.MAX_VALUE;
    private int          minimumStepCost         = 1;
    private MixingRule   mixingRule              = MixingRule.ADDITIVE;
    private int          parallelism             = Runtime.getRuntime().availableProcessors();
    private int          quadtreeCapacity        = Quadtree.DEFAULT_CAPACITY;
    private int          quadtreeMaxDepth        = Quadtree.DEFAULT_MAX_DEPTH;
    private int          quadtreeMergeThreshold  = Quadtree.DEFAULT_MERGE_THRESHOLD;
    private double       tileSize                = 1.0;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Small leaves and eager merging, for dense crowds of entities in a small world.
     */
    public static EngineConfig fineGrained() {
        return new EngineConfig().withQuadtreeCapacity(4).withQuadtreeMergeThreshold(2);
    }

    /**
     * Coarse leaves and a bounded path search, for large worlds where an unbounded search could scan the map.
     */
    public static EngineConfig largeWorld() {
        return new EngineConfig().withQuadtreeCapacity(32)
                                 .withQuadtreeMergeThreshold(12)
                                 .withMaxPathCost(100_000);
    }

    public FovAlgorithm getFovAlgorithm() {
        return fovAlgorithm;
    }

    /**
     * Default ceiling on path cost; {@link Long#MAX_VALUE} when unbounded.
     */
    public long getMaxPathCost() {
        return maxPathCost;
    }

    public int getMinimumStepCost() {
        return minimumStepCost;
    }

    public MixingRule getMixingRule() {
        return mixingRule;
    }

    /**
     * Threads used when building several flow fields at once.
     */
    public int getParallelism() {
        return parallelism;
    }

    public int getQuadtreeCapacity() {
        return quadtreeCapacity;
    }

    public int getQuadtreeMaxDepth() {
        return quadtreeMaxDepth;
    }

    public int getQuadtreeMergeThreshold() {
        return quadtreeMergeThreshold;
    }

    /**
     * World space size of a tile, used for pixel conversions and spatial index bounds.
     */
    public double getTileSize() {
        return tileSize;
    }

    @Override
    public String toString() {
        return "EngineConfig[tile=" + tileSize + ", fov=" + fovAlgorithm + ", quadtree=" + quadtreeCapacity + "/"
        + quadtreeMergeThreshold + "/" + quadtreeMaxDepth + ", maxPathCost=" + maxPathCost + ", mixing=" + mixingRule
        + ", parallelism=" + parallelism + "]";
    }

    public EngineConfig withFovAlgorithm(FovAlgorithm algorithm) {
        this.fovAlgorithm = Objects.requireNonNull(algorithm, "algorithm");
        return this;
    }

    public EngineConfig withMaxPathCost(long ceiling) {
        if (ceiling < 0) {
            throw new InvalidConfigurationException("Max path cost must be non-negative");
        }
        this.maxPathCost = ceiling;
        return this;
    }

    public EngineConfig withMinimumStepCost(int cost) {
        if (cost <= 0) {
            throw new InvalidConfigurationException("Minimum step cost must be positive");
        }
        this.minimumStepCost = cost;
        return this;
    }

    public EngineConfig withMixingRule(MixingRule rule) {
        this.mixingRule = Objects.requireNonNull(rule, "rule");
        return this;
    }

    public EngineConfig withParallelism(int threads) {
        if (threads <= 0) {
            throw new InvalidConfigurationException("Parallelism must be positive");
        }
        this.parallelism = threads;
        return this;
    }

    public EngineConfig withQuadtreeCapacity(int capacity) {
        if (capacity <= 0) {
            throw new InvalidConfigurationException("Quadtree capacity must be positive");
        }
        this.quadtreeCapacity = capacity;
        return this;
    }

    public EngineConfig withQuadtreeMaxDepth(int depth) {
        if (depth < 0 || depth > Quadtree.DEFAULT_MAX_DEPTH) {
            throw new InvalidConfigurationException(
            "Quadtree max depth must be within [0, " + Quadtree.DEFAULT_MAX_DEPTH + "]");
        }
        this.quadtreeMaxDepth = depth;
        return this;
    }

    public EngineConfig withQuadtreeMergeThreshold(int threshold) {
        if (threshold < 0) {
            throw new InvalidConfigurationException("Quadtree merge threshold must be non-negative");
        }
        this.quadtreeMergeThreshold = threshold;
        return this;
    }

    public EngineConfig withTileSize(double size) {
        if (!(size > 0.0)) {
            throw new InvalidConfigurationException("Tile size must be positive");
        }
        this.tileSize = size;
        return this;
    }
}
