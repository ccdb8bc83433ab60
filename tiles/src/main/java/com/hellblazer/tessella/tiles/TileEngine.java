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

import com.hellblazer.tessella.geometry.Pixel;
import com.hellblazer.tessella.geometry.Rectangle;
import com.hellblazer.tessella.tiles.coordinates.Coordinate;
import com.hellblazer.tessella.tiles.flowfield.FlowField;
import com.hellblazer.tessella.tiles.flowfield.FlowFieldCalculator;
import com.hellblazer.tessella.tiles.grid.ReadableGrid;
import com.hellblazer.tessella.tiles.pathfind.EdgeCost;
import com.hellblazer.tessella.tiles.pathfind.PathQuery;
import com.hellblazer.tessella.tiles.pathfind.PathResult;
import com.hellblazer.tessella.tiles.pathfind.Pathfinder;
import com.hellblazer.tessella.tiles.spatial.Quadtree;
import com.hellblazer.tessella.tiles.spatial.entity.EntityID;
import com.hellblazer.tessella.tiles.spatial.entity.EntityIDGenerator;
import com.hellblazer.tessella.tiles.spatial.entity.LongEntityID;
import com.hellblazer.tessella.tiles.spatial.entity.SequentialLongIDGenerator;
import com.hellblazer.tessella.tiles.visibility.LightMap;
import com.hellblazer.tessella.tiles.visibility.LightSource;
import com.hellblazer.tessella.tiles.visibility.LightingCalculator;
import com.hellblazer.tessella.tiles.visibility.VisibilityCalculator;
import com.hellblazer.tessella.tiles.visibility.VisibilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Binds a grid, the caller's {@link WorldQuery} and an {@link EngineConfig}, exposing pathfinding, visibility,
 * lighting, flow fields and spatial indexing over that world. Every computation is confined to the grid's bounds.
 * <p>
 * Thread Safety: the engine holds no mutable state of its own; concurrent calls are safe when the grid and world
 * query are safe for concurrent reads.
 *
 * @param <C> coordinate type
 * @param <T> tile value type
 * @author hal.hildebrand
 */
public class TileEngine<C extends Coordinate<C>, T> {
    private static final Logger log = LoggerFactory.getLogger(TileEngine.class);

    private final EngineConfig         config;
    private final FlowFieldCalculator  flowFields;
    private final ReadableGrid<C, T>   grid;
    private final LightingCalculator   lighting;
    private final Pathfinder           pathfinder = new Pathfinder();
    private final VisibilityCalculator visibility;
    private final WorldQuery<C>        world;
    private final Rectangle            worldBounds;

    public TileEngine(ReadableGrid<C, T> grid, WorldQuery<C> world) {
        this(grid, world, EngineConfig.defaults());
    }

    public TileEngine(ReadableGrid<C, T> grid, WorldQuery<C> world, EngineConfig config) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.world = Objects.requireNonNull(world, "world");
        this.config = Objects.requireNonNull(config, "config");
        if (config.getQuadtreeMergeThreshold() > config.getQuadtreeCapacity()) {
            throw new InvalidConfigurationException(
            "Quadtree merge threshold " + config.getQuadtreeMergeThreshold() + " exceeds capacity "
            + config.getQuadtreeCapacity());
        }
        this.visibility = new VisibilityCalculator(config.getFovAlgorithm());
        this.lighting = new LightingCalculator(visibility, config.getMixingRule());
        this.flowFields = new FlowFieldCalculator(config.getParallelism());
        this.worldBounds = computeWorldBounds();
        log.debug("Engine over {} {} with {}", grid.system(), grid.bounds(), config);
    }

    public FlowField<C> buildFlowField(Collection<? extends C> goals) {
        return flowFields.build(grid, goals, world.accessible(), world.movementCost());
    }

    public FlowField<C> buildFlowField(Collection<? extends C> goals, EdgeCost<? super C> cost) {
        return flowFields.build(grid, goals, world.accessible(), cost);
    }

    /**
     * @throws InterruptedException if interrupted while waiting for the fields
     */
    public List<FlowField<C>> buildFlowFields(List<? extends Collection<? extends C>> goalGroups)
    throws InterruptedException {
        return flowFields.buildAll(grid, goalGroups, world.accessible(), world.movementCost());
    }

    public EngineConfig config() {
        return config;
    }

    public C fromPixel(Pixel pixel) {
        return grid.system().fromPixel(pixel, config.getTileSize());
    }

    public ReadableGrid<C, T> grid() {
        return grid;
    }

    public LightMap<C> illuminate(Iterable<LightSource<C>> sources) {
        return lighting.illuminate(sources, world::blocksSight, grid::contains);
    }

    public boolean lineOfSight(C origin, C target) {
        return visibility.lineOfSight(origin, target, world::blocksSight);
    }

    /**
     * A spatial index covering the world, issuing sequential long identifiers.
     */
    public Quadtree<LongEntityID> newSpatialIndex() {
        return newSpatialIndex(new SequentialLongIDGenerator());
    }

    /**
     * A spatial index covering the world, configured from the engine configuration.
     */
    public <ID extends EntityID> Quadtree<ID> newSpatialIndex(EntityIDGenerator<ID> idGenerator) {
        return new Quadtree<>(idGenerator, worldBounds, config.getQuadtreeCapacity(),
                              config.getQuadtreeMergeThreshold(), config.getQuadtreeMaxDepth());
    }

    public PathResult<C> pathfind(C start, C goal) {
        return pathfind(start, Set.of(goal));
    }

    /**
     * Search with the world's accessibility and terrain costs, confined to the grid.
     */
    public PathResult<C> pathfind(C start, Collection<? extends C> goals) {
        var query = PathQuery.from(start)
                             .goals(goals)
                             .accessible(world.accessible())
                             .cost(world.movementCost())
                             .minimumStepCost(config.getMinimumStepCost())
                             .within(grid);
        if (config.getMaxPathCost() != Long.MAX_VALUE) {
            query.maxCost(config.getMaxPathCost());
        }
        return pathfinder.find(query.build());
    }

    public PathResult<C> pathfind(PathQuery<C> query) {
        return pathfinder.find(query);
    }

    public Pixel toPixel(C coordinate) {
        return coordinate.toPixel(config.getTileSize());
    }

    public VisibilityResult<C> visibleSet(C origin, int radius) {
        return visibleSet(origin, radius, world::blocksSight);
    }

    public VisibilityResult<C> visibleSet(C origin, int radius, Predicate<? super C> blocking) {
        grid.requireContains(origin);
        return visibility.visibleSet(origin, radius, blocking, config.getFovAlgorithm(), grid::contains);
    }

    public WorldQuery<C> world() {
        return world;
    }

    /**
     * World space rectangle enclosing every tile of the grid.
     */
    public Rectangle worldBounds() {
        return worldBounds;
    }

    private Rectangle computeWorldBounds() {
        double tileSize = config.getTileSize();
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (var c : grid.coordinates()) {
            var p = c.toPixel(tileSize);
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x());
            maxY = Math.max(maxY, p.y());
        }
        return new Rectangle(minX - tileSize, minY - tileSize, maxX + tileSize, maxY + tileSize);
    }
}
