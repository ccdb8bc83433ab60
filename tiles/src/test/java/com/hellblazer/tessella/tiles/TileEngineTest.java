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
import com.hellblazer.tessella.tiles.coordinates.Connectivity;
import com.hellblazer.tessella.tiles.coordinates.HexOrientation;
import com.hellblazer.tessella.tiles.coordinates.SquareCoordinate;
import com.hellblazer.tessella.tiles.grid.Grid;
import com.hellblazer.tessella.tiles.grid.GridBounds;
import com.hellblazer.tessella.tiles.pathfind.PathResult;
import com.hellblazer.tessella.tiles.pathfind.PathStatus;
import com.hellblazer.tessella.tiles.spatial.entity.LongEntityID;
import com.hellblazer.tessella.tiles.visibility.LightSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class TileEngineTest {

    private Grid<SquareCoordinate, Character> grid;
    private WorldQuery<SquareCoordinate>      world;

    private static SquareCoordinate sq(int x, int y) {
        return SquareCoordinate.four(x, y);
    }

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        grid = Grid.filled(Connectivity.FOUR, GridBounds.of(5, 5), '.');
        world = mock(WorldQuery.class, withSettings().defaultAnswer(CALLS_REAL_METHODS));
        doReturn(false).when(world).isBlocking(any());
        doReturn(1).when(world).terrainCost(any());
        // wall across row 2 with a gap at column 4
        for (int x = 0; x < 4; x++) {
            doReturn(true).when(world).isBlocking(sq(x, 2));
        }
    }

    @Test
    void testPathfindUsesWorld() {
        var engine = new TileEngine<>(grid, world);
        var result = engine.pathfind(sq(0, 0), sq(0, 4));
        var found = assertInstanceOf(PathResult.Found.class, result);
        assertEquals(12, found.totalCost());
        assertTrue(found.path().contains(sq(4, 2)));
        verify(world, atLeastOnce()).isBlocking(sq(0, 2));
        verify(world, never()).isBlocking(sq(-1, 0));

        assertEquals(PathStatus.NO_PATH_EXISTS, engine.pathfind(sq(0, 0), sq(0, 2)).status());
        assertThrows(CoordinateOutOfBoundsException.class, () -> engine.pathfind(sq(0, 0), sq(5, 5)));
    }

    @Test
    void testConfiguredCostCeiling() {
        var engine = new TileEngine<>(grid, world, EngineConfig.defaults().withMaxPathCost(10));
        assertEquals(PathStatus.SEARCH_LIMIT_EXCEEDED, engine.pathfind(sq(0, 0), sq(0, 4)).status());
        assertTrue(engine.pathfind(sq(0, 0), List.of(sq(0, 4), sq(1, 1))).isFound());
    }

    @Test
    void testVisibilityConfinedToGrid() {
        var engine = new TileEngine<>(grid, world);
        var result = engine.visibleSet(sq(0, 0), 10);
        assertTrue(result.visible().stream().allMatch(grid::contains));
        assertTrue(result.isVisible(sq(3, 2)));
        assertTrue(result.stateOf(sq(3, 2)).orElseThrow().blocksSight());
        assertFalse(result.isVisible(sq(0, 3)));
        assertEquals(25, engine.visibleSet(sq(2, 2), 10, c -> false).size());
        assertThrows(CoordinateOutOfBoundsException.class, () -> engine.visibleSet(sq(-1, 0), 3));

        assertFalse(engine.lineOfSight(sq(0, 0), sq(0, 4)));
        assertTrue(engine.lineOfSight(sq(4, 0), sq(4, 4)));
    }

    @Test
    void testFlowFields() throws InterruptedException {
        var engine = new TileEngine<>(grid, world);
        var field = engine.buildFlowField(List.of(sq(0, 4)));
        assertEquals(12, field.integrationCost(sq(0, 0)));
        assertFalse(field.isReachable(sq(1, 2)));

        var fields = engine.buildFlowFields(List.of(List.of(sq(0, 4)), List.of(sq(0, 0))));
        assertEquals(2, fields.size());
        assertEquals(12, fields.get(1).integrationCost(sq(0, 4)));
        assertEquals(field.integrationCost(sq(3, 3)), fields.get(0).integrationCost(sq(3, 3)));
    }

    @Test
    void testIlluminationStopsAtWalls() {
        var engine = new TileEngine<>(grid, world);
        var light = engine.illuminate(List.of(LightSource.of(sq(0, 0), 5, 1.0)));
        assertEquals(0.8, light.levelAt(sq(1, 0)), 1e-9);
        assertEquals(0.0, light.levelAt(sq(0, 3)));
        assertTrue(light.illuminated().stream().allMatch(grid::contains));
    }

    @Test
    void testWorldBoundsAndPixels() {
        var engine = new TileEngine<>(grid, world, EngineConfig.defaults().withTileSize(2.0));
        assertEquals(new Rectangle(-2, -2, 10, 10), engine.worldBounds());
        assertEquals(new Pixel(6, 8), engine.toPixel(sq(3, 4)));
        assertEquals(sq(3, 4), engine.fromPixel(new Pixel(6.4, 7.7)));

        var index = engine.newSpatialIndex();
        assertEquals(engine.worldBounds(), index.bounds());
        for (var c : grid.coordinates()) {
            index.insert(new LongEntityID(c.x() * 10L + c.y()), engine.toPixel(c));
        }
        assertEquals(25, index.size());
        assertEquals(List.of(new LongEntityID(34)), index.kNearest(engine.toPixel(sq(3, 4)), 1));
        assertEquals(new LongEntityID(45), index.insert(new Pixel(0.5, 0.5)));
        assertEquals(List.of(new LongEntityID(45)), index.kNearest(new Pixel(0.4, 0.4), 1));
    }

    @Test
    void testConfigurationValidation() {
        assertThrows(InvalidConfigurationException.class,
                     () -> new TileEngine<>(grid, world, EngineConfig.defaults().withQuadtreeCapacity(4)));
        assertDoesNotThrow(() -> new TileEngine<>(grid, world, EngineConfig.fineGrained()));
    }

    @Test
    void testWorldFromGrid() {
        var hexGrid = Grid.generate(HexOrientation.POINTY, new GridBounds(-2, -2, 5, 5),
                                    c -> c.q() == 1 && c.r() == 0 ? '#' : c.r() == 1 ? '~' : '.');
        var hexWorld = WorldQuery.fromGrid(hexGrid, t -> t == '#', t -> t == '~' ? 3 : 1);
        var engine = new TileEngine<>(hexGrid, hexWorld);
        assertTrue(hexWorld.isBlocking(HexOrientation.POINTY.at(1, 0)));
        assertTrue(hexWorld.isBlocking(HexOrientation.POINTY.at(9, 9)));
        assertEquals(1, hexWorld.terrainCost(HexOrientation.POINTY.at(9, 9)));
        assertEquals(3, hexWorld.terrainCost(HexOrientation.POINTY.at(0, 1)));

        var found = assertInstanceOf(PathResult.Found.class,
                                     engine.pathfind(HexOrientation.POINTY.at(0, 0), HexOrientation.POINTY.at(2, 0)));
        assertEquals(3, found.totalCost());
        assertFalse(engine.visibleSet(HexOrientation.POINTY.at(0, 0), 3)
                          .isVisible(HexOrientation.POINTY.at(2, 0)));
        assertEquals(Set.of(HexOrientation.POINTY.at(2, 0)), engine.buildFlowField(
        List.of(HexOrientation.POINTY.at(2, 0))).goals());
    }
}
