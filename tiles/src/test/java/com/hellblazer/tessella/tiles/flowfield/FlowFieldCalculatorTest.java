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

import com.hellblazer.tessella.tiles.CoordinateOutOfBoundsException;
import com.hellblazer.tessella.tiles.InvalidConfigurationException;
import com.hellblazer.tessella.tiles.coordinates.Connectivity;
import com.hellblazer.tessella.tiles.coordinates.HexOrientation;
import com.hellblazer.tessella.tiles.coordinates.SquareCoordinate;
import com.hellblazer.tessella.tiles.grid.Grid;
import com.hellblazer.tessella.tiles.grid.GridBounds;
import com.hellblazer.tessella.tiles.pathfind.EdgeCost;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class FlowFieldCalculatorTest {

    private final FlowFieldCalculator calculator = new FlowFieldCalculator(2);

    private static SquareCoordinate sq(int x, int y) {
        return SquareCoordinate.four(x, y);
    }

    @Test
    void testOpenFieldCostIsDistance() {
        var grid = Grid.filled(Connectivity.FOUR, GridBounds.of(10, 10), 0);
        var goal = sq(3, 7);
        var field = calculator.build(grid, List.of(goal), c -> true, EdgeCost.uniform());
        for (var c : grid.coordinates()) {
            assertEquals(c.distance(goal), field.integrationCost(c), c.toString());
            var path = field.pathFrom(c);
            assertEquals(c.distance(goal) + 1, path.size());
            assertEquals(goal, path.get(path.size() - 1));
        }
        assertTrue(field.isGoal(goal));
        assertEquals(Optional.empty(), field.directionAt(goal));
        assertEquals(Set.of(goal), field.goals());
    }

    @Test
    void testDirectionsDescendOnRandomTerrain() {
        var random = new Random(17);
        var grid = Grid.generate(Connectivity.EIGHT, GridBounds.of(16, 12), c -> random.nextInt(6));
        var goals = List.of(SquareCoordinate.eight(0, 0), SquareCoordinate.eight(15, 11));
        goals.forEach(g -> grid.set(g, 1));
        var field = calculator.build(grid, goals, c -> grid.get(c) != 0, EdgeCost.entering(grid::get));
        for (var c : grid.coordinates()) {
            if (!field.isReachable(c) || field.isGoal(c)) {
                continue;
            }
            var next = field.nextStep(c).orElseThrow();
            assertTrue(field.integrationCost(next) < field.integrationCost(c), c + " -> " + next);
            var path = field.pathFrom(c);
            assertTrue(goals.contains(path.get(path.size() - 1)));
        }
    }

    @Test
    void testEnclosedCoordinatesAreUnreachable() {
        var walls = Set.of(sq(2, 3), sq(4, 3), sq(3, 2), sq(3, 4));
        var grid = Grid.filled(Connectivity.FOUR, GridBounds.of(5, 5), 0);
        var field = calculator.build(grid, List.of(sq(0, 0)), c -> !walls.contains(c), EdgeCost.uniform());
        assertFalse(field.isReachable(sq(3, 3)));
        assertEquals(FlowField.UNREACHABLE, field.integrationCost(sq(3, 3)));
        assertEquals(List.of(), field.pathFrom(sq(3, 3)));
        assertEquals(Optional.empty(), field.nextStep(sq(3, 3)));
        assertFalse(field.isReachable(sq(2, 3)));
        assertFalse(field.isReachable(sq(9, 9)));
        // the corner is cut off by the walls and the grid edge
        assertFalse(field.isReachable(sq(4, 4)));
        assertTrue(field.isReachable(sq(4, 2)));

        var analysis = field.analyze();
        assertEquals(25, analysis.cells());
        assertEquals(19, analysis.reachable());
        assertEquals(6, analysis.unreachable());
        assertEquals(1, analysis.goals());
    }

    @Test
    void testGoalValidation() {
        var grid = Grid.filled(Connectivity.FOUR, GridBounds.of(3, 3), 0);
        assertThrows(InvalidConfigurationException.class,
                     () -> calculator.build(grid, List.of(), c -> true, EdgeCost.uniform()));
        assertThrows(CoordinateOutOfBoundsException.class,
                     () -> calculator.build(grid, List.of(sq(3, 0)), c -> true, EdgeCost.uniform()));
        assertThrows(InvalidConfigurationException.class,
                     () -> calculator.build(grid, List.of(sq(0, 0)), c -> true, (a, b) -> 0));
        assertThrows(InvalidConfigurationException.class, () -> new FlowFieldCalculator(0));
    }

    @Test
    void testTiesFollowNeighborOrder() {
        var grid = Grid.filled(Connectivity.FOUR, GridBounds.of(3, 3), 0);
        var field = calculator.build(grid, List.of(sq(1, 1)), c -> true, EdgeCost.uniform());
        assertEquals(Optional.of(sq(1, 0)), field.directionAt(sq(0, 0)));
        var batch = field.directionsAt(List.of(sq(0, 0), sq(1, 1), sq(2, 2)));
        assertEquals(List.of(sq(0, 0), sq(1, 1), sq(2, 2)), List.copyOf(batch.keySet()));
        assertEquals(Optional.empty(), batch.get(sq(1, 1)));
        assertEquals(Optional.of(sq(-1, 0)), batch.get(sq(2, 2)));
    }

    @Test
    void testIntegrationCeiling() {
        var grid = Grid.filled(Connectivity.FOUR, GridBounds.of(10, 10), 0);
        var field = calculator.build(grid, List.of(sq(0, 0)), c -> true, EdgeCost.uniform(), 3);
        assertEquals(10, field.analyze().reachable());
        assertEquals(3, field.integrationCost(sq(1, 2)));
        assertFalse(field.isReachable(sq(2, 2)));
    }

    @Test
    void testCostIsChargedTowardTheGoal() {
        var grid = Grid.filled(Connectivity.FOUR, GridBounds.of(3, 1), 1);
        grid.set(sq(0, 0), 3);
        grid.set(sq(1, 0), 5);
        var field = calculator.build(grid, List.of(sq(0, 0)), c -> true, EdgeCost.entering(grid::get));
        assertEquals(3, field.integrationCost(sq(1, 0)));
        assertEquals(8, field.integrationCost(sq(2, 0)));
    }

    @Test
    void testAnalysis() {
        var square = Grid.filled(Connectivity.FOUR, GridBounds.of(3, 3), 0);
        var analysis = calculator.build(square, List.of(sq(1, 1)), c -> true, EdgeCost.uniform()).analyze();
        assertEquals(9, analysis.reachable());
        assertEquals(2, analysis.maxCost());
        assertEquals(12.0 / 9.0, analysis.averageCost(), 1e-9);
        assertEquals(List.of(sq(1, 1)), analysis.convergencePoints());

        var hexGrid = Grid.filled(HexOrientation.POINTY, new GridBounds(-1, -1, 3, 3), 0);
        var hex = calculator.build(hexGrid, List.of(HexOrientation.POINTY.at(0, 0)), c -> true, EdgeCost.uniform())
                            .analyze();
        assertEquals(9, hex.reachable());
        assertEquals(List.of(HexOrientation.POINTY.at(0, 0)), hex.convergencePoints());
    }

    @Test
    void testBuildAllMatchesSequential() throws InterruptedException {
        var random = new Random(5);
        var grid = Grid.generate(Connectivity.EIGHT, GridBounds.of(20, 20), c -> 1 + random.nextInt(3));
        List<List<SquareCoordinate>> groups = List.of(List.of(SquareCoordinate.eight(0, 0)),
                                                      List.of(SquareCoordinate.eight(19, 19),
                                                              SquareCoordinate.eight(0, 19)),
                                                      List.of(SquareCoordinate.eight(10, 10)));
        var fields = calculator.buildAll(grid, groups, c -> true, EdgeCost.entering(grid::get));
        assertEquals(groups.size(), fields.size());
        for (int i = 0; i < groups.size(); i++) {
            var sequential = calculator.build(grid, groups.get(i), c -> true, EdgeCost.entering(grid::get));
            for (var c : grid.coordinates()) {
                assertEquals(sequential.integrationCost(c), fields.get(i).integrationCost(c));
                assertEquals(sequential.nextStep(c), fields.get(i).nextStep(c));
            }
        }
    }

    @Test
    void testBuildAllPropagatesFailure() {
        var grid = Grid.filled(Connectivity.FOUR, GridBounds.of(3, 3), 0);
        List<List<SquareCoordinate>> groups = List.of(List.of(sq(0, 0)), List.of(sq(7, 7)));
        assertThrows(CoordinateOutOfBoundsException.class,
                     () -> calculator.buildAll(grid, groups, c -> true, EdgeCost.uniform()));
    }
}
