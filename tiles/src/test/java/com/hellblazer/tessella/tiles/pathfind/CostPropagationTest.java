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
import com.hellblazer.tessella.tiles.coordinates.HexCoordinate;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CostPropagationTest {

    @Test
    void testMultipleSeedsSettleNearest() {
        var a = HexCoordinate.pointy(0, 0);
        var b = HexCoordinate.pointy(6, 0);
        var propagation = new CostPropagation<HexCoordinate>(c -> a.distance(c) <= 6, (x, y) -> 1, 1, c -> 0L);
        propagation.seed(a, 0);
        propagation.seed(b, 0);
        var outcome = propagation.run(c -> false, Long.MAX_VALUE);
        assertEquals(CostPropagation.Termination.EXHAUSTED, outcome.termination());
        assertNull(outcome.reached());
        assertEquals(Optional.of(3L), propagation.costOf(HexCoordinate.pointy(3, 0)));
        assertEquals(Optional.of(1L), propagation.costOf(HexCoordinate.pointy(5, 0)));
        assertEquals(Optional.empty(), propagation.costOf(HexCoordinate.pointy(-7, 0)));
        assertNull(propagation.predecessors().get(a));
        assertEquals(b, propagation.predecessors().get(HexCoordinate.pointy(5, 0)));
    }

    @Test
    void testSeedKeepsCheaperCost() {
        var origin = HexCoordinate.flat(0, 0);
        var propagation = new CostPropagation<HexCoordinate>(c -> true, (x, y) -> 1, 1, c -> 0L);
        propagation.seed(origin, 2);
        propagation.seed(origin, 5);
        assertEquals(Optional.of(2L), propagation.costOf(origin));
        propagation.seed(origin, 0);
        assertEquals(Optional.of(0L), propagation.costOf(origin));
    }

    @Test
    void testStopsAtCeiling() {
        var origin = HexCoordinate.pointy(0, 0);
        var propagation = new CostPropagation<HexCoordinate>(c -> true, (x, y) -> 2, 2, c -> 0L);
        propagation.seed(origin, 0);
        var outcome = propagation.run(c -> false, 4);
        assertEquals(CostPropagation.Termination.CEILING, outcome.termination());
        // rings 0, 1 and 2 are settled
        assertEquals(19, propagation.expandedNodes());
    }

    @Test
    void testReachesStopPredicate() {
        var origin = HexCoordinate.pointy(0, 0);
        var target = HexCoordinate.pointy(2, -1);
        var propagation = new CostPropagation<HexCoordinate>(c -> true, (x, y) -> 1, 1, c -> c.distance(target));
        propagation.seed(origin, 0);
        var outcome = propagation.run(target::equals, Long.MAX_VALUE);
        assertEquals(CostPropagation.Termination.REACHED, outcome.termination());
        assertEquals(target, outcome.reached());
        assertEquals(2, propagation.expandedNodes());
    }

    @Test
    void testRejectsCheapSteps() {
        assertThrows(InvalidConfigurationException.class,
                     () -> new CostPropagation<HexCoordinate>(c -> true, (x, y) -> 1, 0, c -> 0L));
        var propagation = new CostPropagation<HexCoordinate>(c -> true, (x, y) -> 1, 3, c -> 0L);
        propagation.seed(HexCoordinate.pointy(0, 0), 0);
        assertThrows(InvalidConfigurationException.class, () -> propagation.run(c -> false, 10));
    }
}
