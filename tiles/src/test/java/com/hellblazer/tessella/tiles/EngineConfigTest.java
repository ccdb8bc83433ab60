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

import com.hellblazer.tessella.tiles.visibility.FovAlgorithm;
import com.hellblazer.tessella.tiles.visibility.MixingRule;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class EngineConfigTest {

    @Test
    void testDefaults() {
        var config = EngineConfig.defaults();
        assertEquals(FovAlgorithm.SHADOWCASTING, config.getFovAlgorithm());
        assertEquals(MixingRule.ADDITIVE, config.getMixingRule());
        assertEquals(Long.MAX_VALUE, config.getMaxPathCost());
        assertEquals(1, config.getMinimumStepCost());
        assertEquals(10, config.getQuadtreeCapacity());
        assertEquals(5, config.getQuadtreeMergeThreshold());
        assertEquals(16, config.getQuadtreeMaxDepth());
        assertEquals(1.0, config.getTileSize());
        assertTrue(config.getParallelism() > 0);
    }

    @Test
    void testPresets() {
        var fine = EngineConfig.fineGrained();
        assertEquals(4, fine.getQuadtreeCapacity());
        assertEquals(2, fine.getQuadtreeMergeThreshold());
        var large = EngineConfig.largeWorld();
        assertEquals(32, large.getQuadtreeCapacity());
        assertEquals(100_000, large.getMaxPathCost());
    }

    @Test
    void testRejectsInvalidValues() {
        var config = EngineConfig.defaults();
        var e = assertThrows(InvalidConfigurationException.class, () -> config.withTileSize(0));
        assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
        assertTrue(e.getMessage().startsWith("[INVALID_CONFIGURATION]"));
        assertThrows(InvalidConfigurationException.class, () -> config.withTileSize(Double.NaN));
        assertThrows(InvalidConfigurationException.class, () -> config.withQuadtreeMaxDepth(17));
        assertThrows(InvalidConfigurationException.class, () -> config.withParallelism(0));
        assertThrows(InvalidConfigurationException.class, () -> config.withMinimumStepCost(0));
        assertThrows(InvalidConfigurationException.class, () -> config.withMaxPathCost(-5));
        assertThrows(InvalidConfigurationException.class, () -> config.withQuadtreeMergeThreshold(-1));
    }
}
