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
package com.hellblazer.tessella.tiles.spatial.entity;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SequentialLongIDGeneratorTest {

    @Test
    void testSequenceAndReservation() {
        var generator = new SequentialLongIDGenerator(100);
        assertEquals(new LongEntityID(100), generator.generateID());
        assertEquals(new LongEntityID(101), generator.generateID());
        assertEquals(102, generator.nextValue());

        generator.reserve(new LongEntityID(50));
        assertEquals(102, generator.nextValue());
        generator.reserve(new LongEntityID(200));
        assertEquals(new LongEntityID(201), generator.generateID());
        assertTrue(new LongEntityID(3).compareTo(new LongEntityID(4)) < 0);
    }

    @Test
    void testExhaustion() {
        var generator = new SequentialLongIDGenerator(Long.MAX_VALUE - 1);
        assertEquals(new LongEntityID(Long.MAX_VALUE - 1), generator.generateID());
        assertThrows(IllegalStateException.class, generator::generateID);
    }

    @Test
    void testConcurrentGenerationIsUnique() {
        var generator = new SequentialLongIDGenerator();
        Set<LongEntityID> ids = ConcurrentHashMap.newKeySet();
        IntStream.range(0, 10_000).parallel().forEach(i -> ids.add(generator.generateID()));
        assertEquals(10_000, ids.size());
        assertEquals(10_000, generator.nextValue());
    }
}
