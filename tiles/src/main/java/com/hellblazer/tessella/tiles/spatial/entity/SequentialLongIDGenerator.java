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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues {@link LongEntityID}s in increasing order, skipping past any identifier reserved by a caller. Thread safe.
 *
 * @author hal.hildebrand
 */
public class SequentialLongIDGenerator implements EntityIDGenerator<LongEntityID> {
    private final AtomicLong floor;

    public SequentialLongIDGenerator() {
        this(0L);
    }

    public SequentialLongIDGenerator(long first) {
        this.floor = new AtomicLong(first);
    }

    @Override
    public LongEntityID generateID() {
        long value = floor.getAndIncrement();
        if (value == Long.MAX_VALUE) {
            throw new IllegalStateException("Entity identifiers exhausted");
        }
        return new LongEntityID(value);
    }

    /**
     * @return the lowest value a generated identifier may still carry
     */
    public long nextValue() {
        return floor.get();
    }

    @Override
    public void reserve(LongEntityID id) {
        long value = id.value();
        floor.accumulateAndGet(value == Long.MAX_VALUE ? value : value + 1, Math::max);
    }
}
