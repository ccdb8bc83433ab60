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

/**
 * Long valued entity identifier, as issued by {@link SequentialLongIDGenerator}.
 *
 * @author hal.hildebrand
 */
public record LongEntityID(long value) implements EntityID, Comparable<LongEntityID> {

    @Override
    public int compareTo(LongEntityID other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toDebugString() {
        return "Entity[" + value + "]";
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
