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
 * Source of the identifiers a spatial index assigns to entities inserted without one.
 *
 * @param <ID> the identifier type produced
 * @author hal.hildebrand
 */
public interface EntityIDGenerator<ID extends EntityID> {

    ID generateID();

    /**
     * Note an identifier the caller assigned itself, so that later generated identifiers do not collide with it.
     */
    default void reserve(ID id) {
        // generators that cannot collide ignore caller assigned identifiers
    }
}
