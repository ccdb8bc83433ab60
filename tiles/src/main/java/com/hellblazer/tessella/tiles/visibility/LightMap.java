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
package com.hellblazer.tessella.tiles.visibility;

import com.hellblazer.tessella.tiles.coordinates.Coordinate;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Immutable per-coordinate illumination. Coordinates no light reaches are {@link Illumination#DARK}.
 *
 * @author hal.hildebrand
 */
public final class LightMap<C extends Coordinate<C>> {
    private final Map<C, Illumination> illumination;

    LightMap(Map<C, Illumination> illumination) {
        this.illumination = Collections.unmodifiableMap(illumination);
    }

    public Illumination at(C coordinate) {
        return illumination.getOrDefault(coordinate, Illumination.DARK);
    }

    public Rgb colorAt(C coordinate) {
        return at(coordinate).color();
    }

    public Set<C> illuminated() {
        return illumination.keySet();
    }

    public double levelAt(C coordinate) {
        return at(coordinate).level();
    }

    public int size() {
        return illumination.size();
    }
}
