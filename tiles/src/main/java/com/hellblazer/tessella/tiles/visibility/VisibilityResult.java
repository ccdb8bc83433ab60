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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of coordinates visible from an origin. The origin is always a member.
 *
 * @param <C> coordinate type
 * @author hal.hildebrand
 */
public final class VisibilityResult<C extends Coordinate<C>> {

    private final FovAlgorithm                algorithm;
    private final C                           origin;
    private final int                         radius;
    private final Map<C, VisibilityState>     visible;

    VisibilityResult(C origin, int radius, FovAlgorithm algorithm, Map<C, VisibilityState> visible) {
        this.origin = origin;
        this.radius = radius;
        this.algorithm = algorithm;
        this.visible = Collections.unmodifiableMap(new LinkedHashMap<>(visible));
    }

    public FovAlgorithm algorithm() {
        return algorithm;
    }

    public boolean isVisible(C coordinate) {
        return visible.containsKey(coordinate);
    }

    public double lightLevel(C coordinate) {
        var state = visible.get(coordinate);
        return state == null ? 0.0 : state.lightLevel();
    }

    public C origin() {
        return origin;
    }

    public int radius() {
        return radius;
    }

    public int size() {
        return visible.size();
    }

    public Optional<VisibilityState> stateOf(C coordinate) {
        return Optional.ofNullable(visible.get(coordinate));
    }

    /**
     * Visible coordinates, nearest first.
     */
    public Set<C> visible() {
        return visible.keySet();
    }

    public Map<C, VisibilityState> states() {
        return visible;
    }

    @Override
    public String toString() {
        return "Visibility[" + origin + ", r=" + radius + ", " + algorithm + ", " + visible.size() + " visible]";
    }
}
