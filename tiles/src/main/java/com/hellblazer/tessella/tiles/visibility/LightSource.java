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

import com.hellblazer.tessella.tiles.InvalidConfigurationException;
import com.hellblazer.tessella.tiles.coordinates.Coordinate;

/**
 * A point light.
 *
 * @param penetratesWalls when set the light reaches every coordinate within its radius, ignoring opacity
 * @author hal.hildebrand
 */
public record LightSource<C extends Coordinate<C>>(C position, int radius, double intensity, Rgb color,
                                                   Falloff falloff, boolean penetratesWalls) {

    public LightSource {
        if (position == null || color == null || falloff == null) {
            throw new InvalidConfigurationException("Light source position, color and falloff are required");
        }
        if (radius < 0) {
            throw new InvalidConfigurationException("Light radius must be non-negative: " + radius);
        }
        if (intensity < 0.0) {
            throw new InvalidConfigurationException("Light intensity must be non-negative: " + intensity);
        }
    }

    /**
     * White light with linear falloff that is stopped by opaque coordinates.
     */
    public static <C extends Coordinate<C>> LightSource<C> of(C position, int radius, double intensity) {
        return new LightSource<>(position, radius, intensity, Rgb.WHITE, Falloff.LINEAR, false);
    }

    public double contributionAt(int distance) {
        return intensity * falloff.attenuation(distance, radius);
    }

    public LightSource<C> withColor(Rgb color) {
        return new LightSource<>(position, radius, intensity, color, falloff, penetratesWalls);
    }

    public LightSource<C> withFalloff(Falloff falloff) {
        return new LightSource<>(position, radius, intensity, color, falloff, penetratesWalls);
    }

    public LightSource<C> withPenetratesWalls(boolean penetratesWalls) {
        return new LightSource<>(position, radius, intensity, color, falloff, penetratesWalls);
    }
}
