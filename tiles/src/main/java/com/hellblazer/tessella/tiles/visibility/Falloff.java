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

/**
 * How a light's strength decays with lattice distance.
 *
 * @author hal.hildebrand
 */
public enum Falloff {
    CONSTANT {
        @Override
        public double attenuation(int distance, int radius) {
            return distance <= radius ? 1.0 : 0.0;
        }
    }, LINEAR {
        @Override
        public double attenuation(int distance, int radius) {
            return VisibilityCalculator.lightLevel(distance, radius);
        }
    }, QUADRATIC {
        @Override
        public double attenuation(int distance, int radius) {
            double linear = VisibilityCalculator.lightLevel(distance, radius);
            return linear * linear;
        }
    };

    /**
     * @return a factor in [0, 1]
     */
    public abstract double attenuation(int distance, int radius);
}
