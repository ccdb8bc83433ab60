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
 * Linear RGB color with channels in [0, 1].
 *
 * @author hal.hildebrand
 */
public record Rgb(double red, double green, double blue) {
    public static final Rgb BLACK = new Rgb(0, 0, 0);
    public static final Rgb WHITE = new Rgb(1, 1, 1);

    public Rgb {
        red = clamp(red);
        green = clamp(green);
        blue = clamp(blue);
    }

    private static double clamp(double channel) {
        return Math.max(0.0, Math.min(1.0, channel));
    }

    public Rgb add(Rgb other) {
        return new Rgb(red + other.red, green + other.green, blue + other.blue);
    }

    public Rgb max(Rgb other) {
        return new Rgb(Math.max(red, other.red), Math.max(green, other.green), Math.max(blue, other.blue));
    }

    public Rgb scale(double factor) {
        return new Rgb(red * factor, green * factor, blue * factor);
    }
}
