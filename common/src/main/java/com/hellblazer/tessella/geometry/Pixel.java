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
package com.hellblazer.tessella.geometry;

import javax.vecmath.Point2d;
import javax.vecmath.Tuple2d;
import javax.vecmath.Vector2d;

/**
 * A point in continuous 2D world space. Produced by coordinate to pixel conversions and used as the position of
 * entities in the spatial index.
 *
 * @author hal.hildebrand
 */
public record Pixel(double x, double y) {

    public static final Pixel ORIGIN = new Pixel(0, 0);

    public static Pixel of(Tuple2d tuple) {
        return new Pixel(tuple.x, tuple.y);
    }

    public Pixel add(Pixel other) {
        return new Pixel(x + other.x, y + other.y);
    }

    /**
     * @return the angle of this point around the given center, in radians in (-PI, PI]
     */
    public double angleFrom(Pixel center) {
        return Math.atan2(y - center.y, x - center.x);
    }

    public double distance(Pixel other) {
        return Math.sqrt(distanceSquared(other));
    }

    public double distanceSquared(Pixel other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return dx * dx + dy * dy;
    }

    /**
     * Perpendicular distance from this point to the infinite line through a and b. Degenerates to the point distance
     * when a and b coincide.
     */
    public double distanceToLine(Pixel a, Pixel b) {
        var direction = new Vector2d(b.x - a.x, b.y - a.y);
        double length = direction.length();
        if (length == 0.0) {
            return distance(a);
        }
        var offset = new Vector2d(x - a.x, y - a.y);
        double cross = direction.x * offset.y - direction.y * offset.x;
        return Math.abs(cross) / length;
    }

    public Pixel lerp(Pixel target, double t) {
        var p = toPoint2d();
        p.interpolate(target.toPoint2d(), t);
        return of(p);
    }

    public Pixel scale(double factor) {
        return new Pixel(x * factor, y * factor);
    }

    public Pixel subtract(Pixel other) {
        return new Pixel(x - other.x, y - other.y);
    }

    public Point2d toPoint2d() {
        return new Point2d(x, y);
    }

    public Vector2d toVector2d() {
        return new Vector2d(x, y);
    }
}
