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

/**
 * Axis aligned rectangle in world space. Containment is half open: the minimum edges are inside, the maximum edges
 * are outside, so the four quadrants produced by {@link #quadrant(int)} partition the rectangle exactly.
 *
 * @author hal.hildebrand
 */
public record Rectangle(double minX, double minY, double maxX, double maxY) {

    public Rectangle {
        if (!(maxX > minX) || !(maxY > minY)) {
            throw new IllegalArgumentException(
            "Rectangle must have positive extent: [" + minX + ", " + minY + "] - [" + maxX + ", " + maxY + "]");
        }
    }

    public static Rectangle around(Pixel center, double radius) {
        return new Rectangle(center.x() - radius, center.y() - radius, center.x() + radius, center.y() + radius);
    }

    public static Rectangle of(double x, double y, double width, double height) {
        return new Rectangle(x, y, x + width, y + height);
    }

    public Pixel center() {
        return new Pixel((minX + maxX) / 2.0, (minY + maxY) / 2.0);
    }

    public boolean contains(Pixel p) {
        return p.x() >= minX && p.x() < maxX && p.y() >= minY && p.y() < maxY;
    }

    /**
     * Closed containment, including the maximum edges. Used for query regions supplied by callers.
     */
    public boolean containsInclusive(Pixel p) {
        return p.x() >= minX && p.x() <= maxX && p.y() >= minY && p.y() <= maxY;
    }

    /**
     * @return the squared distance from the point to the closest point of this rectangle, 0 if inside
     */
    public double distanceSquaredTo(Pixel p) {
        double dx = Math.max(Math.max(minX - p.x(), 0.0), p.x() - maxX);
        double dy = Math.max(Math.max(minY - p.y(), 0.0), p.y() - maxY);
        return dx * dx + dy * dy;
    }

    public double height() {
        return maxY - minY;
    }

    public boolean intersects(Rectangle other) {
        return minX <= other.maxX && maxX >= other.minX && minY <= other.maxY && maxY >= other.minY;
    }

    public boolean intersectsCircle(Pixel center, double radius) {
        return distanceSquaredTo(center) <= radius * radius;
    }

    /**
     * Quadrant by index: 0 = lower left, 1 = lower right, 2 = upper left, 3 = upper right.
     */
    public Rectangle quadrant(int index) {
        var c = center();
        return switch (index) {
            case 0 -> new Rectangle(minX, minY, c.x(), c.y());
            case 1 -> new Rectangle(c.x(), minY, maxX, c.y());
            case 2 -> new Rectangle(minX, c.y(), c.x(), maxY);
            case 3 -> new Rectangle(c.x(), c.y(), maxX, maxY);
            default -> throw new IllegalArgumentException("Quadrant index must be 0..3: " + index);
        };
    }

    /**
     * The index of the quadrant containing the point, consistent with {@link #quadrant(int)}.
     */
    public int quadrantOf(Pixel p) {
        var c = center();
        int index = p.x() >= c.x() ? 1 : 0;
        if (p.y() >= c.y()) {
            index += 2;
        }
        return index;
    }

    public double width() {
        return maxX - minX;
    }
}
