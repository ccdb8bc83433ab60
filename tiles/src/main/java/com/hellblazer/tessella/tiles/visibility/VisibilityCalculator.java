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

import com.hellblazer.tessella.geometry.Pixel;
import com.hellblazer.tessella.tiles.InvalidConfigurationException;
import com.hellblazer.tessella.tiles.coordinates.Coordinate;
import com.hellblazer.tessella.tiles.coordinates.CoordinateSystem;
import com.hellblazer.tessella.tiles.coordinates.Lattice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Field of view over any lattice, with the algorithm chosen per call.
 * <p>
 * Radius is measured in lattice distance. Opaque coordinates that are reached are visible themselves. An optional
 * domain predicate (typically grid bounds) restricts the result; coordinates outside the domain are treated as
 * opaque and never reported.
 * <p>
 * Shadowcasting on square lattices treats tiles as squares whatever the connectivity. Under
 * {@link com.hellblazer.tessella.tiles.coordinates.Connectivity#FOUR} light therefore passes between two walls that
 * only touch at a corner, while ray marching and flood fill, which step orthogonally, stop at them.
 * <p>
 * Thread Safety: stateless apart from its default algorithm; safe for concurrent use.
 *
 * @author hal.hildebrand
 */
public class VisibilityCalculator {
    private static final double EPSILON = 1e-9;
    private static final Logger log     = LoggerFactory.getLogger(VisibilityCalculator.class);

    // Octant transforms: (dx, dy) -> (dx * xx + dy * xy, dx * yx + dy * yy)
    private static final int[] XX = { 1, 0, 0, -1, -1, 0, 0, 1 };
    private static final int[] XY = { 0, 1, -1, 0, 0, -1, 1, 0 };
    private static final int[] YX = { 0, 1, 1, 0, 0, -1, -1, 0 };
    private static final int[] YY = { 1, 0, 0, 1, -1, 0, 0, -1 };

    private final FovAlgorithm defaultAlgorithm;

    public VisibilityCalculator() {
        this(FovAlgorithm.SHADOWCASTING);
    }

    public VisibilityCalculator(FovAlgorithm defaultAlgorithm) {
        this.defaultAlgorithm = Objects.requireNonNull(defaultAlgorithm, "defaultAlgorithm");
    }

    static double lightLevel(int distance, int radius) {
        if (radius == 0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - (double) distance / radius);
    }

    public FovAlgorithm defaultAlgorithm() {
        return defaultAlgorithm;
    }

    public <C extends Coordinate<C>> boolean lineOfSight(C origin, C target, Predicate<? super C> blocking) {
        return LineTracer.lineOfSight(origin, target, blocking);
    }

    public <C extends Coordinate<C>> VisibilityResult<C> visibleSet(C origin, int radius,
                                                                    Predicate<? super C> blocking) {
        return visibleSet(origin, radius, blocking, defaultAlgorithm, c -> true);
    }

    public <C extends Coordinate<C>> VisibilityResult<C> visibleSet(C origin, int radius,
                                                                    Predicate<? super C> blocking,
                                                                    FovAlgorithm algorithm) {
        return visibleSet(origin, radius, blocking, algorithm, c -> true);
    }

    /**
     * @param domain coordinates that exist; everything else is opaque and unreported
     */
    public <C extends Coordinate<C>> VisibilityResult<C> visibleSet(C origin, int radius,
                                                                    Predicate<? super C> blocking,
                                                                    FovAlgorithm algorithm,
                                                                    Predicate<? super C> domain) {
        if (radius < 0) {
            throw new InvalidConfigurationException("Visibility radius must be non-negative: " + radius);
        }
        var visible = new Visible<C>(origin, radius, blocking);
        visible.mark(origin);
        Predicate<C> opaque = c -> !domain.test(c) || blocking.test(c);
        switch (algorithm) {
            case SHADOWCASTING -> {
                switch (origin.system().topology()) {
                    case SQUARE, ISOMETRIC -> octantShadowcast(origin, radius, opaque, domain, visible);
                    case HEXAGONAL, TRIANGULAR -> angularShadowcast(origin, radius, opaque, domain, visible);
                }
            }
            case RAY_MARCHING -> rayMarch(origin, radius, opaque, domain, visible);
            case FLOOD_FILL -> floodFill(origin, radius, opaque, domain, visible);
        }
        log.trace("{} from {} radius {}: {} visible", algorithm, origin, radius, visible.states.size());
        return new VisibilityResult<>(origin, radius, algorithm, visible.states);
    }

    /**
     * Walks outward ring by ring keeping the angular intervals hidden by visible opaque coordinates of earlier rings.
     * A coordinate is hidden when the angle of its center lies strictly inside a hidden interval. Each opaque
     * coordinate hides the angular span of its polygon, so blockers sharing an edge or a corner leave no gap.
     */
    private <C extends Coordinate<C>> void angularShadowcast(C origin, int radius, Predicate<C> opaque,
                                                             Predicate<? super C> domain, Visible<C> visible) {
        CoordinateSystem<C> system = origin.system();
        var center = origin.toPixel(1.0);
        var shadows = new ShadowSet();
        var rings = Lattice.rings(origin, radius);
        for (int k = 1; k < rings.size(); k++) {
            var casting = new ArrayList<double[]>();
            for (var c : rings.get(k)) {
                if (!domain.test(c)) {
                    continue;
                }
                var p = c.toPixel(1.0);
                double angle = p.angleFrom(center);
                if (shadows.hides(angle)) {
                    continue;
                }
                visible.mark(c);
                if (opaque.test(c)) {
                    casting.add(span(system.vertices(c, 1.0), center, angle));
                }
            }
            for (var interval : casting) {
                shadows.add(interval[0], interval[1]);
            }
            if (shadows.isFull()) {
                break;
            }
        }
    }

    /**
     * @return the interval of angles covered by the polygon as seen from the center, around the angle of its middle
     */
    static double[] span(Pixel[] polygon, Pixel center, double angle) {
        double lo = 0.0;
        double hi = 0.0;
        for (var vertex : polygon) {
            double offset = vertex.angleFrom(center) - angle;
            if (offset > Math.PI) {
                offset -= 2 * Math.PI;
            } else if (offset < -Math.PI) {
                offset += 2 * Math.PI;
            }
            lo = Math.min(lo, offset);
            hi = Math.max(hi, offset);
        }
        return new double[] { angle + lo, angle + hi };
    }

    private <C extends Coordinate<C>> void castOctant(C origin, int row, double start, double end, int radius,
                                                      int octant, Predicate<C> opaque,
                                                      Predicate<? super C> domain, Visible<C> visible) {
        if (start < end) {
            return;
        }
        var system = origin.system();
        int ox = system.column(origin);
        int oy = system.row(origin);
        double newStart = 0.0;
        for (int j = row; j <= radius; j++) {
            boolean blocked = false;
            for (int dx = -j; dx <= 0; dx++) {
                int dy = -j;
                double leftSlope = (dx - 0.5) / (dy + 0.5);
                double rightSlope = (dx + 0.5) / (dy - 0.5);
                if (start < rightSlope) {
                    continue;
                }
                if (end > leftSlope) {
                    break;
                }
                var c = system.at(ox + dx * XX[octant] + dy * XY[octant], oy + dx * YX[octant] + dy * YY[octant]);
                if (domain.test(c) && origin.distance(c) <= radius) {
                    visible.mark(c);
                }
                boolean isOpaque = opaque.test(c);
                if (blocked) {
                    if (isOpaque) {
                        newStart = rightSlope;
                    } else {
                        blocked = false;
                        start = newStart;
                    }
                } else if (isOpaque && j < radius) {
                    blocked = true;
                    castOctant(origin, j + 1, start, leftSlope, radius, octant, opaque, domain, visible);
                    newStart = rightSlope;
                }
            }
            if (blocked) {
                break;
            }
        }
    }

    private <C extends Coordinate<C>> void floodFill(C origin, int radius, Predicate<C> opaque,
                                                     Predicate<? super C> domain, Visible<C> visible) {
        var seen = new HashSet<C>();
        var frontier = new ArrayDeque<C>();
        seen.add(origin);
        frontier.add(origin);
        for (int depth = 0; depth < radius && !frontier.isEmpty(); depth++) {
            int layer = frontier.size();
            for (int i = 0; i < layer; i++) {
                var current = frontier.poll();
                for (var n : current.neighbors()) {
                    if (!seen.add(n) || !domain.test(n)) {
                        continue;
                    }
                    visible.mark(n);
                    if (!opaque.test(n)) {
                        frontier.add(n);
                    }
                }
            }
        }
    }

    private <C extends Coordinate<C>> void octantShadowcast(C origin, int radius, Predicate<C> opaque,
                                                            Predicate<? super C> domain, Visible<C> visible) {
        for (int octant = 0; octant < 8; octant++) {
            castOctant(origin, 1, 1.0, 0.0, radius, octant, opaque, domain, visible);
        }
    }

    private <C extends Coordinate<C>> void rayMarch(C origin, int radius, Predicate<C> opaque,
                                                    Predicate<? super C> domain, Visible<C> visible) {
        for (var target : Lattice.ball(origin, radius)) {
            if (target.equals(origin) || !domain.test(target)) {
                continue;
            }
            if (LineTracer.lineOfSight(origin, target, opaque)) {
                visible.mark(target);
            }
        }
    }

    /**
     * Hidden angular intervals within [-PI, PI], kept sorted and merged so that touching intervals form one shadow.
     */
    static final class ShadowSet {
        private final List<double[]> intervals = new ArrayList<>();

        void add(double lo, double hi) {
            if (hi - lo >= 2 * Math.PI) {
                insert(-Math.PI, Math.PI);
                return;
            }
            if (lo < -Math.PI) {
                insert(lo + 2 * Math.PI, Math.PI);
                insert(-Math.PI, hi);
            } else if (hi > Math.PI) {
                insert(lo, Math.PI);
                insert(-Math.PI, hi - 2 * Math.PI);
            } else {
                insert(lo, hi);
            }
        }

        boolean hides(double angle) {
            for (var interval : intervals) {
                if (angle > interval[0] + EPSILON && angle < interval[1] - EPSILON) {
                    return true;
                }
            }
            // the seam at +/- PI is interior when shadows reach it from both sides
            if (Math.PI - Math.abs(angle) <= EPSILON && !intervals.isEmpty()) {
                var first = intervals.get(0);
                var last = intervals.get(intervals.size() - 1);
                return first[0] <= -Math.PI + EPSILON && last[1] >= Math.PI - EPSILON;
            }
            return false;
        }

        boolean isFull() {
            return intervals.size() == 1 && intervals.get(0)[0] <= -Math.PI + EPSILON
            && intervals.get(0)[1] >= Math.PI - EPSILON;
        }

        private void insert(double lo, double hi) {
            var merged = new ArrayList<double[]>(intervals.size() + 1);
            double mergedLo = lo;
            double mergedHi = hi;
            int i = 0;
            while (i < intervals.size() && intervals.get(i)[1] < mergedLo - EPSILON) {
                merged.add(intervals.get(i++));
            }
            while (i < intervals.size() && intervals.get(i)[0] <= mergedHi + EPSILON) {
                mergedLo = Math.min(mergedLo, intervals.get(i)[0]);
                mergedHi = Math.max(mergedHi, intervals.get(i)[1]);
                i++;
            }
            merged.add(new double[] { mergedLo, mergedHi });
            while (i < intervals.size()) {
                merged.add(intervals.get(i++));
            }
            intervals.clear();
            intervals.addAll(merged);
        }
    }

    private static final class Visible<C extends Coordinate<C>> {
        final Predicate<? super C>    blocking;
        final C                       origin;
        final int                     radius;
        final Map<C, VisibilityState> states = new LinkedHashMap<>();

        Visible(C origin, int radius, Predicate<? super C> blocking) {
            this.origin = origin;
            this.radius = radius;
            this.blocking = blocking;
        }

        void mark(C coordinate) {
            if (states.containsKey(coordinate)) {
                return;
            }
            int distance = origin.distance(coordinate);
            states.put(coordinate,
                       new VisibilityState(distance, blocking.test(coordinate), lightLevel(distance, radius)));
        }
    }
}
