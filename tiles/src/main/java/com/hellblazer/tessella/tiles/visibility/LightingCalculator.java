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
import com.hellblazer.tessella.tiles.coordinates.Lattice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Combines several light sources into one {@link LightMap}. Each source lights what it can see, using the
 * visibility calculator, unless it penetrates walls. Contributions combine under the configured
 * {@link MixingRule}, and colors combine under the same rule weighted by contribution.
 *
 * @author hal.hildebrand
 */
public class LightingCalculator {
    private static final Logger log = LoggerFactory.getLogger(LightingCalculator.class);

    private final MixingRule           mixingRule;
    private final VisibilityCalculator visibility;

    public LightingCalculator() {
        this(new VisibilityCalculator(), MixingRule.ADDITIVE);
    }

    public LightingCalculator(VisibilityCalculator visibility, MixingRule mixingRule) {
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.mixingRule = Objects.requireNonNull(mixingRule, "mixingRule");
    }

    public <C extends Coordinate<C>> LightMap<C> illuminate(Iterable<LightSource<C>> sources,
                                                            Predicate<? super C> blocking) {
        return illuminate(sources, blocking, c -> true);
    }

    public <C extends Coordinate<C>> LightMap<C> illuminate(Iterable<LightSource<C>> sources,
                                                            Predicate<? super C> blocking,
                                                            Predicate<? super C> domain) {
        var combined = new LinkedHashMap<C, Illumination>();
        int count = 0;
        for (var source : sources) {
            count++;
            var origin = source.position();
            if (source.penetratesWalls()) {
                for (var c : Lattice.ball(origin, source.radius())) {
                    if (domain.test(c)) {
                        contribute(combined, c, source, origin.distance(c));
                    }
                }
            } else {
                var seen = visibility.visibleSet(origin, source.radius(), blocking, visibility.defaultAlgorithm(),
                                                 domain);
                seen.states().forEach((c, state) -> contribute(combined, c, source, state.distance()));
            }
        }
        log.debug("Illuminated {} coordinates from {} sources ({})", combined.size(), count, mixingRule);
        return new LightMap<>(combined);
    }

    public MixingRule mixingRule() {
        return mixingRule;
    }

    private <C extends Coordinate<C>> void contribute(LinkedHashMap<C, Illumination> combined, C coordinate,
                                                      LightSource<C> source, int distance) {
        double contribution = source.contributionAt(distance);
        if (contribution <= 0.0) {
            return;
        }
        var light = new Illumination(Math.min(1.0, contribution), source.color().scale(contribution));
        combined.merge(coordinate, light, (a, b) -> switch (mixingRule) {
            case ADDITIVE -> new Illumination(Math.min(1.0, a.level() + b.level()), a.color().add(b.color()));
            case MAX -> new Illumination(Math.max(a.level(), b.level()), a.color().max(b.color()));
        });
    }
}
