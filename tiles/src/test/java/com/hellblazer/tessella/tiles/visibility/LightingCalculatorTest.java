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
import com.hellblazer.tessella.tiles.coordinates.SquareCoordinate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class LightingCalculatorTest {

    private static SquareCoordinate sq(int x, int y) {
        return SquareCoordinate.eight(x, y);
    }

    private static LightingCalculator calculator(MixingRule rule) {
        return new LightingCalculator(new VisibilityCalculator(), rule);
    }

    @Test
    void testFalloff() {
        var lighting = new LightingCalculator();
        var linear = lighting.illuminate(List.of(LightSource.of(sq(0, 0), 4, 1.0)), c -> false);
        assertEquals(0.5, linear.levelAt(sq(2, 0)), 1e-9);
        assertEquals(0.0, linear.levelAt(sq(4, 0)), 1e-9);
        assertFalse(linear.illuminated().contains(sq(4, 0)));
        assertEquals(Illumination.DARK, linear.at(sq(9, 9)));

        var quadratic = lighting.illuminate(List.of(LightSource.of(sq(0, 0), 4, 1.0).withFalloff(Falloff.QUADRATIC)),
                                            c -> false);
        assertEquals(0.25, quadratic.levelAt(sq(2, 0)), 1e-9);

        var constant = lighting.illuminate(List.of(LightSource.of(sq(0, 0), 4, 0.7).withFalloff(Falloff.CONSTANT)),
                                           c -> false);
        assertEquals(0.7, constant.levelAt(sq(4, 4)), 1e-9);
        assertEquals(81, constant.size());
    }

    @Test
    void testMixingRules() {
        var sources = List.of(LightSource.of(sq(0, 0), 4, 0.5), LightSource.of(sq(4, 0), 4, 0.5));
        assertEquals(0.5, calculator(MixingRule.ADDITIVE).illuminate(sources, c -> false).levelAt(sq(2, 0)), 1e-9);
        assertEquals(0.25, calculator(MixingRule.MAX).illuminate(sources, c -> false).levelAt(sq(2, 0)), 1e-9);
    }

    @Test
    void testClamping() {
        var bright = LightSource.of(sq(0, 0), 3, 3.0);
        var map = calculator(MixingRule.ADDITIVE).illuminate(List.of(bright, LightSource.of(sq(0, 0), 3, 1.0)),
                                                             c -> false);
        assertEquals(1.0, map.levelAt(sq(0, 0)));
        assertEquals(Rgb.WHITE, map.colorAt(sq(0, 0)));
    }

    @Test
    void testWallsStopLightUnlessPenetrating() {
        var wall = sq(2, 0);
        var source = LightSource.of(sq(0, 0), 5, 1.0);
        var blocked = calculator(MixingRule.ADDITIVE).illuminate(List.of(source), wall::equals);
        assertEquals(0.0, blocked.levelAt(sq(3, 0)));
        assertEquals(0.6, blocked.levelAt(wall), 1e-9);

        var penetrating = calculator(MixingRule.ADDITIVE).illuminate(List.of(source.withPenetratesWalls(true)),
                                                                     wall::equals);
        assertEquals(0.4, penetrating.levelAt(sq(3, 0)), 1e-9);
    }

    @Test
    void testColorsMix() {
        var red = LightSource.of(sq(0, 0), 2, 1.0).withColor(new Rgb(1, 0, 0));
        var blue = LightSource.of(sq(0, 0), 2, 1.0).withColor(new Rgb(0, 0, 1));
        assertEquals(new Rgb(1, 0, 1), calculator(MixingRule.ADDITIVE).illuminate(List.of(red, blue), c -> false)
                                                                      .colorAt(sq(0, 0)));
        assertEquals(new Rgb(1, 0, 1), calculator(MixingRule.MAX).illuminate(List.of(red, blue), c -> false)
                                                                 .colorAt(sq(0, 0)));
        var halfRed = calculator(MixingRule.MAX).illuminate(List.of(red), c -> false).colorAt(sq(1, 0));
        assertEquals(0.5, halfRed.red(), 1e-9);
        assertEquals(0.0, halfRed.blue());
    }

    @Test
    void testInvalidSources() {
        assertThrows(InvalidConfigurationException.class, () -> LightSource.of(sq(0, 0), -1, 1.0));
        assertThrows(InvalidConfigurationException.class, () -> LightSource.of(sq(0, 0), 1, -0.1));
    }
}
