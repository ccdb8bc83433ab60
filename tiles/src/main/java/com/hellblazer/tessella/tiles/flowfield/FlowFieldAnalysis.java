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
package com.hellblazer.tessella.tiles.flowfield;

import java.util.List;

/**
 * Summary of a computed {@link FlowField}.
 *
 * @param convergencePoints reachable coordinates that at least three neighbors flow into, row-major
 * @param averageCost       mean integration cost over reachable coordinates, goals included
 * @author hal.hildebrand
 */
public record FlowFieldAnalysis<C>(int cells, int reachable, int unreachable, int goals, double averageCost,
                                   long maxCost, List<C> convergencePoints) {
}
