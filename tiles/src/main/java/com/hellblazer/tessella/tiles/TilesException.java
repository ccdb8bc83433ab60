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
package com.hellblazer.tessella.tiles;

import java.util.Objects;

/**
 * Base of the engine's programmer error hierarchy. Every instance carries an {@link ErrorKind} and a message prefixed
 * with that kind, e.g. {@code [TOPOLOGY_MISMATCH] pointy vs flat}.
 * <p>
 * Recoverable search outcomes (no path, search limit) are never reported through this hierarchy; they are values of
 * {@link com.hellblazer.tessella.tiles.pathfind.PathResult}.
 *
 * @author hal.hildebrand
 */
public class TilesException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public TilesException(ErrorKind kind, String message) {
        super(formatMessage(kind, message));
        this.kind = kind;
    }

    public TilesException(ErrorKind kind, String message, Throwable cause) {
        super(formatMessage(kind, message), cause);
        this.kind = kind;
    }

    private static String formatMessage(ErrorKind kind, String message) {
        return "[" + Objects.requireNonNull(kind, "kind") + "] " + Objects.requireNonNull(message, "message");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
