/*
 * Copyright (C) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.glencoesoftware.nexus.model;

import java.util.Objects;

/**
 * A single step of a path change: close the innermost open node, or open a
 * named group or leaf inside the active group.
 */
public final class PathOperation {

    /** Kind of step. */
    public enum Kind {
        CLOSE,
        OPEN_GROUP,
        OPEN_LEAF
    }

    private static final PathOperation CLOSE = new PathOperation(Kind.CLOSE, null);

    private final Kind kind;

    private final String name;

    private PathOperation(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public static PathOperation close() {
        return CLOSE;
    }

    public static PathOperation openGroup(String name) {
        return new PathOperation(Kind.OPEN_GROUP, Objects.requireNonNull(name, "name"));
    }

    public static PathOperation openLeaf(String name) {
        return new PathOperation(Kind.OPEN_LEAF, Objects.requireNonNull(name, "name"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets the name of the node to open.
     *
     * @return the name, or {@code null} for {@link Kind#CLOSE}
     */
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PathOperation)) {
            return false;
        }
        PathOperation other = (PathOperation) obj;
        return kind == other.kind && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        switch (kind) {
            case OPEN_GROUP:
                return "OpenGroup(" + name + ")";
            case OPEN_LEAF:
                return "OpenLeaf(" + name + ")";
            default:
                return "Close";
        }
    }
}
