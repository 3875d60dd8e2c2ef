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
 * Metadata of one attribute, obtained before its value is read because the
 * read buffer is sized from it.
 */
public class AttributeInfo {

    private final String name;

    /** Number of elements (characters for text). */
    private final int length;

    private final NexusType type;

    public AttributeInfo(String name, int length, NexusType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.length = length;
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public int getLength() {
        return length;
    }

    public NexusType getType() {
        return type;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AttributeInfo)) {
            return false;
        }
        AttributeInfo other = (AttributeInfo) obj;
        return name.equals(other.name) && length == other.length && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, length, type);
    }

    @Override
    public String toString() {
        return "AttributeInfo{" + "name='" + name + '\'' + ", length=" + length
            + ", type=" + type + '}';
    }
}
