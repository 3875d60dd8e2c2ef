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
 * One entry of a group as reported by the enumeration cursor: its name and
 * its class. Leaves carry the {@link #DATA_CLASS} sentinel.
 */
public class ChildEntry {

    /** Class reported for leaves (scientific data sets). */
    public static final String DATA_CLASS = "SDS";

    private final String name;

    private final String nxclass;

    /**
     * Constructs an entry.
     *
     * @param name    the entry name
     * @param nxclass the group class or {@link #DATA_CLASS}
     */
    public ChildEntry(String name, String nxclass) {
        this.name = Objects.requireNonNull(name, "name");
        this.nxclass = Objects.requireNonNull(nxclass, "nxclass");
    }

    public String getName() {
        return name;
    }

    public String getNxclass() {
        return nxclass;
    }

    /**
     * Whether this entry is a leaf.
     *
     * @return {@code true} if the class is the data sentinel
     */
    public boolean isData() {
        return DATA_CLASS.equals(nxclass);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ChildEntry)) {
            return false;
        }
        ChildEntry other = (ChildEntry) obj;
        return name.equals(other.name) && nxclass.equals(other.nxclass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, nxclass);
    }

    @Override
    public String toString() {
        return name + ":" + nxclass;
    }
}
