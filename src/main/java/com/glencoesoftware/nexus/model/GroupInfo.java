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

/**
 * Summary of the active group: how many entries it holds, its name and its
 * class.
 */
public class GroupInfo {

    private final int entryCount;

    private final String name;

    private final String nxclass;

    public GroupInfo(int entryCount, String name, String nxclass) {
        this.entryCount = entryCount;
        this.name = name;
        this.nxclass = nxclass;
    }

    public int getEntryCount() {
        return entryCount;
    }

    public String getName() {
        return name;
    }

    public String getNxclass() {
        return nxclass;
    }

    @Override
    public String toString() {
        return "GroupInfo{" + "entryCount=" + entryCount + ", name='" + name + '\''
            + ", nxclass='" + nxclass + '\'' + '}';
    }
}
