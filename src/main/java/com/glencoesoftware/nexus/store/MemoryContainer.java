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

package com.glencoesoftware.nexus.store;

import com.glencoesoftware.nexus.model.ChildEntry;
import com.glencoesoftware.nexus.model.Compression;
import com.glencoesoftware.nexus.model.NexusType;
import com.glencoesoftware.nexus.model.Values;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node tree of one in-memory container. Children keep insertion order, which
 * is the enumeration order reported to callers.
 */
class MemoryContainer {

    static final String ROOT_CLASS = "NXroot";

    final String name;

    final Group root = new Group(ROOT_CLASS);

    MemoryContainer(String name) {
        this.name = name;
    }

    /** Common part of groups and leaves: the attribute table. */
    abstract static class Node {

        final Map<String, Attribute> attributes = new LinkedHashMap<>();

        /**
         * Class reported by the enumeration cursor.
         *
         * @return group class or {@link ChildEntry#DATA_CLASS}
         */
        abstract String nxclass();
    }

    static class Group extends Node {

        final String nxclass;

        final Map<String, Node> children = new LinkedHashMap<>();

        Group(String nxclass) {
            this.nxclass = nxclass;
        }

        @Override
        String nxclass() {
            return nxclass;
        }
    }

    static class Leaf extends Node {

        final NexusType type;

        int[] shape;

        final boolean unlimited;

        final Compression compression;

        final int[] chunks;

        /** Flat row major buffer. */
        Object data;

        Leaf(NexusType type, int[] shape, boolean unlimited, Compression compression,
            int[] chunks) {
            this.type = type;
            this.shape = shape;
            this.unlimited = unlimited;
            this.compression = compression;
            this.chunks = chunks;
            this.data = type.allocate((int) Values.size(shape));
        }

        @Override
        String nxclass() {
            return ChildEntry.DATA_CLASS;
        }
    }

    /** Placeholder for a group that lives in another container. */
    static class ExternalGroup extends Node {

        final String nxclass;

        final String url;

        ExternalGroup(String nxclass, String url) {
            this.nxclass = nxclass;
            this.url = url;
        }

        @Override
        String nxclass() {
            return nxclass;
        }
    }

    static class Attribute {

        final NexusType type;

        /** UTF-8 bytes for text, a one element primitive array otherwise. */
        final Object value;

        Attribute(NexusType type, Object value) {
            this.type = type;
            this.value = value;
        }
    }
}
