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

package com.glencoesoftware.nexus;

import com.glencoesoftware.nexus.model.NexusType;

/**
 * Callbacks receiving the nodes met by a {@link TreeWalker}.
 *
 * <p>Attributes reported after {@link #onLeaf} and before the next leaf or
 * group event belong to that leaf; otherwise they belong to the innermost
 * entered group.</p>
 */
public interface NexusVisitor {

    /**
     * Called once before the walk starts.
     *
     * @param fileName container holding the start node
     * @param path     absolute path of the start node
     */
    default void onFile(String fileName, String path) {
    }

    public void onAttribute(String name, Object value);

    /**
     * Called for a leaf.
     *
     * @param name        leaf name
     * @param shape       leaf dimensions
     * @param type        element type
     * @param inlineValue the value when the leaf is small, otherwise {@code null}
     */
    public void onLeaf(String name, int[] shape, NexusType type, Object inlineValue);

    public void onGroupEnter(String name, String nxclass);

    public void onGroupExit();

    /**
     * Called instead of descending into a node that is an alias.
     *
     * @param target the path the alias designates
     */
    public void onAlias(String target);
}
