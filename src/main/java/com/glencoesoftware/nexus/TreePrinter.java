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

import com.glencoesoftware.nexus.model.DataInfo;
import com.glencoesoftware.nexus.model.NexusType;
import com.google.common.base.Strings;
import java.lang.reflect.Array;

/**
 * Renders a walked subtree as indented text, one node or attribute per
 * line:
 *
 * <pre>
 * === File demo.nxs /
 * entry1 NXentry
 *   &#64;signal: 1
 *   data float64 10
 *     &#64;units: counts
 *   alias_to_data float64 10
 *     -&gt; /entry1/data
 * </pre>
 */
public class TreePrinter implements NexusVisitor {

    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();

    private int depth;

    /** Whether the last node reported was a leaf. */
    private boolean inLeaf = false;

    /**
     * Constructs a printer.
     *
     * @param indent initial indentation, in levels
     */
    public TreePrinter(int indent) {
        this.depth = indent;
    }

    public TreePrinter() {
        this(0);
    }

    /**
     * Walks the subtree at a path and renders it.
     *
     * @param file an open NeXus file
     * @param path start path, {@code null} for the current position
     * @return the rendered tree
     * @throws NexusException if the walk fails
     */
    public static String print(NexusFile file, String path) throws NexusException {
        TreePrinter printer = new TreePrinter();
        new TreeWalker(file).walk(path, printer);
        return printer.toString();
    }

    @Override
    public void onFile(String fileName, String path) {
        out.append("=== File ").append(fileName).append(' ').append(path).append('\n');
    }

    @Override
    public void onAttribute(String name, Object value) {
        line(inLeaf ? 1 : 0).append('@').append(name).append(": ").append(format(value))
            .append('\n');
    }

    @Override
    public void onLeaf(String name, int[] shape, NexusType type, Object inlineValue) {
        inLeaf = true;
        line(0).append(name).append(' ').append(type).append(' ')
            .append(new DataInfo(shape, type).getDimensions()).append('\n');
        if (inlineValue != null) {
            line(1).append(format(inlineValue)).append('\n');
        }
    }

    @Override
    public void onGroupEnter(String name, String nxclass) {
        inLeaf = false;
        line(0).append(name).append(' ').append(nxclass).append('\n');
        depth++;
    }

    @Override
    public void onGroupExit() {
        inLeaf = false;
        depth--;
    }

    @Override
    public void onAlias(String target) {
        line(inLeaf ? 1 : 0).append("-> ").append(target).append('\n');
    }

    @Override
    public String toString() {
        return out.toString();
    }

    private StringBuilder line(int extra) {
        return out.append(Strings.repeat(INDENT, depth + extra));
    }

    /** Formats scalars with toString and arrays as {@code [a, b, c]}. */
    static String format(Object value) {
        if (value == null || !value.getClass().isArray()) {
            return String.valueOf(value);
        }
        StringBuilder sb = new StringBuilder("[");
        int n = Array.getLength(value);
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(Array.get(value, i));
        }
        return sb.append(']').toString();
    }
}
