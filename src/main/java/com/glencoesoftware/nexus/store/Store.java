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

import com.glencoesoftware.nexus.model.AttributeInfo;
import com.glencoesoftware.nexus.model.ChildEntry;
import com.glencoesoftware.nexus.model.Compression;
import com.glencoesoftware.nexus.model.DataInfo;
import com.glencoesoftware.nexus.model.GroupInfo;
import com.glencoesoftware.nexus.model.NexusType;
import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Stateful handle on one open NeXus container. All operations act on the
 * currently active node: the innermost open group, or the open leaf inside it.
 * Children can only be discovered through the forward only enumeration
 * cursor, and there is no way to open an arbitrary path in one call.
 *
 * <p>Implementations report failures as {@link IOException}s and are not
 * safe for concurrent use.</p>
 */
public interface Store extends Closeable {

    /**
     * Gets the location this handle was opened on.
     *
     * @return the container location
     */
    public String getLocation();

    /**
     * Returns the name of the container holding the active node. This differs
     * from {@link #getLocation()} inside an external link.
     *
     * @return the container name
     * @throws IOException if the handle is closed
     */
    public String inquireFile() throws IOException;

    /**
     * Flushes pending writes.
     *
     * @throws IOException if the flush fails
     */
    public void flush() throws IOException;

    /**
     * Releases the handle. Further calls fail.
     *
     * @throws IOException if the container cannot be closed cleanly
     */
    @Override
    public void close() throws IOException;

    // Groups

    /**
     * Creates the group {@code nxclass:name} inside the active group. The new
     * group is not opened.
     *
     * @param name    group name
     * @param nxclass group class, e.g. {@code NXentry}
     * @throws IOException if the group cannot be created
     */
    public void makeGroup(String name, String nxclass) throws IOException;

    /**
     * Opens the group {@code nxclass:name} inside the active group.
     *
     * @param name    group name
     * @param nxclass group class
     * @throws IOException if there is no such group or a leaf is open
     */
    public void openGroup(String name, String nxclass) throws IOException;

    /**
     * Closes the active group, making its parent active.
     *
     * @throws IOException if no group is open or a leaf is open
     */
    public void closeGroup() throws IOException;

    /**
     * Describes the active group.
     *
     * @return entry count, name and class of the active group
     * @throws IOException if the information cannot be read
     */
    public GroupInfo getGroupInfo() throws IOException;

    // Enumeration

    /**
     * Resets the child cursor to the first entry of the active group.
     *
     * @throws IOException if the cursor cannot be reset
     */
    public void resetChildCursor() throws IOException;

    /**
     * Steps the child cursor.
     *
     * @return the next entry, or empty at the end of the group
     * @throws IOException if the cursor cannot advance
     */
    public Optional<ChildEntry> nextChild() throws IOException;

    /**
     * Resets the attribute cursor to the first attribute of the active node.
     *
     * @throws IOException if the cursor cannot be reset
     */
    public void resetAttributeCursor() throws IOException;

    /**
     * Counts the attributes of the active node.
     *
     * @return number of attributes
     * @throws IOException if the count cannot be read
     */
    public int getAttributeCount() throws IOException;

    /**
     * Steps the attribute cursor.
     *
     * @return name, length and type of the next attribute, or empty at the end
     * @throws IOException if the cursor cannot advance
     */
    public Optional<AttributeInfo> nextAttributeMeta() throws IOException;

    // Attributes

    /**
     * Reads an attribute of the active node into a buffer of {@code length}
     * elements.
     *
     * @param name   attribute name
     * @param length buffer size in elements
     * @param type   attribute type
     * @return a String for text, a boxed scalar for one element, otherwise an
     *         array; unsigned values are widened as by
     *         {@link NexusType#widen(Object)}
     * @throws IOException if the attribute cannot be read
     */
    public Object readAttribute(String name, int length, NexusType type) throws IOException;

    /**
     * Writes a string or scalar attribute on the active node.
     *
     * @param name  attribute name
     * @param value a String for {@link NexusType#CHAR}, otherwise a scalar
     * @param type  attribute type
     * @throws IOException if the attribute cannot be written
     */
    public void putAttribute(String name, Object value, NexusType type) throws IOException;

    /**
     * Whether text attribute buffers need one element more than the length
     * reported by {@link #nextAttributeMeta()} to hold the whole value.
     *
     * @return {@code true} for backends with undercounted text metadata
     */
    public boolean requiresStringTerminator();

    // Leaves

    /**
     * Creates a leaf in the active group. The leaf is not opened.
     *
     * @param name  leaf name
     * @param type  element type
     * @param shape dimensions; the first may be {@code UNLIMITED}
     * @throws IOException if the leaf cannot be created
     */
    public void makeData(String name, NexusType type, int[] shape) throws IOException;

    /**
     * Creates a compressed leaf in the active group.
     *
     * @param name        leaf name
     * @param type        element type
     * @param shape       dimensions
     * @param compression compression scheme
     * @param chunks      chunk size per dimension
     * @throws IOException if the leaf cannot be created
     */
    public void compMakeData(String name, NexusType type, int[] shape,
        Compression compression, int[] chunks) throws IOException;

    /**
     * Opens a leaf of the active group.
     *
     * @param name leaf name
     * @throws IOException if there is no such leaf
     */
    public void openLeaf(String name) throws IOException;

    /**
     * Closes the open leaf.
     *
     * @throws IOException if no leaf is open
     */
    public void closeLeaf() throws IOException;

    /**
     * Describes the open leaf.
     *
     * @return shape and type
     * @throws IOException if no leaf is open
     */
    public DataInfo getInfo() throws IOException;

    /**
     * Reads the whole open leaf.
     *
     * @return a flat primitive array in row major order
     * @throws IOException if the data cannot be read
     */
    public Object getData() throws IOException;

    /**
     * Reads a hyperslab of the open leaf.
     *
     * @param offset zero based start per dimension
     * @param shape  extent per dimension
     * @return a flat primitive array in row major order
     * @throws IOException if the slab cannot be read
     */
    public Object getSlab(int[] offset, int[] shape) throws IOException;

    /**
     * Writes the whole open leaf.
     *
     * @param buffer flat primitive array matching the leaf
     * @throws IOException if the data cannot be written
     */
    public void putData(Object buffer) throws IOException;

    /**
     * Writes a hyperslab of the open leaf.
     *
     * @param buffer flat primitive array holding the slab
     * @param offset zero based start per dimension
     * @param shape  extent per dimension
     * @throws IOException if the slab cannot be written
     */
    public void putSlab(Object buffer, int[] offset, int[] shape) throws IOException;

    // Identity

    /**
     * Captures the identity of the active node: the open leaf if there is
     * one, otherwise the active group.
     *
     * @return the identity
     * @throws IOException if the identity cannot be captured
     */
    public NodeId captureIdentity() throws IOException;

    /**
     * Links a captured node into the active group under its original name.
     *
     * @param id a captured identity
     * @throws IOException if the link cannot be made
     */
    public void attachIdentity(NodeId id) throws IOException;

    /**
     * Links a captured node into the active group under another name.
     *
     * @param name the new name
     * @param id   a captured identity
     * @throws IOException if the link cannot be made
     */
    public void attachIdentity(String name, NodeId id) throws IOException;

    /**
     * Compares two identities. Never fails.
     *
     * @param a first identity
     * @param b second identity
     * @return {@code true} if both designate the same node
     */
    public boolean identitiesEqual(NodeId a, NodeId b);

    // External references

    /**
     * Checks, without opening it, whether a group of the active group is a
     * reference into another container.
     *
     * @param name    group name
     * @param nxclass group class
     * @return the reference URL, or empty
     * @throws IOException if the handle is closed
     */
    public Optional<String> externalReferenceOf(String name, String nxclass) throws IOException;

    /**
     * Creates a group in the active group that refers to a group of another
     * container.
     *
     * @param name    group name
     * @param nxclass group class
     * @param url     reference, {@code nxfile://container#/path}
     * @throws IOException if the link cannot be made
     */
    public void linkExternal(String name, String nxclass, String url) throws IOException;
}
