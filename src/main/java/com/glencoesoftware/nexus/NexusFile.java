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

import com.glencoesoftware.nexus.model.AccessMode;
import com.glencoesoftware.nexus.model.ChildEntry;
import com.glencoesoftware.nexus.model.Compression;
import com.glencoesoftware.nexus.model.DataInfo;
import com.glencoesoftware.nexus.model.GroupInfo;
import com.glencoesoftware.nexus.model.NexusType;
import com.glencoesoftware.nexus.model.PathOperation;
import com.glencoesoftware.nexus.model.ResolveMode;
import com.glencoesoftware.nexus.model.Values;
import com.glencoesoftware.nexus.store.NodeId;
import com.glencoesoftware.nexus.store.Store;
import com.glencoesoftware.nexus.store.StoreFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.io.Closeable;
import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.LoggerFactory;

/**
 * Cursor over one open NeXus container. Owns the store handle together with
 * the path of currently open groups and whether a leaf is open at the end
 * of it, and is the only thing that changes them.
 *
 * <pre>
 * try (NexusFile file = NexusFile.open(factory, "demo.nxs", "r")) {
 *     file.openPath("/entry1/data");
 *     Object data = file.getData();
 * }
 * </pre>
 *
 * <p>Instances are not thread safe; all navigation on one container must be
 * serialized by the caller.</p>
 */
public class NexusFile implements Closeable {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(NexusFile.class);

    private final StoreFactory factory;

    private final String location;

    private final AccessMode mode;

    private final NexusConfig config;

    /** Open handle, {@code null} while closed. */
    private Store store;

    /** Names of the open nodes from the root down. */
    private final List<String> path = new ArrayList<>();

    /** Whether the last entry of {@link #path} is an open leaf. */
    private boolean inData = false;

    private final ChildIterator children;

    private final AttributeIterator attributes;

    private final PathResolver resolver;

    private final LinkResolver links;

    /**
     * Opens or creates a container.
     *
     * @param factory  source of store handles
     * @param location container location
     * @param mode     access mode
     * @param config   engine settings
     * @throws StoreFailureException if the container cannot be opened
     */
    public NexusFile(StoreFactory factory, String location, AccessMode mode, NexusConfig config)
        throws NexusException {
        this.factory = Preconditions.checkNotNull(factory, "factory");
        this.location = Preconditions.checkNotNull(location, "location");
        this.mode = Preconditions.checkNotNull(mode, "mode");
        this.config = Preconditions.checkNotNull(config, "config");
        this.children = new ChildIterator(this, config);
        this.attributes = new AttributeIterator(this);
        this.resolver = new PathResolver(this, children);
        this.links = new LinkResolver(this, attributes);
        acquire(mode);
    }

    /**
     * Opens or creates a container with the configuration found on the
     * classpath.
     *
     * @param factory  source of store handles
     * @param location container location
     * @param mode     access mode code: {@code r}, {@code rw}, {@code w},
     *                 {@code w4}, {@code w5} or {@code wx}
     * @return the open file
     * @throws IllegalArgumentException if the mode code is invalid
     * @throws StoreFailureException    if the container cannot be opened
     */
    public static NexusFile open(StoreFactory factory, String location, String mode)
        throws NexusException {
        return new NexusFile(factory, location, AccessMode.fromCode(mode), NexusConfig.load());
    }

    // Lifecycle

    /**
     * Opens the container again after {@link #close()}. A container that was
     * created is reopened for update. Does nothing if already open.
     *
     * @throws StoreFailureException if the container cannot be opened
     */
    public void open() throws NexusException {
        if (store == null) {
            acquire(mode.reopenMode());
        }
    }

    /**
     * Closes the container. The path is reset even if the store fails to
     * close. Does nothing if already closed.
     *
     * @throws StoreFailureException if the store fails to close
     */
    @Override
    public void close() throws NexusException {
        if (store == null) {
            return;
        }
        Store handle = store;
        store = null;
        path.clear();
        inData = false;
        try {
            handle.close();
            log.info("Closed {}", location);
        } catch (IOException e) {
            throw new StoreFailureException("Could not close NeXus file " + location, "/", null,
                e);
        }
    }

    /**
     * Flushes pending writes to the container.
     *
     * @throws StoreFailureException if the flush fails
     */
    public void flush() throws NexusException {
        try {
            store().flush();
        } catch (IOException e) {
            throw storeFailure("Could not flush NeXus file " + location, null, e);
        }
    }

    public boolean isOpen() {
        return store != null;
    }

    public String getLocation() {
        return location;
    }

    public AccessMode getMode() {
        return mode;
    }

    public NexusConfig getConfig() {
        return config;
    }

    /**
     * Unix style path of the active node, {@code /} at the root.
     *
     * @return the absolute path
     */
    public String getPath() {
        return PathResolver.toPath(path);
    }

    /**
     * Names of the open nodes from the root down.
     *
     * @return an immutable copy of the path stack
     */
    public List<String> getPathStack() {
        return ImmutableList.copyOf(path);
    }

    /**
     * Whether the active node is a leaf.
     *
     * @return {@code true} if a leaf is open
     */
    public boolean isInData() {
        return inData;
    }

    // Components

    public ChildIterator children() {
        return children;
    }

    public AttributeIterator attributes() {
        return attributes;
    }

    public LinkResolver links() {
        return links;
    }

    // Paths

    /**
     * Moves to a group or leaf, e.g. {@code /entry1/data} or {@code ../sample}.
     * On failure the cursor is left where the last successful step put it.
     *
     * @param target absolute or relative path
     * @return the steps applied
     * @throws NexusException if the path cannot be resolved
     */
    public List<PathOperation> openPath(String target) throws NexusException {
        return resolver.resolve(target, ResolveMode.ALLOW_LEAF_TARGET);
    }

    /**
     * Moves to a group; when the path names a leaf, moves to the group
     * containing it instead.
     *
     * @param target absolute or relative path
     * @return the steps applied
     * @throws NexusException if the path cannot be resolved
     */
    public List<PathOperation> openGroupPath(String target) throws NexusException {
        return resolver.resolve(target, ResolveMode.GROUP_ONLY);
    }

    // Groups

    /**
     * Creates a group in the active group without opening it.
     *
     * @param name    group name
     * @param nxclass group class
     * @throws NexusException if the group cannot be created
     */
    public void makeGroup(String name, String nxclass) throws NexusException {
        requireGroup(name);
        try {
            store().makeGroup(name, nxclass);
        } catch (IOException e) {
            throw storeFailure("Could not create " + nxclass + ":" + name, name, e);
        }
    }

    /**
     * Opens a group of the active group, looking up its class by
     * enumeration.
     *
     * @param name group name
     * @throws NodeNotFoundException       if there is no such child
     * @throws StructuralMismatchException if the child is a leaf
     * @throws NexusException              if the store fails
     */
    public void openGroup(String name) throws NexusException {
        requireGroup(name);
        String nxclass = children.listChildren().get(name);
        if (nxclass == null) {
            throw new NodeNotFoundException("File does not have " + name + " at this level",
                getPath(), name);
        }
        if (ChildEntry.DATA_CLASS.equals(nxclass)) {
            throw new StructuralMismatchException(name + " is data, not a group", getPath(), name);
        }
        openGroup(name, nxclass);
    }

    /**
     * Opens the group {@code nxclass:name} of the active group.
     *
     * @param name    group name
     * @param nxclass group class
     * @throws NexusException if the group cannot be opened
     */
    public void openGroup(String name, String nxclass) throws NexusException {
        requireGroup(name);
        try {
            store().openGroup(name, nxclass);
        } catch (IOException e) {
            throw storeFailure("Could not open " + nxclass + ":" + name, name, e);
        }
        path.add(name);
        log.debug("Opened group {}", getPath());
    }

    /**
     * Closes the active group.
     *
     * @throws StructuralMismatchException if a leaf is open or at the root
     * @throws NexusException              if the store fails
     */
    public void closeGroup() throws NexusException {
        store();
        if (inData || path.isEmpty()) {
            throw new StructuralMismatchException("No group to close", getPath(), null);
        }
        try {
            store.closeGroup();
        } catch (IOException e) {
            throw storeFailure("Could not close group", null, e);
        }
        path.remove(path.size() - 1);
    }

    /**
     * Describes the active group.
     *
     * @return entry count, name and class
     * @throws NexusException if the store fails
     */
    public GroupInfo getGroupInfo() throws NexusException {
        requireGroup(null);
        try {
            return store().getGroupInfo();
        } catch (IOException e) {
            throw storeFailure("Could not get group info", null, e);
        }
    }

    /**
     * Lists the children of the active group.
     *
     * @return child name vs. class
     * @throws NexusException if the store fails
     */
    public Map<String, String> getEntries() throws NexusException {
        return children.listChildren();
    }

    /**
     * Visits the children of the active group, opening each in turn.
     *
     * @return a restartable sequence of children
     * @see ChildIterator#entries()
     */
    public Iterable<ChildEntry> entries() {
        return children.entries();
    }

    // Leaves

    /**
     * Creates a leaf in the active group without opening it.
     *
     * @param name  leaf name
     * @param type  element type
     * @param shape dimensions; the first may be {@code UNLIMITED}
     * @throws NexusException if the leaf cannot be created
     */
    public void makeData(String name, NexusType type, int... shape) throws NexusException {
        requireGroup(name);
        try {
            store().makeData(name, type, shape);
        } catch (IOException e) {
            throw storeFailure("Could not create data " + name, name, e);
        }
    }

    /**
     * Creates a compressed leaf in the active group. Without chunk sizes each
     * chunk spans the last dimension.
     *
     * @param name        leaf name
     * @param type        element type
     * @param shape       dimensions
     * @param compression compression scheme
     * @param chunks      chunk size per dimension, may be {@code null}
     * @throws NexusException if the leaf cannot be created
     */
    public void compMakeData(String name, NexusType type, int[] shape, Compression compression,
        int[] chunks) throws NexusException {
        requireGroup(name);
        Preconditions.checkArgument(shape.length > 0, "Data %s must have a dimension", name);
        int[] actual = chunks;
        if (actual == null) {
            actual = new int[shape.length];
            Arrays.fill(actual, 1);
            actual[shape.length - 1] = shape[shape.length - 1];
        }
        try {
            store().compMakeData(name, type, shape, compression, actual);
        } catch (IOException e) {
            throw storeFailure("Could not create compressed data " + name, name, e);
        }
    }

    /**
     * Opens a leaf of the active group.
     *
     * @param name leaf name
     * @throws StructuralMismatchException if a leaf is already open
     * @throws NexusException              if the leaf cannot be opened
     */
    public void openData(String name) throws NexusException {
        requireGroup(name);
        try {
            store().openLeaf(name);
        } catch (IOException e) {
            throw storeFailure("Could not open data " + name, name, e);
        }
        path.add(name);
        inData = true;
        log.debug("Opened data {}", getPath());
    }

    /**
     * Closes the open leaf.
     *
     * @throws StructuralMismatchException if no leaf is open
     * @throws NexusException              if the store fails
     */
    public void closeData() throws NexusException {
        store();
        if (!inData) {
            throw new StructuralMismatchException("No data to close", getPath(), null);
        }
        try {
            store.closeLeaf();
        } catch (IOException e) {
            throw storeFailure("Could not close data", null, e);
        }
        path.remove(path.size() - 1);
        inData = false;
    }

    /**
     * Describes the open leaf.
     *
     * @return shape and type
     * @throws NexusException if no leaf is open
     */
    public DataInfo getInfo() throws NexusException {
        requireData();
        try {
            return store.getInfo();
        } catch (IOException e) {
            throw storeFailure("Could not get data info", null, e);
        }
    }

    /**
     * Reads the open leaf. One dimensional text is returned as a String, a
     * single element as its boxed scalar, anything else as a flat array.
     * Unsigned values are widened, e.g. {@code uint8} reads as {@code int}
     * and {@code uint64} as {@code BigInteger}.
     *
     * @return the value
     * @throws NexusException if the data cannot be read
     */
    public Object getData() throws NexusException {
        DataInfo info = getInfo();
        try {
            return info.getType().toValue(store.getData(), info.getShape());
        } catch (IOException e) {
            throw storeFailure("Could not read data", null, e);
        }
    }

    /**
     * Reads a hyperslab of the open leaf.
     *
     * @param offset zero based start per dimension
     * @param shape  extent per dimension
     * @return the value, converted as by {@link #getData()}
     * @throws NexusException if the slab cannot be read
     */
    public Object getSlab(int[] offset, int[] shape) throws NexusException {
        DataInfo info = getInfo();
        try {
            return info.getType().toValue(store.getSlab(offset, shape), shape);
        } catch (IOException e) {
            throw storeFailure("Could not read slab", null, e);
        }
    }

    /**
     * Writes the open leaf. Text leaves accept a String, padded with NUL
     * bytes; single element leaves accept a boxed number.
     *
     * @param value the value
     * @throws IllegalArgumentException if the value does not fit the leaf
     * @throws NexusException           if the data cannot be written
     */
    public void putData(Object value) throws NexusException {
        DataInfo info = getInfo();
        Object buffer = toBuffer(value, info.getType(), info.getShape());
        try {
            store.putData(buffer);
        } catch (IOException e) {
            throw storeFailure("Could not write data", null, e);
        }
    }

    /**
     * Writes a hyperslab of the open leaf.
     *
     * @param value  the slab, converted as by {@link #putData(Object)}
     * @param offset zero based start per dimension
     * @param shape  extent per dimension
     * @throws NexusException if the slab cannot be written
     */
    public void putSlab(Object value, int[] offset, int[] shape) throws NexusException {
        DataInfo info = getInfo();
        Object buffer = toBuffer(value, info.getType(), shape);
        try {
            store.putSlab(buffer, offset, shape);
        } catch (IOException e) {
            throw storeFailure("Could not write slab", null, e);
        }
    }

    // Attributes

    /**
     * Reads an attribute of the active node. Text buffers get one extra
     * element on stores that need room for a terminator.
     *
     * @param name   attribute name
     * @param length number of elements, as reported by the attribute cursor
     * @param type   attribute type
     * @return a String, a boxed scalar or a primitive array
     * @throws NexusException if the attribute cannot be read
     */
    public Object getAttr(String name, int length, NexusType type) throws NexusException {
        int size = length;
        if (type.isText() && store().requiresStringTerminator()) {
            size++;
        }
        try {
            return store.readAttribute(name, size, type);
        } catch (IOException e) {
            throw storeFailure("Could not read attr " + name, name, e);
        }
    }

    /**
     * Writes a string or scalar attribute, inferring its type from the value.
     *
     * @param name  attribute name
     * @param value a String, a boxed number or a one element array
     * @throws IllegalArgumentException if the value is not a string or scalar
     * @throws NexusException           if the attribute cannot be written
     */
    public void putAttr(String name, Object value) throws NexusException {
        putAttr(name, value, NexusType.typeOf(value));
    }

    /**
     * Writes a string or scalar attribute of an explicit type.
     *
     * @param name  attribute name
     * @param value a String for {@code char}, otherwise a scalar number
     * @param type  attribute type
     * @throws IllegalArgumentException if the value does not match the type
     * @throws NexusException           if the attribute cannot be written
     */
    public void putAttr(String name, Object value, NexusType type) throws NexusException {
        Object stored = value;
        if (type.isText()) {
            Preconditions.checkArgument(value instanceof String,
                "Expected string for 'char' attribute value");
        } else {
            // NeXus ignores attribute arrays
            Values.scalarBuffer(value, type);
            if (value != null && value.getClass().isArray()) {
                stored = Array.get(value, 0);
            }
        }
        try {
            store().putAttribute(name, stored, type);
        } catch (IOException e) {
            throw storeFailure("Could not write attr " + name, name, e);
        }
    }

    /**
     * Iterates the attributes of the active node.
     *
     * @return attribute name and value pairs
     * @see AttributeIterator#attributes()
     */
    public Iterable<Map.Entry<String, Object>> attrs() {
        return attributes.attributes();
    }

    // Links

    public NodeId getGroupId() throws NexusException {
        requireGroup(null);
        return links.captureIdentity();
    }

    public NodeId getDataId() throws NexusException {
        requireData();
        return links.captureIdentity();
    }

    public void makeLink(NodeId id) throws NexusException {
        links.attach(id);
    }

    public void makeNamedLink(String name, NodeId id) throws NexusException {
        links.attach(id, name);
    }

    public boolean sameId(NodeId a, NodeId b) {
        return links.sameNode(a, b);
    }

    /**
     * Path the active node links to, if it is an alias.
     *
     * @return the target path or empty
     * @throws NexusException if the attributes cannot be read
     */
    public Optional<String> link() throws NexusException {
        return links.aliasTarget();
    }

    /**
     * Moves onto the node the active alias designates.
     *
     * @return the steps applied
     * @throws NexusException if the target cannot be opened
     */
    public List<PathOperation> openSourceGroup() throws NexusException {
        return links.followAlias();
    }

    public String inquireFile() throws NexusException {
        return links.inquireFile();
    }

    public void linkExternal(String name, String nxclass, String url) throws NexusException {
        links.linkExternal(name, nxclass, url);
    }

    public Optional<String> isExternalGroup(String name, String nxclass) throws NexusException {
        return links.externalFileOf(name, nxclass);
    }

    /**
     * Renders the structure below a path.
     *
     * @param target start path, {@code null} for the current position
     * @return the rendered tree
     * @throws NexusException if the walk fails
     */
    public String show(String target) throws NexusException {
        return TreePrinter.print(this, target);
    }

    @Override
    public String toString() {
        return "NexusFile('" + location + "')";
    }

    // Internals

    /**
     * Gets the open handle.
     *
     * @return the store
     * @throws IllegalStateException if the file is not open
     */
    Store store() {
        Preconditions.checkState(store != null, "NeXus file %s is not open", location);
        return store;
    }

    /**
     * Wraps a store failure with the current position.
     *
     * @param message what was being attempted
     * @param segment node name involved, may be null
     * @param cause   the store failure
     * @return the exception to throw
     */
    StoreFailureException storeFailure(String message, String segment, IOException cause) {
        return new StoreFailureException(message + " in " + location, getPath(), segment, cause);
    }

    private void acquire(AccessMode openMode) throws NexusException {
        path.clear();
        inData = false;
        try {
            store = factory.open(location, openMode);
        } catch (IOException e) {
            store = null;
            String op = openMode.isCreate() ? "create" : "open";
            throw new StoreFailureException("Could not " + op + " " + location, "/", null, e);
        }
        log.info("Opened {} ({})", location, openMode.getCode());
    }

    private void requireGroup(String name) throws StructuralMismatchException {
        store();
        if (inData) {
            throw new StructuralMismatchException("Data is open, no group is active", getPath(),
                name);
        }
    }

    private void requireData() throws StructuralMismatchException {
        store();
        if (!inData) {
            throw new StructuralMismatchException("No data is open", getPath(), null);
        }
    }

    private static Object toBuffer(Object value, NexusType type, int[] shape) {
        // Rejects shapes larger than a Java array
        int size = Ints.checkedCast(Values.size(shape));
        if (type.isText() && value instanceof String) {
            return Values.encode((String) value, size);
        }
        if (value instanceof Number && size == 1) {
            return Values.scalarBuffer(value, type);
        }
        Preconditions.checkArgument(Values.isBufferOf(value, type),
            "Type mismatch, expected %s data", type);
        return value;
    }
}
