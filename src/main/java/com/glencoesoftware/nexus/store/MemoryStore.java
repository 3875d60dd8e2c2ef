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

import com.glencoesoftware.nexus.model.AccessMode;
import com.glencoesoftware.nexus.model.AttributeInfo;
import com.glencoesoftware.nexus.model.ChildEntry;
import com.glencoesoftware.nexus.model.Compression;
import com.glencoesoftware.nexus.model.DataInfo;
import com.glencoesoftware.nexus.model.GroupInfo;
import com.glencoesoftware.nexus.model.NexusConstants;
import com.glencoesoftware.nexus.model.NexusType;
import com.glencoesoftware.nexus.model.Values;
import com.glencoesoftware.nexus.store.MemoryContainer.Attribute;
import com.glencoesoftware.nexus.store.MemoryContainer.ExternalGroup;
import com.glencoesoftware.nexus.store.MemoryContainer.Group;
import com.glencoesoftware.nexus.store.MemoryContainer.Leaf;
import com.glencoesoftware.nexus.store.MemoryContainer.Node;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.LoggerFactory;

/**
 * {@link Store} over a {@link MemoryContainer}. Mirrors the behaviour of the
 * NeXus API: one active group, at most one open leaf inside it, and
 * single pass child and attribute cursors that are reset whenever the active
 * node changes.
 */
public class MemoryStore implements Store {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(MemoryStore.class);

    /** Scheme of external link URLs. */
    public static final String EXTERNAL_SCHEME = "nxfile://";

    /** An open node together with the name and container it was opened from. */
    private static class Frame {

        final String name;

        final Node node;

        final MemoryContainer container;

        Frame(String name, Node node, MemoryContainer container) {
            this.name = name;
            this.node = node;
            this.container = container;
        }
    }

    /** Identity of a node plus the path it was captured at. */
    private static class MemoryNodeId implements NodeId {

        final Node node;

        final String name;

        final String path;

        MemoryNodeId(Node node, String name, String path) {
            this.node = node;
            this.name = name;
            this.path = path;
        }

        @Override
        public String toString() {
            return "MemoryNodeId{" + "path='" + path + '\'' + '}';
        }
    }

    private final MemoryStoreFactory factory;

    private final MemoryContainer container;

    private final AccessMode mode;

    private final boolean legacyStringAttributes;

    /** Open nodes, root at the bottom. */
    private final Deque<Frame> frames = new ArrayDeque<>();

    private Iterator<ChildEntry> childCursor;

    private Iterator<AttributeInfo> attributeCursor;

    private boolean closed = false;

    MemoryStore(MemoryStoreFactory factory, MemoryContainer container, AccessMode mode,
        boolean legacyStringAttributes) {
        this.factory = factory;
        this.container = container;
        this.mode = mode;
        this.legacyStringAttributes = legacyStringAttributes;
        frames.push(new Frame("", container.root, container));
    }

    @Override
    public String getLocation() {
        return container.name;
    }

    @Override
    public String inquireFile() throws IOException {
        ensureOpen();
        return frames.peek().container.name;
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        log.debug("Flushed {}", container.name);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            throw new IOException("Could not close NeXus file " + container.name);
        }
        closed = true;
        frames.clear();
        childCursor = null;
        attributeCursor = null;
    }

    // Groups

    @Override
    public void makeGroup(String name, String nxclass) throws IOException {
        Group group = activeGroup();
        ensureWritable();
        if (group.children.containsKey(name)) {
            throw new IOException("Could not create " + nxclass + ":" + name + " in "
                + location());
        }
        group.children.put(name, new Group(nxclass));
    }

    @Override
    public void openGroup(String name, String nxclass) throws IOException {
        Group group = activeGroup();
        Node child = group.children.get(name);
        if (child == null || child instanceof Leaf
            || (nxclass != null && !nxclass.equals(child.nxclass()))) {
            throw new IOException("Could not open " + nxclass + ":" + name + " in "
                + location());
        }
        if (child instanceof ExternalGroup) {
            ExternalGroup external = (ExternalGroup) child;
            push(new Frame(name, resolveExternal(external.url), targetContainer(external.url)));
        } else {
            push(new Frame(name, child, frames.peek().container));
        }
    }

    @Override
    public void closeGroup() throws IOException {
        ensureOpen();
        Frame top = frames.peek();
        if (frames.size() == 1 || !(top.node instanceof Group)) {
            throw new IOException("Could not close group at " + location());
        }
        pop();
    }

    @Override
    public GroupInfo getGroupInfo() throws IOException {
        Group group = activeGroup();
        Frame top = frames.peek();
        return new GroupInfo(group.children.size(), top.name, group.nxclass);
    }

    // Enumeration

    @Override
    public void resetChildCursor() throws IOException {
        Group group = activeGroup();
        List<ChildEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Node> e : group.children.entrySet()) {
            entries.add(new ChildEntry(e.getKey(), e.getValue().nxclass()));
        }
        childCursor = entries.iterator();
    }

    @Override
    public Optional<ChildEntry> nextChild() throws IOException {
        if (childCursor == null) {
            resetChildCursor();
        }
        return childCursor.hasNext() ? Optional.of(childCursor.next()) : Optional.empty();
    }

    @Override
    public void resetAttributeCursor() throws IOException {
        Node node = activeNode();
        List<AttributeInfo> infos = new ArrayList<>();
        for (Map.Entry<String, Attribute> e : node.attributes.entrySet()) {
            Attribute attr = e.getValue();
            infos.add(new AttributeInfo(e.getKey(), Array.getLength(attr.value), attr.type));
        }
        attributeCursor = infos.iterator();
    }

    @Override
    public int getAttributeCount() throws IOException {
        return activeNode().attributes.size();
    }

    @Override
    public Optional<AttributeInfo> nextAttributeMeta() throws IOException {
        if (attributeCursor == null) {
            resetAttributeCursor();
        }
        return attributeCursor.hasNext()
            ? Optional.of(attributeCursor.next()) : Optional.empty();
    }

    // Attributes

    @Override
    public Object readAttribute(String name, int length, NexusType type) throws IOException {
        Attribute attr = activeNode().attributes.get(name);
        if (attr == null || attr.type != type) {
            throw new IOException("Could not read attr " + name + ": " + location());
        }
        if (type.isText()) {
            // A terminating NUL must fit in the buffer on legacy backends
            int usable = legacyStringAttributes ? length - 1 : length;
            return Values.decode((byte[]) attr.value, Math.max(usable, 0));
        }
        Object buffer = type.allocate(length);
        System.arraycopy(attr.value, 0, buffer, 0,
            Math.min(length, Array.getLength(attr.value)));
        Object widened = type.widen(buffer);
        return length == 1 ? Array.get(widened, 0) : widened;
    }

    @Override
    public void putAttribute(String name, Object value, NexusType type) throws IOException {
        Node node = activeNode();
        ensureWritable();
        Object stored;
        if (type.isText()) {
            if (!(value instanceof String)) {
                throw new IOException("Expected string for 'char' attribute value");
            }
            stored = ((String) value).getBytes(StandardCharsets.UTF_8);
        } else {
            try {
                stored = Values.scalarBuffer(value, type);
            } catch (IllegalArgumentException e) {
                throw new IOException("Could not write attr " + name + ": " + location(), e);
            }
        }
        node.attributes.put(name, new Attribute(type, stored));
        attributeCursor = null;
    }

    @Override
    public boolean requiresStringTerminator() {
        return legacyStringAttributes;
    }

    // Leaves

    @Override
    public void makeData(String name, NexusType type, int[] shape) throws IOException {
        compMakeData(name, type, shape, Compression.NONE, null);
    }

    @Override
    public void compMakeData(String name, NexusType type, int[] shape,
        Compression compression, int[] chunks) throws IOException {
        Group group = activeGroup();
        ensureWritable();
        if (group.children.containsKey(name) || shape.length == 0) {
            throw new IOException("Could not create data " + name + ": " + location());
        }
        int[] actual = shape.clone();
        boolean unlimited = actual[0] == NexusConstants.UNLIMITED;
        if (unlimited) {
            actual[0] = 0;
        }
        for (int dim : actual) {
            if (dim < 0) {
                throw new IOException("Could not create data " + name + ": " + location());
            }
        }
        group.children.put(name, new Leaf(type, actual, unlimited, compression,
            chunks == null ? null : chunks.clone()));
    }

    @Override
    public void openLeaf(String name) throws IOException {
        Group group = activeGroup();
        Node child = group.children.get(name);
        if (!(child instanceof Leaf)) {
            throw new IOException("Could not open data " + name + ": " + location());
        }
        push(new Frame(name, child, frames.peek().container));
    }

    @Override
    public void closeLeaf() throws IOException {
        openLeaf();
        pop();
    }

    @Override
    public DataInfo getInfo() throws IOException {
        Leaf leaf = openLeaf();
        return new DataInfo(leaf.shape, leaf.type);
    }

    @Override
    public Object getData() throws IOException {
        Leaf leaf = openLeaf();
        int size = Array.getLength(leaf.data);
        Object copy = leaf.type.allocate(size);
        System.arraycopy(leaf.data, 0, copy, 0, size);
        return copy;
    }

    @Override
    public Object getSlab(int[] offset, int[] shape) throws IOException {
        Leaf leaf = openLeaf();
        checkSlab(leaf, offset, shape, false);
        Object slab = leaf.type.allocate((int) Values.size(shape));
        transfer(leaf.data, leaf.shape, slab, offset, shape, true);
        return slab;
    }

    @Override
    public void putData(Object buffer) throws IOException {
        Leaf leaf = openLeaf();
        ensureWritable();
        if (!Values.isBufferOf(buffer, leaf.type)
            || Array.getLength(buffer) != Array.getLength(leaf.data)) {
            throw new IOException("Could not write data: " + location());
        }
        System.arraycopy(buffer, 0, leaf.data, 0, Array.getLength(buffer));
    }

    @Override
    public void putSlab(Object buffer, int[] offset, int[] shape) throws IOException {
        Leaf leaf = openLeaf();
        ensureWritable();
        if (!Values.isBufferOf(buffer, leaf.type)
            || Array.getLength(buffer) != Values.size(shape)) {
            throw new IOException("Could not write slab: " + location());
        }
        checkSlab(leaf, offset, shape, true);
        if (leaf.unlimited && offset[0] + shape[0] > leaf.shape[0]) {
            int[] grown = leaf.shape.clone();
            grown[0] = offset[0] + shape[0];
            Object data = leaf.type.allocate((int) Values.size(grown));
            System.arraycopy(leaf.data, 0, data, 0, Array.getLength(leaf.data));
            leaf.data = data;
            leaf.shape = grown;
        }
        transfer(leaf.data, leaf.shape, buffer, offset, shape, false);
    }

    // Identity

    @Override
    public NodeId captureIdentity() throws IOException {
        ensureOpen();
        Frame top = frames.peek();
        return new MemoryNodeId(top.node, top.name, currentPath());
    }

    @Override
    public void attachIdentity(NodeId id) throws IOException {
        if (!(id instanceof MemoryNodeId)) {
            throw new IOException("Could not make link: " + location());
        }
        attachIdentity(((MemoryNodeId) id).name, id);
    }

    @Override
    public void attachIdentity(String name, NodeId id) throws IOException {
        if (!(id instanceof MemoryNodeId) || frames.peek() == null
            || !(frames.peek().node instanceof Group)) {
            throw new IOException("Could not make link " + name + ": " + location());
        }
        Group group = activeGroup();
        ensureWritable();
        MemoryNodeId source = (MemoryNodeId) id;
        if (group.children.containsKey(name) || source.node == group) {
            throw new IOException("Could not make link " + name + ": " + location());
        }
        group.children.put(name, source.node);
        if (!source.node.attributes.containsKey(NexusConstants.TARGET_ATTRIBUTE)) {
            source.node.attributes.put(NexusConstants.TARGET_ATTRIBUTE,
                new Attribute(NexusType.CHAR, source.path.getBytes(StandardCharsets.UTF_8)));
        }
    }

    @Override
    public boolean identitiesEqual(NodeId a, NodeId b) {
        if (!(a instanceof MemoryNodeId) || !(b instanceof MemoryNodeId)) {
            return false;
        }
        return ((MemoryNodeId) a).node == ((MemoryNodeId) b).node;
    }

    // External references

    @Override
    public Optional<String> externalReferenceOf(String name, String nxclass) throws IOException {
        Group group = activeGroup();
        Node child = group.children.get(name);
        if (child instanceof ExternalGroup
            && (nxclass == null || nxclass.equals(child.nxclass()))) {
            return Optional.of(((ExternalGroup) child).url);
        }
        return Optional.empty();
    }

    @Override
    public void linkExternal(String name, String nxclass, String url) throws IOException {
        Group group = activeGroup();
        ensureWritable();
        if (group.children.containsKey(name) || !url.startsWith(EXTERNAL_SCHEME)) {
            throw new IOException("Could not link " + name + " to " + url + ": " + location());
        }
        group.children.put(name, new ExternalGroup(nxclass, url));
    }

    @Override
    public String toString() {
        return "MemoryStore{" + "location='" + container.name + '\'' + ", mode=" + mode
            + ", path='" + (closed ? "" : currentPath()) + '\'' + '}';
    }

    // Internals

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("NeXus file " + container.name + " is closed");
        }
    }

    private void ensureWritable() throws IOException {
        if (!mode.isWritable()) {
            throw new IOException("NeXus file " + container.name + " is opened read only");
        }
    }

    private Node activeNode() throws IOException {
        ensureOpen();
        return frames.peek().node;
    }

    /** The active group; fails while a leaf is open. */
    private Group activeGroup() throws IOException {
        Node node = activeNode();
        if (!(node instanceof Group)) {
            throw new IOException("No group is active, data is open at " + location());
        }
        return (Group) node;
    }

    private Leaf openLeaf() throws IOException {
        Node node = activeNode();
        if (!(node instanceof Leaf)) {
            throw new IOException("No data open at " + location());
        }
        return (Leaf) node;
    }

    private void push(Frame frame) {
        frames.push(frame);
        childCursor = null;
        attributeCursor = null;
    }

    private void pop() {
        frames.pop();
        childCursor = null;
        attributeCursor = null;
    }

    private String currentPath() {
        List<String> names = new ArrayList<>();
        Iterator<Frame> it = frames.descendingIterator();
        it.next();
        while (it.hasNext()) {
            names.add(it.next().name);
        }
        return "/" + Joiner.on('/').join(names);
    }

    private String location() {
        return container.name + "(" + currentPath() + ")";
    }

    private MemoryContainer targetContainer(String url) throws IOException {
        List<String> parts = splitUrl(url);
        return factory.lookup(parts.get(0));
    }

    /** Walks {@code nxfile://container#/path} down to the referenced group. */
    private Group resolveExternal(String url) throws IOException {
        List<String> parts = splitUrl(url);
        MemoryContainer target = factory.lookup(parts.get(0));
        Node node = target.root;
        String path = parts.size() > 1 ? parts.get(1) : "/";
        for (String segment : Splitter.on('/').omitEmptyStrings().split(path)) {
            if (!(node instanceof Group)) {
                node = null;
                break;
            }
            node = ((Group) node).children.get(segment);
        }
        if (!(node instanceof Group)) {
            throw new IOException("Could not resolve external link " + url);
        }
        return (Group) node;
    }

    private static List<String> splitUrl(String url) throws IOException {
        if (!url.startsWith(EXTERNAL_SCHEME)) {
            throw new IOException("Unsupported external link " + url);
        }
        return Splitter.on('#').limit(2).splitToList(url.substring(EXTERNAL_SCHEME.length()));
    }

    private static void checkSlab(Leaf leaf, int[] offset, int[] shape, boolean write)
        throws IOException {
        if (offset.length != leaf.shape.length || shape.length != leaf.shape.length) {
            throw new IOException("Slab rank does not match data rank " + leaf.shape.length);
        }
        for (int d = 0; d < shape.length; d++) {
            boolean growable = write && d == 0 && leaf.unlimited;
            if (offset[d] < 0 || shape[d] < 0
                || (!growable && offset[d] + shape[d] > leaf.shape[d])) {
                throw new IOException("Slab out of bounds in dimension " + d);
            }
        }
    }

    /**
     * Copies a hyperslab between a leaf buffer and a slab buffer, one
     * contiguous row of the last dimension at a time.
     */
    private static void transfer(Object leafData, int[] leafShape, Object slab, int[] offset,
        int[] shape, boolean read) {
        if (Values.size(shape) == 0) {
            return;
        }
        int rank = shape.length;
        int row = shape[rank - 1];
        int[] index = new int[rank];
        int slabPos = 0;
        while (true) {
            int leafPos = 0;
            for (int d = 0; d < rank; d++) {
                leafPos = leafPos * leafShape[d] + offset[d] + index[d];
            }
            if (read) {
                System.arraycopy(leafData, leafPos, slab, slabPos, row);
            } else {
                System.arraycopy(slab, slabPos, leafData, leafPos, row);
            }
            slabPos += row;
            int d = rank - 2;
            while (d >= 0) {
                index[d]++;
                if (index[d] < shape[d]) {
                    break;
                }
                index[d] = 0;
                d--;
            }
            if (d < 0) {
                return;
            }
        }
    }
}
