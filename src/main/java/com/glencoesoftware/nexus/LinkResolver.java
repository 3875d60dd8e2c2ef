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

import com.glencoesoftware.nexus.model.NexusConstants;
import com.glencoesoftware.nexus.model.PathOperation;
import com.glencoesoftware.nexus.store.NodeId;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.LoggerFactory;

/**
 * Node identities, links and aliases. Linking a captured node into another
 * group gives it a second path, so the container becomes a DAG; the node
 * seen through the second path is an alias of the first, recognisable by
 * its {@value NexusConstants#TARGET_ATTRIBUTE} attribute naming a different
 * path.
 */
public class LinkResolver {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LinkResolver.class);

    private final NexusFile file;

    private final AttributeIterator attributes;

    LinkResolver(NexusFile file, AttributeIterator attributes) {
        this.file = file;
        this.attributes = attributes;
    }

    /**
     * Captures the identity of the open leaf, or of the active group when no
     * leaf is open. The identity is valid until the container is closed.
     *
     * @return the identity
     * @throws NexusException if the store fails
     */
    public NodeId captureIdentity() throws NexusException {
        try {
            return file.store().captureIdentity();
        } catch (IOException e) {
            throw file.storeFailure(
                file.isInData() ? "Could not link to data" : "Could not link to group", null, e);
        }
    }

    /**
     * Links a captured node into the active group under its own name.
     *
     * @param id a captured identity
     * @throws StructuralMismatchException if a leaf is open
     * @throws NexusException              if the store fails
     */
    public void attach(NodeId id) throws NexusException {
        requireGroup(null);
        try {
            file.store().attachIdentity(id);
        } catch (IOException e) {
            throw file.storeFailure("Could not make link", null, e);
        }
    }

    /**
     * Links a captured node into the active group under another name.
     *
     * @param id   a captured identity
     * @param name the name of the new link
     * @throws StructuralMismatchException if a leaf is open
     * @throws NexusException              if the store fails
     */
    public void attach(NodeId id, String name) throws NexusException {
        requireGroup(name);
        try {
            file.store().attachIdentity(name, id);
        } catch (IOException e) {
            throw file.storeFailure("Could not make link", name, e);
        }
    }

    /**
     * Compares two identities without touching the cursor.
     *
     * @param a first identity
     * @param b second identity
     * @return {@code true} if both designate the same node
     */
    public boolean sameNode(NodeId a, NodeId b) {
        return file.store().identitiesEqual(a, b);
    }

    /**
     * Returns the path the active node links to, if it is an alias: the
     * value of its {@value NexusConstants#TARGET_ATTRIBUTE} attribute when
     * that differs from the node's own path. Does not move the cursor.
     *
     * @return the target path, or empty for a primary node
     * @throws NexusException if the attributes cannot be read
     */
    public Optional<String> aliasTarget() throws NexusException {
        Optional<Object> target = attributes.find(NexusConstants.TARGET_ATTRIBUTE);
        if (!target.isPresent()) {
            return Optional.empty();
        }
        String value = String.valueOf(target.get());
        return value.equals(file.getPath()) ? Optional.empty() : Optional.of(value);
    }

    /**
     * If the active node is an alias, moves the cursor onto the node it
     * designates; otherwise does nothing.
     *
     * @return the steps applied, empty when the node is not an alias
     * @throws DanglingAliasException if the target cannot be opened; the
     *                                cursor may be left part way
     * @throws NexusException         if the attributes cannot be read
     */
    public List<PathOperation> followAlias() throws NexusException {
        Optional<String> target = aliasTarget();
        if (!target.isPresent()) {
            return Collections.emptyList();
        }
        String from = file.getPath();
        try {
            List<PathOperation> steps = file.openPath(target.get());
            log.debug("Followed alias {} to {}", from, target.get());
            return steps;
        } catch (NexusException e) {
            throw new DanglingAliasException("Could not open alias target", from,
                target.get(), e);
        }
    }

    /**
     * Checks, without opening it, whether a group of the active group
     * refers to another container.
     *
     * @param name    group name
     * @param nxclass group class
     * @return the reference URL, or empty
     * @throws NexusException if the store fails
     */
    public Optional<String> externalFileOf(String name, String nxclass) throws NexusException {
        try {
            return file.store().externalReferenceOf(name, nxclass);
        } catch (IOException e) {
            throw file.storeFailure("Could not check external link", name, e);
        }
    }

    /**
     * Creates a group in the active group referring to a group of another
     * container.
     *
     * @param name    group name
     * @param nxclass group class
     * @param url     the reference
     * @throws NexusException if the link cannot be made
     */
    public void linkExternal(String name, String nxclass, String url) throws NexusException {
        requireGroup(name);
        try {
            file.store().linkExternal(name, nxclass, url);
        } catch (IOException e) {
            throw file.storeFailure("Could not link " + name + " to " + url, name, e);
        }
    }

    /**
     * Gets the name of the container holding the active node, which differs
     * from the opened one below an external link.
     *
     * @return the container name
     * @throws NexusException if the store fails
     */
    public String inquireFile() throws NexusException {
        try {
            return file.store().inquireFile();
        } catch (IOException e) {
            throw file.storeFailure("Could not determine filename", null, e);
        }
    }

    private void requireGroup(String name) throws StructuralMismatchException {
        if (file.isInData()) {
            throw new StructuralMismatchException("Links can only be made inside a group",
                file.getPath(), name);
        }
    }
}
