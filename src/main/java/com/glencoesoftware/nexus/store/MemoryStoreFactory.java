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
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.LoggerFactory;

/**
 * Keeps named containers in memory and hands out {@link MemoryStore} handles
 * on them. Containers survive their handles being closed, so a container can
 * be reopened and referenced from external links in other containers.
 *
 * <p>Handles on different containers are independent and may be used from
 * different threads.</p>
 */
public class MemoryStoreFactory implements StoreFactory {

    private static final org.slf4j.Logger log =
        LoggerFactory.getLogger(MemoryStoreFactory.class);

    /** Container name vs. container. */
    private final Map<String, MemoryContainer> containers = new ConcurrentHashMap<>();

    /** Emulate backends whose text attribute metadata is one element short. */
    private final boolean legacyStringAttributes;

    /**
     * Creates a factory whose handles report exact text attribute lengths.
     */
    public MemoryStoreFactory() {
        this(false);
    }

    /**
     * Creates a factory.
     *
     * @param legacyStringAttributes whether handles need a terminator element
     *                               when reading text attributes
     */
    public MemoryStoreFactory(boolean legacyStringAttributes) {
        this.legacyStringAttributes = legacyStringAttributes;
    }

    @Override
    public Store open(String location, AccessMode mode) throws IOException {
        MemoryContainer container;
        if (mode.isCreate()) {
            container = new MemoryContainer(location);
            containers.put(location, container);
            log.debug("Created container {}", location);
        } else {
            container = containers.get(location);
            if (container == null) {
                throw new IOException("Could not open " + location);
            }
        }
        return new MemoryStore(this, container, mode, legacyStringAttributes);
    }

    /**
     * Whether a container exists.
     *
     * @param location container name
     * @return {@code true} if the container has been created
     */
    public boolean exists(String location) {
        return containers.containsKey(location);
    }

    /**
     * Discards a container. Open handles keep working on the detached tree.
     *
     * @param location container name
     * @return {@code true} if a container was removed
     */
    public boolean delete(String location) {
        return containers.remove(location) != null;
    }

    /**
     * Looks up a container for external link resolution.
     *
     * @param location container name
     * @return the container
     * @throws IOException if there is no such container
     */
    MemoryContainer lookup(String location) throws IOException {
        MemoryContainer container = containers.get(location);
        if (container == null) {
            throw new IOException("External container not found: " + location);
        }
        return container;
    }
}
