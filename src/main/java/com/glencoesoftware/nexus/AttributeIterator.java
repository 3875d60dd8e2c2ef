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

import com.glencoesoftware.nexus.model.AttributeInfo;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Maps;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the attributes of the active node. Each pass resets the store's
 * attribute cursor and drains it; reading attributes never moves the
 * cursor, so no snapshot is taken.
 */
public class AttributeIterator {

    private final NexusFile file;

    AttributeIterator(NexusFile file) {
        this.file = file;
    }

    /**
     * Iterates name and value of every attribute of the active node. Do not
     * change the active node while iterating.
     *
     * <p>Store failures surface from {@code hasNext()} as an
     * {@link UncheckedIOException} wrapping the {@link NexusException}.</p>
     *
     * @return a restartable sequence of attributes
     */
    public Iterable<Map.Entry<String, Object>> attributes() {
        return () -> new AbstractIterator<Map.Entry<String, Object>>() {

            private boolean started = false;

            @Override
            protected Map.Entry<String, Object> computeNext() {
                try {
                    if (!started) {
                        reset();
                        started = true;
                    }
                    Optional<AttributeInfo> info = nextInfo();
                    if (!info.isPresent()) {
                        return endOfData();
                    }
                    AttributeInfo i = info.get();
                    return Maps.immutableEntry(i.getName(), read(i));
                } catch (NexusException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
    }

    /**
     * Reads every attribute of the active node.
     *
     * @return attribute name vs. value, in enumeration order
     * @throws NexusException if the store fails
     */
    public Map<String, Object> readAll() throws NexusException {
        Map<String, Object> values = new LinkedHashMap<>();
        reset();
        Optional<AttributeInfo> info = nextInfo();
        while (info.isPresent()) {
            values.put(info.get().getName(), read(info.get()));
            info = nextInfo();
        }
        return values;
    }

    /**
     * Lists the metadata of every attribute without reading values.
     *
     * @return name, length and type per attribute
     * @throws NexusException if the store fails
     */
    public List<AttributeInfo> infos() throws NexusException {
        List<AttributeInfo> infos = new ArrayList<>();
        reset();
        Optional<AttributeInfo> info = nextInfo();
        while (info.isPresent()) {
            infos.add(info.get());
            info = nextInfo();
        }
        return infos;
    }

    /**
     * Reads a single attribute by name, skipping the values of the others.
     *
     * @param name attribute name
     * @return the value, or empty if the node has no such attribute
     * @throws NexusException if the store fails
     */
    public Optional<Object> find(String name) throws NexusException {
        reset();
        Optional<AttributeInfo> info = nextInfo();
        while (info.isPresent()) {
            if (info.get().getName().equals(name)) {
                return Optional.of(read(info.get()));
            }
            info = nextInfo();
        }
        return Optional.empty();
    }

    private void reset() throws NexusException {
        try {
            file.store().resetAttributeCursor();
        } catch (IOException e) {
            throw file.storeFailure("Could not reset attribute list", null, e);
        }
    }

    private Optional<AttributeInfo> nextInfo() throws NexusException {
        try {
            return file.store().nextAttributeMeta();
        } catch (IOException e) {
            throw file.storeFailure("Could not get next attr", null, e);
        }
    }

    private Object read(AttributeInfo info) throws NexusException {
        return file.getAttr(info.getName(), info.getLength(), info.getType());
    }
}
