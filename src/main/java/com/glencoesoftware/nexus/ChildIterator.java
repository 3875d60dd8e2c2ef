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

import com.glencoesoftware.nexus.model.ChildEntry;
import com.google.common.collect.AbstractIterator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the children of the active group on top of the store's single
 * pass child cursor.
 */
public class ChildIterator {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(ChildIterator.class);

    private final NexusFile file;

    private final NexusConfig config;

    ChildIterator(NexusFile file, NexusConfig config) {
        this.file = file;
        this.config = config;
    }

    /**
     * Lists every child of the active group in one enumeration pass. Names
     * are not guaranteed unique by the container; a repeated name keeps the
     * class seen last.
     *
     * @return child name vs. class, in enumeration order
     * @throws NexusException if no group is active or the store fails
     */
    public Map<String, String> listChildren() throws NexusException {
        Map<String, String> listing = new LinkedHashMap<>();
        for (ChildEntry entry : scan()) {
            listing.put(entry.getName(), entry.getNxclass());
        }
        return listing;
    }

    /**
     * Lists the children of the active group that are not of an ignorable
     * class, in enumeration order.
     *
     * @return the filtered entries
     * @throws NexusException if no group is active or the store fails
     */
    public List<ChildEntry> snapshot() throws NexusException {
        List<ChildEntry> entries = new ArrayList<>();
        for (ChildEntry entry : scan()) {
            if (config.isSkipped(entry.getNxclass())) {
                log.debug("Skipping {} entry {}", entry.getNxclass(), entry.getName());
                continue;
            }
            entries.add(entry);
        }
        return entries;
    }

    /**
     * Visits the children of the active group, opening each one in turn.
     *
     * <p>Each call to {@code iterator()} records the current path and takes
     * a snapshot of the children. Before every child is opened the recorded
     * path is resolved again, so callers may navigate freely while handling
     * a child. Do not rely on any node remaining open between children.</p>
     *
     * <p>Store failures surface from {@code hasNext()} as an
     * {@link UncheckedIOException} wrapping the {@link NexusException}; the
     * iteration cannot be resumed afterwards.</p>
     *
     * @return a restartable sequence of the children
     */
    public Iterable<ChildEntry> entries() {
        return () -> {
            try {
                return new EntryIterator(file.getPathStack(), snapshot());
            } catch (NexusException e) {
                throw new UncheckedIOException(e);
            }
        };
    }

    private List<ChildEntry> scan() throws NexusException {
        if (file.isInData()) {
            throw new StructuralMismatchException("Data has no children", file.getPath(), null);
        }
        List<ChildEntry> entries = new ArrayList<>();
        try {
            file.store().resetChildCursor();
            Optional<ChildEntry> next = file.store().nextChild();
            while (next.isPresent()) {
                entries.add(next.get());
                next = file.store().nextChild();
            }
        } catch (IOException e) {
            throw file.storeFailure("Could not get next entry", null, e);
        }
        log.debug("Enumerated {} entries at {}", entries.size(), file.getPath());
        return entries;
    }

    /** Replays a snapshot, restoring the recorded path before each entry. */
    private class EntryIterator extends AbstractIterator<ChildEntry> {

        private final String path;

        private final Iterator<ChildEntry> remaining;

        EntryIterator(List<String> stack, List<ChildEntry> entries) {
            this.path = PathResolver.toPath(stack);
            this.remaining = entries.iterator();
        }

        @Override
        protected ChildEntry computeNext() {
            if (!remaining.hasNext()) {
                return endOfData();
            }
            ChildEntry entry = remaining.next();
            try {
                file.openPath(path);
                if (entry.isData()) {
                    file.openData(entry.getName());
                } else {
                    file.openGroup(entry.getName(), entry.getNxclass());
                }
            } catch (NexusException e) {
                throw new UncheckedIOException(e);
            }
            return entry;
        }
    }
}
