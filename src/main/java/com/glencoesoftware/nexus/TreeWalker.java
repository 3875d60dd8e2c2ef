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
import com.glencoesoftware.nexus.model.DataInfo;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.perf4j.StopWatch;
import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.LoggerFactory;

/**
 * Walks a subtree depth first in enumeration order, reporting every node to
 * a {@link NexusVisitor} once. Aliases are reported but not descended into,
 * which keeps the walk finite on a DAG.
 */
public class TreeWalker {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(TreeWalker.class);

    private final NexusFile file;

    private final int inlineThreshold;

    /**
     * Constructs a walker using the inline threshold of the file's
     * configuration.
     *
     * @param file an open NeXus file
     */
    public TreeWalker(NexusFile file) {
        this(file, file.getConfig().getInlineThreshold());
    }

    /**
     * Constructs a walker.
     *
     * @param file            an open NeXus file
     * @param inlineThreshold leaves with fewer elements have their value reported
     */
    public TreeWalker(NexusFile file, int inlineThreshold) {
        this.file = file;
        this.inlineThreshold = inlineThreshold;
    }

    /**
     * Walks the subtree at a path. The cursor is returned to where it was
     * once the walk ends.
     *
     * @param path    absolute or relative start path, {@code null} for the
     *                current position
     * @param visitor receives the nodes
     * @throws NexusException if navigation or reading fails
     */
    public void walk(String path, NexusVisitor visitor) throws NexusException {
        String saved = file.getPath();
        StopWatch t0 = new Slf4JStopWatch("TreeWalker.walk", path == null ? saved : path);
        boolean completed = false;
        try {
            if (path != null) {
                file.openPath(path);
            }
            visitor.onFile(file.links().inquireFile(), file.getPath());
            if (file.isInData()) {
                List<String> stack = file.getPathStack();
                visitLeaf(stack.get(stack.size() - 1), visitor);
            } else {
                visitGroup(visitor);
            }
            completed = true;
        } catch (UncheckedIOException e) {
            log.error("Failed walking {}", file.getPath(), e);
            if (e.getCause() instanceof NexusException) {
                throw (NexusException) e.getCause();
            }
            throw new StoreFailureException("Walk failed", file.getPath(), null, e.getCause());
        } finally {
            try {
                file.openPath(saved);
            } catch (NexusException e) {
                if (completed) {
                    throw e;
                }
                log.warn("Could not return to {} after failed walk", saved, e);
            } finally {
                t0.stop();
            }
        }
    }

    private void visitGroup(NexusVisitor visitor) throws NexusException {
        Optional<String> alias = file.links().aliasTarget();
        if (alias.isPresent()) {
            visitor.onAlias(alias.get());
            return;
        }
        for (Map.Entry<String, Object> attr : file.attributes().attributes()) {
            visitor.onAttribute(attr.getKey(), attr.getValue());
        }
        for (ChildEntry entry : file.children().entries()) {
            if (entry.isData()) {
                visitLeaf(entry.getName(), visitor);
            } else {
                visitor.onGroupEnter(entry.getName(), entry.getNxclass());
                visitGroup(visitor);
                visitor.onGroupExit();
            }
        }
    }

    /** Reports the open leaf; leaves have no children. */
    private void visitLeaf(String name, NexusVisitor visitor) throws NexusException {
        DataInfo info = file.getInfo();
        Optional<String> alias = file.links().aliasTarget();
        Object inline = null;
        if (!alias.isPresent() && info.getSize() < inlineThreshold) {
            inline = file.getData();
        }
        visitor.onLeaf(name, info.getShape(), info.getType(), inline);
        if (alias.isPresent()) {
            visitor.onAlias(alias.get());
            return;
        }
        for (Map.Entry<String, Object> attr : file.attributes().attributes()) {
            visitor.onAttribute(attr.getKey(), attr.getValue());
        }
    }
}
