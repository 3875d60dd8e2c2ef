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
import com.glencoesoftware.nexus.model.PathOperation;
import com.glencoesoftware.nexus.model.ResolveMode;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Turns a path expression into the close and open steps that move a
 * {@link NexusFile} from where it is to where the path points.
 *
 * <p>Paths starting with {@code /} are absolute, anything else is relative
 * to the current position. {@code .} segments and empty segments are
 * dropped and {@code ..} removes the preceding segment. The class of each
 * node to open is only known from an enumeration pass over its parent, so
 * opening steps are discovered one segment at a time.</p>
 *
 * <p>Steps are applied as they are discovered. When a step fails the
 * cursor is left where the previous step put it.</p>
 */
public class PathResolver {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(PathResolver.class);

    public static final char SEPARATOR = '/';

    public static final String CURRENT = ".";

    public static final String PARENT = "..";

    private static final Splitter SPLITTER = Splitter.on(SEPARATOR);

    private static final Joiner JOINER = Joiner.on(SEPARATOR);

    private final NexusFile file;

    private final ChildIterator children;

    PathResolver(NexusFile file, ChildIterator children) {
        this.file = file;
        this.children = children;
    }

    /**
     * Computes the normalized segment list a path expression points to.
     *
     * @param current    the current path stack
     * @param expression absolute or relative path
     * @return the target path stack
     * @throws PathUnderflowException if a {@code ..} would climb above the root
     */
    public static List<String> normalize(List<String> current, String expression)
        throws PathUnderflowException {
        List<String> raw = new ArrayList<>();
        if (!expression.startsWith(String.valueOf(SEPARATOR))) {
            raw.addAll(current);
        }
        SPLITTER.split(expression).forEach(raw::add);

        List<String> target = new ArrayList<>();
        for (String segment : raw) {
            if (segment.isEmpty() || CURRENT.equals(segment)) {
                continue;
            }
            if (PARENT.equals(segment)) {
                if (target.isEmpty()) {
                    throw new PathUnderflowException("Too many '..' in " + expression,
                        toPath(current), segment);
                }
                target.remove(target.size() - 1);
            } else {
                target.add(segment);
            }
        }
        return target;
    }

    /**
     * Length of the common prefix of two path stacks.
     *
     * @param a first stack
     * @param b second stack
     * @return index of the first differing segment, or the shorter length
     */
    public static int commonPrefix(List<String> a, List<String> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            if (!a.get(i).equals(b.get(i))) {
                return i;
            }
        }
        return n;
    }

    /**
     * Formats a path stack as an absolute path.
     *
     * @param stack segment names from the root
     * @return e.g. {@code /entry1/data}, or {@code /} for the root
     */
    public static String toPath(List<String> stack) {
        return SEPARATOR + JOINER.join(stack);
    }

    /**
     * Moves the cursor to the node a path expression points to.
     *
     * @param expression absolute or relative path
     * @param mode       whether a final leaf is opened
     * @return the steps that were applied, in order
     * @throws NexusException if the path is malformed, a segment does not
     *                        exist, the path descends through a leaf, or the
     *                        store fails
     */
    public List<PathOperation> resolve(String expression, ResolveMode mode)
        throws NexusException {
        List<String> current = file.getPathStack();
        List<String> target = normalize(current, expression);
        if (mode == ResolveMode.GROUP_ONLY && file.isInData() && target.equals(current)) {
            // The open leaf is the target; stop at its group
            target = target.subList(0, target.size() - 1);
        }
        int common = commonPrefix(current, target);

        if (file.isInData() && common == current.size() && target.size() > common) {
            throw new NotTraversableException("Cannot descend below data",
                file.getPath(), target.get(common));
        }

        List<PathOperation> applied = new ArrayList<>();
        for (int i = current.size(); i > common; i--) {
            if (file.isInData()) {
                file.closeData();
            } else {
                file.closeGroup();
            }
            applied.add(PathOperation.close());
        }

        for (int i = common; i < target.size(); i++) {
            String segment = target.get(i);
            boolean last = i == target.size() - 1;
            Map<String, String> listing = children.listChildren();
            String nxclass = listing.get(segment);
            if (nxclass == null) {
                throw new NodeNotFoundException("Node " + segment + " not in "
                    + file.getPath(), file.getPath(), segment);
            }
            if (ChildEntry.DATA_CLASS.equals(nxclass)) {
                if (!last) {
                    throw new NotTraversableException("Cannot descend below data " + segment,
                        file.getPath(), segment);
                }
                if (mode == ResolveMode.GROUP_ONLY) {
                    break;
                }
                file.openData(segment);
                applied.add(PathOperation.openLeaf(segment));
            } else {
                file.openGroup(segment, nxclass);
                applied.add(PathOperation.openGroup(segment));
            }
        }
        log.debug("Resolved {} to {} via {}", expression, file.getPath(), applied);
        return Collections.unmodifiableList(applied);
    }
}
