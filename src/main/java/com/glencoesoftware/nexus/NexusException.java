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

import java.io.IOException;

/**
 * Base class of failures raised while navigating a NeXus container. Every
 * failure records the absolute path the cursor was at and the segment or
 * name that triggered it.
 */
public class NexusException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String path;

    private final String segment;

    /**
     * Constructs a NexusException.
     *
     * @param message description of the failure
     * @param path    absolute path of the cursor when the failure occurred
     * @param segment the path segment or node name involved, may be null
     */
    public NexusException(String message, String path, String segment) {
        this(message, path, segment, null);
    }

    /**
     * Constructs a NexusException with a cause.
     *
     * @param message description of the failure
     * @param path    absolute path of the cursor when the failure occurred
     * @param segment the path segment or node name involved, may be null
     * @param cause   the underlying failure
     */
    public NexusException(String message, String path, String segment, Throwable cause) {
        super(format(message, path, segment), cause);
        this.path = path;
        this.segment = segment;
    }

    /**
     * Gets the absolute path of the cursor when the failure occurred.
     *
     * @return the path
     */
    public String getPath() {
        return path;
    }

    /**
     * Gets the segment or node name that triggered the failure.
     *
     * @return the segment, or {@code null}
     */
    public String getSegment() {
        return segment;
    }

    private static String format(String message, String path, String segment) {
        StringBuilder sb = new StringBuilder(message).append(" [path=").append(path);
        if (segment != null) {
            sb.append(", segment=").append(segment);
        }
        return sb.append(']').toString();
    }
}
