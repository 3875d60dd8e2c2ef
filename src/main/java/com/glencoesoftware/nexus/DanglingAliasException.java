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

/**
 * Raised when the target of an alias cannot be opened.
 */
public class DanglingAliasException extends NexusException {

    private static final long serialVersionUID = 1L;

    public DanglingAliasException(String message, String path, String segment) {
        super(message, path, segment);
    }

    public DanglingAliasException(String message, String path, String segment,
        Throwable cause) {
        super(message, path, segment, cause);
    }
}
