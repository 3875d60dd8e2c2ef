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

package com.glencoesoftware.nexus.model;

/**
 * Modes a NeXus container can be opened with, together with the short codes
 * accepted by {@link #fromCode(String)}.
 */
public enum AccessMode {

    READ("r", 1),
    READ_WRITE("rw", 2),
    CREATE("w", 3),
    CREATE4("w4", 4),
    CREATE5("w5", 5),
    CREATE_XML("wx", 6);

    private final String code;

    private final int value;

    AccessMode(String code, int value) {
        this.code = code;
        this.value = value;
    }

    public String getCode() {
        return code;
    }

    public int getValue() {
        return value;
    }

    /**
     * Whether this mode creates a new container.
     *
     * @return {@code true} for the create modes
     */
    public boolean isCreate() {
        return value >= CREATE.value;
    }

    /**
     * Whether writes are permitted.
     *
     * @return {@code false} only for {@link #READ}
     */
    public boolean isWritable() {
        return this != READ;
    }

    /**
     * The mode used when a closed container is opened again. A container that
     * was created is reopened for update.
     *
     * @return {@link #READ} or {@link #READ_WRITE}
     */
    public AccessMode reopenMode() {
        return this == READ ? READ : READ_WRITE;
    }

    /**
     * Parses a short mode code such as {@code "rw"}.
     *
     * @param code the mode code
     * @return the matching mode
     * @throws IllegalArgumentException if the code is invalid
     */
    public static AccessMode fromCode(String code) {
        for (AccessMode mode : values()) {
            if (mode.code.equals(code)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid open mode " + code);
    }
}
