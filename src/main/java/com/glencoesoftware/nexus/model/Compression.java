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
 * Compression requested when a leaf is created. Only {@link #NONE} and
 * {@link #LZW} are supported by current NeXus libraries.
 */
public enum Compression {

    NONE("none", 100),
    LZW("lzw", 200),
    RLE("rle", 300),
    HUFFMAN("huffman", 400);

    private final String name;

    private final int code;

    Compression(String name, int code) {
        this.name = name;
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public int getCode() {
        return code;
    }

    /**
     * Looks up a compression scheme by name.
     *
     * @param name one of {@code none}, {@code lzw}, {@code rle}, {@code huffman}
     * @return the matching scheme
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Compression fromName(String name) {
        for (Compression c : values()) {
            if (c.name.equals(name)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown compression " + name);
    }
}
