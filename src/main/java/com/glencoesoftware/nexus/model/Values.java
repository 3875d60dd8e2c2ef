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

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;

/**
 * Helpers for moving text in and out of NUL terminated byte buffers.
 */
public abstract class Values {

    /**
     * Decodes at most {@code limit} bytes of a buffer, stopping at the first
     * NUL byte.
     *
     * @param buffer the text buffer
     * @param limit  maximum number of bytes to decode
     * @return the decoded text
     */
    public static String decode(byte[] buffer, int limit) {
        int end = Math.min(limit, buffer.length);
        for (int i = 0; i < end; i++) {
            if (buffer[i] == 0) {
                end = i;
                break;
            }
        }
        return new String(buffer, 0, end, StandardCharsets.UTF_8);
    }

    /**
     * Encodes text into a buffer of exactly {@code length} bytes, padding
     * with NUL bytes or truncating as required.
     *
     * @param text   the text to encode
     * @param length size of the buffer
     * @return the padded buffer
     */
    public static byte[] encode(String text, int length) {
        byte[] raw = text.getBytes(StandardCharsets.UTF_8);
        byte[] padded = new byte[length];
        System.arraycopy(raw, 0, padded, 0, Math.min(raw.length, length));
        return padded;
    }

    /**
     * Number of elements described by a shape.
     *
     * @param shape dimensions
     * @return the product of the dimensions
     */
    public static long size(int[] shape) {
        long size = 1;
        for (int dim : shape) {
            size *= dim;
        }
        return size;
    }

    /**
     * Converts a scalar or a single element array into a one element buffer
     * of the given numeric type.
     *
     * @param value a boxed number or a primitive array of length one
     * @param type  target numeric type
     * @return a one element primitive array
     * @throws IllegalArgumentException if the value is not a scalar number
     */
    public static Object scalarBuffer(Object value, NexusType type) {
        Object element = value;
        if (value != null && value.getClass().isArray()) {
            if (Array.getLength(value) != 1) {
                throw new IllegalArgumentException("Attribute value must be scalar or string");
            }
            element = Array.get(value, 0);
        }
        if (!(element instanceof Number)) {
            throw new IllegalArgumentException("Expected a number for " + type + " value");
        }
        Number n = (Number) element;
        Object buffer = type.allocate(1);
        switch (type) {
            case INT8:
            case UINT8:
                ((byte[]) buffer)[0] = n.byteValue();
                break;
            case INT16:
            case UINT16:
                ((short[]) buffer)[0] = n.shortValue();
                break;
            case INT32:
            case UINT32:
                ((int[]) buffer)[0] = n.intValue();
                break;
            case INT64:
            case UINT64:
                ((long[]) buffer)[0] = n.longValue();
                break;
            case FLOAT32:
                ((float[]) buffer)[0] = n.floatValue();
                break;
            case FLOAT64:
                ((double[]) buffer)[0] = n.doubleValue();
                break;
            default:
                throw new IllegalArgumentException("Expected string for 'char' attribute value");
        }
        return buffer;
    }

    /**
     * Whether a buffer is the primitive array used for a type.
     *
     * @param buffer candidate buffer
     * @param type   element type
     * @return {@code true} if the buffer's component type matches
     */
    public static boolean isBufferOf(Object buffer, NexusType type) {
        return buffer != null && buffer.getClass().equals(type.allocate(0).getClass());
    }
}
