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
import java.math.BigInteger;

/**
 * Element types a NeXus leaf or attribute can be stored as. The codes are the
 * storage codes used by the NeXus API.
 */
public enum NexusType {

    CHAR("char", 4),
    FLOAT32("float32", 5),
    FLOAT64("float64", 6),
    INT8("int8", 20),
    UINT8("uint8", 21),
    INT16("int16", 22),
    UINT16("uint16", 23),
    INT32("int32", 24),
    UINT32("uint32", 25),
    INT64("int64", 26),
    UINT64("uint64", 27);

    private final String name;

    private final int code;

    NexusType(String name, int code) {
        this.name = name;
        this.code = code;
    }

    /**
     * Gets the type name, e.g. {@code float64} or {@code char}.
     *
     * @return the type name
     */
    public String getName() {
        return name;
    }

    /**
     * Gets the NeXus storage code.
     *
     * @return the storage code
     */
    public int getCode() {
        return code;
    }

    /**
     * Looks up a type by its name.
     *
     * @param name type name such as {@code int32}
     * @return the matching type
     * @throws IllegalArgumentException if no type has that name
     */
    public static NexusType fromName(String name) {
        for (NexusType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Data type " + name + " not supported");
    }

    /**
     * Looks up a type by its storage code.
     *
     * @param code NeXus storage code
     * @return the matching type
     * @throws IllegalArgumentException if no type has that code
     */
    public static NexusType fromCode(int code) {
        for (NexusType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Storage code " + code + " not supported");
    }

    /**
     * Infers the type of a Java value. Strings are {@link #CHAR}; boxed
     * numbers and primitive arrays map to their signed counterpart.
     *
     * @param value a String, boxed number or primitive array
     * @return the inferred type
     * @throws IllegalArgumentException if the value has no NeXus equivalent
     */
    public static NexusType typeOf(Object value) {
        if (value instanceof String || value instanceof char[]) {
            return CHAR;
        }
        if (value instanceof Byte || value instanceof byte[]) {
            return INT8;
        }
        if (value instanceof Short || value instanceof short[]) {
            return INT16;
        }
        if (value instanceof Integer || value instanceof int[]) {
            return INT32;
        }
        if (value instanceof Long || value instanceof long[]) {
            return INT64;
        }
        if (value instanceof Float || value instanceof float[]) {
            return FLOAT32;
        }
        if (value instanceof Double || value instanceof double[]) {
            return FLOAT64;
        }
        throw new IllegalArgumentException(
            "No NeXus type for " + (value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Allocates a flat primitive buffer able to hold {@code count} elements
     * of this type. Unsigned types use the signed primitive of the same width
     * and text uses bytes.
     *
     * @param count number of elements
     * @return a new primitive array
     */
    public Object allocate(int count) {
        switch (this) {
            case CHAR:
            case INT8:
            case UINT8:
                return new byte[count];
            case INT16:
            case UINT16:
                return new short[count];
            case INT32:
            case UINT32:
                return new int[count];
            case INT64:
            case UINT64:
                return new long[count];
            case FLOAT32:
                return new float[count];
            case FLOAT64:
                return new double[count];
            default:
                throw new IllegalArgumentException("Data type " + this + " not supported");
        }
    }

    /**
     * Whether values of this type are text.
     *
     * @return {@code true} for {@link #CHAR}
     */
    public boolean isText() {
        return this == CHAR;
    }

    /**
     * Converts a flat buffer read from a leaf into the value handed to
     * callers: a 1-D text buffer becomes a String, unsigned buffers are
     * widened, a single element becomes its boxed scalar and anything else is
     * returned as is.
     *
     * @param buffer flat primitive array
     * @param shape  dimensions of the leaf or slab
     * @return the caller facing value
     */
    public Object toValue(Object buffer, int[] shape) {
        if (shape.length == 1 && this == CHAR) {
            return Values.decode((byte[]) buffer, Array.getLength(buffer));
        }
        Object widened = widen(buffer);
        if (shape.length == 1 && shape[0] == 1) {
            return Array.get(widened, 0);
        }
        return widened;
    }

    /**
     * Whether values of this type are unsigned integers.
     *
     * @return {@code true} for {@code uint8} to {@code uint64}
     */
    public boolean isUnsigned() {
        return this == UINT8 || this == UINT16 || this == UINT32 || this == UINT64;
    }

    /**
     * Reinterprets a buffer of unsigned values held in signed primitives so
     * that every element reads back as its unsigned value: {@code uint8} and
     * {@code uint16} become {@code int[]}, {@code uint32} becomes
     * {@code long[]} and {@code uint64} becomes {@code BigInteger[]}. Buffers
     * of other types are returned as is.
     *
     * @param buffer flat primitive array as allocated by {@link #allocate(int)}
     * @return the widened buffer
     */
    public Object widen(Object buffer) {
        switch (this) {
            case UINT8: {
                byte[] in = (byte[]) buffer;
                int[] out = new int[in.length];
                for (int i = 0; i < in.length; i++) {
                    out[i] = Byte.toUnsignedInt(in[i]);
                }
                return out;
            }
            case UINT16: {
                short[] in = (short[]) buffer;
                int[] out = new int[in.length];
                for (int i = 0; i < in.length; i++) {
                    out[i] = Short.toUnsignedInt(in[i]);
                }
                return out;
            }
            case UINT32: {
                int[] in = (int[]) buffer;
                long[] out = new long[in.length];
                for (int i = 0; i < in.length; i++) {
                    out[i] = Integer.toUnsignedLong(in[i]);
                }
                return out;
            }
            case UINT64: {
                long[] in = (long[]) buffer;
                BigInteger[] out = new BigInteger[in.length];
                for (int i = 0; i < in.length; i++) {
                    out[i] = new BigInteger(Long.toUnsignedString(in[i]));
                }
                return out;
            }
            default:
                return buffer;
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
