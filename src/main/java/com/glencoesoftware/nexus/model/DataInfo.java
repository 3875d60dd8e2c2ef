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

import java.util.Arrays;
import java.util.Objects;

/**
 * Shape and element type of an open leaf.
 */
public class DataInfo {

    private final int[] shape;

    private final NexusType type;

    /**
     * Constructs a DataInfo.
     *
     * @param shape dimensions of the leaf, copied
     * @param type  element type
     */
    public DataInfo(int[] shape, NexusType type) {
        this.shape = shape.clone();
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Gets the dimensions of the leaf.
     *
     * @return a copy of the shape
     */
    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    public NexusType getType() {
        return type;
    }

    /**
     * Total number of elements.
     *
     * @return product of the dimensions
     */
    public long getSize() {
        return Values.size(shape);
    }

    /**
     * Dimensions joined with {@code x}, e.g. {@code 10x3}.
     *
     * @return the formatted dimensions
     */
    public String getDimensions() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < shape.length; i++) {
            if (i > 0) {
                sb.append('x');
            }
            sb.append(shape[i]);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DataInfo)) {
            return false;
        }
        DataInfo other = (DataInfo) obj;
        return Arrays.equals(shape, other.shape) && type == other.type;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + type.hashCode();
    }

    @Override
    public String toString() {
        return "DataInfo{" + "shape=" + Arrays.toString(shape) + ", type=" + type + '}';
    }
}
