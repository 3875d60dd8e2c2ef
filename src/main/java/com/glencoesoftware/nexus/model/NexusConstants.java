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

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * Limits and conventions shared by NeXus containers.
 */
public final class NexusConstants {

    /** Extent of an extensible first dimension. */
    public static final int UNLIMITED = -1;

    /** Maximum rank of a leaf. */
    public static final int MAXRANK = 32;

    /** Names must be shorter than this. */
    public static final int MAXNAMELEN = 64;

    /** Total path length must be shorter than this. */
    public static final int MAXPATHLEN = 1024;

    /** Attribute naming the primary path of a linked node. */
    public static final String TARGET_ATTRIBUTE = "target";

    /**
     * Classes of bookkeeping entries found in HDF4 files that carry no NeXus
     * content and are skipped during enumeration.
     */
    public static final Set<String> H4SKIP = ImmutableSet.of(
        "CDF0.0", "_HDF_CHK_TBL_", "Attr0.0", "RIG0.0", "RI0.0", "RIATTR0.0N", "RIATTR0.0C");

    private NexusConstants() {
    }
}
