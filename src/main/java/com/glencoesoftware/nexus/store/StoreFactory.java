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

package com.glencoesoftware.nexus.store;

import com.glencoesoftware.nexus.model.AccessMode;
import java.io.IOException;

/**
 * Opens {@link Store} handles on named containers.
 */
public interface StoreFactory {

    /**
     * Opens or creates the container at a location.
     *
     * @param location the container location, e.g. a file name
     * @param mode     the access mode
     * @return a new open handle exclusively owned by the caller
     * @throws IOException if the container cannot be opened or created
     */
    public Store open(String location, AccessMode mode) throws IOException;
}
