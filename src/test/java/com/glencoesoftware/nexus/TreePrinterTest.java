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

import com.glencoesoftware.nexus.model.NexusType;
import com.glencoesoftware.nexus.store.MemoryStoreFactory;
import org.junit.Assert;
import org.junit.Test;

public class TreePrinterTest {

    @Test
    public void testShowSample() throws NexusException {
        MemoryStoreFactory factory = new MemoryStoreFactory();
        TestNexus.sample(factory, "sample.nxs");
        try (NexusFile file = NexusFile.open(factory, "sample.nxs", "r")) {
            String expected = "=== File sample.nxs /\n"
                + "entry1 NXentry\n"
                + "  data float64 10\n"
                + "    @signal: 1\n"
                + "  alias_to_data float64 10\n"
                + "    -> /entry1/data\n"
                + "  sample NXsample\n"
                + "    name char 6\n"
                + "      quartz\n";
            Assert.assertEquals(expected, file.show("/"));
            Assert.assertEquals("/", file.getPath());
        }
    }

    @Test
    public void testShowLeaf() throws NexusException {
        MemoryStoreFactory factory = new MemoryStoreFactory();
        TestNexus.sample(factory, "sample.nxs");
        try (NexusFile file = NexusFile.open(factory, "sample.nxs", "r")) {
            file.openPath("/entry1/sample");
            Assert.assertEquals("=== File sample.nxs /entry1/data\n"
                + "data float64 10\n"
                + "  @signal: 1\n", file.show("../data"));
            Assert.assertEquals("/entry1/sample", file.getPath());
        }
    }

    @Test
    public void testShowInlineArraysAndGroupAttributes() throws NexusException {
        MemoryStoreFactory factory = new MemoryStoreFactory();
        new TestNexus(factory, "small.nxs")
            .group("/entry1", "NXentry")
            .attr("/entry1", "title", "scan")
            .data("/entry1/counts", NexusType.INT32, new int[] {1, 2, 3, 4}, 2, 2)
            .attr("/entry1/counts", "units", "counts")
            .build();
        try (NexusFile file = NexusFile.open(factory, "small.nxs", "r")) {
            Assert.assertEquals("=== File small.nxs /entry1\n"
                + "@title: scan\n"
                + "counts int32 2x2\n"
                + "  [1, 2, 3, 4]\n"
                + "  @units: counts\n", file.show("/entry1"));
        }
    }

    @Test
    public void testFormat() {
        Assert.assertEquals("null", TreePrinter.format(null));
        Assert.assertEquals("1.5", TreePrinter.format(1.5));
        Assert.assertEquals("[1, 2]", TreePrinter.format(new long[] {1, 2}));
        Assert.assertEquals("[]", TreePrinter.format(new byte[0]));
    }
}
