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

import com.glencoesoftware.nexus.model.AccessMode;
import com.glencoesoftware.nexus.model.ChildEntry;
import com.glencoesoftware.nexus.model.NexusType;
import com.glencoesoftware.nexus.store.MemoryStoreFactory;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class ChildIteratorTest {

    private MemoryStoreFactory factory;

    private NexusFile file;

    @Before
    public void setUp() throws NexusException {
        factory = new MemoryStoreFactory();
        new TestNexus(factory, "mixed.nxs")
            .group("/entry1", "NXentry")
            .group("/entry1/CDF0.0", "CDF0.0")
            .data("/entry1/counts", NexusType.INT32, new int[] {1, 2, 3}, 3)
            .group("/entry1/sample", "NXsample")
            .group("/entry1/instrument", "NXinstrument")
            .data("/entry1/instrument/name", NexusType.CHAR, "POLDI", 5)
            .build();
        file = new NexusFile(factory, "mixed.nxs", AccessMode.READ, NexusConfig.defaults());
        file.openPath("/entry1");
    }

    @After
    public void tearDown() throws NexusException {
        file.close();
    }

    @Test
    public void testListChildrenIsUnfiltered() throws NexusException {
        Map<String, String> listing = file.getEntries();
        Assert.assertEquals(Arrays.asList("CDF0.0", "counts", "sample", "instrument"),
            new ArrayList<>(listing.keySet()));
        Assert.assertEquals("SDS", listing.get("counts"));
        Assert.assertEquals("NXsample", listing.get("sample"));
        Assert.assertEquals("/entry1", file.getPath());
    }

    @Test
    public void testSnapshotSkipsIgnorableClasses() throws NexusException {
        List<ChildEntry> entries = file.children().snapshot();
        Assert.assertEquals(Arrays.asList(
            new ChildEntry("counts", "SDS"),
            new ChildEntry("sample", "NXsample"),
            new ChildEntry("instrument", "NXinstrument")), entries);
    }

    @Test
    public void testEntriesOpenEachChild() throws NexusException {
        List<String> paths = new ArrayList<>();
        List<Boolean> leaves = new ArrayList<>();
        for (ChildEntry entry : file.entries()) {
            paths.add(file.getPath());
            leaves.add(file.isInData());
            Assert.assertEquals(entry.isData(), file.isInData());
        }
        Assert.assertEquals(Arrays.asList(
            "/entry1/counts", "/entry1/sample", "/entry1/instrument"), paths);
        Assert.assertEquals(Arrays.asList(true, false, false), leaves);
    }

    @Test
    public void testEntriesAreRestartable() throws NexusException {
        Iterable<ChildEntry> entries = file.entries();
        List<ChildEntry> first = new ArrayList<>();
        entries.forEach(first::add);
        file.openPath("/entry1");
        List<ChildEntry> second = new ArrayList<>();
        entries.forEach(second::add);
        Assert.assertEquals(3, first.size());
        Assert.assertEquals(first, second);
    }

    @Test
    public void testCallerMayNavigateBetweenEntries() throws NexusException {
        List<String> names = new ArrayList<>();
        for (ChildEntry entry : file.entries()) {
            names.add(entry.getName());
            file.openPath("/");
            if (!entry.isData()) {
                // Nested enumeration of the opened group
                file.openPath("/entry1/" + entry.getName());
                for (ChildEntry nested : file.entries()) {
                    names.add(entry.getName() + "/" + nested.getName());
                }
            }
        }
        Assert.assertEquals(Arrays.asList(
            "counts", "sample", "instrument", "instrument/name"), names);
    }

    @Test
    public void testCustomSkipClasses() throws NexusException {
        NexusConfig config = NexusConfig.builder()
            .skipClasses(ImmutableSet.of("NXsample", "SDS"))
            .build();
        try (NexusFile other = new NexusFile(factory, "mixed.nxs", AccessMode.READ, config)) {
            other.openPath("/entry1");
            List<ChildEntry> entries = other.children().snapshot();
            Assert.assertEquals(Arrays.asList(
                new ChildEntry("CDF0.0", "CDF0.0"),
                new ChildEntry("instrument", "NXinstrument")), entries);
        }
    }

    @Test
    public void testEmptyGroup() throws NexusException {
        file.openPath("sample");
        Assert.assertTrue(file.getEntries().isEmpty());
        Assert.assertFalse(file.entries().iterator().hasNext());
        Assert.assertEquals("/entry1/sample", file.getPath());
    }

    @Test(expected = StructuralMismatchException.class)
    public void testLeafHasNoChildren() throws NexusException {
        file.openPath("counts");
        file.getEntries();
    }
}
