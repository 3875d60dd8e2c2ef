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
import com.glencoesoftware.nexus.model.AttributeInfo;
import com.glencoesoftware.nexus.model.ChildEntry;
import com.glencoesoftware.nexus.model.NexusType;
import java.io.IOException;
import java.util.Optional;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class MemoryStoreTest {

    private MemoryStoreFactory factory;

    private Store store;

    @Before
    public void setUp() throws IOException {
        factory = new MemoryStoreFactory();
        store = factory.open("store.nxs", AccessMode.CREATE5);
        store.makeGroup("entry1", "NXentry");
        store.openGroup("entry1", "NXentry");
        store.makeData("data", NexusType.INT16, new int[] {2, 2});
        store.makeGroup("sample", "NXsample");
        store.putAttribute("title", "run", NexusType.CHAR);
        store.putAttribute("number", 3, NexusType.INT32);
    }

    @Test
    public void testChildCursor() throws IOException {
        store.resetChildCursor();
        Assert.assertEquals(Optional.of(new ChildEntry("data", "SDS")), store.nextChild());
        Assert.assertEquals(Optional.of(new ChildEntry("sample", "NXsample")),
            store.nextChild());
        Assert.assertEquals(Optional.empty(), store.nextChild());
        Assert.assertEquals(Optional.empty(), store.nextChild());

        store.resetChildCursor();
        Assert.assertEquals("data", store.nextChild().get().getName());
    }

    @Test
    public void testNavigationResetsCursors() throws IOException {
        store.resetChildCursor();
        store.nextChild();
        store.openGroup("sample", "NXsample");
        Assert.assertEquals(Optional.empty(), store.nextChild());
        store.closeGroup();
        Assert.assertEquals("data", store.nextChild().get().getName());
    }

    @Test
    public void testAttributeCursor() throws IOException {
        Assert.assertEquals(2, store.getAttributeCount());
        store.resetAttributeCursor();
        Assert.assertEquals(Optional.of(new AttributeInfo("title", 3, NexusType.CHAR)),
            store.nextAttributeMeta());
        Assert.assertEquals(Optional.of(new AttributeInfo("number", 1, NexusType.INT32)),
            store.nextAttributeMeta());
        Assert.assertEquals(Optional.empty(), store.nextAttributeMeta());
        Assert.assertEquals("run", store.readAttribute("title", 3, NexusType.CHAR));
        Assert.assertEquals(3, store.readAttribute("number", 1, NexusType.INT32));
    }

    @Test(expected = IOException.class)
    public void testAttributeTypeMismatch() throws IOException {
        store.readAttribute("number", 1, NexusType.FLOAT64);
    }

    @Test
    public void testGroupInfoAndLocation() throws IOException {
        Assert.assertEquals(2, store.getGroupInfo().getEntryCount());
        Assert.assertEquals("store.nxs", store.getLocation());
        Assert.assertEquals("store.nxs", store.inquireFile());
        Assert.assertFalse(store.requiresStringTerminator());
    }

    @Test(expected = IOException.class)
    public void testOpenGroupWrongClass() throws IOException {
        store.openGroup("sample", "NXentry");
    }

    @Test(expected = IOException.class)
    public void testOpenLeafAsGroup() throws IOException {
        store.openGroup("data", null);
    }

    @Test(expected = IOException.class)
    public void testCloseGroupAtRoot() throws IOException {
        store.closeGroup();
        store.closeGroup();
    }

    @Test(expected = IOException.class)
    public void testDuplicateName() throws IOException {
        store.makeGroup("data", "NXdata");
    }

    @Test
    public void testSlabBounds() throws IOException {
        store.openLeaf("data");
        store.putData(new short[] {1, 2, 3, 4});
        Assert.assertArrayEquals(new short[] {3, 4},
            (short[]) store.getSlab(new int[] {1, 0}, new int[] {1, 2}));
        try {
            store.getSlab(new int[] {1, 1}, new int[] {1, 2});
            Assert.fail("Expected IOException");
        } catch (IOException e) {
            Assert.assertEquals("Slab out of bounds in dimension 1", e.getMessage());
        }
        try {
            store.putData(new short[] {1, 2});
            Assert.fail("Expected IOException");
        } catch (IOException e) {
            // expected
        }
    }

    @Test
    public void testIdentity() throws IOException {
        store.openLeaf("data");
        NodeId data = store.captureIdentity();
        store.closeLeaf();
        NodeId entry = store.captureIdentity();
        store.openGroup("sample", "NXsample");
        store.attachIdentity("linked", data);
        store.openLeaf("linked");
        Assert.assertTrue(store.identitiesEqual(data, store.captureIdentity()));
        Assert.assertFalse(store.identitiesEqual(data, entry));
        Assert.assertEquals("/entry1/data",
            store.readAttribute("target", 12, NexusType.CHAR));
    }

    @Test(expected = IOException.class)
    public void testCannotLinkGroupIntoItself() throws IOException {
        store.attachIdentity("self", store.captureIdentity());
    }

    @Test
    public void testExternalReference() throws IOException {
        store.linkExternal("ext", "NXentry", "nxfile://store.nxs#/entry1");
        Assert.assertEquals(Optional.of("nxfile://store.nxs#/entry1"),
            store.externalReferenceOf("ext", null));
        Assert.assertEquals(Optional.empty(), store.externalReferenceOf("sample", null));
        store.openGroup("ext", "NXentry");
        Assert.assertEquals(3, store.getGroupInfo().getEntryCount());
        try {
            store.linkExternal("bad", "NXentry", "file:///tmp/other.nxs");
            Assert.fail("Expected IOException");
        } catch (IOException e) {
            // expected
        }
    }

    @Test
    public void testReadOnlyHandle() throws IOException {
        store.close();
        Store reader = factory.open("store.nxs", AccessMode.READ);
        reader.openGroup("entry1", "NXentry");
        Assert.assertEquals("run", reader.readAttribute("title", 3, NexusType.CHAR));
        try {
            reader.putAttribute("title", "other", NexusType.CHAR);
            Assert.fail("Expected IOException");
        } catch (IOException e) {
            Assert.assertEquals("NeXus file store.nxs is opened read only", e.getMessage());
        }
        reader.close();
    }

    @Test
    public void testCloseTwice() throws IOException {
        store.close();
        try {
            store.close();
            Assert.fail("Expected IOException");
        } catch (IOException e) {
            // expected
        }
        try {
            store.inquireFile();
            Assert.fail("Expected IOException");
        } catch (IOException e) {
            Assert.assertEquals("NeXus file store.nxs is closed", e.getMessage());
        }
    }

    @Test
    public void testFactoryRegistry() throws IOException {
        Assert.assertTrue(factory.exists("store.nxs"));
        Assert.assertTrue(factory.delete("store.nxs"));
        Assert.assertFalse(factory.exists("store.nxs"));
        try {
            factory.open("store.nxs", AccessMode.READ);
            Assert.fail("Expected IOException");
        } catch (IOException e) {
            Assert.assertEquals("Could not open store.nxs", e.getMessage());
        }
    }
}
