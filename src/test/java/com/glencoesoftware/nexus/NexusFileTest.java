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

import com.glencoesoftware.nexus.model.Compression;
import com.glencoesoftware.nexus.model.DataInfo;
import com.glencoesoftware.nexus.model.GroupInfo;
import com.glencoesoftware.nexus.model.NexusConstants;
import com.glencoesoftware.nexus.model.NexusType;
import com.glencoesoftware.nexus.store.MemoryStoreFactory;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class NexusFileTest {

    private MemoryStoreFactory factory;

    private NexusFile file;

    @Before
    public void setUp() throws NexusException {
        factory = new MemoryStoreFactory();
        file = NexusFile.open(factory, "test.nxs", "w5");
        file.makeGroup("entry1", "NXentry");
        file.openGroup("entry1");
    }

    @After
    public void tearDown() throws NexusException {
        file.close();
    }

    @Test
    public void testToString() {
        Assert.assertEquals("NexusFile('test.nxs')", file.toString());
    }

    @Test
    public void testInvalidMode() throws NexusException {
        try {
            NexusFile.open(factory, "test.nxs", "x");
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            Assert.assertEquals("Invalid open mode x", e.getMessage());
        }
    }

    @Test(expected = StoreFailureException.class)
    public void testOpenMissingContainer() throws NexusException {
        NexusFile.open(factory, "missing.nxs", "r");
    }

    @Test
    public void testClosedFileFailsFast() throws NexusException {
        file.close();
        Assert.assertFalse(file.isOpen());
        Assert.assertEquals("/", file.getPath());
        try {
            file.openPath("/entry1");
            Assert.fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            Assert.assertEquals("NeXus file test.nxs is not open", e.getMessage());
        }
        // Closing twice is harmless
        file.close();
    }

    @Test
    public void testReopenResetsPathAndKeepsWrites() throws NexusException {
        file.putAttr("title", "first");
        file.close();
        file.open();
        Assert.assertTrue(file.isOpen());
        Assert.assertEquals("/", file.getPath());
        file.openPath("/entry1");
        Assert.assertEquals("first", file.attributes().find("title").get());
        // Created files come back for update
        file.putAttr("title", "second");
        Assert.assertEquals("second", file.attributes().find("title").get());
        file.open();
        Assert.assertEquals("/entry1", file.getPath());
    }

    @Test(expected = StoreFailureException.class)
    public void testReadOnlyRejectsWrites() throws NexusException {
        file.close();
        try (NexusFile reader = NexusFile.open(factory, "test.nxs", "r")) {
            reader.makeGroup("entry2", "NXentry");
        }
    }

    @Test
    public void testGroupInfo() throws NexusException {
        file.makeGroup("sample", "NXsample");
        file.makeData("counts", NexusType.INT32, 3);
        GroupInfo info = file.getGroupInfo();
        Assert.assertEquals(2, info.getEntryCount());
        Assert.assertEquals("entry1", info.getName());
        Assert.assertEquals("NXentry", info.getNxclass());
    }

    @Test
    public void testOpenGroupDiscoversClass() throws NexusException {
        file.makeGroup("sample", "NXsample");
        file.openGroup("sample");
        Assert.assertEquals("/entry1/sample", file.getPath());
        Assert.assertEquals("NXsample", file.getGroupInfo().getNxclass());
        file.closeGroup();
        Assert.assertEquals("/entry1", file.getPath());
    }

    @Test
    public void testOpenGroupErrors() throws NexusException {
        file.makeData("counts", NexusType.INT32, 3);
        try {
            file.openGroup("missing");
            Assert.fail("Expected NodeNotFoundException");
        } catch (NodeNotFoundException e) {
            Assert.assertEquals("missing", e.getSegment());
        }
        try {
            file.openGroup("counts");
            Assert.fail("Expected StructuralMismatchException");
        } catch (StructuralMismatchException e) {
            Assert.assertEquals("counts", e.getSegment());
        }
        try {
            file.openGroup("counts", "NXdata");
            Assert.fail("Expected StoreFailureException");
        } catch (StoreFailureException e) {
            Assert.assertEquals("/entry1", e.getPath());
        }
        Assert.assertEquals("/entry1", file.getPath());
    }

    @Test(expected = StructuralMismatchException.class)
    public void testCloseGroupAtRoot() throws NexusException {
        file.closeGroup();
        file.closeGroup();
    }

    @Test(expected = StructuralMismatchException.class)
    public void testCloseDataWithoutData() throws NexusException {
        file.closeData();
    }

    @Test(expected = StructuralMismatchException.class)
    public void testNoGroupOperationsInsideData() throws NexusException {
        file.makeData("counts", NexusType.INT32, 3);
        file.openData("counts");
        file.makeGroup("nested", "NXcollection");
    }

    @Test
    public void testWriteAndReadData() throws NexusException {
        file.makeData("image", NexusType.FLOAT32, 2, 3);
        file.openData("image");
        file.putData(new float[] {0, 1, 2, 3, 4, 5});
        DataInfo info = file.getInfo();
        Assert.assertArrayEquals(new int[] {2, 3}, info.getShape());
        Assert.assertEquals(NexusType.FLOAT32, info.getType());
        Assert.assertArrayEquals(new float[] {0, 1, 2, 3, 4, 5}, (float[]) file.getData(), 0f);
        Assert.assertArrayEquals(new float[] {4, 5},
            (float[]) file.getSlab(new int[] {1, 1}, new int[] {1, 2}), 0f);

        file.putSlab(new float[] {9, 9}, new int[] {0, 0}, new int[] {2, 1});
        Assert.assertArrayEquals(new float[] {9, 1, 2, 9, 4, 5}, (float[]) file.getData(), 0f);
        file.closeData();
        Assert.assertFalse(file.isInData());
    }

    @Test
    public void testScalarAndTextData() throws NexusException {
        file.makeData("title", NexusType.CHAR, 8);
        file.openData("title");
        file.putData("run 7");
        Assert.assertEquals("run 7", file.getData());
        file.closeData();

        file.makeData("energy", NexusType.FLOAT64, 1);
        file.openData("energy");
        file.putData(12.5);
        Assert.assertEquals(12.5, file.getData());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDataTypeMismatch() throws NexusException {
        file.makeData("counts", NexusType.INT32, 3);
        file.openData("counts");
        file.putData(new double[] {1, 2, 3});
    }

    @Test
    public void testUnsignedData() throws NexusException {
        file.makeData("total", NexusType.UINT32, 1);
        file.openData("total");
        file.putData(4000000000L);
        Assert.assertEquals(4000000000L, file.getData());
        file.closeData();

        file.makeData("pixels", NexusType.UINT8, 3);
        file.openData("pixels");
        file.putData(new byte[] {(byte) 200, 1, (byte) 255});
        Assert.assertArrayEquals(new int[] {200, 1, 255}, (int[]) file.getData());
        Assert.assertArrayEquals(new int[] {1, 255},
            (int[]) file.getSlab(new int[] {1}, new int[] {2}));
        Assert.assertTrue(file.show(null).contains("  [200, 1, 255]\n"));
    }

    @Test
    public void testOversizedSlabRejected() throws NexusException {
        file.makeData("counts", NexusType.INT8, 1, 1);
        file.openData("counts");
        try {
            file.putSlab(new byte[1], new int[] {0, 0}, new int[] {65536, 65536});
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            Assert.assertArrayEquals(new int[] {1, 1}, file.getInfo().getShape());
        }
    }

    @Test
    public void testUnlimitedDimension() throws NexusException {
        file.makeData("events", NexusType.INT64, NexusConstants.UNLIMITED, 2);
        file.openData("events");
        Assert.assertArrayEquals(new int[] {0, 2}, file.getInfo().getShape());
        file.putSlab(new long[] {1, 2}, new int[] {0, 0}, new int[] {1, 2});
        file.putSlab(new long[] {3, 4, 5, 6}, new int[] {1, 0}, new int[] {2, 2});
        Assert.assertArrayEquals(new int[] {3, 2}, file.getInfo().getShape());
        Assert.assertArrayEquals(new long[] {1, 2, 3, 4, 5, 6}, (long[]) file.getData());
    }

    @Test
    public void testCompressedData() throws NexusException {
        file.compMakeData("frames", NexusType.UINT16, new int[] {4, 8}, Compression.LZW, null);
        file.openData("frames");
        Assert.assertEquals(32, file.getInfo().getSize());
        Assert.assertEquals("4x8", file.getInfo().getDimensions());
    }

    @Test
    public void testPutAttrValidation() throws NexusException {
        try {
            file.putAttr("range", new int[] {1, 2});
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            Assert.assertEquals("Attribute value must be scalar or string", e.getMessage());
        }
        try {
            file.putAttr("units", 5, NexusType.CHAR);
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            Assert.assertEquals("Expected string for 'char' attribute value", e.getMessage());
        }
        file.putAttr("count", new int[] {3});
        file.putAttr("scale", 2, NexusType.FLOAT32);
        Assert.assertEquals(3, file.attributes().find("count").get());
        Assert.assertEquals(2.0f, file.attributes().find("scale").get());
    }

    @Test
    public void testDataAttributes() throws NexusException {
        file.makeData("counts", NexusType.INT32, 3);
        file.openData("counts");
        file.putAttr("units", "counts");
        file.closeData();
        file.openPath("counts");
        Assert.assertEquals("counts", file.attributes().find("units").get());
    }
}
