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

import java.math.BigInteger;
import org.junit.Assert;
import org.junit.Test;

public class NexusTypeTest {

    @Test
    public void testCodes() {
        Assert.assertEquals(4, NexusType.CHAR.getCode());
        Assert.assertEquals(6, NexusType.FLOAT64.getCode());
        Assert.assertEquals(NexusType.UINT64, NexusType.fromCode(27));
        Assert.assertEquals(NexusType.INT16, NexusType.fromName("int16"));
        Assert.assertEquals("float32", NexusType.FLOAT32.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCode() {
        NexusType.fromCode(99);
    }

    @Test
    public void testTypeOf() {
        Assert.assertEquals(NexusType.CHAR, NexusType.typeOf("text"));
        Assert.assertEquals(NexusType.INT32, NexusType.typeOf(1));
        Assert.assertEquals(NexusType.INT64, NexusType.typeOf(new long[] {1}));
        Assert.assertEquals(NexusType.FLOAT64, NexusType.typeOf(1.0));
        Assert.assertEquals(NexusType.FLOAT32, NexusType.typeOf(1.0f));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTypeOfUnsupported() {
        NexusType.typeOf(new Object());
    }

    @Test
    public void testToValue() {
        byte[] text = Values.encode("abc", 6);
        Assert.assertEquals("abc", NexusType.CHAR.toValue(text, new int[] {6}));
        Assert.assertEquals(7, NexusType.INT32.toValue(new int[] {7}, new int[] {1}));
        int[] matrix = {1, 2, 3, 4};
        Assert.assertSame(matrix, NexusType.INT32.toValue(matrix, new int[] {2, 2}));
        Assert.assertTrue(NexusType.UINT16.allocate(3) instanceof short[]);
    }

    @Test
    public void testUnsignedValuesWiden() {
        Assert.assertEquals(200, NexusType.UINT8.toValue(new byte[] {(byte) 200}, new int[] {1}));
        Assert.assertEquals(60000,
            NexusType.UINT16.toValue(new short[] {(short) 60000}, new int[] {1}));
        Assert.assertEquals(4000000000L,
            NexusType.UINT32.toValue(new int[] {(int) 4000000000L}, new int[] {1}));
        Assert.assertEquals(new BigInteger("18446744073709551615"),
            NexusType.UINT64.toValue(new long[] {-1L}, new int[] {1}));
        Assert.assertArrayEquals(new int[] {255, 0, 128},
            (int[]) NexusType.UINT8.toValue(new byte[] {-1, 0, -128}, new int[] {3}));
        Assert.assertArrayEquals(new long[] {4294967295L, 7L},
            (long[]) NexusType.UINT32.widen(new int[] {-1, 7}));
        Assert.assertTrue(NexusType.UINT64.isUnsigned());
        Assert.assertFalse(NexusType.INT64.isUnsigned());
    }

    @Test
    public void testSignedValuesUnchanged() {
        byte[] raw = {-1, 2};
        Assert.assertSame(raw, NexusType.INT8.widen(raw));
        Assert.assertEquals((byte) -1, NexusType.INT8.toValue(new byte[] {-1}, new int[] {1}));
    }

    @Test
    public void testValues() {
        Assert.assertEquals("ab", Values.decode(new byte[] {'a', 'b', 0, 'c'}, 4));
        Assert.assertEquals("a", Values.decode(new byte[] {'a', 'b'}, 1));
        Assert.assertArrayEquals(new byte[] {'a', 'b'}, Values.encode("abc", 2));
        Assert.assertEquals(24, Values.size(new int[] {2, 3, 4}));
        Assert.assertEquals(0, Values.size(new int[] {0, 3}));
        Assert.assertArrayEquals(new double[] {2.5},
            (double[]) Values.scalarBuffer(2.5f, NexusType.FLOAT64), 0);
    }

    @Test
    public void testAccessModes() {
        Assert.assertEquals(AccessMode.CREATE_XML, AccessMode.fromCode("wx"));
        Assert.assertTrue(AccessMode.CREATE4.isCreate());
        Assert.assertFalse(AccessMode.READ_WRITE.isCreate());
        Assert.assertEquals(AccessMode.READ_WRITE, AccessMode.CREATE.reopenMode());
        Assert.assertEquals(AccessMode.READ, AccessMode.READ.reopenMode());
        Assert.assertEquals(Compression.LZW, Compression.fromName("lzw"));
        Assert.assertEquals(400, Compression.HUFFMAN.getCode());
    }
}
