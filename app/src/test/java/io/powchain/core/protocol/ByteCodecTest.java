package io.powchain.core.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteCodecTest {

    @Test
    void u32IsLittleEndian() {
        assertArrayEquals(new byte[] {0x04, 0x03, 0x02, 0x01}, ByteCodec.u32(0x01020304L));
        assertArrayEquals(new byte[] {0, 0, 0, 0}, ByteCodec.u32(0));
        assertArrayEquals(new byte[] {(byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff}, ByteCodec.u32(0xFFFF_FFFFL));
    }

    @Test
    void u64IsLittleEndian() {
        assertArrayEquals(new byte[] {0x08, 0x07, 0x06, 0x05, 0x04, 0x03, 0x02, 0x01},
                ByteCodec.u64(0x0102030405060708L));
        assertArrayEquals(new byte[] {0x00, (byte) 0x9c, (byte) 0xb0, 0x63, 0, 0, 0, 0},
                ByteCodec.u64(1_672_531_200L));
    }

    @Test
    void u64TreatsNegativeAsUnsigned() {
        byte[] max = ByteCodec.u64(-1L);
        assertEquals(8, max.length);
        for (byte b : max) {
            assertEquals((byte) 0xff, b);
        }
    }

    @Test
    void utf8HasNoLengthPrefix() {
        assertArrayEquals(new byte[] {'A', 'l', 'i', 'c', 'e'}, ByteCodec.utf8("Alice"));
        assertEquals(0, ByteCodec.utf8("").length);
        assertEquals(2, ByteCodec.utf8("é").length);
    }
}
