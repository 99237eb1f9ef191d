package io.powchain.core.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Canonical hashing input format.
 * Unsigned 32/64-bit values are written little-endian (4 and 8 bytes);
 * strings are their raw UTF-8 bytes with no length prefix.
 */
public final class ByteCodec {
    private ByteCodec() {}

    /** Low 32 bits of {@code value}, little-endian. */
    public static byte[] u32(long value) {
        return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt((int) value).array();
    }

    /** All 64 bits of {@code value} (read as unsigned), little-endian. */
    public static byte[] u64(long value) {
        return ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
    }

    public static byte[] utf8(String s) {
        return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
    }
}
