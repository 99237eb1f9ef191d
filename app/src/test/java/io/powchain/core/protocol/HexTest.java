package io.powchain.core.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HexTest {

    @Test
    void encodesLowercasePairs() {
        assertEquals("00ff10ab", Hex.encode(new byte[] {0x00, (byte) 0xff, 0x10, (byte) 0xab}));
        assertEquals("", Hex.encode(new byte[0]));
    }

    @Test
    void decodesEitherCase() {
        assertArrayEquals(new byte[] {(byte) 0xab, (byte) 0xcd}, Hex.decode("abcd"));
        assertArrayEquals(new byte[] {(byte) 0xab, (byte) 0xcd}, Hex.decode("ABCD"));
        assertArrayEquals(new byte[] {(byte) 0xab, (byte) 0xcd}, Hex.decode("aBcD"));
    }

    @Test
    void emptyStringDecodesToEmptyArray() {
        assertEquals(0, Hex.decode("").length);
    }

    @Test
    void roundTripsEveryByteValue() {
        byte[] all = new byte[256];
        for (int i = 0; i < all.length; i++) {
            all[i] = (byte) i;
        }
        String text = Hex.encode(all);
        assertEquals(512, text.length());
        assertArrayEquals(all, Hex.decode(text));
    }

    @Test
    void oddLengthIsRejected() {
        ProtocolException ex = assertThrows(ProtocolException.class, () -> Hex.decode("abc"));
        assertEquals(ProtocolError.INVALID_HEX_LENGTH, ex.error());
    }

    @Test
    void nonHexCharacterIsRejected() {
        ProtocolException ex = assertThrows(ProtocolException.class, () -> Hex.decode("zz"));
        assertEquals(ProtocolError.INVALID_HEX_CHAR, ex.error());
        assertEquals(ProtocolError.INVALID_HEX_CHAR,
                assertThrows(ProtocolException.class, () -> Hex.decode("0g")).error());
    }
}
