package io.powchain.core.protocol;

public final class Hex {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hex() {}

    /** Lowercase hex, two chars per byte. */
    public static String encode(byte[] b) {
        if (b == null) return "";
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    /**
     * Case-insensitive decode.
     *
     * @throws ProtocolException INVALID_HEX_LENGTH for odd input, INVALID_HEX_CHAR for a non-hex digit
     */
    public static byte[] decode(String s) {
        if (s == null) {
            throw new ProtocolException(ProtocolError.INVALID_FORMAT, "null hex string");
        }
        if ((s.length() & 1) != 0) {
            throw new ProtocolException(ProtocolError.INVALID_HEX_LENGTH, "odd hex length: " + s.length());
        }
        byte[] out = new byte[s.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = digit(s, 2 * i);
            int lo = digit(s, 2 * i + 1);
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    private static int digit(String s, int pos) {
        char c = s.charAt(pos);
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        throw new ProtocolException(ProtocolError.INVALID_HEX_CHAR, "bad hex char '" + c + "' at " + pos);
    }
}
