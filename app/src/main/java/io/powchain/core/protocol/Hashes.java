package io.powchain.core.protocol;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    public static final int LENGTH = 32;
    private static final byte[] ZERO = new byte[LENGTH];

    private Hashes(){}

    public static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    public static byte[] zero() { return ZERO.clone(); }

    public static boolean isZero(byte[] hash) {
        if (hash == null) return true;
        for (byte b : hash) {
            if (b != 0) return false;
        }
        return true;
    }

    /** First 8 hex chars, for logs. */
    public static String shortHex(byte[] hash) {
        String hex = Hex.encode(hash);
        return hex.length() > 8 ? hex.substring(0, 8) + "…" : hex;
    }
}
