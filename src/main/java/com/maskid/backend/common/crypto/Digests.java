package com.maskid.backend.common.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public final class Digests {

    private Digests() {}

    /** gravatar 用 */
    public static String md5Hex(String msg) {
        return hex("MD5", msg);
    }

    /** 一次性 code 只存 hash，不存明碼 */
    public static String sha256Hex(String msg) {
        return hex("SHA-256", msg);
    }

    /** 比對 secret 用，避免 timing 差異 */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8)
        );
    }

    private static String hex(String algorithm, String msg) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            byte[] out = md.digest(msg.getBytes(StandardCharsets.UTF_8));
            return toHex(out);
        } catch (Exception e) {
            throw new IllegalStateException(algorithm + "_DIGEST_FAILED", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
