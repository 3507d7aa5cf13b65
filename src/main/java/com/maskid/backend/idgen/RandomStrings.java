package com.maskid.backend.idgen;

import java.security.SecureRandom;

public final class RandomStrings {
    private static final SecureRandom SR = new SecureRandom();

    private static final char[] LOWER = "abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final char[] ALNUM =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();
    private static final char[] DIGITS = "0123456789".toCharArray();

    private RandomStrings() {}

    public static String lowercase(int len) {
        return pick(LOWER, len);
    }

    public static String alphanumeric(int len) {
        return pick(ALNUM, len);
    }

    public static String digits(int len) {
        return pick(DIGITS, len);
    }

    public static String hex(int bytes) {
        byte[] buf = new byte[bytes]; // 32 bytes → 256-bit
        SR.nextBytes(buf);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : buf) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    public static int nextInt(int bound) {
        return SR.nextInt(bound);
    }

    private static String pick(char[] alphabet, int len) {
        StringBuilder sb = new StringBuilder(len);
        for (int i = 0; i < len; i++) sb.append(alphabet[SR.nextInt(alphabet.length)]);
        return sb.toString();
    }
}
