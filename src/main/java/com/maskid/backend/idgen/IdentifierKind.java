package com.maskid.backend.idgen;

/**
 * 對外可見的識別碼種類。
 * humanReadable 的種類由 seed（名稱或隨機單字）加短隨機尾碼組成，其餘為純隨機。
 * secret 的種類值絕不進 log。
 */
public enum IdentifierKind {
    ALIAS(true, false, 3),
    CLIENT_ID(true, false, 10),
    CLIENT_SECRET(false, true, 40),
    AUTH_CODE(false, true, 40),
    ACCESS_TOKEN(false, true, 40),
    SESSION_TOKEN(false, true, 32),
    ACTIVATION_CODE(false, true, 30),
    RESET_PASSWORD_CODE(false, true, 30);

    private final boolean humanReadable;
    private final boolean secret;
    private final int randomLength;

    IdentifierKind(boolean humanReadable, boolean secret, int randomLength) {
        this.humanReadable = humanReadable;
        this.secret = secret;
        this.randomLength = randomLength;
    }

    public boolean humanReadable() { return humanReadable; }
    public boolean secret() { return secret; }

    /** humanReadable：尾碼長度；SESSION_TOKEN：bytes；其餘：字元數 */
    public int randomLength() { return randomLength; }
}
