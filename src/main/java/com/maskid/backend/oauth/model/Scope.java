package com.maskid.backend.oauth.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** client 可被授予的屬性。value 同時是 scope 字串與 user info 的 key */
public enum Scope {
    NAME("name"),
    EMAIL("email"),
    AVATAR_URL("avatar_url");

    private final String value;

    Scope(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Scope fromValue(String raw) {
        String v = (raw == null) ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Scope s : values()) {
            if (s.value.equals(v)) return s;
        }
        throw new IllegalArgumentException("UNKNOWN_SCOPE: " + raw);
    }

    /** "name email" / "name,email" → {NAME, EMAIL}；空字串 → 空集合 */
    public static Set<Scope> parse(String scopeString) {
        if (scopeString == null || scopeString.isBlank()) return EnumSet.noneOf(Scope.class);
        return Arrays.stream(scopeString.trim().split("[\\s,]+"))
                .filter(s -> !s.isBlank())
                .map(Scope::fromValue)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Scope.class)));
    }

    /** 依 enum 順序輸出，空白分隔 */
    public static String format(Collection<Scope> scopes) {
        if (scopes == null || scopes.isEmpty()) return "";
        return EnumSet.copyOf(scopes).stream().map(Scope::value).collect(Collectors.joining(" "));
    }
}
