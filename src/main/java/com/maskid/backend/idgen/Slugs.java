package com.maskid.backend.idgen;

import java.text.Normalizer;
import java.util.Locale;

public final class Slugs {

    static final int MAX_LEN = 40;

    private Slugs() {}

    /** "Mon Appli Préférée!" → "mon-appli-preferee" */
    public static String toId(String name) {
        if (name == null) return "client";
        String s = Normalizer.normalize(name, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (s.length() > MAX_LEN) s = s.substring(0, MAX_LEN).replaceAll("-+$", "");
        return s.isEmpty() ? "client" : s;
    }
}
