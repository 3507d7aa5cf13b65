package com.maskid.backend.idgen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SlugsTest {

    @Test
    void should_strip_accents_and_symbols() {
        assertEquals("mon-appli-preferee", Slugs.toId("Mon Appli Préférée!"));
        assertEquals("a-b", Slugs.toId("  --A__B-- "));
    }

    @Test
    void should_fall_back_when_nothing_left() {
        assertEquals("client", Slugs.toId("!!!"));
        assertEquals("client", Slugs.toId(null));
    }

    @Test
    void should_cap_length_without_trailing_dash() {
        String slug = Slugs.toId("a".repeat(39) + " bcd");
        assertEquals("a".repeat(39), slug);
    }
}
