package com.maskid.backend.oauth.model;

/**
 * client 看到這個 user 的哪個 email：某個 alias，或真實 email。
 */
public sealed interface DisclosureChannel permits DisclosureChannel.Alias, DisclosureChannel.RealEmail {

    record Alias(Long aliasId) implements DisclosureChannel {
        public Alias {
            if (aliasId == null) throw new IllegalArgumentException("aliasId required");
        }
    }

    record RealEmail() implements DisclosureChannel {}

    static DisclosureChannel alias(Long aliasId) {
        return new Alias(aliasId);
    }

    static DisclosureChannel realEmail() {
        return new RealEmail();
    }
}
