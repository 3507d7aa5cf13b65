package com.maskid.backend.oauth.web;

/** code 超過 TTL 未兌換。RFC 6749 沒有獨立的 code，對外仍是 invalid_grant */
public class ExpiredGrantException extends InvalidGrantException {

    public ExpiredGrantException(String description) {
        super(description);
    }
}
