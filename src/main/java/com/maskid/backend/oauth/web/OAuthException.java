package com.maskid.backend.oauth.web;

import org.springframework.http.HttpStatus;

/**
 * authorize / token / user_info 的錯誤，對外以 RFC 6749 的 error code 回報，不自動重試。
 */
public abstract class OAuthException extends RuntimeException {

    protected OAuthException(String description) {
        super(description);
    }

    /** RFC 6749 / 6750 error code */
    public abstract String error();

    public abstract HttpStatus status();
}
