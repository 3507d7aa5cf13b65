package com.maskid.backend.oauth.web;

import org.springframework.http.HttpStatus;

/** code 不存在 / 已使用 / 不屬於此 client / redirect_uri 不符 */
public class InvalidGrantException extends OAuthException {

    public InvalidGrantException(String description) {
        super(description);
    }

    @Override public String error() { return "invalid_grant"; }
    @Override public HttpStatus status() { return HttpStatus.BAD_REQUEST; }
}
