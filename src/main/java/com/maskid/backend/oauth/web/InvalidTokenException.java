package com.maskid.backend.oauth.web;

import org.springframework.http.HttpStatus;

/** access token 不存在 / 過期 / 已撤銷（RFC 6750） */
public class InvalidTokenException extends OAuthException {

    public InvalidTokenException(String description) {
        super(description);
    }

    @Override public String error() { return "invalid_token"; }
    @Override public HttpStatus status() { return HttpStatus.UNAUTHORIZED; }
}
