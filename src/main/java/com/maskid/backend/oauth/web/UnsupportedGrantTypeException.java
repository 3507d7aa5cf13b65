package com.maskid.backend.oauth.web;

import org.springframework.http.HttpStatus;

public class UnsupportedGrantTypeException extends OAuthException {

    public UnsupportedGrantTypeException(String grantType) {
        super("grant_type not supported: " + grantType);
    }

    @Override public String error() { return "unsupported_grant_type"; }
    @Override public HttpStatus status() { return HttpStatus.BAD_REQUEST; }
}
