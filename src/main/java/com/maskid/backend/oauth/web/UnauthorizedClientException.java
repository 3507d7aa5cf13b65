package com.maskid.backend.oauth.web;

import org.springframework.http.HttpStatus;

/** client_id 不存在或 client_secret 錯誤 */
public class UnauthorizedClientException extends OAuthException {

    public UnauthorizedClientException(String description) {
        super(description);
    }

    @Override public String error() { return "invalid_client"; }
    @Override public HttpStatus status() { return HttpStatus.UNAUTHORIZED; }
}
