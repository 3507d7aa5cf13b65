package com.maskid.backend.oauth.web;

import org.springframework.http.HttpStatus;

public class InvalidRequestException extends OAuthException {

    public InvalidRequestException(String description) {
        super(description);
    }

    @Override public String error() { return "invalid_request"; }
    @Override public HttpStatus status() { return HttpStatus.BAD_REQUEST; }
}
