package com.maskid.backend.billing;

import lombok.Getter;

@Getter
public class BillingHttpException extends RuntimeException {

    private final int status;
    private final String bodySnippet;

    public BillingHttpException(int status, String message, String bodySnippet) {
        super(message);
        this.status = status;
        this.bodySnippet = bodySnippet;
    }

    public BillingHttpException(int status, String message, String bodySnippet, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.bodySnippet = bodySnippet;
    }
}
