package com.maskid.backend.alias.web;

/** alias 額度用完。可恢復：前端依 clientAction 顯示升級提示 */
public class QuotaExceededException extends RuntimeException {
    private final int limit;
    private final String clientAction;

    public QuotaExceededException(String message, int limit, String clientAction) {
        super(message);
        this.limit = limit;
        this.clientAction = clientAction;
    }

    public int limit() { return limit; }
    public String clientAction() { return clientAction; }
}
