package com.maskid.backend.idgen;

/**
 * 重試上限內一直撞到已存在的值。fatal，交給維運處理，呼叫端不可吞掉。
 */
public class GenerationExhaustedException extends RuntimeException {
    private final IdentifierKind kind;
    private final int attempts;

    public GenerationExhaustedException(IdentifierKind kind, int attempts) {
        super("GENERATION_EXHAUSTED");
        this.kind = kind;
        this.attempts = attempts;
    }

    public IdentifierKind kind() { return kind; }
    public int attempts() { return attempts; }
}
