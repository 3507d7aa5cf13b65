package com.maskid.backend.idgen;

/**
 * 識別碼唯一性的權威來源（DB 欄位）。
 * 只做存在性查詢；真正的「保留」靠 DB unique constraint + IdentifierAllocator 的衝突重試。
 */
public interface UniquenessAuthority {

    boolean isTaken(IdentifierKind kind, String candidate);
}
