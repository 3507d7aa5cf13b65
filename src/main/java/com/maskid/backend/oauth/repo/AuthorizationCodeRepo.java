package com.maskid.backend.oauth.repo;

import com.maskid.backend.oauth.entity.AuthorizationCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface AuthorizationCodeRepo extends JpaRepository<AuthorizationCode, Long> {

    Optional<AuthorizationCode> findByCode(String code);

    boolean existsByCode(String code);

    /**
     * 條件式更新：只有「未使用且未過期」才會被標記。
     * 回 1 = 搶到這個 code；回 0 = 已被用過 / 已過期（兩個並行 exchange 只會有一個拿到 1）
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           update AuthorizationCode c
              set c.consumedAt = :now
            where c.id = :id
              and c.consumedAt is null
              and c.expiresAt > :now
           """)
    int consume(@Param("id") Long id, @Param("now") Instant now);
}
