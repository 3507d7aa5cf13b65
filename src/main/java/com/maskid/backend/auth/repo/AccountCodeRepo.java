package com.maskid.backend.auth.repo;

import com.maskid.backend.auth.entity.AccountCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface AccountCodeRepo extends JpaRepository<AccountCode, Long> {

    Optional<AccountCode> findByCodeHashAndPurpose(String codeHash, AccountCode.Purpose purpose);

    boolean existsByCodeHash(String codeHash);

    /**
     * 發新碼前，把同一 user 同一用途仍有效的舊碼標記為 consumed，避免同時存在多筆有效碼
     */
    @Modifying
    @Query("""
           update AccountCode c
              set c.consumedAt = :now
            where c.userId = :userId
              and c.purpose = :purpose
              and c.consumedAt is null
              and c.expiresAt > :now
           """)
    int consumeAllActive(@Param("userId") Long userId,
                         @Param("purpose") AccountCode.Purpose purpose,
                         @Param("now") Instant now);

    /** 回傳 1 = 搶到；0 = 已被用掉或過期 */
    @Modifying
    @Query("""
           update AccountCode c
              set c.consumedAt = :now
            where c.id = :id
              and c.consumedAt is null
              and c.expiresAt > :now
           """)
    int consume(@Param("id") Long id, @Param("now") Instant now);
}
