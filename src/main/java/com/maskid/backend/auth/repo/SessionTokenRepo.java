package com.maskid.backend.auth.repo;

import com.maskid.backend.auth.entity.SessionToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface SessionTokenRepo extends JpaRepository<SessionToken, Long> {

    Optional<SessionToken> findByToken(String token);

    boolean existsByToken(String token);

    /** 重設密碼後全域登出 */
    @Modifying
    @Query("update SessionToken t set t.revoked = true where t.userId = :userId and t.revoked = false")
    int revokeAllByUserId(@Param("userId") Long userId);
}
