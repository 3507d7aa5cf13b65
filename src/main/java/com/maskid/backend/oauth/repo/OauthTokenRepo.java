package com.maskid.backend.oauth.repo;

import com.maskid.backend.oauth.entity.OauthToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface OauthTokenRepo extends JpaRepository<OauthToken, Long> {

    Optional<OauthToken> findByAccessToken(String accessToken);

    boolean existsByAccessToken(String accessToken);

    /** 只撤銷仍有效的 token：EXPIRED / REVOKED 是終點，不再變動 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           update OauthToken t
              set t.revokedAt = :now
            where t.id = :id
              and t.revokedAt is null
              and t.expiresAt > :now
           """)
    int revokeIfActive(@Param("id") Long id, @Param("now") Instant now);
}
