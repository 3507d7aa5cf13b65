package com.maskid.backend.oauth.repo;

import com.maskid.backend.oauth.entity.ClientUser;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ClientUserRepo extends JpaRepository<ClientUser, Long> {

    Optional<ClientUser> findByClientIdAndUserId(Long clientId, Long userId);

    long countByClientId(Long clientId);
}
