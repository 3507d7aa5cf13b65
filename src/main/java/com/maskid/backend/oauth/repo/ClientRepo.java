package com.maskid.backend.oauth.repo;

import com.maskid.backend.oauth.entity.Client;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ClientRepo extends JpaRepository<Client, Long> {

    Optional<Client> findByOauthClientId(String oauthClientId);

    boolean existsByOauthClientId(String oauthClientId);

    boolean existsByOauthClientSecret(String oauthClientSecret);

    List<Client> findByUserIdOrderByIdDesc(Long userId);
}
