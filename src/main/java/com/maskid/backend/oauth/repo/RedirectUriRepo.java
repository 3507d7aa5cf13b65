package com.maskid.backend.oauth.repo;

import com.maskid.backend.oauth.entity.RedirectUri;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RedirectUriRepo extends JpaRepository<RedirectUri, Long> {

    List<RedirectUri> findByClientIdOrderByIdAsc(Long clientId);

    boolean existsByClientIdAndUri(Long clientId, String uri);
}
