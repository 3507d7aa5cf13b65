package com.maskid.backend.alias.repo;

import com.maskid.backend.alias.entity.Alias;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AliasRepo extends JpaRepository<Alias, Long> {

    boolean existsByEmail(String email);

    long countByUserId(Long userId);

    List<Alias> findByUserIdOrderByIdDesc(Long userId);

    Optional<Alias> findByIdAndUserId(Long id, Long userId);
}
