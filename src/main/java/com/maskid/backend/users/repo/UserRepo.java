package com.maskid.backend.users.repo;

import com.maskid.backend.users.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepo extends JpaRepository<User, Long> {

    // setEmail 已經 lower-case，這裡 IgnoreCase 兩邊保險
    Optional<User> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);
}
