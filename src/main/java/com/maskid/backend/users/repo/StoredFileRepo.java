package com.maskid.backend.users.repo;

import com.maskid.backend.users.entity.StoredFile;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StoredFileRepo extends JpaRepository<StoredFile, Long> {
}
