package com.lumi.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.lumi.backend.modules.audit.domain.SecurityEvent;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SecurityEventRepository extends JpaRepository<SecurityEvent, UUID> {

    List<SecurityEvent> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<SecurityEvent> findByTypeOrderByCreatedAtDesc(String type);
}
