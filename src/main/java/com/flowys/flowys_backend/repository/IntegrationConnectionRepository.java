package com.flowys.flowys_backend.repository;

import com.flowys.flowys_backend.model.domain.IntegrationConnection;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface IntegrationConnectionRepository extends JpaRepository<IntegrationConnection, UUID> {
    List<IntegrationConnection> findByOwnerIdOrderByCreatedAtDesc(String ownerId);
}
