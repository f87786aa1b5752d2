package com.autopilot.connector.repository;

import com.autopilot.connector.model.ConnectorCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConnectorCredentialRepository extends JpaRepository<ConnectorCredential, UUID> {

    Optional<ConnectorCredential> findByTenantIdAndTool(UUID tenantId, String tool);
}
