package com.autopilot.tenant.repository;

import com.autopilot.tenant.model.ConfigAdjustment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ConfigAdjustmentRepository extends JpaRepository<ConfigAdjustment, UUID> {

    List<ConfigAdjustment> findByTenantIdOrderByAdjustedAtDesc(UUID tenantId);
}
