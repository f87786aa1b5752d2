package com.autopilot.agent.repository;

import com.autopilot.agent.model.AgentRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AgentRunRepository extends JpaRepository<AgentRun, UUID> {

    Optional<AgentRun> findFirstByTenantIdAndAgentOrderByStartedAtDesc(UUID tenantId, String agent);

    Optional<AgentRun> findFirstByTenantIdAndAgentAndSuccessTrueOrderByStartedAtDesc(UUID tenantId, String agent);

    Page<AgentRun> findByTenantIdOrderByStartedAtDesc(UUID tenantId, Pageable pageable);

    Page<AgentRun> findByTenantIdAndAgentOrderByStartedAtDesc(UUID tenantId, String agent, Pageable pageable);

    List<AgentRun> findByTenantIdAndAgentAndStartedAtGreaterThanEqualOrderByStartedAtDesc(
            UUID tenantId, String agent, LocalDateTime from);
}
