package com.autopilot.action.repository;

import com.autopilot.action.model.ActionLog;
import com.autopilot.action.model.ActionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface ActionLogRepository extends JpaRepository<ActionLog, UUID> {

    @Query("SELECT l FROM ActionLog l WHERE l.tenantId = :tenantId ORDER BY l.executedAt DESC")
    Page<ActionLog> findAllByTenantId(@Param("tenantId") UUID tenantId, Pageable pageable);

    @Query("SELECT l FROM ActionLog l WHERE l.tenantId = :tenantId " +
            "AND (:status IS NULL OR l.status = :status) " +
            "AND (:actionType IS NULL OR l.actionType = :actionType) " +
            "AND (:agent IS NULL OR l.agent = :agent) " +
            "AND (:from IS NULL OR l.executedAt >= :from) " +
            "AND (:to IS NULL OR l.executedAt <= :to) " +
            "ORDER BY l.executedAt DESC")
    Page<ActionLog> findByTenantIdWithFilters(
            @Param("tenantId") UUID tenantId,
            @Param("status") ActionStatus status,
            @Param("actionType") String actionType,
            @Param("agent") String agent,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            Pageable pageable);

    List<ActionLog> findByPendingActionIdOrderByExecutedAtAsc(UUID pendingActionId);

    List<ActionLog> findByTenantIdAndAgentAndExecutedAtGreaterThanEqual(UUID tenantId, String agent, LocalDateTime from);

    long countByTenantIdAndStatusAndExecutedAtGreaterThanEqual(UUID tenantId, ActionStatus status, LocalDateTime from);
}
