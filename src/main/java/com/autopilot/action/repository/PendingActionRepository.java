package com.autopilot.action.repository;

import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.model.PendingAction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PendingActionRepository extends JpaRepository<PendingAction, UUID> {

    Optional<PendingAction> findByIdAndTenantId(UUID id, UUID tenantId);

    @Query("SELECT p FROM PendingAction p WHERE p.tenantId = :tenantId AND p.status = :status ORDER BY p.createdAt DESC")
    Page<PendingAction> findByTenantIdAndStatus(
            @Param("tenantId") UUID tenantId,
            @Param("status") ActionStatus status,
            Pageable pageable);

    long countByTenantIdAndStatus(UUID tenantId, ActionStatus status);

    /**
     * Атомарный переход статуса. Возвращает 0, если запись уже не в статусе expected.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PendingAction p SET p.status = :target, p.executedAt = :executedAt " +
            "WHERE p.id = :id AND p.status = :expected")
    int compareAndSetStatus(
            @Param("id") UUID id,
            @Param("expected") ActionStatus expected,
            @Param("target") ActionStatus target,
            @Param("executedAt") LocalDateTime executedAt);
}
