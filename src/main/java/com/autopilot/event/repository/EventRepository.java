package com.autopilot.event.repository;

import com.autopilot.event.model.AgentEvent;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface EventRepository extends JpaRepository<AgentEvent, Long> {

    List<AgentEvent> findByTenantIdAndProcessedFalseOrderByCreatedAtAscIdAsc(UUID tenantId);

    @Query("SELECT e FROM AgentEvent e WHERE e.tenantId = :tenantId " +
            "AND (:processed IS NULL OR e.processed = :processed) " +
            "ORDER BY e.createdAt DESC, e.id DESC")
    Page<AgentEvent> findByTenantId(
            @Param("tenantId") UUID tenantId,
            @Param("processed") Boolean processed,
            Pageable pageable);

    /**
     * Помечает событие обработанным, только если оно еще не обработано.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE AgentEvent e SET e.processed = true, e.processedAt = :processedAt " +
            "WHERE e.id = :id AND e.processed = false")
    int markProcessed(@Param("id") Long id, @Param("processedAt") LocalDateTime processedAt);
}
