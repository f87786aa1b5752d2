package com.autopilot.connector.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "connector_credentials", uniqueConstraints = {
        @UniqueConstraint(name = "uk_connector_credentials_tenant_tool", columnNames = {"tenant_id", "tool"})
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConnectorCredential {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "tool", nullable = false, length = 100)
    private String tool;

    @Column(name = "credentials")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> credentials;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
