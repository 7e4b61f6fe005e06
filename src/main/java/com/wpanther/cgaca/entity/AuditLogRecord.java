package com.wpanther.cgaca.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity for the CA audit trail
 * One row per mutating operation, never updated or deleted
 */
@Entity
@Table(name = "audit_log", indexes = {
        @Index(name = "idx_audit_log_timestamp", columnList = "event_timestamp"),
        @Index(name = "idx_audit_log_actor", columnList = "actor_type, actor_id"),
        @Index(name = "idx_audit_log_resource", columnList = "resource_type, resource_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_timestamp", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_type", nullable = false, length = 16)
    private ActorType actorType;

    @Column(name = "actor_id")
    private String actorId;

    @Column(name = "action", nullable = false)
    private String action;

    @Column(name = "resource_type", nullable = false)
    private String resourceType;

    @Column(name = "resource_id")
    private String resourceId;

    @Column(name = "details", length = 4000)
    private String details;

    @Column(name = "request_ip")
    private String requestIp;

    @Column(name = "request_id")
    private String requestId;
}
