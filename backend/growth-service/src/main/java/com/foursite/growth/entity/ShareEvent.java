package com.foursite.growth.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * ShareEvent entity - append-only record of one external share
 */
@Entity
@Table(name = "share_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_share_events_idempotency_key", columnNames = "idempotency_key"),
        indexes = @Index(name = "idx_share_events_site_occurred", columnList = "site_id, occurred_at"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShareEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "site_id", nullable = false, length = 64)
    private String siteId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SharePlatform platform;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Column(name = "idempotency_key", nullable = false, length = 128)
    private String idempotencyKey;
}
