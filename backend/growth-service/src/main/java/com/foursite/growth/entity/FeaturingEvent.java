package com.foursite.growth.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * FeaturingEvent entity - log of auto-featuring windows granted to a site
 */
@Entity
@Table(name = "featuring_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_featuring_site_multiple", columnNames = {"site_id", "share_multiple"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeaturingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "site_id", nullable = false, length = 64)
    private String siteId;

    @Column(name = "share_multiple", nullable = false)
    private long shareMultiple;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SubscriptionTier tier;

    @Column(name = "duration_seconds", nullable = false)
    private long durationSeconds;

    @Column(name = "featured_until", nullable = false)
    private Instant featuredUntil;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FeaturingSource source;
}
