package com.foursite.growth.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Site entity - a generated site with its engagement counters and featuring state
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "sites", indexes = {
        @Index(name = "idx_sites_owner", columnList = "owner_id"),
        @Index(name = "idx_sites_showcase_eligible", columnList = "showcase_eligible")
})
@DynamicUpdate
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Site {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private SubscriptionTier tier = SubscriptionTier.FREE;

    @Column(nullable = false)
    @Builder.Default
    private long pageviews = 0;

    @Column(name = "total_shares", nullable = false)
    @Builder.Default
    private long totalShares = 0;

    @ElementCollection
    @CollectionTable(name = "site_platform_shares", joinColumns = @JoinColumn(name = "site_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "platform", length = 16)
    @Column(name = "share_count", nullable = false)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Map<SharePlatform, Long> platformShares = new EnumMap<>(SharePlatform.class);

    /** Highest share multiple that already fired auto-featuring */
    @Column(name = "last_triggered_multiple", nullable = false)
    @Builder.Default
    private long lastTriggeredMultiple = 0;

    @Column(name = "auto_featured_until")
    @Setter(AccessLevel.NONE)
    private Instant autoFeaturedUntil;

    @Column(name = "showcase_eligible", nullable = false)
    @Builder.Default
    private boolean showcaseEligible = false;

    @Column(nullable = false)
    @Builder.Default
    private boolean retired = false;

    @Column(name = "created_at", nullable = false)
    @CreatedDate
    private Instant createdAt;

    @Column(name = "updated_at")
    @LastModifiedDate
    private Instant updatedAt;

    @Version
    private Long version;

    /**
     * Count one external share.
     *
     * @return the new total share count
     */
    public long recordShare(SharePlatform platform) {
        platformShares.merge(platform, 1L, Long::sum);
        totalShares++;
        return totalShares;
    }

    /**
     * Move the featured window forward. An earlier instant is ignored.
     *
     * @return true if the window moved
     */
    public boolean extendFeaturedUntil(Instant until) {
        if (autoFeaturedUntil != null && !until.isAfter(autoFeaturedUntil)) {
            return false;
        }
        autoFeaturedUntil = until;
        return true;
    }

    public boolean isFeatured(Instant now) {
        return autoFeaturedUntil != null && autoFeaturedUntil.isAfter(now);
    }

    /**
     * Mirror the owner's tier and keep showcase eligibility in step.
     *
     * @return true if anything changed
     */
    public boolean applyTier(SubscriptionTier newTier) {
        boolean eligible = newTier == SubscriptionTier.PRO && !retired;
        boolean changed = tier != newTier || showcaseEligible != eligible;
        tier = newTier;
        showcaseEligible = eligible;
        return changed;
    }

    public void retire() {
        retired = true;
        showcaseEligible = false;
    }

    /**
     * Highest multiple of the threshold reached by the share count
     */
    public long reachedMultiple(long threshold) {
        return (totalShares / threshold) * threshold;
    }

    public ViralBoostLevel getBoostLevel() {
        return ViralBoostLevel.fromShareCount(totalShares);
    }
}
