package com.foursite.growth.entity;

import com.foursite.growth.exception.ConflictException;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.UUID;

/**
 * ReferralEdge entity - a converted referral from referrer to referee.
 * Only the status moves after creation.
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "referral_edges",
        uniqueConstraints = @UniqueConstraint(name = "uk_referral_edges_active_pair", columnNames = "active_pair_key"),
        indexes = {
                @Index(name = "idx_referral_edges_referrer", columnList = "referrer_id"),
                @Index(name = "idx_referral_edges_referee", columnList = "referee_id")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReferralEdge {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "referrer_id", nullable = false, length = 64)
    private String referrerId;

    @Column(name = "referee_id", nullable = false, length = 64)
    private String refereeId;

    @Column(name = "converted_at", nullable = false)
    private Instant convertedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private ReferralStatus status = ReferralStatus.ACTIVE;

    /** Length-prefixed referrer and referee while the edge is live, null once churned */
    @Column(name = "active_pair_key", length = 140)
    private String activePairKey;

    @Column(name = "created_at", nullable = false)
    @CreatedDate
    private Instant createdAt;

    @Column(name = "updated_at")
    @LastModifiedDate
    private Instant updatedAt;

    @Version
    private Long version;

    /**
     * Key that is unique per ordered pair. The referrer length prefix keeps ids that contain the
     * separator from colliding.
     */
    public static String pairKey(String referrerId, String refereeId) {
        return referrerId.length() + ":" + referrerId + ":" + refereeId;
    }

    public boolean isLive() {
        return status != ReferralStatus.CHURNED;
    }

    public void suspend() {
        if (status != ReferralStatus.ACTIVE) {
            throw new ConflictException("REFERRAL_NOT_ACTIVE", "Referral " + id + " is " + status);
        }
        status = ReferralStatus.PENDING;
    }

    public void reinstate() {
        if (status != ReferralStatus.PENDING) {
            throw new ConflictException("REFERRAL_NOT_SUSPENDED", "Referral " + id + " is " + status);
        }
        status = ReferralStatus.ACTIVE;
    }

    public void churn() {
        if (status == ReferralStatus.CHURNED) {
            throw new ConflictException("REFERRAL_CHURNED", "Referral " + id + " already churned");
        }
        status = ReferralStatus.CHURNED;
        activePairKey = null;
    }
}
