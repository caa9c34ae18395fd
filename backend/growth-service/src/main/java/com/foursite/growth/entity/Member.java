package com.foursite.growth.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

/**
 * Member entity - a user as the growth engine sees it (referrer, site owner)
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "members")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Member {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private SubscriptionTier tier = SubscriptionTier.FREE;

    /** Pro subscription reported by billing; indefinite while true */
    @Column(name = "paid_pro", nullable = false)
    @Builder.Default
    private boolean paidPro = false;

    /** End of a time-bounded pro grant, such as a milestone reward */
    @Column(name = "pro_expires_at")
    private Instant proExpiresAt;

    @Column(name = "created_at", nullable = false)
    @CreatedDate
    private Instant createdAt;

    @Column(name = "updated_at")
    @LastModifiedDate
    private Instant updatedAt;

    @Version
    private Long version;

    public SubscriptionTier effectiveTier(Instant now) {
        if (paidPro || (proExpiresAt != null && proExpiresAt.isAfter(now))) {
            return SubscriptionTier.PRO;
        }
        return SubscriptionTier.FREE;
    }

    /**
     * Recompute the stored tier from the paid flag and grant expiry.
     *
     * @return true if the tier changed
     */
    public boolean refreshTier(Instant now) {
        SubscriptionTier effective = effectiveTier(now);
        if (effective == tier) {
            return false;
        }
        tier = effective;
        return true;
    }

    /**
     * Extend the time-bounded pro grant. Never shortens an existing grant.
     */
    public void extendProGrant(Instant until) {
        if (proExpiresAt == null || until.isAfter(proExpiresAt)) {
            proExpiresAt = until;
        }
    }
}
