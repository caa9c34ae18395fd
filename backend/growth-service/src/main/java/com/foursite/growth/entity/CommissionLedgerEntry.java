package com.foursite.growth.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * CommissionLedgerEntry entity - one accrual or reversal for a referral in a billing period.
 * Amounts are never negative; the entry type carries the sign.
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "commission_ledger_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_ledger_edge_period_type",
                columnNames = {"referral_edge_id", "period", "entry_type"}),
        indexes = {
                @Index(name = "idx_ledger_referrer", columnList = "referrer_id"),
                @Index(name = "idx_ledger_payout", columnList = "payout_id")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CommissionLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "referral_edge_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ReferralEdge referralEdge;

    @Column(name = "referrer_id", nullable = false, length = 64)
    private String referrerId;

    /** Billing cycle, yyyy-MM */
    @Column(nullable = false, length = 7)
    private String period;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 16)
    private LedgerEntryType entryType;

    @Column(name = "rate_applied", nullable = false, precision = 9, scale = 6)
    private BigDecimal rateApplied;

    @Column(name = "base_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal baseAmount;

    @Column(name = "payable_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal payableAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "settlement_status", nullable = false, length = 16)
    @Builder.Default
    private SettlementStatus settlementStatus = SettlementStatus.PENDING;

    @Column(name = "payout_id")
    private UUID payoutId;

    @Column(name = "reversed_entry_id")
    private UUID reversedEntryId;

    @Column(length = 255)
    private String reason;

    @Column(name = "created_at", nullable = false)
    @CreatedDate
    private Instant createdAt;

    /**
     * Signed contribution of this entry to the referrer's balance
     */
    public BigDecimal signedAmount() {
        return entryType == LedgerEntryType.REVERSAL ? payableAmount.negate() : payableAmount;
    }
}
