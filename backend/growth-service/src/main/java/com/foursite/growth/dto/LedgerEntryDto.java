package com.foursite.growth.dto;

import com.foursite.growth.entity.LedgerEntryType;
import com.foursite.growth.entity.SettlementStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * DTO for a commission ledger entry
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerEntryDto {

    private UUID id;
    private UUID referralEdgeId;
    private String referrerId;
    private String period;
    private LedgerEntryType entryType;
    private BigDecimal rateApplied;
    private BigDecimal baseAmount;
    private BigDecimal payableAmount;
    private SettlementStatus settlementStatus;
    private UUID payoutId;
    private UUID reversedEntryId;
    private String reason;
    private Instant createdAt;
}
