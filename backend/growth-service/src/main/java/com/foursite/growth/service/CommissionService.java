package com.foursite.growth.service;

import com.foursite.growth.dto.CommissionSummaryDto;
import com.foursite.growth.dto.LedgerEntryDto;
import com.foursite.growth.entity.CommissionLedgerEntry;
import com.foursite.growth.entity.LedgerEntryType;
import com.foursite.growth.entity.ReferralEdge;
import com.foursite.growth.entity.ReferralStatus;
import com.foursite.growth.entity.SettlementStatus;
import com.foursite.growth.exception.ConflictException;
import com.foursite.growth.exception.DuplicatePeriodException;
import com.foursite.growth.exception.NotFoundException;
import com.foursite.growth.repository.CommissionLedgerEntryRepository;
import com.foursite.growth.repository.ReferralEdgeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Commission ledger: period settlement, reversals and referrer summaries.
 * Ledger entries are append-only; only payouts move their settlement status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommissionService {

    private final CommissionLedgerEntryRepository ledgerRepository;
    private final ReferralEdgeRepository referralEdgeRepository;
    private final CommissionCalculator commissionCalculator;
    private final IngestionExecutor ingestionExecutor;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    // ==================== Settlement ====================

    /**
     * Accrue commission for one billing period of a referral
     */
    public LedgerEntryDto settlePeriod(UUID edgeId, String period, BigDecimal revenue) {
        YearMonth billingPeriod = parsePeriod(period);
        if (revenue == null || revenue.signum() < 0) {
            throw new IllegalArgumentException("Period revenue must be zero or positive");
        }
        if (billingPeriod.isAfter(YearMonth.now(clock.withZone(ZoneOffset.UTC)))) {
            throw new IllegalArgumentException("Period " + period + " has not started yet");
        }
        try {
            return ingestionExecutor.execute("Settle period", status -> {
                ReferralEdge edge = referralEdgeRepository.findById(edgeId)
                        .orElseThrow(() -> referralNotFound(edgeId));
                if (edge.getStatus() == ReferralStatus.CHURNED) {
                    throw new ConflictException("REFERRAL_CHURNED", "Referral " + edgeId + " has churned");
                }
                if (ledgerRepository.existsByReferralEdgeIdAndPeriodAndEntryType(edgeId, billingPeriod.toString(),
                        LedgerEntryType.ACCRUAL)) {
                    throw new DuplicatePeriodException(edgeId, billingPeriod.toString());
                }
                CommissionCalculator.PeriodCharge charge = commissionCalculator.chargeForPeriod(
                        edge.getConvertedAt(), billingPeriod, revenue);
                CommissionLedgerEntry entry = ledgerRepository.saveAndFlush(CommissionLedgerEntry.builder()
                        .referralEdge(edge)
                        .referrerId(edge.getReferrerId())
                        .period(charge.period())
                        .entryType(LedgerEntryType.ACCRUAL)
                        .rateApplied(charge.rateApplied())
                        .baseAmount(charge.baseAmount())
                        .payableAmount(charge.payableAmount())
                        .createdAt(clock.instant())
                        .build());
                log.info("Settled {} for referral {}: {} at rate {}", charge.period(), edgeId,
                        charge.payableAmount(), charge.rateApplied());
                return toDto(entry);
            });
        } catch (DataIntegrityViolationException e) {
            throw new DuplicatePeriodException(edgeId, billingPeriod.toString());
        }
    }

    /**
     * Offset an accrual with a reversal of the same amount
     */
    public LedgerEntryDto reverseEntry(UUID entryId, String reason) {
        try {
            return transactionTemplate.execute(status -> {
                CommissionLedgerEntry accrual = ledgerRepository.findById(entryId)
                        .orElseThrow(() -> new NotFoundException("LEDGER_ENTRY_NOT_FOUND",
                                "Ledger entry not found: " + entryId));
                if (accrual.getEntryType() != LedgerEntryType.ACCRUAL) {
                    throw new ConflictException("NOT_AN_ACCRUAL", "Only accruals can be reversed");
                }
                if (ledgerRepository.existsByReversedEntryId(entryId)) {
                    throw new ConflictException("ALREADY_REVERSED", "Ledger entry " + entryId + " already reversed");
                }
                CommissionLedgerEntry reversal = ledgerRepository.saveAndFlush(CommissionLedgerEntry.builder()
                        .referralEdge(accrual.getReferralEdge())
                        .referrerId(accrual.getReferrerId())
                        .period(accrual.getPeriod())
                        .entryType(LedgerEntryType.REVERSAL)
                        .rateApplied(accrual.getRateApplied())
                        .baseAmount(accrual.getBaseAmount())
                        .payableAmount(accrual.getPayableAmount())
                        .reversedEntryId(accrual.getId())
                        .reason(reason)
                        .createdAt(clock.instant())
                        .build());
                log.info("Reversed ledger entry {} ({}): {}", entryId, accrual.getPayableAmount(), reason);
                return toDto(reversal);
            });
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("ALREADY_REVERSED", "Ledger entry " + entryId + " already reversed");
        }
    }

    // ==================== Statistics ====================

    @Transactional(readOnly = true)
    public CommissionSummaryDto getSummary(String userId) {
        int scale = commissionCalculator.currencyScale();
        BigDecimal accrued = orZero(ledgerRepository.sumByReferrerIdAndType(userId, LedgerEntryType.ACCRUAL));
        BigDecimal reversed = orZero(ledgerRepository.sumByReferrerIdAndType(userId, LedgerEntryType.REVERSAL));
        BigDecimal paid = net(userId, SettlementStatus.PAID);
        BigDecimal pending = net(userId, SettlementStatus.PENDING);

        Instant now = clock.instant();
        List<ReferralEdge> edges = referralEdgeRepository.findByReferrerIdOrderByConvertedAtAsc(userId);
        BigDecimal currentRate = edges.stream()
                .filter(ReferralEdge::isLive)
                .findFirst()
                .map(edge -> commissionCalculator.rateAt(edge.getConvertedAt(), now))
                .orElse(BigDecimal.ZERO);
        long activeReferrals = edges.stream().filter(e -> e.getStatus() == ReferralStatus.ACTIVE).count();

        return CommissionSummaryDto.builder()
                .userId(userId)
                .totalEarned(accrued.subtract(reversed).setScale(scale, RoundingMode.HALF_EVEN))
                .totalPaid(paid.setScale(scale, RoundingMode.HALF_EVEN))
                .pendingAmount(pending.setScale(scale, RoundingMode.HALF_EVEN))
                .pendingPeriod(ledgerRepository.findEarliestPeriod(userId, SettlementStatus.PENDING).orElse(null))
                .currentRate(currentRate)
                .activeReferrals(activeReferrals)
                .build();
    }

    @Transactional(readOnly = true)
    public List<LedgerEntryDto> getEntries(String userId) {
        return ledgerRepository.findByReferrerIdOrderByCreatedAtDesc(userId).stream()
                .map(CommissionService::toDto)
                .collect(Collectors.toList());
    }

    private BigDecimal net(String userId, SettlementStatus status) {
        BigDecimal accruals = orZero(ledgerRepository.sumByReferrerIdAndTypeAndStatus(userId,
                LedgerEntryType.ACCRUAL, status));
        BigDecimal reversals = orZero(ledgerRepository.sumByReferrerIdAndTypeAndStatus(userId,
                LedgerEntryType.REVERSAL, status));
        return accruals.subtract(reversals);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static YearMonth parsePeriod(String period) {
        try {
            return YearMonth.parse(period);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("Period must be formatted yyyy-MM: " + period);
        }
    }

    private static NotFoundException referralNotFound(UUID edgeId) {
        return new NotFoundException("REFERRAL_NOT_FOUND", "Referral not found: " + edgeId);
    }

    static LedgerEntryDto toDto(CommissionLedgerEntry entry) {
        return LedgerEntryDto.builder()
                .id(entry.getId())
                .referralEdgeId(entry.getReferralEdge().getId())
                .referrerId(entry.getReferrerId())
                .period(entry.getPeriod())
                .entryType(entry.getEntryType())
                .rateApplied(entry.getRateApplied())
                .baseAmount(entry.getBaseAmount())
                .payableAmount(entry.getPayableAmount())
                .settlementStatus(entry.getSettlementStatus())
                .payoutId(entry.getPayoutId())
                .reversedEntryId(entry.getReversedEntryId())
                .reason(entry.getReason())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
