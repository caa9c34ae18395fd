package com.foursite.growth.service;

import com.foursite.growth.dto.PayoutDto;
import com.foursite.growth.entity.CommissionLedgerEntry;
import com.foursite.growth.entity.Payout;
import com.foursite.growth.entity.PayoutStatus;
import com.foursite.growth.entity.SettlementStatus;
import com.foursite.growth.exception.ConflictException;
import com.foursite.growth.exception.NotFoundException;
import com.foursite.growth.repository.CommissionLedgerEntryRepository;
import com.foursite.growth.repository.PayoutRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Payout lifecycle. A payout claims the referrer's pending ledger entries; a failed payout
 * hands them back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutService {

    private static final Set<PayoutStatus> OPEN = EnumSet.of(PayoutStatus.PENDING, PayoutStatus.PROCESSING);

    private final PayoutRepository payoutRepository;
    private final CommissionLedgerEntryRepository ledgerRepository;
    private final Clock clock;

    /**
     * Claim all pending commission of a referrer into a new payout
     */
    @Transactional
    public PayoutDto requestPayout(String userId) {
        List<CommissionLedgerEntry> entries = ledgerRepository.findByReferrerIdAndStatusForUpdate(userId,
                SettlementStatus.PENDING);
        BigDecimal net = entries.stream()
                .map(CommissionLedgerEntry::signedAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (net.signum() <= 0) {
            throw new ConflictException("NOTHING_TO_PAY", "No pending commission for " + userId);
        }

        Payout payout = payoutRepository.saveAndFlush(Payout.builder()
                .userId(userId)
                .amount(net)
                .status(PayoutStatus.PENDING)
                .createdAt(clock.instant())
                .build());
        for (CommissionLedgerEntry entry : entries) {
            entry.setSettlementStatus(SettlementStatus.PAID);
            entry.setPayoutId(payout.getId());
        }
        log.info("Created payout {} of {} for {} covering {} entries", payout.getId(), net, userId, entries.size());
        return toDto(payout, entries.size());
    }

    @Transactional
    public PayoutDto markProcessing(UUID payoutId) {
        Payout payout = lockPayout(payoutId);
        requireStatus(payout, EnumSet.of(PayoutStatus.PENDING));
        payout.setStatus(PayoutStatus.PROCESSING);
        return toDto(payout, ledgerRepository.findByPayoutId(payoutId).size());
    }

    @Transactional
    public PayoutDto completePayout(UUID payoutId, String externalReference) {
        Payout payout = lockPayout(payoutId);
        requireStatus(payout, OPEN);
        payout.setStatus(PayoutStatus.COMPLETED);
        payout.setExternalReference(externalReference);
        payout.setProcessedAt(clock.instant());
        log.info("Payout {} completed ({})", payoutId, externalReference);
        return toDto(payout, ledgerRepository.findByPayoutId(payoutId).size());
    }

    /**
     * Mark a payout failed and release its entries for the next payout
     */
    @Transactional
    public PayoutDto failPayout(UUID payoutId, String errorMessage) {
        Payout payout = lockPayout(payoutId);
        requireStatus(payout, OPEN);
        payout.setStatus(PayoutStatus.FAILED);
        payout.setErrorMessage(errorMessage);
        payout.setProcessedAt(clock.instant());
        List<CommissionLedgerEntry> entries = ledgerRepository.findByPayoutId(payoutId);
        for (CommissionLedgerEntry entry : entries) {
            entry.setSettlementStatus(SettlementStatus.PENDING);
            entry.setPayoutId(null);
        }
        log.warn("Payout {} failed, released {} entries: {}", payoutId, entries.size(), errorMessage);
        return toDto(payout, 0);
    }

    /**
     * Get payout history for a referrer
     */
    @Transactional(readOnly = true)
    public List<PayoutDto> getPayouts(String userId) {
        return payoutRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(p -> toDto(p, ledgerRepository.findByPayoutId(p.getId()).size()))
                .collect(Collectors.toList());
    }

    private Payout lockPayout(UUID payoutId) {
        return payoutRepository.findByIdForUpdate(payoutId)
                .orElseThrow(() -> new NotFoundException("PAYOUT_NOT_FOUND", "Payout not found: " + payoutId));
    }

    private static void requireStatus(Payout payout, Set<PayoutStatus> allowed) {
        if (!allowed.contains(payout.getStatus())) {
            throw new ConflictException("PAYOUT_STATE", "Payout " + payout.getId() + " is " + payout.getStatus());
        }
    }

    private static PayoutDto toDto(Payout payout, int entryCount) {
        return PayoutDto.builder()
                .id(payout.getId())
                .userId(payout.getUserId())
                .amount(payout.getAmount())
                .status(payout.getStatus())
                .externalReference(payout.getExternalReference())
                .entryCount(entryCount)
                .createdAt(payout.getCreatedAt())
                .processedAt(payout.getProcessedAt())
                .errorMessage(payout.getErrorMessage())
                .build();
    }
}
