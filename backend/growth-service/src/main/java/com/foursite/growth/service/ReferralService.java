package com.foursite.growth.service;

import com.foursite.growth.config.IngestionProperties;
import com.foursite.growth.dto.RecordConversionRequest;
import com.foursite.growth.dto.ReferralDto;
import com.foursite.growth.entity.ReferralEdge;
import com.foursite.growth.entity.ReferralStatus;
import com.foursite.growth.event.ReferralConvertedEvent;
import com.foursite.growth.exception.DuplicateConversionException;
import com.foursite.growth.exception.NotFoundException;
import com.foursite.growth.repository.ReferralEdgeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Referral conversions and their status transitions
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferralService {

    private final ReferralEdgeRepository referralEdgeRepository;
    private final MemberService memberService;
    private final CommissionCalculator commissionCalculator;
    private final IngestionExecutor ingestionExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final IngestionProperties ingestionProperties;
    private final Clock clock;

    // ==================== Conversion ====================

    /**
     * Record that a referee converted through a referrer's link
     */
    public ReferralDto recordConversion(RecordConversionRequest request) {
        String referrerId = request.getReferrerId();
        String refereeId = request.getRefereeId();
        if (referrerId.equals(refereeId)) {
            throw new IllegalArgumentException("Cannot refer yourself");
        }
        Instant now = clock.instant();
        Instant convertedAt = request.getOccurredAt() != null ? request.getOccurredAt() : now;
        if (convertedAt.isAfter(now.plus(ingestionProperties.getMaxClockSkew()))) {
            throw new IllegalArgumentException("occurredAt " + convertedAt + " is in the future");
        }

        memberService.ensureExists(referrerId);
        memberService.ensureExists(refereeId);
        try {
            return ingestionExecutor.execute("Record referral conversion", status -> {
                String pairKey = ReferralEdge.pairKey(referrerId, refereeId);
                if (referralEdgeRepository.existsByActivePairKey(pairKey)) {
                    throw new DuplicateConversionException(referrerId, refereeId);
                }
                ReferralEdge edge = referralEdgeRepository.saveAndFlush(ReferralEdge.builder()
                        .referrerId(referrerId)
                        .refereeId(refereeId)
                        .convertedAt(convertedAt)
                        .status(ReferralStatus.ACTIVE)
                        .activePairKey(pairKey)
                        .createdAt(now)
                        .build());
                eventPublisher.publishEvent(new ReferralConvertedEvent(edge.getId(), referrerId, refereeId, convertedAt));
                log.info("Tracked referral: {} referred by {}", refereeId, referrerId);
                return toDto(edge, now);
            });
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateConversionException(referrerId, refereeId);
        }
    }

    // ==================== Status transitions ====================

    /**
     * Suspend an active referral, e.g. while the referee's payment is past due
     */
    @Transactional
    public ReferralDto suspend(UUID edgeId) {
        ReferralEdge edge = lockEdge(edgeId);
        edge.suspend();
        log.info("Suspended referral {}", edgeId);
        return toDto(edge, clock.instant());
    }

    @Transactional
    public ReferralDto reinstate(UUID edgeId) {
        ReferralEdge edge = lockEdge(edgeId);
        edge.reinstate();
        eventPublisher.publishEvent(new ReferralConvertedEvent(edge.getId(), edge.getReferrerId(),
                edge.getRefereeId(), edge.getConvertedAt()));
        log.info("Reinstated referral {}", edgeId);
        return toDto(edge, clock.instant());
    }

    /**
     * Terminal transition. The pair may convert again afterwards as a new referral.
     */
    @Transactional
    public ReferralDto churn(UUID edgeId) {
        ReferralEdge edge = lockEdge(edgeId);
        edge.churn();
        log.info("Referral {} churned", edgeId);
        return toDto(edge, clock.instant());
    }

    // ==================== Queries ====================

    /**
     * Get list of referrals for a referrer, with the rate each earns now
     */
    @Transactional(readOnly = true)
    public List<ReferralDto> getReferrals(String referrerId) {
        Instant now = clock.instant();
        return referralEdgeRepository.findByReferrerIdOrderByConvertedAtAsc(referrerId).stream()
                .map(edge -> toDto(edge, now))
                .collect(Collectors.toList());
    }

    private ReferralEdge lockEdge(UUID edgeId) {
        return referralEdgeRepository.findByIdForUpdate(edgeId)
                .orElseThrow(() -> new NotFoundException("REFERRAL_NOT_FOUND", "Referral not found: " + edgeId));
    }

    private ReferralDto toDto(ReferralEdge edge, Instant now) {
        ReferralDto.ReferralDtoBuilder builder = ReferralDto.builder()
                .id(edge.getId())
                .referrerId(edge.getReferrerId())
                .refereeId(edge.getRefereeId())
                .convertedAt(edge.getConvertedAt())
                .status(edge.getStatus());
        if (edge.isLive()) {
            builder.currentRate(commissionCalculator.rateAt(edge.getConvertedAt(), now));
            Optional<CommissionCalculator.RateChange> next = commissionCalculator.nextRateChange(edge.getConvertedAt(), now);
            next.ifPresent(change -> builder.nextRateChangeAt(change.effectiveAt()).nextRate(change.rate()));
        }
        return builder.build();
    }
}
