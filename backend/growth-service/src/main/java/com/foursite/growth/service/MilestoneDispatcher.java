package com.foursite.growth.service;

import com.foursite.growth.config.MilestoneProperties;
import com.foursite.growth.config.TransactionConfig;
import com.foursite.growth.entity.MilestoneRecord;
import com.foursite.growth.entity.ReferralStatus;
import com.foursite.growth.repository.MilestoneRecordRepository;
import com.foursite.growth.repository.ReferralEdgeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * One-time referral milestone rewards. The reward is applied in the same transaction that inserts
 * the milestone record, so it happens only if the insert wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MilestoneDispatcher {

    private final ReferralEdgeRepository referralEdgeRepository;
    private final MilestoneRecordRepository milestoneRecordRepository;
    private final MemberService memberService;
    private final MilestoneProperties milestoneProperties;
    @Qualifier(TransactionConfig.REQUIRES_NEW)
    private final TransactionTemplate requiresNewTransactionTemplate;
    private final Clock clock;

    /**
     * Grant every milestone the referrer now qualifies for and has not received
     *
     * @return the milestones granted by this call
     */
    public List<MilestoneRecord> evaluate(String referrerId) {
        long activeReferrals = referralEdgeRepository.countByReferrerIdAndStatus(referrerId, ReferralStatus.ACTIVE);
        List<MilestoneRecord> granted = new ArrayList<>();
        for (MilestoneProperties.Definition definition : milestoneProperties.getDefinitions()) {
            if (activeReferrals < definition.getReferralThreshold()
                    || milestoneRecordRepository.existsByUserIdAndMilestoneType(referrerId, definition.getType())) {
                continue;
            }
            MilestoneRecord record = grant(referrerId, definition, activeReferrals);
            if (record != null) {
                granted.add(record);
            }
        }
        return granted;
    }

    private MilestoneRecord grant(String referrerId, MilestoneProperties.Definition definition, long activeReferrals) {
        memberService.ensureExists(referrerId);
        try {
            MilestoneRecord record = requiresNewTransactionTemplate.execute(status -> {
                Instant now = clock.instant();
                MilestoneRecord inserted = milestoneRecordRepository.saveAndFlush(MilestoneRecord.builder()
                        .userId(referrerId)
                        .milestoneType(definition.getType())
                        .qualifyingCount(activeReferrals)
                        .firedAt(now)
                        .build());
                Instant until = now.atZone(ZoneOffset.UTC).plus(definition.getRewardDuration()).toInstant();
                memberService.grantPro(referrerId, until);
                return inserted;
            });
            log.info("Granted milestone {} to {} at {} active referrals",
                    definition.getType(), referrerId, activeReferrals);
            return record;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            if (milestoneRecordRepository.existsByUserIdAndMilestoneType(referrerId, definition.getType())) {
                log.debug("Milestone {} for {} already granted", definition.getType(), referrerId);
            } else {
                log.warn("Milestone {} for {} not granted, left to reconciliation: {}",
                        definition.getType(), referrerId, e.toString());
            }
            return null;
        }
    }
}
