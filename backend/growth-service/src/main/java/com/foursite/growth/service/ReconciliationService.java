package com.foursite.growth.service;

import com.foursite.growth.config.FeaturingProperties;
import com.foursite.growth.config.MilestoneProperties;
import com.foursite.growth.dto.ReconciliationReportDto;
import com.foursite.growth.entity.ReferralStatus;
import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.repository.MemberRepository;
import com.foursite.growth.repository.ReferralEdgeRepository;
import com.foursite.growth.repository.SiteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Heals state the after-commit dispatch may have missed, from durable counters only
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final SiteRepository siteRepository;
    private final ReferralEdgeRepository referralEdgeRepository;
    private final MemberRepository memberRepository;
    private final FeaturingDispatcher featuringDispatcher;
    private final MilestoneDispatcher milestoneDispatcher;
    private final MemberService memberService;
    private final FeaturingProperties featuringProperties;
    private final MilestoneProperties milestoneProperties;
    private final Clock clock;

    public ReconciliationReportDto runAll() {
        Instant ranAt = clock.instant();
        int featured = reconcileFeaturing();
        int granted = reconcileMilestones();
        int expired = expireGrants();
        log.info("Reconciliation done: {} featuring fired, {} milestones granted, {} grants expired",
                featured, granted, expired);
        return ReconciliationReportDto.builder()
                .featuringFired(featured)
                .milestonesGranted(granted)
                .grantsExpired(expired)
                .ranAt(ranAt)
                .build();
    }

    /**
     * Fire featuring for sites whose share count passed a multiple without a trigger
     */
    public int reconcileFeaturing() {
        List<String> siteIds = siteRepository.findIdsWithUntriggeredCrossing(featuringProperties.getShareThreshold());
        int fired = 0;
        for (String siteId : siteIds) {
            try {
                if (featuringDispatcher.reconcileSite(siteId)) {
                    fired++;
                }
            } catch (RuntimeException e) {
                log.warn("Featuring reconciliation failed for site {}: {}", siteId, e.toString());
            }
        }
        return fired;
    }

    /**
     * Re-evaluate milestones for every referrer with enough active referrals
     */
    public int reconcileMilestones() {
        long lowest = milestoneProperties.lowestThreshold();
        if (lowest <= 0) {
            return 0;
        }
        int granted = 0;
        for (String referrerId : referralEdgeRepository.findReferrersWithAtLeast(ReferralStatus.ACTIVE, lowest)) {
            try {
                granted += milestoneDispatcher.evaluate(referrerId).size();
            } catch (RuntimeException e) {
                log.warn("Milestone reconciliation failed for {}: {}", referrerId, e.toString());
            }
        }
        return granted;
    }

    /**
     * Downgrade members whose time-bounded pro grant has run out
     */
    public int expireGrants() {
        int expired = 0;
        for (String userId : memberRepository.findIdsWithExpiredGrant(SubscriptionTier.PRO, clock.instant())) {
            try {
                if (memberService.expireGrant(userId)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.warn("Expiring pro grant of {} failed: {}", userId, e.toString());
            }
        }
        return expired;
    }
}
