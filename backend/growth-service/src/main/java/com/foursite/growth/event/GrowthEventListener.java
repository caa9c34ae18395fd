package com.foursite.growth.event;

import com.foursite.growth.config.AsyncConfig;
import com.foursite.growth.exception.InvariantViolationException;
import com.foursite.growth.service.FeaturingDispatcher;
import com.foursite.growth.service.MilestoneDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Routes committed ingestion events to the trigger dispatchers.
 * Failures are logged only; the reconciliation sweep heals anything lost here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GrowthEventListener {

    private final FeaturingDispatcher featuringDispatcher;
    private final MilestoneDispatcher milestoneDispatcher;

    @Async(AsyncConfig.DISPATCH_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onShareRecorded(ShareRecordedEvent event) {
        if (event.crossedMultiple() == null) {
            return;
        }
        try {
            featuringDispatcher.onShareRecorded(event.siteId(), event.crossedMultiple());
        } catch (InvariantViolationException e) {
            log.error("Featuring dispatch for site {} broke an invariant: {}", event.siteId(), e.getMessage());
        } catch (Exception e) {
            log.warn("Featuring dispatch failed for site {} at multiple {}: {}",
                    event.siteId(), event.crossedMultiple(), e.toString());
        }
    }

    @Async(AsyncConfig.DISPATCH_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onReferralConverted(ReferralConvertedEvent event) {
        try {
            milestoneDispatcher.evaluate(event.referrerId());
        } catch (Exception e) {
            log.warn("Milestone dispatch failed for referrer {}: {}", event.referrerId(), e.toString());
        }
    }
}
