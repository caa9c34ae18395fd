package com.foursite.growth.service;

import com.foursite.growth.config.ScoringProperties;
import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.repository.ShareSample;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Viral score of a site:
 * tierMultiplier * (sum of platformWeight * exp(-lambda * ageHours) + pageviewWeight * log1p(pageviews)).
 * <p>
 * Deterministic: samples are summed in a fixed order with {@link StrictMath}, so identical inputs
 * give bit-identical scores no matter how the samples were fetched.
 */
@Component
@RequiredArgsConstructor
public class ViralScoreCalculator {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private static final Comparator<ShareSample> CANONICAL_ORDER = Comparator
            .comparing(ShareSample::occurredAt)
            .thenComparing(ShareSample::platform)
            .thenComparing(ShareSample::idempotencyKey, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ScoringProperties scoringProperties;

    public double score(SubscriptionTier tier, long pageviews, Collection<ShareSample> shares, Instant now) {
        Instant horizonStart = horizonStart(now);
        List<ShareSample> counted = new ArrayList<>(shares.size());
        for (ShareSample share : shares) {
            // future shares are outside the snapshot, stale ones are outside the horizon
            if (!share.occurredAt().isAfter(now) && share.occurredAt().isAfter(horizonStart)) {
                counted.add(share);
            }
        }
        counted.sort(CANONICAL_ORDER);

        double lambda = scoringProperties.decayPerHour();
        double shareSum = 0.0;
        for (ShareSample share : counted) {
            double ageHours = (now.toEpochMilli() - share.occurredAt().toEpochMilli()) / MILLIS_PER_HOUR;
            shareSum += scoringProperties.weightOf(share.platform()) * StrictMath.exp(-lambda * ageHours);
        }
        double pageviewTerm = scoringProperties.getPageviewWeight() * StrictMath.log1p(Math.max(0, pageviews));
        return scoringProperties.multiplierOf(tier) * (shareSum + pageviewTerm);
    }

    /**
     * Oldest instant (exclusive) whose shares still count towards a score at {@code now}
     */
    public Instant horizonStart(Instant now) {
        return now.minus(scoringProperties.getHorizon());
    }
}
