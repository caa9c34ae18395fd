package com.foursite.growth.config;

import com.foursite.growth.entity.SharePlatform;
import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.exception.InvalidThresholdException;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "growth.scoring")
@Data
public class ScoringProperties implements InitializingBean {

    /**
     * Age at which a share counts half as much as a fresh one
     */
    private Duration halfLife = Duration.ofDays(10);

    /**
     * Shares older than this are not loaded for scoring
     */
    private Duration horizon = Duration.ofDays(180);

    private double pageviewWeight = 1.0;

    private Map<SharePlatform, Double> platformWeights = defaultPlatformWeights();

    private Map<SubscriptionTier, Double> tierMultipliers = defaultTierMultipliers();

    public double weightOf(SharePlatform platform) {
        return platformWeights.get(platform);
    }

    public double multiplierOf(SubscriptionTier tier) {
        return tierMultipliers.get(tier);
    }

    /**
     * Decay constant per hour, ln 2 / half-life
     */
    public double decayPerHour() {
        return StrictMath.log(2.0) / (halfLife.toMillis() / 3_600_000.0);
    }

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    public void validate() {
        if (halfLife == null || halfLife.isNegative() || halfLife.isZero()) {
            throw new InvalidThresholdException("growth.scoring.half-life must be positive");
        }
        if (horizon == null || horizon.isNegative() || horizon.isZero()) {
            throw new InvalidThresholdException("growth.scoring.horizon must be positive");
        }
        if (!(pageviewWeight >= 0) || Double.isInfinite(pageviewWeight)) {
            throw new InvalidThresholdException("growth.scoring.pageview-weight must be a non-negative number");
        }
        for (SharePlatform platform : SharePlatform.values()) {
            requireWeight("platform-weights." + platform, platformWeights.get(platform));
        }
        for (SubscriptionTier tier : SubscriptionTier.values()) {
            requireWeight("tier-multipliers." + tier, tierMultipliers.get(tier));
        }
    }

    private static void requireWeight(String name, Double value) {
        if (value == null) {
            throw new InvalidThresholdException("growth.scoring." + name + " is missing");
        }
        if (!(value >= 0) || value.isInfinite()) {
            throw new InvalidThresholdException("growth.scoring." + name + " must be a non-negative number");
        }
    }

    private static Map<SharePlatform, Double> defaultPlatformWeights() {
        Map<SharePlatform, Double> weights = new LinkedHashMap<>();
        weights.put(SharePlatform.TWITTER, 5.0);
        weights.put(SharePlatform.LINKEDIN, 4.0);
        weights.put(SharePlatform.FACEBOOK, 3.0);
        weights.put(SharePlatform.REDDIT, 6.0);
        weights.put(SharePlatform.HACKERNEWS, 8.0);
        weights.put(SharePlatform.EMAIL, 4.0);
        weights.put(SharePlatform.DISCORD, 2.0);
        weights.put(SharePlatform.SLACK, 2.0);
        weights.put(SharePlatform.COPY_LINK, 2.0);
        return weights;
    }

    private static Map<SubscriptionTier, Double> defaultTierMultipliers() {
        Map<SubscriptionTier, Double> multipliers = new LinkedHashMap<>();
        multipliers.put(SubscriptionTier.FREE, 1.0);
        multipliers.put(SubscriptionTier.PRO, 1.5);
        return multipliers;
    }
}
