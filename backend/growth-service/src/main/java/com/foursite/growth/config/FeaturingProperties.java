package com.foursite.growth.config;

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
@ConfigurationProperties(prefix = "growth.featuring")
@Data
public class FeaturingProperties implements InitializingBean {

    /**
     * Every multiple of this many shares grants an auto-featuring window
     */
    private long shareThreshold = 5;

    private Map<SubscriptionTier, Duration> durations = defaultDurations();

    public Duration durationFor(SubscriptionTier tier) {
        return durations.get(tier);
    }

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    public void validate() {
        if (shareThreshold <= 0) {
            throw new InvalidThresholdException("growth.featuring.share-threshold must be positive, got " + shareThreshold);
        }
        for (SubscriptionTier tier : SubscriptionTier.values()) {
            Duration duration = durations.get(tier);
            if (duration == null || duration.isNegative() || duration.isZero()) {
                throw new InvalidThresholdException("growth.featuring.durations." + tier + " must be positive");
            }
        }
    }

    private static Map<SubscriptionTier, Duration> defaultDurations() {
        Map<SubscriptionTier, Duration> map = new LinkedHashMap<>();
        map.put(SubscriptionTier.FREE, Duration.ofHours(48));
        map.put(SubscriptionTier.PRO, Duration.ofDays(7));
        return map;
    }
}
