package com.foursite.growth.config;

import com.foursite.growth.exception.InvalidThresholdException;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "growth.ingestion")
@Data
public class IngestionProperties implements InitializingBean {

    /**
     * How far in the future an occurredAt may lie
     */
    private Duration maxClockSkew = Duration.ofMinutes(5);

    private Retry retry = new Retry();

    @Override
    public void afterPropertiesSet() {
        if (maxClockSkew == null || maxClockSkew.isNegative()) {
            throw new InvalidThresholdException("growth.ingestion.max-clock-skew must not be negative");
        }
        if (retry.getMaxAttempts() < 1) {
            throw new InvalidThresholdException("growth.ingestion.retry.max-attempts must be at least 1");
        }
        if (retry.getInitialDelay().isNegative() || retry.getMaxDelay().compareTo(retry.getInitialDelay()) < 0
                || retry.getMultiplier() < 1.0) {
            throw new InvalidThresholdException("growth.ingestion.retry backoff is inconsistent");
        }
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(50);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(1);
    }
}
