package com.foursite.growth.config;

import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.exception.InvalidThresholdException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Period;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "growth.milestones")
@Data
public class MilestoneProperties implements InitializingBean {

    private List<Definition> definitions = new ArrayList<>(List.of(
            new Definition("10-referrals-free-pro", 10, SubscriptionTier.PRO, Period.ofMonths(12))));

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    public void validate() {
        Set<String> types = new HashSet<>();
        for (Definition definition : definitions) {
            if (definition.getType() == null || definition.getType().isBlank()) {
                throw new InvalidThresholdException("growth.milestones.definitions[].type is required");
            }
            if (!types.add(definition.getType())) {
                throw new InvalidThresholdException("Duplicate milestone type " + definition.getType());
            }
            if (definition.getReferralThreshold() <= 0) {
                throw new InvalidThresholdException("Milestone " + definition.getType()
                        + " needs a positive referral threshold, got " + definition.getReferralThreshold());
            }
            if (definition.getRewardTier() != SubscriptionTier.PRO) {
                throw new InvalidThresholdException("Milestone " + definition.getType() + " must reward PRO");
            }
            Period duration = definition.getRewardDuration();
            if (duration == null || duration.isNegative() || duration.isZero()) {
                throw new InvalidThresholdException("Milestone " + definition.getType() + " needs a positive reward duration");
            }
        }
    }

    /**
     * Lowest threshold among the definitions, or 0 when none are configured
     */
    public long lowestThreshold() {
        return definitions.stream().mapToLong(Definition::getReferralThreshold).min().orElse(0);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Definition {
        private String type;
        /** Active referrals needed */
        private long referralThreshold;
        private SubscriptionTier rewardTier = SubscriptionTier.PRO;
        private Period rewardDuration;
    }
}
