package com.foursite.growth.dto;

import com.foursite.growth.entity.FeaturingSource;
import com.foursite.growth.entity.SubscriptionTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for one auto-featuring window
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeaturingEventDto {

    private long shareMultiple;
    private SubscriptionTier tier;
    private long durationSeconds;
    private Instant featuredUntil;
    private Instant triggeredAt;
    private FeaturingSource source;
}
