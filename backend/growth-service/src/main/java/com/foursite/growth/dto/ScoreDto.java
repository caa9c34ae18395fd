package com.foursite.growth.dto;

import com.foursite.growth.entity.SubscriptionTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for a site's current viral score
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScoreDto {

    private String siteId;
    private SubscriptionTier tier;
    private double score;
    private Instant computedAt;
}
