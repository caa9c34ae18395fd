package com.foursite.growth.dto;

import com.foursite.growth.entity.SharePlatform;
import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.entity.ViralBoostLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * DTO for site engagement and featuring state
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SiteStatsDto {

    private String siteId;
    private String ownerId;
    private SubscriptionTier tier;
    private long pageviews;
    private long totalShares;
    private Map<SharePlatform, Long> platformShares;
    private ViralBoostLevel boostLevel;
    private long sharesToNextLevel;
    private String nextLevel;
    private long lastTriggeredMultiple;
    private boolean featured;
    private Instant autoFeaturedUntil;
    private boolean showcaseEligible;
    private boolean retired;
    private Instant createdAt;
}
