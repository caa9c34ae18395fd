package com.foursite.growth.dto;

import com.foursite.growth.entity.SubscriptionTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for a member's subscription state
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemberDto {

    private String id;
    private SubscriptionTier tier;
    private boolean paidPro;
    private Instant proExpiresAt;
    private int sitesUpdated;
}
