package com.foursite.growth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for progress towards one configured milestone
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MilestoneProgressDto {

    private String milestoneType;
    private long referralThreshold;
    private long activeReferrals;
    private long referralsRemaining;
    private boolean achieved;
    private Instant firedAt;
}
