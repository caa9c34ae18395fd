package com.foursite.growth.dto;

import com.foursite.growth.entity.ReferralStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * DTO for referral info
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReferralDto {

    private UUID id;
    private String referrerId;
    private String refereeId;
    private Instant convertedAt;
    private ReferralStatus status;
    private BigDecimal currentRate;
    private Instant nextRateChangeAt;
    private BigDecimal nextRate;
}
