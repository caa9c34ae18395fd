package com.foursite.growth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO for a referrer's commission dashboard
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CommissionSummaryDto {

    private String userId;
    private BigDecimal totalEarned;
    private BigDecimal totalPaid;
    private BigDecimal pendingAmount;
    /** Earliest period with unsettled entries, null when everything is paid */
    private String pendingPeriod;
    private BigDecimal currentRate;
    private long activeReferrals;
}
