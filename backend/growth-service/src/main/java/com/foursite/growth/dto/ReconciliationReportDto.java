package com.foursite.growth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Counts of what one reconciliation sweep healed
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconciliationReportDto {

    private int featuringFired;
    private int milestonesGranted;
    private int grantsExpired;
    private Instant ranAt;
}
