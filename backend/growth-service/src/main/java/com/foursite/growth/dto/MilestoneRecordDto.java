package com.foursite.growth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for a granted milestone
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MilestoneRecordDto {

    private String milestoneType;
    private long qualifyingCount;
    private Instant firedAt;
}
