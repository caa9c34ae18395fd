package com.foursite.growth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for a showcase leaderboard row
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShowcaseEntryDto {

    private int rank;
    private String siteId;
    private String ownerId;
    private double score;
    private Instant generatedAt;
}
