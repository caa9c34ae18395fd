package com.foursite.growth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one showcase ranking run
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShowcaseRefreshDto {

    /** False when another run was already in progress */
    private boolean executed;
    private int rankedSites;
    private Instant generatedAt;
    private long durationMillis;
}
