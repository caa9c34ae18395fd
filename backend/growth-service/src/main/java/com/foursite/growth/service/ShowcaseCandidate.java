package com.foursite.growth.service;

import java.time.Instant;

/**
 * A scored site waiting to be ranked
 */
public record ShowcaseCandidate(String siteId, String ownerId, Instant createdAt, double score) {
}
